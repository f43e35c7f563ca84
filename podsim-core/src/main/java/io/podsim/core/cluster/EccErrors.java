package io.podsim.core.cluster;

/**
 * ECC counters of a GPU. Volatile counters reset with the driver, aggregate counters persist across
 * reboots. Health rules look at the aggregate counters.
 */
public record EccErrors(
    long volatileSingleBit,
    long volatileDoubleBit,
    long aggregateSingleBit,
    long aggregateDoubleBit) {

  public static final EccErrors NONE = new EccErrors(0, 0, 0, 0);

  public static EccErrors of(long singleBit, long doubleBit) {
    return new EccErrors(singleBit, doubleBit, singleBit, doubleBit);
  }

  public boolean isClean() {
    return aggregateSingleBit == 0 && aggregateDoubleBit == 0;
  }
}
