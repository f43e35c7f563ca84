package io.podsim.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FlagSchemaTest {

  private final FlagSchema sbatch =
      FlagSchema.builder("sbatch")
          .option("gres")
          .option("w", "nodelist")
          .flag("exclusive")
          .flag("help", "h")
          .build();

  @Test
  void booleanFlagGivesBackCapturedValue() throws SimulatorException {
    ParsedCommand cmd = sbatch.validate(CommandParser.parse("sbatch --exclusive job.sh"));

    assertTrue(cmd.flags().get("exclusive").isBoolean());
    assertEquals(List.of("job.sh"), cmd.positionalArgs());
  }

  @Test
  void reclaimedValueGoesBeforeExistingPositionals() {
    ParsedCommand cmd =
        sbatch.normalize(CommandParser.parse("sbatch --exclusive first --gres=gpu:1 second"));

    assertEquals(List.of("first", "second"), cmd.positionalArgs());
    assertEquals(Optional.of("gpu:1"), cmd.flagValue("gres"));
  }

  @Test
  void normalizeLeavesCleanCommandUntouched() {
    ParsedCommand cmd = CommandParser.parse("sbatch --gres=gpu:2 job.sh");

    assertSame(cmd, sbatch.normalize(cmd));
  }

  @Test
  void unknownFlagIsRejected() {
    SimulatorException e =
        assertThrows(
            SimulatorException.class, () -> sbatch.validate(CommandParser.parse("sbatch --bogus")));
    assertEquals("sbatch: unrecognized option '--bogus'", e.getMessage());
    assertEquals(1, e.getExitCode());
  }

  @Test
  void customUnknownFlagMessage() {
    FlagSchema schema =
        FlagSchema.builder("nvidia-smi").flag("L").unknownFlagMessage("Invalid flag: %s").build();

    SimulatorException e =
        assertThrows(
            SimulatorException.class, () -> schema.validate(CommandParser.parse("nvidia-smi -x")));
    assertEquals("Invalid flag: -x", e.getMessage());
  }

  @Test
  void lenientSchemaIgnoresUnknownFlags() throws SimulatorException {
    FlagSchema schema = FlagSchema.builder("lspci").flag("v").lenient().build();

    ParsedCommand cmd = schema.validate(CommandParser.parse("lspci -v -nn"));
    assertTrue(cmd.hasFlag("nn"));
  }

  @Test
  void optionWithoutArgumentIsRejected() {
    SimulatorException e =
        assertThrows(
            SimulatorException.class, () -> sbatch.validate(CommandParser.parse("sbatch -w")));
    assertEquals("sbatch: option '-w' requires an argument", e.getMessage());
  }

  @Test
  void missingRequiredFlag() {
    FlagSchema health =
        FlagSchema.builder("dcgmi").option("g").requiredFlag("c", "check").build();

    SimulatorException e =
        assertThrows(
            SimulatorException.class,
            () -> health.validate(CommandParser.parse("dcgmi health -g 0")));
    assertEquals("Missing required flag: -c", e.getMessage());
  }

  @Test
  void requiredFlagSatisfiedByAlias() throws SimulatorException {
    FlagSchema diag = FlagSchema.builder("dcgmi").required("r", "run").option("g").build();

    ParsedCommand cmd = diag.validate(CommandParser.parse("dcgmi diag --run 2"));
    assertEquals(Optional.of("2"), cmd.flagValue("run"));
  }

  @Test
  void specLookupMatchesAliases() {
    assertEquals("w", sbatch.spec("nodelist").map(FlagSchema.FlagSpec::name).orElseThrow());
    assertTrue(sbatch.spec("nope").isEmpty());
  }
}
