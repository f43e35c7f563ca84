package io.podsim.core.render;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * JSON output for structured tool modes such as {@code cmsh list -d {}}. Keys are capitalized:
 * fields are named with {@link FieldNamingPolicy#UPPER_CAMEL_CASE} unless a {@code
 * SerializedName} says otherwise.
 */
public final class CapitalizedJson {
  private static final Gson GSON =
      new GsonBuilder()
          .setFieldNamingPolicy(FieldNamingPolicy.UPPER_CAMEL_CASE)
          .setPrettyPrinting()
          .disableHtmlEscaping()
          .create();

  private CapitalizedJson() {}

  public static String toJson(Object value) {
    return GSON.toJson(value);
  }

  public static Gson gson() {
    return GSON;
  }
}
