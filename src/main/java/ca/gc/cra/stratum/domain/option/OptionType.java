package ca.gc.cra.stratum.domain.option;

import java.util.Locale;

/**
 * Value kinds an option may declare; drives coercion of raw strings into typed values.
 *
 * @since 0.1.0
 */
public enum OptionType {
  /** {@code y}/{@code n} in files and environment, flag form on the command line. */
  BOOLEAN,
  /** Free-form text. */
  STRING,
  /** Signed 64-bit integer. */
  INTEGER,
  /** Floating point number. */
  FLOAT,
  /** Byte count with an optional binary unit suffix such as {@code 10m}. */
  SIZE,
  /** Absolute filesystem path. */
  PATH,
  /** Ordered list of strings. */
  LIST,
  /** Ordered {@code key=value} map. */
  HASH;

  /**
   * Indicates whether occurrences of this type accumulate more than one raw value.
   *
   * @return {@code true} for {@link #LIST} and {@link #HASH}
   */
  public boolean multiValued() {
    return this == LIST || this == HASH;
  }

  /**
   * Parses a schema spelling such as {@code "size"} or {@code "map"}.
   *
   * @param value schema text
   * @return matching type
   * @throws IllegalArgumentException when the spelling is unknown
   */
  public static OptionType fromSchema(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "boolean" -> BOOLEAN;
      case "string" -> STRING;
      case "integer" -> INTEGER;
      case "float" -> FLOAT;
      case "size" -> SIZE;
      case "path" -> PATH;
      case "list" -> LIST;
      case "hash", "map" -> HASH;
      default -> throw new IllegalArgumentException("unknown option type: " + value);
    };
  }
}
