package ca.gc.cra.stratum.domain.option;

import java.util.Locale;

/**
 * Where an option may appear in configuration files.
 *
 * @since 0.1.0
 */
public enum OptionSection {
  /** Command line (or environment) only; ignored with a warning in files. */
  COMMAND_LINE,
  /** Any section, including {@code [global]} and {@code [global:<command>]}. */
  GLOBAL,
  /** Stanza sections only; ignored with a warning in global sections. */
  STANZA;

  /**
   * Parses a schema spelling such as {@code "command-line"}.
   *
   * @param value schema text; {@code null} defaults to {@link #GLOBAL}
   * @return matching section
   * @throws IllegalArgumentException when the spelling is unknown
   */
  public static OptionSection fromSchema(String value) {
    if (value == null) {
      return GLOBAL;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "command-line", "commandline" -> COMMAND_LINE;
      case "global" -> GLOBAL;
      case "stanza" -> STANZA;
      default -> throw new IllegalArgumentException("unknown option section: " + value);
    };
  }
}
