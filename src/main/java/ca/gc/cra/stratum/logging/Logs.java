package ca.gc.cra.stratum.logging;

import ca.gc.cra.stratum.domain.option.OptionDefinition;

/**
 * Helpers that keep secure option values out of logs and console output.
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent API usage
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Renders an option value for display, redacting it when the option is secure.
   *
   * @param option option definition
   * @param value display text of the value; may be {@code null}
   * @return display text
   */
  public static String display(OptionDefinition option, String value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    return option.secure() ? redact(value) : value;
  }
}
