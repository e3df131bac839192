package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.domain.option.OptionKey;
import java.util.Objects;

/**
 * One classified command-line argument.
 *
 * @param kind classification
 * @param text raw argument as given (for options, the spelling including dashes)
 * @param key decoded option, or {@code null} for commands and parameters
 * @param value option value, or {@code null} when the option takes none
 * @since 0.1.0
 */
public record ArgumentToken(Kind kind, String text, OptionKey key, String value) {
  /** Argument classification. */
  public enum Kind {
    COMMAND,
    PARAMETER,
    OPTION
  }

  public ArgumentToken {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(text, "text");
    if (kind == Kind.OPTION && key == null) {
      throw new IllegalArgumentException("option token requires a key");
    }
  }

  static ArgumentToken command(String text) {
    return new ArgumentToken(Kind.COMMAND, text, null, null);
  }

  static ArgumentToken parameter(String text) {
    return new ArgumentToken(Kind.PARAMETER, text, null, null);
  }

  static ArgumentToken option(String text, OptionKey key, String value) {
    return new ArgumentToken(Kind.OPTION, text, key, value);
  }
}
