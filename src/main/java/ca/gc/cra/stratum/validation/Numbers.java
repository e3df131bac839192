package ca.gc.cra.stratum.validation;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Numeric parsing and validation helpers for option values.
 * <p><strong>Why:</strong> Integer, float, and size options share one set of parse rules and error
 * messages regardless of whether the value came from the command line, the environment, or a file.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse integers, decimals, and byte sizes with binary unit suffixes.</li>
 *   <li>Enforce inclusive numeric bounds declared in the option schema.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Paths
 */
public final class Numbers {
  private static final Pattern SIZE_PATTERN = Pattern.compile("([0-9]+)(b|[kmgtp]b?)?");
  private static final Pattern DECIMAL_PATTERN = Pattern.compile("[-+]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][-+]?[0-9]+)?");

  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a signed 64-bit integer.
   *
   * @param value candidate text
   * @return parsed value
   * @throws IllegalArgumentException when the text is not an integer
   */
  public static long parseInteger(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("value '" + value + "' is not a valid integer", ex);
    }
  }

  /**
   * Parses a finite decimal number. Java-specific spellings such as {@code NaN}, {@code Infinity},
   * or a trailing {@code d} are rejected.
   *
   * @param value candidate text
   * @return parsed value
   * @throws IllegalArgumentException when the text is not a decimal number
   */
  public static double parseDecimal(String value) {
    String trimmed = value.trim();
    if (!DECIMAL_PATTERN.matcher(trimmed).matches()) {
      throw new IllegalArgumentException("value '" + value + "' is not a valid number");
    }
    double result = Double.parseDouble(trimmed);
    if (Double.isInfinite(result)) {
      throw new IllegalArgumentException("value '" + value + "' is out of range");
    }
    return result;
  }

  /**
   * Parses a byte size such as {@code 512}, {@code 1kb}, {@code 10m}, or {@code 2GB}.
   *
   * <p>Suffixes are case-insensitive: {@code b} (bytes) or one of {@code k m g t p} with an
   * optional trailing {@code b}, multiplying by 2^10 through 2^50.</p>
   *
   * @param value candidate text
   * @return size in bytes
   * @throws IllegalArgumentException when the text is malformed or the size overflows a long
   */
  public static long parseSize(String value) {
    Matcher matcher = SIZE_PATTERN.matcher(value.trim().toLowerCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw new IllegalArgumentException("value '" + value + "' is not valid");
    }
    String unit = matcher.group(2);
    long multiplier = unit == null ? 1L : sizeMultiplier(unit.charAt(0));
    try {
      return Math.multiplyExact(Long.parseLong(matcher.group(1)), multiplier);
    } catch (NumberFormatException | ArithmeticException ex) {
      throw new IllegalArgumentException("value '" + value + "' is out of range", ex);
    }
  }

  /**
   * Returns the multiplier for a size qualifier.
   *
   * @param qualifier lower-case qualifier character
   * @return multiplier in bytes
   * @throws IllegalArgumentException for unknown qualifiers
   */
  static long sizeMultiplier(char qualifier) {
    return switch (qualifier) {
      case 'b' -> 1L;
      case 'k' -> 1L << 10;
      case 'm' -> 1L << 20;
      case 'g' -> 1L << 30;
      case 't' -> 1L << 40;
      case 'p' -> 1L << 50;
      default -> throw new IllegalArgumentException("'" + qualifier + "' is not a valid size qualifier");
    };
  }
}
