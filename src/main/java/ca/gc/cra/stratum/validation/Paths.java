package ca.gc.cra.stratum.validation;

/**
 * <strong>What:</strong> Validation of path option values.
 * <p><strong>Why:</strong> Path options are compared and concatenated textually by downstream
 * commands, so they must be absolute and free of empty segments before anything uses them.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @implNote Validation is purely textual; the filesystem is never consulted.
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private static final String SEPARATOR = "/";

  private Paths() {
    // Utility
  }

  /**
   * Validates and normalizes a path option value.
   *
   * @param option option name included in diagnostics
   * @param value candidate path
   * @return the path without a trailing {@code /} (unless it is exactly {@code /})
   * @throws IllegalArgumentException if the value is empty, relative, or contains {@code //}
   */
  public static String requireOptionPath(String option, String value) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(
          "'" + (value == null ? "" : value) + "' must be >= 1 character for '" + option + "' option");
    }
    if (!value.startsWith(SEPARATOR)) {
      throw new IllegalArgumentException("'" + value + "' must begin with / for '" + option + "' option");
    }
    if (value.contains("//")) {
      throw new IllegalArgumentException("'" + value + "' cannot contain // for '" + option + "' option");
    }
    if (value.endsWith(SEPARATOR) && value.length() != 1) {
      return value.substring(0, value.length() - 1);
    }
    return value;
  }
}
