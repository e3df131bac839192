package ca.gc.cra.stratum.domain.ini;

/**
 * Thrown when configuration text is not well-formed INI.
 *
 * @since 0.1.0
 */
public final class IniFormatException extends IllegalArgumentException {
  private final int line;

  /**
   * Creates an exception for a malformed line.
   *
   * @param line one-based line number
   * @param msg human-readable error
   */
  public IniFormatException(int line, String msg) {
    super(msg + " at line " + line);
    this.line = line;
  }

  /**
   * Returns the one-based line number of the offending text.
   *
   * @return line number
   */
  public int line() {
    return line;
  }
}
