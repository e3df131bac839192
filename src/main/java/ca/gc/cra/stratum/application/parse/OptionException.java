package ca.gc.cra.stratum.application.parse;

import java.util.Objects;

/**
 * Hard error that aborts configuration resolution.
 *
 * <p>Extends {@link IllegalArgumentException} so callers that already translate validation failures
 * into CLI guidance handle it without change; {@link #kind()} distinguishes the category.</p>
 *
 * @since 0.1.0
 */
public final class OptionException extends IllegalArgumentException {
  private final ErrorKind kind;
  private final boolean commandLine;

  /**
   * Creates an exception with a user-actionable message.
   *
   * @param kind error category
   * @param msg human-readable error, may contain {@code HINT:} lines
   */
  public OptionException(ErrorKind kind, String msg) {
    this(kind, msg, false);
  }

  private OptionException(ErrorKind kind, String msg, boolean commandLine) {
    super(msg);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.commandLine = commandLine;
  }

  /**
   * Creates an exception for a problem in the command-line arguments themselves.
   *
   * @param kind error category
   * @param msg human-readable error
   * @return exception reporting {@link #commandLine()} as {@code true}
   */
  public static OptionException commandLine(ErrorKind kind, String msg) {
    return new OptionException(kind, msg, true);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param kind error category
   * @param msg human-readable error
   * @param cause root cause
   */
  public OptionException(ErrorKind kind, String msg, Throwable cause) {
    super(msg, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.commandLine = false;
  }

  public ErrorKind kind() {
    return kind;
  }

  /**
   * Whether the error was found in the command-line arguments rather than in the environment, a
   * configuration file, or a resolved value.
   *
   * @return {@code true} for command-line errors
   */
  public boolean commandLine() {
    return commandLine;
  }
}
