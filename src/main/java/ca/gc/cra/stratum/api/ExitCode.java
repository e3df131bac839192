package ca.gc.cra.stratum.api;

import ca.gc.cra.stratum.application.parse.ErrorKind;

/**
 * <strong>What:</strong> Canonical exit codes of the Stratum command-line tool.
 * <p><strong>Why:</strong> Provides consistent process status semantics so operators and automation
 * can react deterministically.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Invalid command, option, or parameter on the command line. */
  INVALID_ARGS(2),
  /** Configuration file missing or unreadable. */
  IO_ERROR(3),
  /** Invalid option value, missing required option, or malformed configuration file. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }

  /**
   * Maps a resolution error category to the exit code reported for it.
   *
   * @param kind error category
   * @return exit code
   */
  public static ExitCode of(ErrorKind kind) {
    return switch (kind) {
      case COMMAND_INVALID, COMMAND_REQUIRED, PARAM_INVALID, OPTION_INVALID -> INVALID_ARGS;
      case FILE_MISSING, FILE_READ -> IO_ERROR;
      case OPTION_INVALID_VALUE, OPTION_REQUIRED, FORMAT -> CONFIG_ERROR;
    };
  }
}
