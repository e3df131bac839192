package ca.gc.cra.stratum.application.parse;

/**
 * Categories of hard resolution errors.
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** Unknown command or command role. */
  COMMAND_INVALID,
  /** Arguments were given but none named a command. */
  COMMAND_REQUIRED,
  /** Positional parameters given to a command that takes none. */
  PARAM_INVALID,
  /** Unknown, misplaced, or conflicting option. */
  OPTION_INVALID,
  /** Option value that cannot be coerced or is not allowed. */
  OPTION_INVALID_VALUE,
  /** Required option with no value from any source. */
  OPTION_REQUIRED,
  /** Malformed configuration file. */
  FORMAT,
  /** Required configuration file or include directory does not exist. */
  FILE_MISSING,
  /** Configuration file exists but could not be read. */
  FILE_READ
}
