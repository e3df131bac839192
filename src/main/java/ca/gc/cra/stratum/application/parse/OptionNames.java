package ca.gc.cra.stratum.application.parse;

/**
 * Names of the options the engine itself interprets. A schema that omits one of them simply loses
 * the corresponding behavior.
 *
 * @since 0.1.0
 */
public final class OptionNames {
  /** Main configuration file; {@code --no-config} disables it. */
  public static final String CONFIG = "config";
  /** Base path overriding the default main file and include directory locations. */
  public static final String CONFIG_PATH = "config-path";
  /** Directory of {@code *.conf} files appended to the main file. */
  public static final String CONFIG_INCLUDE_PATH = "config-include-path";
  /** Stanza selecting the stanza-qualified configuration sections. */
  public static final String STANZA = "stanza";

  private OptionNames() {}
}
