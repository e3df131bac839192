package ca.gc.cra.stratum.domain.option;

/**
 * Provenance tier of a value. Earlier constants take precedence over later ones.
 *
 * @since 0.1.0
 */
public enum OptionSource {
  /** Command-line argument. */
  PARAM,
  /** Environment variable or configuration file. */
  CONFIG,
  /** Schema default. */
  DEFAULT
}
