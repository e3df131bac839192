package ca.gc.cra.stratum.application.parse;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Fixed locations and naming rules used when looking for configuration files. The current defaults
 * for the main file and include directory come from the schema; these values complement them.
 *
 * @param legacyConfigFile well-known main file tried when the current default main file is missing
 * @param includeDirName include directory name appended to {@code --config-path}
 * @param includePattern full-match filter for include file names
 * @since 0.1.0
 */
public record ConfigLocations(Path legacyConfigFile, String includeDirName, Pattern includePattern) {
  /** Legacy main file location. */
  public static final Path LEGACY_CONFIG_FILE = Path.of("/etc/stratum.conf");
  /** Include directory name under the configuration base path. */
  public static final String INCLUDE_DIR_NAME = "conf.d";
  /** Include files end in {@code .conf}. */
  public static final Pattern INCLUDE_PATTERN = Pattern.compile(".+\\.conf");

  public ConfigLocations {
    Objects.requireNonNull(includeDirName, "includeDirName");
    Objects.requireNonNull(includePattern, "includePattern");
  }

  /**
   * Returns the production locations.
   *
   * @return default locations
   */
  public static ConfigLocations defaults() {
    return new ConfigLocations(LEGACY_CONFIG_FILE, INCLUDE_DIR_NAME, INCLUDE_PATTERN);
  }

  /**
   * Returns a copy with a different legacy main file, e.g. for tests running in a temp directory.
   *
   * @param legacy legacy main file, or {@code null} to disable the fallback
   * @return updated locations
   */
  public ConfigLocations withLegacyConfigFile(Path legacy) {
    return new ConfigLocations(legacy, includeDirName, includePattern);
  }
}
