package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.application.port.ConfigStorage;
import ca.gc.cra.stratum.domain.ini.IniFormatException;
import ca.gc.cra.stratum.domain.ini.Ini;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decides which configuration files to read and concatenates them.
 * <p><strong>Rules:</strong></p>
 * <ul>
 *   <li>By default the main file is read when it exists, falling back to the legacy location, and
 *   every {@code *.conf} file of the include directory is appended when the directory exists.</li>
 *   <li>{@code --config} alone: only that file is read and it must exist.</li>
 *   <li>{@code --config} with {@code --config-path}: the file must exist; the include directory under
 *   the config path is optional.</li>
 *   <li>{@code --config-include-path}: the directory must exist; with {@code --config} as well, at
 *   least one include file must exist.</li>
 *   <li>{@code --config-path}: moves the default main file and include directory under that path;
 *   neither is required.</li>
 *   <li>{@code --no-config}: the main file is skipped; the include directory is read only when
 *   {@code --config-include-path} or {@code --config-path} is given.</li>
 * </ul>
 * <p>"Given" means found on the command line or in the environment. Each text part is parsed as INI
 * before it is appended so malformed files fail fast; the merged text is parsed by the caller.</p>
 * <p><strong>Thread-safety:</strong> One instance per resolution pass; reads are memoized per path.</p>
 *
 * @since 0.1.0
 */
public final class ConfigFileLoader {
  private static final Logger log = LoggerFactory.getLogger(ConfigFileLoader.class);
  private static final String LF = "\n";

  private final ConfigStorage storage;
  private final ConfigLocations locations;
  private final Map<Path, Optional<String>> reads = new HashMap<>();

  public ConfigFileLoader(ConfigStorage storage, ConfigLocations locations) {
    this.storage = Objects.requireNonNull(storage, "storage");
    this.locations = Objects.requireNonNull(locations, "locations");
  }

  /**
   * Loads and concatenates the configuration files selected by the current option state.
   *
   * @param context parse context after the command-line and environment phases
   * @return merged configuration text, or empty when nothing was loaded
   * @throws OptionException when a required file or directory is missing, unreadable, or malformed
   */
  public Optional<String> load(ParseContext context) {
    Explicit config = explicit(context, OptionNames.CONFIG);
    Explicit configPath = explicit(context, OptionNames.CONFIG_PATH);
    Explicit includePath = explicit(context, OptionNames.CONFIG_INCLUDE_PATH);

    String configDefaultCurrent = defaultValue(context, OptionNames.CONFIG);
    String configDefault = configDefaultCurrent;
    String includeDefault = defaultValue(context, OptionNames.CONFIG_INCLUDE_PATH);

    boolean configRequired = config.found();
    boolean configIncludeRequired = includePath.found();
    boolean loadConfig = true;
    boolean loadInclude = true;

    if (configPath.value() != null) {
      if (configDefault != null) {
        configDefault = Path.of(configPath.value()).resolve(baseName(configDefault)).toString();
      }
      includeDefault = Path.of(configPath.value()).resolve(locations.includeDirName()).toString();
    }

    if (config.negate()) {
      loadConfig = false;
      configRequired = false;
      loadInclude = configPath.found() || configIncludeRequired;
    }

    if (configRequired && !(configPath.found() || configIncludeRequired)) {
      loadInclude = false;
      configIncludeRequired = false;
    }

    String result = null;
    if (loadConfig) {
      String fileName = configRequired ? config.value() : configDefault;
      if (fileName != null) {
        Path file = Path.of(fileName);
        Optional<String> text = read(file, !configRequired);
        if (text.isEmpty() && fileName.equals(configDefaultCurrent) && locations.legacyConfigFile() != null) {
          log.debug("Configuration file {} not found; trying legacy location {}", file,
              locations.legacyConfigFile());
          text = read(locations.legacyConfigFile(), !configRequired);
        }
        if (text.isPresent()) {
          validate(text.get(), file);
          result = text.get();
        }
      }
    }

    if (loadInclude) {
      String directory = configIncludeRequired ? includePath.value() : includeDefault;
      if (directory != null) {
        int parts = 0;
        Path includeDir = Path.of(directory);
        for (String name : listIncludes(includeDir, configIncludeRequired)) {
          Path file = includeDir.resolve(name);
          Optional<String> part = read(file, true);
          if (part.isEmpty() || part.get().isEmpty()) {
            continue;
          }
          validate(part.get(), file);
          result = result == null ? part.get() : result + LF + part.get();
          parts++;
        }
        if (parts == 0 && configRequired && configIncludeRequired) {
          throw new OptionException(
              ErrorKind.FILE_MISSING, "no configuration files found in include path '" + includeDir + "'");
        }
      }
    }

    return Optional.ofNullable(result);
  }

  private List<String> listIncludes(Path directory, boolean required) {
    try {
      List<String> names = new ArrayList<>(
          storage.list(directory, locations.includePattern(), required).orElse(List.of()));
      names.sort(null);
      return names;
    } catch (NoSuchFileException ex) {
      throw new OptionException(
          ErrorKind.FILE_MISSING, "unable to list files for missing path '" + directory + "'", ex);
    } catch (IOException ex) {
      throw new OptionException(
          ErrorKind.FILE_READ, "unable to list files in '" + directory + "': " + ex.getMessage(), ex);
    }
  }

  private Optional<String> read(Path file, boolean ignoreMissing) {
    Optional<String> cached = reads.get(file);
    if (cached != null && (cached.isPresent() || ignoreMissing)) {
      return cached;
    }
    try {
      Optional<String> text = storage.read(file, ignoreMissing);
      reads.put(file, text);
      return text;
    } catch (NoSuchFileException ex) {
      throw new OptionException(
          ErrorKind.FILE_MISSING, "unable to open missing file '" + file + "' for read", ex);
    } catch (IOException ex) {
      throw new OptionException(
          ErrorKind.FILE_READ, "unable to read file '" + file + "': " + ex.getMessage(), ex);
    }
  }

  private static void validate(String text, Path file) {
    try {
      Ini.parse(text);
    } catch (IniFormatException ex) {
      throw new OptionException(
          ErrorKind.FORMAT, "invalid configuration file '" + file + "': " + ex.getMessage(), ex);
    }
  }

  private static Explicit explicit(ParseContext context, String name) {
    Optional<OptionDefinition> option = context.option(name);
    if (option.isEmpty()) {
      return Explicit.NONE;
    }
    return context.store().find(option.get().id(), 0)
        .filter(OptionOccurrence::found)
        .map(occurrence -> new Explicit(
            true,
            occurrence.negate(),
            occurrence.values().isEmpty() ? null : occurrence.values().get(0)))
        .orElse(Explicit.NONE);
  }

  private static String defaultValue(ParseContext context, String name) {
    return context.option(name)
        .map(option -> option.rule(context.commandName()).defaultValue())
        .orElse(null);
  }

  private static String baseName(String path) {
    Path name = Path.of(path).getFileName();
    return name == null ? path : name.toString();
  }

  private record Explicit(boolean found, boolean negate, String value) {
    static final Explicit NONE = new Explicit(false, false, null);
  }
}
