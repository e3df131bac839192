package ca.gc.cra.stratum.api;

import ca.gc.cra.stratum.application.parse.ConfigLocations;
import ca.gc.cra.stratum.application.parse.ConfigParser;
import ca.gc.cra.stratum.application.parse.OptionException;
import ca.gc.cra.stratum.application.port.OptionSchema;
import ca.gc.cra.stratum.domain.config.ResolvedConfig;
import ca.gc.cra.stratum.domain.config.ResolvedOption;
import ca.gc.cra.stratum.domain.config.ResolvedValue;
import ca.gc.cra.stratum.domain.option.CommandDefinition;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionRule;
import ca.gc.cra.stratum.infrastructure.schema.SchemaException;
import ca.gc.cra.stratum.infrastructure.schema.YamlOptionSchemaLoader;
import ca.gc.cra.stratum.infrastructure.storage.LocalConfigStorage;
import ca.gc.cra.stratum.logging.LoggingConfigurator;
import ca.gc.cra.stratum.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stratum CLI: resolves the configuration of a command and prints one {@code name=value (source)}
 * line per configured option.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  static final String SCHEMA_RESOURCE = "stratum-schema.yaml";
  static final String VERSION = "0.1.0";
  private static final String LOG_LEVEL_OPTION = "log-level-console";
  private static final String SUMMARY_USAGE =
      "usage: stratum <command>[:<role>] [parameters] [--option[=value]|--no-option|--reset-option]...";

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args, System.getenv());
    System.exit(exit.code());
  }

  /**
   * Resolves and prints the configuration without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @param environment process environment
   * @return exit code
   */
  static ExitCode run(String[] args, Map<String, String> environment) {
    return run(args, environment, ConfigLocations.defaults());
  }

  static ExitCode run(String[] args, Map<String, String> environment, ConfigLocations locations) {
    OptionSchema schema;
    try {
      schema = YamlOptionSchemaLoader.loadResource(SCHEMA_RESOURCE);
    } catch (IOException ex) {
      log.error("Unable to read option schema {}", SCHEMA_RESOURCE, ex);
      return ExitCode.IO_ERROR;
    } catch (SchemaException ex) {
      log.error("Invalid option schema {}: {}", SCHEMA_RESOURCE, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    ResolvedConfig config;
    try {
      ConfigParser parser = new ConfigParser(schema, new LocalConfigStorage(), locations, log::warn);
      config = parser.parse(Arrays.asList(args), environment);
    } catch (OptionException ex) {
      log.error(ex.getMessage());
      if (ex.commandLine()) {
        CliPrinter.print(SUMMARY_USAGE);
      }
      return ExitCode.of(ex.kind());
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while resolving configuration", ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    if (CommandDefinition.VERSION.equals(config.command())) {
      CliPrinter.print("stratum " + VERSION);
      return ExitCode.SUCCESS;
    }
    if (config.help()) {
      CliPrinter.print(CommandDefinition.HELP.equals(config.command())
          ? summaryHelp(schema)
          : commandHelp(schema, config.command()));
      return ExitCode.SUCCESS;
    }

    config.string(LOG_LEVEL_OPTION).ifPresent(level -> {
      if (!LoggingConfigurator.applyLevel(level)) {
        log.warn("Unknown log level '{}'", level);
      }
    });
    log.debug("Resolved {}", config);
    CliPrinter.print(describe(config));
    return ExitCode.SUCCESS;
  }

  /**
   * Renders the configured options of a resolved configuration, one line per option instance.
   *
   * @param config resolved configuration
   * @return lines of the form {@code name=value (source)}
   */
  static List<String> describe(ResolvedConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("command=" + config.command() + " (" + config.role().label() + ")");
    if (!config.parameters().isEmpty()) {
      lines.add("parameters=" + String.join(" ", config.parameters()));
    }
    for (ResolvedOption option : config.options().values()) {
      if (!option.valid()) {
        continue;
      }
      OptionDefinition definition = option.definition();
      for (int dense = 0; dense < option.values().size(); dense++) {
        ResolvedValue value = option.at(dense);
        if (!value.present()) {
          continue;
        }
        int sparse = definition.grouped() ? config.groupIndexKey(definition.group(), dense) - 1 : 0;
        lines.add(definition.indexName(sparse) + "="
            + Logs.display(definition, format(value.value()))
            + " (" + value.source().name().toLowerCase(Locale.ROOT) + ")");
      }
    }
    return lines;
  }

  private static String format(Object value) {
    if (value instanceof Boolean flag) {
      return flag ? "y" : "n";
    }
    if (value instanceof List<?> list) {
      return list.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
    if (value instanceof Map<?, ?> map) {
      return map.entrySet().stream()
          .map(entry -> entry.getKey() + "=" + entry.getValue())
          .collect(Collectors.joining(","));
    }
    return String.valueOf(value);
  }

  private static List<String> summaryHelp(OptionSchema schema) {
    List<String> lines = new ArrayList<>();
    lines.add("stratum " + VERSION);
    lines.add("");
    lines.add(SUMMARY_USAGE);
    lines.add("");
    lines.add("Commands:");
    for (CommandDefinition command : schema.commands()) {
      lines.add("  " + command.name());
    }
    lines.add("");
    lines.add("Use 'stratum help <command>' for the options of a command.");
    return lines;
  }

  private static List<String> commandHelp(OptionSchema schema, String command) {
    List<String> lines = new ArrayList<>();
    lines.add("stratum " + VERSION + " - '" + command + "' command help");
    lines.add("");
    lines.add("Options:");
    for (OptionDefinition option : schema.options()) {
      if (!option.validFor(command)) {
        continue;
      }
      OptionRule rule = option.rule(command);
      StringBuilder line = new StringBuilder("  --").append(option.name())
          .append(" (").append(option.type().name().toLowerCase(Locale.ROOT)).append(')');
      if (rule.required()) {
        line.append(" required");
      }
      if (rule.hasDefault()) {
        line.append(" [default=").append(Logs.display(option, rule.defaultValue())).append(']');
      }
      lines.add(line.toString());
    }
    return lines;
  }
}
