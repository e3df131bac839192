package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.application.port.ConfigStorage;
import ca.gc.cra.stratum.application.port.OptionSchema;
import ca.gc.cra.stratum.domain.config.ResolvedConfig;
import ca.gc.cra.stratum.domain.config.ResolvedOption;
import ca.gc.cra.stratum.domain.ini.Ini;
import ca.gc.cra.stratum.domain.ini.IniFormatException;
import ca.gc.cra.stratum.domain.option.CommandDefinition;
import ca.gc.cra.stratum.domain.option.CommandRole;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves the configuration of one invocation from command-line arguments,
 * environment variables, configuration files, and schema defaults.
 * <p><strong>Phases:</strong> command line, environment, configuration files, group index
 * compaction, then dependency-ordered validation. Each phase only fills option indexes no earlier
 * phase found, which yields the precedence command line &gt; environment &gt; file &gt; default.</p>
 * <p><strong>Thread-safety:</strong> The parser is immutable and may be reused; every call to
 * {@link #parse(List, Map)} works on its own {@link ParseContext}.</p>
 * <p><strong>Observability:</strong> Warnings go to the supplied sink; phase progress is logged at
 * DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class ConfigParser {
  private static final Logger log = LoggerFactory.getLogger(ConfigParser.class);

  private final OptionSchema schema;
  private final LongOptionTable table;
  private final ArgumentTokenizer tokenizer;
  private final ConfigStorage storage;
  private final ConfigLocations locations;
  private final Consumer<String> warn;

  /**
   * Creates a parser.
   *
   * @param schema option schema
   * @param storage file-system accessor for configuration files
   * @param locations legacy main file and include naming rules
   * @param warn sink for warnings about ignored environment and file entries
   */
  public ConfigParser(
      OptionSchema schema, ConfigStorage storage, ConfigLocations locations, Consumer<String> warn) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.locations = Objects.requireNonNull(locations, "locations");
    this.warn = warn == null ? msg -> {} : warn;
    this.table = new LongOptionTable(schema);
    this.tokenizer = new ArgumentTokenizer(table);
  }

  /**
   * Resolves the configuration.
   *
   * @param args command-line arguments, excluding the executable name
   * @param environment process environment
   * @return immutable configuration
   * @throws OptionException when any phase finds a hard error
   */
  public ResolvedConfig parse(List<String> args, Map<String, String> environment) {
    ParseContext context = new ParseContext(schema, table, warn);

    List<ArgumentToken> tokens = tokenizer.tokenize(args);
    applyCommandLine(context, tokens);

    if (context.command() == null) {
      log.debug("No command given; help requested");
      return new ResolvedConfig(
          CommandDefinition.HELP, CommandRole.DEFAULT, true, context.parameters(), Map.of(), Map.of());
    }
    if (CommandDefinition.VERSION.equals(context.commandName())) {
      return new ResolvedConfig(
          context.commandName(), context.role(), context.help(), context.parameters(), Map.of(), Map.of());
    }

    EnvironmentMapper.apply(context, environment);
    log.debug("Environment applied for command {}", context.commandName());

    Optional<String> configText = new ConfigFileLoader(storage, locations).load(context);
    if (configText.isPresent()) {
      SectionResolver.apply(context, parseIni(configText.get()));
      log.debug("Configuration files applied for command {}", context.commandName());
    }

    Map<String, List<Integer>> groups = GroupIndexCompactor.compact(context);
    Map<String, ResolvedOption> options = OptionValueResolver.resolve(context);
    return new ResolvedConfig(
        context.commandName(), context.role(), context.help(), context.parameters(), groups, options);
  }

  private void applyCommandLine(ParseContext context, List<ArgumentToken> tokens) {
    boolean commandSet = false;
    for (ArgumentToken token : tokens) {
      switch (token.kind()) {
        case COMMAND -> {
          if (CommandDefinition.HELP.equals(token.text())) {
            context.help(true);
          } else if (!commandSet) {
            setCommand(context, token.text());
            commandSet = true;
          } else {
            context.parameters().add(token.text());
          }
        }
        case PARAMETER -> context.parameters().add(token.text());
        case OPTION -> {
          OptionDefinition option = schema.option(token.key().optionId());
          if (option.secure()) {
            throw OptionException.commandLine(
                ErrorKind.OPTION_INVALID,
                "option '" + option.indexName(token.key().index()) + "' is not allowed on the command-line\n"
                    + "HINT: this option could expose secrets in the process list.\n"
                    + "HINT: specify the option in a configuration file or an environment variable instead.");
          }
          if (token.key().deprecated()) {
            log.debug("Deprecated option spelling {} used", token.text());
          }
          context.store().recordCommandLine(token.key(), token.value());
        }
        default -> throw new IllegalStateException("unexpected token kind " + token.kind());
      }
    }

    if (!commandSet && !context.help() && !tokens.isEmpty()) {
      throw OptionException.commandLine(ErrorKind.COMMAND_REQUIRED, "no command found");
    }
    if (!commandSet) {
      context.help(true);
    }
    if (commandSet && !context.parameters().isEmpty() && !context.help() && !context.command().parameterAllowed()) {
      throw OptionException.commandLine(ErrorKind.PARAM_INVALID, "command does not allow parameters");
    }
  }

  private void setCommand(ParseContext context, String text) {
    Optional<CommandDefinition> command = schema.command(text);
    CommandRole role = CommandRole.DEFAULT;

    if (command.isEmpty()) {
      String[] parts = text.split(":", -1);
      if (parts.length == 2) {
        command = schema.command(parts[0]);
        if (command.isPresent()) {
          role = CommandRole.find(parts[1])
              .orElseThrow(() -> OptionException.commandLine(
                  ErrorKind.COMMAND_INVALID, "invalid command role '" + parts[1] + "'"));
          if (!command.get().supports(role)) {
            throw OptionException.commandLine(ErrorKind.COMMAND_INVALID, "invalid command '" + text + "'");
          }
        }
      }
    }

    CommandDefinition resolved = command
        .orElseThrow(() -> OptionException.commandLine(ErrorKind.COMMAND_INVALID, "invalid command '" + text + "'"));
    context.command(resolved, role);
  }

  private static Ini parseIni(String text) {
    try {
      return Ini.parse(text);
    } catch (IniFormatException ex) {
      throw new OptionException(ErrorKind.FORMAT, "invalid configuration: " + ex.getMessage(), ex);
    }
  }
}
