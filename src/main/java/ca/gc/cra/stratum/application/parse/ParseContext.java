package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.application.port.OptionSchema;
import ca.gc.cra.stratum.domain.option.CommandDefinition;
import ca.gc.cra.stratum.domain.option.CommandRole;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one resolution pass, created by {@link ConfigParser#parse} and passed through every
 * phase. Not thread-safe; never shared between passes.
 *
 * @since 0.1.0
 */
public final class ParseContext {
  private static final Logger log = LoggerFactory.getLogger(ParseContext.class);

  private final OptionSchema schema;
  private final LongOptionTable table;
  private final OptionOccurrenceStore store;
  private final Consumer<String> warn;
  private final List<String> parameters = new ArrayList<>();
  private final Map<String, List<Integer>> groupIndexes = new LinkedHashMap<>();
  private CommandDefinition command;
  private CommandRole role = CommandRole.DEFAULT;
  private boolean help;

  ParseContext(OptionSchema schema, LongOptionTable table, Consumer<String> warn) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.table = Objects.requireNonNull(table, "table");
    this.warn = warn == null ? msg -> {} : warn;
    this.store = new OptionOccurrenceStore(schema);
  }

  public OptionSchema schema() {
    return schema;
  }

  public LongOptionTable table() {
    return table;
  }

  public OptionOccurrenceStore store() {
    return store;
  }

  /**
   * Emits a warning; the offending entry is ignored and resolution continues. Warnings are dropped
   * for internal roles.
   *
   * @param message warning text
   */
  public void warn(String message) {
    if (role.internal()) {
      log.debug("Warning suppressed for {} role: {}", role.label(), message);
      return;
    }
    warn.accept(message);
  }

  /**
   * Returns the active command.
   *
   * @return command, or {@code null} before one was parsed
   */
  public CommandDefinition command() {
    return command;
  }

  /**
   * Returns the active command name.
   *
   * @return command name, or {@code null} before one was parsed
   */
  public String commandName() {
    return command == null ? null : command.name();
  }

  void command(CommandDefinition command, CommandRole role) {
    this.command = command;
    this.role = role;
  }

  public CommandRole role() {
    return role;
  }

  public boolean help() {
    return help;
  }

  void help(boolean help) {
    this.help = help;
  }

  public List<String> parameters() {
    return parameters;
  }

  /**
   * Returns per group the used sparse indexes in dense order, filled by {@link GroupIndexCompactor}.
   *
   * @return mutable map owned by the context
   */
  public Map<String, List<Integer>> groupIndexes() {
    return groupIndexes;
  }

  /**
   * Indicates whether an option is valid for the active command.
   *
   * @param option option definition
   * @return {@code true} when valid
   */
  public boolean valid(OptionDefinition option) {
    return option.validFor(commandName());
  }

  /**
   * Looks up a well-known option by name; the schema may omit it.
   *
   * @param name canonical option name
   * @return definition, or empty
   */
  public Optional<OptionDefinition> option(String name) {
    return schema.option(name);
  }
}
