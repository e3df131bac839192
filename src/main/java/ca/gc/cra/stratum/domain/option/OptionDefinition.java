package ca.gc.cra.stratum.domain.option;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Schema entry describing one option.
 * <p><strong>Why:</strong> Every resolution phase consults the definition to decide whether a raw
 * value is accepted, where it may come from, and how it is coerced.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param id dense identifier assigned by the schema; equals the position in
 *     {@code OptionSchema#options()}
 * @param name canonical option name (for grouped options the unindexed form, e.g. {@code repo-path})
 * @param type value kind
 * @param section where the option may appear in configuration files
 * @param group owning group name, or {@code null} for ungrouped options
 * @param multi whether the option may be given more than once; always {@code true} for list/hash
 * @param secure whether the option is forbidden on the command line
 * @param negatable whether a non-boolean option accepts the {@code no-} prefix
 * @param deprecatedNames alternate spellings still accepted
 * @param commandRules per-command rules; the key set is the set of commands the option is valid for
 * @since 0.1.0
 */
public record OptionDefinition(
    int id,
    String name,
    OptionType type,
    OptionSection section,
    String group,
    boolean multi,
    boolean secure,
    boolean negatable,
    List<String> deprecatedNames,
    Map<String, OptionRule> commandRules) {

  public OptionDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    section = section == null ? OptionSection.GLOBAL : section;
    multi = multi || type.multiValued();
    deprecatedNames = deprecatedNames == null ? List.of() : List.copyOf(deprecatedNames);
    commandRules = commandRules == null ? Map.of() : Map.copyOf(commandRules);
  }

  /**
   * Indicates whether the option may be used with {@code command}.
   *
   * @param command command name
   * @return {@code true} when a rule exists for the command
   */
  public boolean validFor(String command) {
    return command != null && commandRules.containsKey(command);
  }

  /**
   * Returns the rule for {@code command}, or {@link OptionRule#NONE} when the option is not valid
   * for it.
   *
   * @param command command name
   * @return effective rule
   */
  public OptionRule rule(String command) {
    OptionRule rule = command == null ? null : commandRules.get(command);
    return rule == null ? OptionRule.NONE : rule;
  }

  public boolean grouped() {
    return group != null;
  }

  /**
   * Whether {@code --no-<name>} is recognized.
   *
   * @return {@code true} for booleans and options declared negatable
   */
  public boolean acceptsNegate() {
    return type == OptionType.BOOLEAN || negatable;
  }

  /**
   * Whether {@code --reset-<name>} is recognized.
   *
   * @return {@code true} unless the option is command-line only
   */
  public boolean acceptsReset() {
    return section != OptionSection.COMMAND_LINE;
  }

  /**
   * Whether the plain option form consumes a value on the command line.
   *
   * @return {@code false} for booleans
   */
  public boolean takesValue() {
    return type != OptionType.BOOLEAN;
  }

  /**
   * Returns the name used for the option at {@code index}, e.g. {@code repo2-path} for index 1 of
   * {@code repo-path} in group {@code repo}.
   *
   * @param index zero-based sparse index
   * @return indexed name, or the canonical name for ungrouped options
   */
  public String indexName(int index) {
    if (group == null) {
      return name;
    }
    return group + (index + 1) + name.substring(group.length());
  }
}
