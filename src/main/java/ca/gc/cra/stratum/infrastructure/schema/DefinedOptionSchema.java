package ca.gc.cra.stratum.infrastructure.schema;

import ca.gc.cra.stratum.application.port.OptionSchema;
import ca.gc.cra.stratum.domain.option.CommandDefinition;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionDependency;
import ca.gc.cra.stratum.domain.option.OptionGroupDefinition;
import ca.gc.cra.stratum.domain.option.OptionRule;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * <strong>What:</strong> In-memory {@link OptionSchema} built from explicit definitions.
 * <p><strong>Why:</strong> Validates cross references once, when the schema is built, so parse
 * phases can trust every name and id they look up.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject duplicate command, group, and option names.</li>
 *   <li>Check group membership, group name prefixes, dependency targets, and command references.</li>
 *   <li>Compute the dependency-respecting resolve order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class DefinedOptionSchema implements OptionSchema {
  private final List<CommandDefinition> commands;
  private final List<OptionGroupDefinition> groups;
  private final List<OptionDefinition> options;
  private final Map<String, CommandDefinition> commandsByName = new LinkedHashMap<>();
  private final Map<String, OptionGroupDefinition> groupsByName = new LinkedHashMap<>();
  private final Map<String, OptionDefinition> optionsByName = new LinkedHashMap<>();
  private final List<Integer> resolveOrder;

  /**
   * Builds and validates a schema.
   *
   * @param commands commands in declaration order
   * @param groups option groups in declaration order
   * @param options options where {@code options.get(i).id() == i}
   * @throws SchemaException when the definitions are inconsistent
   */
  public DefinedOptionSchema(
      List<CommandDefinition> commands,
      List<OptionGroupDefinition> groups,
      List<OptionDefinition> options) {
    this.commands = List.copyOf(commands);
    this.groups = List.copyOf(groups);
    this.options = List.copyOf(options);

    for (CommandDefinition command : this.commands) {
      if (CommandDefinition.HELP.equals(command.name())) {
        throw new SchemaException("command '" + CommandDefinition.HELP + "' is built in");
      }
      if (commandsByName.put(command.name(), command) != null) {
        throw new SchemaException("duplicate command '" + command.name() + "'");
      }
    }
    for (OptionGroupDefinition group : this.groups) {
      if (groupsByName.put(group.name(), group) != null) {
        throw new SchemaException("duplicate group '" + group.name() + "'");
      }
    }
    for (int i = 0; i < this.options.size(); i++) {
      OptionDefinition option = this.options.get(i);
      if (option.id() != i) {
        throw new SchemaException("option '" + option.name() + "' has id " + option.id() + ", expected " + i);
      }
      if (optionsByName.put(option.name(), option) != null) {
        throw new SchemaException("duplicate option '" + option.name() + "'");
      }
    }
    this.options.forEach(this::check);
    this.resolveOrder = List.copyOf(topologicalOrder());
  }

  private void check(OptionDefinition option) {
    if (option.grouped()) {
      if (!groupsByName.containsKey(option.group())) {
        throw new SchemaException("option '" + option.name() + "' references unknown group '" + option.group() + "'");
      }
      if (!option.name().startsWith(option.group() + "-")) {
        throw new SchemaException(
            "option '" + option.name() + "' must start with its group prefix '" + option.group() + "-'");
      }
    }
    for (Map.Entry<String, OptionRule> entry : option.commandRules().entrySet()) {
      if (!commandsByName.containsKey(entry.getKey())) {
        throw new SchemaException("option '" + option.name() + "' references unknown command '" + entry.getKey() + "'");
      }
      OptionDependency depend = entry.getValue().depend();
      if (depend != null) {
        if (!optionsByName.containsKey(depend.option())) {
          throw new SchemaException(
              "option '" + option.name() + "' depends on unknown option '" + depend.option() + "'");
        }
        if (depend.option().equals(option.name())) {
          throw new SchemaException("option '" + option.name() + "' depends on itself");
        }
      }
    }
  }

  // Kahn's algorithm; ties are broken by declaration order.
  private List<Integer> topologicalOrder() {
    int size = options.size();
    int[] pending = new int[size];
    List<List<Integer>> dependents = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      dependents.add(new ArrayList<>());
    }
    for (OptionDefinition option : options) {
      option.commandRules().values().stream()
          .map(OptionRule::depend)
          .filter(depend -> depend != null)
          .map(depend -> optionsByName.get(depend.option()).id())
          .distinct()
          .forEach(target -> {
            dependents.get(target).add(option.id());
            pending[option.id()]++;
          });
    }

    PriorityQueue<Integer> ready = new PriorityQueue<>();
    for (int i = 0; i < size; i++) {
      if (pending[i] == 0) {
        ready.add(i);
      }
    }
    List<Integer> order = new ArrayList<>(size);
    while (!ready.isEmpty()) {
      int id = ready.poll();
      order.add(id);
      for (int dependent : dependents.get(id)) {
        if (--pending[dependent] == 0) {
          ready.add(dependent);
        }
      }
    }
    if (order.size() != size) {
      List<String> cyclic = new ArrayList<>();
      for (int i = 0; i < size; i++) {
        if (pending[i] > 0) {
          cyclic.add(options.get(i).name());
        }
      }
      throw new SchemaException("option dependencies form a cycle among " + cyclic);
    }
    return order;
  }

  @Override
  public Optional<CommandDefinition> command(String name) {
    return Optional.ofNullable(commandsByName.get(name));
  }

  @Override
  public List<CommandDefinition> commands() {
    return commands;
  }

  @Override
  public List<OptionDefinition> options() {
    return options;
  }

  @Override
  public Optional<OptionDefinition> option(String name) {
    return Optional.ofNullable(optionsByName.get(name));
  }

  @Override
  public Optional<OptionGroupDefinition> group(String name) {
    return Optional.ofNullable(groupsByName.get(name));
  }

  @Override
  public List<OptionGroupDefinition> groups() {
    return groups;
  }

  @Override
  public List<Integer> resolveOrder() {
    return resolveOrder;
  }
}
