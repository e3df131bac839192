package ca.gc.cra.stratum.application.port;

import ca.gc.cra.stratum.domain.option.CommandDefinition;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionGroupDefinition;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Port exposing the static command and option schema.
 * <p><strong>Why:</strong> Keeps the resolution engine independent of how the schema is authored.</p>
 * <p><strong>Role:</strong> Consumed by every parse phase; implemented by
 * {@link ca.gc.cra.stratum.infrastructure.schema.DefinedOptionSchema}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be immutable.</p>
 *
 * @since 0.1.0
 */
public interface OptionSchema {
  /**
   * Looks up a command.
   *
   * @param name command name without role suffix
   * @return definition, or empty for unknown commands
   */
  Optional<CommandDefinition> command(String name);

  /**
   * Returns all commands in declaration order.
   *
   * @return unmodifiable command list
   */
  List<CommandDefinition> commands();

  /**
   * Returns all options ordered by id.
   *
   * @return unmodifiable option list where {@code options().get(id).id() == id}
   */
  List<OptionDefinition> options();

  /**
   * Looks up an option by canonical name.
   *
   * @param name canonical name
   * @return definition, or empty for unknown names
   */
  Optional<OptionDefinition> option(String name);

  /**
   * Returns the option with the given id.
   *
   * @param optionId option id
   * @return definition
   * @throws IndexOutOfBoundsException for unknown ids
   */
  default OptionDefinition option(int optionId) {
    return options().get(optionId);
  }

  /**
   * Looks up an option group.
   *
   * @param name group name
   * @return definition, or empty for unknown groups
   */
  Optional<OptionGroupDefinition> group(String name);

  /**
   * Returns all groups in declaration order.
   *
   * @return unmodifiable group list
   */
  List<OptionGroupDefinition> groups();

  /**
   * Returns option ids ordered so that every option follows the option it depends on.
   *
   * @return unmodifiable list containing every option id exactly once
   */
  List<Integer> resolveOrder();
}
