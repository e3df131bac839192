package ca.gc.cra.stratum.domain.option;

import java.util.Objects;
import java.util.Set;

/**
 * Schema entry for a command.
 *
 * @param name command name as typed on the command line
 * @param parameterAllowed whether positional parameters may follow the command
 * @param roles roles the command may run under; always contains {@link CommandRole#DEFAULT}
 * @since 0.1.0
 */
public record CommandDefinition(String name, boolean parameterAllowed, Set<CommandRole> roles) {
  /** Command that prints help for the command that follows it. */
  public static final String HELP = "help";
  /** Command that prints the version and skips option resolution. */
  public static final String VERSION = "version";

  public CommandDefinition {
    Objects.requireNonNull(name, "name");
    roles = roles == null || roles.isEmpty() ? Set.of(CommandRole.DEFAULT) : Set.copyOf(roles);
    if (!roles.contains(CommandRole.DEFAULT)) {
      throw new IllegalArgumentException("command " + name + " must support the default role");
    }
  }

  public boolean supports(CommandRole role) {
    return roles.contains(role);
  }
}
