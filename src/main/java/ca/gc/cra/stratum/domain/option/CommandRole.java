package ca.gc.cra.stratum.domain.option;

import java.util.Locale;
import java.util.Optional;

/**
 * Role a command runs under, selected with the {@code <command>:<role>} spelling.
 *
 * @since 0.1.0
 */
public enum CommandRole {
  DEFAULT,
  ASYNC,
  LOCAL,
  REMOTE;

  /**
   * Looks up a role by its lower-case name.
   *
   * @param value role text from the command token or schema
   * @return matching role, or empty when the text names no role
   */
  public static Optional<CommandRole> find(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (CommandRole role : values()) {
      if (role.name().equals(normalized)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }

  /**
   * Whether the role runs as a sub-process of another command, whose warnings are not reported.
   *
   * @return {@code true} for {@link #LOCAL} and {@link #REMOTE}
   */
  public boolean internal() {
    return this == LOCAL || this == REMOTE;
  }

  /**
   * Returns the spelling used on the command line.
   *
   * @return lower-case role name
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
