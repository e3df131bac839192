package ca.gc.cra.stratum.domain.option;

import java.util.Objects;

/**
 * Family of options that may be instantiated several times, each instance addressed by an index.
 *
 * @param name group name; also the prefix of every member option name
 * @param indexMax number of instances that may be configured
 * @since 0.1.0
 */
public record OptionGroupDefinition(String name, int indexMax) {
  public OptionGroupDefinition {
    Objects.requireNonNull(name, "name");
    if (indexMax < 1) {
      throw new IllegalArgumentException("group " + name + " indexMax must be >= 1 (was " + indexMax + ")");
    }
  }
}
