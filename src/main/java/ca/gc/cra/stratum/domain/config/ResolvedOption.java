package ca.gc.cra.stratum.domain.config;

import ca.gc.cra.stratum.domain.option.OptionDefinition;
import java.util.List;
import java.util.Objects;

/**
 * Resolution result for one option across the dense indexes of its group.
 *
 * @param definition schema entry
 * @param valid whether the option is valid for the active command
 * @param values one entry per dense index (a single entry for ungrouped options, none for a group
 *     with no configured index, and none when the option is not valid)
 * @since 0.1.0
 */
public record ResolvedOption(OptionDefinition definition, boolean valid, List<ResolvedValue> values) {
  public ResolvedOption {
    Objects.requireNonNull(definition, "definition");
    values = values == null ? List.of() : List.copyOf(values);
  }

  /**
   * Returns the value at a dense index.
   *
   * @param index dense index
   * @return value, or {@link ResolvedValue#absent()} when the index is out of bounds
   */
  public ResolvedValue at(int index) {
    if (index < 0 || index >= values.size()) {
      return ResolvedValue.absent();
    }
    return values.get(index);
  }
}
