package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionGroupDefinition;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns the sparse indexes at which grouped options were found into dense positions.
 *
 * <p>An index is used when any valid member option of the group was found at it. Used indexes are
 * assigned dense positions {@code 0..k-1} in ascending order, so {@code repo1} and {@code repo3}
 * become dense positions 0 and 1. A group with no used index has no positions.</p>
 *
 * @since 0.1.0
 */
public final class GroupIndexCompactor {
  private GroupIndexCompactor() {}

  /**
   * Computes the dense index list of every group and stores it in the context.
   *
   * @param context parse context after all value phases
   * @return per group, the used sparse indexes in dense order
   */
  public static Map<String, List<Integer>> compact(ParseContext context) {
    Map<String, TreeSet<Integer>> used = new LinkedHashMap<>();
    for (OptionGroupDefinition group : context.schema().groups()) {
      used.put(group.name(), new TreeSet<>());
    }

    for (OptionDefinition option : context.schema().options()) {
      if (!option.grouped() || !context.valid(option)) {
        continue;
      }
      used.computeIfAbsent(option.group(), name -> new TreeSet<>())
          .addAll(context.store().foundIndexes(option.id()).keySet());
    }

    Map<String, List<Integer>> dense = context.groupIndexes();
    dense.clear();
    used.forEach((group, indexes) -> dense.put(group, List.copyOf(indexes)));
    return dense;
  }
}
