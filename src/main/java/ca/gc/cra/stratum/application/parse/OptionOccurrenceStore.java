package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.application.port.OptionSchema;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionKey;
import ca.gc.cra.stratum.domain.option.OptionSource;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per option, per sparse index record of what each parse phase found.
 *
 * <p>The command-line phase records through {@link #recordCommandLine(OptionKey, String)}, which
 * enforces the negate/reset invariants; later phases claim unfound occurrences through
 * {@link #getOrCreate(int, int)} and never touch an occurrence that is already found.</p>
 *
 * @since 0.1.0
 */
public final class OptionOccurrenceStore {
  private final OptionSchema schema;
  private final Map<Integer, NavigableMap<Integer, OptionOccurrence>> occurrences = new HashMap<>();

  public OptionOccurrenceStore(OptionSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /**
   * Returns the occurrence for an option index, creating an unfound one when absent.
   *
   * @param optionId option id
   * @param index sparse index
   * @return occurrence owned by this store
   */
  public OptionOccurrence getOrCreate(int optionId, int index) {
    return occurrences
        .computeIfAbsent(optionId, id -> new TreeMap<>())
        .computeIfAbsent(index, idx -> new OptionOccurrence());
  }

  /**
   * Returns the occurrence for an option index without creating one.
   *
   * @param optionId option id
   * @param index sparse index
   * @return occurrence, or empty when nothing was recorded
   */
  public Optional<OptionOccurrence> find(int optionId, int index) {
    NavigableMap<Integer, OptionOccurrence> byIndex = occurrences.get(optionId);
    return byIndex == null ? Optional.empty() : Optional.ofNullable(byIndex.get(index));
  }

  /**
   * Indicates whether an option index was claimed by any phase.
   *
   * @param optionId option id
   * @param index sparse index
   * @return {@code true} when found
   */
  public boolean found(int optionId, int index) {
    return find(optionId, index).map(OptionOccurrence::found).orElse(false);
  }

  /**
   * Returns the found occurrences of an option keyed by ascending sparse index.
   *
   * @param optionId option id
   * @return found occurrences, possibly empty
   */
  public NavigableMap<Integer, OptionOccurrence> foundIndexes(int optionId) {
    NavigableMap<Integer, OptionOccurrence> result = new TreeMap<>();
    NavigableMap<Integer, OptionOccurrence> byIndex = occurrences.get(optionId);
    if (byIndex != null) {
      byIndex.forEach((index, occurrence) -> {
        if (occurrence.found()) {
          result.put(index, occurrence);
        }
      });
    }
    return result;
  }

  /**
   * Indicates whether any index of an option was set on the command line.
   *
   * @param optionId option id
   * @return {@code true} when a command-line occurrence exists
   */
  public boolean setOnCommandLine(int optionId) {
    return foundIndexes(optionId).values().stream()
        .anyMatch(occurrence -> occurrence.source() == OptionSource.PARAM);
  }

  /**
   * Returns the first value of the index 0 occurrence when found.
   *
   * @param optionId option id
   * @return first raw value, or empty
   */
  public Optional<String> firstValue(int optionId) {
    return find(optionId, 0)
        .filter(OptionOccurrence::found)
        .map(OptionOccurrence::values)
        .filter(values -> !values.isEmpty())
        .map(values -> values.get(0));
  }

  /**
   * Records one command-line occurrence.
   *
   * @param key decoded option spelling
   * @param value option value, or {@code null} when the spelling takes none
   * @throws OptionException when the occurrence conflicts with an earlier one for the same index
   */
  public void recordCommandLine(OptionKey key, String value) {
    OptionDefinition option = schema.option(key.optionId());
    OptionOccurrence occurrence = getOrCreate(key.optionId(), key.index());
    String name = option.indexName(key.index());

    if (!occurrence.found()) {
      occurrence.claim(OptionSource.PARAM, key.negate(), key.reset());
      if (value != null) {
        occurrence.addValue(value);
      }
      return;
    }

    if (occurrence.negate() && key.negate()) {
      throw invalid(name, "is negated multiple times");
    }
    if (occurrence.reset() && key.reset()) {
      throw invalid(name, "is reset multiple times");
    }
    if ((occurrence.reset() && key.negate()) || (occurrence.negate() && key.reset())) {
      throw invalid(name, "cannot be negated and reset");
    }
    if (occurrence.negate() != key.negate()) {
      throw invalid(name, "cannot be set and negated");
    }
    if (occurrence.reset() != key.reset()) {
      throw invalid(name, "cannot be set and reset");
    }
    if (value != null && option.multi()) {
      occurrence.addValue(value);
      return;
    }
    throw invalid(name, "cannot be set multiple times");
  }

  /**
   * Claims an unfound occurrence for the environment/file tier.
   *
   * @param optionId option id
   * @param index sparse index
   * @param negate whether a boolean was given as {@code n}
   * @param values raw values, empty for booleans
   * @return {@code true} when claimed, {@code false} when a higher tier already found it
   */
  boolean claimConfig(int optionId, int index, boolean negate, List<String> values) {
    OptionOccurrence occurrence = getOrCreate(optionId, index);
    if (occurrence.found()) {
      return false;
    }
    occurrence.claim(OptionSource.CONFIG, negate, false);
    occurrence.addValues(values);
    return true;
  }

  private static OptionException invalid(String name, String problem) {
    return OptionException.commandLine(ErrorKind.OPTION_INVALID, "option '" + name + "' " + problem);
  }
}
