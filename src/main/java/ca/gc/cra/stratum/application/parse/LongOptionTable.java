package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.application.port.OptionSchema;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionGroupDefinition;
import ca.gc.cra.stratum.domain.option.OptionKey;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Every accepted option spelling mapped to the option, index, and modifier it denotes.
 *
 * <p>For each option the table holds the plain name, {@code no-<name>} when the option accepts
 * negation, and {@code reset-<name>} when it accepts reset. Grouped options are expanded per index
 * ({@code repo1-path} .. {@code repoN-path}); the unindexed spelling and any deprecated names map
 * to index 0 and are flagged deprecated. The same table classifies command-line tokens,
 * environment keys, and configuration file keys.</p>
 *
 * @since 0.1.0
 */
public final class LongOptionTable {
  private static final String NEGATE_PREFIX = "no-";
  private static final String RESET_PREFIX = "reset-";

  private final OptionSchema schema;
  private final Map<String, OptionKey> keys = new HashMap<>();

  /**
   * Builds the table for a schema.
   *
   * @param schema option schema
   * @throws IllegalArgumentException when two options claim the same spelling
   */
  public LongOptionTable(OptionSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
    for (OptionDefinition option : schema.options()) {
      if (option.grouped()) {
        OptionGroupDefinition group = schema.group(option.group())
            .orElseThrow(() -> new IllegalArgumentException(
                "option " + option.name() + " references unknown group " + option.group()));
        for (int index = 0; index < group.indexMax(); index++) {
          addSpellings(option, option.indexName(index), index, false);
        }
        addSpellings(option, option.name(), 0, true);
      } else {
        addSpellings(option, option.name(), 0, false);
      }
      for (String deprecated : option.deprecatedNames()) {
        addSpellings(option, deprecated, 0, true);
      }
    }
  }

  private void addSpellings(OptionDefinition option, String name, int index, boolean deprecated) {
    put(name, new OptionKey(option.id(), index, false, false, deprecated));
    if (option.acceptsNegate()) {
      put(NEGATE_PREFIX + name, new OptionKey(option.id(), index, true, false, deprecated));
    }
    if (option.acceptsReset()) {
      put(RESET_PREFIX + name, new OptionKey(option.id(), index, false, true, deprecated));
    }
  }

  private void put(String name, OptionKey key) {
    OptionKey previous = keys.putIfAbsent(name, key);
    if (previous != null) {
      throw new IllegalArgumentException("option name '" + name + "' is defined more than once");
    }
  }

  /**
   * Looks up a spelling.
   *
   * @param name option spelling without leading dashes
   * @return decoded key, or empty for unknown spellings
   */
  public Optional<OptionKey> find(String name) {
    return Optional.ofNullable(keys.get(name));
  }

  /**
   * Indicates whether a spelling consumes a value on the command line.
   *
   * @param key decoded spelling
   * @return {@code true} for the plain form of a non-boolean option
   */
  public boolean takesValue(OptionKey key) {
    return !key.modified() && schema.option(key.optionId()).takesValue();
  }

  /**
   * Returns the indexed name of the option a key addresses, e.g. {@code repo2-path}.
   *
   * @param key decoded spelling
   * @return indexed option name
   */
  public String indexName(OptionKey key) {
    return schema.option(key.optionId()).indexName(key.index());
  }
}
