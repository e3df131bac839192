package ca.gc.cra.stratum.domain.option;

import java.util.List;
import java.util.Objects;

/**
 * Declares that an option only resolves when another option has a value, optionally one of
 * {@code values}. Boolean dependencies compare against {@code "1"} (true) and {@code "0"} (false).
 *
 * @param option name of the option depended upon
 * @param values accepted values; empty means any value
 * @since 0.1.0
 */
public record OptionDependency(String option, List<String> values) {
  /** Sentinel compared against a boolean dependency that resolved to {@code true}. */
  public static final String TRUE = "1";
  /** Sentinel compared against a boolean dependency that resolved to {@code false}. */
  public static final String FALSE = "0";

  public OptionDependency {
    Objects.requireNonNull(option, "option");
    values = values == null ? List.of() : List.copyOf(values);
  }

  /**
   * Indicates whether only specific values of the dependency satisfy it.
   *
   * @return {@code true} when a value subset is declared
   */
  public boolean restricted() {
    return !values.isEmpty();
  }

  /**
   * Tests a resolved dependency value against the declared subset.
   *
   * @param value comparison form of the dependency value
   * @return {@code true} when unrestricted or {@code value} is in the subset
   */
  public boolean accepts(String value) {
    return !restricted() || values.contains(value);
  }
}
