package ca.gc.cra.stratum.domain.option;

import java.util.List;

/**
 * Per-command behavior of an option: whether it is required, its default literal, the values and
 * range it accepts, and what it depends on.
 *
 * @param required whether resolution fails when no source supplies a value and there is no default
 * @param defaultValue default literal, or {@code null}
 * @param allowList accepted values; empty means unrestricted
 * @param allowRange numeric bounds, or {@code null}
 * @param depend dependency, or {@code null}
 * @since 0.1.0
 */
public record OptionRule(
    boolean required,
    String defaultValue,
    List<String> allowList,
    AllowRange allowRange,
    OptionDependency depend) {

  /** Rule with no constraints and no default. */
  public static final OptionRule NONE = new OptionRule(false, null, List.of(), null, null);

  public OptionRule {
    allowList = allowList == null ? List.of() : List.copyOf(allowList);
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }

  public boolean hasAllowList() {
    return !allowList.isEmpty();
  }
}
