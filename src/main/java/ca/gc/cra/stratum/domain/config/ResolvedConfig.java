package ca.gc.cra.stratum.domain.config;

import ca.gc.cra.stratum.domain.option.CommandRole;
import ca.gc.cra.stratum.domain.option.OptionSource;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable, validated configuration produced once per invocation.
 * <p><strong>Why:</strong> Downstream commands read typed values without knowing which source
 * supplied them.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * <p>Grouped options are addressed by dense index {@code 0..groupIndexTotal(group)-1}; the sparse
 * index a dense position came from is available through {@link #groupIndexKey(String, int)}.</p>
 *
 * @since 0.1.0
 */
public final class ResolvedConfig {
  private final String command;
  private final CommandRole role;
  private final boolean help;
  private final List<String> parameters;
  private final Map<String, List<Integer>> groupIndexes;
  private final Map<String, ResolvedOption> options;

  /**
   * Creates a configuration snapshot.
   *
   * @param command active command name
   * @param role command role
   * @param help whether help was requested for the command
   * @param parameters positional command parameters
   * @param groupIndexes per group, the used sparse indexes in ascending (dense) order
   * @param options resolved options keyed by canonical name, in schema order
   */
  public ResolvedConfig(
      String command,
      CommandRole role,
      boolean help,
      List<String> parameters,
      Map<String, List<Integer>> groupIndexes,
      Map<String, ResolvedOption> options) {
    this.command = Objects.requireNonNull(command, "command");
    this.role = role == null ? CommandRole.DEFAULT : role;
    this.help = help;
    this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
    Map<String, List<Integer>> groups = new LinkedHashMap<>();
    if (groupIndexes != null) {
      groupIndexes.forEach((group, indexes) -> groups.put(group, List.copyOf(indexes)));
    }
    this.groupIndexes = Collections.unmodifiableMap(groups);
    this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options == null ? Map.of() : options));
  }

  public String command() {
    return command;
  }

  public CommandRole role() {
    return role;
  }

  public boolean help() {
    return help;
  }

  public List<String> parameters() {
    return parameters;
  }

  /**
   * Returns every resolved option in schema order.
   *
   * @return unmodifiable map keyed by canonical option name
   */
  public Map<String, ResolvedOption> options() {
    return options;
  }

  public Optional<ResolvedOption> option(String name) {
    return Optional.ofNullable(options.get(name));
  }

  /**
   * Indicates whether {@code name} is valid for the active command.
   *
   * @param name canonical option name
   * @return {@code false} for unknown or invalid options
   */
  public boolean valid(String name) {
    ResolvedOption option = options.get(name);
    return option != null && option.valid();
  }

  /**
   * Returns the number of configured instances of a group.
   *
   * @param group group name
   * @return dense index total, 0 for unknown or unused groups
   */
  public int groupIndexTotal(String group) {
    List<Integer> indexes = groupIndexes.get(group);
    return indexes == null ? 0 : indexes.size();
  }

  /**
   * Returns the user-facing key (sparse index + 1) of a dense group position, e.g. {@code 3} for
   * the instance configured as {@code repo3-*}.
   *
   * @param group group name
   * @param denseIndex dense index
   * @return one-based key
   * @throws IndexOutOfBoundsException when the dense index is not configured
   */
  public int groupIndexKey(String group, int denseIndex) {
    List<Integer> indexes = groupIndexes.getOrDefault(group, List.of());
    return indexes.get(denseIndex) + 1;
  }

  public ResolvedValue resolved(String name) {
    return resolved(name, 0);
  }

  /**
   * Returns the resolved value of an option at a dense index.
   *
   * @param name canonical option name
   * @param index dense index
   * @return resolved value; {@link ResolvedValue#absent()} for unknown, invalid, or unset options
   */
  public ResolvedValue resolved(String name, int index) {
    ResolvedOption option = options.get(name);
    return option == null ? ResolvedValue.absent() : option.at(index);
  }

  public Optional<Object> value(String name) {
    return value(name, 0);
  }

  public Optional<Object> value(String name, int index) {
    return Optional.ofNullable(resolved(name, index).value());
  }

  public boolean test(String name) {
    return test(name, 0);
  }

  /**
   * Returns a boolean option, treating absent as {@code false}.
   *
   * @param name canonical option name
   * @param index dense index
   * @return option value
   * @throws ClassCastException when the option is not boolean
   */
  public boolean test(String name, int index) {
    Object value = resolved(name, index).value();
    return value != null && (Boolean) value;
  }

  public Optional<String> string(String name) {
    return string(name, 0);
  }

  public Optional<String> string(String name, int index) {
    return value(name, index).map(String.class::cast);
  }

  public Optional<Long> number(String name) {
    return number(name, 0);
  }

  public Optional<Long> number(String name, int index) {
    return value(name, index).map(Long.class::cast);
  }

  public Optional<Double> decimal(String name) {
    return value(name, 0).map(Double.class::cast);
  }

  public List<String> list(String name) {
    return value(name, 0)
        .map(v -> ((List<?>) v).stream().map(String::valueOf).toList())
        .orElse(List.of());
  }

  public Map<String, String> map(String name) {
    return value(name, 0).map(ResolvedConfig::copyStrings).orElse(Map.of());
  }

  private static Map<String, String> copyStrings(Object value) {
    Map<String, String> copy = new LinkedHashMap<>();
    ((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), String.valueOf(v)));
    return Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the tier that supplied an option value.
   *
   * @param name canonical option name
   * @param index dense index
   * @return source, or empty when the option is absent
   */
  public Optional<OptionSource> source(String name, int index) {
    return Optional.ofNullable(resolved(name, index).source());
  }

  public Optional<OptionSource> source(String name) {
    return source(name, 0);
  }

  @Override
  public String toString() {
    return "ResolvedConfig{command=" + command + ", role=" + role.label() + ", help=" + help
        + ", parameters=" + parameters + ", groups=" + groupIndexes + ", options=" + options.size() + "}";
  }
}
