package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.application.port.OptionSchema;
import ca.gc.cra.stratum.domain.config.ResolvedOption;
import ca.gc.cra.stratum.domain.config.ResolvedValue;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionDependency;
import ca.gc.cra.stratum.domain.option.OptionRule;
import ca.gc.cra.stratum.domain.option.OptionSection;
import ca.gc.cra.stratum.domain.option.OptionSource;
import ca.gc.cra.stratum.domain.option.OptionType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Final phase producing typed values from the occurrence store.
 * <p><strong>How:</strong> Options are visited in {@link OptionSchema#resolveOrder()} so a dependency
 * always resolves before its dependents. Per dense index an option is:</p>
 * <ul>
 *   <li>left unset when its dependency has no value or a value outside the declared subset. That is
 *   a hard error only when the option itself came from the command line; values from files or the
 *   environment may legitimately target another command.</li>
 *   <li>coerced and validated when set (found, not reset, and not negated unless boolean).</li>
 *   <li>cleared when reset, without falling back to the default.</li>
 *   <li>otherwise given its default, or rejected when required and not a help request.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class OptionValueResolver {
  private static final String STANZA_HINT = "\nHINT: does this stanza exist?";

  private OptionValueResolver() {}

  /**
   * Resolves every option.
   *
   * @param context parse context after group compaction
   * @return resolved options keyed by canonical name, in schema order
   * @throws OptionException for invalid values, unresolved command-line dependencies, and missing
   *     required options
   */
  public static Map<String, ResolvedOption> resolve(ParseContext context) {
    OptionSchema schema = context.schema();
    for (OptionDefinition option : schema.options()) {
      if (!context.valid(option) && context.store().setOnCommandLine(option.id())) {
        throw OptionException.commandLine(
            ErrorKind.OPTION_INVALID,
            "option '" + option.name() + "' not valid for command '" + context.commandName() + "'");
      }
    }

    Map<Integer, List<ResolvedValue>> resolved = new HashMap<>();
    for (int optionId : schema.resolveOrder()) {
      OptionDefinition option = schema.option(optionId);
      if (!context.valid(option)) {
        continue;
      }
      List<Integer> sparseIndexes = option.grouped()
          ? context.groupIndexes().getOrDefault(option.group(), List.of())
          : List.of(0);
      List<ResolvedValue> values = new ArrayList<>(sparseIndexes.size());
      for (int dense = 0; dense < sparseIndexes.size(); dense++) {
        values.add(resolveIndex(context, resolved, option, dense, sparseIndexes.get(dense)));
      }
      resolved.put(optionId, values);
    }

    Map<String, ResolvedOption> result = new LinkedHashMap<>();
    for (OptionDefinition option : schema.options()) {
      List<ResolvedValue> values = resolved.get(option.id());
      result.put(option.name(), new ResolvedOption(option, values != null, values));
    }
    return result;
  }

  private static ResolvedValue resolveIndex(
      ParseContext context,
      Map<Integer, List<ResolvedValue>> resolved,
      OptionDefinition option,
      int dense,
      int sparse) {
    OptionOccurrence occurrence = context.store().find(option.id(), sparse)
        .filter(OptionOccurrence::found)
        .orElse(null);
    boolean negate = occurrence != null && occurrence.negate();
    boolean reset = occurrence != null && occurrence.reset();
    OptionSource source = occurrence == null ? null : occurrence.source();
    boolean set = occurrence != null && (option.type() == OptionType.BOOLEAN || !negate) && !reset;
    boolean fromCommandLine = set && source == OptionSource.PARAM;

    String name = option.indexName(sparse);
    OptionRule rule = option.rule(context.commandName());

    OptionDependency depend = rule.depend();
    if (depend != null) {
      OptionDefinition dependOption = context.schema().option(depend.option())
          .orElseThrow(() -> new IllegalStateException(
              "option " + option.name() + " depends on unknown option " + depend.option()));
      boolean sameGroup = dependOption.grouped() && dependOption.group().equals(option.group());
      String dependValue = dependValue(resolved, dependOption, sameGroup ? dense : 0);

      if (dependValue == null || !depend.accepts(dependValue)) {
        if (fromCommandLine) {
          String dependName = sameGroup ? dependOption.indexName(sparse) : dependOption.name();
          throw OptionException.commandLine(
              ErrorKind.OPTION_INVALID, unresolvedMessage(name, dependOption, dependName, depend, dependValue));
        }
        return new ResolvedValue(null, null, negate, reset);
      }
    }

    if (set) {
      Object value = option.type() == OptionType.BOOLEAN
          ? Boolean.valueOf(!negate)
          : ValueCoercion.coerce(option, name, rule, occurrence.values());
      return new ResolvedValue(value, source, negate, reset);
    }
    if (reset || negate) {
      return new ResolvedValue(null, source, negate, reset);
    }
    if (rule.hasDefault()) {
      return new ResolvedValue(
          ValueCoercion.coerce(option, name, rule, List.of(rule.defaultValue())), OptionSource.DEFAULT, false, false);
    }
    if (rule.required() && !context.help()) {
      String hint = option.section() == OptionSection.STANZA ? STANZA_HINT : "";
      throw new OptionException(
          ErrorKind.OPTION_REQUIRED, context.commandName() + " command requires option: " + name + hint);
    }
    return ResolvedValue.absent();
  }

  private static String dependValue(
      Map<Integer, List<ResolvedValue>> resolved, OptionDefinition dependOption, int dense) {
    List<ResolvedValue> values = resolved.get(dependOption.id());
    if (values == null || dense >= values.size()) {
      return null;
    }
    Object value = values.get(dense).value();
    if (value == null) {
      return null;
    }
    if (value instanceof Boolean bool) {
      return bool ? OptionDependency.TRUE : OptionDependency.FALSE;
    }
    return String.valueOf(value);
  }

  private static String unresolvedMessage(
      String name, OptionDefinition dependOption, String dependName, OptionDependency depend, String dependValue) {
    String displayName = dependName;
    String values = "";
    if (dependValue != null && depend.restricted()) {
      if (dependOption.type() == OptionType.BOOLEAN) {
        if (depend.values().contains(OptionDependency.FALSE)) {
          displayName = "no-" + dependName;
        }
      } else if (depend.values().size() == 1) {
        values = " = '" + depend.values().get(0) + "'";
      } else {
        values = " in (" + depend.values().stream()
            .map(value -> "'" + value + "'")
            .collect(Collectors.joining(", ")) + ")";
      }
    }
    return "option '" + name + "' not valid without option '" + displayName + "'" + values;
  }
}
