package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.domain.option.AllowRange;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionRule;
import ca.gc.cra.stratum.validation.Numbers;
import ca.gc.cra.stratum.validation.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts raw option values into typed values and checks them against the option rule.
 *
 * @since 0.1.0
 */
final class ValueCoercion {
  private ValueCoercion() {}

  /**
   * Coerces the raw values of a non-boolean option.
   *
   * @param option option definition
   * @param name indexed option name used in diagnostics
   * @param rule rule for the active command
   * @param values raw values; at least one
   * @return typed value
   * @throws OptionException when a value cannot be coerced or is not allowed
   */
  static Object coerce(OptionDefinition option, String name, OptionRule rule, List<String> values) {
    switch (option.type()) {
      case HASH:
        return toMap(name, values);
      case LIST:
        return List.copyOf(values);
      case BOOLEAN:
        return parseBoolean(name, values.get(0));
      default:
        break;
    }

    String raw = values.get(0);
    Object typed;
    String comparable;
    switch (option.type()) {
      case INTEGER: {
        long value = parseNumber(name, raw, () -> Numbers.parseInteger(raw));
        checkRange(name, raw, rule.allowRange(), value);
        typed = value;
        comparable = raw;
        break;
      }
      case FLOAT: {
        double value = parseNumber(name, raw, () -> Numbers.parseDecimal(raw));
        checkRange(name, raw, rule.allowRange(), value);
        typed = value;
        comparable = raw;
        break;
      }
      case SIZE: {
        long value = parseNumber(name, raw, () -> Numbers.parseSize(raw));
        checkRange(name, raw, rule.allowRange(), value);
        typed = value;
        comparable = Long.toString(value);
        break;
      }
      case PATH: {
        try {
          comparable = Paths.requireOptionPath(name, raw);
        } catch (IllegalArgumentException ex) {
          throw new OptionException(ErrorKind.OPTION_INVALID_VALUE, ex.getMessage(), ex);
        }
        typed = comparable;
        break;
      }
      default:
        typed = raw;
        comparable = raw;
        break;
    }

    if (rule.hasAllowList() && !rule.allowList().contains(comparable)) {
      throw new OptionException(
          ErrorKind.OPTION_INVALID_VALUE, "'" + raw + "' is not allowed for '" + name + "' option");
    }
    return typed;
  }

  /**
   * Parses a boolean literal as written in schema defaults.
   *
   * @param name option name used in diagnostics
   * @param value literal such as {@code y}, {@code n}, {@code 1}, {@code 0}, {@code true}, {@code false}
   * @return parsed value
   */
  static Boolean parseBoolean(String name, String value) {
    return switch (value) {
      case "y", "1", "true" -> Boolean.TRUE;
      case "n", "0", "false" -> Boolean.FALSE;
      default -> throw new OptionException(
          ErrorKind.OPTION_INVALID_VALUE, "'" + value + "' is not valid for '" + name + "' option");
    };
  }

  private static Map<String, String> toMap(String name, List<String> values) {
    Map<String, String> map = new LinkedHashMap<>();
    for (String pair : values) {
      int equals = pair.indexOf('=');
      if (equals < 0) {
        throw new OptionException(
            ErrorKind.OPTION_INVALID, "key/value '" + pair + "' not valid for '" + name + "' option");
      }
      map.put(pair.substring(0, equals), pair.substring(equals + 1));
    }
    return Collections.unmodifiableMap(map);
  }

  private static <T extends Number> T parseNumber(String name, String raw, NumberParser<T> parser) {
    try {
      return parser.parse();
    } catch (IllegalArgumentException ex) {
      throw new OptionException(
          ErrorKind.OPTION_INVALID_VALUE, "'" + raw + "' is not valid for '" + name + "' option", ex);
    }
  }

  private static void checkRange(String name, String raw, AllowRange range, double value) {
    if (range != null && !range.contains(value)) {
      throw new OptionException(
          ErrorKind.OPTION_INVALID_VALUE, "'" + raw + "' is out of range for '" + name + "' option");
    }
  }

  @FunctionalInterface
  private interface NumberParser<T extends Number> {
    T parse();
  }
}
