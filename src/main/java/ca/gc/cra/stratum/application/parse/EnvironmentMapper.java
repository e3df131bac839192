package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionKey;
import ca.gc.cra.stratum.domain.option.OptionType;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code STRATUM_*} environment variables to the occurrence store.
 *
 * <p>The key after the prefix is lower-cased and {@code _} becomes {@code -}, so
 * {@code STRATUM_REPO1_PATH} addresses {@code repo1-path}. Entries are processed in key order.
 * Options already set on the command line are left untouched.</p>
 *
 * @since 0.1.0
 */
public final class EnvironmentMapper {
  /** Prefix identifying variables that carry option values. */
  public static final String PREFIX = "STRATUM_";

  private static final Logger log = LoggerFactory.getLogger(EnvironmentMapper.class);
  private static final String LIST_SEPARATOR = ":";

  private EnvironmentMapper() {}

  /**
   * Maps environment variables onto options valid for the active command.
   *
   * @param context active parse context
   * @param environment process environment
   * @throws OptionException for empty values and booleans other than {@code y}/{@code n}
   */
  public static void apply(ParseContext context, Map<String, String> environment) {
    if (environment == null || environment.isEmpty()) {
      return;
    }
    for (Map.Entry<String, String> entry : new TreeMap<>(environment).entrySet()) {
      String variable = entry.getKey();
      if (variable == null || !variable.startsWith(PREFIX)) {
        continue;
      }
      String key = variable.substring(PREFIX.length()).toLowerCase(Locale.ROOT).replace('_', '-');
      String value = entry.getValue() == null ? "" : entry.getValue();

      OptionKey optionKey = context.table().find(key).orElse(null);
      if (optionKey == null) {
        context.warn("environment contains invalid option '" + key + "'");
        continue;
      }
      if (optionKey.negate()) {
        context.warn("environment contains invalid negate option '" + key + "'");
        continue;
      }
      if (optionKey.reset()) {
        context.warn("environment contains invalid reset option '" + key + "'");
        continue;
      }

      OptionDefinition option = context.schema().option(optionKey.optionId());
      if (!context.valid(option)) {
        continue;
      }
      if (value.isEmpty()) {
        throw new OptionException(
            ErrorKind.OPTION_INVALID_VALUE, "environment variable '" + key + "' must have a value");
      }
      if (context.store().found(optionKey.optionId(), optionKey.index())) {
        log.debug("Environment variable {} ignored; option set on command line", variable);
        continue;
      }

      boolean negate = false;
      List<String> values;
      if (option.type() == OptionType.BOOLEAN) {
        if (value.equals("n")) {
          negate = true;
        } else if (!value.equals("y")) {
          throw new OptionException(
              ErrorKind.OPTION_INVALID_VALUE, "environment boolean option '" + key + "' must be 'y' or 'n'");
        }
        values = List.of();
      } else if (option.type().multiValued()) {
        values = List.of(value.split(LIST_SEPARATOR, -1));
      } else {
        values = List.of(value);
      }
      context.store().claimConfig(optionKey.optionId(), optionKey.index(), negate, values);
    }
  }
}
