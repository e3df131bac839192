package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.domain.ini.Ini;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionKey;
import ca.gc.cra.stratum.domain.option.OptionSection;
import ca.gc.cra.stratum.domain.option.OptionType;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Claims option occurrences from the merged configuration file, section by section.
 *
 * <p>Sections are searched most specific first (see {@link SectionScope#searchOrder}); the first
 * section supplying an option index wins and anything found earlier on the command line or in the
 * environment is never replaced.</p>
 *
 * @since 0.1.0
 */
public final class SectionResolver {
  private static final Logger log = LoggerFactory.getLogger(SectionResolver.class);

  private SectionResolver() {}

  /**
   * Applies configuration file values.
   *
   * @param context parse context after the environment phase
   * @param ini merged configuration
   * @throws OptionException for duplicate spellings, empty values, invalid booleans, and lists given
   *     for single-valued options
   */
  public static void apply(ParseContext context, Ini ini) {
    String stanza = context.option(OptionNames.STANZA)
        .flatMap(option -> context.store().firstValue(option.id()))
        .orElse(null);

    for (SectionScope section : SectionScope.searchOrder(stanza, context.commandName())) {
      Map<OptionKey, String> claimedInSection = new HashMap<>();
      for (String key : ini.keys(section.name())) {
        applyKey(context, ini, section, key, claimedInSection);
      }
    }
  }

  private static void applyKey(
      ParseContext context, Ini ini, SectionScope section, String key, Map<OptionKey, String> claimedInSection) {
    OptionKey optionKey = context.table().find(key).orElse(null);
    if (optionKey == null) {
      context.warn("configuration file contains invalid option '" + key + "'");
      return;
    }
    if (optionKey.negate()) {
      context.warn("configuration file contains negate option '" + key + "'");
      return;
    }
    if (optionKey.reset()) {
      context.warn("configuration file contains reset option '" + key + "'");
      return;
    }

    OptionDefinition option = context.schema().option(optionKey.optionId());
    if (option.section() == OptionSection.COMMAND_LINE) {
      context.warn("configuration file contains command-line only option '" + key + "'");
      return;
    }

    OptionKey slot = new OptionKey(optionKey.optionId(), optionKey.index(), false, false, false);
    String previous = claimedInSection.putIfAbsent(slot, key);
    if (previous != null) {
      throw new OptionException(
          ErrorKind.OPTION_INVALID,
          "configuration file contains duplicate options ('" + key + "', '" + previous + "') in section '"
              + section + "'");
    }

    if (!context.valid(option)) {
      if (section.commandQualified()) {
        context.warn("configuration file contains option '" + key + "' invalid for section '" + section + "'");
      }
      return;
    }

    if (option.section() == OptionSection.STANZA && section.global()) {
      context.warn(
          "configuration file contains stanza-only option '" + key + "' in global section '" + section + "'");
      return;
    }

    if (context.store().found(optionKey.optionId(), optionKey.index())) {
      log.debug("Option {} in section {} ignored; already resolved", key, section);
      return;
    }

    if (ini.isList(section.name(), key)) {
      if (!option.multi()) {
        throw new OptionException(
            ErrorKind.OPTION_INVALID,
            "option '" + option.indexName(optionKey.index()) + "' cannot be set multiple times");
      }
      context.store().claimConfig(
          optionKey.optionId(), optionKey.index(), false, ini.values(section.name(), key));
      return;
    }

    String value = ini.get(section.name(), key);
    if (value == null || value.isEmpty()) {
      throw new OptionException(
          ErrorKind.OPTION_INVALID_VALUE, "section '" + section + "', key '" + key + "' must have a value");
    }

    if (option.type() == OptionType.BOOLEAN) {
      if (value.equals("n")) {
        context.store().claimConfig(optionKey.optionId(), optionKey.index(), true, List.of());
      } else if (value.equals("y")) {
        context.store().claimConfig(optionKey.optionId(), optionKey.index(), false, List.of());
      } else {
        throw new OptionException(
            ErrorKind.OPTION_INVALID_VALUE, "boolean option '" + key + "' must be 'y' or 'n'");
      }
      return;
    }
    context.store().claimConfig(optionKey.optionId(), optionKey.index(), false, List.of(value));
  }
}
