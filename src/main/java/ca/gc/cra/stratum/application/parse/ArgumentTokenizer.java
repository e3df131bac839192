package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.domain.option.CommandDefinition;
import ca.gc.cra.stratum.domain.option.OptionKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Walks the raw argument vector and classifies each argument.
 *
 * <p>Options are {@code --name}, {@code --name=value}, or {@code --name value}; the value form is
 * required exactly when {@link LongOptionTable#takesValue(OptionKey)} says so. A bare {@code --}
 * ends option processing. The first non-option argument is the command; when that command is
 * {@code help} the next non-option argument is also a command (the one help is requested for).
 * All remaining non-option arguments are command parameters.</p>
 *
 * @since 0.1.0
 */
public final class ArgumentTokenizer {
  private static final String OPTION_PREFIX = "--";

  private final LongOptionTable table;

  public ArgumentTokenizer(LongOptionTable table) {
    this.table = Objects.requireNonNull(table, "table");
  }

  /**
   * Classifies arguments.
   *
   * @param args raw arguments, excluding the executable name
   * @return tokens in argument order
   * @throws OptionException for unknown options and missing or unexpected option values
   */
  public List<ArgumentToken> tokenize(List<String> args) {
    List<ArgumentToken> tokens = new ArrayList<>();
    if (args == null) {
      return tokens;
    }

    int commandSlots = 1;
    boolean optionsEnded = false;
    for (int i = 0; i < args.size(); i++) {
      String arg = Objects.requireNonNull(args.get(i), "argument " + i);

      if (!optionsEnded && arg.equals(OPTION_PREFIX)) {
        optionsEnded = true;
        continue;
      }

      if (optionsEnded || !isOption(arg)) {
        if (commandSlots > 0) {
          commandSlots--;
          tokens.add(ArgumentToken.command(arg));
          if (isHelp(arg)) {
            commandSlots++;
          }
        } else {
          tokens.add(ArgumentToken.parameter(arg));
        }
        continue;
      }

      if (!arg.startsWith(OPTION_PREFIX)) {
        throw OptionException.commandLine(ErrorKind.OPTION_INVALID, "invalid option '" + arg + "'");
      }
      String body = arg.substring(OPTION_PREFIX.length());
      int equals = body.indexOf('=');
      String name = equals < 0 ? body : body.substring(0, equals);
      String inlineValue = equals < 0 ? null : body.substring(equals + 1);

      OptionKey key = table.find(name)
          .orElseThrow(() -> OptionException.commandLine(ErrorKind.OPTION_INVALID, "invalid option '" + arg + "'"));

      if (!table.takesValue(key)) {
        if (inlineValue != null) {
          throw OptionException.commandLine(
              ErrorKind.OPTION_INVALID, "option '" + OPTION_PREFIX + name + "' does not allow an argument");
        }
        tokens.add(ArgumentToken.option(arg, key, null));
        continue;
      }

      String value = inlineValue;
      if (value == null) {
        if (i + 1 >= args.size()) {
          throw OptionException.commandLine(ErrorKind.OPTION_INVALID, "option '" + arg + "' requires argument");
        }
        value = args.get(++i);
      }
      tokens.add(ArgumentToken.option(arg, key, value));
    }
    return tokens;
  }

  private static boolean isOption(String arg) {
    return arg.length() > 1 && arg.charAt(0) == '-';
  }

  private static boolean isHelp(String arg) {
    return CommandDefinition.HELP.equals(arg);
  }
}
