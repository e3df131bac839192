package ca.gc.cra.stratum.infrastructure.schema;

import ca.gc.cra.stratum.domain.option.AllowRange;
import ca.gc.cra.stratum.domain.option.CommandDefinition;
import ca.gc.cra.stratum.domain.option.CommandRole;
import ca.gc.cra.stratum.domain.option.OptionDefinition;
import ca.gc.cra.stratum.domain.option.OptionDependency;
import ca.gc.cra.stratum.domain.option.OptionGroupDefinition;
import ca.gc.cra.stratum.domain.option.OptionRule;
import ca.gc.cra.stratum.domain.option.OptionSection;
import ca.gc.cra.stratum.domain.option.OptionType;
import ca.gc.cra.stratum.validation.Numbers;
import ca.gc.cra.stratum.validation.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a {@link DefinedOptionSchema} from a YAML document with top-level {@code groups},
 * {@code commands}, and {@code options} sequences.
 *
 * <p>An option's {@code commands} entry is either a list of command names sharing the option-level
 * rule or a mapping of command name to rule overrides; when absent the option is valid for every
 * command.</p>
 *
 * @since 0.1.0
 */
public final class YamlOptionSchemaLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlOptionSchemaLoader.class);
  private static final int MAX_GROUP_INDEX = 256;

  private YamlOptionSchemaLoader() {}

  /**
   * Loads a schema file.
   *
   * @param path YAML file
   * @return validated schema
   * @throws IOException when the file cannot be read
   * @throws SchemaException when the document is malformed
   */
  public static DefinedOptionSchema load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return load(reader);
    }
  }

  /**
   * Loads a schema bundled on the classpath.
   *
   * @param resource resource name relative to the class-path root
   * @return validated schema
   * @throws IOException when the resource is missing or unreadable
   * @throws SchemaException when the document is malformed
   */
  public static DefinedOptionSchema loadResource(String resource) throws IOException {
    ClassLoader loader = YamlOptionSchemaLoader.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("schema resource not found: " + resource);
      }
      return load(new InputStreamReader(in, StandardCharsets.UTF_8));
    }
  }

  /**
   * Loads a schema from a reader. The reader is not closed.
   *
   * @param reader YAML source
   * @return validated schema
   * @throws SchemaException when the document is malformed
   */
  public static DefinedOptionSchema load(Reader reader) {
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new SchemaException("Failed to parse option schema YAML", ex);
    }
    if (document == null) {
      throw new SchemaException("option schema is empty");
    }
    try {
      return build(asMap(document, "root"));
    } catch (SchemaException ex) {
      throw ex;
    } catch (IllegalArgumentException ex) {
      throw new SchemaException("Invalid option schema: " + ex.getMessage(), ex);
    }
  }

  private static DefinedOptionSchema build(Map<String, Object> root) {
    List<OptionGroupDefinition> groups = new ArrayList<>();
    for (Object node : asList(root.get("groups"), "groups")) {
      groups.add(group(asMap(node, "group")));
    }
    List<CommandDefinition> commands = new ArrayList<>();
    for (Object node : asList(root.get("commands"), "commands")) {
      commands.add(command(asMap(node, "command")));
    }
    List<String> commandNames = commands.stream().map(CommandDefinition::name).toList();

    List<OptionDefinition> options = new ArrayList<>();
    for (Object node : asList(root.get("options"), "options")) {
      options.add(option(options.size(), asMap(node, "option"), commandNames));
    }

    DefinedOptionSchema schema = new DefinedOptionSchema(commands, groups, options);
    log.debug("Loaded option schema: {} commands, {} groups, {} options",
        commands.size(), groups.size(), options.size());
    return schema;
  }

  private static OptionGroupDefinition group(Map<String, Object> node) {
    String name = requiredString(node, "name", "group");
    long indexMax = Numbers.requireRange(
        "group " + name + " indexMax", longValue(node.getOrDefault("indexMax", 1), "indexMax"), 1, MAX_GROUP_INDEX);
    return new OptionGroupDefinition(name, (int) indexMax);
  }

  private static CommandDefinition command(Map<String, Object> node) {
    String name = requiredString(node, "name", "command");
    boolean parameterAllowed = bool(node.get("parameterAllowed"), false);
    Set<CommandRole> roles = new LinkedHashSet<>();
    roles.add(CommandRole.DEFAULT);
    for (Object role : asList(node.get("roles"), "command " + name + " roles")) {
      roles.add(CommandRole.find(String.valueOf(role))
          .orElseThrow(() -> new SchemaException("command " + name + " has unknown role '" + role + "'")));
    }
    return new CommandDefinition(name, parameterAllowed, roles);
  }

  private static OptionDefinition option(int id, Map<String, Object> node, List<String> commandNames) {
    String name = requiredString(node, "name", "option");
    String context = "option " + name;
    OptionType type;
    OptionSection section;
    try {
      type = OptionType.fromSchema(string(node.get("type"), "string"));
      section = OptionSection.fromSchema(string(node.get("section"), null));
    } catch (IllegalArgumentException ex) {
      throw new SchemaException(context + ": " + ex.getMessage(), ex);
    }

    OptionRule base = rule(node, null, type, context);
    Map<String, OptionRule> rules = new LinkedHashMap<>();
    Object commands = node.get("commands");
    if (commands == null) {
      commandNames.forEach(command -> rules.put(command, base));
    } else if (commands instanceof Map<?, ?>) {
      for (Map.Entry<String, Object> entry : asMap(commands, context + " commands").entrySet()) {
        Map<String, Object> override = entry.getValue() == null
            ? Map.of()
            : asMap(entry.getValue(), context + " command " + entry.getKey());
        rules.put(entry.getKey(), rule(override, base, type, context + " command " + entry.getKey()));
      }
    } else {
      for (Object command : asList(commands, context + " commands")) {
        rules.put(String.valueOf(command), base);
      }
    }

    List<String> deprecatedNames = new ArrayList<>();
    for (Object alias : asList(node.get("deprecatedNames"), context + " deprecatedNames")) {
      deprecatedNames.add(String.valueOf(alias));
    }

    return new OptionDefinition(
        id,
        name,
        type,
        section,
        string(node.get("group"), null),
        bool(node.get("multi"), false),
        bool(node.get("secure"), false),
        bool(node.get("negatable"), false),
        deprecatedNames,
        rules);
  }

  private static OptionRule rule(Map<String, Object> node, OptionRule base, OptionType type, String context) {
    boolean required = node.containsKey("required")
        ? bool(node.get("required"), false)
        : base != null && base.required();
    String defaultValue = node.containsKey("default")
        ? literal(node.get("default"), type)
        : base == null ? null : base.defaultValue();

    List<String> allowList = base == null ? List.of() : base.allowList();
    if (node.containsKey("allowList")) {
      List<String> values = new ArrayList<>();
      for (Object value : asList(node.get("allowList"), context + " allowList")) {
        values.add(literal(value, type));
      }
      allowList = values;
    }

    AllowRange allowRange = base == null ? null : base.allowRange();
    if (node.containsKey("allowRange")) {
      List<Object> bounds = asList(node.get("allowRange"), context + " allowRange");
      if (bounds.size() != 2) {
        throw new SchemaException(context + " allowRange must be [min, max]");
      }
      try {
        allowRange = new AllowRange(decimal(bounds.get(0), context), decimal(bounds.get(1), context));
      } catch (IllegalArgumentException ex) {
        throw new SchemaException(context + ": " + ex.getMessage(), ex);
      }
    }

    OptionDependency depend = base == null ? null : base.depend();
    if (node.containsKey("depend")) {
      Object raw = node.get("depend");
      if (raw == null) {
        depend = null;
      } else {
        Map<String, Object> map = asMap(raw, context + " depend");
        List<String> values = new ArrayList<>();
        for (Object value : asList(map.get("values"), context + " depend values")) {
          values.add(value instanceof Boolean flag ? booleanLiteral(flag) : String.valueOf(value));
        }
        depend = new OptionDependency(requiredString(map, "option", context + " depend"), values);
      }
    }
    return new OptionRule(required, defaultValue, allowList, allowRange, depend);
  }

  private static String literal(Object value, OptionType type) {
    if (value == null) {
      return null;
    }
    if (value instanceof Boolean flag) {
      return type == OptionType.BOOLEAN ? booleanLiteral(flag) : flag.toString();
    }
    return value.toString();
  }

  private static String booleanLiteral(boolean flag) {
    return flag ? OptionDependency.TRUE : OptionDependency.FALSE;
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new SchemaException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new SchemaException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static List<Object> asList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof List<?> raw)) {
      throw new SchemaException(context + " must be a sequence");
    }
    return new ArrayList<>(raw);
  }

  private static String requiredString(Map<String, Object> node, String key, String context) {
    Object value = node.get(key);
    if (value == null) {
      throw new SchemaException(context + " requires '" + key + "'");
    }
    try {
      return Strings.requireNonBlank(context + " " + key, value.toString());
    } catch (IllegalArgumentException ex) {
      throw new SchemaException(ex.getMessage(), ex);
    }
  }

  private static String string(Object value, String fallback) {
    return value == null ? fallback : value.toString().trim();
  }

  private static boolean bool(Object value, boolean fallback) {
    if (value == null) {
      return fallback;
    }
    if (value instanceof Boolean flag) {
      return flag;
    }
    throw new SchemaException("expected a boolean but found '" + value + "'");
  }

  private static long longValue(Object value, String context) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    throw new SchemaException(context + " must be an integer but was '" + value + "'");
  }

  private static double decimal(Object value, String context) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    throw new SchemaException(context + " allowRange bound must be numeric but was '" + value + "'");
  }
}
