package ca.gc.cra.stratum.domain.ini;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed INI document: ordered sections, each an ordered mapping of key to one or more values.
 *
 * <p>Lines are trimmed. Blank lines and lines starting with {@code #} are ignored, {@code [name]}
 * opens a section and {@code key=value} adds a value. A key repeated within a section (including
 * across concatenated files) accumulates into a list in order of appearance.</p>
 *
 * <p>Instances are immutable once {@link #parse(String)} returns.</p>
 *
 * @since 0.1.0
 */
public final class Ini {
  private final Map<String, Map<String, List<String>>> sections;

  private Ini(Map<String, Map<String, List<String>>> sections) {
    this.sections = sections;
  }

  /**
   * Parses INI text.
   *
   * @param text document text; {@code null} is treated as empty
   * @return parsed document
   * @throws IniFormatException when a line is neither a section header, a comment, nor a key/value
   */
  public static Ini parse(String text) {
    Map<String, Map<String, List<String>>> sections = new LinkedHashMap<>();
    if (text == null || text.isEmpty()) {
      return new Ini(sections);
    }

    Map<String, List<String>> current = null;
    String[] lines = text.split("\\r?\\n", -1);
    for (int i = 0; i < lines.length; i++) {
      int lineNo = i + 1;
      String line = lines[i].trim();
      if (line.isEmpty() || line.charAt(0) == '#') {
        continue;
      }

      if (line.charAt(0) == '[') {
        if (line.charAt(line.length() - 1) != ']') {
          throw new IniFormatException(lineNo, "ini section '" + line + "' should end with ]");
        }
        String name = line.substring(1, line.length() - 1).trim();
        if (name.isEmpty()) {
          throw new IniFormatException(lineNo, "ini section name must not be empty");
        }
        current = sections.computeIfAbsent(name, key -> new LinkedHashMap<>());
        continue;
      }

      int equals = line.indexOf('=');
      if (equals < 0) {
        throw new IniFormatException(lineNo, "missing '=' in key/value '" + line + "'");
      }
      if (current == null) {
        throw new IniFormatException(lineNo, "key/value found outside of section");
      }
      String key = line.substring(0, equals).trim();
      if (key.isEmpty()) {
        throw new IniFormatException(lineNo, "key is zero-length");
      }
      String value = line.substring(equals + 1).trim();
      current.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }
    return new Ini(sections);
  }

  /**
   * Returns the section names in order of first appearance.
   *
   * @return unmodifiable section names
   */
  public List<String> sectionNames() {
    return List.copyOf(sections.keySet());
  }

  /**
   * Returns the keys of {@code section} in order of first appearance.
   *
   * @param section section name
   * @return keys, empty when the section does not exist
   */
  public List<String> keys(String section) {
    Map<String, List<String>> keys = sections.get(section);
    return keys == null ? List.of() : List.copyOf(keys.keySet());
  }

  /**
   * Indicates whether {@code key} was given more than once in {@code section}.
   *
   * @param section section name
   * @param key key name
   * @return {@code true} when the key carries a value list
   */
  public boolean isList(String section, String key) {
    return values(section, key).size() > 1;
  }

  /**
   * Returns the single value of {@code key}; for list keys the first value.
   *
   * @param section section name
   * @param key key name
   * @return value, or {@code null} when absent
   */
  public String get(String section, String key) {
    List<String> values = values(section, key);
    return values.isEmpty() ? null : values.get(0);
  }

  /**
   * Returns every value given for {@code key}.
   *
   * @param section section name
   * @param key key name
   * @return unmodifiable values in order of appearance
   */
  public List<String> values(String section, String key) {
    Objects.requireNonNull(key, "key");
    Map<String, List<String>> keys = sections.get(section);
    if (keys == null) {
      return List.of();
    }
    List<String> values = keys.get(key);
    return values == null ? List.of() : Collections.unmodifiableList(values);
  }
}
