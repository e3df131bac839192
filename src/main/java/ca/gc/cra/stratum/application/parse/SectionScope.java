package ca.gc.cra.stratum.application.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One configuration section searched for option values.
 *
 * @param name section name as written between brackets
 * @param global whether the section is {@code global} or {@code global:<command>}
 * @param commandQualified whether the section name carries the command
 * @since 0.1.0
 */
public record SectionScope(String name, boolean global, boolean commandQualified) {
  /** Name of the section shared by every stanza. */
  public static final String GLOBAL = "global";

  public SectionScope {
    Objects.requireNonNull(name, "name");
  }

  /**
   * Builds the search list, most specific first: {@code <stanza>:<command>}, {@code <stanza>},
   * {@code global:<command>}, {@code global}. Stanza sections are omitted without a stanza.
   *
   * @param stanza stanza name, or {@code null}
   * @param command active command name
   * @return sections in search order
   */
  public static List<SectionScope> searchOrder(String stanza, String command) {
    List<SectionScope> sections = new ArrayList<>(4);
    if (stanza != null) {
      sections.add(new SectionScope(stanza + ":" + command, false, true));
      sections.add(new SectionScope(stanza, false, false));
    }
    sections.add(new SectionScope(GLOBAL + ":" + command, true, true));
    sections.add(new SectionScope(GLOBAL, true, false));
    return sections;
  }

  @Override
  public String toString() {
    return "[" + name + "]";
  }
}
