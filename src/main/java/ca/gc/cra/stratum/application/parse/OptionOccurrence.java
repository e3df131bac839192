package ca.gc.cra.stratum.application.parse;

import ca.gc.cra.stratum.domain.option.OptionSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What the parse phases saw for one option at one sparse index. Mutable while a resolution pass
 * runs; owned by {@link OptionOccurrenceStore}.
 *
 * @since 0.1.0
 */
public final class OptionOccurrence {
  private boolean found;
  private boolean negate;
  private boolean reset;
  private OptionSource source;
  private final List<String> values = new ArrayList<>();

  OptionOccurrence() {}

  public boolean found() {
    return found;
  }

  public boolean negate() {
    return negate;
  }

  public boolean reset() {
    return reset;
  }

  /**
   * Returns the tier that claimed this occurrence.
   *
   * @return source, or {@code null} while not found
   */
  public OptionSource source() {
    return source;
  }

  /**
   * Returns the raw values in the order they were seen.
   *
   * @return unmodifiable view of the values
   */
  public List<String> values() {
    return Collections.unmodifiableList(values);
  }

  /**
   * Claims the occurrence for a source. Once found, an occurrence is never claimed again.
   *
   * @param source claiming tier
   * @param negate negate modifier
   * @param reset reset modifier
   * @throws IllegalStateException when the occurrence is already found
   */
  void claim(OptionSource source, boolean negate, boolean reset) {
    if (found) {
      throw new IllegalStateException("option occurrence already found from " + this.source);
    }
    this.found = true;
    this.source = source;
    this.negate = negate;
    this.reset = reset;
  }

  void addValue(String value) {
    values.add(value);
  }

  void addValues(List<String> more) {
    values.addAll(more);
  }
}
