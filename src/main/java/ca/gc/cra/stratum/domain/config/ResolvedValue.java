package ca.gc.cra.stratum.domain.config;

import ca.gc.cra.stratum.domain.option.OptionSource;

/**
 * Final value of one option at one dense index.
 *
 * @param value typed value ({@link Boolean}, {@link Long}, {@link Double}, {@link String},
 *     {@code List<String>}, {@code Map<String, String>}) or {@code null} when absent
 * @param source tier that supplied the value, or {@code null} when nothing did
 * @param negate whether the option was negated
 * @param reset whether the option was reset
 * @since 0.1.0
 */
public record ResolvedValue(Object value, OptionSource source, boolean negate, boolean reset) {
  private static final ResolvedValue ABSENT = new ResolvedValue(null, null, false, false);

  /**
   * Returns a value no source supplied.
   *
   * @return shared absent value
   */
  public static ResolvedValue absent() {
    return ABSENT;
  }

  public boolean present() {
    return value != null;
  }
}
