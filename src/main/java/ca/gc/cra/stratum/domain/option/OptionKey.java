package ca.gc.cra.stratum.domain.option;

/**
 * One spelling of an option: which option and index it addresses and which modifier it carries.
 *
 * @param optionId option identifier
 * @param index zero-based sparse index; always 0 for ungrouped options
 * @param negate spelled with the {@code no-} prefix
 * @param reset spelled with the {@code reset-} prefix
 * @param deprecated spelled with a deprecated name
 * @since 0.1.0
 */
public record OptionKey(int optionId, int index, boolean negate, boolean reset, boolean deprecated) {
  public OptionKey {
    if (negate && reset) {
      throw new IllegalArgumentException("option key cannot be both negate and reset");
    }
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0 (was " + index + ")");
    }
  }

  /**
   * Indicates whether the spelling carries a command-line-only modifier.
   *
   * @return {@code true} for negate and reset spellings
   */
  public boolean modified() {
    return negate || reset;
  }
}
