package ca.gc.cra.stratum.domain.option;

/**
 * Inclusive numeric bounds for integer, float, and size options.
 *
 * @param min smallest accepted value
 * @param max largest accepted value
 * @since 0.1.0
 */
public record AllowRange(double min, double max) {
  public AllowRange {
    if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
      throw new IllegalArgumentException("invalid range [" + min + ", " + max + "]");
    }
  }

  /**
   * Tests whether {@code value} lies within the bounds.
   *
   * @param value candidate
   * @return {@code true} when {@code min <= value <= max}
   */
  public boolean contains(double value) {
    return value >= min && value <= max;
  }
}
