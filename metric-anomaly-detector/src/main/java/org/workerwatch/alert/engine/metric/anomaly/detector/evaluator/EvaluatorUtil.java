package org.workerwatch.alert.engine.metric.anomaly.detector.evaluator;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

public class EvaluatorUtil {

  private EvaluatorUtil() {}

  static boolean isBreach(double observed, double limit) {
    return observed > limit;
  }

  /**
   * Ratio of current over baseline, or empty when the baseline is missing or its denominator is
   * not positive. A zero baseline never counts as an infinite spike.
   */
  static Optional<Double> ratio(double current, Double baselineDenominator) {
    if (baselineDenominator == null || !(baselineDenominator > 0)) {
      return Optional.empty();
    }
    return Optional.of(current / baselineDenominator);
  }

  /** Percentages and ratios, two decimals. */
  public static String formatPercent(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }

  /** Millisecond and count values, no decimals. */
  public static String formatMillis(double value) {
    return String.format(Locale.ROOT, "%.0f", value);
  }

  /** Configured limits in their shortest form, e.g. 5 or 2.5. */
  public static String formatLimit(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
