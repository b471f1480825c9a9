package s10k.counterfix.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A decrease between two consecutive aggregates of a cumulative counter.
 * 
 * @param timestamp         the start date of the aggregate where the decrease
 *                          was observed
 * @param previousTimestamp the start date of the aggregate before the decrease
 * @param previousSum       the sum before the decrease
 * @param currentSum        the sum after the decrease
 */
public record ResetEvent(Instant timestamp, Instant previousTimestamp, BigDecimal previousSum,
		BigDecimal currentSum) {

	/**
	 * Constructor.
	 * 
	 * @throws IllegalArgumentException if the sums do not describe a decrease
	 *                                  between two positive values
	 */
	public ResetEvent {
		if (previousSum == null || currentSum == null || currentSum.signum() <= 0
				|| currentSum.compareTo(previousSum) >= 0) {
			throw new IllegalArgumentException(
					"Reset requires 0 < current < previous, got %s -> %s".formatted(previousSum, currentSum));
		}
	}

	/**
	 * Get the observed change, {@code current - previous}.
	 * 
	 * @return the (negative) delta
	 */
	public BigDecimal delta() {
		return currentSum.subtract(previousSum);
	}

	/**
	 * Get the amount that brings the current sum back up to the previous sum.
	 * 
	 * @return the (positive) discontinuity amount
	 */
	public BigDecimal discontinuity() {
		return previousSum.subtract(currentSum);
	}

}
