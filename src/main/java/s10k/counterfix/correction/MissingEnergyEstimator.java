package s10k.counterfix.correction;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;

import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.ResetEvent;

/**
 * Estimate the amount a counter accumulated while it was resetting.
 * 
 * <p>
 * The rate seen between the reset aggregate and the following aggregate is
 * assumed to also apply to the gap between the aggregate before the reset and
 * the reset aggregate. This is a heuristic: for sparse aggregates it can be
 * well off, so it can be disabled.
 * </p>
 */
public class MissingEnergyEstimator {

	private final boolean enabled;

	/**
	 * Constructor.
	 * 
	 * @param enabled {@code false} to always estimate zero
	 */
	public MissingEnergyEstimator(boolean enabled) {
		super();
		this.enabled = enabled;
	}

	/**
	 * Test if estimation is enabled.
	 * 
	 * @return {@code true} if enabled
	 */
	public boolean isEnabled() {
		return enabled;
	}

	/**
	 * Estimate the amount missing from a reset.
	 * 
	 * @param event the reset
	 * @param next  the aggregate following the reset aggregate, or {@code null}
	 * @return the estimate, never {@code null} or negative
	 */
	public BigDecimal estimate(ResetEvent event, AggregatePoint next) {
		if (!enabled || next == null || !next.isUsable() || next.sum().compareTo(event.currentSum()) <= 0) {
			return BigDecimal.ZERO;
		}
		long span = Duration.between(event.timestamp(), next.start()).toMillis();
		long gap = Duration.between(event.previousTimestamp(), event.timestamp()).toMillis();
		if (span <= 0 || gap <= 0) {
			return BigDecimal.ZERO;
		}
		// multiply before divide so evenly spaced aggregates stay exact
		return next.sum().subtract(event.currentSum()).multiply(BigDecimal.valueOf(gap))
				.divide(BigDecimal.valueOf(span), MathContext.DECIMAL64);
	}

	/**
	 * Get the hourly rate seen after a reset.
	 * 
	 * @param event the reset
	 * @param next  the aggregate following the reset aggregate, or {@code null}
	 * @return the rate per hour, or {@code null} if no rate can be derived
	 */
	public static BigDecimal hourlyRate(ResetEvent event, AggregatePoint next) {
		if (next == null || !next.isUsable()) {
			return null;
		}
		long span = Duration.between(event.timestamp(), next.start()).toMillis();
		if (span <= 0) {
			return null;
		}
		return next.sum().subtract(event.currentSum()).multiply(BigDecimal.valueOf(Duration.ofHours(1).toMillis()))
				.divide(BigDecimal.valueOf(span), MathContext.DECIMAL64);
	}

}
