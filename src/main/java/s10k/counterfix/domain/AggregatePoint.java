package s10k.counterfix.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single periodic aggregate of a cumulative counter.
 * 
 * @param start the aggregate period start date
 * @param sum   the cumulative sum at the end of the period, or {@code null} if
 *              no data is available
 */
public record AggregatePoint(Instant start, BigDecimal sum) implements Comparable<AggregatePoint> {

	/**
	 * Create a new point.
	 * 
	 * @param start the start date
	 * @param sum   the sum, or {@code null}
	 * @return the new point
	 */
	public static AggregatePoint point(Instant start, Number sum) {
		if (sum == null) {
			return new AggregatePoint(start, null);
		}
		return new AggregatePoint(start, (sum instanceof BigDecimal d ? d : new BigDecimal(sum.toString())));
	}

	@Override
	public int compareTo(AggregatePoint o) {
		return start.compareTo(o.start);
	}

	/**
	 * Test if a sum is available.
	 * 
	 * @return {@code true} if {@code sum} is not {@code null}
	 */
	public boolean hasSum() {
		return sum != null;
	}

	/**
	 * Test if the sum can take part in a delta comparison.
	 * 
	 * <p>
	 * A missing or zero sum means the counter had no data yet.
	 * </p>
	 * 
	 * @return {@code true} if the sum is present and greater than zero
	 */
	public boolean isUsable() {
		return sum != null && sum.signum() > 0;
	}

	/**
	 * Test if the sum is negative, which a cumulative counter can never be.
	 * 
	 * @return {@code true} if the sum is present and less than zero
	 */
	public boolean isCorrupted() {
		return sum != null && sum.signum() < 0;
	}

	/**
	 * Get a copy of this point with an amount added to the sum.
	 * 
	 * @param amount the amount to add
	 * @return the new point, or this point if no sum is available
	 */
	public AggregatePoint plus(BigDecimal amount) {
		if (sum == null || amount == null) {
			return this;
		}
		return new AggregatePoint(start, sum.add(amount));
	}

}
