package s10k.counterfix.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An additive correction submitted to an aggregate store.
 * 
 * <p>
 * The store applies the adjustment to the aggregate starting at
 * {@code timestamp} and every later aggregate of the same counter.
 * </p>
 * 
 * @param counterId  the counter ID
 * @param timestamp  the anchor aggregate start date
 * @param adjustment the signed amount added
 * @param unit       the unit of {@code adjustment}
 */
public record AdjustmentRecord(String counterId, Instant timestamp, BigDecimal adjustment, String unit) {

	/**
	 * Get the record that exactly undoes this one.
	 * 
	 * @return the reversed record
	 */
	public AdjustmentRecord reversed() {
		return new AdjustmentRecord(counterId, timestamp, adjustment.negate(), unit);
	}

}
