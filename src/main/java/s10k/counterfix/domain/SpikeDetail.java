package s10k.counterfix.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * Report details for a single reset.
 * 
 * @param timestampUtc   the reset aggregate start date
 * @param timestampLocal the reset aggregate start date in the group time zone
 * @param currentValue   the sum after the reset
 * @param previousValue  the sum before the reset
 * @param delta          the change, {@code current - previous}
 */
public record SpikeDetail(Instant timestampUtc, OffsetDateTime timestampLocal, BigDecimal currentValue,
		BigDecimal previousValue, BigDecimal delta) {

	/**
	 * Create a detail from a reset event.
	 * 
	 * @param event the event
	 * @param zone  the local time zone
	 * @return the detail
	 */
	public static SpikeDetail of(ResetEvent event, ZoneId zone) {
		return new SpikeDetail(event.timestamp(), event.timestamp().atZone(zone).toOffsetDateTime(),
				event.currentSum(), event.previousSum(), event.delta());
	}

}
