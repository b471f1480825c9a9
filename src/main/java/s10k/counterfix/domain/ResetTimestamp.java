package s10k.counterfix.domain;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * A reset date expressed in both UTC and local time.
 * 
 * @param utc   the date
 * @param local the date in the group time zone
 */
public record ResetTimestamp(Instant utc, OffsetDateTime local) {

	/**
	 * Create an instance.
	 * 
	 * @param ts   the date
	 * @param zone the local time zone
	 * @return the new instance
	 */
	public static ResetTimestamp of(Instant ts, ZoneId zone) {
		return new ResetTimestamp(ts, ts.atZone(zone).toOffsetDateTime());
	}

}
