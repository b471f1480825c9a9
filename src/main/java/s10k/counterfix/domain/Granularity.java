package s10k.counterfix.domain;

import java.time.Duration;

/**
 * Enumeration of aggregate statistic periods.
 */
public enum Granularity {

	/** Five minute aggregates. */
	FiveMinute(Duration.ofMinutes(5), "5minute"),

	/** Hourly aggregates. */
	Hour(Duration.ofHours(1), "hour"),

	/** Daily aggregates. */
	Day(Duration.ofDays(1), "day"),

	;

	private final Duration period;
	private final String key;

	private Granularity(Duration period, String key) {
		this.period = period;
		this.key = key;
	}

	/**
	 * Get the length of one aggregate period.
	 * 
	 * @return the period
	 */
	public Duration period() {
		return period;
	}

	/**
	 * Get the key used to request this granularity from an aggregate store.
	 * 
	 * @return the key
	 */
	public String key() {
		return key;
	}

	/**
	 * Get an enum instance for a key value.
	 * 
	 * @param key the key, or enum name
	 * @return the enum
	 * @throws IllegalArgumentException if {@code key} is not supported
	 */
	public static Granularity forKey(String key) {
		for (Granularity g : values()) {
			if (g.key.equalsIgnoreCase(key) || g.name().equalsIgnoreCase(key)) {
				return g;
			}
		}
		throw new IllegalArgumentException("Unsupported granularity [" + key + "]");
	}

}
