package s10k.counterfix.correction;

import java.time.Duration;
import java.time.ZoneId;

import s10k.counterfix.domain.Granularity;

/**
 * Tuning settings for reset correction.
 * 
 * @param granularity           the aggregate granularity to detect and correct
 *                              resets at
 * @param unit                  the unit of counter values
 * @param zone                  the time zone to use for groups that do not
 *                              specify one
 * @param commitDelay           the time to wait after submitting an adjustment
 *                              before querying again
 * @param maxIterations         the maximum number of correction iterations per
 *                              counter
 * @param estimateMissingEnergy {@code true} to add an estimate of the amount
 *                              accumulated during a reset gap
 */
public record CorrectionSettings(Granularity granularity, String unit, ZoneId zone, Duration commitDelay,
		int maxIterations, boolean estimateMissingEnergy) {

	/** The default unit. */
	public static final String DEFAULT_UNIT = "Wh";

	/** The default commit delay. */
	public static final Duration DEFAULT_COMMIT_DELAY = Duration.ofSeconds(1);

	/** The default maximum iterations per counter. */
	public static final int DEFAULT_MAX_ITERATIONS = 100;

	/**
	 * Constructor.
	 * 
	 * @throws IllegalArgumentException if {@code maxIterations} is less than 1
	 */
	public CorrectionSettings {
		if (maxIterations < 1) {
			throw new IllegalArgumentException("The maximum iterations must be at least 1.");
		}
		if (granularity == null) {
			granularity = Granularity.Hour;
		}
		if (unit == null || unit.isBlank()) {
			unit = DEFAULT_UNIT;
		}
		if (zone == null) {
			zone = ZoneId.systemDefault();
		}
		if (commitDelay == null) {
			commitDelay = DEFAULT_COMMIT_DELAY;
		}
	}

	/**
	 * Get the default settings.
	 * 
	 * @return the settings
	 */
	public static CorrectionSettings defaults() {
		return new CorrectionSettings(Granularity.Hour, DEFAULT_UNIT, ZoneId.systemDefault(), DEFAULT_COMMIT_DELAY,
				DEFAULT_MAX_ITERATIONS, true);
	}

	/**
	 * Get a copy with a different iteration limit.
	 * 
	 * @param max the maximum iterations
	 * @return the new settings
	 */
	public CorrectionSettings withMaxIterations(int max) {
		return new CorrectionSettings(granularity, unit, zone, commitDelay, max, estimateMissingEnergy);
	}

	/**
	 * Get a copy with missing energy estimation toggled.
	 * 
	 * @param enabled {@code true} to estimate missing energy
	 * @return the new settings
	 */
	public CorrectionSettings withEstimateMissingEnergy(boolean enabled) {
		return new CorrectionSettings(granularity, unit, zone, commitDelay, maxIterations, enabled);
	}

}
