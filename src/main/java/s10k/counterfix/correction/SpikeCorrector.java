package s10k.counterfix.correction;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threeten.extra.Interval;

import s10k.counterfix.domain.AdjustmentRecord;
import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.CounterCorrection;
import s10k.counterfix.domain.ResetEvent;
import s10k.counterfix.domain.ResetScan;
import s10k.counterfix.store.AggregateStore;
import s10k.counterfix.store.AggregateStoreException;
import s10k.counterfix.support.Pause;

/**
 * Remove resets from one counter by submitting additive adjustments until the
 * counter no longer decreases.
 * 
 * <p>
 * Each iteration re-queries the store and corrects only the earliest reset not
 * already handled in the current run. Because the store may apply adjustments
 * asynchronously, the start dates of handled resets are remembered so the same
 * reset is not corrected twice before its adjustment becomes visible, and the
 * corrector pauses after each adjustment before querying again. The number of
 * iterations is capped; when the cap is hit one more query checks whether any
 * reset is left before the cap is reported.
 * </p>
 */
public class SpikeCorrector {

	private static final Logger log = LoggerFactory.getLogger(SpikeCorrector.class);

	private final AggregateStore store;
	private final CorrectionSettings settings;
	private final MissingEnergyEstimator estimator;
	private final Pause pause;

	/**
	 * Constructor.
	 * 
	 * @param store    the store
	 * @param settings the settings
	 * @param pause    the pause to wait for adjustments to be committed with
	 */
	public SpikeCorrector(AggregateStore store, CorrectionSettings settings, Pause pause) {
		super();
		this.store = store;
		this.settings = settings;
		this.estimator = new MissingEnergyEstimator(settings.estimateMissingEnergy());
		this.pause = pause;
	}

	/**
	 * Find the resets of a counter without changing anything.
	 * 
	 * @param counterId the counter ID
	 * @param range     the time range to scan
	 * @return the scan results
	 * @throws AggregateStoreException if the query fails
	 */
	public ResetScan preview(String counterId, Interval range) {
		return ResetDetector.scan(store.query(counterId, range, settings.granularity()));
	}

	/**
	 * Correct all resets of a counter within a time range.
	 * 
	 * <p>
	 * Store failures do not propagate: a failed query ends the correction of the
	 * counter, while a failed adjustment is recorded and the search moves on to
	 * the next reset.
	 * </p>
	 * 
	 * @param counterId the counter ID
	 * @param range     the time range to correct
	 * @return the outcome
	 */
	public CounterCorrection correct(String counterId, Interval range) {
		final Set<Instant> handled = new HashSet<>(8);
		final List<AdjustmentRecord> ledger = new ArrayList<>(4);
		final List<String> errors = new ArrayList<>(0);
		final int maxIterations = settings.maxIterations();
		int iterations = 0;
		boolean stopped = false;
		boolean finished = false;

		while (iterations < maxIterations) {
			iterations++;
			final List<AggregatePoint> points;
			try {
				points = store.query(counterId, range, settings.granularity());
			} catch (AggregateStoreException e) {
				log.error("Failed to query statistics for {}: {}", counterId, e.getMessage());
				errors.add("Failed to query statistics for %s: %s".formatted(counterId, e.getMessage()));
				stopped = true;
				break;
			}

			final ResetEvent event = firstUnhandled(ResetDetector.detect(points), handled);
			if (event == null) {
				finished = true;
				break;
			}

			final AggregatePoint next = nextPoint(points, event.timestamp());
			final BigDecimal missing = estimator.estimate(event, next);
			final BigDecimal adjustment = event.discontinuity().add(missing);
			handled.add(event.timestamp());

			try {
				store.adjust(counterId, event.timestamp(), adjustment, settings.unit());
			} catch (AggregateStoreException e) {
				log.error("Failed to adjust {} at {} by {} {}: {}", counterId, event.timestamp(),
						adjustment.toPlainString(), settings.unit(), e.getMessage());
				errors.add("Failed to adjust %s at %s: %s".formatted(counterId, event.timestamp(), e.getMessage()));
				continue;
			}
			ledger.add(new AdjustmentRecord(counterId, event.timestamp(), adjustment, settings.unit()));
			if (log.isInfoEnabled()) {
				log.info("Adjusted {} at {} by {} {} (reset {} -> {}, discontinuity {}, estimated missing {}, rate {}/h)",
						counterId, event.timestamp(), adjustment.toPlainString(), settings.unit(),
						event.previousSum().toPlainString(), event.currentSum().toPlainString(),
						event.discontinuity().toPlainString(), missing.toPlainString(),
						MissingEnergyEstimator.hourlyRate(event, next));
			}

			try {
				pause.pause(settings.commitDelay());
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				log.warn("Interrupted waiting for adjustment of {} to be committed", counterId);
				stopped = true;
				break;
			}
		}

		if (!(finished || stopped)) {
			// the last allowed iteration may have fixed the final reset
			finished = confirmCorrected(counterId, range, handled);
		}

		final boolean capReached = !(finished || stopped);
		if (capReached) {
			log.error("Maximum iterations ({}) reached correcting {}: {} adjustment(s) applied, resets may remain",
					maxIterations, counterId, ledger.size());
		} else if (finished && !ledger.isEmpty()) {
			log.info("Corrected {} with {} adjustment(s) in {} iteration(s)", counterId, ledger.size(), iterations);
		}
		return new CounterCorrection(counterId, List.copyOf(ledger), iterations, capReached, stopped,
				List.copyOf(errors));
	}

	private boolean confirmCorrected(String counterId, Interval range, Set<Instant> handled) {
		try {
			return firstUnhandled(ResetDetector.detect(store.query(counterId, range, settings.granularity())),
					handled) == null;
		} catch (AggregateStoreException e) {
			log.warn("Failed to confirm correction of {}: {}", counterId, e.getMessage());
			return false;
		}
	}

	private static ResetEvent firstUnhandled(List<ResetEvent> events, Set<Instant> handled) {
		for (ResetEvent event : events) {
			if (!handled.contains(event.timestamp())) {
				return event;
			}
		}
		return null;
	}

	private static AggregatePoint nextPoint(List<AggregatePoint> points, Instant ts) {
		for (int i = 0, len = points.size(); i < len; i++) {
			if (points.get(i).start().equals(ts)) {
				return (i + 1 < len ? points.get(i + 1) : null);
			}
		}
		return null;
	}

}
