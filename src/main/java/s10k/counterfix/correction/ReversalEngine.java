package s10k.counterfix.correction;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threeten.extra.Interval;

import s10k.counterfix.domain.AdjustmentRecord;
import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.Granularity;
import s10k.counterfix.domain.LedgerEntries;
import s10k.counterfix.domain.ResetSimulationResult;
import s10k.counterfix.domain.ReversalReport;
import s10k.counterfix.store.AggregateStore;
import s10k.counterfix.store.AggregateStoreException;

/**
 * Undo previously applied adjustments, or manufacture a synthetic reset.
 */
public class ReversalEngine {

	/** The time either side of a simulated reset to search for aggregates. */
	public static final Duration SIMULATION_SEARCH_WINDOW = Duration.ofHours(1);

	private static final Logger log = LoggerFactory.getLogger(ReversalEngine.class);

	private final AggregateStore store;
	private final String unit;

	/**
	 * Constructor.
	 * 
	 * @param store the store
	 * @param unit  the unit to submit simulated resets with
	 */
	public ReversalEngine(AggregateStore store, String unit) {
		super();
		this.store = store;
		this.unit = unit;
	}

	/**
	 * Reverse a ledger of adjustments.
	 * 
	 * @param ledger the adjustments to reverse
	 * @return the report
	 */
	public ReversalReport reverse(List<AdjustmentRecord> ledger) {
		return reverse(new LedgerEntries(ledger != null ? ledger : List.of(), List.of()));
	}

	/**
	 * Reverse a ledger of adjustments decoded from a previous report.
	 * 
	 * <p>
	 * Every entry is reversed independently: a failure on one entry is recorded
	 * and does not stop the others. Entries that could not be decoded count as
	 * failures.
	 * </p>
	 * 
	 * @param entries the decoded ledger
	 * @return the report
	 */
	public ReversalReport reverse(LedgerEntries entries) {
		final int total = entries.size();
		if (total < 1) {
			return new ReversalReport(false, 0, 0, null, null,
					"No adjustments found in cleanup result. Was dry run enabled?");
		}
		log.info("Reversing {} adjustment(s)", total);

		final List<String> errors = new ArrayList<>(entries.errors());
		for (String error : entries.errors()) {
			log.warn("Skipping ledger entry: {}", error);
		}

		int reversedCount = 0;
		for (AdjustmentRecord record : entries.records()) {
			AdjustmentRecord reversal = record.reversed();
			log.info("Reversing adjustment for {} at {}: {} -> {} {}", record.counterId(), record.timestamp(),
					record.adjustment().toPlainString(), reversal.adjustment().toPlainString(), reversal.unit());
			try {
				store.adjust(reversal.counterId(), reversal.timestamp(), reversal.adjustment(), reversal.unit());
				reversedCount++;
			} catch (AggregateStoreException e) {
				String msg = "Failed to reverse adjustment for %s at %s: %s".formatted(record.counterId(),
						record.timestamp(), e.getMessage());
				log.error(msg, e);
				errors.add(msg);
			}
		}

		if (!errors.isEmpty()) {
			return new ReversalReport(reversedCount > 0, reversedCount, total, List.copyOf(errors), null,
					"Reversed %d of %d adjustments. %d error(s).".formatted(reversedCount, total, errors.size()));
		}
		return new ReversalReport(true, reversedCount, total, null,
				"Successfully reversed %d adjustment(s).".formatted(reversedCount), null);
	}

	/**
	 * Simulate a counter reset by adjusting a counter down.
	 * 
	 * <p>
	 * The aggregate at, or just before, {@code resetTime} is found at five minute
	 * granularity and a single negative adjustment is submitted from there on. If
	 * {@code dropAmount} is {@code null}, or larger than the sum found, the sum is
	 * dropped to zero.
	 * </p>
	 * 
	 * @param counterId  the counter ID
	 * @param resetTime  the reset date
	 * @param dropAmount the amount to drop by, or {@code null} to drop to zero
	 * @return the result
	 */
	public ResetSimulationResult simulateReset(String counterId, Instant resetTime, BigDecimal dropAmount) {
		log.info("Simulating reset of {} at {} (drop {})", counterId, resetTime,
				dropAmount != null ? dropAmount.toPlainString() : "to zero");
		if (dropAmount != null && dropAmount.signum() <= 0) {
			return ResetSimulationResult.failed(counterId, "The drop amount must be greater than zero.");
		}

		final List<AggregatePoint> points;
		try {
			points = store.query(counterId,
					Interval.of(resetTime.minus(SIMULATION_SEARCH_WINDOW), resetTime.plus(SIMULATION_SEARCH_WINDOW)),
					Granularity.FiveMinute);
		} catch (AggregateStoreException e) {
			log.error("Error querying statistics for {}: {}", counterId, e.getMessage(), e);
			return ResetSimulationResult.failed(counterId, "Failed to query statistics: " + e.getMessage());
		}
		if (points.isEmpty()) {
			return ResetSimulationResult.failed(counterId, "No statistics found for " + counterId);
		}

		AggregatePoint found = null;
		for (AggregatePoint p : points) {
			if (p.start().isAfter(resetTime)) {
				break;
			}
			if (p.hasSum()) {
				found = p;
			}
		}
		if (found == null) {
			return ResetSimulationResult.failed(counterId,
					"Could not find statistics entry at or before " + resetTime);
		}

		final BigDecimal previousSum = found.sum();
		BigDecimal adjustment;
		BigDecimal newSum;
		if (dropAmount == null || dropAmount.compareTo(previousSum) > 0) {
			adjustment = previousSum.negate();
			newSum = BigDecimal.ZERO;
		} else {
			adjustment = dropAmount.negate();
			newSum = previousSum.subtract(dropAmount);
		}
		log.info("Found sum {} at {}, adjusting by {} to {} {}", previousSum.toPlainString(), found.start(),
				adjustment.toPlainString(), newSum.toPlainString(), unit);

		try {
			store.adjust(counterId, found.start(), adjustment, unit);
		} catch (AggregateStoreException e) {
			log.error("Failed to adjust statistics for {}: {}", counterId, e.getMessage(), e);
			return ResetSimulationResult.failed(counterId, "Failed to adjust statistics: " + e.getMessage());
		}

		return new ResetSimulationResult(true, counterId, found.start(), previousSum, adjustment, newSum,
				"Simulated counter reset: dropped %s %s at %s".formatted(adjustment.abs().toPlainString(), unit,
						found.start()),
				null);
	}

}
