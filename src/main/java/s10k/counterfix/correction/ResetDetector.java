package s10k.counterfix.correction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.ResetEvent;
import s10k.counterfix.domain.ResetScan;

/**
 * Find decreases in a time-ordered list of cumulative counter aggregates.
 * 
 * <p>
 * A cumulative counter never decreases, so every decrease between two
 * consecutive aggregates is treated as a reset, no matter how small. Pairs
 * where either sum is missing or zero are skipped, as the counter had no data.
 * Pairs where either sum is negative are skipped and reported as corrupted.
 * </p>
 */
public final class ResetDetector {

	private static final Logger log = LoggerFactory.getLogger(ResetDetector.class);

	private ResetDetector() {
		// not available
	}

	/**
	 * Scan aggregates for resets.
	 * 
	 * @param points the aggregates, ordered by start date
	 * @return the scan results
	 */
	public static ResetScan scan(List<AggregatePoint> points) {
		if (points == null || points.size() < 2) {
			return ResetScan.EMPTY;
		}
		List<ResetEvent> events = new ArrayList<>(2);
		List<Instant> corrupted = new ArrayList<>(0);
		AggregatePoint previous = null;
		for (AggregatePoint current : points) {
			if (current.isCorrupted()) {
				corrupted.add(current.start());
			}
			if (previous != null && previous.isUsable() && current.isUsable()
					&& current.sum().compareTo(previous.sum()) < 0) {
				events.add(new ResetEvent(current.start(), previous.start(), previous.sum(), current.sum()));
			}
			previous = current;
		}
		if (!corrupted.isEmpty()) {
			log.warn("Ignoring {} aggregate(s) with negative sums: {}", corrupted.size(), corrupted);
		}
		return new ResetScan(List.copyOf(events), List.copyOf(corrupted));
	}

	/**
	 * Find resets in aggregates.
	 * 
	 * @param points the aggregates, ordered by start date
	 * @return the resets, in time order
	 */
	public static List<ResetEvent> detect(List<AggregatePoint> points) {
		return scan(points).events();
	}

}
