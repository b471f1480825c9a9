package s10k.counterfix.correction;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.threeten.extra.Interval;

import s10k.counterfix.domain.AdjustmentRecord;
import s10k.counterfix.domain.CorrectionReport;
import s10k.counterfix.domain.CounterCorrection;
import s10k.counterfix.domain.CounterGroup;
import s10k.counterfix.domain.CounterSpikes;
import s10k.counterfix.domain.ResetEvent;
import s10k.counterfix.domain.ResetTimestamp;
import s10k.counterfix.domain.SpikeDetail;

/**
 * The working state of one correction run on a counter group.
 */
final class CorrectionSession {

	private final CounterGroup group;
	private final ZoneId zone;
	private final boolean dryRun;
	private final Instant start;
	private final Instant end;
	private final Interval queryRange;
	private final String mainCounterId;
	private final List<Instant> resetTimestamps = new ArrayList<>(2);
	private final Map<String, List<ResetEvent>> counterSpikes = new LinkedHashMap<>(8);
	private final List<AdjustmentRecord> ledger = new ArrayList<>(8);
	private final List<String> warnings = new ArrayList<>(0);
	private int countersAdjusted;

	/**
	 * Constructor.
	 * 
	 * @param group         the group
	 * @param zone          the group time zone
	 * @param dryRun        the dry run mode
	 * @param start         the inclusive window start
	 * @param end           the inclusive window end
	 * @param queryRange    the expanded range to query
	 * @param mainCounterId the main counter ID
	 */
	CorrectionSession(CounterGroup group, ZoneId zone, boolean dryRun, Instant start, Instant end,
			Interval queryRange, String mainCounterId) {
		super();
		this.group = group;
		this.zone = zone;
		this.dryRun = dryRun;
		this.start = start;
		this.end = end;
		this.queryRange = queryRange;
		this.mainCounterId = mainCounterId;
	}

	Interval queryRange() {
		return queryRange;
	}

	String mainCounterId() {
		return mainCounterId;
	}

	/**
	 * Test if a date falls within the requested, inclusive, window.
	 * 
	 * @param ts the date
	 * @return {@code true} if {@code ts} is within the window
	 */
	boolean inWindow(Instant ts) {
		return !(ts.isBefore(start) || ts.isAfter(end));
	}

	void addResetTimestamp(Instant ts) {
		resetTimestamps.add(ts);
	}

	List<Instant> resetTimestamps() {
		return resetTimestamps;
	}

	void addCounterSpikes(String counterId, List<ResetEvent> events) {
		counterSpikes.put(counterId, events);
	}

	/**
	 * Get the IDs of the counters with at least one reset.
	 * 
	 * @return the counter IDs, in group order
	 */
	List<String> affectedCounterIds() {
		List<String> result = new ArrayList<>(counterSpikes.size());
		for (Entry<String, List<ResetEvent>> e : counterSpikes.entrySet()) {
			if (!e.getValue().isEmpty()) {
				result.add(e.getKey());
			}
		}
		return result;
	}

	void addCorrection(CounterCorrection correction) {
		ledger.addAll(correction.ledger());
		if (correction.adjustmentCount() > 0) {
			countersAdjusted++;
		}
		if (correction.capReached()) {
			warnings.add("Maximum iterations reached for %s after %d adjustment(s)"
					.formatted(correction.counterId(), correction.adjustmentCount()));
		}
		if (correction.stopped() && correction.errors().isEmpty()) {
			warnings.add("Correction of %s interrupted after %d adjustment(s)".formatted(correction.counterId(),
					correction.adjustmentCount()));
		}
		warnings.addAll(correction.errors());
	}

	List<AdjustmentRecord> ledger() {
		return ledger;
	}

	int countersAdjusted() {
		return countersAdjusted;
	}

	boolean hasWarnings() {
		return !warnings.isEmpty();
	}

	/**
	 * Create the report for this session.
	 * 
	 * @param message the message
	 * @param error   the error, or {@code null}
	 * @return the report
	 */
	CorrectionReport toReport(String message, String error) {
		List<CounterSpikes> details = new ArrayList<>(counterSpikes.size());
		for (Entry<String, List<ResetEvent>> e : counterSpikes.entrySet()) {
			if (e.getValue().isEmpty()) {
				continue;
			}
			details.add(new CounterSpikes(e.getKey(),
					e.getValue().stream().map(evt -> SpikeDetail.of(evt, zone)).toList()));
		}
		// @formatter:off
		return new CorrectionReport(
				  dryRun
				, group.id()
				, mainCounterId
				, group.counters().size()
				, resetTimestamps.stream().map(ts -> ResetTimestamp.of(ts, zone)).toList()
				, countersAdjusted
				, details
				, ledger.isEmpty() ? null : List.copyOf(ledger)
				, warnings.isEmpty() ? null : List.copyOf(warnings)
				, message
				, error
			);
		// @formatter:on
	}

}
