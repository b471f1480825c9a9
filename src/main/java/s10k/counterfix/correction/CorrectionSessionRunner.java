package s10k.counterfix.correction;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threeten.extra.Interval;

import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.CorrectionReport;
import s10k.counterfix.domain.CorrectionRequest;
import s10k.counterfix.domain.CounterCorrection;
import s10k.counterfix.domain.CounterGroup;
import s10k.counterfix.domain.CounterInfo;
import s10k.counterfix.domain.ResetEvent;
import s10k.counterfix.domain.ResetScan;
import s10k.counterfix.store.AggregateStore;
import s10k.counterfix.store.AggregateStoreException;

/**
 * Find and correct counter resets for a counter group.
 * 
 * <p>
 * Resets are detected on the group's main counter. If any are found within the
 * requested window, every counter in the group is scanned and, unless running
 * in dry-run mode, the counters that show resets of their own are corrected
 * one at a time.
 * </p>
 * 
 * <p>
 * The query window is expanded by one aggregate period on both sides: a reset
 * at the window start can only be seen by comparing against the aggregate
 * before it. Reported reset dates are limited to the requested window.
 * </p>
 */
public class CorrectionSessionRunner {

	private static final Logger log = LoggerFactory.getLogger(CorrectionSessionRunner.class);

	private final CounterGroupResolver groupResolver;
	private final AggregateStore store;
	private final SpikeCorrector corrector;
	private final CorrectionSettings settings;

	/**
	 * Constructor.
	 * 
	 * @param groupResolver the group resolver
	 * @param store         the aggregate store
	 * @param corrector     the corrector
	 * @param settings      the settings
	 */
	public CorrectionSessionRunner(CounterGroupResolver groupResolver, AggregateStore store,
			SpikeCorrector corrector, CorrectionSettings settings) {
		super();
		this.groupResolver = groupResolver;
		this.store = store;
		this.corrector = corrector;
		this.settings = settings;
	}

	/**
	 * Run a correction session.
	 * 
	 * <p>
	 * Configuration problems, invalid input and store query failures are
	 * returned as a report with an {@code error}.
	 * </p>
	 * 
	 * @param request the request
	 * @return the report, never {@code null}
	 */
	public CorrectionReport run(CorrectionRequest request) {
		final boolean dryRun = request.dryRun();
		final String groupId = request.groupId();
		log.info("Starting counter reset cleanup for group {} from {} to {} (dry run: {})", groupId, request.start(),
				request.end(), dryRun);

		final Optional<CounterGroup> resolved = (groupId != null ? groupResolver.findGroup(groupId)
				: Optional.empty());
		if (resolved.isEmpty()) {
			log.warn("Counter group {} not found", groupId);
			return CorrectionReport.failed(dryRun, groupId, 0, "Counter group not found: " + groupId);
		}
		if (!request.hasValidWindow()) {
			return CorrectionReport.failed(dryRun, groupId, 0,
					"Invalid time window: start %s is after end %s".formatted(request.start(), request.end()));
		}
		final CounterGroup group = resolved.get();
		if (group.counters().isEmpty()) {
			log.warn("No counters found in group {}", groupId);
			return CorrectionReport.failed(dryRun, groupId, 0, "No counters found in group " + groupId);
		}
		final Optional<CounterInfo> main = group.mainCounter();
		if (main.isEmpty()) {
			log.warn("No main counter found in group {}", groupId);
			return CorrectionReport.failed(dryRun, groupId, 0, "No main counter found in group " + groupId);
		}

		final ZoneId zone = (group.zone() != null ? group.zone() : settings.zone());
		final Instant start = request.start().atZone(zone).toInstant();
		final Instant end = request.end().atZone(zone).toInstant();
		final Duration period = settings.granularity().period();
		// end bound is exclusive: include the point one period past the window end
		final CorrectionSession session = new CorrectionSession(group, zone, dryRun, start, end,
				Interval.of(start.minus(period), end.plus(period.multipliedBy(2))), main.get().id());
		log.debug("Using main counter {} for group {} with {} counter(s)", session.mainCounterId(), groupId,
				group.counters().size());

		try {
			final ResetScan mainScan = corrector.preview(session.mainCounterId(), session.queryRange());
			for (ResetEvent event : mainScan.events()) {
				if (session.inWindow(event.timestamp())) {
					log.info("Detected reset on {} at {}: {} -> {} (delta {})", session.mainCounterId(),
							event.timestamp(), event.previousSum().toPlainString(),
							event.currentSum().toPlainString(), event.delta().toPlainString());
					session.addResetTimestamp(event.timestamp());
				}
			}
			if (session.resetTimestamps().isEmpty()) {
				log.info("No counter resets detected in group {}", groupId);
				return session.toReport("No counter resets detected", null);
			}
			log.info("Found {} reset timestamp(s) in group {}", session.resetTimestamps().size(), groupId);
			collectCounterSpikes(group, session);
		} catch (AggregateStoreException e) {
			log.error("Error finding counter resets in group {}: {}", groupId, e.getMessage(), e);
			return CorrectionReport.failed(dryRun, groupId, 0, "Failed to query statistics: " + e.getMessage());
		}

		final List<String> affected = session.affectedCounterIds();
		if (dryRun) {
			return session.toReport("Would adjust %d counter(s) with reset spikes. Run without dry run to apply."
					.formatted(affected.size()), null);
		}

		for (String counterId : affected) {
			if (Thread.currentThread().isInterrupted()) {
				break;
			}
			CounterCorrection correction = corrector.correct(counterId, session.queryRange());
			session.addCorrection(correction);
		}

		String error = null;
		if (session.ledger().isEmpty() && session.hasWarnings()) {
			error = "Found resets on %d counter(s) but no adjustments were applied.".formatted(affected.size());
		}
		return session.toReport("Adjusted %d counter(s) with %d adjustment(s).".formatted(session.countersAdjusted(),
				session.ledger().size()), error);
	}

	private void collectCounterSpikes(CounterGroup group, CorrectionSession session) {
		final Map<String, List<AggregatePoint>> stats = store.query(group.counterIds(), session.queryRange(),
				settings.granularity());
		for (CounterInfo counter : group.counters()) {
			List<AggregatePoint> points = stats.get(counter.id());
			if (points == null) {
				log.debug("No statistics found for {}", counter.id());
				continue;
			}
			session.addCounterSpikes(counter.id(), ResetDetector.detect(points));
		}
	}

}
