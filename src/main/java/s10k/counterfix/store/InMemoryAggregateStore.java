package s10k.counterfix.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

import org.threeten.extra.Interval;

import s10k.counterfix.domain.AdjustmentRecord;
import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.Granularity;

/**
 * {@link AggregateStore} that keeps aggregates in memory.
 * 
 * <p>
 * Aggregates are kept at whatever granularity they were added with; the
 * granularity passed to {@link #query(Set, Interval, Granularity)} is not used
 * to re-bucket them. A visibility lag can be configured so that adjustments
 * only show up after a number of further queries, like a store that commits
 * adjustments asynchronously.
 * </p>
 */
public class InMemoryAggregateStore implements AggregateStore {

	private final Map<String, NavigableMap<Instant, BigDecimal>> data = new LinkedHashMap<>(8);
	private final List<PendingAdjustment> pending = new ArrayList<>(4);
	private final List<AdjustmentRecord> submitted = new ArrayList<>(8);
	private final int visibilityLag;

	private int queryCount;

	private static final class PendingAdjustment {

		private final AdjustmentRecord adjustment;
		private int remaining;

		private PendingAdjustment(AdjustmentRecord adjustment, int remaining) {
			super();
			this.adjustment = adjustment;
			this.remaining = remaining;
		}
	}

	/**
	 * Constructor.
	 * 
	 * <p>
	 * Adjustments are visible immediately.
	 * </p>
	 */
	public InMemoryAggregateStore() {
		this(0);
	}

	/**
	 * Constructor.
	 * 
	 * @param visibilityLag the number of queries after an adjustment that will
	 *                      not yet see it
	 */
	public InMemoryAggregateStore(int visibilityLag) {
		super();
		this.visibilityLag = visibilityLag;
	}

	/**
	 * Add aggregates for a counter, replacing any with the same start dates.
	 * 
	 * @param counterId the counter ID
	 * @param points    the aggregates to add
	 * @return this instance
	 */
	public synchronized InMemoryAggregateStore putAll(String counterId, List<AggregatePoint> points) {
		NavigableMap<Instant, BigDecimal> series = data.computeIfAbsent(counterId, k -> new TreeMap<>());
		for (AggregatePoint p : points) {
			series.put(p.start(), p.sum());
		}
		return this;
	}

	/**
	 * Add a single aggregate for a counter.
	 * 
	 * @param counterId the counter ID
	 * @param start     the aggregate start date
	 * @param sum       the sum, or {@code null}
	 * @return this instance
	 */
	public InMemoryAggregateStore put(String counterId, Instant start, Number sum) {
		return putAll(counterId, List.of(AggregatePoint.point(start, sum)));
	}

	@Override
	public synchronized Map<String, List<AggregatePoint>> query(Set<String> counterIds, Interval range,
			Granularity granularity) {
		queryCount++;
		for (Iterator<PendingAdjustment> itr = pending.iterator(); itr.hasNext();) {
			PendingAdjustment p = itr.next();
			if (p.remaining <= 0) {
				apply(p.adjustment);
				itr.remove();
			} else {
				p.remaining--;
			}
		}
		Map<String, List<AggregatePoint>> result = new LinkedHashMap<>(counterIds.size());
		for (String counterId : counterIds) {
			NavigableMap<Instant, BigDecimal> series = data.get(counterId);
			if (series == null) {
				continue;
			}
			List<AggregatePoint> points = new ArrayList<>();
			for (Entry<Instant, BigDecimal> e : series.subMap(range.getStart(), true, range.getEnd(), false)
					.entrySet()) {
				points.add(new AggregatePoint(e.getKey(), e.getValue()));
			}
			result.put(counterId, points);
		}
		return result;
	}

	@Override
	public synchronized void adjust(String counterId, Instant anchor, BigDecimal amount, String unit) {
		if (!data.containsKey(counterId)) {
			throw new AggregateStoreException("Unknown counter [" + counterId + "]");
		}
		AdjustmentRecord adj = new AdjustmentRecord(counterId, anchor, amount, unit);
		submitted.add(adj);
		if (visibilityLag > 0) {
			pending.add(new PendingAdjustment(adj, visibilityLag));
		} else {
			apply(adj);
		}
	}

	private void apply(AdjustmentRecord adj) {
		NavigableMap<Instant, BigDecimal> series = data.get(adj.counterId());
		for (Entry<Instant, BigDecimal> e : series.tailMap(adj.timestamp(), true).entrySet()) {
			if (e.getValue() != null) {
				e.setValue(e.getValue().add(adj.adjustment()));
			}
		}
	}

	/**
	 * Apply all adjustments that are not yet visible.
	 */
	public synchronized void flush() {
		for (PendingAdjustment p : pending) {
			apply(p.adjustment);
		}
		pending.clear();
	}

	/**
	 * Get a snapshot of all aggregates, including pending adjustments.
	 * 
	 * @return mapping of counter ID to aggregates
	 */
	public synchronized Map<String, List<AggregatePoint>> snapshot() {
		flush();
		Map<String, List<AggregatePoint>> result = new LinkedHashMap<>(data.size());
		for (Entry<String, NavigableMap<Instant, BigDecimal>> e : data.entrySet()) {
			List<AggregatePoint> points = new ArrayList<>(e.getValue().size());
			for (Entry<Instant, BigDecimal> p : e.getValue().entrySet()) {
				points.add(new AggregatePoint(p.getKey(), p.getValue()));
			}
			result.put(e.getKey(), points);
		}
		return result;
	}

	/**
	 * Get the sum of one aggregate, including pending adjustments.
	 * 
	 * @param counterId the counter ID
	 * @param start     the aggregate start date
	 * @return the sum, or {@code null} if not available
	 */
	public synchronized BigDecimal sum(String counterId, Instant start) {
		flush();
		NavigableMap<Instant, BigDecimal> series = data.get(counterId);
		return (series != null ? series.get(start) : null);
	}

	/**
	 * Get all adjustments submitted so far.
	 * 
	 * @return the adjustments, in submission order
	 */
	public synchronized List<AdjustmentRecord> submittedAdjustments() {
		return List.copyOf(submitted);
	}

	/**
	 * Get the number of queries performed.
	 * 
	 * @return the query count
	 */
	public synchronized int queryCount() {
		return queryCount;
	}

}
