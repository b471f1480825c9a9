package s10k.counterfix.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.threeten.extra.Interval;

import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.Granularity;

/**
 * API for a store of periodic cumulative counter aggregates.
 * 
 * <p>
 * Adjustments may be applied asynchronously, so an adjustment is not
 * guaranteed to be visible to a query made immediately after it was submitted.
 * </p>
 */
public interface AggregateStore {

	/**
	 * Query for the aggregates of a set of counters.
	 * 
	 * @param counterIds  the counter IDs
	 * @param range       the time range, start inclusive and end exclusive
	 * @param granularity the aggregate granularity
	 * @return mapping of counter ID to aggregates ordered by start date;
	 *         counters without data may be missing
	 * @throws AggregateStoreException if the query fails
	 */
	Map<String, List<AggregatePoint>> query(Set<String> counterIds, Interval range, Granularity granularity);

	/**
	 * Add an amount to the sum of an aggregate and all later aggregates of the
	 * same counter.
	 * 
	 * @param counterId the counter ID
	 * @param anchor    the start date of the first aggregate to adjust
	 * @param amount    the signed amount to add
	 * @param unit      the unit of {@code amount}
	 * @throws AggregateStoreException if the adjustment is not accepted
	 */
	void adjust(String counterId, Instant anchor, BigDecimal amount, String unit);

	/**
	 * Query for the aggregates of a single counter.
	 * 
	 * @param counterId   the counter ID
	 * @param range       the time range, start inclusive and end exclusive
	 * @param granularity the aggregate granularity
	 * @return the aggregates, never {@code null}
	 * @throws AggregateStoreException if the query fails
	 */
	default List<AggregatePoint> query(String counterId, Interval range, Granularity granularity) {
		Map<String, List<AggregatePoint>> result = query(Set.of(counterId), range, granularity);
		List<AggregatePoint> points = (result != null ? result.get(counterId) : null);
		return (points != null ? points : List.of());
	}

}
