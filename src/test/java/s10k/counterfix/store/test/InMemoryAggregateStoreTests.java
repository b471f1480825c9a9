package s10k.counterfix.store.test;

import static org.assertj.core.api.BDDAssertions.then;
import static org.assertj.core.api.BDDAssertions.thenExceptionOfType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.threeten.extra.Interval;

import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.Granularity;
import s10k.counterfix.store.AggregateStoreException;
import s10k.counterfix.store.InMemoryAggregateStore;

/**
 * Test cases for the {@link InMemoryAggregateStore} class.
 */
public class InMemoryAggregateStoreTests {

	private static final Instant START = Instant.parse("2024-06-01T00:00:00Z");

	private static Instant hour(int h) {
		return START.plus(Duration.ofHours(h));
	}

	@Test
	public void query_rangeEndExclusive() {
		// GIVEN
		InMemoryAggregateStore store = new InMemoryAggregateStore().put("a", hour(0), 1).put("a", hour(1), 2)
				.put("a", hour(2), 3);

		// WHEN
		List<AggregatePoint> result = store.query("a", Interval.of(hour(0), hour(2)), Granularity.Hour);

		// THEN
		then(result).as("Start inclusive, end exclusive").extracting(AggregatePoint::start).containsExactly(hour(0),
				hour(1));
	}

	@Test
	public void adjust_appliesFromAnchor() {
		// GIVEN
		InMemoryAggregateStore store = new InMemoryAggregateStore().put("a", hour(0), 1).put("a", hour(1), null)
				.put("a", hour(2), 3);

		// WHEN
		store.adjust("a", hour(1), new BigDecimal("10"), "Wh");

		// THEN
		then(store.sum("a", hour(0))).as("Before anchor unchanged").isEqualByComparingTo("1");
		then(store.sum("a", hour(1))).as("Missing sum stays missing").isNull();
		then(store.sum("a", hour(2))).as("After anchor adjusted").isEqualByComparingTo("13");
	}

	@Test
	public void adjust_unknownCounter() {
		// GIVEN
		InMemoryAggregateStore store = new InMemoryAggregateStore();

		// THEN
		thenExceptionOfType(AggregateStoreException.class).as("Unknown counter rejected")
				.isThrownBy(() -> store.adjust("nope", hour(0), BigDecimal.ONE, "Wh"));
	}

	@Test
	public void adjust_visibilityLag() {
		// GIVEN
		InMemoryAggregateStore store = new InMemoryAggregateStore(2).put("a", hour(0), 1);
		Interval range = Interval.of(hour(0), hour(1));

		// WHEN
		store.adjust("a", hour(0), BigDecimal.TEN, "Wh");

		// THEN
		then(store.query("a", range, Granularity.Hour).get(0).sum()).as("Not visible on first query")
				.isEqualByComparingTo("1");
		then(store.query("a", range, Granularity.Hour).get(0).sum()).as("Not visible on second query")
				.isEqualByComparingTo("1");
		then(store.query("a", range, Granularity.Hour).get(0).sum()).as("Visible on third query")
				.isEqualByComparingTo("11");
		then(store.queryCount()).as("Queries counted").isEqualTo(3);
	}

}
