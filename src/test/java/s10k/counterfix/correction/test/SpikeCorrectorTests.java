package s10k.counterfix.correction.test;

import static org.assertj.core.api.BDDAssertions.then;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.threeten.extra.Interval;

import s10k.counterfix.correction.CorrectionSettings;
import s10k.counterfix.correction.ResetDetector;
import s10k.counterfix.correction.SpikeCorrector;
import s10k.counterfix.domain.AdjustmentRecord;
import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.CounterCorrection;
import s10k.counterfix.domain.Granularity;
import s10k.counterfix.store.AggregateStore;
import s10k.counterfix.store.AggregateStoreException;
import s10k.counterfix.store.InMemoryAggregateStore;
import s10k.counterfix.support.Pause;

/**
 * Test cases for the {@link SpikeCorrector} class.
 */
public class SpikeCorrectorTests {

	private static final String COUNTER = "sensor.main_meter_consumed";
	private static final Instant START = Instant.parse("2024-06-01T00:00:00Z");
	private static final Interval RANGE = Interval.of(START.minus(Duration.ofHours(1)), START.plus(Duration.ofDays(1)));

	private CorrectionSettings settings;
	private AtomicInteger pauses;
	private Pause pause;

	@BeforeEach
	public void setup() {
		settings = new CorrectionSettings(Granularity.Hour, "Wh", ZoneOffset.UTC, Duration.ofSeconds(1), 100, true);
		pauses = new AtomicInteger();
		pause = d -> pauses.incrementAndGet();
	}

	private static Instant hour(int h) {
		return START.plus(Duration.ofHours(h));
	}

	private static InMemoryAggregateStore store(int lag, Number... sums) {
		InMemoryAggregateStore store = new InMemoryAggregateStore(lag);
		for (int i = 0; i < sums.length; i++) {
			store.put(COUNTER, hour(i), sums[i]);
		}
		return store;
	}

	@Test
	public void correct_singleReset() {
		// GIVEN
		InMemoryAggregateStore store = store(0, 100, 40, 160);
		SpikeCorrector corrector = new SpikeCorrector(store, settings, pause);

		// WHEN
		CounterCorrection result = corrector.correct(COUNTER, RANGE);

		// THEN
		// @formatter:off
		then(result.ledger())
			.as("One adjustment applied")
			.hasSize(1)
			.element(0)
			.as("Anchored at reset aggregate")
			.returns(hour(1), AdjustmentRecord::timestamp)
			.as("Unit from settings")
			.returns("Wh", AdjustmentRecord::unit)
			;
		then(result.ledger().get(0).adjustment())
			.as("Discontinuity 60 plus estimated missing 120")
			.isEqualByComparingTo("180")
			;
		then(store.sum(COUNTER, hour(0))).as("Earlier aggregate unchanged").isEqualByComparingTo("100");
		then(store.sum(COUNTER, hour(1))).as("Reset aggregate raised").isEqualByComparingTo("220");
		then(store.sum(COUNTER, hour(2))).as("Later aggregate raised").isEqualByComparingTo("340");
		then(result.isComplete()).as("Correction completed").isTrue();
		then(pauses).as("Paused once after the adjustment").hasValue(1);
		// @formatter:on
	}

	@Test
	public void correct_withoutEstimate() {
		// GIVEN
		InMemoryAggregateStore store = store(0, 100, 40, 160);
		SpikeCorrector corrector = new SpikeCorrector(store, settings.withEstimateMissingEnergy(false), pause);

		// WHEN
		CounterCorrection result = corrector.correct(COUNTER, RANGE);

		// THEN
		then(result.ledger()).extracting(AdjustmentRecord::adjustment).as("Only the discontinuity applied")
				.usingElementComparator(BigDecimal::compareTo).containsExactly(new BigDecimal("60"));
		then(store.sum(COUNTER, hour(1))).as("Reset aggregate continues from previous").isEqualByComparingTo("100");
	}

	@Test
	public void correct_multipleResetsEarliestFirst() {
		// GIVEN
		InMemoryAggregateStore store = store(0, 100, 40, 160, 20, 80);
		SpikeCorrector corrector = new SpikeCorrector(store, settings.withEstimateMissingEnergy(false), pause);

		// WHEN
		CounterCorrection result = corrector.correct(COUNTER, RANGE);

		// THEN
		// @formatter:off
		then(result.ledger())
			.as("Resets corrected in time order")
			.extracting(AdjustmentRecord::timestamp)
			.containsExactly(hour(1), hour(3))
			;
		then(result.ledger())
			.as("Second adjustment computed against corrected data")
			.extracting(AdjustmentRecord::adjustment)
			.usingElementComparator(BigDecimal::compareTo)
			.containsExactly(new BigDecimal("60"), new BigDecimal("140"))
			;
		then(ResetDetector.detect(store.snapshot().get(COUNTER)))
			.as("Counter no longer decreases")
			.isEmpty()
			;
		// @formatter:on
	}

	@Test
	public void correct_secondRunDoesNothing() {
		// GIVEN
		InMemoryAggregateStore store = store(0, 100, 40, 160);
		SpikeCorrector corrector = new SpikeCorrector(store, settings, pause);
		corrector.correct(COUNTER, RANGE);

		// WHEN
		CounterCorrection result = corrector.correct(COUNTER, RANGE);

		// THEN
		then(result.ledger()).as("No further adjustments").isEmpty();
		then(store.submittedAdjustments()).as("Only the first run adjusted").hasSize(1);
	}

	@Test
	public void correct_delayedVisibilityAdjustedOnce() {
		// GIVEN
		InMemoryAggregateStore store = store(1, 100, 40, 160);
		SpikeCorrector corrector = new SpikeCorrector(store, settings, pause);

		// WHEN
		CounterCorrection result = corrector.correct(COUNTER, RANGE);

		// THEN
		then(store.submittedAdjustments()).as("Reset not corrected twice while adjustment pending").hasSize(1);
		then(result.adjustmentCount()).as("Ledger has one entry").isEqualTo(1);
		then(store.sum(COUNTER, hour(2))).as("Adjustment applied once committed").isEqualByComparingTo("340");
	}

	@Test
	public void correct_iterationCap() {
		// GIVEN
		AtomicInteger queries = new AtomicInteger();
		AggregateStore endless = new AggregateStore() {

			@Override
			public Map<String, List<AggregatePoint>> query(Set<String> counterIds, Interval range,
					Granularity granularity) {
				// a new reset shows up on every query
				int n = queries.incrementAndGet();
				List<AggregatePoint> points = new ArrayList<>();
				points.add(AggregatePoint.point(hour(0), 100));
				points.add(AggregatePoint.point(hour(n), 50));
				return Map.of(COUNTER, points);
			}

			@Override
			public void adjust(String counterId, Instant anchor, BigDecimal amount, String unit) {
				// ignore
			}
		};
		SpikeCorrector corrector = new SpikeCorrector(endless, settings.withMaxIterations(3), pause);

		// WHEN
		CounterCorrection result = corrector.correct(COUNTER, RANGE);

		// THEN
		then(result.capReached()).as("Iteration cap reached").isTrue();
		then(result.iterations()).as("Stopped at the cap").isEqualTo(3);
		then(result.adjustmentCount()).as("One adjustment per iteration").isEqualTo(3);
		then(result.isComplete()).as("Not complete").isFalse();
	}

	@Test
	public void correct_lastAllowedIterationFixesFinalReset() {
		// GIVEN
		InMemoryAggregateStore store = store(0, 100, 40, 160);
		SpikeCorrector corrector = new SpikeCorrector(store, settings.withMaxIterations(1), pause);

		// WHEN
		CounterCorrection result = corrector.correct(COUNTER, RANGE);

		// THEN
		then(result.adjustmentCount()).as("Reset corrected").isEqualTo(1);
		then(result.iterations()).as("Single iteration used").isEqualTo(1);
		then(result.capReached()).as("Counter confirmed clean, cap not reported").isFalse();
		then(result.isComplete()).as("Correction completed").isTrue();
	}

	@Test
	public void correct_adjustFailureMovesOn() {
		// GIVEN
		InMemoryAggregateStore delegate = store(0, 100, 40, 160, 20, 80);
		AggregateStore store = new AggregateStore() {

			@Override
			public Map<String, List<AggregatePoint>> query(Set<String> counterIds, Interval range,
					Granularity granularity) {
				return delegate.query(counterIds, range, granularity);
			}

			@Override
			public void adjust(String counterId, Instant anchor, BigDecimal amount, String unit) {
				if (anchor.equals(hour(1))) {
					throw new AggregateStoreException("Service unavailable");
				}
				delegate.adjust(counterId, anchor, amount, unit);
			}
		};
		SpikeCorrector corrector = new SpikeCorrector(store, settings.withEstimateMissingEnergy(false), pause);

		// WHEN
		CounterCorrection result = corrector.correct(COUNTER, RANGE);

		// THEN
		// @formatter:off
		then(result.ledger())
			.as("Failed adjustment not in ledger, later reset still corrected")
			.extracting(AdjustmentRecord::timestamp)
			.containsExactly(hour(3))
			;
		then(result.errors())
			.as("Failure recorded")
			.hasSize(1)
			;
		then(result.errors().get(0))
			.as("Failure message from store")
			.contains("Service unavailable")
			;
		then(result.capReached()).as("Cap not reached").isFalse();
		then(result.stopped()).as("Not stopped").isFalse();
		// @formatter:on
	}

	@Test
	public void correct_queryFailureStops() {
		// GIVEN
		AggregateStore store = new AggregateStore() {

			@Override
			public Map<String, List<AggregatePoint>> query(Set<String> counterIds, Interval range,
					Granularity granularity) {
				throw new AggregateStoreException("Connection refused");
			}

			@Override
			public void adjust(String counterId, Instant anchor, BigDecimal amount, String unit) {
				throw new UnsupportedOperationException();
			}
		};
		SpikeCorrector corrector = new SpikeCorrector(store, settings, pause);

		// WHEN
		CounterCorrection result = corrector.correct(COUNTER, RANGE);

		// THEN
		then(result.stopped()).as("Stopped on query failure").isTrue();
		then(result.capReached()).as("Not a cap failure").isFalse();
		then(result.errors()).as("Failure recorded").hasSize(1);
		then(result.errors().get(0)).as("Failure message from store").contains("Connection refused");
	}

	@Test
	public void correct_interruptedStops() {
		// GIVEN
		InMemoryAggregateStore store = store(0, 100, 40, 160, 20, 80);
		SpikeCorrector corrector = new SpikeCorrector(store, settings, d -> {
			throw new InterruptedException();
		});

		// WHEN
		CounterCorrection result;
		try {
			result = corrector.correct(COUNTER, RANGE);
		} finally {
			Thread.interrupted();
		}

		// THEN
		then(result.stopped()).as("Stopped when interrupted").isTrue();
		then(result.adjustmentCount()).as("Adjustment before the pause kept").isEqualTo(1);
	}

	@Test
	public void preview_doesNotAdjust() {
		// GIVEN
		InMemoryAggregateStore store = store(0, 100, 40, 160);
		SpikeCorrector corrector = new SpikeCorrector(store, settings, Pause.NONE);

		// WHEN
		var result = corrector.preview(COUNTER, RANGE);

		// THEN
		then(result.events()).as("Reset found").hasSize(1);
		then(store.submittedAdjustments()).as("Nothing adjusted").isEmpty();
	}

}
