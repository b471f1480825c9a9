package s10k.counterfix.correction.test;

import static org.assertj.core.api.BDDAssertions.then;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.threeten.extra.Interval;

import s10k.counterfix.correction.CorrectionSessionRunner;
import s10k.counterfix.correction.CorrectionSettings;
import s10k.counterfix.correction.CounterGroupResolver;
import s10k.counterfix.correction.SpikeCorrector;
import s10k.counterfix.domain.AdjustmentRecord;
import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.CorrectionReport;
import s10k.counterfix.domain.CorrectionRequest;
import s10k.counterfix.domain.CounterGroup;
import s10k.counterfix.domain.CounterInfo;
import s10k.counterfix.domain.CounterSpikes;
import s10k.counterfix.domain.Granularity;
import s10k.counterfix.domain.ResetTimestamp;
import s10k.counterfix.store.AggregateStore;
import s10k.counterfix.store.AggregateStoreException;
import s10k.counterfix.store.InMemoryAggregateStore;
import s10k.counterfix.support.Pause;

/**
 * Test cases for the {@link CorrectionSessionRunner} class.
 */
public class CorrectionSessionRunnerTests {

	private static final String GROUP = "panel1";
	private static final String MAIN = "sensor.main_meter_consumed";
	private static final String PRODUCED = "sensor.main_meter_produced";
	private static final String CIRCUIT = "sensor.kitchen_consumed";

	private static final Instant START = Instant.parse("2024-06-01T00:00:00Z");
	private static final LocalDateTime WINDOW_START = LocalDateTime.parse("2024-06-01T00:00");
	private static final LocalDateTime WINDOW_END = LocalDateTime.parse("2024-06-01T23:00");

	private CorrectionSettings settings;
	private InMemoryAggregateStore store;
	private CounterGroup group;

	@BeforeEach
	public void setup() {
		settings = new CorrectionSettings(Granularity.Hour, "Wh", ZoneOffset.UTC, Duration.ZERO, 100, false);
		store = new InMemoryAggregateStore();
		// @formatter:off
		group = new CounterGroup(GROUP, ZoneOffset.UTC, List.of(
				  new CounterInfo(PRODUCED, Set.of("primary", "produced"))
				, new CounterInfo(MAIN, Set.of("primary", "consumed"))
				, new CounterInfo(CIRCUIT, Set.of())
			));
		// @formatter:on
	}

	private static Instant hour(int h) {
		return START.plus(Duration.ofHours(h));
	}

	private void populate(String counterId, Number... sums) {
		for (int i = 0; i < sums.length; i++) {
			store.put(counterId, hour(i), sums[i]);
		}
	}

	private CorrectionSessionRunner runner(CounterGroupResolver resolver, AggregateStore s) {
		return new CorrectionSessionRunner(resolver, s, new SpikeCorrector(s, settings, Pause.NONE), settings);
	}

	private CorrectionSessionRunner runner() {
		return runner(id -> GROUP.equals(id) ? Optional.of(group) : Optional.empty(), store);
	}

	private void populateResetGroup() {
		populate(MAIN, 1000, 10, 110, 210);
		populate(PRODUCED, 500, 600, 700, 800);
		populate(CIRCUIT, 300, 5, 25, 45);
	}

	@Test
	public void run_groupNotFound() {
		// WHEN
		CorrectionReport result = runner().run(new CorrectionRequest("nope", WINDOW_START, WINDOW_END, false));

		// THEN
		// @formatter:off
		then(result)
			.as("Error reported")
			.returns("Counter group not found: nope", CorrectionReport::error)
			.as("No counters processed")
			.returns(0, CorrectionReport::countersProcessed)
			.as("Dry run flag echoed")
			.returns(false, CorrectionReport::dryRun)
			;
		// @formatter:on
	}

	@Test
	public void run_invalidWindow() {
		// WHEN
		CorrectionReport result = runner().run(new CorrectionRequest(GROUP, WINDOW_END, WINDOW_START, true));

		// THEN
		then(result.error()).as("Window error reported").startsWith("Invalid time window");
		then(result.countersProcessed()).as("No counters processed").isEqualTo(0);
	}

	@Test
	public void run_noCounters() {
		// GIVEN
		group = new CounterGroup(GROUP, ZoneOffset.UTC, List.of());

		// WHEN
		CorrectionReport result = runner().run(CorrectionRequest.preview(GROUP, WINDOW_START, WINDOW_END));

		// THEN
		then(result.error()).as("Empty group reported").isEqualTo("No counters found in group panel1");
	}

	@Test
	public void run_noMainCounter() {
		// GIVEN
		group = new CounterGroup(GROUP, ZoneOffset.UTC, List.of(new CounterInfo(CIRCUIT, Set.of("consumed"))));

		// WHEN
		CorrectionReport result = runner().run(CorrectionRequest.preview(GROUP, WINDOW_START, WINDOW_END));

		// THEN
		then(result.error()).as("Missing main counter reported").isEqualTo("No main counter found in group panel1");
	}

	@Test
	public void run_noResets() {
		// GIVEN
		populate(MAIN, 100, 200, 300);
		populate(CIRCUIT, 300, 5, 25);

		// WHEN
		CorrectionReport result = runner().run(new CorrectionRequest(GROUP, WINDOW_START, WINDOW_END, false));

		// THEN
		// @formatter:off
		then(result)
			.as("Main counter chosen by primary and consumed tags")
			.returns(MAIN, CorrectionReport::mainCounterId)
			.as("All counters counted")
			.returns(3, CorrectionReport::countersProcessed)
			.as("Message")
			.returns("No counter resets detected", CorrectionReport::message)
			.as("No error")
			.returns(null, CorrectionReport::error)
			.as("No adjustments")
			.returns(null, CorrectionReport::adjustments)
			;
		then(store.submittedAdjustments())
			.as("Resets on other counters ignored when main counter has none")
			.isEmpty()
			;
		// @formatter:on
	}

	@Test
	public void run_dryRun() {
		// GIVEN
		populateResetGroup();

		// WHEN
		CorrectionReport result = runner().run(CorrectionRequest.preview(GROUP, WINDOW_START, WINDOW_END));

		// THEN
		// @formatter:off
		then(result.resetTimestamps())
			.as("Reset found on main counter")
			.extracting(ResetTimestamp::utc)
			.containsExactly(hour(1))
			;
		then(result.details())
			.as("Spikes reported for affected counters only")
			.extracting(CounterSpikes::counterId)
			.containsExactly(MAIN, CIRCUIT)
			;
		then(result.message())
			.as("Dry run message")
			.isEqualTo("Would adjust 2 counter(s) with reset spikes. Run without dry run to apply.")
			;
		then(result.adjustments()).as("No ledger for dry run").isNull();
		then(store.submittedAdjustments()).as("Dry run never adjusts").isEmpty();
		// @formatter:on
	}

	@Test
	public void run_apply() {
		// GIVEN
		populateResetGroup();

		// WHEN
		CorrectionReport result = runner().run(new CorrectionRequest(GROUP, WINDOW_START, WINDOW_END, false));

		// THEN
		// @formatter:off
		then(result.adjustments())
			.as("Affected counters adjusted")
			.extracting(AdjustmentRecord::counterId)
			.containsExactly(MAIN, CIRCUIT)
			;
		then(result.adjustments())
			.as("Adjustment amounts are the discontinuities")
			.extracting(AdjustmentRecord::adjustment)
			.usingElementComparator(BigDecimal::compareTo)
			.containsExactly(new BigDecimal("990"), new BigDecimal("295"))
			;
		then(result)
			.as("Counters adjusted")
			.returns(2, CorrectionReport::countersAdjusted)
			.as("Summary message")
			.returns("Adjusted 2 counter(s) with 2 adjustment(s).", CorrectionReport::message)
			.as("No error")
			.returns(null, CorrectionReport::error)
			;
		then(store.sum(PRODUCED, hour(1))).as("Unaffected counter untouched").isEqualByComparingTo("600");
		then(store.sum(MAIN, hour(3))).as("Main counter continuous").isEqualByComparingTo("1200");
		// @formatter:on
	}

	@Test
	public void run_resetOnWindowEnd() {
		// GIVEN
		populateResetGroup();

		// WHEN
		CorrectionReport result = runner()
				.run(CorrectionRequest.preview(GROUP, WINDOW_START, LocalDateTime.parse("2024-06-01T01:00")));

		// THEN
		then(result.resetTimestamps()).as("Window end is inclusive").extracting(ResetTimestamp::utc)
				.containsExactly(hour(1));
	}

	@Test
	public void run_resetOnWindowEnd_estimatesFromPointAfterWindow() {
		// GIVEN
		settings = settings.withEstimateMissingEnergy(true);
		populate(MAIN, 100, 40, 160);
		populate(PRODUCED, 500, 600, 700);

		// WHEN
		CorrectionReport result = runner()
				.run(new CorrectionRequest(GROUP, WINDOW_START, LocalDateTime.parse("2024-06-01T01:00"), false));

		// THEN
		// @formatter:off
		then(result.adjustments())
			.as("Single adjustment at window end")
			.extracting(AdjustmentRecord::timestamp)
			.containsExactly(hour(1))
			;
		then(result.adjustments().get(0).adjustment())
			.as("Discontinuity 60 plus 120 estimated from the point one hour past the window end")
			.isEqualByComparingTo("180")
			;
		then(store.sum(MAIN, hour(1))).as("Adjusted").isEqualByComparingTo("220");
		// @formatter:on
	}

	@Test
	public void run_resetAfterWindow() {
		// GIVEN
		populateResetGroup();

		// WHEN
		CorrectionReport result = runner()
				.run(CorrectionRequest.preview(GROUP, WINDOW_START, LocalDateTime.parse("2024-06-01T00:30")));

		// THEN
		then(result.resetTimestamps()).as("Reset after window end ignored").isEmpty();
		then(result.message()).as("Message").isEqualTo("No counter resets detected");
	}

	@Test
	public void run_groupZoneUsedForWindow() {
		// GIVEN
		populateResetGroup();
		group = new CounterGroup(GROUP, ZoneOffset.ofHours(2), group.counters());

		// WHEN
		CorrectionReport result = runner()
				.run(CorrectionRequest.preview(GROUP, LocalDateTime.parse("2024-06-01T03:00"), WINDOW_END));

		// THEN
		then(result.resetTimestamps()).as("Local 03:00 at +02:00 is 01:00 UTC").hasSize(1);
		then(result.resetTimestamps().get(0).local().getOffset()).as("Local timestamp in group zone")
				.isEqualTo(ZoneOffset.ofHours(2));
	}

	@Test
	public void run_queryFailure() {
		// GIVEN
		AggregateStore failing = new AggregateStore() {

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

		// WHEN
		CorrectionReport result = runner(id -> Optional.of(group), failing)
				.run(new CorrectionRequest(GROUP, WINDOW_START, WINDOW_END, false));

		// THEN
		then(result.error()).as("Query failure reported").isEqualTo("Failed to query statistics: Connection refused");
	}

	@Test
	public void run_allAdjustmentsFail() {
		// GIVEN
		populateResetGroup();
		AggregateStore readOnly = new AggregateStore() {

			@Override
			public Map<String, List<AggregatePoint>> query(Set<String> counterIds, Interval range,
					Granularity granularity) {
				return store.query(counterIds, range, granularity);
			}

			@Override
			public void adjust(String counterId, Instant anchor, BigDecimal amount, String unit) {
				throw new AggregateStoreException("Read only");
			}
		};

		// WHEN
		CorrectionReport result = runner(id -> Optional.of(group), readOnly)
				.run(new CorrectionRequest(GROUP, WINDOW_START, WINDOW_END, false));

		// THEN
		// @formatter:off
		then(result.error())
			.as("Nothing applied reported as error")
			.isEqualTo("Found resets on 2 counter(s) but no adjustments were applied.")
			;
		then(result.warnings())
			.as("Each failure listed")
			.hasSize(2)
			;
		then(result.countersAdjusted()).as("Nothing adjusted").isEqualTo(0);
		// @formatter:on
	}

}
