package s10k.counterfix.domain.test;

import static org.assertj.core.api.BDDAssertions.then;

import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import s10k.counterfix.domain.CounterGroup;
import s10k.counterfix.domain.CounterInfo;

/**
 * Test cases for the {@link CounterGroup} class.
 */
public class CounterGroupTests {

	@Test
	public void mainCounter_primaryAndConsumedPreferred() {
		// GIVEN
		// @formatter:off
		CounterGroup group = new CounterGroup("g", ZoneOffset.UTC, List.of(
				  new CounterInfo("produced", Set.of("primary", "produced"))
				, new CounterInfo("consumed", Set.of("primary", "consumed"))
			));
		// @formatter:on

		// THEN
		then(group.mainCounter()).as("Consumed primary counter chosen").map(CounterInfo::id).hasValue("consumed");
	}

	@Test
	public void mainCounter_primaryFallback() {
		// GIVEN
		// @formatter:off
		CounterGroup group = new CounterGroup("g", ZoneOffset.UTC, List.of(
				  new CounterInfo("circuit", Set.of("consumed"))
				, new CounterInfo("net", Set.of("primary"))
			));
		// @formatter:on

		// THEN
		then(group.mainCounter()).as("First primary counter chosen").map(CounterInfo::id).hasValue("net");
	}

	@Test
	public void mainCounter_none() {
		// GIVEN
		CounterGroup group = new CounterGroup("g", ZoneOffset.UTC, List.of(new CounterInfo("circuit", null)));

		// THEN
		then(group.mainCounter()).as("No primary counter").isEmpty();
		then(group.counterIds()).as("Counter IDs").containsExactly("circuit");
	}

}
