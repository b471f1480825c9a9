package s10k.counterfix.monitor.test;

import static org.assertj.core.api.BDDAssertions.then;

import java.time.Clock;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import s10k.counterfix.monitor.LiveResetMonitor;
import s10k.counterfix.monitor.LiveResetMonitorRegistry;
import s10k.counterfix.monitor.LoggingResetAlertListener;

/**
 * Test cases for the {@link LiveResetMonitorRegistry} class.
 */
public class LiveResetMonitorRegistryTests {

	private LiveResetMonitorRegistry registry;

	@BeforeEach
	public void setup() {
		registry = new LiveResetMonitorRegistry(Clock.systemUTC());
	}

	@Test
	public void create_find() {
		// WHEN
		LiveResetMonitor monitor = registry.create("panel1", "c1", List.of(new LoggingResetAlertListener()));

		// THEN
		then(registry.find("panel1")).as("Monitor found").containsSame(monitor);
		then(registry.find("panel2")).as("Other group not found").isEmpty();
		then(registry.groupIds()).as("Group IDs").containsExactly("panel1");
	}

	@Test
	public void create_replaces() {
		// GIVEN
		registry.create("panel1", "c1", List.of());

		// WHEN
		LiveResetMonitor monitor = registry.create("panel1", "c2", List.of());

		// THEN
		then(registry.find("panel1")).as("Replaced monitor found").containsSame(monitor);
		then(monitor.counterId()).as("New counter watched").isEqualTo("c2");
		then(registry.groupIds()).as("Still one group").hasSize(1);
	}

	@Test
	public void remove_clear() {
		// GIVEN
		registry.create("panel1", "c1", List.of());
		registry.create("panel2", "c1", List.of());

		// WHEN
		boolean removed = registry.remove("panel1");
		boolean removedAgain = registry.remove("panel1");

		// THEN
		then(removed).as("Removed").isTrue();
		then(removedAgain).as("Nothing to remove").isFalse();
		then(registry.groupIds()).as("Remaining").containsExactly("panel2");

		// WHEN
		registry.clear();

		// THEN
		then(registry.groupIds()).as("All cleared").isEmpty();
	}

}
