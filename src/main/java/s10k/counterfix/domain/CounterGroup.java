package s10k.counterfix.domain;

import static s10k.counterfix.domain.CounterInfo.CONSUMED_TAG;
import static s10k.counterfix.domain.CounterInfo.PRIMARY_TAG;

import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A set of counters that belong to one physical device.
 * 
 * @param id       the group ID
 * @param zone     the local time zone of the device
 * @param counters the counters
 */
public record CounterGroup(String id, ZoneId zone, List<CounterInfo> counters) {

	/**
	 * Constructor.
	 */
	public CounterGroup {
		counters = (counters == null ? List.of() : List.copyOf(counters));
	}

	/**
	 * Find the counter used to detect resets for the whole group.
	 * 
	 * <p>
	 * The first counter tagged both {@code primary} and {@code consumed} is
	 * preferred, falling back to the first counter tagged {@code primary}.
	 * </p>
	 * 
	 * @return the main counter
	 */
	public Optional<CounterInfo> mainCounter() {
		Optional<CounterInfo> result = counters.stream().filter(c -> c.hasTag(PRIMARY_TAG) && c.hasTag(CONSUMED_TAG))
				.findFirst();
		if (result.isEmpty()) {
			result = counters.stream().filter(c -> c.hasTag(PRIMARY_TAG)).findFirst();
		}
		return result;
	}

	/**
	 * Get the IDs of all counters.
	 * 
	 * @return the counter IDs, in group order
	 */
	public Set<String> counterIds() {
		var result = new LinkedHashSet<String>(counters.size());
		for (CounterInfo counter : counters) {
			result.add(counter.id());
		}
		return result;
	}

}
