package s10k.counterfix.domain;

import java.time.Instant;
import java.util.List;

/**
 * The outcome of scanning one counter's aggregates for resets.
 * 
 * @param events    the resets found, in time order
 * @param corrupted the start dates of aggregates with negative sums, which are
 *                  never corrected
 */
public record ResetScan(List<ResetEvent> events, List<Instant> corrupted) {

	/** An empty scan. */
	public static final ResetScan EMPTY = new ResetScan(List.of(), List.of());

	/**
	 * Test if any resets were found.
	 * 
	 * @return {@code true} if {@code events} is not empty
	 */
	public boolean hasResets() {
		return !events.isEmpty();
	}

}
