package s10k.counterfix.domain;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The result of a reset correction run on one counter group.
 * 
 * @param dryRun            {@code true} if no changes were made
 * @param groupId           the group ID
 * @param mainCounterId     the counter used to detect resets, or {@code null}
 *                          if not resolved
 * @param countersProcessed the number of counters in the group
 * @param resetTimestamps   the resets found on the main counter within the
 *                          requested window
 * @param countersAdjusted  the number of counters that had at least one
 *                          adjustment applied
 * @param details           the resets found per counter
 * @param adjustments       the applied adjustments, or {@code null} if nothing
 *                          was applied
 * @param warnings          problems that affected individual counters, or
 *                          {@code null}
 * @param message           a summary message, or {@code null}
 * @param error             an error message, or {@code null}
 */
@JsonInclude(Include.NON_NULL)
@JsonPropertyOrder({ "dry_run", "group_id", "main_counter_id", "counters_processed", "reset_timestamps",
		"counters_adjusted", "details", "adjustments", "warnings", "message", "error" })
public record CorrectionReport(boolean dryRun, String groupId, String mainCounterId, int countersProcessed,
		List<ResetTimestamp> resetTimestamps, int countersAdjusted, List<CounterSpikes> details,
		List<AdjustmentRecord> adjustments, List<String> warnings, String message, String error) {

	/**
	 * Create an empty report for a run that could not be performed.
	 * 
	 * @param dryRun            the dry run mode
	 * @param groupId           the group ID
	 * @param countersProcessed the number of counters processed
	 * @param error             the error message
	 * @return the report
	 */
	public static CorrectionReport failed(boolean dryRun, String groupId, int countersProcessed, String error) {
		return new CorrectionReport(dryRun, groupId, null, countersProcessed, List.of(), 0, List.of(), null, null,
				null, error);
	}

	/**
	 * Test if an error is present.
	 * 
	 * @return {@code true} if {@code error} is not {@code null}
	 */
	public boolean hasError() {
		return error != null;
	}

	/**
	 * Get the total number of adjustments applied.
	 * 
	 * @return the adjustment count
	 */
	public int adjustmentCount() {
		return (adjustments != null ? adjustments.size() : 0);
	}

}
