package s10k.counterfix.domain;

import java.time.LocalDateTime;

/**
 * A request to find, and optionally correct, counter resets in one group.
 * 
 * @param groupId the group ID
 * @param start   the inclusive local start date
 * @param end     the inclusive local end date
 * @param dryRun  {@code true} to only report resets without changing anything
 */
public record CorrectionRequest(String groupId, LocalDateTime start, LocalDateTime end, boolean dryRun) {

	/**
	 * Create a dry-run request.
	 * 
	 * @param groupId the group ID
	 * @param start   the inclusive local start date
	 * @param end     the inclusive local end date
	 * @return the request
	 */
	public static CorrectionRequest preview(String groupId, LocalDateTime start, LocalDateTime end) {
		return new CorrectionRequest(groupId, start, end, true);
	}

	/**
	 * Test if the window is valid.
	 * 
	 * @return {@code true} if both dates are provided and {@code start} is not
	 *         after {@code end}
	 */
	public boolean hasValidWindow() {
		return start != null && end != null && !start.isAfter(end);
	}

}
