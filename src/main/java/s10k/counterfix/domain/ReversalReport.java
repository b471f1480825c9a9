package s10k.counterfix.domain;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;

/**
 * The result of reversing a ledger of adjustments.
 * 
 * @param success          {@code true} if at least one adjustment was
 *                         reversed
 * @param reversedCount    the number of adjustments reversed
 * @param totalAdjustments the number of ledger entries
 * @param errors           the per-entry errors, or {@code null}
 * @param message          a summary message, or {@code null}
 * @param error            an error summary, or {@code null}
 */
@JsonInclude(Include.NON_NULL)
public record ReversalReport(boolean success, int reversedCount, int totalAdjustments, List<String> errors,
		String message, String error) {

}
