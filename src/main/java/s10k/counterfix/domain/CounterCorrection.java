package s10k.counterfix.domain;

import java.util.List;

/**
 * The outcome of correcting the resets of one counter.
 * 
 * @param counterId  the counter ID
 * @param ledger     the adjustments applied, in the order submitted
 * @param iterations the number of query iterations performed
 * @param capReached {@code true} if the iteration limit stopped the correction
 * @param stopped    {@code true} if the correction ended early because a query
 *                   failed or the thread was interrupted
 * @param errors     messages for failed store operations
 */
public record CounterCorrection(String counterId, List<AdjustmentRecord> ledger, int iterations, boolean capReached,
		boolean stopped, List<String> errors) {

	/**
	 * Get the number of adjustments applied.
	 * 
	 * @return the adjustment count
	 */
	public int adjustmentCount() {
		return ledger.size();
	}

	/**
	 * Test if the correction ran to completion without any errors.
	 * 
	 * @return {@code true} if no resets remain and nothing failed
	 */
	public boolean isComplete() {
		return !(capReached || stopped) && errors.isEmpty();
	}

}
