package s10k.counterfix.domain;

import java.util.List;

/**
 * Adjustment records decoded from a previous correction report.
 * 
 * @param records the valid records
 * @param errors  messages for entries that could not be decoded
 */
public record LedgerEntries(List<AdjustmentRecord> records, List<String> errors) {

	/**
	 * Get the total number of entries, valid or not.
	 * 
	 * @return the entry count
	 */
	public int size() {
		return records.size() + errors.size();
	}

}
