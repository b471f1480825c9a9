package s10k.counterfix.support;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

import s10k.counterfix.domain.AdjustmentRecord;
import s10k.counterfix.domain.LedgerEntries;

/**
 * Decode the adjustment ledger out of a previously written correction report.
 */
public final class LedgerJson {

	/** The report property holding the ledger. */
	public static final String ADJUSTMENTS_PROP = "adjustments";

	private LedgerJson() {
		// not available
	}

	/**
	 * Decode the adjustments of a correction report.
	 * 
	 * <p>
	 * Entries missing a counter ID, timestamp, or adjustment amount, or with an
	 * unparsable timestamp, are returned as errors rather than records. An array
	 * of reports, as written for a multi-group run, is decoded into a single
	 * combined ledger.
	 * </p>
	 * 
	 * @param report      the report JSON
	 * @param defaultUnit the unit to use for entries that do not specify one
	 * @return the decoded entries
	 */
	public static LedgerEntries parseLedger(JsonNode report, String defaultUnit) {
		if (report != null && report.isArray()) {
			List<AdjustmentRecord> records = new ArrayList<>(8);
			List<String> errors = new ArrayList<>(2);
			for (JsonNode r : report) {
				LedgerEntries entries = parseLedger(r, defaultUnit);
				records.addAll(entries.records());
				errors.addAll(entries.errors());
			}
			return new LedgerEntries(records, errors);
		}
		JsonNode adjustments = (report != null ? report.path(ADJUSTMENTS_PROP) : null);
		if (adjustments == null || !adjustments.isArray()) {
			return new LedgerEntries(List.of(), List.of());
		}
		List<AdjustmentRecord> records = new ArrayList<>(adjustments.size());
		List<String> errors = new ArrayList<>(2);
		for (JsonNode entry : adjustments) {
			String counterId = entry.path("counter_id").textValue();
			String ts = entry.path("timestamp").textValue();
			JsonNode amount = entry.path("adjustment");
			if (counterId == null || counterId.isBlank() || ts == null || !amount.isNumber()) {
				errors.add("Invalid adjustment record: " + entry);
				continue;
			}
			final Instant timestamp;
			try {
				timestamp = Instant.parse(ts);
			} catch (DateTimeParseException e) {
				errors.add("Error parsing timestamp %s: %s".formatted(ts, e.getMessage()));
				continue;
			}
			String unit = entry.path("unit").textValue();
			BigDecimal value = amount.decimalValue();
			records.add(new AdjustmentRecord(counterId, timestamp, value, unit != null ? unit : defaultUnit));
		}
		return new LedgerEntries(records, errors);
	}

}
