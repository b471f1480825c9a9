package s10k.counterfix.support;

import static org.supercsv.prefs.CsvPreference.STANDARD_PREFERENCE;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListWriter;

import s10k.counterfix.domain.CorrectionReport;
import s10k.counterfix.domain.CounterSpikes;
import s10k.counterfix.domain.SpikeDetail;

/**
 * Write the reset spikes of correction reports as CSV.
 */
public final class SpikeReportCsv {

	/** The CSV column names. */
	public static final String[] HEADERS = new String[] { "Group", "Counter", "Timestamp", "Local Timestamp",
			"Previous", "Current", "Delta" };

	private SpikeReportCsv() {
		// not available
	}

	/**
	 * Write the spikes of a set of reports.
	 * 
	 * <p>
	 * One row is written per spike. The group and counter columns are left
	 * empty when they repeat the row above.
	 * </p>
	 * 
	 * @param out     the destination; it is closed when this method returns
	 * @param reports the reports
	 * @return the number of spike rows written
	 * @throws IOException if an IO error occurs
	 */
	public static int write(Writer out, List<CorrectionReport> reports) throws IOException {
		int count = 0;
		try (ICsvListWriter csv = new CsvListWriter(out, STANDARD_PREFERENCE)) {
			csv.writeHeader(HEADERS);
			for (CorrectionReport report : reports) {
				if (report.details() == null) {
					continue;
				}
				boolean repeatGroup = false;
				for (CounterSpikes counter : report.details()) {
					boolean repeatCounter = false;
					for (SpikeDetail spike : counter.spikes()) {
						String[] row = new String[HEADERS.length];
						row[0] = (repeatGroup ? "" : report.groupId());
						row[1] = (repeatCounter ? "" : counter.counterId());
						row[2] = spike.timestampUtc().toString();
						row[3] = spike.timestampLocal().toString();
						row[4] = spike.previousValue().toPlainString();
						row[5] = spike.currentValue().toPlainString();
						row[6] = spike.delta().toPlainString();
						csv.write(row);
						repeatGroup = true;
						repeatCounter = true;
						count++;
					}
				}
			}
		}
		return count;
	}

}
