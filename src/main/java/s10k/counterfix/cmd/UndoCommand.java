package s10k.counterfix.cmd;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import s10k.counterfix.config.AggregateStoreFactory;
import s10k.counterfix.correction.CorrectionSettings;
import s10k.counterfix.correction.ReversalEngine;
import s10k.counterfix.domain.LedgerEntries;
import s10k.counterfix.domain.ReversalReport;
import s10k.counterfix.store.AggregateStore;
import s10k.counterfix.support.LedgerJson;

/**
 * Reverse the adjustments recorded in a cleanup report.
 */
@Component
@Command(name = "undo", description = "Reverse the adjustments of a cleanup report")
public class UndoCommand implements Callable<Integer> {

	@Mixin
	StoreOptions storeOptions = new StoreOptions();

	@Option(names = { "-h", "--help" }, usageHelp = true, description = "display this help message")
	boolean usageHelpRequested;

	@Option(names = { "-f", "--file" }, description = "the cleanup report JSON file", required = true)
	Path reportFile;

	@Option(names = { "-o", "--output-file" }, description = "path to write the JSON reversal report")
	Path outputFile;

	private final AggregateStoreFactory storeFactory;
	private final CorrectionSettings settings;
	private final ObjectMapper objectMapper;

	/**
	 * Constructor.
	 * 
	 * @param storeFactory the store factory
	 * @param settings     the correction settings
	 * @param objectMapper the mapper
	 */
	public UndoCommand(AggregateStoreFactory storeFactory, CorrectionSettings settings, ObjectMapper objectMapper) {
		super();
		this.storeFactory = storeFactory;
		this.settings = settings;
		this.objectMapper = objectMapper;
	}

	@Override
	public Integer call() throws Exception {
		final LedgerEntries entries;
		final AggregateStore store;
		try {
			JsonNode report = objectMapper.readTree(reportFile.toFile());
			entries = LedgerJson.parseLedger(report, settings.unit());
			store = storeOptions.createStore(storeFactory);
		} catch (IOException e) {
			// @formatter:off
			System.out.print(Ansi.AUTO.string("""
					@|red Error reading %s:|@ %s
					""".formatted(reportFile, e.getMessage())));
			// @formatter:on
			return 1;
		}

		final ReversalReport result = new ReversalEngine(store, settings.unit()).reverse(entries);
		if (result.errors() != null) {
			for (String error : result.errors()) {
				System.out.println(Ansi.AUTO.string("@|yellow Warning:|@ " + error));
			}
		}
		if (result.error() != null) {
			System.out.println(Ansi.AUTO.string("@|red %s|@".formatted(result.error())));
		} else {
			System.out.println(Ansi.AUTO.string("@|green %s|@".formatted(result.message())));
		}
		if (result.reversedCount() > 0) {
			storeFactory.saveStore(store);
		}
		if (outputFile != null) {
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputFile.toFile(), result);
		}
		return (result.error() != null ? 1 : 0);
	}

}
