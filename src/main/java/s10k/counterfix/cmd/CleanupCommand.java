package s10k.counterfix.cmd;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import s10k.counterfix.config.AggregateStoreFactory;
import s10k.counterfix.correction.CorrectionSessionRunner;
import s10k.counterfix.correction.CorrectionSettings;
import s10k.counterfix.correction.CounterGroupResolver;
import s10k.counterfix.correction.SpikeCorrector;
import s10k.counterfix.domain.CorrectionReport;
import s10k.counterfix.domain.CorrectionRequest;
import s10k.counterfix.domain.CounterSpikes;
import s10k.counterfix.domain.ResetTimestamp;
import s10k.counterfix.domain.SpikeDetail;
import s10k.counterfix.store.AggregateStore;
import s10k.counterfix.support.Pause;
import s10k.counterfix.support.SpikeReportCsv;

/**
 * Find and correct counter reset spikes in one or more counter groups.
 */
@Component
@Command(name = "cleanup", description = "Find and correct counter reset spikes")
public class CleanupCommand implements Callable<Integer> {

	private static final Logger log = LoggerFactory.getLogger(CleanupCommand.class);

	static final String DRY_RUN_PREFIX = "@|blue [Dry run]|@";

	/** The time interrupted tasks get to stop and hand back their partial reports. */
	static final long CANCEL_WAIT_SECS = 30L;

	@Mixin
	StoreOptions storeOptions = new StoreOptions();

	@Option(names = { "-h", "--help" }, usageHelp = true, description = "display this help message")
	boolean usageHelpRequested;

	@Option(names = { "-g",
			"--group" }, description = "a counter group ID to clean up", required = true, split = "\\s*,\\s*", splitSynopsisLabel = ",")
	String[] groupIds;

	@Option(names = { "--start" }, description = "the local start date, inclusive", required = true)
	LocalDateTime start;

	@Option(names = { "--end" }, description = "the local end date, inclusive", required = true)
	LocalDateTime end;

	@Option(names = { "--apply" }, description = "apply the corrections, instead of a dry run")
	boolean apply;

	@Option(names = { "-o", "--output-file" }, description = "path to write the JSON report")
	Path outputFile;

	@Option(names = { "-r", "--report-file" }, description = "path to write CSV spike data")
	String reportFileName;

	@Option(names = { "-j", "--threads" }, description = "number of concurrent threads", defaultValue = "1")
	int threadCount = 1;

	@Option(names = { "-w",
			"--max-wait" }, description = "maximum time to wait for cleanup to complete", defaultValue = "PT30M")
	Duration maxWait = Duration.ofMinutes(30L);

	private final AggregateStoreFactory storeFactory;
	private final CounterGroupResolver groupResolver;
	private final CorrectionSettings settings;
	private final Pause pause;
	private final ObjectMapper objectMapper;

	/**
	 * Constructor.
	 * 
	 * @param storeFactory  the store factory
	 * @param groupResolver the group resolver
	 * @param settings      the correction settings
	 * @param pause         the pause to wait for adjustments to commit with
	 * @param objectMapper  the mapper to write reports with
	 */
	public CleanupCommand(AggregateStoreFactory storeFactory, CounterGroupResolver groupResolver,
			CorrectionSettings settings, Pause pause, ObjectMapper objectMapper) {
		super();
		this.storeFactory = storeFactory;
		this.groupResolver = groupResolver;
		this.settings = settings;
		this.pause = pause;
		this.objectMapper = objectMapper;
	}

	@Override
	public Integer call() throws Exception {
		final boolean dryRun = !apply;
		final AggregateStore store;
		try {
			store = storeOptions.createStore(storeFactory);
		} catch (IOException e) {
			// @formatter:off
			System.out.print(Ansi.AUTO.string("""
					@|red Error loading statistics:|@ %s
					""".formatted(e.getMessage())));
			// @formatter:on
			return 1;
		}

		final CorrectionSessionRunner runner = new CorrectionSessionRunner(groupResolver, store,
				new SpikeCorrector(store, settings, pause), settings);

		final Map<String, Future<CorrectionReport>> taskResults = new LinkedHashMap<>(groupIds.length);
		final ExecutorService threadPool = (threadCount > 1 ? Executors.newFixedThreadPool(threadCount)
				: Executors.newSingleThreadExecutor());
		try {
			for (String groupId : groupIds) {
				if (taskResults.containsKey(groupId)) {
					continue;
				}
				if (storeOptions.isVerbose()) {
					System.out.println(Ansi.AUTO.string("%s Cleanup starting".formatted(groupPrefix(groupId))));
				}
				taskResults.put(groupId,
						threadPool.submit(() -> runner.run(new CorrectionRequest(groupId, start, end, dryRun))));
			}
			threadPool.shutdown();
			boolean finished = threadPool.awaitTermination(maxWait.toSeconds(), TimeUnit.SECONDS);
			if (!finished) {
				System.out.println("Cleanup tasks did not complete within %ds.".formatted(maxWait.toSeconds()));
				// interrupted tasks stop after their current adjustment and still return their ledger
				threadPool.shutdownNow();
				if (!threadPool.awaitTermination(CANCEL_WAIT_SECS, TimeUnit.SECONDS)) {
					log.error("Cleanup tasks did not stop within {}s of being cancelled", CANCEL_WAIT_SECS);
				}
			}
		} finally {
			threadPool.shutdownNow();
		}

		final List<CorrectionReport> reports = new ArrayList<>(taskResults.size());
		for (Entry<String, Future<CorrectionReport>> e : taskResults.entrySet()) {
			final String groupId = e.getKey();
			final Future<CorrectionReport> taskResult = e.getValue();
			if (!taskResult.isDone()) {
				reports.add(CorrectionReport.failed(dryRun, groupId, 0, "Cleanup did not complete in time"));
				continue;
			}
			try {
				reports.add(taskResult.get());
			} catch (CancellationException | ExecutionException ex) {
				Throwable cause = (ex instanceof ExecutionException ? ex.getCause() : ex);
				log.error("Cleanup of group {} failed", groupId, cause);
				reports.add(CorrectionReport.failed(dryRun, groupId, 0, "Cleanup task failed: " + cause));
			}
		}

		boolean errors = false;
		for (CorrectionReport report : reports) {
			printReport(report);
			if (report.hasError()) {
				errors = true;
			}
		}

		if (outputFile != null) {
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputFile.toFile(),
					reports.size() == 1 ? reports.get(0) : reports);
			System.out.println("Report written to " + outputFile);
		}
		if (reportFileName != null) {
			int rows = SpikeReportCsv.write(new FileWriter(reportFileName, UTF_8), reports);
			System.out.println("%d spike(s) written to %s".formatted(rows, reportFileName));
		}
		if (!dryRun) {
			storeFactory.saveStore(store);
		}

		return (errors ? 1 : 0);
	}

	private void printReport(CorrectionReport report) {
		final String prefix = groupPrefix(report.groupId()) + (report.dryRun() ? " " + DRY_RUN_PREFIX : "");
		if (report.hasError()) {
			System.out.println(Ansi.AUTO.string("%s @|red %s|@".formatted(prefix, report.error())));
		}
		if (report.resetTimestamps() != null && !report.resetTimestamps().isEmpty()) {
			// @formatter:off
			System.out.print(Ansi.AUTO.string("""
					%s @|red %d|@ reset(s) found on @|bold %s|@
					""".formatted(
							  prefix
							, report.resetTimestamps().size()
							, report.mainCounterId()
						)
					));
			// @formatter:on
			if (storeOptions.isVerbose()) {
				for (ResetTimestamp ts : report.resetTimestamps()) {
					System.out.println(Ansi.AUTO.string("%s   %s (%s)".formatted(prefix, ts.local(), ts.utc())));
				}
			}
		}
		if (report.details() != null) {
			for (CounterSpikes counter : report.details()) {
				System.out.println(Ansi.AUTO.string("%s @|yellow %s|@ %d spike(s)".formatted(prefix,
						counter.counterId(), counter.spikes().size())));
				if (storeOptions.isVerbose()) {
					for (SpikeDetail spike : counter.spikes()) {
						System.out.println("  %s: %s -> %s (%s)".formatted(spike.timestampLocal(),
								spike.previousValue().toPlainString(), spike.currentValue().toPlainString(),
								spike.delta().toPlainString()));
					}
				}
			}
		}
		if (report.warnings() != null) {
			for (String warning : report.warnings()) {
				System.out.println(Ansi.AUTO.string("%s @|yellow Warning:|@ %s".formatted(prefix, warning)));
			}
		}
		if (report.message() != null) {
			if (report.adjustmentCount() > 0) {
				System.out.println(Ansi.AUTO.string("%s @|green %s|@".formatted(prefix, report.message())));
			} else {
				System.out.println(Ansi.AUTO.string("%s %s".formatted(prefix, report.message())));
			}
		}
	}

	private static String groupPrefix(String groupId) {
		return "[@|yellow %s|@]".formatted(groupId);
	}

}
