package s10k.counterfix.cmd;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.springframework.stereotype.Component;

import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import s10k.counterfix.correction.CorrectionSettings;
import s10k.counterfix.correction.CounterGroupResolver;
import s10k.counterfix.domain.CounterGroup;
import s10k.counterfix.domain.CounterInfo;
import s10k.counterfix.domain.ResetAlert;
import s10k.counterfix.monitor.LiveResetMonitor;
import s10k.counterfix.monitor.LiveResetMonitorRegistry;
import s10k.counterfix.monitor.LoggingResetAlertListener;

/**
 * Watch a stream of live counter readings and report resets as they happen.
 */
@Component
@Command(name = "monitor", description = "Watch live counter readings for resets")
public class MonitorCommand implements Callable<Integer> {

	@Option(names = { "-h", "--help" }, usageHelp = true, description = "display this help message")
	boolean usageHelpRequested;

	@Option(names = { "-g", "--group" }, description = "the counter group ID", required = true)
	String groupId;

	@Option(names = { "-c",
			"--counter" }, description = "the counter ID to watch; defaults to the main counter of the group")
	String counterId;

	@Option(names = { "-f", "--file" }, description = "a file of readings, one per line; defaults to standard input")
	Path readingsFile;

	private final CounterGroupResolver groupResolver;
	private final LiveResetMonitorRegistry registry;
	private final CorrectionSettings settings;

	/**
	 * Constructor.
	 * 
	 * @param groupResolver the group resolver
	 * @param registry      the monitor registry
	 * @param settings      the correction settings
	 */
	public MonitorCommand(CounterGroupResolver groupResolver, LiveResetMonitorRegistry registry,
			CorrectionSettings settings) {
		super();
		this.groupResolver = groupResolver;
		this.registry = registry;
		this.settings = settings;
	}

	@Override
	public Integer call() throws Exception {
		String watchId = counterId;
		if (watchId == null) {
			watchId = groupResolver.findGroup(groupId).flatMap(CounterGroup::mainCounter).map(CounterInfo::id)
					.orElse(null);
			if (watchId == null) {
				System.out.println(Ansi.AUTO.string("@|red No main counter found in group %s|@".formatted(groupId)));
				return 1;
			}
		}

		final LiveResetMonitor monitor = registry.create(groupId, watchId, List.of(new LoggingResetAlertListener(),
				alert -> System.out.println(Ansi.AUTO.string("@|red,bold %s|@%n%s".formatted(alert.title(),
						alert.message(settings.unit()))))));
		System.out.println(Ansi.AUTO.string("Monitoring @|yellow %s|@ in group @|yellow %s|@".formatted(watchId,
				groupId)));

		int readings = 0;
		int alerts = 0;
		try (BufferedReader in = (readingsFile != null ? Files.newBufferedReader(readingsFile, UTF_8)
				: new BufferedReader(new InputStreamReader(System.in, UTF_8)))) {
			String line;
			while ((line = in.readLine()) != null) {
				if (line.isBlank()) {
					continue;
				}
				readings++;
				Optional<ResetAlert> alert = monitor.onReading(line);
				if (alert.isPresent()) {
					alerts++;
				}
			}
		} catch (IOException e) {
			System.out.println(Ansi.AUTO.string("@|red Error reading readings:|@ " + e.getMessage()));
			return 1;
		} finally {
			registry.remove(groupId);
		}

		System.out.println("%d reading(s) processed, %d reset(s) detected.".formatted(readings, alerts));
		return 0;
	}

}
