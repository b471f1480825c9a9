package s10k.counterfix.cmd;

import org.springframework.stereotype.Component;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command grouping the counter reset tools.
 */
@Component
@Command(name = "counterfix", mixinStandardHelpOptions = true, version = "1.0.0", description = "Detect and correct cumulative counter resets in aggregate statistics", subcommands = {
		CleanupCommand.class, UndoCommand.class, SimulateResetCommand.class, MonitorCommand.class })
public class CounterFixCommand implements Runnable {

	@Spec
	CommandSpec spec;

	@Override
	public void run() {
		spec.commandLine().usage(System.out);
	}

}
