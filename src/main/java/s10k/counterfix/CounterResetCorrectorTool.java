package s10k.counterfix;

import org.springframework.boot.Banner.Mode;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

import picocli.CommandLine;
import picocli.CommandLine.IFactory;
import s10k.counterfix.cmd.CounterFixCommand;

/**
 * Counter reset detection and correction command-line tool.
 */
@SpringBootApplication
public class CounterResetCorrectorTool implements CommandLineRunner, ExitCodeGenerator {

	private final IFactory factory;
	private final CounterFixCommand command;

	private int exitCode;

	/**
	 * Constructor.
	 * 
	 * @param factory the command factory
	 * @param command the command
	 */
	public CounterResetCorrectorTool(IFactory factory, CounterFixCommand command) {
		super();
		this.factory = factory;
		this.command = command;
	}

	@Override
	public void run(String... args) throws Exception {
		exitCode = new CommandLine(command, factory).execute(args);
	}

	@Override
	public int getExitCode() {
		return exitCode;
	}

	/**
	 * Main entry point.
	 * 
	 * @param args the arguments
	 */
	public static final void main(String[] args) {
		System.exit(SpringApplication.exit(new SpringApplicationBuilder().sources(CounterResetCorrectorTool.class)
				.web(WebApplicationType.NONE).logStartupInfo(false).bannerMode(Mode.OFF).build().run(args)));
	}

}
