package s10k.counterfix.cmd;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.concurrent.Callable;

import org.springframework.stereotype.Component;

import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import s10k.counterfix.config.AggregateStoreFactory;
import s10k.counterfix.correction.CorrectionSettings;
import s10k.counterfix.correction.ReversalEngine;
import s10k.counterfix.domain.ResetSimulationResult;
import s10k.counterfix.store.AggregateStore;

/**
 * Manufacture a synthetic counter reset, to exercise the cleanup command.
 */
@Component
@Command(name = "simulate-reset", description = "Drop a counter as if its device had reset")
public class SimulateResetCommand implements Callable<Integer> {

	@Mixin
	StoreOptions storeOptions = new StoreOptions();

	@Option(names = { "-h", "--help" }, usageHelp = true, description = "display this help message")
	boolean usageHelpRequested;

	@Option(names = { "-c", "--counter" }, description = "the counter ID to drop", required = true)
	String counterId;

	@Option(names = { "-t", "--time" }, description = "the local reset date", required = true)
	LocalDateTime resetTime;

	@Option(names = { "-z", "--zone" }, description = "the time zone of the reset date")
	ZoneId zone;

	@Option(names = { "--drop" }, description = "the amount to drop by; defaults to dropping to zero")
	BigDecimal dropAmount;

	private final AggregateStoreFactory storeFactory;
	private final CorrectionSettings settings;

	/**
	 * Constructor.
	 * 
	 * @param storeFactory the store factory
	 * @param settings     the correction settings
	 */
	public SimulateResetCommand(AggregateStoreFactory storeFactory, CorrectionSettings settings) {
		super();
		this.storeFactory = storeFactory;
		this.settings = settings;
	}

	@Override
	public Integer call() throws Exception {
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

		final Instant ts = resetTime.atZone(zone != null ? zone : settings.zone()).toInstant();
		final ResetSimulationResult result = new ReversalEngine(store, settings.unit()).simulateReset(counterId, ts,
				dropAmount);
		if (!result.success()) {
			System.out.println(Ansi.AUTO.string("@|red %s|@".formatted(result.error())));
			return 1;
		}
		storeFactory.saveStore(store);
		// @formatter:off
		System.out.print(Ansi.AUTO.string("""
				@|green %s|@
				@|bold Previous sum:|@ %s %s
				@|bold New sum:|@      %s %s
				""".formatted(
						  result.message()
						, result.previousSum().toPlainString()
						, settings.unit()
						, result.newSum().toPlainString()
						, settings.unit()
					)
				));
		// @formatter:on
		return 0;
	}

}
