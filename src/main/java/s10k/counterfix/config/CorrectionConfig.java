package s10k.counterfix.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import s10k.counterfix.correction.CorrectionSettings;
import s10k.counterfix.correction.CounterGroupResolver;
import s10k.counterfix.monitor.LiveResetMonitorRegistry;
import s10k.counterfix.support.Pause;

/**
 * Counter reset correction configuration.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(CorrectionProperties.class)
public class CorrectionConfig {

	@Bean
	public CorrectionSettings correctionSettings(CorrectionProperties props) {
		return props.toSettings();
	}

	@Bean
	public CounterGroupResolver counterGroupResolver(CorrectionProperties props, CorrectionSettings settings) {
		return new ConfiguredCounterGroupResolver(props, settings.zone());
	}

	@Bean
	public Pause commitPause() {
		return Pause.SLEEP;
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public LiveResetMonitorRegistry liveResetMonitorRegistry(Clock clock) {
		return new LiveResetMonitorRegistry(clock);
	}

}
