package s10k.counterfix.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import s10k.counterfix.domain.ResetAlert;

/**
 * Log reset alerts as warnings.
 */
public class LoggingResetAlertListener implements ResetAlertListener {

	private static final Logger log = LoggerFactory.getLogger(LoggingResetAlertListener.class);

	@Override
	public void resetDetected(ResetAlert alert) {
		log.warn("Counter reset detected on {} ({}): value decreased from {} to {} (delta: {})", alert.counterId(),
				alert.groupId(), alert.oldValue().toPlainString(), alert.newValue().toPlainString(),
				alert.delta().toPlainString());
	}

}
