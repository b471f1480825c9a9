package s10k.counterfix.monitor;

import s10k.counterfix.domain.ResetAlert;

/**
 * API for receiving live counter reset alerts.
 */
@FunctionalInterface
public interface ResetAlertListener {

	/**
	 * Handle an alert.
	 * 
	 * <p>
	 * This is called on the thread that delivered the reading.
	 * </p>
	 * 
	 * @param alert the alert
	 */
	void resetDetected(ResetAlert alert);

}
