package s10k.counterfix.domain;

/**
 * Enumeration of live reset monitor states.
 */
public enum MonitorState {

	/** No reset has been observed. */
	Idle,

	/** An alert was raised for the most recent reset. */
	AlertSent,

	;

}
