package s10k.counterfix.monitor;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import s10k.counterfix.domain.MonitorState;
import s10k.counterfix.domain.ResetAlert;

/**
 * Watch the live readings of one counter and raise an alert whenever a reading
 * is lower than the one before it.
 * 
 * <p>
 * The monitor never touches the aggregate store; it is purely advisory. Missing,
 * {@code unavailable}, {@code unknown} or unparsable readings are ignored.
 * </p>
 */
public class LiveResetMonitor {

	private static final Logger log = LoggerFactory.getLogger(LiveResetMonitor.class);

	private final String groupId;
	private final String counterId;
	private final Clock clock;
	private final List<ResetAlertListener> listeners;

	private MonitorState state = MonitorState.Idle;
	private String lastAlertKey;
	private String lastReading;

	/**
	 * Constructor.
	 * 
	 * @param groupId   the group ID
	 * @param counterId the counter ID to watch
	 * @param clock     the clock to date alerts with
	 * @param listeners the alert listeners
	 */
	public LiveResetMonitor(String groupId, String counterId, Clock clock, List<ResetAlertListener> listeners) {
		super();
		this.groupId = groupId;
		this.counterId = counterId;
		this.clock = (clock != null ? clock : Clock.systemUTC());
		this.listeners = (listeners != null ? List.copyOf(listeners) : List.of());
	}

	/**
	 * Handle a change of the counter reading.
	 * 
	 * <p>
	 * If both readings are numbers and the new one is lower, an alert is
	 * delivered to every listener before this method returns.
	 * </p>
	 * 
	 * @param oldReading the previous reading
	 * @param newReading the new reading
	 * @return the alert raised, or an empty result if the change is not a reset
	 */
	public synchronized Optional<ResetAlert> onStateChange(String oldReading, String newReading) {
		final BigDecimal oldValue = parseReading(oldReading);
		final BigDecimal newValue = parseReading(newReading);
		if (oldValue == null || newValue == null) {
			log.debug("Ignoring unusable readings of {}: old={}, new={}", counterId, oldReading, newReading);
			return Optional.empty();
		}
		if (newValue.compareTo(oldValue) >= 0) {
			state = MonitorState.Idle;
			return Optional.empty();
		}
		final ResetAlert alert = new ResetAlert(groupId, counterId, clock.instant(), oldValue, newValue);
		state = MonitorState.AlertSent;
		lastAlertKey = alert.key();
		for (ResetAlertListener listener : listeners) {
			try {
				listener.resetDetected(alert);
			} catch (RuntimeException e) {
				log.error("Reset alert listener {} failed: {}", listener, e.getMessage(), e);
			}
		}
		return Optional.of(alert);
	}

	/**
	 * Handle a new counter reading, comparing it to the previous one given to
	 * this method.
	 * 
	 * @param reading the new reading
	 * @return the alert raised, or an empty result if the change is not a reset
	 */
	public synchronized Optional<ResetAlert> onReading(String reading) {
		final String previous = lastReading;
		lastReading = reading;
		if (previous == null) {
			return Optional.empty();
		}
		return onStateChange(previous, reading);
	}

	/**
	 * Parse a counter reading.
	 * 
	 * @param reading the reading
	 * @return the value, or {@code null} if the reading is not a number
	 */
	public static BigDecimal parseReading(String reading) {
		if (reading == null) {
			return null;
		}
		String s = reading.trim();
		if (s.isEmpty() || "unavailable".equalsIgnoreCase(s) || "unknown".equalsIgnoreCase(s)) {
			return null;
		}
		try {
			return new BigDecimal(s);
		} catch (NumberFormatException e) {
			return null;
		}
	}

	/**
	 * Get the group ID.
	 * 
	 * @return the group ID
	 */
	public String groupId() {
		return groupId;
	}

	/**
	 * Get the watched counter ID.
	 * 
	 * @return the counter ID
	 */
	public String counterId() {
		return counterId;
	}

	/**
	 * Get the current state.
	 * 
	 * @return the state
	 */
	public synchronized MonitorState state() {
		return state;
	}

	/**
	 * Get the key of the last alert raised.
	 * 
	 * @return the key, or {@code null} if no alert was raised
	 */
	public synchronized String lastAlertKey() {
		return lastAlertKey;
	}

}
