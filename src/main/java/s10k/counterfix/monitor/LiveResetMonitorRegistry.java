package s10k.counterfix.monitor;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of live reset monitors, at most one per counter group.
 */
public class LiveResetMonitorRegistry {

	private static final Logger log = LoggerFactory.getLogger(LiveResetMonitorRegistry.class);

	private final ConcurrentMap<String, LiveResetMonitor> monitors = new ConcurrentHashMap<>(4);
	private final Clock clock;

	/**
	 * Constructor.
	 * 
	 * @param clock the clock to date alerts with
	 */
	public LiveResetMonitorRegistry(Clock clock) {
		super();
		this.clock = clock;
	}

	/**
	 * Create a monitor for a group, replacing any existing one.
	 * 
	 * @param groupId   the group ID
	 * @param counterId the counter to watch
	 * @param listeners the alert listeners
	 * @return the new monitor
	 */
	public LiveResetMonitor create(String groupId, String counterId, List<ResetAlertListener> listeners) {
		LiveResetMonitor monitor = new LiveResetMonitor(groupId, counterId, clock, listeners);
		LiveResetMonitor old = monitors.put(groupId, monitor);
		if (old != null) {
			log.info("Replaced reset monitor for group {} on {} with {}", groupId, old.counterId(), counterId);
		} else {
			log.info("Set up reset monitor for group {} on {}", groupId, counterId);
		}
		return monitor;
	}

	/**
	 * Find the monitor of a group.
	 * 
	 * @param groupId the group ID
	 * @return the monitor, or an empty result if none exists
	 */
	public Optional<LiveResetMonitor> find(String groupId) {
		return Optional.ofNullable(monitors.get(groupId));
	}

	/**
	 * Remove the monitor of a group.
	 * 
	 * @param groupId the group ID
	 * @return {@code true} if a monitor was removed
	 */
	public boolean remove(String groupId) {
		LiveResetMonitor removed = monitors.remove(groupId);
		if (removed != null) {
			log.info("Removed reset monitor for group {}", groupId);
		}
		return removed != null;
	}

	/**
	 * Get the IDs of all groups with a monitor.
	 * 
	 * @return the group IDs, sorted
	 */
	public Set<String> groupIds() {
		return new TreeSet<>(monitors.keySet());
	}

	/**
	 * Remove all monitors.
	 */
	public void clear() {
		monitors.clear();
	}

}
