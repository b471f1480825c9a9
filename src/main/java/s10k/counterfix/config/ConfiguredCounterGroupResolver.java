package s10k.counterfix.config;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import s10k.counterfix.correction.CounterGroupResolver;
import s10k.counterfix.domain.CounterGroup;
import s10k.counterfix.domain.CounterInfo;

/**
 * Resolve counter groups from {@link CorrectionProperties}.
 */
public class ConfiguredCounterGroupResolver implements CounterGroupResolver {

	private final CorrectionProperties props;
	private final ZoneId defaultZone;

	/**
	 * Constructor.
	 * 
	 * @param props       the properties
	 * @param defaultZone the zone to use for groups without one
	 */
	public ConfiguredCounterGroupResolver(CorrectionProperties props, ZoneId defaultZone) {
		super();
		this.props = props;
		this.defaultZone = defaultZone;
	}

	@Override
	public Optional<CounterGroup> findGroup(String groupId) {
		if (groupId == null) {
			return Optional.empty();
		}
		for (CorrectionProperties.GroupProperties group : props.getGroups()) {
			if (groupId.equals(group.getId())) {
				return Optional.of(toGroup(group));
			}
		}
		return Optional.empty();
	}

	private CounterGroup toGroup(CorrectionProperties.GroupProperties group) {
		List<CounterInfo> counters = new ArrayList<>(group.getCounters().size());
		for (CorrectionProperties.CounterProperties counter : group.getCounters()) {
			if (counter.getId() != null && !counter.getId().isBlank()) {
				counters.add(new CounterInfo(counter.getId(), counter.getTags()));
			}
		}
		ZoneId zone = (group.getZone() != null && !group.getZone().isBlank() ? ZoneId.of(group.getZone())
				: defaultZone);
		return new CounterGroup(group.getId(), zone, counters);
	}

}
