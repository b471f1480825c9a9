package s10k.counterfix.correction;

import java.util.Optional;

import s10k.counterfix.domain.CounterGroup;

/**
 * API for resolving the counters that belong to a group.
 */
@FunctionalInterface
public interface CounterGroupResolver {

	/**
	 * Find a group.
	 * 
	 * @param groupId the group ID
	 * @return the group, or an empty result if not known
	 */
	Optional<CounterGroup> findGroup(String groupId);

}
