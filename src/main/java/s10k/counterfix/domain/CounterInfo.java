package s10k.counterfix.domain;

import java.util.Set;

/**
 * A counter belonging to a group, with descriptive tags.
 * 
 * @param id   the counter ID, as known to the aggregate store
 * @param tags the tags, for example {@code primary} or {@code consumed}
 */
public record CounterInfo(String id, Set<String> tags) {

	/** Tag for the counter measuring the whole group. */
	public static final String PRIMARY_TAG = "primary";

	/** Tag for a counter measuring consumed energy. */
	public static final String CONSUMED_TAG = "consumed";

	/**
	 * Constructor.
	 */
	public CounterInfo {
		tags = (tags == null ? Set.of() : Set.copyOf(tags));
	}

	/**
	 * Test if a tag is present.
	 * 
	 * @param tag the tag
	 * @return {@code true} if {@code tag} is one of this counter's tags
	 */
	public boolean hasTag(String tag) {
		return tags.contains(tag);
	}

}
