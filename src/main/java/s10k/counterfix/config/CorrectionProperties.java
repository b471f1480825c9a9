package s10k.counterfix.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import s10k.counterfix.correction.CorrectionSettings;
import s10k.counterfix.domain.Granularity;

/**
 * Counter reset correction configuration, bound from the {@code counterfix}
 * properties.
 */
@ConfigurationProperties(prefix = "counterfix")
public class CorrectionProperties {

	private String zone;
	private String granularity = Granularity.Hour.key();
	private String unit = CorrectionSettings.DEFAULT_UNIT;
	private Correction correction = new Correction();
	private Store store = new Store();
	private List<GroupProperties> groups = new ArrayList<>();

	/**
	 * Create correction settings from these properties.
	 * 
	 * @return the settings
	 * @throws IllegalArgumentException if the granularity or zone is not valid
	 */
	public CorrectionSettings toSettings() {
		// @formatter:off
		return new CorrectionSettings(
				Granularity.forKey(granularity),
				unit,
				zone != null && !zone.isBlank() ? ZoneId.of(zone) : null,
				correction.getCommitDelay(),
				correction.getMaxIterations(),
				correction.isEstimateMissingEnergy());
		// @formatter:on
	}

	public String getZone() {
		return zone;
	}

	public void setZone(String zone) {
		this.zone = zone;
	}

	public String getGranularity() {
		return granularity;
	}

	public void setGranularity(String granularity) {
		this.granularity = granularity;
	}

	public String getUnit() {
		return unit;
	}

	public void setUnit(String unit) {
		this.unit = unit;
	}

	public Correction getCorrection() {
		return correction;
	}

	public void setCorrection(Correction correction) {
		this.correction = correction;
	}

	public Store getStore() {
		return store;
	}

	public void setStore(Store store) {
		this.store = store;
	}

	public List<GroupProperties> getGroups() {
		return groups;
	}

	public void setGroups(List<GroupProperties> groups) {
		this.groups = groups;
	}

	/**
	 * Correction loop settings.
	 */
	public static class Correction {

		private Duration commitDelay = CorrectionSettings.DEFAULT_COMMIT_DELAY;
		private int maxIterations = CorrectionSettings.DEFAULT_MAX_ITERATIONS;
		private boolean estimateMissingEnergy = true;

		public Duration getCommitDelay() {
			return commitDelay;
		}

		public void setCommitDelay(Duration commitDelay) {
			this.commitDelay = commitDelay;
		}

		public int getMaxIterations() {
			return maxIterations;
		}

		public void setMaxIterations(int maxIterations) {
			this.maxIterations = maxIterations;
		}

		public boolean isEstimateMissingEnergy() {
			return estimateMissingEnergy;
		}

		public void setEstimateMissingEnergy(boolean estimateMissingEnergy) {
			this.estimateMissingEnergy = estimateMissingEnergy;
		}
	}

	/**
	 * Aggregate store connection settings.
	 */
	public static class Store {

		private String baseUrl = "http://localhost:8123";
		private String token;
		private Duration connectTimeout = Duration.ofSeconds(30);
		private Duration readTimeout = Duration.ofSeconds(60);

		public String getBaseUrl() {
			return baseUrl;
		}

		public void setBaseUrl(String baseUrl) {
			this.baseUrl = baseUrl;
		}

		public String getToken() {
			return token;
		}

		public void setToken(String token) {
			this.token = token;
		}

		public Duration getConnectTimeout() {
			return connectTimeout;
		}

		public void setConnectTimeout(Duration connectTimeout) {
			this.connectTimeout = connectTimeout;
		}

		public Duration getReadTimeout() {
			return readTimeout;
		}

		public void setReadTimeout(Duration readTimeout) {
			this.readTimeout = readTimeout;
		}
	}

	/**
	 * A counter group.
	 */
	public static class GroupProperties {

		private String id;
		private String zone;
		private List<CounterProperties> counters = new ArrayList<>();

		public String getId() {
			return id;
		}

		public void setId(String id) {
			this.id = id;
		}

		public String getZone() {
			return zone;
		}

		public void setZone(String zone) {
			this.zone = zone;
		}

		public List<CounterProperties> getCounters() {
			return counters;
		}

		public void setCounters(List<CounterProperties> counters) {
			this.counters = counters;
		}
	}

	/**
	 * A counter within a group.
	 */
	public static class CounterProperties {

		private String id;
		private Set<String> tags = new LinkedHashSet<>();

		public String getId() {
			return id;
		}

		public void setId(String id) {
			this.id = id;
		}

		public Set<String> getTags() {
			return tags;
		}

		public void setTags(Set<String> tags) {
			this.tags = tags;
		}
	}

}
