package s10k.counterfix.store;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpClientErrorException.TooManyRequests;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.threeten.extra.Interval;

import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.Granularity;
import s10k.counterfix.support.Pause;
import s10k.counterfix.support.StatisticsRestUtils;

/**
 * {@link AggregateStore} that talks to a statistics HTTP API.
 */
public class RestAggregateStore implements AggregateStore {

	/** The default maximum number of rate-limited retries per request. */
	public static final int DEFAULT_MAX_RETRIES = 5;

	private static final Logger log = LoggerFactory.getLogger(RestAggregateStore.class);

	private final RestClient restClient;
	private final Pause pause;
	private final int maxRetries;

	/**
	 * Constructor.
	 * 
	 * @param restClient the REST client to use
	 */
	public RestAggregateStore(RestClient restClient) {
		this(restClient, Pause.SLEEP, DEFAULT_MAX_RETRIES);
	}

	/**
	 * Constructor.
	 * 
	 * @param restClient the REST client to use
	 * @param pause      the pause to use between rate-limited retries
	 * @param maxRetries the maximum number of rate-limited retries per request
	 */
	public RestAggregateStore(RestClient restClient, Pause pause, int maxRetries) {
		super();
		this.restClient = restClient;
		this.pause = pause;
		this.maxRetries = maxRetries;
	}

	@Override
	public Map<String, List<AggregatePoint>> query(Set<String> counterIds, Interval range, Granularity granularity) {
		try {
			return restOp("query " + counterIds,
					() -> StatisticsRestUtils.statistics(restClient, counterIds, range, granularity));
		} catch (IllegalArgumentException e) {
			throw new AggregateStoreException("Invalid statistics response: " + e.getMessage(), e);
		}
	}

	@Override
	public void adjust(String counterId, Instant anchor, BigDecimal amount, String unit) {
		boolean accepted = restOp("adjust " + counterId,
				() -> StatisticsRestUtils.adjustStatistics(restClient, counterId, anchor, amount, unit));
		if (!accepted) {
			throw new AggregateStoreException(
					"Adjustment of %s %s at %s for %s not accepted".formatted(amount, unit, anchor, counterId));
		}
	}

	private <T> T restOp(String description, Supplier<T> provider) {
		int attempt = 0;
		while (true) {
			try {
				return provider.get();
			} catch (TooManyRequests e) {
				if (++attempt > maxRetries) {
					throw new AggregateStoreException(
							"Rate limit exceeded on %s after %d retries".formatted(description, maxRetries), e);
				}
				long sleepMs = StatisticsRestUtils.retryAfterMillis(e.getResponseHeaders(), 60_000L);
				log.debug("Rate limited on {}; retrying in {}ms", description, sleepMs);
				try {
					pause.pause(Duration.ofMillis(sleepMs));
				} catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
					throw new AggregateStoreException("Interrupted waiting to retry " + description, ie);
				}
			} catch (RestClientException e) {
				throw new AggregateStoreException("Failed to %s: %s".formatted(description, e.getMessage()), e);
			}
		}
	}

}
