package s10k.counterfix.support;

import static java.util.stream.Collectors.joining;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.threeten.extra.Interval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.domain.Granularity;

/**
 * Helper utilities for statistics REST operations.
 */
public final class StatisticsRestUtils {

	/** The statistics query path. */
	public static final String STATISTICS_PATH = "/api/statistics";

	/** The statistics adjustment path. */
	public static final String ADJUST_PATH = "/api/statistics/adjust";

	private StatisticsRestUtils() {
		// not available
	}

	/**
	 * Set the ObjectMapper used by a {@link RestTemplate}.
	 * 
	 * @param template     the template to adjust
	 * @param objectMapper the object mapper to use
	 */
	public static void setObjectMapper(RestTemplate template, ObjectMapper objectMapper) {
		for (HttpMessageConverter<?> converter : template.getMessageConverters()) {
			if (converter instanceof MappingJackson2HttpMessageConverter c) {
				c.setObjectMapper(objectMapper);
			}
		}
	}

	/**
	 * Create a new {@link RestClient} instance.
	 * 
	 * <p>
	 * If {@code token} is provided the client will add a bearer
	 * {@code Authorization} header to each request.
	 * </p>
	 * 
	 * @param reqFactory   the request factory
	 * @param objectMapper the object mapper
	 * @param baseUrl      the base URL
	 * @param token        the access token, or {@code null}
	 * @param traceHttp    {@code true} to enable HTTP trace logging
	 * @return the client
	 */
	public static RestClient createRestClient(ClientHttpRequestFactory reqFactory, ObjectMapper objectMapper,
			String baseUrl, String token, boolean traceHttp) {
		List<ClientHttpRequestInterceptor> interceptors = new ArrayList<>(2);
		if (token != null && !token.isBlank()) {
			interceptors.add((request, body, execution) -> {
				request.getHeaders().setBearerAuth(token);
				return execution.execute(request, body);
			});
		}
		final RestTemplate template;
		if (traceHttp) {
			template = new RestTemplate(new BufferingClientHttpRequestFactory(reqFactory));
			interceptors.add(new LoggingHttpRequestInterceptor());
		} else {
			template = new RestTemplate(reqFactory);
		}
		template.setInterceptors(interceptors);
		setObjectMapper(template, objectMapper);
		return RestClient.builder(template).baseUrl(baseUrl).build();
	}

	/**
	 * Query for counter statistics.
	 * 
	 * @param restClient  the REST client to use
	 * @param counterIds  the counter IDs
	 * @param range       the time range, start inclusive and end exclusive
	 * @param granularity the aggregate granularity
	 * @return mapping of counter ID to aggregates, never {@code null}
	 * @throws RestClientException if the request fails
	 */
	public static Map<String, List<AggregatePoint>> statistics(RestClient restClient, Set<String> counterIds,
			Interval range, Granularity granularity) {
		// @formatter:off
		JsonNode stats = restClient.get()
			.uri(b -> {
				return b.path(STATISTICS_PATH)
					.queryParam("statistic_ids", counterIds.stream().sorted().collect(joining(",")))
					.queryParam("start", range.getStart())
					.queryParam("end", range.getEnd())
					.queryParam("period", granularity.key())
					.build();
			})
			.accept(MediaType.APPLICATION_JSON)
			.retrieve()
			.body(JsonNode.class)
			;
		// @formatter:on
		return StatisticsJson.parseStatistics(stats);
	}

	/**
	 * Submit a statistics adjustment.
	 * 
	 * @param restClient the REST client to use
	 * @param counterId  the counter ID
	 * @param anchor     the start date of the first aggregate to adjust
	 * @param amount     the amount to add
	 * @param unit       the unit of {@code amount}
	 * @return {@code true} if the adjustment was accepted
	 * @throws RestClientException if the request fails
	 */
	public static boolean adjustStatistics(RestClient restClient, String counterId, Instant anchor, BigDecimal amount,
			String unit) {
		// @formatter:off
		Map<String, Object> adjustData = Map.of(
				"statistic_id", counterId,
				"start_time", anchor.toString(),
				"sum_adjustment", amount,
				"adjustment_unit", unit
			);
		JsonNode success = restClient.post()
			.uri(ADJUST_PATH)
			.contentType(MediaType.APPLICATION_JSON)
			.body(adjustData)
			.accept(MediaType.APPLICATION_JSON)
			.retrieve()
			.body(JsonNode.class)
			;
		// @formatter:on
		return (success != null && success.path("success").booleanValue());
	}

	/**
	 * Extract a retry delay from a rate-limited response.
	 * 
	 * <p>
	 * The {@code Retry-After} header is read as a number of seconds. A default
	 * pause of 1s is returned when the header is missing or invalid, and a
	 * minimum of 100ms is always applied.
	 * </p>
	 * 
	 * @param headers the response headers, or {@code null}
	 * @param maxMs   the maximum delay, in milliseconds
	 * @return the delay in milliseconds
	 */
	public static long retryAfterMillis(HttpHeaders headers, long maxMs) {
		long sleepMs = 1000L;
		if (headers != null) {
			String retryAfter = headers.getFirst(HttpHeaders.RETRY_AFTER);
			if (retryAfter != null) {
				try {
					sleepMs = Long.parseLong(retryAfter.trim()) * 1000L;
				} catch (NumberFormatException nfe) {
					// not a delay in seconds, so use default
				}
			}
		}
		return Math.max(100L, Math.min(sleepMs, maxMs));
	}

}
