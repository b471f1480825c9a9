package s10k.counterfix.support;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;

/**
 * Log HTTP exchanges at {@code TRACE} level.
 * 
 * <p>
 * The response body is read to be logged, so this must be used with a
 * buffering request factory.
 * </p>
 */
public class LoggingHttpRequestInterceptor implements ClientHttpRequestInterceptor {

	private static final Logger log = LoggerFactory.getLogger(LoggingHttpRequestInterceptor.class);

	@Override
	public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
			throws IOException {
		if (log.isTraceEnabled()) {
			log.trace("Request {} {}\n{}", request.getMethod(), request.getURI(), new String(body, UTF_8));
		}
		ClientHttpResponse response = execution.execute(request, body);
		if (log.isTraceEnabled()) {
			log.trace("Response {} {}: {}\n{}", request.getMethod(), request.getURI(), response.getStatusCode(),
					StreamUtils.copyToString(response.getBody(), UTF_8));
		}
		return response;
	}

}
