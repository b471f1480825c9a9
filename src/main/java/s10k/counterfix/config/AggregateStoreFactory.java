package s10k.counterfix.config;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import s10k.counterfix.store.AggregateStore;
import s10k.counterfix.store.FileAggregateStore;
import s10k.counterfix.store.RestAggregateStore;
import s10k.counterfix.support.StatisticsRestUtils;

/**
 * Create the {@link AggregateStore} a command works against.
 */
@Component
public class AggregateStoreFactory {

	private static final Logger log = LoggerFactory.getLogger(AggregateStoreFactory.class);

	private final ClientHttpRequestFactory reqFactory;
	private final ObjectMapper objectMapper;
	private final CorrectionProperties props;

	/**
	 * Constructor.
	 * 
	 * @param reqFactory   the HTTP request factory to use
	 * @param objectMapper the mapper to use
	 * @param props        the configuration
	 */
	public AggregateStoreFactory(ClientHttpRequestFactory reqFactory, ObjectMapper objectMapper,
			CorrectionProperties props) {
		super();
		this.reqFactory = reqFactory;
		this.objectMapper = objectMapper;
		this.props = props;
	}

	/**
	 * Create a store.
	 * 
	 * <p>
	 * A file store is returned when {@code storeFile} is given, otherwise a REST
	 * store. The {@code baseUrl} and {@code token} arguments fall back to the
	 * configured values when {@code null}.
	 * </p>
	 * 
	 * @param storeFile the statistics file to load, or {@code null}
	 * @param baseUrl   the statistics API base URL, or {@code null}
	 * @param token     the statistics API access token, or {@code null}
	 * @param traceHttp {@code true} to trace HTTP exchanges
	 * @return the store
	 * @throws IOException if {@code storeFile} cannot be loaded
	 */
	public AggregateStore createStore(Path storeFile, String baseUrl, String token, boolean traceHttp)
			throws IOException {
		if (storeFile != null) {
			log.info("Using statistics file [{}]", storeFile);
			return FileAggregateStore.load(storeFile, objectMapper);
		}
		final String url = (baseUrl != null ? baseUrl : props.getStore().getBaseUrl());
		final String tok = (token != null ? token : props.getStore().getToken());
		log.info("Using statistics API at [{}]", url);
		RestClient restClient = StatisticsRestUtils.createRestClient(reqFactory, objectMapper, url, tok, traceHttp);
		return new RestAggregateStore(restClient);
	}

	/**
	 * Persist any changes made to a store.
	 * 
	 * @param store the store returned from
	 *              {@link #createStore(Path, String, String, boolean)}
	 * @throws IOException if the changes cannot be saved
	 */
	public void saveStore(AggregateStore store) throws IOException {
		if (store instanceof FileAggregateStore f) {
			f.save();
		}
	}

}
