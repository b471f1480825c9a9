package s10k.counterfix.config;

import java.net.http.HttpClient;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;

/**
 * HTTP client configuration.
 */
@Configuration(proxyBeanMethods = false)
public class HttpConfig {

	@Bean
	public ClientHttpRequestFactory clientHttpRequestFactory(CorrectionProperties props) {
		HttpClient client = HttpClient.newBuilder().connectTimeout(props.getStore().getConnectTimeout())
				.followRedirects(HttpClient.Redirect.NORMAL).build();
		JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(client);
		factory.setReadTimeout(props.getStore().getReadTimeout());
		return factory;
	}

}
