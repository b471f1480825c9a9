package s10k.counterfix.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON configuration.
 */
@Configuration(proxyBeanMethods = false)
public class JsonConfig {

	/**
	 * Create the mapper used for reports and the statistics API.
	 * 
	 * <p>
	 * Properties are written in {@code snake_case}, dates as ISO 8601 strings,
	 * and {@code null} values are omitted.
	 * </p>
	 * 
	 * @return the new mapper
	 */
	public static ObjectMapper createObjectMapper() {
		// @formatter:off
		return JsonMapper.builder()
				.addModule(new JavaTimeModule())
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.serializationInclusion(Include.NON_NULL)
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
				.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
				.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
				.build();
		// @formatter:on
	}

	@Bean
	@Primary
	public ObjectMapper objectMapper() {
		return createObjectMapper();
	}

	@Bean
	public MappingJackson2HttpMessageConverter objectMapperConverter(ObjectMapper mapper) {
		return new MappingJackson2HttpMessageConverter(mapper);
	}

}
