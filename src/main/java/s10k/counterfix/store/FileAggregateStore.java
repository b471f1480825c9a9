package s10k.counterfix.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import s10k.counterfix.domain.AggregatePoint;
import s10k.counterfix.support.StatisticsJson;

/**
 * {@link InMemoryAggregateStore} loaded from, and saved back to, a statistics
 * JSON file.
 * 
 * <p>
 * The file uses the same structure as the statistics API query response.
 * </p>
 */
public class FileAggregateStore extends InMemoryAggregateStore {

	private static final Logger log = LoggerFactory.getLogger(FileAggregateStore.class);

	private final Path path;
	private final ObjectMapper objectMapper;

	private FileAggregateStore(Path path, ObjectMapper objectMapper) {
		super();
		this.path = path;
		this.objectMapper = objectMapper;
	}

	/**
	 * Load a store from a file.
	 * 
	 * @param path         the file to load
	 * @param objectMapper the mapper
	 * @return the store
	 * @throws IOException if the file cannot be read or parsed
	 */
	public static FileAggregateStore load(Path path, ObjectMapper objectMapper) throws IOException {
		JsonNode root = objectMapper.readTree(path.toFile());
		Map<String, List<AggregatePoint>> stats;
		try {
			stats = StatisticsJson.parseStatistics(root);
		} catch (IllegalArgumentException e) {
			throw new IOException("Invalid statistics file [%s]: %s".formatted(path, e.getMessage()), e);
		}
		FileAggregateStore store = new FileAggregateStore(path, objectMapper);
		for (Entry<String, List<AggregatePoint>> e : stats.entrySet()) {
			store.putAll(e.getKey(), e.getValue());
		}
		log.debug("Loaded {} counters from [{}]", stats.size(), path);
		return store;
	}

	/**
	 * Write all aggregates back to the file the store was loaded from.
	 * 
	 * @throws IOException if the file cannot be written
	 */
	public void save() throws IOException {
		Map<String, List<AggregatePoint>> stats = snapshot();
		Files.writeString(path,
				objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(StatisticsJson.toJson(stats, objectMapper)));
		log.debug("Saved {} counters to [{}]", stats.size(), path);
	}

	/**
	 * Get the file path.
	 * 
	 * @return the path
	 */
	public Path path() {
		return path;
	}

}
