package s10k.counterfix.support;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import s10k.counterfix.domain.AggregatePoint;

/**
 * JSON codec for counter statistics, in the form
 * <code>{"counter": [{"start": epochSeconds, "sum": number|null}, ...]}</code>.
 */
public final class StatisticsJson {

	/** The aggregate start date property name. */
	public static final String START_PROP = "start";

	/** The aggregate sum property name. */
	public static final String SUM_PROP = "sum";

	private StatisticsJson() {
		// not available
	}

	/**
	 * Decode a statistics JSON object.
	 * 
	 * <p>
	 * The {@code start} value may be given as epoch seconds or as an ISO 8601
	 * instant. Entries without a start date are ignored.
	 * </p>
	 * 
	 * @param root the JSON to decode
	 * @return mapping of counter ID to aggregates ordered by start date
	 * @throws IllegalArgumentException if a start date cannot be parsed
	 */
	public static Map<String, List<AggregatePoint>> parseStatistics(JsonNode root) {
		if (root == null || !root.isObject()) {
			return Map.of();
		}
		Map<String, List<AggregatePoint>> result = new LinkedHashMap<>(root.size());
		for (Iterator<Entry<String, JsonNode>> itr = root.fields(); itr.hasNext();) {
			Entry<String, JsonNode> e = itr.next();
			List<AggregatePoint> points = new ArrayList<>(e.getValue().size());
			for (JsonNode row : e.getValue()) {
				Instant start = instant(row.path(START_PROP));
				if (start == null) {
					continue;
				}
				JsonNode sum = row.path(SUM_PROP);
				points.add(new AggregatePoint(start, sum.isNumber() ? sum.decimalValue()
						: sum.isTextual() && !sum.textValue().isBlank() ? new BigDecimal(sum.textValue()) : null));
			}
			Collections.sort(points);
			result.put(e.getKey(), points);
		}
		return result;
	}

	private static Instant instant(JsonNode node) {
		if (node.isNumber()) {
			return Instant.ofEpochMilli(node.decimalValue().movePointRight(3).longValue());
		} else if (node.isTextual()) {
			try {
				return Instant.parse(node.textValue());
			} catch (DateTimeParseException e) {
				throw new IllegalArgumentException("Invalid start date [" + node.textValue() + "]", e);
			}
		}
		return null;
	}

	/**
	 * Encode statistics as JSON.
	 * 
	 * @param statistics the statistics to encode
	 * @param mapper     the mapper
	 * @return the JSON object
	 */
	public static ObjectNode toJson(Map<String, List<AggregatePoint>> statistics, ObjectMapper mapper) {
		ObjectNode root = mapper.createObjectNode();
		for (Entry<String, List<AggregatePoint>> e : statistics.entrySet()) {
			ArrayNode rows = root.putArray(e.getKey());
			for (AggregatePoint p : e.getValue()) {
				ObjectNode row = rows.addObject();
				row.put(START_PROP, p.start().getEpochSecond());
				if (p.hasSum()) {
					row.put(SUM_PROP, p.sum());
				} else {
					row.putNull(SUM_PROP);
				}
			}
		}
		return root;
	}

}
