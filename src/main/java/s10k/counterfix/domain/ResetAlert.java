package s10k.counterfix.domain;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Instant;
import java.util.Locale;

/**
 * An advisory alert raised when a live counter reading decreases.
 * 
 * @param groupId   the group ID
 * @param counterId the counter ID
 * @param observed  the date the decrease was observed
 * @param oldValue  the previous reading
 * @param newValue  the new (lower) reading
 */
public record ResetAlert(String groupId, String counterId, Instant observed, BigDecimal oldValue,
		BigDecimal newValue) {

	/**
	 * Get the change, {@code new - old}.
	 * 
	 * @return the (negative) delta
	 */
	public BigDecimal delta() {
		return newValue.subtract(oldValue);
	}

	/**
	 * Get the size of the drop.
	 * 
	 * @return the absolute delta
	 */
	public BigDecimal dropAmount() {
		return delta().abs();
	}

	/**
	 * Get a key that identifies the reading pair this alert was raised for.
	 * 
	 * @return the key
	 */
	public String key() {
		return "%s:%s:%s".formatted(counterId, oldValue.toPlainString(), newValue.toPlainString());
	}

	/**
	 * Get a short alert title.
	 * 
	 * @return the title
	 */
	public String title() {
		return "Counter reset detected on " + groupId;
	}

	/**
	 * Get the alert body.
	 * 
	 * @param unit the unit of the readings
	 * @return the message
	 */
	public String message(String unit) {
		DecimalFormat fmt = new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.US));
		// @formatter:off
		return """
				The %s value decreased by %s %s (from %s %s to %s %s).
				This typically indicates a device firmware update or reset.
				Run the cleanup command as a dry run to preview the affected aggregates, then again with --apply to correct them."""
				.formatted(counterId, fmt.format(dropAmount()), unit, fmt.format(oldValue), unit,
						fmt.format(newValue), unit);
		// @formatter:on
	}

}
