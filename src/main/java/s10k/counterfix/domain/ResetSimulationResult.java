package s10k.counterfix.domain;

import java.math.BigDecimal;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;

/**
 * The result of manufacturing a synthetic counter reset.
 * 
 * @param success     {@code true} if the adjustment was submitted
 * @param counterId   the counter ID
 * @param resetTime   the start date of the aggregate the drop was anchored at
 * @param previousSum the sum found at the reset time
 * @param adjustment  the (negative) adjustment submitted
 * @param newSum      the expected sum after the drop
 * @param message     a summary message, or {@code null}
 * @param error       an error message, or {@code null}
 */
@JsonInclude(Include.NON_NULL)
public record ResetSimulationResult(boolean success, String counterId, Instant resetTime, BigDecimal previousSum,
		BigDecimal adjustment, BigDecimal newSum, String message, String error) {

	/**
	 * Create a failed result.
	 * 
	 * @param counterId the counter ID
	 * @param error     the error message
	 * @return the result
	 */
	public static ResetSimulationResult failed(String counterId, String error) {
		return new ResetSimulationResult(false, counterId, null, null, null, null, null, error);
	}

}
