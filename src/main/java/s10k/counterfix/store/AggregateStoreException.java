package s10k.counterfix.store;

/**
 * Exception thrown when an aggregate store operation fails.
 */
public class AggregateStoreException extends RuntimeException {

	private static final long serialVersionUID = -2270158930911489064L;

	/**
	 * Constructor.
	 * 
	 * @param message the message
	 */
	public AggregateStoreException(String message) {
		super(message);
	}

	/**
	 * Constructor.
	 * 
	 * @param message the message
	 * @param cause   the cause
	 */
	public AggregateStoreException(String message, Throwable cause) {
		super(message, cause);
	}

}
