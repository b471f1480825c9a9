package s10k.counterfix.support;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * A delay primitive, so waits can be skipped in tests.
 */
@FunctionalInterface
public interface Pause {

	/** A pause that sleeps the calling thread. */
	Pause SLEEP = d -> {
		if (d != null && !d.isNegative() && !d.isZero()) {
			TimeUnit.MILLISECONDS.sleep(d.toMillis());
		}
	};

	/** A pause that returns immediately. */
	Pause NONE = d -> {
		// no wait
	};

	/**
	 * Wait for a duration.
	 * 
	 * @param duration the duration to wait
	 * @throws InterruptedException if interrupted while waiting
	 */
	void pause(Duration duration) throws InterruptedException;

}
