package padlock.core.utils;

import java.text.DecimalFormat;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.log4j.Logger;

/**
 * Log progress of an incrementing count. Safe to advance from several threads.
 */
public class CountLogger {

	private final int totalCount;
	private final int step;
	private final AtomicInteger numDone;
	private final String label;
	private static Logger logger = Logger.getLogger(CountLogger.class.getName());

	/**
	 * @param overallTotal The eventual total for the incrementing count
	 * @param numMessages The total number of messages to print
	 * @param label Prefix for each message
	 */
	public CountLogger(int overallTotal, int numMessages, String label) {
		totalCount = overallTotal;
		numDone = new AtomicInteger(0);
		step = Math.max(1, totalCount / Math.max(1, numMessages));
		this.label = label;
	}

	/**
	 * @param overallTotal The eventual total for the incrementing count
	 */
	public CountLogger(int overallTotal) {
		this(overallTotal, 10, "");
	}

	/**
	 * Increment the count and print progress message if appropriate
	 */
	public void advance() {
		int done = numDone.incrementAndGet();
		if(done % step == 0 || done == totalCount) {
			String pct = new DecimalFormat("#.##").format(100 * (double)done / totalCount);
			logger.info(label + "Finished " + done + "/" + totalCount + " (" + pct + "%).");
		}
	}

	/**
	 * @return Number of advances so far
	 */
	public int getNumDone() {
		return numDone.get();
	}

}
