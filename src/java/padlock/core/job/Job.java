package padlock.core.job;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * An external command run to completion
 */
public interface Job {

	/**
	 * @return Job ID
	 */
	public String getID();

	/**
	 * Start the job
	 * @throws IOException If the command cannot be started
	 */
	public void submit() throws IOException;

	/**
	 * Wait for the job to complete successfully or fail
	 * @param timeout Maximum time to wait
	 * @param unit Unit of timeout
	 * @return False if the timeout elapsed first
	 * @throws InterruptedException
	 */
	public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException;

	/**
	 * @return Whether the job is done (completed successfully, failed or killed)
	 */
	public boolean completed();

	/**
	 * @return Whether the job has run and completed with exit status 0
	 */
	public boolean succeeded();

	/**
	 * Abort or kill the job
	 */
	public void kill();

}
