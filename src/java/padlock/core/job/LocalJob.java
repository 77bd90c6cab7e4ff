package padlock.core.job;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import padlock.core.error.ExternalToolException;

/**
 * Runs a command as a local child process. Arguments are passed to the process
 * directly, never through a shell. Standard output and standard error go to files.
 */
public class LocalJob implements Job {

	private static Logger logger = Logger.getLogger(LocalJob.class.getName());
	private static final AtomicLong COUNTER = new AtomicLong();

	private final String jobId;
	private final List<String> command;
	private final File stdoutFile;
	private final File stderrFile;
	private Process process;

	/**
	 * @param jobName Prefix of the job ID
	 * @param commandArgs Executable followed by its arguments
	 * @param workDir Directory for the stdout and stderr files
	 */
	public LocalJob(String jobName, List<String> commandArgs, File workDir) {
		if(commandArgs.isEmpty()) {
			throw new IllegalArgumentException("Empty command for job " + jobName);
		}
		jobId = jobName + "_" + System.currentTimeMillis() + "_" + COUNTER.incrementAndGet();
		command = Collections.unmodifiableList(new ArrayList<String>(commandArgs));
		stdoutFile = new File(workDir, jobId + ".out");
		stderrFile = new File(workDir, jobId + ".err");
	}

	@Override
	public String getID() {
		return jobId;
	}

	public List<String> getCommand() {
		return command;
	}

	@Override
	public void submit() throws IOException {
		logger.debug("Starting job " + jobId + ": " + StringUtils.join(command, " "));
		ProcessBuilder pb = new ProcessBuilder(command);
		pb.redirectOutput(stdoutFile);
		pb.redirectError(stderrFile);
		process = pb.start();
	}

	@Override
	public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
		checkSubmitted();
		return process.waitFor(timeout, unit);
	}

	@Override
	public boolean completed() {
		return process != null && !process.isAlive();
	}

	@Override
	public boolean succeeded() {
		return completed() && process.exitValue() == 0;
	}

	/**
	 * @return Exit status of the finished process
	 */
	public int exitValue() {
		checkSubmitted();
		return process.exitValue();
	}

	@Override
	public void kill() {
		if(process != null && process.isAlive()) {
			logger.warn("Killing job " + jobId);
			process.destroyForcibly();
		}
	}

	/**
	 * @return File receiving standard output
	 */
	public File getStdoutFile() {
		return stdoutFile;
	}

	/**
	 * @return Contents of standard error, or empty string if it cannot be read
	 */
	public String readStderr() {
		try {
			return stderrFile.exists() ? FileUtils.readFileToString(stderrFile, StandardCharsets.UTF_8) : "";
		} catch(IOException e) {
			logger.warn("Could not read stderr of job " + jobId + ": " + e.getMessage());
			return "";
		}
	}

	/**
	 * Delete the stdout and stderr files
	 */
	public void cleanUp() {
		FileUtils.deleteQuietly(stdoutFile);
		FileUtils.deleteQuietly(stderrFile);
	}

	/**
	 * Submit the job and wait for it to exit with status 0
	 * @param tool Tool name for error messages
	 * @param timeout Maximum time to wait
	 * @param unit Unit of timeout
	 * @throws ExternalToolException If the command cannot start, times out or exits with non-zero status
	 * @throws InterruptedException
	 */
	public void runToCompletion(String tool, long timeout, TimeUnit unit) throws ExternalToolException, InterruptedException {
		try {
			submit();
		} catch(IOException e) {
			throw new ExternalToolException(tool, "could not start " + StringUtils.join(command, " ") + ": " + e.getMessage(), e);
		}
		boolean finished;
		try {
			finished = waitFor(timeout, unit);
		} catch(InterruptedException e) {
			kill();
			throw e;
		}
		if(!finished) {
			kill();
			throw new ExternalToolException(tool, "timed out after " + timeout + " " + unit.toString().toLowerCase() + ": " + StringUtils.join(command, " "));
		}
		if(!succeeded()) {
			throw new ExternalToolException(tool, "exit status " + exitValue() + " from " + StringUtils.join(command, " ") + ". " + readStderr().trim());
		}
		logger.debug("Job " + jobId + " finished");
	}

	private void checkSubmitted() {
		if(process == null) {
			throw new IllegalStateException("Job " + jobId + " has not been submitted");
		}
	}

	/**
	 * Split a command template on whitespace and substitute {placeholder} tokens.
	 * Substitution happens per argument so values containing spaces stay one argument.
	 * @param template e.g. "clustalo -i {input} -o {output} --force"
	 * @param placeholderNames Placeholder names without braces
	 * @param values Values in the same order as the names
	 * @return Argument list
	 */
	public static List<String> buildCommand(String template, String[] placeholderNames, String[] values) {
		if(StringUtils.isBlank(template)) {
			throw new IllegalArgumentException("Command template is empty");
		}
		List<String> rtrn = new ArrayList<String>();
		for(String token : template.trim().split("\\s+")) {
			String arg = token;
			for(int i = 0; i < placeholderNames.length; i++) {
				arg = arg.replace("{" + placeholderNames[i] + "}", values[i]);
			}
			rtrn.add(arg);
		}
		return rtrn;
	}

}
