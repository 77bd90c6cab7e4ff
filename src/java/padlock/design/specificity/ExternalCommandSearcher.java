package padlock.design.specificity;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.log4j.Logger;

import padlock.core.error.ExternalToolException;
import padlock.core.job.LocalJob;

/**
 * Runs an external search program once per query, e.g.
 * <code>seqkit grep -s -m {mismatches} -p {query} {corpus}</code>.
 * Lines of standard output that begin with '&gt;' are the matched entry headers.
 */
public class ExternalCommandSearcher implements TranscriptomeSearcher {

	private static Logger logger = Logger.getLogger(ExternalCommandSearcher.class.getName());
	private static final String TOOL = "search";
	private static final String[] PLACEHOLDERS = new String[] {"query", "mismatches", "corpus"};

	private final String commandTemplate;
	private final String corpusPath;
	private final File workDir;
	private final long timeoutSeconds;

	/**
	 * @param commandTemplate Command with {query}, {mismatches} and {corpus} placeholders
	 * @param corpusPath Path of the reference FASTA
	 * @param workDir Directory for the job output files
	 * @param timeoutSeconds Maximum run time per query
	 */
	public ExternalCommandSearcher(String commandTemplate, String corpusPath, File workDir, long timeoutSeconds) {
		if(!commandTemplate.contains("{query}")) {
			throw new IllegalArgumentException("Search command must contain {query}: " + commandTemplate);
		}
		this.commandTemplate = commandTemplate;
		this.corpusPath = corpusPath;
		this.workDir = workDir;
		this.timeoutSeconds = timeoutSeconds;
	}

	/**
	 * @param query Query
	 * @param maxMismatches Threshold
	 * @return The argument list for the query
	 */
	public List<String> commandFor(String query, int maxMismatches) {
		return LocalJob.buildCommand(commandTemplate, PLACEHOLDERS, new String[] {query, Integer.toString(maxMismatches), corpusPath});
	}

	@Override
	public List<String> search(String query, int maxMismatches) throws ExternalToolException, InterruptedException {
		LocalJob job = new LocalJob("search_" + query, commandFor(query, maxMismatches), workDir);
		try {
			job.runToCompletion(TOOL, timeoutSeconds, TimeUnit.SECONDS);
			LineIterator lines = FileUtils.lineIterator(job.getStdoutFile(), StandardCharsets.UTF_8.name());
			try {
				List<String> rtrn = parseHeaders(lines);
				logger.debug(query + ": " + rtrn.size() + " matched entries");
				return rtrn;
			} finally {
				lines.close();
			}
		} catch(IOException e) {
			throw new ExternalToolException(TOOL, "could not read output for " + query + ": " + e.getMessage(), e);
		} finally {
			job.cleanUp();
		}
	}

	/**
	 * @param lines Output lines
	 * @return Text after '&gt;' of each header line, each once, in order of appearance
	 */
	public static List<String> parseHeaders(Iterator<String> lines) {
		Set<String> headers = new LinkedHashSet<String>();
		while(lines.hasNext()) {
			String line = lines.next();
			if(line.startsWith(">")) {
				headers.add(line.substring(1).trim());
			}
		}
		return new ArrayList<String>(headers);
	}

}
