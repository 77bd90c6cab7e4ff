package padlock.design.specificity;

import java.util.List;

import padlock.core.error.ExternalToolException;

/**
 * Finds transcriptome entries containing a near match to a query. Implementations must be
 * safe to call from several threads.
 */
public interface TranscriptomeSearcher {

	/**
	 * @param query Query sequence
	 * @param maxMismatches Maximum substitutions over the full query length
	 * @return Headers of matched entries, each once
	 * @throws ExternalToolException If the search cannot be completed
	 * @throws InterruptedException
	 */
	public List<String> search(String query, int maxMismatches) throws ExternalToolException, InterruptedException;

}
