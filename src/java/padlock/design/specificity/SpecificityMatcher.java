package padlock.design.specificity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.log4j.Logger;

import padlock.core.error.ExternalToolException;
import padlock.core.utils.CountLogger;
import padlock.design.sampling.SampledKmer;

/**
 * Searches sampled k-mers against the transcriptome on a fixed thread pool.
 * Each query is bounded by a timeout and retried whole on failure.
 */
public class SpecificityMatcher {

	private static Logger logger = Logger.getLogger(SpecificityMatcher.class.getName());

	private final TranscriptomeSearcher searcher;
	private final int maxMismatches;
	private final HitAttribution attribution;
	private final int numThreads;
	private final long timeoutSeconds;
	private final int retries;

	/**
	 * @param searcher Search implementation
	 * @param maxMismatches Maximum substitutions
	 * @param attribution How hits are counted
	 * @param numThreads Worker threads
	 * @param timeoutSeconds Time allowed per query attempt
	 * @param retries Extra attempts per query after a failure
	 */
	public SpecificityMatcher(TranscriptomeSearcher searcher, int maxMismatches, HitAttribution attribution, int numThreads, long timeoutSeconds, int retries) {
		if(maxMismatches < 0) throw new IllegalArgumentException("Mismatches must be non-negative");
		if(numThreads < 1) throw new IllegalArgumentException("Need at least one thread");
		if(timeoutSeconds < 1) throw new IllegalArgumentException("Timeout must be positive");
		if(retries < 0) throw new IllegalArgumentException("Retries must be non-negative");
		this.searcher = searcher;
		this.maxMismatches = maxMismatches;
		this.attribution = attribution;
		this.numThreads = numThreads;
		this.timeoutSeconds = timeoutSeconds;
		this.retries = retries;
	}

	public int getMaxMismatches() {
		return maxMismatches;
	}

	/**
	 * @param kmers Sampled k-mers
	 * @return One result per (gene, sequence), sorted by gene then start
	 * @throws ExternalToolException If a query fails on every attempt
	 * @throws InterruptedException
	 */
	public List<MatchResult> match(Collection<SampledKmer> kmers) throws ExternalToolException, InterruptedException {
		List<SampledKmer> queries = new ArrayList<SampledKmer>(kmers);
		if(queries.isEmpty()) {
			return Collections.emptyList();
		}
		logger.info("Searching " + queries.size() + " k-mers with up to " + maxMismatches + " mismatches on " + numThreads + " threads...");
		CountLogger countLogger = new CountLogger(queries.size(), 10, "Specificity search: ");
		ExecutorService threadService = Executors.newFixedThreadPool(numThreads);
		// attempts never queue, so each timeout covers a single run
		ExecutorService attemptService = Executors.newCachedThreadPool();
		try {
			List<Future<List<String>>> futures = new ArrayList<Future<List<String>>>();
			for(SampledKmer kmer : queries) {
				futures.add(threadService.submit(queryTask(attemptService, kmer)));
			}
			Map<String, MatchResult> byKey = new TreeMap<String, MatchResult>();
			for(int i = 0; i < queries.size(); i++) {
				SampledKmer kmer = queries.get(i);
				List<String> headers = getResult(futures.get(i), kmer);
				byKey.put(kmer.getGene() + "\t" + kmer.getSequence(), new MatchResult(kmer, headers, attribution));
				countLogger.advance();
			}
			List<MatchResult> rtrn = new ArrayList<MatchResult>(byKey.values());
			Collections.sort(rtrn);
			return rtrn;
		} finally {
			threadService.shutdownNow();
			attemptService.shutdownNow();
		}
	}

	private static List<String> getResult(Future<List<String>> future, SampledKmer kmer) throws ExternalToolException, InterruptedException {
		try {
			return future.get();
		} catch(ExecutionException e) {
			Throwable cause = e.getCause();
			if(cause instanceof ExternalToolException) {
				throw (ExternalToolException) cause;
			}
			if(cause instanceof InterruptedException) {
				throw (InterruptedException) cause;
			}
			throw new ExternalToolException("search", "query " + kmer + " failed", cause);
		}
	}

	private Callable<List<String>> queryTask(final ExecutorService attemptService, final SampledKmer kmer) {
		return new Callable<List<String>>() {
			@Override
			public List<String> call() throws Exception {
				return searchWithRetries(attemptService, kmer);
			}
		};
	}

	private Callable<List<String>> searchTask(final String query) {
		return new Callable<List<String>>() {
			@Override
			public List<String> call() throws Exception {
				return searcher.search(query, maxMismatches);
			}
		};
	}

	/**
	 * Runs the whole query up to retries + 1 times, each attempt with its own timeout
	 */
	private List<String> searchWithRetries(ExecutorService attemptService, SampledKmer kmer) throws ExternalToolException, InterruptedException {
		Throwable lastFailure = null;
		for(int attempt = 0; attempt <= retries; attempt++) {
			if(attempt > 0) {
				logger.warn("Retrying search for " + kmer + " (attempt " + (attempt + 1) + " of " + (retries + 1) + ")");
			}
			Future<List<String>> future = attemptService.submit(searchTask(kmer.getSequence()));
			try {
				return future.get(timeoutSeconds, TimeUnit.SECONDS);
			} catch(TimeoutException e) {
				future.cancel(true);
				lastFailure = e;
				logger.warn("Search for " + kmer + " timed out after " + timeoutSeconds + " seconds");
			} catch(ExecutionException e) {
				lastFailure = e.getCause();
				logger.warn("Search for " + kmer + " failed: " + e.getCause().getMessage());
			} catch(InterruptedException e) {
				future.cancel(true);
				throw e;
			}
		}
		throw new ExternalToolException("search", "query " + kmer + " failed after " + (retries + 1) + " attempts", lastFailure);
	}

}
