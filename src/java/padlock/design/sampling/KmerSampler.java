package padlock.design.sampling;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.log4j.Logger;

import padlock.design.RoundTag;
import padlock.design.candidate.CandidateKmer;
import padlock.design.candidate.ExtractionResult;

/**
 * Draws non-overlapping k-mers at random from each gene's candidates
 */
public class KmerSampler {

	private static Logger logger = Logger.getLogger(KmerSampler.class.getName());

	private static final Comparator<SampledKmer> BY_START = new Comparator<SampledKmer>() {
		@Override
		public int compare(SampledKmer a, SampledKmer b) {
			return Integer.compare(a.getStart(), b.getStart());
		}
	};

	/**
	 * Draw candidates uniformly at random, accepting a draw only if it overlaps no accepted k-mer,
	 * until n are accepted or none remain
	 * @param candidates Candidates of one gene
	 * @param n Requested number
	 * @param rng Random source for this gene and round
	 * @param round Round
	 * @param excludedSequences Sequences never drawn, e.g. tested in earlier rounds
	 * @return At most n pairwise non-overlapping k-mers sorted by start
	 */
	public List<SampledKmer> sample(List<CandidateKmer> candidates, int n, RandomGenerator rng, RoundTag round, Set<String> excludedSequences) {
		if(n < 0) {
			throw new IllegalArgumentException("Sample size must be non-negative: " + n);
		}
		List<CandidateKmer> pool = new ArrayList<CandidateKmer>();
		for(CandidateKmer c : candidates) {
			if(!excludedSequences.contains(c.getSequence())) {
				pool.add(c);
			}
		}
		List<CandidateKmer> accepted = new ArrayList<CandidateKmer>();
		while(accepted.size() < n && !pool.isEmpty()) {
			int i = rng.nextInt(pool.size());
			CandidateKmer draw = pool.get(i);
			// swap-remove
			pool.set(i, pool.get(pool.size() - 1));
			pool.remove(pool.size() - 1);
			if(!overlapsAny(draw, accepted)) {
				accepted.add(draw);
			}
		}
		List<SampledKmer> rtrn = new ArrayList<SampledKmer>();
		for(CandidateKmer c : accepted) {
			rtrn.add(new SampledKmer(c, round));
		}
		Collections.sort(rtrn, BY_START);
		return rtrn;
	}

	private static boolean overlapsAny(CandidateKmer kmer, List<CandidateKmer> accepted) {
		for(CandidateKmer a : accepted) {
			if(kmer.overlaps(a)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Sample every listed gene that has candidates
	 * @param extraction Extraction result
	 * @param genes Genes to sample, in roster order
	 * @param n Requested number per gene
	 * @param randomSource Random generators per gene
	 * @param round Round
	 * @param testedSequences Sequences tested in earlier rounds, by gene; may lack genes
	 * @return The round's samples and shortfalls
	 */
	public SampledRound sampleRound(ExtractionResult extraction, Collection<String> genes, int n, RandomSourceFactory randomSource, RoundTag round, Map<String, Set<String>> testedSequences) {
		Map<String, List<SampledKmer>> byGene = new LinkedHashMap<String, List<SampledKmer>>();
		for(String gene : genes) {
			if(!extraction.isFound(gene)) {
				continue;
			}
			Set<String> excluded = testedSequences.containsKey(gene) ? testedSequences.get(gene) : Collections.<String>emptySet();
			byGene.put(gene, sample(extraction.getCandidates(gene), n, randomSource.forGene(gene, round), round, excluded));
		}
		SampledRound rtrn = new SampledRound(round, n, byGene);
		for(Map.Entry<String, Integer> e : rtrn.getShortfalls().entrySet()) {
			logger.warn(round + ": insufficient candidates for " + e.getKey() + "; sampled " + (n - e.getValue().intValue()) + " of " + n);
		}
		logger.info(round + ": sampled " + rtrn.getAllKmers().size() + " k-mers for " + byGene.size() + " genes");
		return rtrn;
	}

}
