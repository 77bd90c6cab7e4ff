package padlock.design.classify;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.log4j.Logger;

import padlock.design.RoundTag;
import padlock.design.candidate.NotFoundReason;
import padlock.design.specificity.MatchResult;

/**
 * Buckets genes by their number of specific k-mers relative to a target
 */
public class GeneClassifier {

	private static Logger logger = Logger.getLogger(GeneClassifier.class.getName());

	/**
	 * Orders results for the same (gene, sequence): more matched entries first, then by entry text,
	 * round label, hit count and start. The first in this order is kept.
	 */
	static final Comparator<MatchResult> PREFERENCE = new Comparator<MatchResult>() {
		@Override
		public int compare(MatchResult a, MatchResult b) {
			int c = Integer.compare(b.getMatchedEntries().size(), a.getMatchedEntries().size());
			if(c != 0) return c;
			c = a.getMatchedEntriesString().compareTo(b.getMatchedEntriesString());
			if(c != 0) return c;
			c = a.getRound().compareTo(b.getRound());
			if(c != 0) return c;
			c = Integer.compare(a.getHitCount(), b.getHitCount());
			if(c != 0) return c;
			c = Integer.compare(a.getKmer().getStart(), b.getKmer().getStart());
			if(c != 0) return c;
			return Boolean.compare(b.hitsSourceGene(), a.hitsSourceGene());
		}
	};

	private final int targetSpecific;

	/**
	 * @param targetSpecific Specific k-mers needed for a gene to be Good
	 */
	public GeneClassifier(int targetSpecific) {
		if(targetSpecific < 1) {
			throw new IllegalArgumentException("Target number of specific k-mers must be positive: " + targetSpecific);
		}
		this.targetSpecific = targetSpecific;
	}

	public int getTargetSpecific() {
		return targetSpecific;
	}

	/**
	 * @param results Match results; duplicates by (gene, sequence) are reduced to one
	 * @param roster All genes in input order
	 * @param notFound Genes without candidates
	 * @param round Round the results belong to
	 * @return Classification of every roster gene
	 */
	public ClassificationResult classify(Collection<MatchResult> results, List<String> roster, Map<String, NotFoundReason> notFound, RoundTag round) {
		Set<String> rosterSet = new HashSet<String>(roster);
		Map<String, MatchResult> byKey = new TreeMap<String, MatchResult>();
		int dropped = 0;
		for(MatchResult r : results) {
			if(!rosterSet.contains(r.getGene())) {
				dropped++;
				continue;
			}
			String key = r.getGene() + "\t" + r.getSequence();
			MatchResult existing = byKey.get(key);
			if(existing == null || PREFERENCE.compare(r, existing) < 0) {
				byKey.put(key, r);
			}
		}
		if(dropped > 0) {
			logger.warn(round + ": ignoring " + dropped + " results for genes not in the gene list");
		}
		List<MatchResult> kept = new ArrayList<MatchResult>(byKey.values());
		Collections.sort(kept);

		Map<String, Integer> numSpecific = new HashMap<String, Integer>();
		Map<String, Integer> numTested = new HashMap<String, Integer>();
		for(MatchResult r : kept) {
			increment(numTested, r.getGene());
			if(r.isSpecific()) {
				increment(numSpecific, r.getGene());
			}
		}

		Map<String, GeneClassification> classifications = new LinkedHashMap<String, GeneClassification>();
		for(String gene : roster) {
			NotFoundReason reason = notFound.get(gene);
			int s = count(numSpecific, gene);
			int t = count(numTested, gene);
			GeneBucket bucket = reason != null ? GeneBucket.NOT_FOUND : GeneBucket.forSpecificCount(s, targetSpecific);
			classifications.put(gene, new GeneClassification(gene, bucket, s, t, reason));
		}
		ClassificationResult rtrn = new ClassificationResult(round, targetSpecific, roster, notFound, kept, classifications);
		logger.info(round + ": " + summary(rtrn));
		return rtrn;
	}

	/**
	 * @param previous Earlier classification
	 * @return The same results classified again with this classifier's target
	 */
	public ClassificationResult reclassify(ClassificationResult previous) {
		return classify(previous.getResults(), previous.getRoster(), previous.getNotFound(), previous.getRound());
	}

	private static void increment(Map<String, Integer> counts, String gene) {
		counts.put(gene, Integer.valueOf(count(counts, gene) + 1));
	}

	private static int count(Map<String, Integer> counts, String gene) {
		Integer n = counts.get(gene);
		return n == null ? 0 : n.intValue();
	}

	private static String summary(ClassificationResult result) {
		StringBuilder sb = new StringBuilder();
		for(GeneBucket b : GeneBucket.values()) {
			if(sb.length() > 0) sb.append(", ");
			sb.append(b.getLabel()).append("=").append(result.getGenes(b).size());
		}
		return sb.toString();
	}

}
