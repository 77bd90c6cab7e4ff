package padlock.design.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import padlock.design.RoundTag;
import padlock.design.candidate.NotFoundReason;
import padlock.design.specificity.MatchResult;

/**
 * Classification of every roster gene after a round or a merge of rounds, with the
 * match results it was computed from
 */
public final class ClassificationResult {

	private final RoundTag round;
	private final int targetSpecific;
	private final List<String> roster;
	private final Map<String, NotFoundReason> notFound;
	private final List<MatchResult> results;
	private final Map<String, GeneClassification> classifications;

	ClassificationResult(RoundTag round, int targetSpecific, List<String> roster, Map<String, NotFoundReason> notFound,
			List<MatchResult> results, Map<String, GeneClassification> classifications) {
		this.round = round;
		this.targetSpecific = targetSpecific;
		this.roster = Collections.unmodifiableList(new ArrayList<String>(roster));
		this.notFound = Collections.unmodifiableMap(new LinkedHashMap<String, NotFoundReason>(notFound));
		this.results = Collections.unmodifiableList(new ArrayList<MatchResult>(results));
		this.classifications = Collections.unmodifiableMap(new LinkedHashMap<String, GeneClassification>(classifications));
	}

	public RoundTag getRound() {
		return round;
	}

	public int getTargetSpecific() {
		return targetSpecific;
	}

	public List<String> getRoster() {
		return roster;
	}

	public Map<String, NotFoundReason> getNotFound() {
		return notFound;
	}

	/**
	 * @return One result per (gene, sequence), sorted
	 */
	public List<MatchResult> getResults() {
		return results;
	}

	/**
	 * @return Classification per gene in roster order
	 */
	public Map<String, GeneClassification> getClassifications() {
		return classifications;
	}

	public GeneBucket getBucket(String gene) {
		GeneClassification c = classifications.get(gene);
		if(c == null) {
			throw new IllegalArgumentException("Gene not in roster: " + gene);
		}
		return c.getBucket();
	}

	/**
	 * @param bucket Bucket
	 * @return Genes in the bucket in roster order
	 */
	public List<String> getGenes(GeneBucket bucket) {
		List<String> rtrn = new ArrayList<String>();
		for(GeneClassification c : classifications.values()) {
			if(c.getBucket() == bucket) {
				rtrn.add(c.getGene());
			}
		}
		return rtrn;
	}

	/**
	 * @return Genes that should be sampled again, in roster order
	 */
	public List<String> getGenesNeedingAnotherRound() {
		List<String> rtrn = new ArrayList<String>();
		for(GeneClassification c : classifications.values()) {
			if(c.getBucket().needsAnotherRound()) {
				rtrn.add(c.getGene());
			}
		}
		return rtrn;
	}

	/**
	 * @return Specific results of found genes, in roster order then by start
	 */
	public List<MatchResult> getSpecificResults() {
		List<MatchResult> rtrn = new ArrayList<MatchResult>();
		for(String gene : roster) {
			rtrn.addAll(getSpecificResults(gene));
		}
		return rtrn;
	}

	/**
	 * @param gene Gene
	 * @return Specific results for the gene sorted by start; empty for NotFound genes
	 */
	public List<MatchResult> getSpecificResults(String gene) {
		List<MatchResult> rtrn = new ArrayList<MatchResult>();
		if(notFound.containsKey(gene)) {
			return rtrn;
		}
		for(MatchResult r : results) {
			if(r.getGene().equals(gene) && r.isSpecific()) {
				rtrn.add(r);
			}
		}
		return rtrn;
	}

}
