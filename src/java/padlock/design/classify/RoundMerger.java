package padlock.design.classify;

import java.util.ArrayList;
import java.util.List;

import padlock.design.specificity.MatchResult;

/**
 * Combines classifications of separate rounds into a new classification.
 * Merging is commutative and associative.
 */
public class RoundMerger {

	private final GeneClassifier classifier;

	public RoundMerger(GeneClassifier classifier) {
		this.classifier = classifier;
	}

	/**
	 * @param a A classification
	 * @param b A classification over the same roster
	 * @return Classification of the union of both rounds' results
	 */
	public ClassificationResult merge(ClassificationResult a, ClassificationResult b) {
		if(!a.getRoster().equals(b.getRoster())) {
			throw new IllegalArgumentException("Cannot merge " + a.getRound() + " and " + b.getRound() + ": gene lists differ");
		}
		if(!a.getNotFound().equals(b.getNotFound())) {
			throw new IllegalArgumentException("Cannot merge " + a.getRound() + " and " + b.getRound() + ": not-found genes differ");
		}
		List<MatchResult> union = new ArrayList<MatchResult>(a.getResults());
		union.addAll(b.getResults());
		return classifier.classify(union, a.getRoster(), a.getNotFound(), a.getRound().mergeWith(b.getRound()));
	}

	/**
	 * @param rounds At least one classification
	 * @return All rounds merged
	 */
	public ClassificationResult mergeAll(List<ClassificationResult> rounds) {
		if(rounds.isEmpty()) {
			throw new IllegalArgumentException("Nothing to merge");
		}
		ClassificationResult rtrn = rounds.get(0);
		for(int i = 1; i < rounds.size(); i++) {
			rtrn = merge(rtrn, rounds.get(i));
		}
		return rtrn;
	}

}
