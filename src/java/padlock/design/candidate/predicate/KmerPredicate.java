package padlock.design.candidate.predicate;

import org.apache.commons.collections15.Predicate;

import padlock.core.pipeline.ConfigurableFeature;
import padlock.design.candidate.CandidateKmer;

/**
 * A chemistry check on a candidate k-mer. {@link #evaluate(Object)} returns true if the k-mer passes.
 */
public interface KmerPredicate extends Predicate<CandidateKmer>, ConfigurableFeature {

	/**
	 * Config file flag for k-mer filter lines
	 */
	public static final String OPTION_FLAG = "kmer_filter";

	/**
	 * @return Predicate name for reports
	 */
	public String getPredicateName();

	/**
	 * @param kmer A k-mer that fails the predicate
	 * @return Short message describing the failure
	 */
	public String getShortFailureMessage(CandidateKmer kmer);

}
