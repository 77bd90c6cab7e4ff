package padlock.design.candidate.predicate;

import java.util.Locale;

import padlock.core.pipeline.ConfigFileOptionValue;
import padlock.design.candidate.CandidateKmer;

/**
 * Rejects k-mers containing a run of one base at least a given length, e.g. GGGG
 */
public class PolyBasePredicate extends AbstractKmerPredicate {

	private int runLength;
	private String basesToFilter;

	public PolyBasePredicate() {}

	/**
	 * @param runLength Minimum run length to reject
	 * @param basesToFilter Bases checked, e.g. "ACGT"
	 */
	public PolyBasePredicate(int runLength, String basesToFilter) {
		if(runLength < 2) {
			throw new IllegalArgumentException("Run length must be at least 2");
		}
		this.runLength = runLength;
		this.basesToFilter = basesToFilter.toUpperCase(Locale.ROOT);
	}

	/**
	 * @param seq Upper case sequence
	 * @return Whether the sequence has a run of runLength of one of the filtered bases
	 */
	public boolean rejectSequence(String seq) {
		int run = 0;
		for(int i = 0; i < seq.length(); i++) {
			char c = seq.charAt(i);
			if(i > 0 && c == seq.charAt(i - 1)) {
				run++;
			} else {
				run = 1;
			}
			if(run >= runLength && basesToFilter.indexOf(c) >= 0) {
				return true;
			}
		}
		return false;
	}

	@Override
	public boolean evaluate(CandidateKmer kmer) {
		return !rejectSequence(kmer.getSequence());
	}

	@Override
	public String getShortFailureMessage(CandidateKmer kmer) {
		return name();
	}

	@Override
	public String name() {
		return "poly_base";
	}

	@Override
	public String configFileLineDescription() {
		return OPTION_FLAG + "\t" + name() + "\t<run_length>\t<bases [e.g. ACGT]>";
	}

	@Override
	protected boolean validParameters(ConfigFileOptionValue value) {
		return value.getActualNumValues() == 4 && value.asInt(2) >= 2 && value.asString(3).matches("[ACGTacgt]+");
	}

	@Override
	protected void setParameters(ConfigFileOptionValue value) {
		runLength = value.asInt(2);
		basesToFilter = value.asString(3).toUpperCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		return name() + "[" + runLength + "," + basesToFilter + "]";
	}

}
