package padlock.design.candidate.predicate;

import java.util.Locale;

import padlock.core.pipeline.ConfigFileOptionValue;
import padlock.core.sequence.SequenceUtils;
import padlock.design.candidate.CandidateKmer;

/**
 * Rejects k-mers where either probe end at the ligation junction would carry a forbidden base.
 * The probe hybridizes with the reverse complement of the k-mer, split after armLength bases;
 * the 3' end is the base before the split and the 5' end the base after it.
 * Without an explicit arm length the split is at the midpoint.
 */
public class JunctionBasePredicate extends AbstractKmerPredicate {

	private String forbidden;
	private Integer armLength;

	public JunctionBasePredicate() {}

	/**
	 * @param forbidden Bases forbidden at either probe end
	 * @param armLength 3' arm length, or null for the midpoint
	 */
	public JunctionBasePredicate(String forbidden, Integer armLength) {
		this.forbidden = forbidden.toUpperCase(Locale.ROOT);
		this.armLength = armLength;
	}

	/**
	 * @param kmerLength K-mer length
	 * @return Split position on the reverse complement
	 */
	public int splitFor(int kmerLength) {
		int split = armLength == null ? kmerLength / 2 : armLength.intValue();
		if(split < 1 || split >= kmerLength) {
			throw new IllegalArgumentException("Arm length " + split + " does not split a k-mer of length " + kmerLength);
		}
		return split;
	}

	@Override
	public boolean evaluate(CandidateKmer kmer) {
		String rc = SequenceUtils.reverseComplement(kmer.getSequence());
		int split = splitFor(rc.length());
		return forbidden.indexOf(rc.charAt(split - 1)) < 0 && forbidden.indexOf(rc.charAt(split)) < 0;
	}

	@Override
	public String getShortFailureMessage(CandidateKmer kmer) {
		return name();
	}

	@Override
	public String name() {
		return "junction_base";
	}

	@Override
	public String configFileLineDescription() {
		return OPTION_FLAG + "\t" + name() + "\t<forbidden_bases>\t<optional arm_length>";
	}

	@Override
	protected boolean validParameters(ConfigFileOptionValue value) {
		int n = value.getActualNumValues();
		if(n != 3 && n != 4) return false;
		if(!value.asString(2).matches("[ACGTacgt]+")) return false;
		return n == 3 || value.asInt(3) >= 1;
	}

	@Override
	protected void setParameters(ConfigFileOptionValue value) {
		forbidden = value.asString(2).toUpperCase(Locale.ROOT);
		armLength = value.getActualNumValues() == 4 ? Integer.valueOf(value.asInt(3)) : null;
	}

	@Override
	public String toString() {
		return name() + "[" + forbidden + "]";
	}

}
