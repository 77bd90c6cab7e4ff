package padlock.design.candidate.predicate;

import java.util.Locale;

import padlock.core.pipeline.ConfigFileOptionValue;
import padlock.design.candidate.CandidateKmer;

/**
 * Rejects k-mers whose first or last base is forbidden. "-" disables a side.
 */
public class TerminalBasePredicate extends AbstractKmerPredicate {

	private static final String NONE = "-";

	private String forbidden5prime = "";
	private String forbidden3prime = "";

	public TerminalBasePredicate() {}

	/**
	 * @param forbidden5prime Bases forbidden at the first position, or empty
	 * @param forbidden3prime Bases forbidden at the last position, or empty
	 */
	public TerminalBasePredicate(String forbidden5prime, String forbidden3prime) {
		this.forbidden5prime = normalize(forbidden5prime);
		this.forbidden3prime = normalize(forbidden3prime);
	}

	private static String normalize(String s) {
		return s == null || NONE.equals(s) ? "" : s.toUpperCase(Locale.ROOT);
	}

	@Override
	public boolean evaluate(CandidateKmer kmer) {
		String seq = kmer.getSequence();
		if(seq.isEmpty()) return true;
		return forbidden5prime.indexOf(seq.charAt(0)) < 0 && forbidden3prime.indexOf(seq.charAt(seq.length() - 1)) < 0;
	}

	@Override
	public String getShortFailureMessage(CandidateKmer kmer) {
		String seq = kmer.getSequence();
		return forbidden5prime.indexOf(seq.charAt(0)) >= 0 ? name() + "_5prime" : name() + "_3prime";
	}

	@Override
	public String name() {
		return "terminal_base";
	}

	@Override
	public String configFileLineDescription() {
		return OPTION_FLAG + "\t" + name() + "\t<forbidden_5prime_bases or ->\t<forbidden_3prime_bases or ->";
	}

	@Override
	protected boolean validParameters(ConfigFileOptionValue value) {
		return value.getActualNumValues() == 4 && validSide(value.asString(2)) && validSide(value.asString(3));
	}

	private static boolean validSide(String s) {
		return NONE.equals(s) || s.matches("[ACGTacgt]+");
	}

	@Override
	protected void setParameters(ConfigFileOptionValue value) {
		forbidden5prime = normalize(value.asString(2));
		forbidden3prime = normalize(value.asString(3));
	}

}
