package padlock.design.classify;

/**
 * Outcome for a gene after a round
 */
public enum GeneBucket {

	/**
	 * No candidate k-mers
	 */
	NOT_FOUND("NotFound"),

	/**
	 * Candidates tested, none specific
	 */
	NO_SPECIFIC("NoSpecific"),

	/**
	 * Some specific k-mers, fewer than the target
	 */
	TOO_FEW("TooFew"),

	/**
	 * At least the target number of specific k-mers
	 */
	GOOD("Good");

	private final String label;

	private GeneBucket(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	/**
	 * @return Whether genes in this bucket are sampled again in the next round
	 */
	public boolean needsAnotherRound() {
		return this == NO_SPECIFIC || this == TOO_FEW;
	}

	/**
	 * @param numSpecific Number of specific k-mers
	 * @param target Target number
	 * @return Bucket for a gene that has candidates
	 */
	public static GeneBucket forSpecificCount(int numSpecific, int target) {
		if(numSpecific == 0) return NO_SPECIFIC;
		if(numSpecific < target) return TOO_FEW;
		return GOOD;
	}

}
