package padlock.design.candidate;

/**
 * Why a gene produced no candidate k-mers
 */
public enum NotFoundReason {

	/**
	 * No reference header carries the symbol in parentheses
	 */
	NOT_IN_REFERENCE("gene_not_in_reference"),

	/**
	 * Isoforms share no conserved run at least one k-mer long
	 */
	NO_CONSERVED_REGION("no_conserved_region"),

	/**
	 * Conserved windows exist but none passes GC and chemistry checks
	 */
	NO_VALID_KMER("no_valid_kmer");

	private final String label;

	private NotFoundReason(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	/**
	 * @param label Label as written to output tables
	 * @return The reason
	 */
	public static NotFoundReason fromLabel(String label) {
		for(NotFoundReason r : values()) {
			if(r.label.equals(label)) return r;
		}
		throw new IllegalArgumentException("Unknown not-found reason: " + label);
	}

}
