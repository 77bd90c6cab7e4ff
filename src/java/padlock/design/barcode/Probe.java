package padlock.design.barcode;

import padlock.design.RoundTag;

/**
 * A padlock probe: 5' arm, barcode backbone and 3' arm. The arms together are the
 * reverse complement of the target k-mer, split so that the probe ends meet on the target.
 */
public final class Probe implements Comparable<Probe> {

	private final String gene;
	private final String targetSequence;
	private final int targetStart;
	private final RoundTag round;
	private final String fivePrimeArm;
	private final String threePrimeArm;
	private final BarcodeEntry barcode;

	public Probe(String gene, String targetSequence, int targetStart, RoundTag round, String fivePrimeArm, String threePrimeArm, BarcodeEntry barcode) {
		this.gene = gene;
		this.targetSequence = targetSequence;
		this.targetStart = targetStart;
		this.round = round;
		this.fivePrimeArm = fivePrimeArm;
		this.threePrimeArm = threePrimeArm;
		this.barcode = barcode;
	}

	public String getGene() {
		return gene;
	}

	/**
	 * @return The k-mer the probe hybridizes to
	 */
	public String getTargetSequence() {
		return targetSequence;
	}

	public int getTargetStart() {
		return targetStart;
	}

	public RoundTag getRound() {
		return round;
	}

	public String getFivePrimeArm() {
		return fivePrimeArm;
	}

	public String getThreePrimeArm() {
		return threePrimeArm;
	}

	public int getBarcodeId() {
		return barcode.getId();
	}

	public String getCode() {
		return barcode.getCode();
	}

	/**
	 * @return External annotation id of the barcode, or null
	 */
	public String getExternalId() {
		return barcode.getExternalId();
	}

	/**
	 * @return Full probe sequence 5' to 3'
	 */
	public String getProbeSequence() {
		return fivePrimeArm + barcode.getBackbone() + threePrimeArm;
	}

	@Override
	public int compareTo(Probe o) {
		int c = gene.compareTo(o.gene);
		if(c != 0) return c;
		return Integer.compare(targetStart, o.targetStart);
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof Probe)) return false;
		Probe p = (Probe) o;
		return gene.equals(p.gene) && targetSequence.equals(p.targetSequence) && targetStart == p.targetStart && getProbeSequence().equals(p.getProbeSequence());
	}

	@Override
	public int hashCode() {
		return getProbeSequence().hashCode();
	}

	@Override
	public String toString() {
		return gene + ":" + targetStart + ":" + getProbeSequence();
	}

}
