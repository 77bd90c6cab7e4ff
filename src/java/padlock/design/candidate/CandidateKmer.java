package padlock.design.candidate;

import padlock.core.sequence.SequenceUtils;
import padlock.design.RoundTag;

/**
 * A fixed-length window of a gene's conserved alignment region
 */
public final class CandidateKmer implements Comparable<CandidateKmer> {

	private final String gene;
	private final int start;
	private final String sequence;
	private final int gcCount;
	private final RoundTag round;

	/**
	 * @param gene Source gene
	 * @param start Start column on the isoform alignment (0-based)
	 * @param sequence Upper case bases
	 * @param round Tag of the step that produced the candidate
	 */
	public CandidateKmer(String gene, int start, String sequence, RoundTag round) {
		if(start < 0) {
			throw new IllegalArgumentException("Negative start " + start + " for " + gene);
		}
		this.gene = gene;
		this.start = start;
		this.sequence = sequence;
		this.gcCount = SequenceUtils.gcCount(sequence);
		this.round = round;
	}

	public String getGene() {
		return gene;
	}

	public int getStart() {
		return start;
	}

	/**
	 * @return First alignment column after the k-mer
	 */
	public int getEnd() {
		return start + sequence.length();
	}

	public int getLength() {
		return sequence.length();
	}

	public String getSequence() {
		return sequence;
	}

	/**
	 * @return Number of G and C bases
	 */
	public int getGcCount() {
		return gcCount;
	}

	/**
	 * @return GC fraction between 0 and 1
	 */
	public double getGcFraction() {
		return sequence.isEmpty() ? 0 : (double) gcCount / sequence.length();
	}

	/**
	 * @return GC content in percent
	 */
	public double getGcPercent() {
		return sequence.isEmpty() ? 0 : 100.0 * gcCount / sequence.length();
	}

	public RoundTag getRound() {
		return round;
	}

	/**
	 * @param other Other k-mer of the same gene
	 * @return Whether the intervals [start, end) intersect
	 */
	public boolean overlaps(CandidateKmer other) {
		return start < other.getEnd() && other.getStart() < getEnd();
	}

	@Override
	public int compareTo(CandidateKmer o) {
		int c = gene.compareTo(o.gene);
		if(c != 0) return c;
		if(start != o.start) return Integer.compare(start, o.start);
		return sequence.compareTo(o.sequence);
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof CandidateKmer)) {
			return false;
		}
		CandidateKmer k = (CandidateKmer) o;
		return gene.equals(k.gene) && start == k.start && sequence.equals(k.sequence) && round.equals(k.round);
	}

	@Override
	public int hashCode() {
		return (gene + "_" + start + "_" + sequence + "_" + round).hashCode();
	}

	@Override
	public String toString() {
		return gene + ":" + start + ":" + sequence;
	}

}
