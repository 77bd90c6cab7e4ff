package padlock.design.classify;

import padlock.design.candidate.NotFoundReason;

/**
 * Bucket of one gene and the count it was computed from
 */
public final class GeneClassification {

	private final String gene;
	private final GeneBucket bucket;
	private final int numSpecific;
	private final int numTested;
	private final NotFoundReason notFoundReason;

	public GeneClassification(String gene, GeneBucket bucket, int numSpecific, int numTested, NotFoundReason notFoundReason) {
		if((bucket == GeneBucket.NOT_FOUND) != (notFoundReason != null)) {
			throw new IllegalArgumentException("A not-found reason is required exactly for NotFound genes: " + gene);
		}
		this.gene = gene;
		this.bucket = bucket;
		this.numSpecific = numSpecific;
		this.numTested = numTested;
		this.notFoundReason = notFoundReason;
	}

	public String getGene() {
		return gene;
	}

	public GeneBucket getBucket() {
		return bucket;
	}

	public int getNumSpecific() {
		return numSpecific;
	}

	public int getNumTested() {
		return numTested;
	}

	/**
	 * @return Reason for NotFound genes, otherwise null
	 */
	public NotFoundReason getNotFoundReason() {
		return notFoundReason;
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof GeneClassification)) return false;
		GeneClassification g = (GeneClassification) o;
		return gene.equals(g.gene) && bucket == g.bucket && numSpecific == g.numSpecific && numTested == g.numTested && notFoundReason == g.notFoundReason;
	}

	@Override
	public int hashCode() {
		return gene.hashCode() * 31 + bucket.hashCode() + numSpecific;
	}

	@Override
	public String toString() {
		return gene + ":" + bucket.getLabel() + "(" + numSpecific + "/" + numTested + ")";
	}

}
