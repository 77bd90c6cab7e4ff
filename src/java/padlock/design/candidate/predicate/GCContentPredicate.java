package padlock.design.candidate.predicate;

import padlock.core.pipeline.ConfigFileOptionValue;
import padlock.design.candidate.CandidateKmer;

/**
 * GC content in percent must lie in [min, max], bounds inclusive
 */
public class GCContentPredicate extends AbstractKmerPredicate {

	private double minPct;
	private double maxPct;

	public GCContentPredicate() {}

	/**
	 * @param minPct Minimum GC percent
	 * @param maxPct Maximum GC percent
	 */
	public GCContentPredicate(double minPct, double maxPct) {
		checkBounds(minPct, maxPct);
		this.minPct = minPct;
		this.maxPct = maxPct;
	}

	private static void checkBounds(double min, double max) {
		if(min < 0 || max > 100 || min > max) {
			throw new IllegalArgumentException("GC bounds must satisfy 0 <= min <= max <= 100: " + min + ", " + max);
		}
	}

	@Override
	public boolean evaluate(CandidateKmer kmer) {
		// GC count * 100 against bound * length, so k-mers on a bound are kept
		double scaledGc = 100.0 * kmer.getGcCount();
		int length = kmer.getLength();
		return scaledGc >= minPct * length && scaledGc <= maxPct * length;
	}

	@Override
	public String getShortFailureMessage(CandidateKmer kmer) {
		return name() + "_" + Math.round(kmer.getGcPercent());
	}

	@Override
	public String name() {
		return "gc_content";
	}

	@Override
	public String configFileLineDescription() {
		return OPTION_FLAG + "\t" + name() + "\t<min_percent>\t<max_percent>";
	}

	@Override
	protected boolean validParameters(ConfigFileOptionValue value) {
		if(value.getActualNumValues() != 4) return false;
		checkBounds(value.asDouble(2), value.asDouble(3));
		return true;
	}

	@Override
	protected void setParameters(ConfigFileOptionValue value) {
		minPct = value.asDouble(2);
		maxPct = value.asDouble(3);
	}

	public double getMinPct() {
		return minPct;
	}

	public double getMaxPct() {
		return maxPct;
	}

	@Override
	public String toString() {
		return name() + "[" + minPct + "," + maxPct + "]";
	}

}
