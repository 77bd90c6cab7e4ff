package padlock.design.sampling;

import padlock.design.RoundTag;
import padlock.design.candidate.CandidateKmer;

/**
 * A candidate k-mer selected in a round
 */
public final class SampledKmer implements Comparable<SampledKmer> {

	private final CandidateKmer candidate;
	private final RoundTag round;

	public SampledKmer(CandidateKmer candidate, RoundTag round) {
		this.candidate = candidate;
		this.round = round;
	}

	public CandidateKmer getCandidate() {
		return candidate;
	}

	public RoundTag getRound() {
		return round;
	}

	public String getGene() {
		return candidate.getGene();
	}

	public int getStart() {
		return candidate.getStart();
	}

	public String getSequence() {
		return candidate.getSequence();
	}

	@Override
	public int compareTo(SampledKmer o) {
		int c = candidate.compareTo(o.candidate);
		return c != 0 ? c : round.compareTo(o.round);
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof SampledKmer)) return false;
		SampledKmer s = (SampledKmer) o;
		return candidate.equals(s.candidate) && round.equals(s.round);
	}

	@Override
	public int hashCode() {
		return candidate.hashCode() * 31 + round.hashCode();
	}

	@Override
	public String toString() {
		return candidate.toString() + "@" + round;
	}

}
