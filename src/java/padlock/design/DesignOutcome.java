package padlock.design;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import padlock.design.barcode.Probe;
import padlock.design.candidate.ExtractionResult;
import padlock.design.classify.ClassificationResult;
import padlock.design.sampling.SampledRound;

/**
 * Everything a design run produced
 */
public final class DesignOutcome {

	private final ExtractionResult extraction;
	private final List<SampledRound> rounds;
	private final ClassificationResult merged;
	private final List<Probe> probes;

	public DesignOutcome(ExtractionResult extraction, List<SampledRound> rounds, ClassificationResult merged, List<Probe> probes) {
		this.extraction = extraction;
		this.rounds = Collections.unmodifiableList(new ArrayList<SampledRound>(rounds));
		this.merged = merged;
		this.probes = Collections.unmodifiableList(new ArrayList<Probe>(probes));
	}

	public ExtractionResult getExtraction() {
		return extraction;
	}

	/**
	 * @return Sampling rounds run, in order
	 */
	public List<SampledRound> getRounds() {
		return rounds;
	}

	/**
	 * @return Classification of all rounds and prior tables merged
	 */
	public ClassificationResult getMerged() {
		return merged;
	}

	public List<Probe> getProbes() {
		return probes;
	}

}
