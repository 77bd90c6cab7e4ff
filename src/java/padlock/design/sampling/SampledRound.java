package padlock.design.sampling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import padlock.design.RoundTag;

/**
 * The k-mers drawn for each gene in one round, plus the genes that got fewer than requested
 */
public final class SampledRound {

	private final RoundTag round;
	private final int requestedPerGene;
	private final Map<String, List<SampledKmer>> kmersByGene;
	private final Map<String, Integer> shortfalls;

	/**
	 * @param round Round
	 * @param requestedPerGene Requested sample size per gene
	 * @param kmersByGene Selected k-mers per gene in roster order
	 */
	public SampledRound(RoundTag round, int requestedPerGene, Map<String, List<SampledKmer>> kmersByGene) {
		this.round = round;
		this.requestedPerGene = requestedPerGene;
		Map<String, List<SampledKmer>> k = new LinkedHashMap<String, List<SampledKmer>>();
		Map<String, Integer> s = new LinkedHashMap<String, Integer>();
		for(Map.Entry<String, List<SampledKmer>> e : kmersByGene.entrySet()) {
			k.put(e.getKey(), Collections.unmodifiableList(new ArrayList<SampledKmer>(e.getValue())));
			if(e.getValue().size() < requestedPerGene) {
				s.put(e.getKey(), Integer.valueOf(requestedPerGene - e.getValue().size()));
			}
		}
		this.kmersByGene = Collections.unmodifiableMap(k);
		this.shortfalls = Collections.unmodifiableMap(s);
	}

	public RoundTag getRound() {
		return round;
	}

	public int getRequestedPerGene() {
		return requestedPerGene;
	}

	public Map<String, List<SampledKmer>> getKmersByGene() {
		return kmersByGene;
	}

	/**
	 * @return All selected k-mers, gene by gene in roster order
	 */
	public List<SampledKmer> getAllKmers() {
		List<SampledKmer> rtrn = new ArrayList<SampledKmer>();
		for(List<SampledKmer> list : kmersByGene.values()) {
			rtrn.addAll(list);
		}
		return rtrn;
	}

	/**
	 * @return For each gene that got fewer k-mers than requested, the number missing
	 */
	public Map<String, Integer> getShortfalls() {
		return shortfalls;
	}

}
