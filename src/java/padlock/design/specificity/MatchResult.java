package padlock.design.specificity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;

import padlock.design.RoundTag;
import padlock.design.sampling.SampledKmer;

/**
 * Transcriptome hits of one sampled k-mer. Specific if it hits exactly one gene or entry,
 * and that hit belongs to the source gene.
 */
public final class MatchResult implements Comparable<MatchResult> {

	/**
	 * Separator between matched entries in tables
	 */
	public static final String ENTRY_SEPARATOR = ";";

	private static final String[] UNESCAPED = new String[] {"%", ENTRY_SEPARATOR, "\t", "\n"};
	private static final String[] ESCAPED = new String[] {"%25", "%3B", "%09", "%0A"};

	private final SampledKmer kmer;
	private final List<String> matchedEntries;
	private final int hitCount;
	private final boolean hitsSourceGene;

	/**
	 * @param kmer Query
	 * @param matchedEntries Headers of matched entries
	 * @param attribution How hits are counted
	 */
	public MatchResult(SampledKmer kmer, Collection<String> matchedEntries, HitAttribution attribution) {
		this(kmer, matchedEntries, attribution.countHits(matchedEntries, kmer.getGene()), HitAttribution.hitsSourceGene(matchedEntries, kmer.getGene()));
	}

	/**
	 * @param kmer Query
	 * @param matchedEntries Headers of matched entries
	 * @param hitCount Number of hits
	 * @param hitsSourceGene Whether a matched entry belongs to the source gene
	 */
	public MatchResult(SampledKmer kmer, Collection<String> matchedEntries, int hitCount, boolean hitsSourceGene) {
		if(hitCount < 0) {
			throw new IllegalArgumentException("Negative hit count for " + kmer);
		}
		this.kmer = kmer;
		this.matchedEntries = Collections.unmodifiableList(new ArrayList<String>(new TreeSet<String>(matchedEntries)));
		this.hitCount = hitCount;
		this.hitsSourceGene = hitsSourceGene;
	}

	public SampledKmer getKmer() {
		return kmer;
	}

	public String getGene() {
		return kmer.getGene();
	}

	public String getSequence() {
		return kmer.getSequence();
	}

	public RoundTag getRound() {
		return kmer.getRound();
	}

	/**
	 * @return Matched entry headers, sorted
	 */
	public List<String> getMatchedEntries() {
		return matchedEntries;
	}

	/**
	 * @return Matched entries joined by {@link #ENTRY_SEPARATOR}, with '%', the separator,
	 * tab and newline inside a header written as %25, %3B, %09 and %0A
	 */
	public String getMatchedEntriesString() {
		List<String> escaped = new ArrayList<String>();
		for(String entry : matchedEntries) {
			escaped.add(StringUtils.replaceEach(entry, UNESCAPED, ESCAPED));
		}
		return StringUtils.join(escaped, ENTRY_SEPARATOR);
	}

	/**
	 * Inverse of {@link #getMatchedEntriesString()}
	 * @param entries Joined entries; may be empty
	 * @return The matched entry headers
	 */
	public static List<String> parseMatchedEntries(String entries) {
		List<String> rtrn = new ArrayList<String>();
		if(StringUtils.isEmpty(entries)) {
			return rtrn;
		}
		for(String entry : StringUtils.split(entries, ENTRY_SEPARATOR)) {
			rtrn.add(StringUtils.replaceEach(entry, ESCAPED, UNESCAPED));
		}
		return rtrn;
	}

	public int getHitCount() {
		return hitCount;
	}

	public boolean hitsSourceGene() {
		return hitsSourceGene;
	}

	public boolean isSpecific() {
		return hitCount == 1 && hitsSourceGene;
	}

	/**
	 * @param round New round
	 * @return Same result carrying a different round tag
	 */
	public MatchResult withRound(RoundTag round) {
		return new MatchResult(new SampledKmer(kmer.getCandidate(), round), matchedEntries, hitCount, hitsSourceGene);
	}

	@Override
	public int compareTo(MatchResult o) {
		int c = getGene().compareTo(o.getGene());
		if(c != 0) return c;
		c = Integer.compare(kmer.getStart(), o.kmer.getStart());
		if(c != 0) return c;
		c = getSequence().compareTo(o.getSequence());
		if(c != 0) return c;
		return getRound().compareTo(o.getRound());
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof MatchResult)) return false;
		MatchResult m = (MatchResult) o;
		return kmer.equals(m.kmer) && matchedEntries.equals(m.matchedEntries) && hitCount == m.hitCount && hitsSourceGene == m.hitsSourceGene;
	}

	@Override
	public int hashCode() {
		return kmer.hashCode() * 31 + matchedEntries.hashCode() + hitCount;
	}

	@Override
	public String toString() {
		return kmer + " hits=" + hitCount + (isSpecific() ? " specific" : "");
	}

}
