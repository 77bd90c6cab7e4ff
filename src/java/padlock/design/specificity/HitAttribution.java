package padlock.design.specificity;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import padlock.design.reference.TranscriptEntry;

/**
 * How matched entries are counted as hits
 */
public enum HitAttribution {

	/**
	 * Entries are collapsed by gene symbol; isoforms of one gene count once
	 */
	GENE,

	/**
	 * Each distinct entry counts
	 */
	ENTRY;

	/**
	 * @param matchedHeaders Headers of matched entries
	 * @param sourceGene Gene the query came from
	 * @return Number of hits
	 */
	public int countHits(Collection<String> matchedHeaders, String sourceGene) {
		Set<String> keys = new HashSet<String>();
		for(String header : matchedHeaders) {
			keys.add(this == ENTRY ? header : geneKey(header, sourceGene));
		}
		return keys.size();
	}

	private static String geneKey(String header, String sourceGene) {
		List<String> symbols = TranscriptEntry.parseSymbols(header);
		if(symbols.contains(sourceGene)) {
			return sourceGene;
		}
		return symbols.isEmpty() ? header : symbols.get(symbols.size() - 1);
	}

	/**
	 * @param matchedHeaders Headers of matched entries
	 * @param sourceGene Gene the query came from
	 * @return Whether some matched entry names the source gene
	 */
	public static boolean hitsSourceGene(Collection<String> matchedHeaders, String sourceGene) {
		for(String header : matchedHeaders) {
			if(TranscriptEntry.parseSymbols(header).contains(sourceGene)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @param name "gene" or "entry", any case
	 * @return The attribution
	 */
	public static HitAttribution fromName(String name) {
		return valueOf(name.toUpperCase(Locale.ROOT));
	}

}
