package padlock.core.sequence;

import htsjdk.samtools.util.SequenceUtil;

/**
 * Static helpers for upper-case DNA strings
 */
public final class SequenceUtils {

	/**
	 * Gap character in aligned sequences
	 */
	public static final char GAP = '-';

	private SequenceUtils() {}

	/**
	 * @param c Base
	 * @return Whether c is one of A, C, G, T
	 */
	public static boolean isACGT(char c) {
		return c == 'A' || c == 'C' || c == 'G' || c == 'T';
	}

	/**
	 * @param seq Sequence
	 * @return Fraction of G and C bases over the full length
	 */
	public static double gcFraction(String seq) {
		if(seq.isEmpty()) {
			return 0;
		}
		return (double) gcCount(seq) / seq.length();
	}

	/**
	 * @param seq Sequence
	 * @return Number of G and C bases
	 */
	public static int gcCount(String seq) {
		int gc = 0;
		for(int i = 0; i < seq.length(); i++) {
			char c = seq.charAt(i);
			if(c == 'G' || c == 'C') gc++;
		}
		return gc;
	}

	/**
	 * @param seq Sequence
	 * @return Reverse complement
	 */
	public static String reverseComplement(String seq) {
		return SequenceUtil.reverseComplement(seq);
	}

	/**
	 * Substitution-only distance between the query and the window of the target starting at offset,
	 * giving up once the distance exceeds maxMismatches
	 * @param query Query
	 * @param target Target
	 * @param offset Window start in target; the window must fit
	 * @param maxMismatches Threshold
	 * @return The distance, or maxMismatches + 1 if it exceeds the threshold
	 */
	public static int boundedHammingDistance(String query, String target, int offset, int maxMismatches) {
		int mismatches = 0;
		for(int i = 0; i < query.length(); i++) {
			if(query.charAt(i) != target.charAt(offset + i)) {
				mismatches++;
				if(mismatches > maxMismatches) {
					return mismatches;
				}
			}
		}
		return mismatches;
	}

	/**
	 * @param query Query
	 * @param target Target
	 * @param maxMismatches Threshold
	 * @return Whether some window of target of the query's length is within maxMismatches substitutions of the query
	 */
	public static boolean containsWithMismatches(String query, String target, int maxMismatches) {
		int last = target.length() - query.length();
		if(maxMismatches == 0) {
			return target.indexOf(query) >= 0;
		}
		for(int offset = 0; offset <= last; offset++) {
			if(boundedHammingDistance(query, target, offset, maxMismatches) <= maxMismatches) {
				return true;
			}
		}
		return false;
	}

}
