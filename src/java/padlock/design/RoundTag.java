package padlock.design;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Identifies the round that produced a value. Merging two tags gives the sorted
 * union of their labels, so the result does not depend on merge order.
 */
public final class RoundTag implements Comparable<RoundTag> {

	private static final Pattern VALID_LABEL = Pattern.compile("[A-Za-z0-9_.-]+");
	private static final String SEPARATOR = "+";
	private static final Pattern ROUND_LABEL = Pattern.compile("round([0-9]+)");

	/**
	 * Tag for candidates produced by extraction, before any sampling round
	 */
	public static final RoundTag EXTRACTION = of("extraction");

	private final SortedSet<String> labels;

	private RoundTag(SortedSet<String> labels) {
		this.labels = Collections.unmodifiableSortedSet(labels);
	}

	/**
	 * @param label Letters, digits, '_', '.' or '-'
	 * @return Tag with a single label
	 */
	public static RoundTag of(String label) {
		if(label == null || !VALID_LABEL.matcher(label).matches()) {
			throw new IllegalArgumentException("Invalid round label: " + label);
		}
		SortedSet<String> set = new TreeSet<String>();
		set.add(label);
		return new RoundTag(set);
	}

	/**
	 * @param roundNumber 1-based round number
	 * @return Tag "round&lt;n&gt;"
	 */
	public static RoundTag round(int roundNumber) {
		if(roundNumber < 1) {
			throw new IllegalArgumentException("Round number must be positive: " + roundNumber);
		}
		return of("round" + roundNumber);
	}

	/**
	 * Parse a label written by {@link #getLabel()}
	 * @param label One or more labels joined by '+'
	 * @return The tag
	 */
	public static RoundTag parse(String label) {
		RoundTag rtrn = null;
		for(String part : StringUtils.split(label, SEPARATOR)) {
			RoundTag single = of(part);
			rtrn = rtrn == null ? single : rtrn.mergeWith(single);
		}
		if(rtrn == null) {
			throw new IllegalArgumentException("Empty round label");
		}
		return rtrn;
	}

	/**
	 * @param other Other tag
	 * @return Tag carrying the labels of both
	 */
	public RoundTag mergeWith(RoundTag other) {
		SortedSet<String> union = new TreeSet<String>(labels);
		union.addAll(other.labels);
		return new RoundTag(union);
	}

	/**
	 * @return Whether this tag came from merging several rounds
	 */
	public boolean isMerged() {
		return labels.size() > 1;
	}

	/**
	 * @return Largest n over the "round&lt;n&gt;" labels of this tag, or 0 if it has none
	 */
	public int getHighestRoundNumber() {
		int rtrn = 0;
		for(String label : labels) {
			Matcher m = ROUND_LABEL.matcher(label);
			if(m.matches()) {
				rtrn = Math.max(rtrn, Integer.parseInt(m.group(1)));
			}
		}
		return rtrn;
	}

	/**
	 * @return Labels joined by '+'
	 */
	public String getLabel() {
		return StringUtils.join(labels, SEPARATOR);
	}

	@Override
	public int compareTo(RoundTag o) {
		return getLabel().compareTo(o.getLabel());
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof RoundTag)) {
			return false;
		}
		return labels.equals(((RoundTag) o).labels);
	}

	@Override
	public int hashCode() {
		return labels.hashCode();
	}

	@Override
	public String toString() {
		return getLabel();
	}

}
