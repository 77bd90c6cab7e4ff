package padlock.design.candidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import padlock.core.sequence.SequenceUtils;

/**
 * Aligned isoform rows of one gene. All rows have the same length.
 */
public final class GeneAlignment {

	private final String gene;
	private final List<String> rows;
	private final int numColumns;

	/**
	 * @param gene Gene
	 * @param alignedRows One row per isoform; bases and '-' gaps
	 * @throws IllegalArgumentException If there are no rows or the rows differ in length
	 */
	public GeneAlignment(String gene, List<String> alignedRows) {
		if(alignedRows.isEmpty()) {
			throw new IllegalArgumentException("Alignment for " + gene + " has no rows");
		}
		List<String> tmp = new ArrayList<String>();
		int len = alignedRows.get(0).length();
		for(String row : alignedRows) {
			if(row.length() != len) {
				throw new IllegalArgumentException("Alignment rows for " + gene + " differ in length: " + len + " vs " + row.length());
			}
			tmp.add(row.toUpperCase(Locale.ROOT));
		}
		this.gene = gene;
		this.rows = Collections.unmodifiableList(tmp);
		this.numColumns = len;
	}

	public String getGene() {
		return gene;
	}

	public List<String> getRows() {
		return rows;
	}

	public int getNumColumns() {
		return numColumns;
	}

	public int getNumRows() {
		return rows.size();
	}

	/**
	 * @param column Column index
	 * @return Whether all rows carry the same A/C/G/T base in the column
	 */
	public boolean isConserved(int column) {
		char c = rows.get(0).charAt(column);
		if(!SequenceUtils.isACGT(c)) {
			return false;
		}
		for(int i = 1; i < rows.size(); i++) {
			if(rows.get(i).charAt(column) != c) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return Maximal runs of conserved columns as [start, end) pairs in left to right order
	 */
	public List<int[]> getConservedRuns() {
		List<int[]> rtrn = new ArrayList<int[]>();
		int runStart = -1;
		for(int i = 0; i < numColumns; i++) {
			if(isConserved(i)) {
				if(runStart < 0) runStart = i;
			} else if(runStart >= 0) {
				rtrn.add(new int[] {runStart, i});
				runStart = -1;
			}
		}
		if(runStart >= 0) {
			rtrn.add(new int[] {runStart, numColumns});
		}
		return rtrn;
	}

	/**
	 * @param start First column
	 * @param end Column after the last
	 * @return Bases of the first row in the range
	 */
	public String getConsensus(int start, int end) {
		return rows.get(0).substring(start, end);
	}

}
