package padlock.design.reference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One record of the reference transcriptome.
 * The gene symbol is read from parentheses in the header, e.g.
 * <code>NM_000168.6 Homo sapiens GLI family zinc finger 3 (GLI3), mRNA</code>.
 */
public final class TranscriptEntry {

	private static final Pattern PARENTHESIZED = Pattern.compile("\\(([^()\\s]+)\\)");

	private final String header;
	private final List<String> symbols;
	private final String sequence;

	/**
	 * @param header Full FASTA header without the leading '&gt;'
	 * @param sequence Bases; stored upper case
	 */
	public TranscriptEntry(String header, String sequence) {
		this.header = header;
		this.sequence = sequence.toUpperCase(Locale.ROOT);
		this.symbols = parseSymbols(header);
	}

	/**
	 * @param header FASTA header
	 * @return All parenthesized single-token values in order of appearance
	 */
	public static List<String> parseSymbols(String header) {
		List<String> rtrn = new ArrayList<String>();
		Matcher m = PARENTHESIZED.matcher(header);
		while(m.find()) {
			rtrn.add(m.group(1));
		}
		return Collections.unmodifiableList(rtrn);
	}

	public String getHeader() {
		return header;
	}

	/**
	 * @return Identifier: first whitespace separated token of the header
	 */
	public String getId() {
		int space = header.indexOf(' ');
		return space < 0 ? header : header.substring(0, space);
	}

	public String getSequence() {
		return sequence;
	}

	public List<String> getSymbols() {
		return symbols;
	}

	/**
	 * @param gene Gene symbol
	 * @return Whether the header names the gene in parentheses
	 */
	public boolean belongsTo(String gene) {
		return symbols.contains(gene);
	}

	/**
	 * @return The last parenthesized symbol, which RefSeq-style headers use for the gene,
	 * or the header itself if there is none
	 */
	public String getPrimarySymbol() {
		return symbols.isEmpty() ? header : symbols.get(symbols.size() - 1);
	}

	@Override
	public String toString() {
		return header;
	}

}
