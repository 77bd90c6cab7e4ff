package padlock.design.reference;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import htsjdk.samtools.reference.ReferenceSequence;
import padlock.core.error.InputNotFoundException;
import padlock.core.error.ParseException;
import padlock.core.sequence.FastaIO;

/**
 * The reference transcriptome held in memory. Read-only after construction and
 * safe to share between search threads.
 */
public final class Transcriptome {

	private static Logger logger = Logger.getLogger(Transcriptome.class.getName());

	private final List<TranscriptEntry> entries;
	private final Map<String, List<TranscriptEntry>> entriesBySymbol;
	private final String source;

	/**
	 * @param entries Entries in file order
	 * @param sourceName Where the entries came from
	 */
	public Transcriptome(List<TranscriptEntry> entries, String sourceName) {
		this.entries = Collections.unmodifiableList(new ArrayList<TranscriptEntry>(entries));
		this.source = sourceName;
		Map<String, List<TranscriptEntry>> bySymbol = new HashMap<String, List<TranscriptEntry>>();
		for(TranscriptEntry entry : this.entries) {
			for(String symbol : entry.getSymbols()) {
				List<TranscriptEntry> list = bySymbol.get(symbol);
				if(list == null) {
					list = new ArrayList<TranscriptEntry>();
					bySymbol.put(symbol, list);
				}
				if(!list.contains(entry)) {
					list.add(entry);
				}
			}
		}
		Map<String, List<TranscriptEntry>> frozen = new HashMap<String, List<TranscriptEntry>>();
		for(Map.Entry<String, List<TranscriptEntry>> e : bySymbol.entrySet()) {
			frozen.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
		}
		this.entriesBySymbol = Collections.unmodifiableMap(frozen);
	}

	/**
	 * Load a FASTA file keeping full headers
	 * @param fasta FASTA file
	 * @return The transcriptome
	 * @throws InputNotFoundException If the file cannot be read
	 * @throws ParseException If the file is not valid FASTA or has no records
	 */
	public static Transcriptome load(File fasta) throws InputNotFoundException, ParseException {
		InputNotFoundException.assertReadable(fasta, "Reference transcriptome");
		logger.info("Loading reference transcriptome from " + fasta + "...");
		List<TranscriptEntry> entries = new ArrayList<TranscriptEntry>();
		for(ReferenceSequence seq : FastaIO.read(fasta)) {
			entries.add(new TranscriptEntry(seq.getName(), seq.getBaseString()));
		}
		if(entries.isEmpty()) {
			throw new ParseException("Reference transcriptome " + fasta + " has no records");
		}
		Transcriptome rtrn = new Transcriptome(entries, fasta.getPath());
		logger.info("Loaded " + entries.size() + " transcripts for " + rtrn.entriesBySymbol.size() + " gene symbols.");
		return rtrn;
	}

	public List<TranscriptEntry> getEntries() {
		return entries;
	}

	/**
	 * @param gene Gene symbol
	 * @return Entries whose header names the gene in parentheses; empty if none
	 */
	public List<TranscriptEntry> getIsoforms(String gene) {
		List<TranscriptEntry> rtrn = entriesBySymbol.get(gene);
		return rtrn == null ? Collections.<TranscriptEntry>emptyList() : rtrn;
	}

	/**
	 * @param gene Gene symbol
	 * @return Whether any header names the gene
	 */
	public boolean hasGene(String gene) {
		return entriesBySymbol.containsKey(gene);
	}

	public int size() {
		return entries.size();
	}

	public String getSource() {
		return source;
	}

}
