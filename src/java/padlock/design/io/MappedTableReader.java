package padlock.design.io;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.List;

import org.apache.log4j.Logger;

import padlock.core.error.InputNotFoundException;
import padlock.core.error.ParseException;
import padlock.core.general.TabbedReader;
import padlock.design.RoundTag;
import padlock.design.candidate.CandidateKmer;
import padlock.design.sampling.SampledKmer;
import padlock.design.specificity.MatchResult;

/**
 * Reads match tables written by {@link DesignTableWriter}, e.g. from an earlier run
 */
public final class MappedTableReader {

	private static Logger logger = Logger.getLogger(MappedTableReader.class.getName());

	private MappedTableReader() {}

	private static final TabbedReader.Factory<MatchResult> FACTORY = new TabbedReader.Factory<MatchResult>() {
		@Override
		public MatchResult create(TabbedReader.Header header, String[] f) throws ParseException {
			String gene = f[header.requireIndex("gene")];
			int start = Integer.parseInt(f[header.requireIndex("start")]);
			String seq = f[header.requireIndex("sequence")];
			RoundTag round = RoundTag.parse(f[header.requireIndex("round")]);
			int hitCount = Integer.parseInt(f[header.requireIndex("hit_count")]);
			boolean hitsSource = parseBoolean(f[header.requireIndex("hits_source_gene")]);
			int entriesCol = header.requireIndex("matched_entries");
			String entries = entriesCol < f.length ? f[entriesCol] : "";
			List<String> matched = MatchResult.parseMatchedEntries(entries);
			SampledKmer kmer = new SampledKmer(new CandidateKmer(gene, start, seq, RoundTag.EXTRACTION), round);
			return new MatchResult(kmer, matched, hitCount, hitsSource);
		}
	};

	private static boolean parseBoolean(String s) {
		if(!s.equalsIgnoreCase("true") && !s.equalsIgnoreCase("false")) {
			throw new IllegalArgumentException("Not true/false: " + s);
		}
		return Boolean.parseBoolean(s);
	}

	/**
	 * @param file Match table
	 * @return Results in file order
	 * @throws InputNotFoundException If the file cannot be read
	 * @throws ParseException If the table is malformed
	 * @throws IOException
	 */
	public static List<MatchResult> load(File file) throws IOException, InputNotFoundException, ParseException {
		List<MatchResult> rtrn = TabbedReader.load(file, FACTORY);
		logger.info("Read " + rtrn.size() + " match results from " + file);
		return rtrn;
	}

	public static List<MatchResult> load(Reader reader, String sourceName) throws ParseException {
		return TabbedReader.load(reader, FACTORY, sourceName);
	}

}
