package padlock.design.io;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import padlock.core.sequence.FastaIO;
import padlock.design.barcode.Probe;
import padlock.design.candidate.CandidateKmer;
import padlock.design.candidate.ExtractionResult;
import padlock.design.candidate.NotFoundReason;
import padlock.design.classify.ClassificationResult;
import padlock.design.classify.GeneClassification;
import padlock.design.specificity.MatchResult;

/**
 * Writes the design tables as tab separated files named &lt;prefix&gt;.&lt;label&gt;.tsv in the output directory
 */
public class DesignTableWriter {

	private static Logger logger = Logger.getLogger(DesignTableWriter.class.getName());

	/**
	 * Columns of match tables, also read back by {@link MappedTableReader}
	 */
	public static final String[] MATCH_COLUMNS = new String[] {"gene", "start", "sequence", "gc_percent", "round", "hit_count", "hits_source_gene", "specific", "matched_entries"};

	private final File outputDir;
	private final String prefix;

	/**
	 * @param outputDir Output directory; created if absent
	 * @param prefix File name prefix
	 * @throws IOException If the directory cannot be created
	 */
	public DesignTableWriter(File outputDir, String prefix) throws IOException {
		Files.createDirectories(outputDir.toPath());
		this.outputDir = outputDir;
		this.prefix = prefix;
	}

	/**
	 * @param label Middle part of the name, e.g. "round1.mapped"
	 * @param extension Extension without the dot
	 * @return Output file
	 */
	public File getFile(String label, String extension) {
		return new File(outputDir, prefix + "." + label + "." + extension);
	}

	public File writeCandidates(ExtractionResult extraction) throws IOException {
		List<String> lines = new ArrayList<String>();
		lines.add(row("gene", "start", "end", "sequence", "gc_percent"));
		for(List<CandidateKmer> kmers : extraction.getFound().values()) {
			for(CandidateKmer k : kmers) {
				lines.add(row(k.getGene(), Integer.toString(k.getStart()), Integer.toString(k.getEnd()), k.getSequence(), formatPct(k.getGcPercent())));
			}
		}
		return write(getFile("candidates", "tsv"), lines);
	}

	public File writeNotFound(ExtractionResult extraction) throws IOException {
		List<String> lines = new ArrayList<String>();
		lines.add(row("gene", "reason"));
		for(Map.Entry<String, NotFoundReason> e : extraction.getNotFound().entrySet()) {
			lines.add(row(e.getKey(), e.getValue().getLabel()));
		}
		return write(getFile("not_found", "tsv"), lines);
	}

	/**
	 * @param label Round label for the file name, e.g. "round1"
	 * @param results Match results
	 * @return The file written
	 * @throws IOException
	 */
	public File writeMapped(String label, List<MatchResult> results) throws IOException {
		return writeMatches(getFile(label + ".mapped", "tsv"), results);
	}

	/**
	 * @param label "merged" or a round label
	 * @param result Classification
	 * @return The file written
	 * @throws IOException
	 */
	public File writeSpecific(String label, ClassificationResult result) throws IOException {
		return writeMatches(getFile(label + ".specific", "tsv"), result.getSpecificResults());
	}

	public File writeClassification(String label, ClassificationResult result) throws IOException {
		List<String> lines = new ArrayList<String>();
		lines.add(row("gene", "bucket", "num_specific", "num_tested", "not_found_reason"));
		for(GeneClassification c : result.getClassifications().values()) {
			String reason = c.getNotFoundReason() == null ? "" : c.getNotFoundReason().getLabel();
			lines.add(row(c.getGene(), c.getBucket().getLabel(), Integer.toString(c.getNumSpecific()), Integer.toString(c.getNumTested()), reason));
		}
		return write(getFile(label + ".classification", "tsv"), lines);
	}

	public File writeProbes(List<Probe> probes) throws IOException {
		List<String> lines = new ArrayList<String>();
		lines.add(row("gene", "Lbar_ID", "code", "ID", "target_start", "target_sequence", "five_prime_arm", "three_prime_arm", "probe_sequence", "round"));
		List<String> names = new ArrayList<String>();
		List<String> seqs = new ArrayList<String>();
		for(Probe p : probes) {
			lines.add(row(p.getGene(), Integer.toString(p.getBarcodeId()), p.getCode(), StringUtils.defaultString(p.getExternalId()),
					Integer.toString(p.getTargetStart()), p.getTargetSequence(), p.getFivePrimeArm(), p.getThreePrimeArm(), p.getProbeSequence(), p.getRound().getLabel()));
			names.add(p.getGene() + "_" + p.getTargetStart() + "_Lbar" + p.getBarcodeId());
			seqs.add(p.getProbeSequence());
		}
		File fasta = getFile("probes", "fa");
		FastaIO.write(fasta, names, seqs);
		logger.info("Wrote " + fasta);
		return write(getFile("probes", "tsv"), lines);
	}

	private static File writeMatches(File file, List<MatchResult> results) throws IOException {
		List<String> lines = new ArrayList<String>();
		lines.add(row(MATCH_COLUMNS));
		for(MatchResult r : results) {
			lines.add(row(r.getGene(), Integer.toString(r.getKmer().getStart()), r.getSequence(), formatPct(r.getKmer().getCandidate().getGcPercent()),
					r.getRound().getLabel(), Integer.toString(r.getHitCount()), Boolean.toString(r.hitsSourceGene()), Boolean.toString(r.isSpecific()),
					r.getMatchedEntriesString()));
		}
		return write(file, lines);
	}

	private static String formatPct(double pct) {
		return String.format(Locale.ROOT, "%.2f", pct);
	}

	private static String row(String... fields) {
		return StringUtils.join(fields, "\t");
	}

	private static File write(File file, List<String> lines) throws IOException {
		try(BufferedWriter w = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
			for(String line : lines) {
				w.write(line);
				w.newLine();
			}
		}
		logger.info("Wrote " + (lines.size() - 1) + " rows to " + file);
		return file;
	}

}
