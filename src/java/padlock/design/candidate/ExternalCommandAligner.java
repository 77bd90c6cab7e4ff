package padlock.design.candidate;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import htsjdk.samtools.reference.ReferenceSequence;
import padlock.core.error.ExternalToolException;
import padlock.core.error.ParseException;
import padlock.core.job.LocalJob;
import padlock.core.sequence.FastaIO;
import padlock.design.reference.TranscriptEntry;

/**
 * Aligns isoforms with an external program, e.g.
 * <code>clustalo -i {input} -o {output} --outfmt=fa --force</code>.
 * Isoforms are written to {input}; the aligned FASTA is read from {output}.
 */
public class ExternalCommandAligner implements IsoformAligner {

	private static Logger logger = Logger.getLogger(ExternalCommandAligner.class.getName());
	private static final String TOOL = "aligner";
	private static final String[] PLACEHOLDERS = new String[] {"input", "output"};

	private final String commandTemplate;
	private final File workDir;
	private final long timeoutSeconds;

	/**
	 * @param commandTemplate Command with {input} and {output} placeholders
	 * @param workDir Directory for temporary files
	 * @param timeoutSeconds Maximum run time per gene
	 */
	public ExternalCommandAligner(String commandTemplate, File workDir, long timeoutSeconds) {
		if(!commandTemplate.contains("{input}") || !commandTemplate.contains("{output}")) {
			throw new IllegalArgumentException("Aligner command must contain {input} and {output}: " + commandTemplate);
		}
		this.commandTemplate = commandTemplate;
		this.workDir = workDir;
		this.timeoutSeconds = timeoutSeconds;
	}

	@Override
	public GeneAlignment align(String gene, List<TranscriptEntry> isoforms) throws ExternalToolException, InterruptedException {
		File input = null;
		File output = null;
		LocalJob job = null;
		try {
			input = File.createTempFile("isoforms_" + safeName(gene) + "_", ".fa", workDir);
			output = File.createTempFile("aligned_" + safeName(gene) + "_", ".fa", workDir);
			List<String> names = new ArrayList<String>();
			List<String> seqs = new ArrayList<String>();
			for(int i = 0; i < isoforms.size(); i++) {
				names.add("isoform" + i);
				seqs.add(isoforms.get(i).getSequence());
			}
			FastaIO.write(input, names, seqs);
			List<String> command = LocalJob.buildCommand(commandTemplate, PLACEHOLDERS, new String[] {input.getAbsolutePath(), output.getAbsolutePath()});
			job = new LocalJob("align_" + safeName(gene), command, workDir);
			logger.debug("Aligning " + isoforms.size() + " isoforms of " + gene);
			job.runToCompletion(TOOL, timeoutSeconds, TimeUnit.SECONDS);
			List<String> rows = new ArrayList<String>();
			for(ReferenceSequence rec : FastaIO.read(output)) {
				rows.add(rec.getBaseString());
			}
			if(rows.size() != isoforms.size()) {
				throw new ExternalToolException(TOOL, "expected " + isoforms.size() + " aligned rows for " + gene + " but got " + rows.size());
			}
			return new GeneAlignment(gene, rows);
		} catch(IOException e) {
			throw new ExternalToolException(TOOL, "could not write or read alignment files for " + gene + ": " + e.getMessage(), e);
		} catch(ParseException e) {
			throw new ExternalToolException(TOOL, "unreadable alignment for " + gene + ": " + e.getMessage(), e);
		} catch(IllegalArgumentException e) {
			throw new ExternalToolException(TOOL, "malformed alignment for " + gene + ": " + e.getMessage(), e);
		} finally {
			FileUtils.deleteQuietly(input);
			FileUtils.deleteQuietly(output);
			if(job != null) job.cleanUp();
		}
	}

	private static String safeName(String gene) {
		return gene.replaceAll("[^A-Za-z0-9_.-]", "_");
	}

}
