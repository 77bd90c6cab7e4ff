package padlock.core.sequence;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.FastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.reference.ReferenceSequenceFile;
import padlock.core.error.ParseException;

/**
 * Read and write FASTA files. Reading keeps full header lines as record names.
 */
public final class FastaIO {

	private static final int LINE_WIDTH = 60;

	private FastaIO() {}

	/**
	 * @param fasta FASTA file
	 * @return Records in file order
	 * @throws ParseException If the file cannot be read as FASTA
	 */
	public static List<ReferenceSequence> read(File fasta) throws ParseException {
		List<ReferenceSequence> rtrn = new ArrayList<ReferenceSequence>();
		try(ReferenceSequenceFile reader = new FastaSequenceFile(fasta.toPath(), false)) {
			ReferenceSequence seq;
			while((seq = reader.nextSequence()) != null) {
				rtrn.add(seq);
			}
		} catch(SAMException e) {
			throw new ParseException("Could not read FASTA " + fasta + ": " + e.getMessage(), e);
		} catch(IOException e) {
			throw new ParseException("Could not close FASTA " + fasta + ": " + e.getMessage(), e);
		}
		return rtrn;
	}

	/**
	 * @param fasta File to write
	 * @param names Record names
	 * @param sequences Sequences in the same order as names
	 * @throws IOException
	 */
	public static void write(File fasta, List<String> names, List<String> sequences) throws IOException {
		if(names.size() != sequences.size()) {
			throw new IllegalArgumentException("Got " + names.size() + " names and " + sequences.size() + " sequences");
		}
		try(BufferedWriter w = Files.newBufferedWriter(fasta.toPath(), StandardCharsets.UTF_8)) {
			for(int i = 0; i < names.size(); i++) {
				w.write(">" + names.get(i));
				w.newLine();
				String seq = sequences.get(i);
				for(int j = 0; j < seq.length(); j += LINE_WIDTH) {
					w.write(seq, j, Math.min(LINE_WIDTH, seq.length() - j));
					w.newLine();
				}
			}
		}
	}

}
