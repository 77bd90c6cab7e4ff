package padlock.design;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

import junit.framework.TestCase;
import padlock.core.error.InputNotFoundException;
import padlock.core.error.MissingCustomBarcodeEntryException;
import padlock.design.barcode.Probe;
import padlock.design.candidate.GeneAlignment;
import padlock.design.candidate.IsoformAligner;
import padlock.design.candidate.NotFoundReason;
import padlock.design.classify.GeneBucket;
import padlock.design.reference.TranscriptEntry;
import padlock.design.sampling.SampledKmer;
import padlock.design.sampling.SampledRound;
import padlock.design.specificity.MatchResult;

public class PadlockProbeDesignerTest extends TestCase {

	private static final String GENEA = "GAGCTGGTGTGTTATCCATTCATGGCAGACAACTAATACG";
	private static final String GENEB = "TGCGAGTTGGGCGTACATACAGTTATAGTGTTTACCGATC";
	private static final String GENEC = "TCAGGGATATAGAATCCTAAATCAGAAATGGAACAAAGCA";

	// Pads rows at the end to the longest isoform
	private static final IsoformAligner PADDING_ALIGNER = new IsoformAligner() {
		@Override
		public GeneAlignment align(String gene, List<TranscriptEntry> isoforms) {
			int width = 0;
			for(TranscriptEntry e : isoforms) width = Math.max(width, e.getSequence().length());
			List<String> rows = new ArrayList<String>();
			for(TranscriptEntry e : isoforms) rows.add(StringUtils.rightPad(e.getSequence(), width, '-'));
			return new GeneAlignment(gene, rows);
		}
	};

	private File dir;
	private File out;

	@Override
	protected void setUp() throws IOException {
		dir = Files.createTempDirectory("designer").toFile();
		out = new File(dir, "out");
		write("genes.csv", "Gene\nGENEA\nGENEB\nGENEC\nBADGENE\n");
		write("rna.fa", ">NM_1 Homo sapiens gene A (GENEA), mRNA\n" + GENEA + "\n"
				+ ">NM_2 Homo sapiens gene B (GENEB), mRNA\n" + GENEB + "\n"
				+ ">NM_3 Homo sapiens gene C (GENEC), transcript variant 1, mRNA\n" + GENEC + "\n"
				+ ">NM_4 Homo sapiens gene C (GENEC), transcript variant 2, mRNA\n" + GENEC + "TCTC\n"
				+ ">NM_9 BADGENE mRNA\n" + StringUtils.repeat('A', 30) + "\n");
		write("barcodes.csv", "Lbar_ID,Backbone,code\n1,CTCAGAAAGG,AAAA\n2,TCCTCAATGC,CCCC\n3,GATTAGCCAT,GGGG\n");
	}

	@Override
	protected void tearDown() {
		FileUtils.deleteQuietly(dir);
	}

	private File write(String name, String contents) throws IOException {
		File f = new File(dir, name);
		FileUtils.writeStringToFile(f, contents, StandardCharsets.UTF_8);
		return f;
	}

	private DesignConfiguration config(String extraRounds, String barcodes) throws IOException {
		return config("2\t3", extraRounds, barcodes);
	}

	private DesignConfiguration config(String sampleSizes, String extraRounds, String barcodes) throws IOException {
		String text = ":Input\n"
				+ "gene_list\t" + new File(dir, "genes.csv").getAbsolutePath() + "\n"
				+ "transcriptome_fasta\t" + new File(dir, "rna.fa").getAbsolutePath() + "\n"
				+ "barcode_library\t" + new File(dir, "barcodes.csv").getAbsolutePath() + "\n"
				+ "output_dir\t" + out.getAbsolutePath() + "\n"
				+ "output_prefix\ttest\n"
				+ ":Candidates\nkmer_length\t8\ngc_min\t0\ngc_max\t100\n"
				+ ":Specificity\nmismatches\t0\nthreads\t2\n"
				+ ":Rounds\nsample_sizes\t" + sampleSizes + "\ntarget_specific\t2\nseed\t7\n" + extraRounds
				+ ":Barcodes\n" + barcodes;
		return DesignConfiguration.load(write("design.cfg", text).getAbsolutePath());
	}

	private static final String START_MODE = "assignment_mode\tstart\nassignment_param\t1\ncap_per_gene\ttrue\n";

	public void testFullDesign() throws Exception {
		DesignOutcome outcome = new PadlockProbeDesigner(config("", START_MODE), PADDING_ALIGNER).run();

		assertEquals(NotFoundReason.NOT_IN_REFERENCE, outcome.getExtraction().getNotFound().get("BADGENE"));
		assertEquals(33, outcome.getExtraction().getCandidates("GENEC").size());
		assertEquals(1, outcome.getRounds().size());
		assertEquals(Arrays.asList("GENEA", "GENEB", "GENEC"), outcome.getMerged().getGenes(GeneBucket.GOOD));
		assertEquals(Arrays.asList("BADGENE"), outcome.getMerged().getGenes(GeneBucket.NOT_FOUND));

		List<Probe> probes = outcome.getProbes();
		assertEquals(6, probes.size());
		int[] expectedIds = new int[] {1, 1, 2, 2, 3, 3};
		for(int i = 0; i < probes.size(); i++) {
			Probe p = probes.get(i);
			assertEquals(expectedIds[i], p.getBarcodeId());
			assertEquals(8, p.getFivePrimeArm().length() + p.getThreePrimeArm().length());
			assertTrue(p.getProbeSequence().startsWith(p.getFivePrimeArm()));
		}
		assertFalse(probes.get(0).getTargetSequence().equals(probes.get(1).getTargetSequence()));

		for(String name : new String[] {"candidates.tsv", "not_found.tsv", "round1.mapped.tsv", "round1.classification.tsv",
				"merged.classification.tsv", "merged.specific.tsv", "probes.tsv", "probes.fa"}) {
			assertTrue(name, new File(out, "test." + name).isFile());
		}
		assertFalse(new File(out, "test.round2.mapped.tsv").exists());
		List<String> notFound = Files.readAllLines(new File(out, "test.not_found.tsv").toPath(), StandardCharsets.UTF_8);
		assertEquals(Arrays.asList("gene\treason", "BADGENE\t" + NotFoundReason.NOT_IN_REFERENCE.getLabel()), notFound);
	}

	public void testSameSeedGivesSameProbes() throws Exception {
		List<Probe> first = new PadlockProbeDesigner(config("", START_MODE), PADDING_ALIGNER).run().getProbes();
		List<Probe> second = new PadlockProbeDesigner(config("", START_MODE), PADDING_ALIGNER).run().getProbes();
		assertEquals(first, second);
	}

	public void testPriorRoundTableSkipsSampling() throws Exception {
		DesignOutcome first = new PadlockProbeDesigner(config("", START_MODE), PADDING_ALIGNER).run();
		File prior = new File(dir, "prior.mapped.tsv");
		FileUtils.copyFile(new File(out, "test.round1.mapped.tsv"), prior);
		DesignOutcome second = new PadlockProbeDesigner(config("prior_round_table\t" + prior.getAbsolutePath() + "\n", START_MODE), PADDING_ALIGNER).run();
		assertTrue(second.getRounds().isEmpty());
		assertEquals(first.getProbes(), second.getProbes());
	}

	public void testTooFewGenesGetAnotherRound() throws Exception {
		// one k-mer per gene in round 1 is below the target of 2
		DesignOutcome outcome = new PadlockProbeDesigner(config("1\t3", "", START_MODE), PADDING_ALIGNER).run();

		assertEquals(2, outcome.getRounds().size());
		SampledRound first = outcome.getRounds().get(0);
		SampledRound second = outcome.getRounds().get(1);
		assertEquals(RoundTag.round(1), first.getRound());
		assertEquals(RoundTag.round(2), second.getRound());
		assertEquals(3, second.getRequestedPerGene());
		assertEquals(Arrays.asList("GENEA", "GENEB", "GENEC"), new ArrayList<String>(second.getKmersByGene().keySet()));
		for(String gene : second.getKmersByGene().keySet()) {
			assertEquals(1, first.getKmersByGene().get(gene).size());
			assertEquals(3, second.getKmersByGene().get(gene).size());
			Set<String> earlier = new HashSet<String>();
			for(SampledKmer k : first.getKmersByGene().get(gene)) earlier.add(k.getSequence());
			for(SampledKmer k : second.getKmersByGene().get(gene)) {
				assertFalse(gene + " " + k, earlier.contains(k.getSequence()));
			}
			assertEquals(4, outcome.getMerged().getSpecificResults(gene).size());
		}

		assertTrue(new File(out, "test.round2.mapped.tsv").isFile());
		assertTrue(new File(out, "test.round2.classification.tsv").isFile());
		assertEquals(Arrays.asList("GENEA", "GENEB", "GENEC"), outcome.getMerged().getGenes(GeneBucket.GOOD));
		assertTrue(outcome.getMerged().getGenes(GeneBucket.TOO_FEW).isEmpty());
		assertEquals(Arrays.asList("BADGENE"), outcome.getMerged().getGenes(GeneBucket.NOT_FOUND));
		assertEquals(6, outcome.getProbes().size());
	}

	public void testPriorRoundsContinueNumbering() throws Exception {
		DesignOutcome first = new PadlockProbeDesigner(config("1", "", START_MODE), PADDING_ALIGNER).run();
		assertEquals(Arrays.asList("GENEA", "GENEB", "GENEC"), first.getMerged().getGenes(GeneBucket.TOO_FEW));
		File round1 = new File(out, "test.round1.mapped.tsv");
		String round1Contents = FileUtils.readFileToString(round1, StandardCharsets.UTF_8);
		File prior = new File(dir, "prior.mapped.tsv");
		FileUtils.copyFile(round1, prior);

		DesignOutcome second = new PadlockProbeDesigner(config("3", "prior_round_table\t" + prior.getAbsolutePath() + "\n", START_MODE), PADDING_ALIGNER).run();
		assertEquals(1, second.getRounds().size());
		assertEquals(RoundTag.round(2), second.getRounds().get(0).getRound());
		assertTrue(new File(out, "test.round2.mapped.tsv").isFile());
		assertEquals(round1Contents, FileUtils.readFileToString(round1, StandardCharsets.UTF_8));
		assertEquals(Arrays.asList("GENEA", "GENEB", "GENEC"), second.getMerged().getGenes(GeneBucket.GOOD));
		Set<RoundTag> tags = new HashSet<RoundTag>();
		for(MatchResult r : second.getMerged().getSpecificResults("GENEA")) tags.add(r.getRound());
		assertEquals(new HashSet<RoundTag>(Arrays.asList(RoundTag.round(1), RoundTag.round(2))), tags);
	}

	public void testCustomModeMissingGene() throws Exception {
		write("custom.csv", "Gene,Lbar_ID\nGENEA,3\nGENEB,2\n");
		String custom = "assignment_mode\tcustom\nassignment_param\t" + new File(dir, "custom.csv").getAbsolutePath() + "\n";
		try {
			new PadlockProbeDesigner(config("", custom), PADDING_ALIGNER).run();
			fail("Expected MissingCustomBarcodeEntryException");
		} catch(MissingCustomBarcodeEntryException e) {
			assertEquals("GENEC", e.getGene());
		}
	}

	public void testMissingTranscriptome() throws Exception {
		DesignConfiguration c = config("", START_MODE);
		FileUtils.deleteQuietly(new File(dir, "rna.fa"));
		try {
			new PadlockProbeDesigner(c, PADDING_ALIGNER).run();
			fail("Expected InputNotFoundException");
		} catch(InputNotFoundException e) {
			// expected
		}
	}

}
