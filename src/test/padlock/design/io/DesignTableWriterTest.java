package padlock.design.io;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.FileUtils;

import junit.framework.TestCase;
import padlock.design.RoundTag;
import padlock.design.barcode.BarcodeEntry;
import padlock.design.barcode.Probe;
import padlock.design.candidate.CandidateKmer;
import padlock.design.sampling.SampledKmer;
import padlock.design.specificity.MatchResult;

public class DesignTableWriterTest extends TestCase {

	private File dir;

	@Override
	protected void setUp() throws IOException {
		dir = Files.createTempDirectory("tablewriter").toFile();
	}

	@Override
	protected void tearDown() {
		FileUtils.deleteQuietly(dir);
	}

	private static MatchResult result(String gene, int start, String seq, RoundTag round, int hits, boolean source, String... entries) {
		return new MatchResult(new SampledKmer(new CandidateKmer(gene, start, seq, RoundTag.EXTRACTION), round), Arrays.asList(entries), hits, source);
	}

	public void testMappedTableReadsBack() throws Exception {
		List<MatchResult> results = Arrays.asList(
				result("GLI3", 12, "ACGTTGCA", RoundTag.round(1), 1, true, "NM_000168.6 Homo sapiens GLI family zinc finger 3 (GLI3), mRNA"),
				result("GLI3", 40, "GGGATTCA", RoundTag.parse("round1+round2"), 2, true, "NM_1 (GLI3)", "NM_2 (MSI2)"),
				result("MSI2", 3, "TTTTCCCC", RoundTag.round(2), 0, false));
		DesignTableWriter writer = new DesignTableWriter(dir, "panel");
		File mapped = writer.writeMapped("round1", results);
		assertEquals(new File(dir, "panel.round1.mapped.tsv"), mapped);
		List<String> lines = Files.readAllLines(mapped.toPath(), StandardCharsets.UTF_8);
		assertEquals(4, lines.size());
		assertTrue(lines.get(0).startsWith("gene\tstart\tsequence\tgc_percent"));
		assertEquals(results, MappedTableReader.load(mapped));
	}

	public void testHeadersWithSeparatorReadBack() throws Exception {
		MatchResult r = result("GLI3", 5, "ACGTACGT", RoundTag.round(1), 2, true,
				"NM_5 (GLI3); alt splice 5%3B", "NM_6 (GLI3)\tpredicted", "NM_7 (MSI2)");
		assertEquals(3, r.getMatchedEntriesString().split(MatchResult.ENTRY_SEPARATOR).length);
		File mapped = new DesignTableWriter(dir, "panel").writeMapped("round1", Collections.singletonList(r));
		assertEquals(2, Files.readAllLines(mapped.toPath(), StandardCharsets.UTF_8).size());
		MatchResult back = MappedTableReader.load(mapped).get(0);
		assertEquals(r.getMatchedEntries(), back.getMatchedEntries());
		assertEquals(r, back);
	}

	public void testProbeTableAndFasta() throws Exception {
		BarcodeEntry barcode = new BarcodeEntry(227, "CTCAG", "AGCT", "L227");
		Probe probe = new Probe("GLI3", "AAAACCCCGG", 12, RoundTag.round(1), "GTTTT", "CCGGG", barcode);
		DesignTableWriter writer = new DesignTableWriter(dir, "panel");
		writer.writeProbes(Collections.singletonList(probe));
		List<String> table = Files.readAllLines(new File(dir, "panel.probes.tsv").toPath(), StandardCharsets.UTF_8);
		assertEquals(2, table.size());
		assertEquals("GLI3\t227\tAGCT\tL227\t12\tAAAACCCCGG\tGTTTT\tCCGGG\tGTTTTCTCAGCCGGG\tround1", table.get(1));
		List<String> fasta = Files.readAllLines(new File(dir, "panel.probes.fa").toPath(), StandardCharsets.UTF_8);
		assertEquals(">GLI3_12_Lbar227", fasta.get(0));
		assertEquals("GTTTTCTCAGCCGGG", fasta.get(1));
	}

}
