package padlock.design.barcode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;
import padlock.core.error.BarcodeRangeExhaustedException;
import padlock.core.error.MissingCustomBarcodeEntryException;
import padlock.design.RoundTag;
import padlock.design.candidate.CandidateKmer;
import padlock.design.sampling.SampledKmer;
import padlock.design.specificity.MatchResult;

public class BarcodeAssignerTest extends TestCase {

	private static final String BACKBONE = "CTCAGAAAGGAACAGGAGATTAG";

	private static BarcodeLibrary library(int... ids) {
		List<BarcodeEntry> entries = new ArrayList<BarcodeEntry>();
		for(int id : ids) {
			entries.add(new BarcodeEntry(id, BACKBONE, "code" + id, null));
		}
		return new BarcodeLibrary(entries);
	}

	private static MatchResult specific(String gene, int start, String seq) {
		SampledKmer kmer = new SampledKmer(new CandidateKmer(gene, start, seq, RoundTag.EXTRACTION), RoundTag.round(1));
		return new MatchResult(kmer, Collections.singletonList("NM_" + start + " (" + gene + ")"), 1, true);
	}

	public void testCustomAssignmentDesignsEveryProbe() throws Exception {
		Map<String, Integer> custom = new HashMap<String, Integer>();
		custom.put("GLI3", Integer.valueOf(227));
		custom.put("MSI2", Integer.valueOf(229));
		custom.put("NR2E1", Integer.valueOf(228));
		BarcodeAssigner assigner = new BarcodeAssigner(library(227, 228, 229), AssignmentMode.CUSTOM, 0, custom, null, null);
		List<String> roster = Arrays.asList("GLI3", "MSI2", "NR2E1");
		List<MatchResult> results = Arrays.asList(
				specific("GLI3", 10, "ACGTACGTAC"), specific("GLI3", 40, "TTGCAATGCA"),
				specific("MSI2", 5, "GGCATTACGA"), specific("MSI2", 60, "CATCATGGAT"),
				specific("NR2E1", 0, "AGAGTCTCAA"), specific("NR2E1", 33, "TCGATCGGCA"));
		List<Probe> probes = assigner.design(roster, results);
		assertEquals(6, probes.size());
		int[] expectedIds = new int[] {227, 227, 229, 229, 228, 228};
		for(int i = 0; i < probes.size(); i++) {
			assertEquals(expectedIds[i], probes.get(i).getBarcodeId());
			assertEquals(results.get(i).getSequence(), probes.get(i).getTargetSequence());
			assertEquals("code" + expectedIds[i], probes.get(i).getCode());
		}
	}

	public void testProbeAssembly() {
		BarcodeAssigner assigner = new BarcodeAssigner(library(1), AssignmentMode.START, 1, null, null, null);
		Probe probe = assigner.assemble(specific("G", 0, "AAAACCCCGG"), library(1).get(1));
		assertEquals("GTTTT", probe.getFivePrimeArm());
		assertEquals("CCGGG", probe.getThreePrimeArm());
		assertEquals("GTTTT" + BACKBONE + "CCGGG", probe.getProbeSequence());
	}

	public void testArmLengthMovesSplit() {
		BarcodeAssigner assigner = new BarcodeAssigner(library(1), AssignmentMode.START, 1, null, Integer.valueOf(3), null);
		Probe probe = assigner.assemble(specific("G", 0, "AAAACCCCGG"), library(1).get(1));
		assertEquals("CCG", probe.getThreePrimeArm());
		assertEquals("GGGTTTT", probe.getFivePrimeArm());
	}

	public void testStartModeAssignsByPosition() throws Exception {
		BarcodeAssigner assigner = new BarcodeAssigner(library(5, 6, 7), AssignmentMode.START, 5, null, null, null);
		BarcodeAssignment a = assigner.assign(Arrays.asList("A", "B", "C", "D"), Arrays.asList("A", "C"));
		assertEquals(5, a.getId("A"));
		assertEquals(6, a.getId("B"));
		assertEquals(7, a.getId("C"));
		// D has no probes, so its id 8 is never checked
		assertEquals(8, a.getId("D"));
	}

	public void testStartModeRunsOutOfBarcodes() throws Exception {
		BarcodeAssigner assigner = new BarcodeAssigner(library(1, 2, 3), AssignmentMode.START, 1, null, null, null);
		try {
			assigner.assign(Arrays.asList("A", "B", "C", "D"), Arrays.asList("D"));
			fail("Expected BarcodeRangeExhaustedException");
		} catch(BarcodeRangeExhaustedException e) {
			assertEquals("D", e.getGene());
			assertEquals(4, e.getBarcodeId());
		}
	}

	public void testEndModeCountsDown() throws Exception {
		BarcodeAssigner assigner = new BarcodeAssigner(library(1, 2, 3), AssignmentMode.END, 3, null, null, null);
		BarcodeAssignment a = assigner.assign(Arrays.asList("A", "B", "C"), Arrays.asList("A", "B", "C"));
		assertEquals(3, a.getId("A"));
		assertEquals(1, a.getId("C"));
		try {
			assigner.assign(Arrays.asList("A", "B", "C", "D"), Arrays.asList("D"));
			fail("Expected BarcodeRangeExhaustedException");
		} catch(BarcodeRangeExhaustedException e) {
			assertEquals(0, e.getBarcodeId());
		}
	}

	public void testCustomModeNeedsEveryGeneWithProbes() throws Exception {
		Map<String, Integer> custom = new HashMap<String, Integer>();
		custom.put("GLI3", Integer.valueOf(227));
		BarcodeAssigner assigner = new BarcodeAssigner(library(227), AssignmentMode.CUSTOM, 0, custom, null, null);
		assertFalse(assigner.assign(Arrays.asList("GLI3", "MSI2"), Arrays.asList("GLI3")).hasGene("MSI2"));
		try {
			assigner.assign(Arrays.asList("GLI3", "MSI2"), Arrays.asList("GLI3", "MSI2"));
			fail("Expected MissingCustomBarcodeEntryException");
		} catch(MissingCustomBarcodeEntryException e) {
			assertEquals("MSI2", e.getGene());
		}
	}

	public void testCustomIdMustBeInLibrary() throws Exception {
		Map<String, Integer> custom = new HashMap<String, Integer>();
		custom.put("GLI3", Integer.valueOf(300));
		BarcodeAssigner assigner = new BarcodeAssigner(library(227), AssignmentMode.CUSTOM, 0, custom, null, null);
		try {
			assigner.assign(Collections.singletonList("GLI3"), Collections.singletonList("GLI3"));
			fail("Expected MissingCustomBarcodeEntryException");
		} catch(MissingCustomBarcodeEntryException e) {
			assertEquals("GLI3", e.getGene());
		}
	}

	public void testCapLimitsProbesPerGene() throws Exception {
		BarcodeAssigner assigner = new BarcodeAssigner(library(1, 2), AssignmentMode.START, 1, null, null, Integer.valueOf(1));
		List<Probe> probes = assigner.design(Arrays.asList("A", "B"),
				Arrays.asList(specific("A", 0, "ACGTACGTAC"), specific("A", 20, "TTGCAATGCA"), specific("B", 3, "GGCATTACGA")));
		assertEquals(2, probes.size());
		assertEquals(0, probes.get(0).getTargetStart());
		assertEquals(2, probes.get(1).getBarcodeId());
	}

	public void testNonSpecificResultIsRejected() throws Exception {
		BarcodeAssigner assigner = new BarcodeAssigner(library(1), AssignmentMode.START, 1, null, null, null);
		SampledKmer kmer = new SampledKmer(new CandidateKmer("A", 0, "ACGTACGTAC", RoundTag.EXTRACTION), RoundTag.round(1));
		MatchResult offTarget = new MatchResult(kmer, Arrays.asList("NM_1 (A)", "NM_2 (B)"), 2, true);
		try {
			assigner.design(Collections.singletonList("A"), Collections.singletonList(offTarget));
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			// expected
		}
	}

}
