package padlock.design.classify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;
import padlock.design.RoundTag;
import padlock.design.candidate.CandidateKmer;
import padlock.design.candidate.NotFoundReason;
import padlock.design.sampling.SampledKmer;
import padlock.design.specificity.MatchResult;

public class GeneClassifierTest extends TestCase {

	private static final List<String> ROSTER = Arrays.asList("A", "B", "C", "D", "E");

	static MatchResult result(String gene, int start, String seq, RoundTag round, int hitCount, boolean hitsSource, String... entries) {
		SampledKmer kmer = new SampledKmer(new CandidateKmer(gene, start, seq, RoundTag.EXTRACTION), round);
		return new MatchResult(kmer, Arrays.asList(entries), hitCount, hitsSource);
	}

	static Map<String, NotFoundReason> notFound() {
		Map<String, NotFoundReason> rtrn = new HashMap<String, NotFoundReason>();
		rtrn.put("E", NotFoundReason.NOT_IN_REFERENCE);
		return rtrn;
	}

	private List<MatchResult> roundOne() {
		RoundTag r1 = RoundTag.round(1);
		List<MatchResult> rtrn = new ArrayList<MatchResult>();
		rtrn.add(result("A", 0, "AAAACCCC", r1, 1, true, "NM_1 (A)"));
		rtrn.add(result("A", 20, "AAAAGGGG", r1, 1, true, "NM_1 (A)"));
		rtrn.add(result("B", 0, "CCCCAAAA", r1, 1, true, "NM_2 (B)"));
		rtrn.add(result("B", 10, "CCCCTTTT", r1, 2, true, "NM_2 (B)", "NM_3 (C)"));
		rtrn.add(result("C", 5, "GGGGAAAA", r1, 2, true, "NM_3 (C)", "NM_4 (X)"));
		rtrn.add(result("Z", 0, "TTTTAAAA", r1, 1, true, "NM_9 (Z)"));
		return rtrn;
	}

	public void testBuckets() {
		ClassificationResult c = new GeneClassifier(2).classify(roundOne(), ROSTER, notFound(), RoundTag.round(1));
		assertEquals(Arrays.asList("A"), c.getGenes(GeneBucket.GOOD));
		assertEquals(Arrays.asList("B"), c.getGenes(GeneBucket.TOO_FEW));
		assertEquals(Arrays.asList("C", "D"), c.getGenes(GeneBucket.NO_SPECIFIC));
		assertEquals(Arrays.asList("E"), c.getGenes(GeneBucket.NOT_FOUND));
		assertEquals(Arrays.asList("B", "C", "D"), c.getGenesNeedingAnotherRound());
		assertEquals(NotFoundReason.NOT_IN_REFERENCE, c.getClassifications().get("E").getNotFoundReason());
		assertEquals(2, c.getClassifications().get("B").getNumTested());
		assertEquals(1, c.getClassifications().get("B").getNumSpecific());
		assertEquals(0, c.getClassifications().get("D").getNumTested());
	}

	public void testResultsForUnknownGenesAreDropped() {
		ClassificationResult c = new GeneClassifier(2).classify(roundOne(), ROSTER, notFound(), RoundTag.round(1));
		assertEquals(5, c.getResults().size());
		for(MatchResult r : c.getResults()) {
			assertFalse("Z".equals(r.getGene()));
		}
		assertEquals(ROSTER, new ArrayList<String>(c.getClassifications().keySet()));
	}

	public void testSpecificResultsInRosterOrder() {
		ClassificationResult c = new GeneClassifier(2).classify(roundOne(), ROSTER, notFound(), RoundTag.round(1));
		List<MatchResult> specific = c.getSpecificResults();
		assertEquals(3, specific.size());
		assertEquals("A", specific.get(0).getGene());
		assertEquals(0, specific.get(0).getKmer().getStart());
		assertEquals(20, specific.get(1).getKmer().getStart());
		assertEquals("B", specific.get(2).getGene());
		assertTrue(c.getSpecificResults("E").isEmpty());
	}

	public void testOnlyOneHitInSourceGeneIsSpecific() {
		RoundTag r1 = RoundTag.round(1);
		List<MatchResult> results = Arrays.asList(
				result("A", 0, "AAAACCCC", r1, 0, false),
				result("A", 10, "AAAAGGGG", r1, 1, false, "NM_5 (X)"),
				result("A", 20, "AAAATTTT", r1, 2, true, "NM_1 (A)", "NM_5 (X)"));
		ClassificationResult c = new GeneClassifier(1).classify(results, ROSTER, notFound(), r1);
		assertEquals(GeneBucket.NO_SPECIFIC, c.getBucket("A"));
		assertEquals(3, c.getClassifications().get("A").getNumTested());
	}

	public void testDuplicateKeepsLargerEvidence() {
		MatchResult narrow = result("A", 0, "AAAACCCC", RoundTag.round(1), 1, true, "NM_1 (A)");
		MatchResult wide = result("A", 0, "AAAACCCC", RoundTag.round(2), 2, true, "NM_1 (A)", "NM_5 (X)");
		GeneClassifier classifier = new GeneClassifier(1);
		ClassificationResult first = classifier.classify(Arrays.asList(narrow, wide), ROSTER, notFound(), RoundTag.round(1));
		ClassificationResult second = classifier.classify(Arrays.asList(wide, narrow), ROSTER, notFound(), RoundTag.round(1));
		assertEquals(Collections.singletonList(wide), first.getResults());
		assertEquals(first.getResults(), second.getResults());
		assertEquals(GeneBucket.NO_SPECIFIC, first.getBucket("A"));
	}

	public void testReclassifyIsIdempotent() {
		GeneClassifier classifier = new GeneClassifier(2);
		ClassificationResult c = classifier.classify(roundOne(), ROSTER, notFound(), RoundTag.round(1));
		ClassificationResult again = classifier.reclassify(c);
		assertEquals(c.getClassifications(), again.getClassifications());
		assertEquals(c.getResults(), again.getResults());
		assertEquals(c.getRound(), again.getRound());
	}

	public void testHigherTargetDemotesGenes() {
		ClassificationResult c = new GeneClassifier(2).classify(roundOne(), ROSTER, notFound(), RoundTag.round(1));
		ClassificationResult strict = new GeneClassifier(3).reclassify(c);
		assertEquals(GeneBucket.TOO_FEW, strict.getBucket("A"));
		assertTrue(strict.getGenes(GeneBucket.GOOD).isEmpty());
	}

}
