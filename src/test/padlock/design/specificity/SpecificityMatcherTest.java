package padlock.design.specificity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import junit.framework.TestCase;
import padlock.core.error.ExternalToolException;
import padlock.design.RoundTag;
import padlock.design.candidate.CandidateKmer;
import padlock.design.reference.TranscriptEntry;
import padlock.design.reference.Transcriptome;
import padlock.design.sampling.SampledKmer;

public class SpecificityMatcherTest extends TestCase {

	private static SampledKmer kmer(String gene, int start, String seq) {
		return new SampledKmer(new CandidateKmer(gene, start, seq, RoundTag.EXTRACTION), RoundTag.round(1));
	}

	private static Transcriptome transcriptome() {
		List<TranscriptEntry> entries = new ArrayList<TranscriptEntry>();
		entries.add(new TranscriptEntry("NM_1 (G1), variant 1", "AAAACCCCGGGGTTTT"));
		entries.add(new TranscriptEntry("NM_2 (G1), variant 2", "AAAACCCCGGGGTTTTAC"));
		entries.add(new TranscriptEntry("NM_3 (G2)", "GATTACAGATTACA"));
		entries.add(new TranscriptEntry("NM_4 (G3)", "TTGATTACATT"));
		return new Transcriptome(entries, "test");
	}

	public void testGeneAttributionCollapsesIsoforms() throws Exception {
		SpecificityMatcher matcher = new SpecificityMatcher(new HammingScanSearcher(transcriptome(), false), 0, HitAttribution.GENE, 2, 30, 0);
		List<MatchResult> results = matcher.match(Arrays.asList(kmer("G2", 0, "GATTACA"), kmer("G1", 4, "CCCCGGGG")));
		assertEquals(2, results.size());
		MatchResult g1 = results.get(0);
		assertEquals("G1", g1.getGene());
		assertEquals(2, g1.getMatchedEntries().size());
		assertEquals(1, g1.getHitCount());
		assertTrue(g1.isSpecific());
		MatchResult g2 = results.get(1);
		assertEquals(2, g2.getHitCount());
		assertTrue(g2.hitsSourceGene());
		assertFalse(g2.isSpecific());
	}

	public void testEntryAttributionCountsIsoforms() throws Exception {
		SpecificityMatcher matcher = new SpecificityMatcher(new HammingScanSearcher(transcriptome(), false), 0, HitAttribution.ENTRY, 1, 30, 0);
		MatchResult r = matcher.match(Collections.singletonList(kmer("G1", 4, "CCCCGGGG"))).get(0);
		assertEquals(2, r.getHitCount());
		assertFalse(r.isSpecific());
	}

	public void testHitOnlyInOtherGeneIsNotSpecific() throws Exception {
		SpecificityMatcher matcher = new SpecificityMatcher(new HammingScanSearcher(transcriptome(), false), 0, HitAttribution.GENE, 1, 30, 0);
		MatchResult r = matcher.match(Collections.singletonList(kmer("G9", 0, "TTGATTACATT"))).get(0);
		assertEquals(1, r.getHitCount());
		assertFalse(r.hitsSourceGene());
		assertFalse(r.isSpecific());
	}

	public void testNoHitIsNotSpecific() throws Exception {
		SpecificityMatcher matcher = new SpecificityMatcher(new HammingScanSearcher(transcriptome(), false), 0, HitAttribution.GENE, 1, 30, 0);
		MatchResult r = matcher.match(Collections.singletonList(kmer("G1", 0, "CGCGCGCG"))).get(0);
		assertEquals(0, r.getHitCount());
		assertFalse(r.isSpecific());
		assertEquals("", r.getMatchedEntriesString());
	}

	public void testFailedQueriesAreRetried() throws Exception {
		final ConcurrentHashMap<String, AtomicInteger> calls = new ConcurrentHashMap<String, AtomicInteger>();
		TranscriptomeSearcher flaky = new TranscriptomeSearcher() {
			@Override
			public List<String> search(String query, int maxMismatches) throws ExternalToolException {
				calls.putIfAbsent(query, new AtomicInteger());
				if(calls.get(query).incrementAndGet() < 3) {
					throw new ExternalToolException("search", "transient failure");
				}
				return Collections.singletonList("NM_1 (G1)");
			}
		};
		SpecificityMatcher matcher = new SpecificityMatcher(flaky, 0, HitAttribution.GENE, 2, 30, 2);
		List<MatchResult> results = matcher.match(Arrays.asList(kmer("G1", 0, "ACGTACGT"), kmer("G1", 20, "TTTTGGGG")));
		assertEquals(2, results.size());
		assertTrue(results.get(0).isSpecific());
		assertEquals(3, calls.get("ACGTACGT").get());
	}

	public void testExhaustedRetriesFail() throws Exception {
		TranscriptomeSearcher broken = new TranscriptomeSearcher() {
			@Override
			public List<String> search(String query, int maxMismatches) throws ExternalToolException {
				throw new ExternalToolException("search", "always fails");
			}
		};
		SpecificityMatcher matcher = new SpecificityMatcher(broken, 0, HitAttribution.GENE, 1, 30, 1);
		try {
			matcher.match(Collections.singletonList(kmer("G1", 0, "ACGTACGT")));
			fail("Expected ExternalToolException");
		} catch(ExternalToolException e) {
			assertEquals("search", e.getTool());
		}
	}

	public void testRetryTimeoutExcludesQueuedQueries() throws Exception {
		final ConcurrentHashMap<String, AtomicInteger> calls = new ConcurrentHashMap<String, AtomicInteger>();
		TranscriptomeSearcher slowOnce = new TranscriptomeSearcher() {
			@Override
			public List<String> search(String query, int maxMismatches) throws ExternalToolException, InterruptedException {
				calls.putIfAbsent(query, new AtomicInteger());
				if(query.equals("AAAAAAAA") && calls.get(query).incrementAndGet() == 1) {
					throw new ExternalToolException("search", "transient failure");
				}
				Thread.sleep(300);
				return Collections.singletonList("NM_1 (G1)");
			}
		};
		List<SampledKmer> queries = new ArrayList<SampledKmer>();
		queries.add(kmer("G1", 0, "AAAAAAAA"));
		String bases = "ACGT";
		for(int i = 1; i < 20; i++) {
			queries.add(kmer("G1", i * 10, "CCC" + bases.charAt(i % 4) + bases.charAt((i / 4) % 4) + bases.charAt((i / 16) % 4) + "GG"));
		}
		// 20 queries of 0.3 s on one thread take longer than the 1 s timeout
		SpecificityMatcher matcher = new SpecificityMatcher(slowOnce, 0, HitAttribution.GENE, 1, 1, 2);
		List<MatchResult> results = matcher.match(queries);
		assertEquals(20, results.size());
		assertEquals(2, calls.get("AAAAAAAA").get());
		for(MatchResult r : results) {
			assertTrue(r.isSpecific());
		}
	}

	public void testSlowQueryTimesOut() throws Exception {
		TranscriptomeSearcher slow = new TranscriptomeSearcher() {
			@Override
			public List<String> search(String query, int maxMismatches) throws InterruptedException {
				Thread.sleep(60000);
				return Collections.emptyList();
			}
		};
		SpecificityMatcher matcher = new SpecificityMatcher(slow, 0, HitAttribution.GENE, 1, 1, 0);
		long start = System.currentTimeMillis();
		try {
			matcher.match(Collections.singletonList(kmer("G1", 0, "ACGTACGT")));
			fail("Expected ExternalToolException");
		} catch(ExternalToolException e) {
			assertTrue(System.currentTimeMillis() - start < 30000);
		}
	}

	public void testManyQueriesOnSeveralThreads() throws Exception {
		List<SampledKmer> queries = new ArrayList<SampledKmer>();
		String bases = "ACGT";
		for(int i = 0; i < 50; i++) {
			String seq = "" + bases.charAt(i % 4) + bases.charAt((i / 4) % 4) + bases.charAt((i / 16) % 4) + "CCCCGG";
			queries.add(kmer("G1", i * 10, seq));
		}
		SpecificityMatcher matcher = new SpecificityMatcher(new HammingScanSearcher(transcriptome(), false), 1, HitAttribution.GENE, 4, 30, 0);
		List<MatchResult> parallel = matcher.match(queries);
		List<MatchResult> serial = new SpecificityMatcher(new HammingScanSearcher(transcriptome(), false), 1, HitAttribution.GENE, 1, 30, 0).match(queries);
		assertEquals(50, parallel.size());
		assertEquals(serial, parallel);
		for(int i = 1; i < parallel.size(); i++) {
			assertTrue(parallel.get(i - 1).getKmer().getStart() < parallel.get(i).getKmer().getStart());
		}
	}

}
