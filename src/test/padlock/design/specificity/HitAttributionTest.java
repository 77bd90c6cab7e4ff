package padlock.design.specificity;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import junit.framework.TestCase;

public class HitAttributionTest extends TestCase {

	private static final List<String> ISOFORMS = Arrays.asList("NM_1 (GLI3), variant 1", "NM_2 (GLI3), variant 2");

	public void testGeneModeCollapsesIsoforms() {
		assertEquals(1, HitAttribution.GENE.countHits(ISOFORMS, "GLI3"));
		assertEquals(2, HitAttribution.ENTRY.countHits(ISOFORMS, "GLI3"));
		assertTrue(HitAttribution.hitsSourceGene(ISOFORMS, "GLI3"));
	}

	public void testOffTargetHitsCountSeparately() {
		List<String> headers = Arrays.asList("NM_1 (GLI3)", "NM_7 (MSI2)", "NM_8 (MSI2)", "XR_9 no symbol");
		assertEquals(3, HitAttribution.GENE.countHits(headers, "GLI3"));
		assertEquals(4, HitAttribution.ENTRY.countHits(headers, "GLI3"));
	}

	public void testReadthroughEntryNamingSourceGeneCountsAsSource() {
		List<String> headers = Arrays.asList("NM_1 (GLI3)", "NR_5 readthrough (GLI3) (ABC)");
		assertEquals(1, HitAttribution.GENE.countHits(headers, "GLI3"));
	}

	public void testNoHits() {
		assertEquals(0, HitAttribution.GENE.countHits(Collections.<String>emptyList(), "GLI3"));
		assertFalse(HitAttribution.hitsSourceGene(Collections.<String>emptyList(), "GLI3"));
		assertEquals(HitAttribution.ENTRY, HitAttribution.fromName("entry"));
	}

}
