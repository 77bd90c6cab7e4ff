package padlock.design;

import junit.framework.TestCase;

public class RoundTagTest extends TestCase {

	public void testMergeIsOrderIndependent() {
		RoundTag r1 = RoundTag.round(1);
		RoundTag r2 = RoundTag.round(2);
		RoundTag prior = RoundTag.of("prior");
		assertEquals(r1.mergeWith(r2), r2.mergeWith(r1));
		assertEquals(r1.mergeWith(r2).mergeWith(prior), r1.mergeWith(r2.mergeWith(prior)));
		assertEquals("prior+round1+round2", prior.mergeWith(r2).mergeWith(r1).getLabel());
		assertTrue(r1.mergeWith(r2).isMerged());
		assertFalse(r1.mergeWith(r1).isMerged());
	}

	public void testParseReadsMergedLabels() {
		RoundTag tag = RoundTag.parse("round2+round1");
		assertEquals(RoundTag.round(1).mergeWith(RoundTag.round(2)), tag);
	}

	public void testHighestRoundNumber() {
		assertEquals(0, RoundTag.EXTRACTION.getHighestRoundNumber());
		assertEquals(1, RoundTag.round(1).getHighestRoundNumber());
		assertEquals(12, RoundTag.parse("round2+round12+pilot").getHighestRoundNumber());
		assertEquals(0, RoundTag.of("roundup").getHighestRoundNumber());
	}

	public void testInvalidLabels() {
		try {
			RoundTag.of("a+b");
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			// expected
		}
		try {
			RoundTag.round(0);
			fail("Expected IllegalArgumentException");
		} catch(IllegalArgumentException e) {
			// expected
		}
	}

}
