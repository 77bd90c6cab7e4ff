package padlock.design.barcode;

import java.io.StringReader;

import junit.framework.TestCase;
import padlock.core.error.ParseException;

public class BarcodeLibraryTest extends TestCase {

	public void testLoadCommaSeparated() throws Exception {
		String table = "Lbar_ID,Backbone,code,ID\n"
				+ "227,ctcagaaaggaacaggagattag,AGCT,L227\n"
				+ "228,TCCTCAATGCTGCTGCTGTACTAC,CGTA,\n";
		BarcodeLibrary library = BarcodeLibrary.load(new StringReader(table), "barcodes.csv");
		assertEquals(2, library.size());
		assertTrue(library.contains(227));
		assertFalse(library.contains(229));
		assertEquals("CTCAGAAAGGAACAGGAGATTAG", library.get(227).getBackbone());
		assertEquals("L227", library.get(227).getExternalId());
		assertNull(library.get(228).getExternalId());
		assertEquals("CGTA", library.get(228).getCode());
	}

	public void testLinkerColumnName() throws Exception {
		BarcodeLibrary library = BarcodeLibrary.load(new StringReader("Lbar_ID\tLinker\tcode\n5\tACGT\tX\n"), "barcodes.tsv");
		assertEquals("ACGT", library.get(5).getBackbone());
	}

	public void testDuplicateIdIsRejected() {
		try {
			BarcodeLibrary.load(new StringReader("Lbar_ID,Backbone,code\n1,ACGT,A\n1,TTTT,B\n"), "dup.csv");
			fail("Expected ParseException");
		} catch(ParseException e) {
			assertTrue(e.getMessage().contains("1"));
		}
	}

	public void testNonDnaBackboneIsRejected() {
		try {
			BarcodeLibrary.load(new StringReader("Lbar_ID,Backbone,code\n1,ACGXT,A\n"), "bad.csv");
			fail("Expected ParseException");
		} catch(ParseException e) {
			// expected
		}
	}

	public void testMissingColumnIsRejected() {
		try {
			BarcodeLibrary.load(new StringReader("Lbar_ID,code\n1,A\n"), "bad.csv");
			fail("Expected ParseException");
		} catch(ParseException e) {
			// expected
		}
	}

}
