package padlock.core.general;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import junit.framework.TestCase;

import padlock.core.error.InputNotFoundException;
import padlock.core.error.ParseException;

public class TabbedReaderTest extends TestCase {

	private static final TabbedReader.Factory<String> GENE_AND_ID = new TabbedReader.Factory<String>() {
		@Override
		public String create(TabbedReader.Header header, String[] rawFields) throws ParseException {
			return rawFields[header.requireIndex("Gene")] + "=" + Integer.parseInt(rawFields[header.requireIndex("Lbar_ID", "id")]);
		}
	};

	public void testCommaSeparatedWithQuotesCommentsAndBlankLines() throws ParseException {
		String text = "\"Gene\",\"Lbar_ID\"\n# skipped\n\nGLI3,227\n\"MSI2\",229\n";
		List<String> rows = TabbedReader.load(new StringReader(text), GENE_AND_ID, "test");
		assertEquals(2, rows.size());
		assertEquals("GLI3=227", rows.get(0));
		assertEquals("MSI2=229", rows.get(1));
	}

	public void testTabSeparatedCaseInsensitiveHeaderAndAlias() throws ParseException {
		String text = "gene\tID\nNR2E1\t228\n";
		List<String> rows = TabbedReader.load(new StringReader(text), GENE_AND_ID, "test");
		assertEquals("NR2E1=228", rows.get(0));
	}

	public void testMissingColumn() {
		try {
			TabbedReader.load(new StringReader("Symbol,Lbar_ID\nA,1\n"), GENE_AND_ID, "test");
			fail("Expected ParseException");
		} catch(ParseException e) {
			assertTrue(e.getMessage().contains("Gene"));
		}
	}

	public void testMalformedValueReportsLine() {
		try {
			TabbedReader.load(new StringReader("Gene,Lbar_ID\nA,1\nB,x\n"), GENE_AND_ID, "test");
			fail("Expected ParseException");
		} catch(ParseException e) {
			assertTrue(e.getMessage().contains("line 3"));
		}
	}

	public void testEmptyTable() {
		try {
			TabbedReader.load(new StringReader("\n# nothing\n"), GENE_AND_ID, "test");
			fail("Expected ParseException");
		} catch(ParseException e) {
			// expected
		}
	}

	public void testMissingFile() throws IOException, ParseException {
		try {
			TabbedReader.load(new File("does/not/exist.csv"), GENE_AND_ID);
			fail("Expected InputNotFoundException");
		} catch(InputNotFoundException e) {
			assertEquals("does/not/exist.csv".replace('/', File.separatorChar), e.getPath());
		}
	}

}
