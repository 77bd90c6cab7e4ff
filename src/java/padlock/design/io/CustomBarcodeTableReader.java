package padlock.design.io;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import padlock.core.error.InputNotFoundException;
import padlock.core.error.ParseException;
import padlock.core.general.TabbedReader;

/**
 * Reads a custom barcode table with columns Gene and Lbar_ID
 */
public final class CustomBarcodeTableReader {

	private CustomBarcodeTableReader() {}

	private static final TabbedReader.Factory<String[]> FACTORY = new TabbedReader.Factory<String[]>() {
		@Override
		public String[] create(TabbedReader.Header header, String[] rawFields) throws ParseException {
			String gene = rawFields[header.requireIndex("Gene")];
			String id = rawFields[header.requireIndex("Lbar_ID")];
			return new String[] {gene, Integer.toString(Integer.parseInt(id))};
		}
	};

	/**
	 * @param file Table
	 * @return Id per gene in file order
	 * @throws InputNotFoundException If the file cannot be read
	 * @throws ParseException If columns are missing, an id is not an integer, or a gene has two ids
	 * @throws IOException
	 */
	public static Map<String, Integer> load(File file) throws IOException, InputNotFoundException, ParseException {
		return toMap(TabbedReader.load(file, FACTORY), file.getPath());
	}

	public static Map<String, Integer> load(Reader reader, String sourceName) throws ParseException {
		return toMap(TabbedReader.load(reader, FACTORY, sourceName), sourceName);
	}

	private static Map<String, Integer> toMap(List<String[]> rows, String source) throws ParseException {
		Map<String, Integer> rtrn = new LinkedHashMap<String, Integer>();
		for(String[] row : rows) {
			Integer id = Integer.valueOf(row[1]);
			Integer previous = rtrn.put(row[0], id);
			if(previous != null && !previous.equals(id)) {
				throw new ParseException("Custom barcode table " + source + " gives gene " + row[0] + " two ids: " + previous + " and " + id);
			}
		}
		return rtrn;
	}

}
