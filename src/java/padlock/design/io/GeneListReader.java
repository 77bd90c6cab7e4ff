package padlock.design.io;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import padlock.core.error.InputNotFoundException;
import padlock.core.error.ParseException;
import padlock.core.general.TabbedReader;

/**
 * Reads the gene list: a table with a column headed Gene
 */
public final class GeneListReader {

	private static Logger logger = Logger.getLogger(GeneListReader.class.getName());

	private GeneListReader() {}

	private static final TabbedReader.Factory<String> FACTORY = new TabbedReader.Factory<String>() {
		@Override
		public String create(TabbedReader.Header header, String[] rawFields) throws ParseException {
			int col = header.requireIndex("Gene");
			return col < rawFields.length ? rawFields[col] : "";
		}
	};

	/**
	 * @param file Gene list file
	 * @return Gene symbols in file order; blank cells are skipped
	 * @throws InputNotFoundException If the file cannot be read
	 * @throws ParseException If there is no Gene column or no genes
	 * @throws IOException
	 */
	public static List<String> load(File file) throws IOException, InputNotFoundException, ParseException {
		List<String> rtrn = nonBlank(TabbedReader.load(file, FACTORY), file.getPath());
		logger.info("Read " + rtrn.size() + " genes from " + file);
		return rtrn;
	}

	/**
	 * @param reader Gene list contents
	 * @param sourceName Name for error messages
	 * @return Gene symbols in order
	 * @throws ParseException If there is no Gene column or no genes
	 */
	public static List<String> load(Reader reader, String sourceName) throws ParseException {
		return nonBlank(TabbedReader.load(reader, FACTORY, sourceName), sourceName);
	}

	private static List<String> nonBlank(List<String> genes, String source) throws ParseException {
		List<String> rtrn = new ArrayList<String>();
		for(String g : genes) {
			if(StringUtils.isNotBlank(g)) {
				rtrn.add(g.trim());
			}
		}
		if(rtrn.isEmpty()) {
			throw new ParseException("Gene list " + source + " contains no genes");
		}
		return rtrn;
	}

}
