package padlock.core.general;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.collections15.Predicate;
import org.apache.commons.collections15.iterators.FilterIterator;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;
import org.apache.commons.lang3.StringUtils;

import padlock.core.error.InputNotFoundException;
import padlock.core.error.ParseException;

/**
 * Reads delimited tables with a header line. The delimiter is a tab if the header
 * contains one, otherwise a comma. Blank lines and lines starting with '#' are skipped.
 */
public class TabbedReader {

	/**
	 * Lines that carry data
	 */
	public static final Predicate<String> DATA_LINE = new Predicate<String>() {
		@Override
		public boolean evaluate(String line) {
			return StringUtils.isNotBlank(line) && !line.trim().startsWith("#");
		}
	};

	/**
	 * @param file Table file
	 * @param factory Creates one object per data line
	 * @return Objects in file order
	 * @throws InputNotFoundException If the file cannot be read
	 * @throws ParseException If the header or a line is malformed
	 * @throws IOException
	 */
	public static <T> List<T> load(File file, Factory<? extends T> factory) throws IOException, InputNotFoundException, ParseException {
		InputNotFoundException.assertReadable(file, "Table");
		LineIterator itr = FileUtils.lineIterator(file, StandardCharsets.UTF_8.name());
		try {
			return load(itr, factory, file.getPath());
		} finally {
			itr.close();
		}
	}

	/**
	 * @param reader Table contents; not closed
	 * @param factory Creates one object per data line
	 * @param sourceName Name for error messages
	 * @return Objects in input order
	 * @throws ParseException If the header or a line is malformed
	 */
	public static <T> List<T> load(Reader reader, Factory<? extends T> factory, String sourceName) throws ParseException {
		return load(new LineIterator(reader), factory, sourceName);
	}

	private static <T> List<T> load(LineIterator lines, Factory<? extends T> factory, String sourceName) throws ParseException {
		Iterator<String> dataLines = new FilterIterator<String>(lines, DATA_LINE);
		if(!dataLines.hasNext()) {
			throw new ParseException("Table " + sourceName + " is empty; expected a header line");
		}
		String headerLine = dataLines.next();
		String delimiter = headerLine.indexOf('\t') >= 0 ? "\t" : ",";
		Header header = new Header(split(headerLine, delimiter), sourceName);
		List<T> rtrn = new ArrayList<T>();
		int lineNumber = 1;
		while(dataLines.hasNext()) {
			lineNumber++;
			String[] fields = split(dataLines.next(), delimiter);
			try {
				rtrn.add(factory.create(header, fields));
			} catch(RuntimeException e) {
				throw new ParseException("Could not parse data line " + lineNumber + " of " + sourceName + ": " + e.getMessage(), e);
			}
		}
		return rtrn;
	}

	private static String[] split(String line, String delimiter) {
		String[] fields = line.split(delimiter, -1);
		for(int i = 0; i < fields.length; i++) {
			fields[i] = StringUtils.strip(fields[i].trim(), "\"");
		}
		return fields;
	}

	/**
	 * Column names of a table, matched case-insensitively
	 */
	public static class Header {

		private final Map<String, Integer> columns;
		private final String source;

		public Header(String[] names, String sourceName) {
			source = sourceName;
			Map<String, Integer> tmp = new LinkedHashMap<String, Integer>();
			for(int i = 0; i < names.length; i++) {
				tmp.put(names[i].toLowerCase(Locale.ROOT), Integer.valueOf(i));
			}
			columns = Collections.unmodifiableMap(tmp);
		}

		/**
		 * @param aliases Accepted names for the column
		 * @return Index of the first alias present, or -1
		 */
		public int indexOf(String... aliases) {
			for(String alias : aliases) {
				Integer i = columns.get(alias.toLowerCase(Locale.ROOT));
				if(i != null) {
					return i.intValue();
				}
			}
			return -1;
		}

		/**
		 * @param aliases Accepted names for the column
		 * @return Index of the first alias present
		 * @throws ParseException If no alias is a column
		 */
		public int requireIndex(String... aliases) throws ParseException {
			int i = indexOf(aliases);
			if(i < 0) {
				throw new ParseException("Table " + source + " has no column named " + StringUtils.join(aliases, " or ") + "; columns are " + columns.keySet());
			}
			return i;
		}

		public String getSource() {
			return source;
		}

	}

	/**
	 * Creates an object from the fields of one data line
	 */
	public interface Factory<T> {
		T create(Header header, String[] rawFields) throws ParseException;
	}

}
