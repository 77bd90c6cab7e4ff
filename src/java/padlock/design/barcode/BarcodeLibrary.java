package padlock.design.barcode;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.TreeMap;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import padlock.core.error.InputNotFoundException;
import padlock.core.error.ParseException;
import padlock.core.general.TabbedReader;

/**
 * Barcode entries by id
 */
public final class BarcodeLibrary {

	private static Logger logger = Logger.getLogger(BarcodeLibrary.class.getName());

	private final TreeMap<Integer, BarcodeEntry> entries;

	/**
	 * @param entries Entries with distinct ids
	 */
	public BarcodeLibrary(Collection<BarcodeEntry> entries) {
		this.entries = new TreeMap<Integer, BarcodeEntry>();
		for(BarcodeEntry e : entries) {
			if(this.entries.put(Integer.valueOf(e.getId()), e) != null) {
				throw new IllegalArgumentException("Barcode id " + e.getId() + " appears more than once");
			}
		}
	}

	private static final TabbedReader.Factory<BarcodeEntry> FACTORY = new TabbedReader.Factory<BarcodeEntry>() {
		@Override
		public BarcodeEntry create(TabbedReader.Header header, String[] rawFields) throws ParseException {
			int idCol = header.requireIndex("Lbar_ID");
			int backboneCol = header.requireIndex("Backbone", "Sequence", "Linker");
			int codeCol = header.requireIndex("code");
			int extCol = header.indexOf("ID");
			String ext = extCol >= 0 && extCol < rawFields.length && StringUtils.isNotBlank(rawFields[extCol]) ? rawFields[extCol] : null;
			String backbone = rawFields[backboneCol].toUpperCase(Locale.ROOT);
			if(!backbone.matches("[ACGTN]*")) {
				throw new ParseException("Backbone for barcode " + rawFields[idCol] + " in " + header.getSource() + " is not a DNA sequence: " + backbone);
			}
			return new BarcodeEntry(Integer.parseInt(rawFields[idCol]), backbone, rawFields[codeCol], ext);
		}
	};

	/**
	 * @param file Comma or tab separated table with columns Lbar_ID, Backbone (or Sequence or Linker), code and optionally ID
	 * @return The library
	 * @throws InputNotFoundException If the file cannot be read
	 * @throws ParseException If the table is malformed
	 * @throws IOException
	 */
	public static BarcodeLibrary load(File file) throws IOException, InputNotFoundException, ParseException {
		List<BarcodeEntry> list = TabbedReader.load(file, FACTORY);
		logger.info("Loaded " + list.size() + " barcodes from " + file);
		return fromEntries(list, file.getPath());
	}

	/**
	 * @param reader Table contents
	 * @param sourceName Name for error messages
	 * @return The library
	 * @throws ParseException If the table is malformed
	 */
	public static BarcodeLibrary load(Reader reader, String sourceName) throws ParseException {
		return fromEntries(TabbedReader.load(reader, FACTORY, sourceName), sourceName);
	}

	private static BarcodeLibrary fromEntries(List<BarcodeEntry> list, String source) throws ParseException {
		try {
			return new BarcodeLibrary(list);
		} catch(IllegalArgumentException e) {
			throw new ParseException("Barcode library " + source + ": " + e.getMessage(), e);
		}
	}

	public boolean contains(int id) {
		return entries.containsKey(Integer.valueOf(id));
	}

	/**
	 * @param id Lbar_ID
	 * @return Entry, or null if absent
	 */
	public BarcodeEntry get(int id) {
		return entries.get(Integer.valueOf(id));
	}

	/**
	 * @return Entries ordered by id
	 */
	public Collection<BarcodeEntry> getEntries() {
		return Collections.unmodifiableCollection(entries.values());
	}

	public int size() {
		return entries.size();
	}

}
