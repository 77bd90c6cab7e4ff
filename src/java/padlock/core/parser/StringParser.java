package padlock.core.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Splits a line into fields and exposes typed access to each field.
 * Default delimiter is any run of whitespace.
 */
public class StringParser {

	private static final String WHITESPACE = "\\s+";
	private String[] fields;

	public StringParser() {
		fields = new String[0];
	}

	/**
	 * Split on whitespace; leading and trailing whitespace is ignored
	 * @param line Line to parse
	 */
	public void parse(String line) {
		parse(line, WHITESPACE);
	}

	/**
	 * @param line Line to parse
	 * @param delimiterRegex Regular expression separating fields
	 */
	public void parse(String line, String delimiterRegex) {
		if(line == null || StringUtils.isBlank(line)) {
			fields = new String[0];
			return;
		}
		String toSplit = WHITESPACE.equals(delimiterRegex) ? line.trim() : line;
		fields = toSplit.split(delimiterRegex, -1);
		for(int i = 0; i < fields.length; i++) {
			fields[i] = fields[i].trim();
		}
	}

	public void clear() {
		fields = new String[0];
	}

	public int getFieldCount() {
		return fields.length;
	}

	/**
	 * @param fieldNumber Zero based field number
	 * @return The field
	 */
	public String asString(int fieldNumber) {
		checkField(fieldNumber);
		return fields[fieldNumber];
	}

	public int asInt(int fieldNumber) {
		return Integer.parseInt(asString(fieldNumber));
	}

	public double asDouble(int fieldNumber) {
		return Double.parseDouble(asString(fieldNumber));
	}

	public boolean asBoolean(int fieldNumber) {
		String s = asString(fieldNumber);
		if(!s.equalsIgnoreCase("true") && !s.equalsIgnoreCase("false")) {
			throw new IllegalArgumentException("Field " + fieldNumber + " is not a boolean: " + s);
		}
		return Boolean.parseBoolean(s);
	}

	/**
	 * @return Copy of all fields
	 */
	public List<String> getFields() {
		return Collections.unmodifiableList(new ArrayList<String>(Arrays.asList(fields)));
	}

	private void checkField(int fieldNumber) {
		if(fieldNumber < 0 || fieldNumber >= fields.length) {
			throw new IllegalArgumentException("Field " + fieldNumber + " requested but line has " + fields.length + " fields");
		}
	}

}
