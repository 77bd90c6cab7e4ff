package padlock.core.pipeline;

import padlock.core.parser.StringParser;

/**
 * One option line from a config file, split into whitespace separated fields.
 * Field 0 is the flag itself.
 */
public class ConfigFileOptionValue {

	private ConfigFileOption option;
	private StringParser stringParser;
	private String line;

	protected ConfigFileOptionValue(ConfigFileOption op, String fileLine) {
		this(op, fileLine, true);
	}

	protected ConfigFileOptionValue(ConfigFileOption op, String fileLine, boolean validate) {
		line = fileLine;
		option = op;
		stringParser = new StringParser();
		stringParser.parse(fileLine);
		if(validate && !option.acceptsFieldCount(stringParser.getFieldCount())) {
			throw new ConfigFileException("Line must have " + option.describeFieldCount() + " fields: " + fileLine);
		}
	}

	/**
	 * @return The number of fields in option line including the flag itself
	 */
	public int getActualNumValues() {
		return stringParser.getFieldCount();
	}

	/**
	 * @param fieldNumber Field number where the flag itself is field 0
	 * @return The value as a string
	 */
	public String asString(int fieldNumber) {
		return stringParser.asString(fieldNumber);
	}

	/**
	 * @param fieldNumber Field number where the flag itself is field 0
	 * @return The value as an int
	 */
	public int asInt(int fieldNumber) {
		try {
			return stringParser.asInt(fieldNumber);
		} catch(NumberFormatException e) {
			throw new ConfigFileException("Field " + fieldNumber + " is not an integer: " + line, e);
		}
	}

	/**
	 * @param fieldNumber Field number where the flag itself is field 0
	 * @return The value as a double
	 */
	public double asDouble(int fieldNumber) {
		try {
			return stringParser.asDouble(fieldNumber);
		} catch(NumberFormatException e) {
			throw new ConfigFileException("Field " + fieldNumber + " is not a number: " + line, e);
		}
	}

	/**
	 * @param fieldNumber Field number where the flag itself is field 0
	 * @return The value as a boolean; only "true" and "false" are accepted
	 */
	public boolean asBoolean(int fieldNumber) {
		try {
			return stringParser.asBoolean(fieldNumber);
		} catch(IllegalArgumentException e) {
			throw new ConfigFileException("Field " + fieldNumber + " is not true/false: " + line, e);
		}
	}

	/**
	 * @return Values after the flag joined by single spaces
	 */
	public String getLineMinusFlag() {
		StringBuilder rtrn = new StringBuilder();
		for(int i = 1; i < stringParser.getFieldCount(); i++) {
			if(i > 1) rtrn.append(' ');
			rtrn.append(stringParser.asString(i));
		}
		return rtrn.toString();
	}

	/**
	 * @return The line as it appeared in the config file, trimmed
	 */
	public String getFullOptionLine() {
		return line;
	}

	@Override
	public String toString() {
		return option.getName() + ": " + line;
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof ConfigFileOptionValue)) {
			return false;
		}
		ConfigFileOptionValue v = (ConfigFileOptionValue) o;
		return option.equals(v.option) && line.equals(v.line);
	}

	@Override
	public int hashCode() {
		return line.hashCode();
	}

}
