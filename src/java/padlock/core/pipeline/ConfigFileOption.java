package padlock.core.pipeline;

/**
 * An option that may appear in one section of a config file. An option line is the flag
 * followed by its values; field counts below include the flag.
 */
public class ConfigFileOption {

	private final String flag;
	private final int minFields;
	private final int maxFields;
	private final boolean repeatable;
	private final boolean required;
	private final String defaultVal;
	private String description;

	/**
	 * @param optionFlag Flag
	 * @param numFields Number of fields including the flag
	 * @param fewerFieldsOK Accept any number of fields from 2 up to numFields
	 * @param isRepeatable Whether the option may appear on several lines
	 * @param isRequired Whether the section must contain the option
	 */
	public ConfigFileOption(String optionFlag, int numFields, boolean fewerFieldsOK, boolean isRepeatable, boolean isRequired) {
		this(optionFlag, numFields, fewerFieldsOK, isRepeatable, isRequired, null);
	}

	/**
	 * @param optionFlag Flag
	 * @param numFields Number of fields including the flag
	 * @param fewerFieldsOK Accept any number of fields from 2 up to numFields
	 * @param isRepeatable Whether the option may appear on several lines
	 * @param isRequired Whether the section must contain the option
	 * @param defaultValue Value used when the option is absent, without the flag; null for none
	 */
	public ConfigFileOption(String optionFlag, int numFields, boolean fewerFieldsOK, boolean isRepeatable, boolean isRequired, String defaultValue) {
		if(numFields < 2) {
			throw new IllegalArgumentException("Option " + optionFlag + " needs at least one value");
		}
		if(isRequired && defaultValue != null) {
			throw new IllegalArgumentException("Required option " + optionFlag + " cannot specify a default value.");
		}
		flag = optionFlag;
		maxFields = numFields;
		minFields = fewerFieldsOK ? 2 : numFields;
		repeatable = isRepeatable;
		required = isRequired;
		defaultVal = defaultValue;
	}

	/**
	 * @param text One line shown next to the option in the config file guide
	 * @return This option
	 */
	public ConfigFileOption withDescription(String text) {
		description = text;
		return this;
	}

	public String getName() {
		return flag;
	}

	public String getDescription() {
		return description;
	}

	protected boolean hasDefault() {
		return defaultVal != null;
	}

	protected ConfigFileOptionValue getDefaultValue() {
		return defaultVal == null ? null : new ConfigFileOptionValue(this, flag + " " + defaultVal);
	}

	protected boolean isRequired() {
		return required;
	}

	protected boolean isRepeatable() {
		return repeatable;
	}

	protected int getMaxFields() {
		return maxFields;
	}

	/**
	 * @param numFields Fields on a line including the flag
	 * @return Whether a line with that many fields is allowed
	 */
	protected boolean acceptsFieldCount(int numFields) {
		return numFields >= minFields && numFields <= maxFields;
	}

	/**
	 * @return Allowed field counts for messages, e.g. "2" or "2 to 5"
	 */
	protected String describeFieldCount() {
		return minFields == maxFields ? Integer.toString(maxFields) : minFields + " to " + maxFields;
	}

	@Override
	public String toString() {
		return flag + "[" + describeFieldCount() + (required ? ",required" : "") + (repeatable ? ",repeatable" : "") + "]";
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof ConfigFileOption)) {
			return false;
		}
		ConfigFileOption c = (ConfigFileOption) o;
		return flag.equals(c.flag) && minFields == c.minFields && maxFields == c.maxFields
				&& repeatable == c.repeatable && required == c.required;
	}

	@Override
	public int hashCode() {
		return flag.hashCode() * 31 + maxFields;
	}

}
