package padlock.core.pipeline;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named block of a config file, introduced by a <code>:Name</code> header line.
 * Options keep the order in which they were added, which is the order of the config file guide.
 */
public class ConfigFileSection {

	private final String name;
	private final boolean required;
	private final Map<String, ConfigFileOption> options = new LinkedHashMap<String, ConfigFileOption>();

	/**
	 * @param sectionName Name used in the header line
	 * @param isRequired Whether the file must contain the section
	 */
	public ConfigFileSection(String sectionName, boolean isRequired) {
		name = sectionName;
		required = isRequired;
	}

	public String getName() {
		return name;
	}

	public boolean isRequired() {
		return required;
	}

	/**
	 * @param option Option allowed in this section
	 * @throws IllegalArgumentException If a different option with the same flag was already added
	 */
	public void addAllowableOption(ConfigFileOption option) {
		ConfigFileOption existing = options.get(option.getName());
		if(existing != null && !existing.equals(option)) {
			throw new IllegalArgumentException("Section " + name + " already has a different option " + option.getName());
		}
		options.put(option.getName(), option);
	}

	public void addAllowableOptions(Collection<ConfigFileOption> optionCollection) {
		for(ConfigFileOption option : optionCollection) {
			addAllowableOption(option);
		}
	}

	protected Collection<ConfigFileOption> getAllowableOptions() {
		return Collections.unmodifiableCollection(options.values());
	}

	protected ConfigFileOption getAllowableOption(String optionName) {
		ConfigFileOption option = options.get(optionName);
		if(option == null) {
			throw new ConfigFileException("Section " + name + " has no option " + optionName + ". Allowed: " + options.keySet());
		}
		return option;
	}

	@Override
	public String toString() {
		return ":" + name + (required ? " (required) " : " ") + options.values();
	}

	@Override
	public boolean equals(Object o) {
		if(!(o instanceof ConfigFileSection)) {
			return false;
		}
		ConfigFileSection s = (ConfigFileSection) o;
		return name.equals(s.name) && required == s.required && options.equals(s.options);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

}
