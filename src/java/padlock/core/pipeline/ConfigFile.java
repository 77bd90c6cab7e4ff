package padlock.core.pipeline;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import padlock.core.parser.StringParser;


/**
 * A config file made of sections. Each section starts with a header line
 * <code>:Section_name</code> and holds option lines <code>flag value1 value2 ...</code>.
 * Lines starting with <code>#</code> are comments.
 */
public class ConfigFile {

	/**
	 * Comment character
	 */
	public static final char COMMENT_CHAR = '#';

	/**
	 * Character that begins each section header
	 */
	public static final char SECTION_HEADER_CHAR = ':';

	private static final int MAX_GUIDE_VALUES = 5;

	private List<ConfigFileSection> fileSections;
	private Map<String, ConfigFileSection> allowableSectionsByName;
	private Map<ConfigFileSection, Map<ConfigFileOption, List<ConfigFileOptionValue>>> optionsFromFile;
	private Map<ConfigFileSection, List<OptionValuePair>> orderedOptionsBySection;
	private String source;
	private static Logger logger = Logger.getLogger(ConfigFile.class.getName());

	/**
	 * Instantiate config file and parse file
	 * @param sections Sections
	 * @param fileName File name
	 * @throws IOException
	 */
	public ConfigFile(Collection<ConfigFileSection> sections, String fileName) throws IOException {
		this(sections, new FileReader(new File(fileName)), fileName);
	}

	/**
	 * Instantiate config file and parse its contents; the reader is closed
	 * @param sections Sections
	 * @param reader Config file contents
	 * @param sourceName Name used in log and error messages
	 * @throws IOException
	 */
	public ConfigFile(Collection<ConfigFileSection> sections, Reader reader, String sourceName) throws IOException {
		source = sourceName;
		fileSections = new ArrayList<ConfigFileSection>(sections);
		allowableSectionsByName = new LinkedHashMap<String, ConfigFileSection>();
		for(ConfigFileSection section : fileSections) {
			allowableSectionsByName.put(section.getName(), section);
		}
		try(BufferedReader b = new BufferedReader(reader)) {
			parse(b);
		}
		validateFileAndGetDefaults();
	}

	/**
	 * @param section The section
	 * @param option The option
	 * @return Whether the option is specified (or defaulted) in the section
	 */
	public boolean hasOption(ConfigFileSection section, ConfigFileOption option) {
		return optionsFromFile.containsKey(section) && optionsFromFile.get(section).containsKey(option);
	}

	/**
	 * @param section The section
	 * @return Whether the section is specified in the file
	 */
	public boolean hasSection(ConfigFileSection section) {
		return optionsFromFile.containsKey(section);
	}

	/**
	 * @param section File section
	 * @param option The option
	 * @return The values for the option in the section, or an empty list if option is not specified
	 */
	public List<ConfigFileOptionValue> getOptionValues(ConfigFileSection section, ConfigFileOption option) {
		if(!hasOption(section, option)) {
			return Collections.emptyList();
		}
		return Collections.unmodifiableList(optionsFromFile.get(section).get(option));
	}

	/**
	 * @param section File section
	 * @param option The option
	 * @return The value for the option in the section or null if option is not specified in the section
	 */
	public ConfigFileOptionValue getSingleValue(ConfigFileSection section, ConfigFileOption option) {
		if(!hasOption(section, option)) {
			return null;
		}
		if(optionsFromFile.get(section).get(option).size() > 1) {
			throw new ConfigFileException("Can't get single value for option " + option.getName() + ": option is specified more than once in config file.");
		}
		return optionsFromFile.get(section).get(option).get(0);
	}

	/**
	 * @param section File section
	 * @param option The option
	 * @return The single value for the singleton option or null if file does not have the value
	 */
	public String getSingleValueString(ConfigFileSection section, ConfigFileOption option) {
		ConfigFileOptionValue value = getSingleValue(section, option);
		if(value == null) {
			return null;
		}
		return singleField(option, value).asString(1);
	}

	/**
	 * @param section File section
	 * @param option The option
	 * @return The single value for the singleton option
	 */
	public double getSingleValueDouble(ConfigFileSection section, ConfigFileOption option) {
		return singleField(option, requireValue(section, option)).asDouble(1);
	}

	/**
	 * @param section File section
	 * @param option The option
	 * @return The single value for the singleton option
	 */
	public int getSingleValueInt(ConfigFileSection section, ConfigFileOption option) {
		return singleField(option, requireValue(section, option)).asInt(1);
	}

	/**
	 * @param section File section
	 * @param option The option
	 * @return The single value for the singleton option
	 */
	public boolean getSingleValueBoolean(ConfigFileSection section, ConfigFileOption option) {
		return singleField(option, requireValue(section, option)).asBoolean(1);
	}

	/**
	 * @param section The section
	 * @return Options and values in the order listed in the section
	 */
	public List<OptionValuePair> getOrderedOptionsAndValues(ConfigFileSection section) {
		if(!orderedOptionsBySection.containsKey(section)) {
			throw new ConfigFileException("Section not found: " + section.getName());
		}
		return Collections.unmodifiableList(orderedOptionsBySection.get(section));
	}

	private ConfigFileOptionValue requireValue(ConfigFileSection section, ConfigFileOption option) {
		ConfigFileOptionValue value = getSingleValue(section, option);
		if(value == null) {
			throw new ConfigFileException("File does not have option " + option.getName());
		}
		return value;
	}

	private static ConfigFileOptionValue singleField(ConfigFileOption option, ConfigFileOptionValue value) {
		if(value.getActualNumValues() != 2) {
			throw new ConfigFileException("Can't get single value for option " + option.getName() + ": option must specify 2 fields including flag.");
		}
		return value;
	}

	private static boolean isSectionHeaderLine(String fileLine) {
		return fileLine.length() > 0 && fileLine.charAt(0) == SECTION_HEADER_CHAR;
	}

	private static boolean isComment(String fileLine) {
		return fileLine.length() > 0 && fileLine.charAt(0) == COMMENT_CHAR;
	}

	private void parse(BufferedReader b) throws IOException {
		logger.info("Reading config file " + source + "...");
		optionsFromFile = new HashMap<ConfigFileSection, Map<ConfigFileOption, List<ConfigFileOptionValue>>>();
		orderedOptionsBySection = new HashMap<ConfigFileSection, List<OptionValuePair>>();
		StringParser s = new StringParser();
		ConfigFileSection currentSection = null;

		String line;
		while((line = b.readLine()) != null) {
			String trimmed = line.trim();
			s.parse(trimmed);
			// Skip blank lines and comments
			if(s.getFieldCount() == 0 || isComment(trimmed)) {
				continue;
			}
			if(isSectionHeaderLine(trimmed)) {
				String newSectionName = trimmed.substring(1).trim();
				if(!allowableSectionsByName.containsKey(newSectionName)) {
					throw invalid("Section " + newSectionName + " not recognized.");
				}
				currentSection = allowableSectionsByName.get(newSectionName);
				if(optionsFromFile.containsKey(currentSection)) {
					throw invalid("Section is specified more than once: " + newSectionName);
				}
				logger.debug("Reading section " + newSectionName);
				optionsFromFile.put(currentSection, new HashMap<ConfigFileOption, List<ConfigFileOptionValue>>());
				orderedOptionsBySection.put(currentSection, new ArrayList<OptionValuePair>());
				continue;
			}
			if(currentSection == null) {
				throw invalid("First line of file must be section header.");
			}
			String optionName = s.asString(0);
			ConfigFileOption option;
			try {
				option = currentSection.getAllowableOption(optionName);
			} catch(ConfigFileException e) {
				throw invalid(e.getMessage());
			}
			Map<ConfigFileOption, List<ConfigFileOptionValue>> currentSectionOptions = optionsFromFile.get(currentSection);
			if(!currentSectionOptions.containsKey(option)) {
				currentSectionOptions.put(option, new ArrayList<ConfigFileOptionValue>());
			} else if(!option.isRepeatable()) {
				throw invalid("Option " + optionName + " in section " + currentSection.getName() + " is not repeatable.");
			}
			ConfigFileOptionValue val = new ConfigFileOptionValue(option, trimmed, false);
			currentSectionOptions.get(option).add(val);
			orderedOptionsBySection.get(currentSection).add(new OptionValuePair(option, val));
		}
		logger.info("Successfully read config file.");
	}

	private void validateFileAndGetDefaults() {
		for(ConfigFileSection section : allowableSectionsByName.values()) {
			if(!optionsFromFile.containsKey(section)) {
				if(section.isRequired()) {
					throw invalid("Required section " + section.getName() + " is missing.");
				}
				// Absent optional sections still expose option defaults
				optionsFromFile.put(section, new HashMap<ConfigFileOption, List<ConfigFileOptionValue>>());
				orderedOptionsBySection.put(section, new ArrayList<OptionValuePair>());
			}
			Map<ConfigFileOption, List<ConfigFileOptionValue>> sectionOptions = optionsFromFile.get(section);
			for(ConfigFileOption option : section.getAllowableOptions()) {
				if(!sectionOptions.containsKey(option)) {
					if(option.isRequired()) {
						throw invalid("Required option " + option.getName() + " in section " + section.getName() + " is missing.");
					}
					if(option.hasDefault()) {
						List<ConfigFileOptionValue> tmp = new ArrayList<ConfigFileOptionValue>();
						tmp.add(option.getDefaultValue());
						sectionOptions.put(option, tmp);
					}
					continue;
				}
				for(ConfigFileOptionValue value : sectionOptions.get(option)) {
					if(!option.acceptsFieldCount(value.getActualNumValues())) {
						throw invalid("Option " + option.getName() + " in section " + section.getName() + " must have " + option.describeFieldCount() + " fields including the flag itself. (Line = " + value.getFullOptionLine() + ")");
					}
				}
			}
		}
	}

	/**
	 * @return Guide to the sections and options this config file accepts
	 */
	public String getHelpMenu() {

		StringBuilder helpMenu = new StringBuilder("\n************************************************************\n");
		helpMenu.append("************         CONFIG FILE GUIDE         *************\n");
		helpMenu.append("************************************************************\n");
		helpMenu.append("\n").append(COMMENT_CHAR).append("<Comment>\n");
		helpMenu.append(SECTION_HEADER_CHAR).append("<Section_name>\n");

		for(ConfigFileSection section : allowableSectionsByName.values()) {
			helpMenu.append("\n").append(SECTION_HEADER_CHAR).append(section.getName());
			if(section.isRequired()) {
				helpMenu.append("\t(Required)");
			}
			helpMenu.append("\n");
			for(ConfigFileOption option : section.getAllowableOptions()) {
				StringBuilder helpMenuLine = new StringBuilder(option.getName()).append("\t");
				// long command lines are shown as a single placeholder
				if(option.getMaxFields() > MAX_GUIDE_VALUES + 1) {
					helpMenuLine.append("<value1 ...>\t");
				} else {
					for(int i = 2; i <= option.getMaxFields(); i++) {
						helpMenuLine.append("<value").append(i - 1).append(">\t");
					}
				}
				if(option.isRequired()) {
					helpMenuLine.append("(Required)\t");
				}
				if(option.isRepeatable()) {
					helpMenuLine.append("(Repeatable)\t");
				}
				if(option.hasDefault()) {
					helpMenuLine.append("(Default = ").append(option.getDefaultValue().getLineMinusFlag()).append(")\t");
				}
				if(option.getDescription() != null) {
					helpMenuLine.append(option.getDescription());
				}
				helpMenu.append(helpMenuLine).append("\n");
			}
		}
		helpMenu.append("\n************************************************************\n");
		return helpMenu.toString();
	}

	private ConfigFileException invalid(String errorMessage) {
		return new ConfigFileException("Invalid config file " + source + ":\n" + errorMessage + "\n" + getHelpMenu());
	}

	public class OptionValuePair {

		private ConfigFileOption option;
		private ConfigFileOptionValue value;

		public OptionValuePair(ConfigFileOption op, ConfigFileOptionValue val) {
			option = op;
			value = val;
		}

		public ConfigFileOption option() {return option;}
		public ConfigFileOptionValue value() {return value;}

	}

}
