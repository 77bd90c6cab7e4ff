package padlock.core.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;


/**
 * Flag/value command line parser.
 * Every flag takes exactly one value: "-c design.cfg -l DEBUG".
 */
public final class CommandLineParser {

	private boolean isParsed;
	private List<String> programDescription;

	private Map<String,String> stringArgDescriptions;
	private Map<String,String> stringArgDefaults;

	private Set<String> requiredArgs;
	private Map<String,String> commandLineValues;


	public CommandLineParser() {
		isParsed = false;
		stringArgDescriptions = new HashMap<String,String>();
		stringArgDefaults = new HashMap<String,String>();
		programDescription = new ArrayList<String>();
		requiredArgs = new HashSet<String>();
		commandLineValues = new HashMap<String,String>();
	}

	/**
	 * Sets program description to be printed as part of help menu
	 * @param description The program description
	 */
	public void setProgramDescription(String description) {
		programDescription.add(description);
	}

	/**
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 */
	public void addStringArg(String flag, String description, boolean required) {
		addStringArg(flag, description, required, null);
	}

	/**
	 * @param flag the command line flag for the argument
	 * @param description the description of the argument
	 * @param required whether parameter is required
	 * @param def default value
	 */
	public void addStringArg(String flag, String description, boolean required, String def) {
		enforceUniqueFlag(flag);
		stringArgDescriptions.put(flag, description);
		if(required) requiredArgs.add(flag);
		if(def != null) stringArgDefaults.put(flag, def);
	}

	/**
	 * Parse command arguments
	 * @param args the command line arguments passed to a main program
	 * @throws IllegalArgumentException If the command line is malformed or a required argument is missing; the message includes the help menu
	 */
	public void parse(String[] args) {

		isParsed = false;
		commandLineValues.clear();
		int i = 0;
		while(i < args.length) {

			// A flag shouldn't be the last item
			if(args.length == i+1) {
				throw new IllegalArgumentException("No value for flag " + args[i] + "\n" + getHelpMessage());
			}

			// Make sure flag exists; can't see same flag twice; next item should not be a flag
			if(!hasFlag(args[i])) {
				throw new IllegalArgumentException("Unknown flag " + args[i] + "\n" + getHelpMessage());
			}
			if(commandLineValues.containsKey(args[i])) {
				throw new IllegalArgumentException("Flag " + args[i] + " given more than once\n" + getHelpMessage());
			}
			if(hasFlag(args[i+1])) {
				throw new IllegalArgumentException("No value for flag " + args[i] + "\n" + getHelpMessage());
			}

			commandLineValues.put(args[i], args[i+1]);
			i += 2;
		}

		for(String req : requiredArgs) {
			if(!commandLineValues.containsKey(req)) {
				throw new IllegalArgumentException("Invalid command line: argument " + req + " is required\n" + getHelpMessage());
			}
		}

		isParsed = true;
	}

	/**
	 * @param flag The command line flag for the argument
	 * @return String specified on command line, the default, or null if neither
	 */
	public String getStringArg(String flag) {
		checkParsed(flag);
		if(commandLineValues.get(flag) == null) {
			return stringArgDefaults.get(flag);
		}
		return commandLineValues.get(flag);
	}

	private void checkParsed(String flag) {
		if(!isParsed) {
			throw new IllegalStateException("Cannot get parameter value without first calling method parse()");
		}
		if(!stringArgDescriptions.containsKey(flag)) {
			throw new IllegalArgumentException("Unknown parameter " + flag);
		}
	}

	/**
	 * @return Program description plus argument flags and descriptions
	 */
	public String getHelpMessage() {
		StringBuilder sb = new StringBuilder("\n");
		for(String s : programDescription) {
			sb.append(s).append("\n\n");
		}
		for(String key : new TreeSet<String>(stringArgDescriptions.keySet())) {
			sb.append(key).append(" <String>\t").append(stringArgDescriptions.get(key));
			if(requiredArgs.contains(key)) sb.append(" (required)");
			else sb.append(" (default=").append(stringArgDefaults.get(key)).append(")");
			sb.append("\n");
		}
		return sb.toString();
	}

	private boolean hasFlag(String flag) {
		return stringArgDescriptions.containsKey(flag);
	}

	private void enforceUniqueFlag(String flag) {
		if(hasFlag(flag)) {
			throw new IllegalStateException("Flag " + flag + " has already been used.");
		}
	}

}
