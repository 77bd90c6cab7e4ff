package padlock.design.candidate.predicate;

import org.apache.log4j.Logger;

import padlock.core.pipeline.ConfigFileOptionValue;

/**
 * Shared config line handling for k-mer predicates.
 * Lines look like <code>kmer_filter &lt;name&gt; &lt;param1&gt; ...</code>.
 */
public abstract class AbstractKmerPredicate implements KmerPredicate {

	private static Logger logger = Logger.getLogger(AbstractKmerPredicate.class.getName());

	/**
	 * @param value Config file value already known to name this predicate
	 * @return Whether the parameters are valid
	 */
	protected abstract boolean validParameters(ConfigFileOptionValue value);

	/**
	 * @param value Valid config file value
	 */
	protected abstract void setParameters(ConfigFileOptionValue value);

	@Override
	public boolean validConfigFileValue(ConfigFileOptionValue value) {
		if(value.getActualNumValues() < 2) return false;
		if(!value.asString(0).equals(OPTION_FLAG)) return false;
		if(!value.asString(1).equals(name())) return false;
		try {
			if(validParameters(value)) {
				return true;
			}
		} catch(RuntimeException e) {
			logger.debug("Invalid value " + value.getFullOptionLine() + ": " + e.getMessage());
		}
		logger.error("Correct config file line format: " + configFileLineDescription());
		return false;
	}

	@Override
	public void setParametersFromConfigFile(ConfigFileOptionValue value) {
		if(!validConfigFileValue(value)) {
			throw new IllegalArgumentException("Config file line invalid. Line format:\n" + configFileLineDescription());
		}
		setParameters(value);
	}

	@Override
	public String getPredicateName() {
		return name();
	}

	@Override
	public String toString() {
		return name();
	}

}
