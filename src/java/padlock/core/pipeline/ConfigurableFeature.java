package padlock.core.pipeline;

/**
 * A pluggable component whose parameters come from one config file line
 */
public interface ConfigurableFeature {

	/**
	 * @return Name of feature as written in the config file
	 */
	public String name();

	/**
	 * @return Description of a valid config file line to specify parameters of this feature
	 */
	public String configFileLineDescription();

	/**
	 * @param value Config file value
	 * @return Whether the value is a valid specification of this feature
	 */
	public boolean validConfigFileValue(ConfigFileOptionValue value);

	/**
	 * @param value Config file value
	 */
	public void setParametersFromConfigFile(ConfigFileOptionValue value);

}
