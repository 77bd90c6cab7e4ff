package padlock.core.pipeline;

/**
 * Invalid config file; the message carries the config file guide
 */
public class ConfigFileException extends IllegalArgumentException {

	private static final long serialVersionUID = 6619407736501284113L;

	public ConfigFileException(String message) {
		super(message);
	}

	public ConfigFileException(String message, Throwable cause) {
		super(message, cause);
	}

}
