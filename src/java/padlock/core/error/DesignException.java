package padlock.core.error;

/**
 * Fatal condition that stops a design run.
 * Subclasses name the offending gene, file or tool in their message.
 */
public class DesignException extends Exception {

	private static final long serialVersionUID = -4218755630196348201L;

	public DesignException(String message) {
		super(message);
	}

	public DesignException(String message, Throwable cause) {
		super(message, cause);
	}

}
