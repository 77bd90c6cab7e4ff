package padlock.core.error;

/**
 * A tabular or FASTA input could not be parsed
 */
public class ParseException extends DesignException {

	private static final long serialVersionUID = 1932856210457711180L;

	public ParseException(String message) {
		super(message);
	}

	public ParseException(String message, Throwable cause) {
		super(message, cause);
	}

}
