package padlock.core.error;

/**
 * An external collaborator (aligner or transcriptome search) could not be run,
 * did not finish in time, or produced output that could not be parsed
 */
public class ExternalToolException extends DesignException {

	private static final long serialVersionUID = 7713960226150398765L;
	private final String tool;

	public ExternalToolException(String tool, String message) {
		super(tool + ": " + message);
		this.tool = tool;
	}

	public ExternalToolException(String tool, String message, Throwable cause) {
		super(tool + ": " + message, cause);
		this.tool = tool;
	}

	/**
	 * @return Name of the failing tool
	 */
	public String getTool() {
		return tool;
	}

}
