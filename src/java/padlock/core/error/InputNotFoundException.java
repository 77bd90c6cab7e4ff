package padlock.core.error;

import java.io.File;

/**
 * A required input file is missing or unreadable
 */
public class InputNotFoundException extends DesignException {

	private static final long serialVersionUID = 3056279152881923013L;
	private final String path;

	public InputNotFoundException(String description, String path) {
		super(description + " not found or not readable: " + path);
		this.path = path;
	}

	/**
	 * @return The path that could not be read
	 */
	public String getPath() {
		return path;
	}

	/**
	 * @param file File to check
	 * @param description What the file is, used in the error message
	 * @throws InputNotFoundException If the file does not exist, is a directory or cannot be read
	 */
	public static void assertReadable(File file, String description) throws InputNotFoundException {
		if(file == null) {
			throw new InputNotFoundException(description, "null");
		}
		if(!file.exists() || file.isDirectory() || !file.canRead()) {
			throw new InputNotFoundException(description, file.getPath());
		}
	}

}
