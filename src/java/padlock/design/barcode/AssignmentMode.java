package padlock.design.barcode;

import java.util.Locale;

/**
 * How genes are mapped to barcode ids
 */
public enum AssignmentMode {

	/**
	 * Genes in input order get on, on+1, ...
	 */
	START,

	/**
	 * Genes in input order get on, on-1, ...
	 */
	END,

	/**
	 * Ids come from a Gene, Lbar_ID table
	 */
	CUSTOM;

	/**
	 * @param name "start", "end" or "custom", any case
	 * @return The mode
	 */
	public static AssignmentMode fromName(String name) {
		return valueOf(name.toUpperCase(Locale.ROOT));
	}

}
