package padlock.design.barcode;

/**
 * One row of the barcode library
 */
public final class BarcodeEntry {

	private final int id;
	private final String backbone;
	private final String code;
	private final String externalId;

	/**
	 * @param id Lbar_ID
	 * @param backbone Backbone sequence placed between the probe arms
	 * @param code Decoded barcode
	 * @param externalId External annotation id, or null
	 */
	public BarcodeEntry(int id, String backbone, String code, String externalId) {
		this.id = id;
		this.backbone = backbone;
		this.code = code;
		this.externalId = externalId;
	}

	public int getId() {
		return id;
	}

	public String getBackbone() {
		return backbone;
	}

	public String getCode() {
		return code;
	}

	/**
	 * @return External annotation id, or null if the library has none
	 */
	public String getExternalId() {
		return externalId;
	}

	@Override
	public String toString() {
		return "Lbar_" + id + ":" + code;
	}

}
