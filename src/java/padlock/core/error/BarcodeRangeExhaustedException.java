package padlock.core.error;

/**
 * Sequential barcode assignment ran past the ids available in the barcode library
 */
public class BarcodeRangeExhaustedException extends DesignException {

	private static final long serialVersionUID = -1520381143766390415L;
	private final String gene;
	private final int barcodeId;

	public BarcodeRangeExhaustedException(String gene, int barcodeId) {
		super("Barcode id " + barcodeId + " for gene " + gene + " is outside the barcode library");
		this.gene = gene;
		this.barcodeId = barcodeId;
	}

	public String getGene() {
		return gene;
	}

	public int getBarcodeId() {
		return barcodeId;
	}

}
