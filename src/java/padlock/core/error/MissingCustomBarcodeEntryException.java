package padlock.core.error;

/**
 * Custom barcode assignment has no usable entry for a gene
 */
public class MissingCustomBarcodeEntryException extends DesignException {

	private static final long serialVersionUID = 5409125672311287954L;
	private final String gene;

	public MissingCustomBarcodeEntryException(String gene) {
		super("Custom barcode table has no Lbar_ID for gene " + gene);
		this.gene = gene;
	}

	public MissingCustomBarcodeEntryException(String gene, int barcodeId) {
		super("Custom barcode table assigns id " + barcodeId + " to gene " + gene + " but the barcode library has no such id");
		this.gene = gene;
	}

	public String getGene() {
		return gene;
	}

}
