package padlock.design.barcode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Barcode id per gene, in gene order
 */
public final class BarcodeAssignment {

	private final AssignmentMode mode;
	private final Map<String, Integer> idsByGene;

	public BarcodeAssignment(AssignmentMode mode, Map<String, Integer> idsByGene) {
		this.mode = mode;
		this.idsByGene = Collections.unmodifiableMap(new LinkedHashMap<String, Integer>(idsByGene));
	}

	public AssignmentMode getMode() {
		return mode;
	}

	public boolean hasGene(String gene) {
		return idsByGene.containsKey(gene);
	}

	/**
	 * @param gene Gene
	 * @return Barcode id
	 * @throws IllegalArgumentException If the gene has no id
	 */
	public int getId(String gene) {
		Integer id = idsByGene.get(gene);
		if(id == null) {
			throw new IllegalArgumentException("No barcode assigned to " + gene);
		}
		return id.intValue();
	}

	public Map<String, Integer> asMap() {
		return idsByGene;
	}

}
