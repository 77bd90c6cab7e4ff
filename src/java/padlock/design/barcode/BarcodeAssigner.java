package padlock.design.barcode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import padlock.core.error.BarcodeRangeExhaustedException;
import padlock.core.error.MissingCustomBarcodeEntryException;
import padlock.core.sequence.SequenceUtils;
import padlock.design.specificity.MatchResult;

/**
 * Maps genes to barcodes and assembles probes from specific k-mers
 */
public class BarcodeAssigner {

	private static Logger logger = Logger.getLogger(BarcodeAssigner.class.getName());

	private final BarcodeLibrary library;
	private final AssignmentMode mode;
	private final int firstId;
	private final Map<String, Integer> customIds;
	private final Integer armLength;
	private final Integer capPerGene;

	/**
	 * @param library Barcode library
	 * @param mode Assignment mode
	 * @param firstId First id for start and end modes; ignored for custom
	 * @param customIds Ids per gene for custom mode; may be null otherwise
	 * @param armLength 3' arm length, or null for half the k-mer length
	 * @param capPerGene Maximum probes per gene, or null for no cap
	 */
	public BarcodeAssigner(BarcodeLibrary library, AssignmentMode mode, int firstId, Map<String, Integer> customIds, Integer armLength, Integer capPerGene) {
		if(mode == AssignmentMode.CUSTOM && customIds == null) {
			throw new IllegalArgumentException("Custom barcode assignment needs a Gene, Lbar_ID table");
		}
		if(capPerGene != null && capPerGene.intValue() < 1) {
			throw new IllegalArgumentException("Cap per gene must be positive: " + capPerGene);
		}
		this.library = library;
		this.mode = mode;
		this.firstId = firstId;
		this.customIds = customIds;
		this.armLength = armLength;
		this.capPerGene = capPerGene;
	}

	/**
	 * In start and end mode every roster gene gets an id by position; ids are checked against the library
	 * only for genes with probes. In custom mode only genes with probes are assigned.
	 * @param roster Genes in input order
	 * @param genesWithProbes Genes that will get probes
	 * @return The assignment
	 * @throws BarcodeRangeExhaustedException If a gene with probes gets an id below 1 or absent from the library
	 * @throws MissingCustomBarcodeEntryException If a gene with probes has no custom id or its id is not in the library
	 */
	public BarcodeAssignment assign(List<String> roster, List<String> genesWithProbes) throws BarcodeRangeExhaustedException, MissingCustomBarcodeEntryException {
		Map<String, Integer> ids = new LinkedHashMap<String, Integer>();
		if(mode == AssignmentMode.CUSTOM) {
			for(String gene : roster) {
				if(!genesWithProbes.contains(gene)) {
					continue;
				}
				Integer id = customIds.get(gene);
				if(id == null) {
					throw new MissingCustomBarcodeEntryException(gene);
				}
				if(!library.contains(id.intValue())) {
					throw new MissingCustomBarcodeEntryException(gene, id.intValue());
				}
				ids.put(gene, id);
			}
		} else {
			int step = mode == AssignmentMode.START ? 1 : -1;
			for(int i = 0; i < roster.size(); i++) {
				String gene = roster.get(i);
				int id = firstId + step * i;
				if(genesWithProbes.contains(gene) && (id < 1 || !library.contains(id))) {
					throw new BarcodeRangeExhaustedException(gene, id);
				}
				ids.put(gene, Integer.valueOf(id));
			}
		}
		logger.info("Assigned barcodes to " + ids.size() + " genes in " + mode.toString().toLowerCase() + " mode");
		return new BarcodeAssignment(mode, ids);
	}

	/**
	 * @param roster Genes in input order
	 * @param specific Specific results, in roster order then by start
	 * @return One probe per specific k-mer, capped per gene if configured
	 * @throws BarcodeRangeExhaustedException
	 * @throws MissingCustomBarcodeEntryException
	 */
	public List<Probe> design(List<String> roster, List<MatchResult> specific) throws BarcodeRangeExhaustedException, MissingCustomBarcodeEntryException {
		Map<String, List<MatchResult>> byGene = new LinkedHashMap<String, List<MatchResult>>();
		for(MatchResult r : specific) {
			if(!r.isSpecific()) {
				throw new IllegalArgumentException("Not a specific result: " + r);
			}
			List<MatchResult> list = byGene.get(r.getGene());
			if(list == null) {
				list = new ArrayList<MatchResult>();
				byGene.put(r.getGene(), list);
			}
			if(capPerGene == null || list.size() < capPerGene.intValue()) {
				list.add(r);
			}
		}
		List<String> genesWithProbes = new ArrayList<String>(byGene.keySet());
		BarcodeAssignment assignment = assign(roster, genesWithProbes);
		List<Probe> rtrn = new ArrayList<Probe>();
		for(String gene : roster) {
			if(!byGene.containsKey(gene)) {
				continue;
			}
			BarcodeEntry barcode = library.get(assignment.getId(gene));
			for(MatchResult r : byGene.get(gene)) {
				rtrn.add(assemble(r, barcode));
			}
		}
		logger.info("Designed " + rtrn.size() + " probes for " + genesWithProbes.size() + " genes");
		return rtrn;
	}

	/**
	 * @param result Specific result
	 * @param barcode Barcode of the gene
	 * @return Probe: second part of the reverse complement, backbone, first part
	 */
	public Probe assemble(MatchResult result, BarcodeEntry barcode) {
		String rc = SequenceUtils.reverseComplement(result.getSequence());
		int split = armLength == null ? rc.length() / 2 : armLength.intValue();
		if(split < 1 || split >= rc.length()) {
			throw new IllegalArgumentException("Arm length " + split + " does not split a k-mer of length " + rc.length());
		}
		String threePrimeArm = rc.substring(0, split);
		String fivePrimeArm = rc.substring(split);
		return new Probe(result.getGene(), result.getSequence(), result.getKmer().getStart(), result.getRound(), fivePrimeArm, threePrimeArm, barcode);
	}

}
