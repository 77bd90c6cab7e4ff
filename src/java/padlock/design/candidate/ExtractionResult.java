package padlock.design.candidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidate k-mers per found gene and a reason per gene without candidates.
 * Both maps follow roster order.
 */
public final class ExtractionResult {

	private final List<String> roster;
	private final Map<String, List<CandidateKmer>> found;
	private final Map<String, NotFoundReason> notFound;

	/**
	 * @param roster Genes in input order
	 * @param found Non-empty candidate lists per gene
	 * @param notFound Reason per gene without candidates
	 */
	public ExtractionResult(List<String> roster, Map<String, List<CandidateKmer>> found, Map<String, NotFoundReason> notFound) {
		Map<String, List<CandidateKmer>> f = new LinkedHashMap<String, List<CandidateKmer>>();
		Map<String, NotFoundReason> nf = new LinkedHashMap<String, NotFoundReason>();
		for(String gene : roster) {
			if(found.containsKey(gene) && notFound.containsKey(gene)) {
				throw new IllegalArgumentException("Gene " + gene + " is both found and not found");
			}
			if(found.containsKey(gene)) {
				if(found.get(gene).isEmpty()) {
					throw new IllegalArgumentException("Found gene " + gene + " has no candidates");
				}
				f.put(gene, Collections.unmodifiableList(new ArrayList<CandidateKmer>(found.get(gene))));
			} else if(notFound.containsKey(gene)) {
				nf.put(gene, notFound.get(gene));
			} else {
				throw new IllegalArgumentException("Gene " + gene + " has no extraction outcome");
			}
		}
		this.roster = Collections.unmodifiableList(new ArrayList<String>(roster));
		this.found = Collections.unmodifiableMap(f);
		this.notFound = Collections.unmodifiableMap(nf);
	}

	public List<String> getRoster() {
		return roster;
	}

	public Map<String, List<CandidateKmer>> getFound() {
		return found;
	}

	public Map<String, NotFoundReason> getNotFound() {
		return notFound;
	}

	public boolean isFound(String gene) {
		return found.containsKey(gene);
	}

	/**
	 * @param gene Gene
	 * @return Candidates, or an empty list if the gene was not found
	 */
	public List<CandidateKmer> getCandidates(String gene) {
		List<CandidateKmer> rtrn = found.get(gene);
		return rtrn == null ? Collections.<CandidateKmer>emptyList() : rtrn;
	}

}
