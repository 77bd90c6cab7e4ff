package padlock.design.specificity;

import java.util.ArrayList;
import java.util.List;

import padlock.core.sequence.SequenceUtils;
import padlock.design.reference.TranscriptEntry;
import padlock.design.reference.Transcriptome;

/**
 * Scans every transcriptome entry in memory for a window within the mismatch threshold
 */
public class HammingScanSearcher implements TranscriptomeSearcher {

	private final Transcriptome transcriptome;
	private final boolean searchReverseComplement;

	/**
	 * @param transcriptome Reference
	 * @param searchReverseComplement Also match the reverse complement of the query
	 */
	public HammingScanSearcher(Transcriptome transcriptome, boolean searchReverseComplement) {
		this.transcriptome = transcriptome;
		this.searchReverseComplement = searchReverseComplement;
	}

	@Override
	public List<String> search(String query, int maxMismatches) throws InterruptedException {
		String rc = searchReverseComplement ? SequenceUtils.reverseComplement(query) : null;
		List<String> rtrn = new ArrayList<String>();
		for(TranscriptEntry entry : transcriptome.getEntries()) {
			if(Thread.interrupted()) {
				throw new InterruptedException("Search interrupted for " + query);
			}
			String target = entry.getSequence();
			if(SequenceUtils.containsWithMismatches(query, target, maxMismatches)
					|| (rc != null && SequenceUtils.containsWithMismatches(rc, target, maxMismatches))) {
				rtrn.add(entry.getHeader());
			}
		}
		return rtrn;
	}

}
