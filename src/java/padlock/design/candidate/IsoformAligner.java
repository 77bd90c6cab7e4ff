package padlock.design.candidate;

import java.util.List;

import padlock.core.error.ExternalToolException;
import padlock.design.reference.TranscriptEntry;

/**
 * Multiple sequence alignment of the isoforms of one gene
 */
public interface IsoformAligner {

	/**
	 * @param gene Gene
	 * @param isoforms At least two isoforms
	 * @return Alignment with one row per isoform
	 * @throws ExternalToolException If the alignment cannot be produced
	 * @throws InterruptedException
	 */
	public GeneAlignment align(String gene, List<TranscriptEntry> isoforms) throws ExternalToolException, InterruptedException;

}
