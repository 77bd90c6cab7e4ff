package padlock.design.candidate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.commons.collections15.Predicate;
import org.apache.commons.collections15.iterators.FilterIterator;
import org.apache.log4j.Logger;

import padlock.core.error.ExternalToolException;
import padlock.design.RoundTag;
import padlock.design.candidate.predicate.GCContentPredicate;
import padlock.design.candidate.predicate.KmerPredicate;
import padlock.design.reference.TranscriptEntry;
import padlock.design.reference.Transcriptome;

/**
 * Finds k-mers in the regions conserved across all isoforms of a gene that pass
 * the GC bounds and any configured chemistry predicates
 */
public class CandidateExtractor {

	private static Logger logger = Logger.getLogger(CandidateExtractor.class.getName());

	private final int kmerLength;
	private final List<KmerPredicate> predicates;

	/**
	 * @param kmerLength K-mer length
	 * @param gcContent GC bounds
	 * @param otherPredicates Additional predicates, evaluated in order after the GC check
	 */
	public CandidateExtractor(int kmerLength, GCContentPredicate gcContent, Collection<KmerPredicate> otherPredicates) {
		if(kmerLength < 2) {
			throw new IllegalArgumentException("K-mer length must be at least 2: " + kmerLength);
		}
		this.kmerLength = kmerLength;
		List<KmerPredicate> tmp = new ArrayList<KmerPredicate>();
		tmp.add(gcContent);
		tmp.addAll(otherPredicates);
		this.predicates = Collections.unmodifiableList(tmp);
	}

	public int getKmerLength() {
		return kmerLength;
	}

	public List<KmerPredicate> getPredicates() {
		return predicates;
	}

	/**
	 * Extract candidates for each gene in roster order. Repeated genes are considered once.
	 * @param genes Gene roster
	 * @param transcriptome Reference transcriptome
	 * @param aligner Aligner for genes with more than one isoform
	 * @return Candidates and not-found reasons
	 * @throws ExternalToolException If the aligner fails
	 * @throws InterruptedException
	 */
	public ExtractionResult extractAll(List<String> genes, Transcriptome transcriptome, IsoformAligner aligner) throws ExternalToolException, InterruptedException {
		List<String> roster = new ArrayList<String>(new LinkedHashSet<String>(genes));
		if(roster.size() < genes.size()) {
			logger.warn("Gene list has " + (genes.size() - roster.size()) + " repeated entries; using each gene once.");
		}
		Map<String, List<CandidateKmer>> found = new LinkedHashMap<String, List<CandidateKmer>>();
		Map<String, NotFoundReason> notFound = new LinkedHashMap<String, NotFoundReason>();
		for(String gene : roster) {
			List<TranscriptEntry> isoforms = transcriptome.getIsoforms(gene);
			if(isoforms.isEmpty()) {
				logger.warn("No reference header contains (" + gene + "); check gene naming.");
				notFound.put(gene, NotFoundReason.NOT_IN_REFERENCE);
				continue;
			}
			GeneAlignment alignment = isoforms.size() == 1 ? singleIsoform(gene, isoforms.get(0)) : aligner.align(gene, isoforms);
			if(!hasConservedRun(alignment)) {
				logger.info(gene + ": no conserved region of length " + kmerLength + " across " + isoforms.size() + " isoforms");
				notFound.put(gene, NotFoundReason.NO_CONSERVED_REGION);
				continue;
			}
			List<CandidateKmer> candidates = extract(alignment);
			if(candidates.isEmpty()) {
				logger.info(gene + ": no conserved k-mer passes the filters");
				notFound.put(gene, NotFoundReason.NO_VALID_KMER);
				continue;
			}
			logger.info(gene + ": " + candidates.size() + " candidate k-mers from " + isoforms.size() + " isoforms");
			found.put(gene, candidates);
		}
		logger.info("Found candidates for " + found.size() + " of " + roster.size() + " genes.");
		return new ExtractionResult(roster, found, notFound);
	}

	private static GeneAlignment singleIsoform(String gene, TranscriptEntry isoform) {
		List<String> rows = new ArrayList<String>();
		rows.add(isoform.getSequence());
		return new GeneAlignment(gene, rows);
	}

	private boolean hasConservedRun(GeneAlignment alignment) {
		for(int[] run : alignment.getConservedRuns()) {
			if(run[1] - run[0] >= kmerLength) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @param alignment Isoform alignment of one gene
	 * @return Passing k-mers in left to right order, first occurrence of each sequence only
	 */
	public List<CandidateKmer> extract(GeneAlignment alignment) {
		List<CandidateKmer> windows = new ArrayList<CandidateKmer>();
		for(int[] run : alignment.getConservedRuns()) {
			for(int start = run[0]; start + kmerLength <= run[1]; start++) {
				String seq = alignment.getConsensus(start, start + kmerLength);
				windows.add(new CandidateKmer(alignment.getGene(), start, seq, RoundTag.EXTRACTION));
			}
		}
		Map<String, Integer> failures = new TreeMap<String, Integer>();
		FilterIterator<CandidateKmer> passing = new FilterIterator<CandidateKmer>(windows.iterator(), allPredicates(failures));
		List<CandidateKmer> rtrn = new ArrayList<CandidateKmer>();
		Set<String> seen = new HashSet<String>();
		while(passing.hasNext()) {
			CandidateKmer kmer = passing.next();
			if(seen.add(kmer.getSequence())) {
				rtrn.add(kmer);
			}
		}
		if(!failures.isEmpty()) {
			logger.debug(alignment.getGene() + ": " + windows.size() + " conserved windows; rejected " + failures);
		}
		return rtrn;
	}

	private Predicate<CandidateKmer> allPredicates(final Map<String, Integer> failures) {
		return new Predicate<CandidateKmer>() {
			@Override
			public boolean evaluate(CandidateKmer kmer) {
				for(KmerPredicate p : predicates) {
					if(!p.evaluate(kmer)) {
						String msg = p.getShortFailureMessage(kmer);
						Integer n = failures.get(msg);
						failures.put(msg, Integer.valueOf(n == null ? 1 : n.intValue() + 1));
						return false;
					}
				}
				return true;
			}
		};
	}

}
