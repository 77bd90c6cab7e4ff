package padlock.design;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import padlock.core.error.DesignException;
import padlock.core.error.ExternalToolException;
import padlock.core.parser.CommandLineParser;
import padlock.design.barcode.AssignmentMode;
import padlock.design.barcode.BarcodeAssigner;
import padlock.design.barcode.BarcodeLibrary;
import padlock.design.barcode.Probe;
import padlock.design.candidate.CandidateExtractor;
import padlock.design.candidate.ExternalCommandAligner;
import padlock.design.candidate.ExtractionResult;
import padlock.design.candidate.GeneAlignment;
import padlock.design.candidate.IsoformAligner;
import padlock.design.classify.ClassificationResult;
import padlock.design.classify.GeneClassifier;
import padlock.design.classify.RoundMerger;
import padlock.design.io.CustomBarcodeTableReader;
import padlock.design.io.DesignTableWriter;
import padlock.design.io.GeneListReader;
import padlock.design.io.MappedTableReader;
import padlock.design.reference.TranscriptEntry;
import padlock.design.reference.Transcriptome;
import padlock.design.sampling.KmerSampler;
import padlock.design.sampling.RandomSourceFactory;
import padlock.design.sampling.SampledRound;
import padlock.design.specificity.ExternalCommandSearcher;
import padlock.design.specificity.HammingScanSearcher;
import padlock.design.specificity.MatchResult;
import padlock.design.specificity.SpecificityMatcher;
import padlock.design.specificity.TranscriptomeSearcher;

/**
 * Designs padlock probes from a config file: extracts conserved candidates, runs sampling and
 * specificity rounds until every gene has enough specific k-mers or the rounds run out, merges
 * the rounds and assigns barcodes.
 */
public class PadlockProbeDesigner {

	private static Logger logger = Logger.getLogger(PadlockProbeDesigner.class.getName());

	/**
	 * Label of merged output files
	 */
	public static final String MERGED_LABEL = "merged";

	private final DesignConfiguration config;
	private final IsoformAligner alignerOverride;

	/**
	 * @param config Configuration
	 */
	public PadlockProbeDesigner(DesignConfiguration config) {
		this(config, null);
	}

	/**
	 * @param config Configuration
	 * @param aligner Aligner to use instead of the configured command, or null
	 */
	public PadlockProbeDesigner(DesignConfiguration config, IsoformAligner aligner) {
		this.config = config;
		this.alignerOverride = aligner;
	}

	/**
	 * Run the full design and write all tables
	 * @return What the run produced
	 * @throws DesignException If an input is missing or malformed, an external tool fails, or barcodes cannot be assigned
	 * @throws IOException If output cannot be written
	 * @throws InterruptedException
	 */
	public DesignOutcome run() throws DesignException, IOException, InterruptedException {
		logger.info("");
		logger.info("Reading inputs...");
		List<String> genes = GeneListReader.load(config.getGeneList());
		Transcriptome transcriptome = Transcriptome.load(config.getTranscriptomeFasta());
		BarcodeLibrary library = BarcodeLibrary.load(config.getBarcodeLibrary());
		Map<String, Integer> customIds = config.getAssignmentMode() == AssignmentMode.CUSTOM ? CustomBarcodeTableReader.load(config.getCustomBarcodeTable()) : null;
		DesignTableWriter writer = new DesignTableWriter(config.getOutputDir(), config.getOutputPrefix());

		logger.info("");
		logger.info("Extracting candidate k-mers...");
		CandidateExtractor extractor = new CandidateExtractor(config.getKmerLength(), config.getGCContentPredicate(), config.getKmerPredicates());
		ExtractionResult extraction = extractor.extractAll(genes, transcriptome, createAligner());
		writer.writeCandidates(extraction);
		writer.writeNotFound(extraction);
		List<String> roster = extraction.getRoster();

		GeneClassifier classifier = new GeneClassifier(config.getTargetSpecific());
		RoundMerger merger = new RoundMerger(classifier);
		Map<String, Set<String>> tested = new HashMap<String, Set<String>>();

		ClassificationResult merged = null;
		int firstRound = 1;
		List<MatchResult> prior = readPriorRounds();
		if(!prior.isEmpty()) {
			RoundTag priorTag = null;
			for(MatchResult r : prior) {
				priorTag = priorTag == null ? r.getRound() : priorTag.mergeWith(r.getRound());
			}
			merged = classifier.classify(prior, roster, extraction.getNotFound(), priorTag);
			recordTested(tested, merged.getResults());
			// continue numbering after the prior rounds
			firstRound = priorTag.getHighestRoundNumber() + 1;
			logger.info("Read " + prior.size() + " results from prior rounds " + priorTag + "; new rounds start at round" + firstRound);
		}

		List<String> toSample = merged == null ? new ArrayList<String>(extraction.getFound().keySet()) : merged.getGenesNeedingAnotherRound();
		KmerSampler sampler = new KmerSampler();
		RandomSourceFactory randomSource = config.getSeed() == null ? RandomSourceFactory.unseeded() : RandomSourceFactory.seeded(config.getSeed().longValue());
		SpecificityMatcher matcher = new SpecificityMatcher(createSearcher(transcriptome), config.getMismatches(), config.getHitAttribution(),
				config.getThreads(), config.getSearchTimeoutSeconds(), config.getSearchRetries());
		List<SampledRound> rounds = new ArrayList<SampledRound>();
		List<Integer> sampleSizes = config.getSampleSizes();
		for(int i = 0; i < sampleSizes.size(); i++) {
			if(toSample.isEmpty()) {
				logger.info("No genes need another round.");
				break;
			}
			RoundTag round = RoundTag.round(firstRound + i);
			logger.info("");
			logger.info("Starting " + round + " for " + toSample.size() + " genes with sample size " + sampleSizes.get(i) + "...");
			SampledRound sampled = sampler.sampleRound(extraction, toSample, sampleSizes.get(i).intValue(), randomSource, round, tested);
			rounds.add(sampled);
			List<MatchResult> results = matcher.match(sampled.getAllKmers());
			writer.writeMapped(round.getLabel(), results);
			ClassificationResult classification = classifier.classify(results, roster, extraction.getNotFound(), round);
			writer.writeClassification(round.getLabel(), classification);
			recordTested(tested, results);
			merged = merged == null ? classification : merger.merge(merged, classification);
			toSample = merged.getGenesNeedingAnotherRound();
		}
		if(merged == null) {
			merged = classifier.classify(Collections.<MatchResult>emptyList(), roster, extraction.getNotFound(), RoundTag.of(MERGED_LABEL));
		}
		if(!toSample.isEmpty()) {
			logger.warn(toSample.size() + " genes still have fewer than " + config.getTargetSpecific() + " specific k-mers: " + toSample);
		}
		writer.writeClassification(MERGED_LABEL, merged);
		writer.writeSpecific(MERGED_LABEL, merged);

		logger.info("");
		logger.info("Assigning barcodes...");
		Integer cap = config.getCapPerGene() ? Integer.valueOf(config.getTargetSpecific()) : null;
		int firstId = config.getAssignmentMode() == AssignmentMode.CUSTOM ? 0 : config.getFirstBarcodeId();
		BarcodeAssigner assigner = new BarcodeAssigner(library, config.getAssignmentMode(), firstId, customIds, config.getArmLength(), cap);
		List<Probe> probes = assigner.design(roster, merged.getSpecificResults());
		writer.writeProbes(probes);
		return new DesignOutcome(extraction, rounds, merged, probes);
	}

	private List<MatchResult> readPriorRounds() throws IOException, DesignException {
		List<MatchResult> rtrn = new ArrayList<MatchResult>();
		for(File table : config.getPriorRoundTables()) {
			rtrn.addAll(MappedTableReader.load(table));
		}
		return rtrn;
	}

	private static void recordTested(Map<String, Set<String>> tested, List<MatchResult> results) {
		for(MatchResult r : results) {
			Set<String> seqs = tested.get(r.getGene());
			if(seqs == null) {
				seqs = new HashSet<String>();
				tested.put(r.getGene(), seqs);
			}
			seqs.add(r.getSequence());
		}
	}

	private IsoformAligner createAligner() {
		if(alignerOverride != null) {
			return alignerOverride;
		}
		final String command = config.getAlignerCommand();
		if(command != null) {
			return new ExternalCommandAligner(command, config.getWorkDir(), config.getAlignerTimeoutSeconds());
		}
		return new IsoformAligner() {
			@Override
			public GeneAlignment align(String gene, List<TranscriptEntry> isoforms) throws ExternalToolException {
				throw new ExternalToolException("aligner", gene + " has " + isoforms.size() + " isoforms but no aligner_command is configured");
			}
		};
	}

	private TranscriptomeSearcher createSearcher(Transcriptome transcriptome) {
		if(DesignConfiguration.SEARCH_EXTERNAL.equals(config.getSearchMode())) {
			return new ExternalCommandSearcher(config.getSearchCommand(), config.getTranscriptomeFasta().getAbsolutePath(), config.getWorkDir(), config.getSearchTimeoutSeconds());
		}
		return new HammingScanSearcher(transcriptome, config.getSearchReverseComplement());
	}

	/**
	 * @param args -c config file, -o output prefix override, -l log level
	 * @throws IOException
	 * @throws DesignException
	 * @throws InterruptedException
	 */
	public static void main(String[] args) throws IOException, DesignException, InterruptedException {

		CommandLineParser p = new CommandLineParser();
		p.setProgramDescription("Design gene-specific padlock probes from a gene list, a reference transcriptome and a barcode library.");
		p.addStringArg("-c", "Config file", true);
		p.addStringArg("-o", "Output file prefix; overrides output_prefix in the config file", false);
		p.addStringArg("-l", "Logger level", false);
		p.parse(args);

		Level level = Level.toLevel(p.getStringArg("-l"), Level.INFO);
		Logger.getRootLogger().setLevel(level);

		DesignConfiguration config = DesignConfiguration.load(p.getStringArg("-c"));
		if(p.getStringArg("-o") != null) {
			config.setOutputPrefix(p.getStringArg("-o"));
		}

		DesignOutcome outcome = new PadlockProbeDesigner(config).run();

		logger.info("");
		logger.info("Designed " + outcome.getProbes().size() + " probes. All done.");

	}

}
