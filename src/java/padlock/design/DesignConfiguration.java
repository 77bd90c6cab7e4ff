package padlock.design;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.log4j.Logger;

import padlock.core.pipeline.ConfigFile;
import padlock.core.pipeline.ConfigFileException;
import padlock.core.pipeline.ConfigFileOption;
import padlock.core.pipeline.ConfigFileOptionValue;
import padlock.core.pipeline.ConfigFileSection;
import padlock.design.barcode.AssignmentMode;
import padlock.design.candidate.predicate.GCContentPredicate;
import padlock.design.candidate.predicate.KmerPredicate;
import padlock.design.candidate.predicate.KmerPredicates;
import padlock.design.specificity.HitAttribution;

/**
 * Typed view of a design config file. Sections:
 * <pre>
 * :Input         gene_list, transcriptome_fasta, barcode_library, output_dir, output_prefix
 * :Alignment     aligner_command, aligner_timeout_seconds
 * :Candidates    kmer_length, gc_min, gc_max, kmer_filter (repeatable)
 * :Specificity   mismatches, search_mode, search_command, hit_attribution, threads,
 *                search_timeout_seconds, search_retries, search_reverse_complement, work_dir
 * :Rounds        sample_sizes, target_specific, seed, prior_round_table (repeatable)
 * :Barcodes      assignment_mode, assignment_param, arm_length, cap_per_gene
 * </pre>
 */
public final class DesignConfiguration {

	private static Logger logger = Logger.getLogger(DesignConfiguration.class.getName());

	/**
	 * Search modes
	 */
	public static final String SEARCH_IN_PROCESS = "in_process";
	public static final String SEARCH_EXTERNAL = "external";

	// Upper bound on fields for options holding a command line or a list
	private static final int MAX_FIELDS = 64;

	private static final ConfigFileOption geneListOption = new ConfigFileOption("gene_list", 2, false, false, true);
	private static final ConfigFileOption transcriptomeOption = new ConfigFileOption("transcriptome_fasta", 2, false, false, true);
	private static final ConfigFileOption barcodeLibraryOption = new ConfigFileOption("barcode_library", 2, false, false, true);
	private static final ConfigFileOption outputDirOption = new ConfigFileOption("output_dir", 2, false, false, false, ".");
	private static final ConfigFileOption outputPrefixOption = new ConfigFileOption("output_prefix", 2, false, false, false, "padlock");

	private static final ConfigFileOption alignerCommandOption = new ConfigFileOption("aligner_command", MAX_FIELDS, true, false, false).withDescription("Command with {input} and {output} placeholders, run for genes with several isoforms");
	private static final ConfigFileOption alignerTimeoutOption = new ConfigFileOption("aligner_timeout_seconds", 2, false, false, false, "600");

	private static final ConfigFileOption kmerLengthOption = new ConfigFileOption("kmer_length", 2, false, false, true);
	private static final ConfigFileOption gcMinOption = new ConfigFileOption("gc_min", 2, false, false, true);
	private static final ConfigFileOption gcMaxOption = new ConfigFileOption("gc_max", 2, false, false, true);
	private static final ConfigFileOption kmerFilterOption = new ConfigFileOption(KmerPredicate.OPTION_FLAG, 5, true, true, false).withDescription("<filter name> <parameters>, e.g. poly_base 4 ACGT");

	private static final ConfigFileOption mismatchesOption = new ConfigFileOption("mismatches", 2, false, false, true).withDescription("Maximum substitutions for a transcriptome hit");
	private static final ConfigFileOption searchModeOption = new ConfigFileOption("search_mode", 2, false, false, false, SEARCH_IN_PROCESS).withDescription("in_process or external");
	private static final ConfigFileOption searchCommandOption = new ConfigFileOption("search_command", MAX_FIELDS, true, false, false).withDescription("Command with {query}, {mismatches} and {corpus} placeholders printing matched FASTA headers");
	private static final ConfigFileOption hitAttributionOption = new ConfigFileOption("hit_attribution", 2, false, false, false, "gene").withDescription("gene: isoforms of one gene count once; entry: every entry counts");
	private static final ConfigFileOption threadsOption = new ConfigFileOption("threads", 2, false, false, false, "1");
	private static final ConfigFileOption searchTimeoutOption = new ConfigFileOption("search_timeout_seconds", 2, false, false, false, "600");
	private static final ConfigFileOption searchRetriesOption = new ConfigFileOption("search_retries", 2, false, false, false, "2");
	private static final ConfigFileOption searchReverseComplementOption = new ConfigFileOption("search_reverse_complement", 2, false, false, false, "false");
	private static final ConfigFileOption workDirOption = new ConfigFileOption("work_dir", 2, false, false, false).withDescription("Directory for temporary files; defaults to output_dir");

	private static final ConfigFileOption sampleSizesOption = new ConfigFileOption("sample_sizes", MAX_FIELDS, true, false, true).withDescription("K-mers sampled per gene in each round");
	private static final ConfigFileOption targetSpecificOption = new ConfigFileOption("target_specific", 2, false, false, true).withDescription("Specific k-mers needed per gene");
	private static final ConfigFileOption seedOption = new ConfigFileOption("seed", 2, false, false, false);
	private static final ConfigFileOption priorRoundTableOption = new ConfigFileOption("prior_round_table", 2, false, true, false).withDescription("Mapped table from an earlier run to merge in");

	private static final ConfigFileOption assignmentModeOption = new ConfigFileOption("assignment_mode", 2, false, false, true).withDescription("start, end or custom");
	private static final ConfigFileOption assignmentParamOption = new ConfigFileOption("assignment_param", 2, false, false, true).withDescription("First Lbar_ID for start and end; Gene,Lbar_ID table for custom");
	private static final ConfigFileOption armLengthOption = new ConfigFileOption("arm_length", 2, false, false, false).withDescription("3' arm length; defaults to half the k-mer length");
	private static final ConfigFileOption capPerGeneOption = new ConfigFileOption("cap_per_gene", 2, false, false, false, "false").withDescription("Keep at most target_specific probes per gene");

	private final ConfigFileSection inputSection = new ConfigFileSection("Input", true);
	private final ConfigFileSection alignmentSection = new ConfigFileSection("Alignment", false);
	private final ConfigFileSection candidatesSection = new ConfigFileSection("Candidates", true);
	private final ConfigFileSection specificitySection = new ConfigFileSection("Specificity", true);
	private final ConfigFileSection roundsSection = new ConfigFileSection("Rounds", true);
	private final ConfigFileSection barcodesSection = new ConfigFileSection("Barcodes", true);

	private final ConfigFile configFile;
	private final String source;
	private String outputPrefixOverride;

	private DesignConfiguration(Reader reader, String sourceName) throws IOException {
		source = sourceName;
		inputSection.addAllowableOption(geneListOption);
		inputSection.addAllowableOption(transcriptomeOption);
		inputSection.addAllowableOption(barcodeLibraryOption);
		inputSection.addAllowableOption(outputDirOption);
		inputSection.addAllowableOption(outputPrefixOption);
		alignmentSection.addAllowableOption(alignerCommandOption);
		alignmentSection.addAllowableOption(alignerTimeoutOption);
		candidatesSection.addAllowableOption(kmerLengthOption);
		candidatesSection.addAllowableOption(gcMinOption);
		candidatesSection.addAllowableOption(gcMaxOption);
		candidatesSection.addAllowableOption(kmerFilterOption);
		specificitySection.addAllowableOption(mismatchesOption);
		specificitySection.addAllowableOption(searchModeOption);
		specificitySection.addAllowableOption(searchCommandOption);
		specificitySection.addAllowableOption(hitAttributionOption);
		specificitySection.addAllowableOption(threadsOption);
		specificitySection.addAllowableOption(searchTimeoutOption);
		specificitySection.addAllowableOption(searchRetriesOption);
		specificitySection.addAllowableOption(searchReverseComplementOption);
		specificitySection.addAllowableOption(workDirOption);
		roundsSection.addAllowableOption(sampleSizesOption);
		roundsSection.addAllowableOption(targetSpecificOption);
		roundsSection.addAllowableOption(seedOption);
		roundsSection.addAllowableOption(priorRoundTableOption);
		barcodesSection.addAllowableOption(assignmentModeOption);
		barcodesSection.addAllowableOption(assignmentParamOption);
		barcodesSection.addAllowableOption(armLengthOption);
		barcodesSection.addAllowableOption(capPerGeneOption);
		Collection<ConfigFileSection> sections = new ArrayList<ConfigFileSection>();
		sections.add(inputSection);
		sections.add(alignmentSection);
		sections.add(candidatesSection);
		sections.add(specificitySection);
		sections.add(roundsSection);
		sections.add(barcodesSection);
		configFile = new ConfigFile(sections, reader, sourceName);
		validate();
	}

	/**
	 * @param fileName Config file
	 * @return The configuration
	 * @throws IOException
	 * @throws ConfigFileException If the file is invalid
	 */
	public static DesignConfiguration load(String fileName) throws IOException {
		logger.info("Getting config file from " + fileName);
		return new DesignConfiguration(new FileReader(new File(fileName)), fileName);
	}

	/**
	 * @param reader Config contents; closed after reading
	 * @param sourceName Name for messages
	 * @return The configuration
	 * @throws IOException
	 * @throws ConfigFileException If the contents are invalid
	 */
	public static DesignConfiguration load(Reader reader, String sourceName) throws IOException {
		return new DesignConfiguration(reader, sourceName);
	}

	private void validate() {
		try {
			checkValues();
		} catch(IllegalArgumentException e) {
			// covers malformed numbers and unknown names
			throw invalid(e.getMessage());
		}
	}

	private void checkValues() {
		if(getKmerLength() < 2) {
			throw new IllegalArgumentException("kmer_length must be at least 2");
		}
		if(getMismatches() < 0 || getMismatches() >= getKmerLength()) {
			throw new IllegalArgumentException("mismatches must be between 0 and kmer_length - 1");
		}
		getGCContentPredicate();
		getKmerPredicates();
		getHitAttribution();
		for(int n : getSampleSizes()) {
			if(n < 1) throw new IllegalArgumentException("sample_sizes must be positive");
		}
		if(getTargetSpecific() < 1) {
			throw new IllegalArgumentException("target_specific must be positive");
		}
		if(getThreads() < 1 || getSearchTimeoutSeconds() < 1 || getSearchRetries() < 0 || getAlignerTimeoutSeconds() < 1) {
			throw new IllegalArgumentException("threads and timeouts must be positive and search_retries non-negative");
		}
		String mode = getSearchMode();
		if(!SEARCH_IN_PROCESS.equals(mode) && !SEARCH_EXTERNAL.equals(mode)) {
			throw new IllegalArgumentException("search_mode must be " + SEARCH_IN_PROCESS + " or " + SEARCH_EXTERNAL);
		}
		if(SEARCH_EXTERNAL.equals(mode) && getSearchCommand() == null) {
			throw new IllegalArgumentException("search_mode " + SEARCH_EXTERNAL + " requires search_command");
		}
		if(getAssignmentMode() != AssignmentMode.CUSTOM) {
			getFirstBarcodeId();
		}
		Integer arm = getArmLength();
		if(arm != null && (arm.intValue() < 1 || arm.intValue() >= getKmerLength())) {
			throw new IllegalArgumentException("arm_length must be between 1 and kmer_length - 1");
		}
		getSeed();
		getCapPerGene();
		getSearchReverseComplement();
	}

	private ConfigFileException invalid(String message) {
		return new ConfigFileException("Invalid config file " + source + ": " + message + "\n" + configFile.getHelpMenu());
	}

	public String getSource() {
		return source;
	}

	public File getGeneList() {
		return new File(configFile.getSingleValueString(inputSection, geneListOption));
	}

	public File getTranscriptomeFasta() {
		return new File(configFile.getSingleValueString(inputSection, transcriptomeOption));
	}

	public File getBarcodeLibrary() {
		return new File(configFile.getSingleValueString(inputSection, barcodeLibraryOption));
	}

	public File getOutputDir() {
		return new File(configFile.getSingleValueString(inputSection, outputDirOption));
	}

	public String getOutputPrefix() {
		return outputPrefixOverride != null ? outputPrefixOverride : configFile.getSingleValueString(inputSection, outputPrefixOption);
	}

	/**
	 * @param prefix Output prefix replacing the config value, e.g. from the command line
	 */
	public void setOutputPrefix(String prefix) {
		outputPrefixOverride = prefix;
	}

	/**
	 * @return Aligner command template, or null if not configured
	 */
	public String getAlignerCommand() {
		ConfigFileOptionValue v = configFile.getSingleValue(alignmentSection, alignerCommandOption);
		return v == null ? null : v.getLineMinusFlag();
	}

	public int getAlignerTimeoutSeconds() {
		return configFile.getSingleValueInt(alignmentSection, alignerTimeoutOption);
	}

	public int getKmerLength() {
		return configFile.getSingleValueInt(candidatesSection, kmerLengthOption);
	}

	public GCContentPredicate getGCContentPredicate() {
		return new GCContentPredicate(configFile.getSingleValueDouble(candidatesSection, gcMinOption), configFile.getSingleValueDouble(candidatesSection, gcMaxOption));
	}

	/**
	 * @return Predicates from kmer_filter lines in file order
	 */
	public List<KmerPredicate> getKmerPredicates() {
		List<KmerPredicate> rtrn = new ArrayList<KmerPredicate>();
		for(ConfigFileOptionValue value : configFile.getOptionValues(candidatesSection, kmerFilterOption)) {
			rtrn.add(KmerPredicates.fromConfigFileValue(value));
		}
		return rtrn;
	}

	public int getMismatches() {
		return configFile.getSingleValueInt(specificitySection, mismatchesOption);
	}

	public String getSearchMode() {
		return configFile.getSingleValueString(specificitySection, searchModeOption);
	}

	/**
	 * @return Search command template, or null if not configured
	 */
	public String getSearchCommand() {
		ConfigFileOptionValue v = configFile.getSingleValue(specificitySection, searchCommandOption);
		return v == null ? null : v.getLineMinusFlag();
	}

	public HitAttribution getHitAttribution() {
		return HitAttribution.fromName(configFile.getSingleValueString(specificitySection, hitAttributionOption));
	}

	public int getThreads() {
		return configFile.getSingleValueInt(specificitySection, threadsOption);
	}

	public int getSearchTimeoutSeconds() {
		return configFile.getSingleValueInt(specificitySection, searchTimeoutOption);
	}

	public int getSearchRetries() {
		return configFile.getSingleValueInt(specificitySection, searchRetriesOption);
	}

	public boolean getSearchReverseComplement() {
		return configFile.getSingleValueBoolean(specificitySection, searchReverseComplementOption);
	}

	/**
	 * @return Directory for temporary files of external tools; the output directory unless configured
	 */
	public File getWorkDir() {
		String dir = configFile.getSingleValueString(specificitySection, workDirOption);
		return dir == null ? getOutputDir() : new File(dir);
	}

	/**
	 * @return Sample size per round
	 */
	public List<Integer> getSampleSizes() {
		ConfigFileOptionValue v = configFile.getSingleValue(roundsSection, sampleSizesOption);
		List<Integer> rtrn = new ArrayList<Integer>();
		for(int i = 1; i < v.getActualNumValues(); i++) {
			rtrn.add(Integer.valueOf(v.asInt(i)));
		}
		return rtrn;
	}

	public int getTargetSpecific() {
		return configFile.getSingleValueInt(roundsSection, targetSpecificOption);
	}

	/**
	 * @return Seed, or null if sampling should not be reproducible
	 */
	public Long getSeed() {
		String s = configFile.getSingleValueString(roundsSection, seedOption);
		return s == null ? null : Long.valueOf(s);
	}

	public List<File> getPriorRoundTables() {
		List<File> rtrn = new ArrayList<File>();
		for(ConfigFileOptionValue v : configFile.getOptionValues(roundsSection, priorRoundTableOption)) {
			rtrn.add(new File(v.asString(1)));
		}
		return rtrn;
	}

	public AssignmentMode getAssignmentMode() {
		return AssignmentMode.fromName(configFile.getSingleValueString(barcodesSection, assignmentModeOption));
	}

	/**
	 * @return First barcode id for start and end modes
	 */
	public int getFirstBarcodeId() {
		return configFile.getSingleValueInt(barcodesSection, assignmentParamOption);
	}

	/**
	 * @return Custom barcode table for custom mode
	 */
	public File getCustomBarcodeTable() {
		return new File(configFile.getSingleValueString(barcodesSection, assignmentParamOption));
	}

	/**
	 * @return Arm length, or null for half the k-mer length
	 */
	public Integer getArmLength() {
		ConfigFileOptionValue v = configFile.getSingleValue(barcodesSection, armLengthOption);
		return v == null ? null : Integer.valueOf(v.asInt(1));
	}

	/**
	 * @return Whether to keep at most target_specific probes per gene
	 */
	public boolean getCapPerGene() {
		return configFile.getSingleValueBoolean(barcodesSection, capPerGeneOption);
	}

}
