package padlock.design.candidate.predicate;

import org.apache.log4j.Logger;

import padlock.core.pipeline.ConfigFileOptionValue;

/**
 * Builds k-mer predicates from config file lines
 */
public final class KmerPredicates {

	private static Logger logger = Logger.getLogger(KmerPredicates.class.getName());

	private KmerPredicates() {}

	/**
	 * @return One unconfigured instance of every available predicate
	 */
	public static KmerPredicate[] prototypes() {
		// Add additional predicate classes to this array
		return new KmerPredicate[] {new GCContentPredicate(), new PolyBasePredicate(), new TerminalBasePredicate(), new JunctionBasePredicate()};
	}

	/**
	 * @param value A kmer_filter config line
	 * @return The configured predicate
	 * @throws IllegalArgumentException If no predicate accepts the line
	 */
	public static KmerPredicate fromConfigFileValue(ConfigFileOptionValue value) {
		for(KmerPredicate predicate : prototypes()) {
			if(predicate.validConfigFileValue(value)) {
				predicate.setParametersFromConfigFile(value);
				logger.info("Got k-mer filter " + predicate.toString());
				return predicate;
			}
		}
		StringBuilder formats = new StringBuilder();
		for(KmerPredicate predicate : prototypes()) {
			formats.append("\n").append(predicate.configFileLineDescription());
		}
		throw new IllegalArgumentException("K-mer filter not recognized: " + value.getFullOptionLine() + ". Valid formats:" + formats);
	}

}
