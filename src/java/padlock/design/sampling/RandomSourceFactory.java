package padlock.design.sampling;

import java.nio.charset.StandardCharsets;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import padlock.design.RoundTag;

/**
 * Creates one random generator per (gene, round). With a seed, the generator depends only on
 * the seed, the gene and the round label, so draws do not depend on processing order.
 */
public final class RandomSourceFactory {

	private final Long seed;

	private RandomSourceFactory(Long seed) {
		this.seed = seed;
	}

	/**
	 * @param seed Base seed
	 * @return Factory giving reproducible generators
	 */
	public static RandomSourceFactory seeded(long seed) {
		return new RandomSourceFactory(Long.valueOf(seed));
	}

	/**
	 * @return Factory giving self-seeded generators
	 */
	public static RandomSourceFactory unseeded() {
		return new RandomSourceFactory(null);
	}

	public boolean isSeeded() {
		return seed != null;
	}

	/**
	 * @param gene Gene
	 * @param round Round
	 * @return A new generator
	 */
	public RandomGenerator forGene(String gene, RoundTag round) {
		if(seed == null) {
			return new Well19937c();
		}
		long s = seed.longValue();
		return new Well19937c(new int[] {(int) (s >>> 32), (int) s, stableHash(gene), stableHash(round.getLabel())});
	}

	// FNV-1a over UTF-8 bytes
	private static int stableHash(String s) {
		int h = 0x811c9dc5;
		for(byte b : s.getBytes(StandardCharsets.UTF_8)) {
			h ^= b & 0xff;
			h *= 0x01000193;
		}
		return h;
	}

}
