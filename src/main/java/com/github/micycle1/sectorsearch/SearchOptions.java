package com.github.micycle1.sectorsearch;

/**
 * Immutable tuning options for a {@link SectorSearch} run.
 * <p>
 * Instances are derived from {@link #defaults()} with the {@code with*} methods,
 * each of which returns a new instance:
 *
 * <pre>
 * SearchOptions opts = SearchOptions.defaults().withPadMult(4).withParallel(true);
 * </pre>
 *
 * @author Michael Carleton
 */
public final class SearchOptions {

	public static final int DEFAULT_PAD_MULT = 10;
	/** Sentinel limit meaning "process every drone". */
	public static final int NO_LIMIT = -1;

	private static final SearchOptions DEFAULTS = new SearchOptions(DEFAULT_PAD_MULT, NO_LIMIT, false, false);

	private final int padMult;
	private final int limit;
	private final boolean debug;
	private final boolean parallel;

	private SearchOptions(int padMult, int limit, boolean debug, boolean parallel) {
		// sector width is conflictRadius * padMult and must exceed the radius
		if (padMult < 2) {
			throw new IllegalArgumentException("Unexpected padMult value: " + padMult + " (must be >= 2)");
		}
		if (limit < NO_LIMIT) {
			throw new IllegalArgumentException("Unexpected limit value: " + limit);
		}
		this.padMult = padMult;
		this.limit = limit;
		this.debug = debug;
		this.parallel = parallel;
	}

	public static SearchOptions defaults() {
		return DEFAULTS;
	}

	/**
	 * @param padMult how many conflict radii wide each sector is
	 */
	public SearchOptions withPadMult(int padMult) {
		return new SearchOptions(padMult, limit, debug, parallel);
	}

	/**
	 * @param limit number of leading drones to process, or {@link #NO_LIMIT}. The
	 *              upper bound is checked against the input when the search runs.
	 */
	public SearchOptions withLimit(int limit) {
		return new SearchOptions(padMult, limit, debug, parallel);
	}

	/**
	 * @param debug log timings and counts of each pipeline stage; when a limit is
	 *              also set, a brute-force comparison over the same prefix is
	 *              logged too
	 */
	public SearchOptions withDebug(boolean debug) {
		return new SearchOptions(padMult, limit, debug, parallel);
	}

	/**
	 * @param parallel scan sectors concurrently on the common fork-join pool
	 */
	public SearchOptions withParallel(boolean parallel) {
		return new SearchOptions(padMult, limit, debug, parallel);
	}

	public int getPadMult() {
		return padMult;
	}

	public int getLimit() {
		return limit;
	}

	public boolean hasLimit() {
		return limit != NO_LIMIT;
	}

	public boolean isDebug() {
		return debug;
	}

	public boolean isParallel() {
		return parallel;
	}

	@Override
	public String toString() {
		return String.format("SearchOptions[padMult=%d, limit=%d, debug=%s, parallel=%s]", padMult, limit, debug, parallel);
	}
}
