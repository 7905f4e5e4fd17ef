package com.github.micycle1.sectorsearch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts drones flying too close to one another in a square airspace.
 * <p>
 * Rather than comparing every pair of drones, the airspace is broken into
 * overlapping sectors (see {@link SectorGrid}); only drones sharing a sector are
 * compared. For roughly uniform traffic over {@code F} sectors this reduces the
 * work from {@code N²} to about {@code N²/F}, at the cost of assigning every
 * drone to four sectors. A pathological input with every drone in one sector
 * still costs {@code N²}.
 * <p>
 * Two drones are <i>in conflict</i> when their Euclidean distance is strictly
 * less than the conflict radius. Every call is computed from scratch; nothing is
 * cached between calls.
 *
 * @author Michael Carleton
 */
public final class SectorSearch {

	private static final Logger log = LoggerFactory.getLogger(SectorSearch.class);

	private SectorSearch() {
	}

	/**
	 * Counts the drones in a conflicted state (not the number of conflicting
	 * pairs), using {@link SearchOptions#defaults() default options}.
	 *
	 * @param positions      {@code [x, y]} position of each drone; the row index is
	 *                       the drone's identifier
	 * @param conflictRadius separation below which two drones conflict
	 * @param airspaceSize   side length of the airspace; all positions must lie
	 *                       within {@code [0, airspaceSize]}
	 * @return number of distinct drones in conflict
	 */
	public static int countConflicts(double[][] positions, double conflictRadius, double airspaceSize) {
		return countConflicts(positions, conflictRadius, airspaceSize, SearchOptions.defaults());
	}

	public static int countConflicts(double[][] positions, double conflictRadius, double airspaceSize,
			SearchOptions options) {
		return findConflicts(positions, conflictRadius, airspaceSize, options).size();
	}

	public static int countConflicts(List<Coordinate> positions, double conflictRadius, double airspaceSize) {
		return countConflicts(positions, conflictRadius, airspaceSize, SearchOptions.defaults());
	}

	public static int countConflicts(List<Coordinate> positions, double conflictRadius, double airspaceSize,
			SearchOptions options) {
		return findConflicts(positions, conflictRadius, airspaceSize, options).size();
	}

	/**
	 * Finds the identifiers of every drone in a conflicted state.
	 *
	 * @return ascending identifiers (row indices into {@code positions}) of drones
	 *         in conflict
	 * @throws IllegalArgumentException if the radius or airspace size is not
	 *                                  positive, a row is not exactly two finite
	 *                                  numbers, a position lies outside the
	 *                                  airspace, or the limit exceeds the number
	 *                                  of drones
	 */
	public static SortedSet<Integer> findConflicts(double[][] positions, double conflictRadius, double airspaceSize,
			SearchOptions options) {
		validateParameters(conflictRadius, airspaceSize, options);
		if (positions == null) {
			throw new IllegalArgumentException("positions must not be null");
		}
		List<Drone> drones = new ArrayList<>(positions.length);
		for (int i = 0; i < positions.length; i++) {
			double[] p = positions[i];
			if (p == null || p.length != 2) {
				throw new IllegalArgumentException("Drone " + i + " must have exactly two coordinates");
			}
			drones.add(toDrone(i, p[0], p[1], airspaceSize));
		}
		return search(drones, conflictRadius, airspaceSize, options);
	}

	public static SortedSet<Integer> findConflicts(List<Coordinate> positions, double conflictRadius,
			double airspaceSize, SearchOptions options) {
		validateParameters(conflictRadius, airspaceSize, options);
		if (positions == null) {
			throw new IllegalArgumentException("positions must not be null");
		}
		List<Drone> drones = new ArrayList<>(positions.size());
		for (int i = 0; i < positions.size(); i++) {
			Coordinate c = positions.get(i);
			if (c == null) {
				throw new IllegalArgumentException("Drone " + i + " has no coordinate");
			}
			drones.add(toDrone(i, c.x, c.y, airspaceSize));
		}
		return search(drones, conflictRadius, airspaceSize, options);
	}

	/**
	 * Runs the sector pipeline over already-validated drones: build the grid,
	 * assign drones to sectors, scan each sector and merge the results.
	 */
	static SortedSet<Integer> search(List<Drone> drones, double conflictRadius, double airspaceSize,
			SearchOptions options) {
		int limit = options.hasLimit() ? options.getLimit() : drones.size();
		if (limit > drones.size()) {
			throw new IllegalArgumentException(
					"Limit " + limit + " should not exceed the number of drones available (" + drones.size() + ")");
		}
		List<Drone> subject = drones.subList(0, limit);

		long startPre = System.nanoTime();
		SectorGrid grid = new SectorGrid(airspaceSize, conflictRadius, options.getPadMult());
		grid.assignAll(subject);
		if (options.isDebug()) {
			log.info("Preprocessing {} drones into {} occupied sectors took {} ms", subject.size(),
					grid.getOccupiedSectorCount(), millisSince(startPre));
		}

		long startScan = System.nanoTime();
		List<List<Integer>> perSector = options.isParallel() ? scanParallel(grid, conflictRadius)
				: scanSequential(grid, conflictRadius);
		SortedSet<Integer> conflicts = aggregate(perSector);
		if (options.isDebug()) {
			log.info("Sector conflict processing of {} drones took {} ms. Drones in conflict: {}", subject.size(),
					millisSince(startScan), conflicts.size());
		}

		if (options.isDebug() && options.hasLimit()) {
			long startBatch = System.nanoTime();
			SortedSet<Integer> batch = bruteForceConflicts(subject, conflictRadius);
			log.info("Brute-force processing of all {} drones at once took {} ms. Drones in conflict: {}", subject.size(),
					millisSince(startBatch), batch.size());
		}
		log.debug("{} of {} drones in conflict (radius={}, airspace={}, {})", conflicts.size(), subject.size(),
				conflictRadius, airspaceSize, options);
		return conflicts;
	}

	/**
	 * Brute-force scan of a single sector's drones: every unordered pair closer
	 * than {@code conflictRadius} contributes both identifiers.
	 *
	 * @return identifiers of conflicting drones, once per conflicting pair they
	 *         take part in
	 */
	public static List<Integer> scanSector(List<Drone> drones, double conflictRadius) {
		if (drones.size() < 2) {
			return Collections.emptyList();
		}
		List<Integer> conflicts = new ArrayList<>();
		// only examine each combination once
		for (int a = 0; a < drones.size(); a++) {
			Drone droneA = drones.get(a);
			for (int b = a + 1; b < drones.size(); b++) {
				Drone droneB = drones.get(b);
				double distance = droneA.distance(droneB);
				if (distance < conflictRadius) {
					if (log.isTraceEnabled()) {
						log.trace("Conflict! Drone {} and drone {} are {} apart", droneA.getId(), droneB.getId(),
								distance);
					}
					conflicts.add(droneA.getId());
					conflicts.add(droneB.getId());
				}
			}
		}
		return conflicts;
	}

	/**
	 * Merges per-sector conflict lists into the set of distinct identifiers. The
	 * same drone is typically flagged several times: by more than one partner, and
	 * by the same pair in more than one shared sector.
	 */
	public static SortedSet<Integer> aggregate(Collection<? extends Collection<Integer>> perSector) {
		SortedSet<Integer> distinct = new TreeSet<>();
		for (Collection<Integer> ids : perSector) {
			distinct.addAll(ids);
		}
		return distinct;
	}

	/**
	 * Reference {@code O(N²)} search comparing every pair of drones, without any
	 * sectoring.
	 *
	 * @return identifiers of drones in conflict
	 */
	public static SortedSet<Integer> bruteForceConflicts(List<Drone> drones, double conflictRadius) {
		return aggregate(Collections.singletonList(scanSector(drones, conflictRadius)));
	}

	private static List<List<Integer>> scanSequential(SectorGrid grid, double conflictRadius) {
		List<List<Integer>> out = new ArrayList<>();
		for (List<Drone> bucket : grid.getOccupiedSectors()) {
			out.add(scanSector(bucket, conflictRadius));
		}
		return out;
	}

	/**
	 * One scan task per sector holding at least two drones. Sectors are read-only
	 * once assignment finishes, so tasks share no mutable state.
	 */
	private static List<List<Integer>> scanParallel(SectorGrid grid, double conflictRadius) {
		List<CompletableFuture<List<Integer>>> futures = new ArrayList<>();
		for (List<Drone> bucket : grid.getOccupiedSectors()) {
			if (bucket.size() > 1) {
				futures.add(CompletableFuture.supplyAsync(() -> scanSector(bucket, conflictRadius),
						ForkJoinPool.commonPool()));
			}
		}
		try {
			CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while scanning sectors", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException("Sector scan failed", cause);
		}

		List<List<Integer>> out = new ArrayList<>(futures.size());
		for (CompletableFuture<List<Integer>> future : futures) {
			out.add(future.join());
		}
		return out;
	}

	private static void validateParameters(double conflictRadius, double airspaceSize, SearchOptions options) {
		SectorGrid.requirePositive(conflictRadius, "conflictRadius");
		SectorGrid.requirePositive(airspaceSize, "airspaceSize");
		if (options == null) {
			throw new IllegalArgumentException("options must not be null");
		}
	}

	private static Drone toDrone(int id, double x, double y, double airspaceSize) {
		if (!Double.isFinite(x) || !Double.isFinite(y)) {
			throw new IllegalArgumentException("Drone " + id + " has a non-finite coordinate (" + x + ", " + y + ")");
		}
		if (x < 0 || x > airspaceSize || y < 0 || y > airspaceSize) {
			throw new IllegalArgumentException(
					"Drone " + id + " at (" + x + ", " + y + ") lies outside the airspace [0, " + airspaceSize + "]");
		}
		return new Drone(id, x, y);
	}

	private static double millisSince(long startNanos) {
		return (System.nanoTime() - startNanos) / 1_000_000.0;
	}
}
