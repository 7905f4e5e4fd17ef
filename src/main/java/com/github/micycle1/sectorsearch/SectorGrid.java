package com.github.micycle1.sectorsearch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.geom.Envelope;

/**
 * Overlapping grid of square sectors covering a square airspace
 * {@code [0, airspaceSize]²}.
 * <p>
 * Sector edges along each axis are placed every {@code conflictRadius * padMult}
 * units, with the airspace size always appended as the final edge. A coordinate
 * lying between edges {@code hi-1} and {@code hi} belongs to both sector
 * {@code hi-1} and sector {@code hi} along that axis, so each sector spans two
 * cell widths and overlaps its neighbours by a full cell width:
 *
 * <pre>
 * boundaries  [0    10      20    30      40...]
 *              |--sector 1--|
 *                    |--sector 2--|
 *                            |--sector 3--| ...
 * </pre>
 *
 * Combining the x and y memberships places every drone in four 2D sectors. Two
 * drones closer than a cell width therefore always share at least one sector.
 * <p>
 * Sector buckets are allocated lazily; looking up a sector that was never
 * populated (including the fictitious sector one past the last edge) yields an
 * empty list.
 *
 * @author Michael Carleton
 */
public class SectorGrid {

	/** Cells per axis are kept below this so that every edge index is exact as a double. */
	static final double MAX_CELLS_PER_AXIS = 0x1p52;

	private final double airspaceSize;
	private final double sectorWidth;
	/** Index of the final boundary, which always equals the airspace size. */
	private final long lastIndex;
	private final Map<SectorKey, List<Drone>> sectors;

	/**
	 * Builds the sector boundaries for an airspace. Boundaries are computed on
	 * demand from the sector width, so arbitrarily fine grids cost no memory
	 * beyond the buckets that drones actually occupy.
	 *
	 * @param airspaceSize   length of one side of the square airspace
	 * @param conflictRadius distance defining a conflict, in the same units
	 * @param padMult        how many conflict radii wide each cell is; at least 2
	 *                       so that the cell width strictly exceeds the radius
	 */
	public SectorGrid(double airspaceSize, double conflictRadius, int padMult) {
		requirePositive(airspaceSize, "airspaceSize");
		requirePositive(conflictRadius, "conflictRadius");
		if (padMult < 2) {
			throw new IllegalArgumentException("Unexpected padMult value: " + padMult + " (must be >= 2)");
		}
		this.airspaceSize = airspaceSize;
		// widening a cell never splits a conflict, so extreme ratios just get coarser cells
		this.sectorWidth = Math.max(conflictRadius * padMult, airspaceSize / MAX_CELLS_PER_AXIS);
		this.lastIndex = countEdgesBelow(airspaceSize, sectorWidth);
		this.sectors = new LinkedHashMap<>();
	}

	/**
	 * Number of edges {@code k * step} (k >= 0) strictly below {@code airspaceSize}.
	 */
	private static long countEdgesBelow(double airspaceSize, double step) {
		long m = Math.max(1, (long) Math.ceil(airspaceSize / step));
		// correct for rounding in the division
		while (m > 1 && (m - 1) * step >= airspaceSize) {
			m--;
		}
		while (m * step < airspaceSize) {
			m++;
		}
		return m;
	}

	/**
	 * Edge {@code k} along either axis: {@code k * sectorWidth}, except the final
	 * edge, which is the airspace size so no stragglers on the far edge are lost.
	 */
	public double getBoundary(long k) {
		if (k < 0 || k > lastIndex) {
			throw new IndexOutOfBoundsException("Boundary " + k + " outside [0, " + lastIndex + "]");
		}
		if (k == 0) {
			return 0;
		}
		return k < lastIndex ? k * sectorWidth : airspaceSize; // multiply rather than accumulate to avoid drift
	}

	public long getBoundaryCount() {
		return lastIndex + 1;
	}

	/**
	 * Determines which two sector indices (along one axis) a coordinate falls in,
	 * given an explicit boundary sequence.
	 * <p>
	 * {@code hi} is the index of the first boundary strictly greater than
	 * {@code position}, and {@code lo = hi - 1}. A coordinate exactly on a
	 * boundary therefore belongs to the cell above it. When no boundary exceeds the
	 * position (the far edge of the airspace) {@code hi} is clamped to the last
	 * boundary index.
	 *
	 * @param boundaries ascending sector edges, as produced by {@link #getBoundaries()}
	 * @param position   coordinate along the same axis
	 * @return {@code {lo, hi}}
	 */
	public static int[] mapCoordinate(double[] boundaries, double position) {
		// binary search for the first boundary > position
		int low = 0;
		int high = boundaries.length;
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (boundaries[mid] > position) {
				high = mid;
			} else {
				low = mid + 1;
			}
		}
		int hi = low == boundaries.length ? boundaries.length - 1 : low;
		return new int[] { hi - 1, hi };
	}

	/**
	 * Same rule as {@link #mapCoordinate(double[], double)}, computed directly from
	 * the sector width instead of searching a boundary array.
	 *
	 * @return {@code {lo, hi}}
	 */
	public long[] mapCoordinate(double position) {
		long hi = Math.min((long) Math.floor(position / sectorWidth) + 1, lastIndex);
		// the division may round across an edge; settle on the first boundary > position
		while (hi > 1 && getBoundary(hi - 1) > position) {
			hi--;
		}
		while (hi < lastIndex && getBoundary(hi) <= position) {
			hi++;
		}
		return new long[] { hi - 1, hi };
	}

	/**
	 * Places a drone into each of the four sectors formed by crossing its x and y
	 * sector memberships. Drones are shared between buckets, not copied.
	 *
	 * @throws IllegalArgumentException if the drone lies outside the airspace
	 */
	public void assign(Drone drone) {
		if (!contains(drone.getX()) || !contains(drone.getY())) {
			throw new IllegalArgumentException(drone + " lies outside the airspace [0, " + airspaceSize + "]");
		}
		long[] xs = mapCoordinate(drone.getX());
		long[] ys = mapCoordinate(drone.getY());
		for (long x : xs) {
			for (long y : ys) {
				sectors.computeIfAbsent(new SectorKey(x, y), k -> new ArrayList<>()).add(drone);
			}
		}
	}

	public void assignAll(Collection<Drone> drones) {
		for (Drone drone : drones) {
			assign(drone);
		}
	}

	/**
	 * @return the drones assigned to sector {@code (i, j)}; an empty list for any
	 *         sector with no bucket
	 */
	public List<Drone> getSector(long i, long j) {
		List<Drone> bucket = sectors.get(new SectorKey(i, j));
		return bucket == null ? Collections.emptyList() : Collections.unmodifiableList(bucket);
	}

	/**
	 * @return read-only views of every populated sector bucket
	 */
	public List<List<Drone>> getOccupiedSectors() {
		List<List<Drone>> out = new ArrayList<>(sectors.size());
		for (List<Drone> bucket : sectors.values()) {
			out.add(Collections.unmodifiableList(bucket));
		}
		return out;
	}

	public int getOccupiedSectorCount() {
		return sectors.size();
	}

	/**
	 * The area covered by sector {@code (i, j)}: from the edge below its lower
	 * cell to the edge above its upper cell, clipped to the airspace. Sectors
	 * outside the grid (such as the fictitious one past the far edge) cover nothing
	 * and yield a null envelope.
	 */
	public Envelope getSectorEnvelope(long i, long j) {
		double[] xr = axisRange(i);
		double[] yr = axisRange(j);
		if (xr == null || yr == null) {
			return new Envelope();
		}
		return new Envelope(xr[0], xr[1], yr[0], yr[1]);
	}

	private double[] axisRange(long index) {
		if (index < 0 || index > lastIndex) {
			return null;
		}
		double min = index == 0 ? 0 : getBoundary(index - 1);
		double max = index < lastIndex ? getBoundary(index + 1) : airspaceSize;
		return new double[] { min, max };
	}

	/**
	 * Materializes the sector edges along either axis.
	 *
	 * @throws IllegalStateException if the grid has too many edges for an array;
	 *                               use {@link #getBoundary(long)} instead
	 */
	public double[] getBoundaries() {
		if (getBoundaryCount() > Integer.MAX_VALUE - 8) {
			throw new IllegalStateException(getBoundaryCount() + " boundaries do not fit in an array");
		}
		double[] out = new double[(int) getBoundaryCount()];
		for (int k = 0; k < out.length; k++) {
			out[k] = getBoundary(k);
		}
		return out;
	}

	/**
	 * Number of sector indices per axis, including the fictitious edge sector.
	 */
	public long getSectorsPerAxis() {
		return lastIndex + 2;
	}

	public double getSectorWidth() {
		return sectorWidth;
	}

	public double getAirspaceSize() {
		return airspaceSize;
	}

	public boolean contains(double value) {
		return value >= 0 && value <= airspaceSize;
	}

	/**
	 * 2D sector index.
	 */
	private static final class SectorKey {
		final long i;
		final long j;

		SectorKey(long i, long j) {
			this.i = i;
			this.j = j;
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof SectorKey)) {
				return false;
			}
			SectorKey other = (SectorKey) o;
			return i == other.i && j == other.j;
		}

		@Override
		public int hashCode() {
			return 31 * Long.hashCode(i) + Long.hashCode(j);
		}
	}

	static void requirePositive(double value, String name) {
		if (!(value > 0) || !Double.isFinite(value)) {
			throw new IllegalArgumentException("Unexpected " + name + " value: " + value + " (must be positive and finite)");
		}
	}
}
