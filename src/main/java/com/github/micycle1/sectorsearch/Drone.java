package com.github.micycle1.sectorsearch;

import org.locationtech.jts.geom.Coordinate;

/**
 * A drone position in the airspace: a stable identifier plus a 2D coordinate.
 * <p>
 * Identity is the identifier alone; two drones at the same coordinate are still
 * two distinct drones.
 *
 * @author Michael Carleton
 */
public final class Drone {

	private final int id;
	private final Coordinate coords;

	public Drone(int id, Coordinate coords) {
		if (coords == null) {
			throw new IllegalArgumentException("Drone " + id + " has no coordinate");
		}
		this.id = id;
		this.coords = new Coordinate(coords.x, coords.y); // drop any Z and detach from the caller's copy
	}

	public Drone(int id, double x, double y) {
		this(id, new Coordinate(x, y));
	}

	public int getId() {
		return id;
	}

	public double getX() {
		return coords.x;
	}

	public double getY() {
		return coords.y;
	}

	/**
	 * @return a copy of this drone's position
	 */
	public Coordinate getCoordinate() {
		return new Coordinate(coords);
	}

	/**
	 * Euclidean (planar) distance between this drone and another.
	 */
	public double distance(Drone other) {
		return coords.distance(other.coords);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Drone)) {
			return false;
		}
		return id == ((Drone) o).id;
	}

	@Override
	public int hashCode() {
		return Integer.hashCode(id);
	}

	@Override
	public String toString() {
		return "Drone " + id + " @ (" + coords.x + ", " + coords.y + ")";
	}
}
