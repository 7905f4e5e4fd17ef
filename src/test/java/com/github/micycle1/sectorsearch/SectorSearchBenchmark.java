package com.github.micycle1.sectorsearch;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class SectorSearchBenchmark {

	private static final double AIRSPACE_SIZE = 128_000; // meters
	private static final double CONFLICT_RADIUS = 500; // meters

	@ParameterizedTest
	@ValueSource(ints = { 100, 1_000, 10_000, 50_000 })
	public void benchmarkSectoredVsBruteForce(int num) {
		double[][] drones = SectorSearchTest.randomDrones(new Random(1), num, AIRSPACE_SIZE);
		List<Drone> droneList = SectorSearchTest.toDrones(drones);

		long startTime = System.currentTimeMillis();
		int sectored = SectorSearch.countConflicts(drones, CONFLICT_RADIUS, AIRSPACE_SIZE);
		long sectorDuration = System.currentTimeMillis() - startTime;

		startTime = System.currentTimeMillis();
		int brute = SectorSearch.bruteForceConflicts(droneList, CONFLICT_RADIUS).size();
		long bruteDuration = System.currentTimeMillis() - startTime;

		System.out.println("Sector search of " + num + " drones took " + sectorDuration + " ms (" + sectored
				+ " in conflict); brute force took " + bruteDuration + " ms (" + brute + " in conflict).");
	}

	@ParameterizedTest
	@ValueSource(ints = { 2, 5, 10, 20, 40 })
	public void benchmarkPadMult(int padMult) {
		double[][] drones = SectorSearchTest.randomDrones(new Random(1), 50_000, AIRSPACE_SIZE);
		SearchOptions opts = SearchOptions.defaults().withPadMult(padMult);

		long startTime = System.currentTimeMillis();
		int sequential = SectorSearch.countConflicts(drones, CONFLICT_RADIUS, AIRSPACE_SIZE, opts);
		long sequentialDuration = System.currentTimeMillis() - startTime;

		startTime = System.currentTimeMillis();
		SectorSearch.countConflicts(drones, CONFLICT_RADIUS, AIRSPACE_SIZE, opts.withParallel(true));
		long parallelDuration = System.currentTimeMillis() - startTime;

		System.out.println("padMult=" + padMult + ": sequential " + sequentialDuration + " ms, parallel "
				+ parallelDuration + " ms. " + sequential + " drones in conflict.");
	}

}
