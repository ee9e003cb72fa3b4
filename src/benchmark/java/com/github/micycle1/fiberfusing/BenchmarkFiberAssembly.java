package com.github.micycle1.fiberfusing;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.operation.union.CascadedPolygonUnion;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@State(Scope.Benchmark)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2)
@Measurement(iterations = 2, time = 5)
@Fork(value = 1, jvmArgsAppend = { "-Xms1g", "-Xmx1g", "-XX:+AlwaysPreTouch" })
public class BenchmarkFiberAssembly {

	// number of fibers in the ring
	@Param({ "2", "3", "7" })
	public int n;

	@Param({ "0.3", "0.8" })
	public double fusionDegree;

//	@Param({ "64", "256" })
	public int circleSegments = 256;

	private static final double radius = 62.5;

	private FusionSettings settings;
	private List<FiberCircle> fibers;
	private List<Geometry> disks;

	@Setup(Level.Trial)
	public void setup() {
		settings = FusionSettings.builder().circleSegments(circleSegments).build();
		double factor = FiberAssembly.scalingFactor(fusionDegree);
		AffineTransformation scale = AffineTransformation.scaleInstance(factor, factor);
		fibers = new ArrayList<>();
		disks = new ArrayList<>();
		for (FiberCircle f : FiberLayouts.ring(n, radius, 0, settings)) {
			FiberCircle scaled = f.transformed(scale);
			fibers.add(scaled);
			disks.add(scaled.getPolygon());
		}

		// Trigger class loading/JIT outside measurement
		assemble().build();
	}

	private FiberAssembly assemble() {
		FiberAssembly assembly = new FiberAssembly(settings);
		fibers.forEach(f -> assembly.addFiber(f.transformed(new AffineTransformation())));
		return assembly;
	}

	@Benchmark
	public void testBuild(Blackhole bh) {
		bh.consume(assemble().build().getFusedPolygon());
	}

	@Benchmark
	public void testShiftSearch(Blackhole bh) {
		List<PairConnection> connections = ConnectionGraph.build(fibers, settings);
		bh.consume(new GlobalShiftOptimizer(settings, FusionListener.NONE).findShift(connections));
	}

	@Benchmark
	public void testCascadedDiskUnion(Blackhole bh) {
		bh.consume(CascadedPolygonUnion.union(new ArrayList<>(disks)));
	}

	@Benchmark
	public void testHilbertDiskUnion(Blackhole bh) {
		bh.consume(PolygonOps.union(new ArrayList<>(disks)));
	}
}
