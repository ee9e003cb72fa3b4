package com.github.micycle1.fiberfusing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class FusionSettingsTest {

	@Test
	void defaults() {
		FusionSettings s = FusionSettings.defaults();
		assertSame(s, FusionSettings.defaults());
		assertEquals(256, s.getCircleSegments());
		assertEquals(1e-2, s.getToleranceFactor(), 0);
		assertEquals(1e-10, s.getCoreTolerance(), 0);
		assertEquals(500, s.getMaxEvaluations());
		assertTrue(Double.isNaN(s.getShiftUpperBound()));
	}

	@Test
	void toBuilderCopiesEveryValue() {
		FusionSettings s = FusionSettings.builder().circleSegments(64).virtualCircleDeviation(1e-3).maxVirtualCircleSegments(1024).toleranceFactor(1e-3)
				.coreTolerance(1e-8).shiftUpperBound(10).maxEvaluations(50).build();
		FusionSettings copy = s.toBuilder().build();
		assertEquals(s.toString(), copy.toString());
		assertEquals(64, copy.getCircleSegments());
		assertEquals(1e-3, copy.getVirtualCircleDeviation(), 0);
		assertEquals(1024, copy.getMaxVirtualCircleSegments());
		assertEquals(10, copy.getShiftUpperBound(), 0);

		FusionSettings changed = s.toBuilder().maxEvaluations(7).build();
		assertEquals(7, changed.getMaxEvaluations());
		assertEquals(50, s.getMaxEvaluations());
	}

	@Test
	void invalidValuesRejected() {
		assertThrows(IllegalArgumentException.class, () -> FusionSettings.builder().circleSegments(4).build());
		assertThrows(IllegalArgumentException.class, () -> FusionSettings.builder().maxVirtualCircleSegments(100).build());
		assertThrows(IllegalArgumentException.class, () -> FusionSettings.builder().virtualCircleDeviation(0).build());
		assertThrows(IllegalArgumentException.class, () -> FusionSettings.builder().toleranceFactor(-1).build());
		assertThrows(IllegalArgumentException.class, () -> FusionSettings.builder().coreTolerance(Double.NaN).build());
		assertThrows(IllegalArgumentException.class, () -> FusionSettings.builder().shiftUpperBound(0).build());
		assertThrows(IllegalArgumentException.class, () -> FusionSettings.builder().maxEvaluations(0).build());
	}

	@Test
	void assemblyFibersFollowSettings() {
		FusionSettings s = FusionSettings.builder().circleSegments(48).build();
		FiberAssembly assembly = new FiberAssembly(s).addFiber(0, 0, 1);
		assertEquals(48, assembly.getFibers().get(0).getSegments());
		assertSame(s, assembly.getSettings());
	}
}
