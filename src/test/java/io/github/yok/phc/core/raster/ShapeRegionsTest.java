package io.github.yok.phc.core.raster;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.phc.core.exception.UnsupportedShapeException;
import io.github.yok.phc.core.geometry.Circle;
import io.github.yok.phc.core.geometry.EquilateralTriangle;
import io.github.yok.phc.core.geometry.HoleShape;
import io.github.yok.phc.core.geometry.RightAngledIsosceles;
import org.junit.jupiter.api.Test;

class ShapeRegionsTest {

    @Test
    void circleBoundaryIsInclusive() {
        ShapeRegion region = ShapeRegions.of(new Circle(0.5), 1.0, 1.0);

        assertTrue(region.contains(1.0, 1.0));
        assertTrue(region.contains(1.5, 1.0));
        assertFalse(region.contains(1.5, 1.01));
    }

    @Test
    void equilateralTriangleApexPointsUpAtZeroRotation() {
        double s = 0.5;
        ShapeRegion region = ShapeRegions.of(new EquilateralTriangle(s, 0.0), 0.0, 0.0);

        // 重心は中心、頂点は y = 2h/3 ≈ 0.2887
        assertTrue(region.contains(0.0, 0.0));
        assertTrue(region.contains(0.0, 0.25));
        assertFalse(region.contains(0.0, 0.30));
        assertFalse(region.contains(0.0, -0.25));
        assertTrue(region.contains(-0.15, -0.05));
        assertFalse(region.contains(-0.2, 0.1));
    }

    @Test
    void equilateralTriangleRotatedHalfTurnPointsDown() {
        ShapeRegion region = ShapeRegions.of(new EquilateralTriangle(0.5, 180.0), 0.0, 0.0);

        assertFalse(region.contains(0.0, 0.25));
        assertTrue(region.contains(0.0, -0.25));
    }

    @Test
    void equilateralTriangleIsInvariantUnderThirdTurn() {
        ShapeRegion base = ShapeRegions.of(new EquilateralTriangle(0.5, 0.0), 0.0, 0.0);
        ShapeRegion turned = ShapeRegions.of(new EquilateralTriangle(0.5, 120.0), 0.0, 0.0);

        double[][] probes = {{0.0, 0.25}, {0.0, 0.3}, {-0.2, -0.1}, {0.2, -0.1}, {0.1, 0.1},
                {-0.15, 0.05}, {0.0, -0.2}};
        for (double[] p : probes) {
            assertTrue(base.contains(p[0], p[1]) == turned.contains(p[0], p[1]),
                    "(" + p[0] + ", " + p[1] + ")");
        }
    }

    @Test
    void rightAngledIsoscelesHasRightAngleAtLowerLeft() {
        double l = 0.6;
        ShapeRegion region = ShapeRegions.of(new RightAngledIsosceles(l, 0.0), 0.0, 0.0);

        // 直角の頂点 (-L/3, -L/3) の近傍
        assertTrue(region.contains(-l / 3.0 + 1e-3, -l / 3.0 + 1e-3));
        assertFalse(region.contains(-l / 3.0 - 1e-3, 0.0));
        // 斜辺 x + y = L/3 の外側
        assertFalse(region.contains(l / 4.0, l / 4.0));
        assertTrue(region.contains(0.6 * l, -0.3 * l));
    }

    @Test
    void rightAngledIsoscelesRotatesCounterClockwise() {
        double l = 0.6;
        ShapeRegion unrotated = ShapeRegions.of(new RightAngledIsosceles(l, 0.0), 0.0, 0.0);
        ShapeRegion quarter = ShapeRegions.of(new RightAngledIsosceles(l, 90.0), 0.0, 0.0);

        // 90 度回転で直角の頂点は (L/3, -L/3) に移る
        assertFalse(unrotated.contains(-0.6 * l, -0.3 * l));
        assertTrue(quarter.contains(-0.6 * l, -0.3 * l));
        assertTrue(quarter.contains(l / 3.0 - 1e-3, -l / 3.0 + 1e-3));
        assertFalse(quarter.contains(0.6 * l, -0.3 * l));
    }

    @Test
    void polygonIsTranslatedToPlacementCenter() {
        ShapeRegion region = ShapeRegions.of(new RightAngledIsosceles(0.6, 0.0), 10.0, -5.0);

        assertTrue(region.contains(10.0, -5.0));
        assertFalse(region.contains(0.0, 0.0));
    }

    @Test
    void unknownShapeIsRejected() {
        HoleShape hexagon = () -> "Hexagon";

        assertThrows(UnsupportedShapeException.class, () -> ShapeRegions.of(hexagon, 0.0, 0.0));
    }
}
