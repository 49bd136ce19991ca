package io.github.yok.phc.core.lattice;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.phc.core.exception.InvalidGeometryException;
import org.junit.jupiter.api.Test;

class TriangularLattice2DTest {

    @Test
    void basisVectorsEnclose60Degrees() {
        double a = 400e-9;
        TriangularLattice2D lattice = new TriangularLattice2D(a);

        double[][] v = lattice.inPlaneVectors();
        assertArrayEquals(new double[] {a, 0.0}, v[0], 0.0);
        assertArrayEquals(new double[] {0.5 * a, Math.sqrt(3.0) / 2.0 * a}, v[1], 1e-24);

        double cos = (v[0][0] * v[1][0] + v[0][1] * v[1][1]) / (a * a);
        assertEquals(0.5, cos, 1e-12);
    }

    @Test
    void unitCellAreaMatchesCrossProduct() {
        double a = 1.0;
        TriangularLattice2D lattice = new TriangularLattice2D(a);

        assertEquals(Math.sqrt(3.0) / 2.0, lattice.unitCellArea(), 1e-15);
        double[][] v = lattice.inPlaneVectors();
        assertEquals(lattice.unitCellArea(), Math.abs(v[0][0] * v[1][1] - v[0][1] * v[1][0]),
                1e-15);
        assertFalse(lattice.isSquareCell());
    }

    @Test
    void rejectsNonPositiveOrNonFiniteConstant() {
        assertThrows(InvalidGeometryException.class, () -> new TriangularLattice2D(0.0));
        assertThrows(InvalidGeometryException.class, () -> new TriangularLattice2D(-1.0));
        assertThrows(InvalidGeometryException.class, () -> new TriangularLattice2D(Double.NaN));
    }
}
