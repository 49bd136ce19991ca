package io.github.yok.phc.core.lattice;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.phc.core.exception.InvalidGeometryException;
import org.junit.jupiter.api.Test;

class SquareLattice2DTest {

    @Test
    void unitCellAreaIsSquareOfLatticeConstant() {
        double a = 1e-6;
        SquareLattice2D lattice = new SquareLattice2D(a);

        assertEquals(a, lattice.latticeConstant(), 0.0);
        assertEquals(a * a, lattice.unitCellArea(), 1e-24);
    }

    @Test
    void basisVectorsAreOrthogonalWithEqualLength() {
        double a = 295e-9;
        SquareLattice2D lattice = new SquareLattice2D(a);

        double[][] v = lattice.inPlaneVectors();
        assertArrayEquals(new double[] {a, 0.0}, v[0], 0.0);
        assertArrayEquals(new double[] {0.0, a}, v[1], 0.0);
        assertTrue(lattice.isSquareCell());
    }

    @Test
    void defaultContractDerivesAreaAndShapeFromVectors() {
        Lattice rotated = new Lattice() {
            @Override
            public double latticeConstant() {
                return 2.0;
            }

            @Override
            public double[][] inPlaneVectors() {
                double c = Math.sqrt(2.0);
                return new double[][] {{c, c}, {-c, c}};
            }
        };

        assertEquals(4.0, rotated.unitCellArea(), 1e-12);
        assertTrue(rotated.isSquareCell());
    }

    @Test
    void rejectsNonPositiveOrNonFiniteConstant() {
        assertThrows(InvalidGeometryException.class, () -> new SquareLattice2D(0.0));
        assertThrows(InvalidGeometryException.class, () -> new SquareLattice2D(-295e-9));
        assertThrows(InvalidGeometryException.class, () -> new SquareLattice2D(Double.NaN));
        assertThrows(InvalidGeometryException.class,
                () -> new SquareLattice2D(Double.POSITIVE_INFINITY));
    }
}
