package io.github.yok.phc.core.fourier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.phc.core.fourier.FourierTransformBackend.ExponentSign;
import org.junit.jupiter.api.Test;

class JTransformsFourierBackendTest {

    private final JTransformsFourierBackend backend = new JTransformsFourierBackend();

    @Test
    void positiveSignUsesPositiveExponent() {
        int n = 8;
        double[][] data = impulse(n, 1, 0);

        backend.transform(data, ExponentSign.POSITIVE);

        for (int m = 0; m < n; m++) {
            for (int k = 0; k < n; k++) {
                double angle = 2.0 * Math.PI * m / n;
                assertEquals(Math.cos(angle), data[m][2 * k], 1e-12);
                assertEquals(Math.sin(angle), data[m][2 * k + 1], 1e-12);
            }
        }
    }

    @Test
    void negativeSignUsesNegativeExponent() {
        int n = 6;
        double[][] data = impulse(n, 0, 1);

        backend.transform(data, ExponentSign.NEGATIVE);

        for (int m = 0; m < n; m++) {
            for (int k = 0; k < n; k++) {
                double angle = -2.0 * Math.PI * k / n;
                assertEquals(Math.cos(angle), data[m][2 * k], 1e-12);
                assertEquals(Math.sin(angle), data[m][2 * k + 1], 1e-12);
            }
        }
    }

    @Test
    void neverNormalizes() {
        int n = 16;
        double[][] data = new double[n][2 * n];
        for (double[] row : data) {
            for (int k = 0; k < n; k++) {
                row[2 * k] = 1.0;
            }
        }

        backend.transform(data, ExponentSign.POSITIVE);

        assertEquals(n * n, data[0][0], 1e-9);
        assertEquals(0.0, data[0][1], 1e-9);
        assertEquals(0.0, data[3][6], 1e-9);
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class,
                () -> backend.transform(new double[0][0], ExponentSign.POSITIVE));
        assertThrows(IllegalArgumentException.class,
                () -> backend.transform(new double[2][3], ExponentSign.POSITIVE));
        assertThrows(IllegalArgumentException.class,
                () -> backend.transform(new double[2][4], null));
        assertThrows(IllegalArgumentException.class,
                () -> backend.transform(new double[1][2], ExponentSign.POSITIVE));
        assertThrows(IllegalArgumentException.class,
                () -> backend.transform(new double[4][2], ExponentSign.NEGATIVE));
    }

    private static double[][] impulse(int n, int row, int col) {
        double[][] data = new double[n][2 * n];
        data[row][2 * col] = 1.0;
        return data;
    }
}
