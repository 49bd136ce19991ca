package io.github.yok.phc.core.fourier;

import io.github.yok.phc.core.exception.InvalidGeometryException;
import io.github.yok.phc.core.fourier.FourierTransformBackend.ExponentSign;
import io.github.yok.phc.core.raster.DielectricGrid;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.MatrixFeatures_DDRM;

/**
 * 誘電率グリッドから全フーリエ係数 ξ_{m,n} を計算するクラスです。
 *
 * <p>
 * 係数の定義は、単位胞の中心を原点とした正の指数のフーリエ級数です。
 * </p>
 *
 * <pre>
 *   ξ_{m,n} = 1/N² · Σ_i Σ_j (ε[i][j] - ε_av) · exp(+i·2π(m(i-c) + n(j-c))/N),  c = (N-1)/2
 *   ξ_{0,0} = ε_av
 * </pre>
 *
 * <p>
 * 手順は 1) 平均 ε_av、2) ε - ε_av、3) 正の指数の DFT（バックエンドの逆変換）と 1/N² の正規化、
 * 4) 画素中心の原点補正 exp(-i·2π(m+n)c/N) と中央寄せ（象限入れ替え）、5) ξ_{0,0} を (ε_av, 0) で上書き、です。
 * N = 1 の場合はバックエンドを呼ばず、(ε_av, 0) だけの 1×1 の表を返します。
 * </p>
 */
@Getter
@Slf4j
public final class FourierEngine {

    /**
     * 2 次元 DFT のバックエンドです。
     */
    private final FourierTransformBackend backend;

    /**
     * フーリエ係数計算を生成します。
     *
     * <p>
     * 生成時に 4×4 のインパルスを変換し、{@link ExponentSign#POSITIVE} が exp(+i…) を返し、
     * 正規化を行わないことを確認します。
     * </p>
     *
     * @param backend DFT バックエンドです（null 不可）
     * @throws IllegalArgumentException backend が null の場合に発生します
     * @throws IllegalStateException backend の符号規約または正規化が想定と異なる場合に発生します
     */
    public FourierEngine(FourierTransformBackend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("backend は null 不可です");
        }
        verifyPositiveExponent(backend);
        this.backend = backend;
    }

    /**
     * 全フーリエ係数を計算します。
     *
     * @param grid 誘電率グリッドです（null 不可）
     * @param gridSize 一辺の画素数 N です（grid と一致すること）
     * @return 中央寄せ済みの係数表です
     * @throws IllegalArgumentException grid が null の場合に発生します
     * @throws InvalidGeometryException gridSize が grid と一致しない、または非有限値を含む場合に発生します
     */
    public FourierTable calculateAllXi(DielectricGrid grid, int gridSize) {
        if (grid == null) {
            throw new IllegalArgumentException("grid は null 不可です");
        }
        if (gridSize <= 0 || gridSize != grid.getGridSize()) {
            throw new InvalidGeometryException("gridSize がグリッドの大きさと一致しません: gridSize="
                    + gridSize + ", grid=" + grid.getGridSize());
        }
        DMatrixRMaj samples = grid.toMatrix();
        if (MatrixFeatures_DDRM.hasUncountable(samples)) {
            throw new InvalidGeometryException("グリッドに非有限値（NaN/Infinity）が含まれています");
        }

        long t0 = System.nanoTime();
        int n = gridSize;

        // 1) 平均誘電率
        double epsAv = grid.mean();

        // N = 1 では平均を引いた場が恒等的に 0 なので、変換せず ξ_{0,0} のみを返す
        if (n == 1) {
            ZMatrixRMaj single = new ZMatrixRMaj(1, 1);
            single.set(0, 0, epsAv, 0.0);
            return new FourierTable(single);
        }

        // 2) 平均を引いた場を複素配列（虚部 0）に詰める
        double[][] data = new double[n][2 * n];
        for (int i = 0; i < n; i++) {
            double[] row = data[i];
            for (int j = 0; j < n; j++) {
                row[2 * j] = samples.get(i, j) - epsAv;
            }
        }

        // 3) 正の指数の DFT（正規化なし）
        backend.transform(data, ExponentSign.POSITIVE);

        // 4) 1/N² 正規化、原点補正、中央寄せ
        ZMatrixRMaj centered = new ZMatrixRMaj(n, n);
        int half = n / 2;
        double scale = 1.0 / ((double) n * n);
        double c = (n - 1) / 2.0;
        for (int row = 0; row < n; row++) {
            int m = row - half;
            int src = Math.floorMod(m, n);
            for (int col = 0; col < n; col++) {
                int k = col - half;
                int srcCol = Math.floorMod(k, n);
                double re = data[src][2 * srcCol] * scale;
                double im = data[src][2 * srcCol + 1] * scale;

                double phase = -2.0 * Math.PI * (m + k) * c / n;
                double cos = Math.cos(phase);
                double sin = Math.sin(phase);
                centered.set(row, col, re * cos - im * sin, re * sin + im * cos);
            }
        }

        // 5) ξ_{0,0} は丸め誤差の残る計算値ではなく平均値そのものを採用
        centered.set(half, half, epsAv, 0.0);

        if (log.isDebugEnabled()) {
            long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
            log.debug("フーリエ係数を計算しました。N={}、ε_av={}、所要時間={}ms", n, fmt5(epsAv), elapsedMs);
        }
        return new FourierTable(centered);
    }

    /**
     * バックエンドの符号規約と正規化を確認します。
     *
     * <p>
     * (0, 1) のインパルスを POSITIVE で変換すると X[m][n] = exp(+i·2πn/4) となるはずです。
     * </p>
     *
     * @param backend DFT バックエンドです
     * @throws IllegalStateException 想定と異なる場合に発生します
     */
    private static void verifyPositiveExponent(FourierTransformBackend backend) {
        double[][] probe = new double[4][8];
        probe[0][2] = 1.0;
        backend.transform(probe, ExponentSign.POSITIVE);

        for (int m = 0; m < 4; m++) {
            for (int k = 0; k < 4; k++) {
                double angle = 2.0 * Math.PI * k / 4.0;
                double dRe = probe[m][2 * k] - Math.cos(angle);
                double dIm = probe[m][2 * k + 1] - Math.sin(angle);
                if (Math.abs(dRe) > 1e-12 || Math.abs(dIm) > 1e-12) {
                    throw new IllegalStateException("DFT バックエンドの符号規約または正規化が想定と異なります: "
                            + backend.getClass().getName() + "（m=" + m + ", n=" + k + "）");
                }
            }
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
