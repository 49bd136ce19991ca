package io.github.yok.phc.core.fourier;

import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * 回折次数 (m, n) で引ける複素フーリエ係数 ξ の表です。
 *
 * <p>
 * 行 {@code row = m + N/2}、列 {@code col = n + N/2}（整数除算）で格納し、次数 (0, 0) が中央に来ます。
 * 次数の範囲は {@code [-N/2, N - N/2)} です。m は x 方向、n は y 方向の次数です。
 * </p>
 */
public final class FourierTable {

    /**
     * 係数（N×N 複素行列）です。
     */
    private final ZMatrixRMaj coefficients;

    /**
     * 係数表を生成します（行列はコピーせずに保持します）。
     *
     * @param coefficients 中央寄せ済みの係数行列です
     */
    FourierTable(ZMatrixRMaj coefficients) {
        this.coefficients = coefficients;
    }

    /**
     * 一辺の要素数 N を返します。
     *
     * @return 要素数です
     */
    public int getGridSize() {
        return coefficients.numRows;
    }

    /**
     * 最小の回折次数 -N/2 を返します。
     *
     * @return 最小次数です
     */
    public int minOrder() {
        return -(getGridSize() / 2);
    }

    /**
     * 最大の回折次数 N - N/2 - 1 を返します。
     *
     * @return 最大次数です
     */
    public int maxOrder() {
        return getGridSize() - getGridSize() / 2 - 1;
    }

    /**
     * 回折次数 (m, n) の係数 ξ_{m,n} を返します。
     *
     * @param m x 方向の次数です
     * @param n y 方向の次数です
     * @return 係数です（新しいインスタンス）
     * @throws IllegalArgumentException 次数が範囲外の場合に発生します
     */
    public Complex_F64 get(int m, int n) {
        if (m < minOrder() || m > maxOrder() || n < minOrder() || n > maxOrder()) {
            throw new IllegalArgumentException("回折次数が範囲外です: (m, n)=(" + m + ", " + n + ")、範囲=["
                    + minOrder() + ", " + maxOrder() + "]");
        }
        int center = getGridSize() / 2;
        return getAt(m + center, n + center);
    }

    /**
     * 格納位置 (row, col) の係数を返します。
     *
     * @param row 行インデックスです
     * @param col 列インデックスです
     * @return 係数です（新しいインスタンス）
     */
    public Complex_F64 getAt(int row, int col) {
        Complex_F64 out = new Complex_F64();
        coefficients.get(row, col, out);
        return out;
    }

    /**
     * 平均誘電率に等しい ξ_{0,0} を返します。
     *
     * @return 係数です
     */
    public Complex_F64 zeroOrder() {
        return get(0, 0);
    }

    /**
     * 全要素の虚部の絶対値の最大を返します。
     *
     * @return 虚部の最大絶対値です
     */
    public double maxAbsImaginary() {
        double max = 0.0;
        double[] data = coefficients.data;
        int length = coefficients.getDataLength();
        for (int k = 1; k < length; k += 2) {
            max = Math.max(max, Math.abs(data[k]));
        }
        return max;
    }

    /**
     * 係数行列のコピーを返します。
     *
     * @return N×N 複素行列です
     */
    public ZMatrixRMaj toMatrix() {
        return coefficients.copy();
    }
}
