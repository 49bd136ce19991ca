package io.github.yok.phc.core.raster;

import io.github.yok.phc.core.exception.InvalidGeometryException;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 単位胞を N×N 画素で標本化した誘電率グリッドです。
 *
 * <p>
 * 行インデックス i が x 方向、列インデックス j が y 方向に対応します。
 * 生成後は変更できません（{@link #toMatrix()} はコピーを返します）。
 * </p>
 */
public final class DielectricGrid {

    /**
     * 標本値（N×N）です。
     */
    private final DMatrixRMaj samples;

    private DielectricGrid(DMatrixRMaj samples) {
        this.samples = samples;
    }

    /**
     * 2 次元配列からグリッドを生成します（値はコピーされます）。
     *
     * <p>
     * 負の値は拒否します。NaN/Infinity の検査はフーリエ変換側で行います。
     * </p>
     *
     * @param values 標本値です（N×N の正方配列、N は 1 以上、各値は 0 以上）
     * @return グリッドです
     * @throws InvalidGeometryException 配列が空、正方でない、または負の値を含む場合に発生します
     */
    public static DielectricGrid of(double[][] values) {
        if (values == null || values.length == 0) {
            throw new InvalidGeometryException("グリッドは 1×1 以上が必要です");
        }
        int n = values.length;
        for (int i = 0; i < n; i++) {
            if (values[i] == null || values[i].length != n) {
                throw new InvalidGeometryException("グリッドは正方である必要があります: row=" + i);
            }
            for (int j = 0; j < n; j++) {
                if (values[i][j] < 0.0) {
                    throw new InvalidGeometryException("誘電率は 0 以上である必要があります: ("
                            + i + ", " + j + ")=" + values[i][j]);
                }
            }
        }
        return new DielectricGrid(new DMatrixRMaj(values));
    }

    /**
     * グリッドの一辺の画素数 N を返します。
     *
     * @return 画素数です
     */
    public int getGridSize() {
        return samples.numRows;
    }

    /**
     * 画素 (i, j) の誘電率を返します。
     *
     * @param i 行インデックス（x 方向）です
     * @param j 列インデックス（y 方向）です
     * @return 誘電率です
     */
    public double get(int i, int j) {
        return samples.get(i, j);
    }

    /**
     * 全画素の算術平均を返します。
     *
     * @return 平均誘電率です
     */
    public double mean() {
        // N が数百程度までなら単純和の丸め誤差は問題にならない
        return CommonOps_DDRM.elementSum(samples) / samples.getNumElements();
    }

    /**
     * 値が epsilon に一致する画素の割合を返します。
     *
     * @param epsilon 誘電率です
     * @return 0 以上 1 以下の割合です
     */
    public double fractionOf(double epsilon) {
        int count = 0;
        int total = samples.getNumElements();
        for (int k = 0; k < total; k++) {
            if (samples.data[k] == epsilon) {
                count++;
            }
        }
        return (double) count / total;
    }

    /**
     * 標本値のコピーを返します。
     *
     * @return N×N 行列です
     */
    public DMatrixRMaj toMatrix() {
        return samples.copy();
    }
}
