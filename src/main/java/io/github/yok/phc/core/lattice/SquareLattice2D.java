package io.github.yok.phc.core.lattice;

import io.github.yok.phc.core.exception.InvalidGeometryException;

/**
 * 2 次元の正方格子を表すクラスです。
 *
 * <p>
 * 基本ベクトルは a1 = (a, 0)、a2 = (0, a) です。
 * </p>
 */
public final class SquareLattice2D implements Lattice {

    /**
     * 格子定数です。
     */
    private final double a;

    /**
     * 2 次元正方格子を生成します。
     *
     * @param a 格子定数です（正の有限値）
     * @throws InvalidGeometryException a が正の有限値でない場合に発生します
     */
    public SquareLattice2D(double a) {
        if (!(a > 0.0) || !Double.isFinite(a)) {
            throw new InvalidGeometryException("格子定数は正の有限値である必要があります: " + a);
        }
        this.a = a;
    }

    @Override
    public double latticeConstant() {
        return a;
    }

    @Override
    public double[][] inPlaneVectors() {
        return new double[][] {{a, 0.0}, {0.0, a}};
    }

    /**
     * 単位胞面積 a² を返します。
     *
     * @return 単位胞面積です
     */
    @Override
    public double unitCellArea() {
        return a * a;
    }

    @Override
    public boolean isSquareCell() {
        return true;
    }

    @Override
    public String toString() {
        return "SquareLattice2D(a=" + a + ")";
    }
}
