package io.github.yok.phc.core.lattice;

import io.github.yok.phc.core.exception.InvalidGeometryException;

/**
 * 2 次元の三角格子（六方格子）を表すクラスです。
 *
 * <p>
 * 基本ベクトルは a1 = (a, 0)、a2 = (a/2, a·√3/2) で、単位胞は内角 60° の菱形です。
 * </p>
 */
public final class TriangularLattice2D implements Lattice {

    private static final double SQRT3_HALF = Math.sqrt(3.0) / 2.0;

    /**
     * 格子定数です。
     */
    private final double a;

    /**
     * 2 次元三角格子を生成します。
     *
     * @param a 格子定数です（正の有限値）
     * @throws InvalidGeometryException a が正の有限値でない場合に発生します
     */
    public TriangularLattice2D(double a) {
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
        return new double[][] {{a, 0.0}, {0.5 * a, SQRT3_HALF * a}};
    }

    /**
     * 単位胞面積 (√3/2)·a² を返します。
     *
     * @return 単位胞面積です
     */
    @Override
    public double unitCellArea() {
        return SQRT3_HALF * a * a;
    }

    @Override
    public boolean isSquareCell() {
        return false;
    }

    @Override
    public String toString() {
        return "TriangularLattice2D(a=" + a + ")";
    }
}
