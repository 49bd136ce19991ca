package io.github.yok.phc.core.lattice;

/**
 * フォトニック結晶の 2 次元格子を表すインタフェースです。
 *
 * <p>
 * 基本ベクトル a1, a2 は面内（xy 平面）にあり、長さの単位は形状寸法と共通です。
 * </p>
 */
public interface Lattice {

    /**
     * 格子定数 a を返します。
     *
     * @return 格子定数です（正、長さの単位は形状寸法と共通）
     */
    double latticeConstant();

    /**
     * 面内の基本ベクトルを返します。
     *
     * @return {@code {{a1x, a1y}, {a2x, a2y}}} です（呼び出しごとに新しい配列）
     */
    double[][] inPlaneVectors();

    /**
     * 面内単位胞の面積 |a1 × a2| を返します。
     *
     * @return 単位胞面積です
     */
    default double unitCellArea() {
        double[][] v = inPlaneVectors();
        return Math.abs(v[0][0] * v[1][1] - v[0][1] * v[1][0]);
    }

    /**
     * 単位胞が正方形（a1 ⊥ a2 かつ |a1| = |a2|）かどうかを返します。
     *
     * @return 正方形の場合は true です
     */
    default boolean isSquareCell() {
        double[][] v = inPlaneVectors();
        double len1 = Math.hypot(v[0][0], v[0][1]);
        double len2 = Math.hypot(v[1][0], v[1][1]);
        double dot = v[0][0] * v[1][0] + v[0][1] * v[1][1];
        double tol = 1e-12 * len1 * len2;
        return Math.abs(dot) <= tol && Math.abs(len1 - len2) <= 1e-12 * len1;
    }
}
