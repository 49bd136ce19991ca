package io.github.yok.phc.core.raster;

/**
 * 実空間座標で表した形状の領域です。
 *
 * <p>
 * ラスタライザは形状の種類を意識せず、画素中心の所属判定のみを利用します。
 * </p>
 */
public interface ShapeRegion {

    /**
     * 点 (x, y) が領域に含まれるかどうかを返します（境界を含みます）。
     *
     * @param x 実空間 x 座標です
     * @param y 実空間 y 座標です
     * @return 含まれる場合に true です
     */
    boolean contains(double x, double y);
}
