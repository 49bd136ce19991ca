package io.github.yok.phc.core.geometry;

import lombok.Value;

/**
 * 正三角形の穴です。
 *
 * <p>
 * 回転 0 度の基準姿勢では、重心を配置中心に置き、底辺を x 軸に平行、頂点を +y 方向に向けます。
 * 頂点は (0, 2h/3)、(-s/2, -h/3)、(s/2, -h/3) です（h = s·√3/2）。
 * </p>
 */
@Value
public class EquilateralTriangle implements HoleShape {

    /**
     * 一辺の長さです。
     */
    double side;

    /**
     * 回転角（度、反時計回り）です。
     */
    double rotationDegrees;

    /**
     * 正三角形を生成します。
     *
     * @param side 一辺の長さです（正の有限値）
     * @param rotationDegrees 回転角（度）です（有限値）
     * @throws io.github.yok.phc.core.exception.InvalidGeometryException 引数が不正な場合に発生します
     */
    public EquilateralTriangle(double side, double rotationDegrees) {
        Shapes.requirePositiveLength("side", side);
        Shapes.requireFinite("rotationDegrees", rotationDegrees);
        this.side = side;
        this.rotationDegrees = rotationDegrees;
    }

    @Override
    public String kind() {
        return "EquilateralTriangle";
    }
}
