package io.github.yok.phc.core.geometry;

import lombok.Value;

/**
 * 直角二等辺三角形の穴です。
 *
 * <p>
 * 回転 0 度の基準姿勢では、重心を配置中心に置き、直角を左下、等辺を +x 方向と +y 方向に取ります。
 * 頂点は (-L/3, -L/3)、(2L/3, -L/3)、(-L/3, 2L/3) です。
 * </p>
 */
@Value
public class RightAngledIsosceles implements HoleShape {

    /**
     * 等辺（直角を挟む辺）の長さです。
     */
    double leg;

    /**
     * 回転角（度、反時計回り）です。
     */
    double rotationDegrees;

    /**
     * 直角二等辺三角形を生成します。
     *
     * @param leg 等辺の長さです（正の有限値）
     * @param rotationDegrees 回転角（度）です（有限値）
     * @throws io.github.yok.phc.core.exception.InvalidGeometryException 引数が不正な場合に発生します
     */
    public RightAngledIsosceles(double leg, double rotationDegrees) {
        Shapes.requirePositiveLength("leg", leg);
        Shapes.requireFinite("rotationDegrees", rotationDegrees);
        this.leg = leg;
        this.rotationDegrees = rotationDegrees;
    }

    @Override
    public String kind() {
        return "RightAngledIsosceles";
    }
}
