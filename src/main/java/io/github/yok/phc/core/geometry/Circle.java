package io.github.yok.phc.core.geometry;

import lombok.Value;

/**
 * 円形の穴です。
 */
@Value
public class Circle implements HoleShape {

    /**
     * 半径です。
     */
    double radius;

    /**
     * 円を生成します。
     *
     * @param radius 半径です（正の有限値）
     * @throws io.github.yok.phc.core.exception.InvalidGeometryException radius が不正な場合に発生します
     */
    public Circle(double radius) {
        Shapes.requirePositiveLength("radius", radius);
        this.radius = radius;
    }

    @Override
    public String kind() {
        return "Circle";
    }
}
