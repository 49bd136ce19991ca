package io.github.yok.phc.core.geometry;

import io.github.yok.phc.core.material.Material;
import lombok.Value;

/**
 * 単位胞内に配置された形状（形状 + 分数座標の中心 + 材料）です。
 *
 * <p>
 * 中心 (s, t) は格子基本ベクトル単位の分数座標で、通常は [-0.5, 0.5) の範囲です。
 * </p>
 */
@Value
public class ShapeInCell {

    /**
     * 形状です。
     */
    HoleShape shape;

    /**
     * 中心の分数座標 s（x 方向）です。
     */
    double centerS;

    /**
     * 中心の分数座標 t（y 方向）です。
     */
    double centerT;

    /**
     * 形状内部の材料です。
     */
    Material material;

    /**
     * 配置済み形状を生成します。
     *
     * @param shape 形状です（null 不可）
     * @param centerS 中心の分数座標 s です（有限値）
     * @param centerT 中心の分数座標 t です（有限値）
     * @param material 材料です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public ShapeInCell(HoleShape shape, double centerS, double centerT, Material material) {
        if (shape == null) {
            throw new IllegalArgumentException("shape は null 不可です");
        }
        if (material == null) {
            throw new IllegalArgumentException("material は null 不可です");
        }
        Shapes.requireFinite("centerS", centerS);
        Shapes.requireFinite("centerT", centerT);
        this.shape = shape;
        this.centerS = centerS;
        this.centerT = centerT;
        this.material = material;
    }
}
