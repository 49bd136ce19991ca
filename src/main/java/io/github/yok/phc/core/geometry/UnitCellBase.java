package io.github.yok.phc.core.geometry;

import io.github.yok.phc.core.exception.InvalidGeometryException;
import io.github.yok.phc.core.lattice.Lattice;
import io.github.yok.phc.core.material.Material;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Value;

/**
 * 単位胞の基底（背景材料と、配置済み形状の順序付き列）です。
 *
 * <p>
 * 列の順序はラスタライズの描画順で、後の形状が重なった画素を上書きします。空の列も許容します。
 * </p>
 */
@Value
public class UnitCellBase {

    /**
     * 背景材料です。
     */
    Material backgroundMaterial;

    /**
     * 配置済み形状の列です（変更不可）。
     */
    List<ShapeInCell> shapes;

    /**
     * 基底を生成します。
     *
     * @param backgroundMaterial 背景材料です（null 不可）
     * @param shapes 配置済み形状の列です（null 不可、要素も null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public UnitCellBase(Material backgroundMaterial, List<ShapeInCell> shapes) {
        if (backgroundMaterial == null) {
            throw new IllegalArgumentException("backgroundMaterial は null 不可です");
        }
        if (shapes == null) {
            throw new IllegalArgumentException("shapes は null 不可です");
        }
        List<ShapeInCell> copy = new ArrayList<>(shapes.size());
        for (ShapeInCell s : shapes) {
            if (s == null) {
                throw new IllegalArgumentException("shapes に null が含まれています");
            }
            copy.add(s);
        }
        this.backgroundMaterial = backgroundMaterial;
        this.shapes = Collections.unmodifiableList(copy);
    }

    /**
     * 形状を持たない基底を生成します。
     *
     * @param backgroundMaterial 背景材料です
     * @return 基底です
     */
    public static UnitCellBase empty(Material backgroundMaterial) {
        return new UnitCellBase(backgroundMaterial, List.of());
    }

    /**
     * 形状を末尾に追加した新しい基底を返します。
     *
     * @param shape 形状です
     * @param centerS 中心の分数座標 s です
     * @param centerT 中心の分数座標 t です
     * @param material 形状内部の材料です
     * @return 新しい基底です
     */
    public UnitCellBase withShape(HoleShape shape, double centerS, double centerT,
            Material material) {
        List<ShapeInCell> next = new ArrayList<>(shapes);
        next.add(new ShapeInCell(shape, centerS, centerT, material));
        return new UnitCellBase(backgroundMaterial, next);
    }

    /**
     * 充填率 f から、中心 (0, 0) に円形の穴を 1 つ持つ基底を生成します。
     *
     * <p>
     * 半径は {@code r = sqrt(f·A/π)}（A は単位胞面積）です。
     * </p>
     *
     * @param fillingFactor 充填率です（0 より大きく 1 以下）
     * @param lattice 格子です（null 不可）
     * @param holeMaterial 穴の材料です
     * @param backgroundMaterial 背景材料です
     * @return 基底です
     * @throws InvalidGeometryException 充填率が範囲外の場合に発生します
     */
    public static UnitCellBase fromSimpleCircle(double fillingFactor, Lattice lattice,
            Material holeMaterial, Material backgroundMaterial) {
        if (!(fillingFactor > 0.0 && fillingFactor <= 1.0)) {
            throw new InvalidGeometryException("充填率は (0, 1] が必要です: " + fillingFactor);
        }
        if (lattice == null) {
            throw new IllegalArgumentException("lattice は null 不可です");
        }
        double radius = Math.sqrt(fillingFactor * lattice.unitCellArea() / Math.PI);
        return empty(backgroundMaterial).withShape(new Circle(radius), 0.0, 0.0, holeMaterial);
    }
}
