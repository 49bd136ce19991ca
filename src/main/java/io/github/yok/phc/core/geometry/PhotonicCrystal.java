package io.github.yok.phc.core.geometry;

import io.github.yok.phc.core.lattice.Lattice;
import lombok.Value;

/**
 * 2 次元フォトニック結晶（格子 + 単位胞の基底）です。
 */
@Value
public class PhotonicCrystal {

    /**
     * 格子です。
     */
    Lattice lattice;

    /**
     * 単位胞の基底です。
     */
    UnitCellBase base;

    /**
     * フォトニック結晶を生成します。
     *
     * @param lattice 格子です（null 不可）
     * @param base 基底です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public PhotonicCrystal(Lattice lattice, UnitCellBase base) {
        if (lattice == null) {
            throw new IllegalArgumentException("lattice は null 不可です");
        }
        if (base == null) {
            throw new IllegalArgumentException("base は null 不可です");
        }
        this.lattice = lattice;
        this.base = base;
    }
}
