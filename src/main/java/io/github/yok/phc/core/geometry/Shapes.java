package io.github.yok.phc.core.geometry;

import io.github.yok.phc.core.exception.InvalidGeometryException;

/**
 * 形状記述子の引数検証をまとめたユーティリティです。
 */
final class Shapes {

    private Shapes() {
    }

    /**
     * 寸法が正の有限値であることを検証します。
     *
     * @param name 引数名です
     * @param value 値です
     * @throws InvalidGeometryException 正の有限値でない場合に発生します
     */
    static void requirePositiveLength(String name, double value) {
        if (!(value > 0.0) || !Double.isFinite(value)) {
            throw new InvalidGeometryException(name + " は正の有限値である必要があります: " + value);
        }
    }

    /**
     * 値が有限であることを検証します。
     *
     * @param name 引数名です
     * @param value 値です
     * @throws InvalidGeometryException 有限値でない場合に発生します
     */
    static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidGeometryException(name + " は有限値である必要があります: " + value);
        }
    }
}
