package io.github.yok.phc.core.material;

import io.github.yok.phc.core.exception.InvalidGeometryException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 材料の誘電率（対角テンソル）を保持するクラスです。
 *
 * <p>
 * ラスタライズでは面内成分 εx のみを使用します（TE 偏光を想定）。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Material {

    /**
     * 空気（ε = 1）です。
     */
    public static final Material AIR = ofEpsilon(1.0);

    /**
     * x 成分の誘電率です。
     */
    double epsilonX;

    /**
     * y 成分の誘電率です。
     */
    double epsilonY;

    /**
     * z 成分の誘電率です。
     */
    double epsilonZ;

    /**
     * 等方性材料を誘電率から生成します。
     *
     * @param epsilon 誘電率です（正の有限値）
     * @return 材料です
     * @throws InvalidGeometryException epsilon が正の有限値でない場合に発生します
     */
    public static Material ofEpsilon(double epsilon) {
        return anisotropic(epsilon, epsilon, epsilon);
    }

    /**
     * 等方性材料を屈折率から生成します（ε = n²）。
     *
     * @param n 屈折率です（正の有限値）
     * @return 材料です
     * @throws InvalidGeometryException n が正の有限値でない場合に発生します
     */
    public static Material ofRefractiveIndex(double n) {
        requirePositive("屈折率", n);
        return ofEpsilon(n * n);
    }

    /**
     * 対角成分を個別に指定して異方性材料を生成します。
     *
     * @param epsilonX x 成分です
     * @param epsilonY y 成分です
     * @param epsilonZ z 成分です
     * @return 材料です
     * @throws InvalidGeometryException いずれかの成分が正の有限値でない場合に発生します
     */
    public static Material anisotropic(double epsilonX, double epsilonY, double epsilonZ) {
        requirePositive("epsilonX", epsilonX);
        requirePositive("epsilonY", epsilonY);
        requirePositive("epsilonZ", epsilonZ);
        return new Material(epsilonX, epsilonY, epsilonZ);
    }

    /**
     * 面内（TE）誘電率 εx を返します。
     *
     * @return 面内誘電率です
     */
    public double inPlaneEpsilon() {
        return epsilonX;
    }

    /**
     * 等方性かどうかを返します。
     *
     * @return 3 成分がすべて等しい場合に true です
     */
    public boolean isIsotropic() {
        return epsilonX == epsilonY && epsilonY == epsilonZ;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0) || !Double.isFinite(value)) {
            throw new InvalidGeometryException(name + " は正の有限値である必要があります: " + value);
        }
    }
}
