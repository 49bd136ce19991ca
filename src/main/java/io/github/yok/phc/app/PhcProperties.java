package io.github.yok.phc.app;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * phc-fourier の設定値（phc.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、既定の結晶とラスタライザ/フーリエ係数計算の組み立てに使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "phc")
public class PhcProperties {

    /**
     * 格子設定です。
     */
    @Valid
    private Lattice lattice = new Lattice();

    /**
     * 材料設定です。
     */
    @Valid
    private Material material = new Material();

    /**
     * 穴（円形インクルージョン）の設定です。
     */
    @Valid
    private Hole hole = new Hole();

    /**
     * グリッド設定です。
     */
    @Valid
    private Grid grid = new Grid();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "phc")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "lattice",
                // type: 格子の種類
                "type", lattice.getType(),
                // constant: 格子定数 a
                "constant", lattice.getConstant());

        appendSection(sb, nl, "material",
                // epsilonBackground: 背景（母材）の誘電率
                "epsilonBackground", material.getEpsilonBackground(),
                // epsilonHole: 穴の誘電率
                "epsilonHole", material.getEpsilonHole());

        appendSection(sb, nl, "hole",
                // fillingFactor: 充填率
                "fillingFactor", hole.getFillingFactor());

        appendSection(sb, nl, "grid",
                // size: 一辺の画素数
                "size", grid.getSize(),
                // parallel: 行単位の並列ラスタライズ
                "parallel", grid.isParallel());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    /**
     * 格子の種類です。
     */
    public enum LatticeType {
        /**
         * 正方格子です。
         */
        SQUARE,
        /**
         * 三角格子です（単位胞が正方形でないため、ラスタライズは拒否されます）。
         */
        TRIANGULAR
    }

    @Data
    public static class Lattice {

        /**
         * 格子の種類です。
         */
        @NotNull
        private LatticeType type = LatticeType.SQUARE;

        /**
         * 格子定数 a（メートル）です。
         */
        @Positive
        private double constant = 295e-9;
    }

    @Data
    public static class Material {

        /**
         * 背景（母材）の誘電率です。
         */
        @Positive
        private double epsilonBackground = 12.7449;

        /**
         * 穴の誘電率です。
         */
        @Positive
        private double epsilonHole = 1.0;
    }

    @Data
    public static class Hole {

        /**
         * 単位胞に対する穴の面積比（充填率）です。
         */
        @Positive
        @DecimalMax("1.0")
        private double fillingFactor = 0.16;
    }

    @Data
    public static class Grid {

        /**
         * 一辺の画素数 N です（FFT 効率のため 2 の冪を推奨）。
         */
        @Min(1)
        private int size = 128;

        /**
         * 行単位で並列にラスタライズするかどうかです。
         */
        private boolean parallel = true;
    }
}
