package io.github.yok.phc.core.geometry;

/**
 * 単位胞内に配置する穴（インクルージョン）の形状記述子です。
 *
 * <p>
 * 実装は {@link Circle}、{@link EquilateralTriangle}、{@link RightAngledIsosceles} の 3 種です。
 * 寸法は格子定数と同じ長さ単位、回転は度（反時計回り）で表します。
 * </p>
 *
 * <p>
 * このインタフェースは封印していません。上記 3 種以外の実装も基底に配置できますが、
 * ラスタライズ時に {@link io.github.yok.phc.core.exception.UnsupportedShapeException} で拒否されます
 * （黙って読み飛ばすことはしません）。
 * </p>
 */
public interface HoleShape {

    /**
     * ログ出力用の形状名を返します。
     *
     * @return 形状名です
     */
    String kind();
}
