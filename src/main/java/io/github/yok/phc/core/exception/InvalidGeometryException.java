package io.github.yok.phc.core.exception;

/**
 * 幾何条件（格子定数、グリッド解像度、寸法、サンプル値）が不正な場合に発生する例外です。
 *
 * <p>
 * 計算は決定的なため、同じ入力で再試行しても同じ結果になります。呼び出し側は設定誤りとして扱ってください。
 * </p>
 */
public class InvalidGeometryException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public InvalidGeometryException(String message) {
        super(message);
    }
}
