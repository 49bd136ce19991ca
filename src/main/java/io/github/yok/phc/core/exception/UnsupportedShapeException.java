package io.github.yok.phc.core.exception;

/**
 * ラスタライズ規則が定義されていない形状が指定された場合に発生する例外です。
 */
public class UnsupportedShapeException extends UnsupportedOperationException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public UnsupportedShapeException(String message) {
        super(message);
    }
}
