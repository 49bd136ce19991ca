package io.github.yok.phc.core.fourier;

/**
 * 2 次元離散フーリエ変換を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * ライブラリごとに「順変換」の符号規約が異なるため、指数の符号を呼び出し側が明示します。
 * 実装は正規化（1/N² などの除算）を一切行いません。
 * </p>
 *
 * <pre>
 *   X[m][n] = Σ_i Σ_j x[i][j] · exp(sign · i·2π(m·i/rows + n·j/cols))
 * </pre>
 */
public interface FourierTransformBackend {

    /**
     * 指数の符号です。
     */
    enum ExponentSign {
        /**
         * exp(-i…)（一般的な「順変換」）です。
         */
        NEGATIVE,
        /**
         * exp(+i…)（一般的な「逆変換」、正規化なし）です。
         */
        POSITIVE
    }

    /**
     * 複素 2 次元配列をその場で変換します。
     *
     * <p>
     * 対応する大きさは rows ≥ 2 かつ cols ≥ 2 です。1×1 の変換は恒等写像なので、呼び出し側で扱います。
     * </p>
     *
     * @param interleaved 行優先の複素配列です（[rows][2·cols]、(実部, 虚部) の交互配置）
     * @param sign 指数の符号です
     * @throws IllegalArgumentException 配列の形が不正、または rows/cols が 2 未満の場合に発生します
     */
    void transform(double[][] interleaved, ExponentSign sign);
}
