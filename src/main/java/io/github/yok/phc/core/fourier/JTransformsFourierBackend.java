package io.github.yok.phc.core.fourier;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jtransforms.fft.DoubleFFT_2D;

/**
 * JTransforms を用いて 2 次元複素 DFT を行うクラスです。
 *
 * <p>
 * JTransforms の {@code complexForward} は exp(-i…)、{@code complexInverse} は exp(+i…) の規約です。
 * 逆変換は {@code scale = false} で呼び、正規化は呼び出し側に委ねます。
 * </p>
 */
public final class JTransformsFourierBackend implements FourierTransformBackend {

    /**
     * サイズ（rows x cols）ごとの変換プランです。
     */
    private final Map<String, DoubleFFT_2D> plans = new ConcurrentHashMap<>();

    /**
     * 複素 2 次元配列をその場で変換します。
     *
     * @param interleaved 行優先の複素配列です（[rows][2·cols]）
     * @param sign 指数の符号です（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    @Override
    public void transform(double[][] interleaved, ExponentSign sign) {
        if (interleaved == null || interleaved.length == 0) {
            throw new IllegalArgumentException("interleaved は 1 行以上が必要です");
        }
        if (sign == null) {
            throw new IllegalArgumentException("sign は null 不可です");
        }
        int rows = interleaved.length;
        int width = interleaved[0].length;
        if (width == 0 || width % 2 != 0) {
            throw new IllegalArgumentException("interleaved の列数は正の偶数が必要です: " + width);
        }
        for (int r = 1; r < rows; r++) {
            if (interleaved[r].length != width) {
                throw new IllegalArgumentException("interleaved の列数が行によって異なります: row=" + r);
            }
        }
        int cols = width / 2;
        if (rows < 2 || cols < 2) {
            throw new IllegalArgumentException("DFT の大きさは 2×2 以上が必要です: " + rows + "x" + cols);
        }

        DoubleFFT_2D fft = plans.computeIfAbsent(rows + "x" + cols,
                k -> new DoubleFFT_2D(rows, cols));
        if (sign == ExponentSign.POSITIVE) {
            fft.complexInverse(interleaved, false);
        } else {
            fft.complexForward(interleaved);
        }
    }
}
