package io.github.yok.phc.core;

import io.github.yok.phc.core.fourier.FourierEngine;
import io.github.yok.phc.core.fourier.FourierTable;
import io.github.yok.phc.core.geometry.PhotonicCrystal;
import io.github.yok.phc.core.raster.DielectricGrid;
import io.github.yok.phc.core.raster.UnitCellRasterizer;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * フォトニック結晶の単位胞からフーリエ係数を求める窓口クラスです。
 *
 * <p>
 * ラスタライズ → フーリエ変換の順に実行し、両者の間で受け渡すのは誘電率グリッドのみです。
 * </p>
 */
@Getter
@Slf4j
public final class UnitCellFourier {

    /**
     * ラスタライザです。
     */
    private final UnitCellRasterizer rasterizer;

    /**
     * フーリエ係数計算です。
     */
    private final FourierEngine engine;

    /**
     * 窓口クラスを生成します。
     *
     * @param rasterizer ラスタライザです（null 不可）
     * @param engine フーリエ係数計算です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public UnitCellFourier(UnitCellRasterizer rasterizer, FourierEngine engine) {
        if (rasterizer == null) {
            throw new IllegalArgumentException("rasterizer は null 不可です");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine は null 不可です");
        }
        this.rasterizer = rasterizer;
        this.engine = engine;
    }

    /**
     * 結晶の単位胞を誘電率グリッドに標本化します。
     *
     * @param crystal フォトニック結晶です（null 不可）
     * @param gridSize 一辺の画素数 N です
     * @return 誘電率グリッドです
     * @throws io.github.yok.phc.core.exception.InvalidGeometryException 単位胞が正方形でない場合などに発生します
     */
    public DielectricGrid generateGrid(PhotonicCrystal crystal, int gridSize) {
        return rasterizer.generateGrid(crystal, gridSize);
    }

    /**
     * 結晶の単位胞から全フーリエ係数を計算します。
     *
     * @param crystal フォトニック結晶です（null 不可）
     * @param gridSize 一辺の画素数 N です
     * @return 中央寄せ済みの係数表です
     */
    public FourierTable calculateAllXi(PhotonicCrystal crystal, int gridSize) {
        long t0 = System.nanoTime();

        DielectricGrid grid = generateGrid(crystal, gridSize);
        FourierTable table = engine.calculateAllXi(grid, gridSize);

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("単位胞のフーリエ係数を計算しました。N={}、形状数={}、ξ(0,0)={}、所要時間={}ms", gridSize,
                crystal.getBase().getShapes().size(), fmt5(table.zeroOrder().real), elapsedMs);
        return table;
    }

    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
