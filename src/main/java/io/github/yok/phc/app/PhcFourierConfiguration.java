package io.github.yok.phc.app;

import io.github.yok.phc.core.UnitCellFourier;
import io.github.yok.phc.core.fourier.FourierEngine;
import io.github.yok.phc.core.fourier.FourierTable;
import io.github.yok.phc.core.fourier.FourierTransformBackend;
import io.github.yok.phc.core.fourier.JTransformsFourierBackend;
import io.github.yok.phc.core.geometry.PhotonicCrystal;
import io.github.yok.phc.core.geometry.UnitCellBase;
import io.github.yok.phc.core.lattice.Lattice;
import io.github.yok.phc.core.lattice.SquareLattice2D;
import io.github.yok.phc.core.lattice.TriangularLattice2D;
import io.github.yok.phc.core.material.Material;
import io.github.yok.phc.core.raster.UnitCellRasterizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * ラスタライザ + JTransforms によるフーリエ係数計算の Bean 定義を行う設定クラスです。
 *
 * <p>
 * 既定の結晶として、設定された格子の中心に円形の穴を 1 つ持つ単位胞を設定値から組み立てます。
 * 係数表の計算は正方格子のみ対応です。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class PhcFourierConfiguration {

    /**
     * phc-fourier の設定値（phc.*）です。
     */
    private final PhcProperties p;

    /**
     * 設定された種類の格子を生成します。
     *
     * @return 格子です
     */
    @Bean
    public Lattice lattice() {
        double a = p.getLattice().getConstant();
        switch (p.getLattice().getType()) {
            case TRIANGULAR:
                return new TriangularLattice2D(a);
            case SQUARE:
            default:
                return new SquareLattice2D(a);
        }
    }

    /**
     * 既定のフォトニック結晶（中心に円形の穴）を生成します。
     *
     * @param lattice 格子です
     * @return フォトニック結晶です
     */
    @Bean
    public PhotonicCrystal photonicCrystal(Lattice lattice) {
        log.info("設定値: {}", p.toMultilineString());
        PhcProperties.Material m = p.getMaterial();
        UnitCellBase base = UnitCellBase.fromSimpleCircle(p.getHole().getFillingFactor(), lattice,
                Material.ofEpsilon(m.getEpsilonHole()), Material.ofEpsilon(m.getEpsilonBackground()));
        return new PhotonicCrystal(lattice, base);
    }

    /**
     * ラスタライザを生成します。
     *
     * @return ラスタライザです
     */
    @Bean
    public UnitCellRasterizer unitCellRasterizer() {
        return new UnitCellRasterizer(p.getGrid().isParallel());
    }

    /**
     * 2 次元 DFT バックエンドを生成します。
     *
     * @return DFT バックエンドです
     */
    @Bean
    public FourierTransformBackend fourierTransformBackend() {
        return new JTransformsFourierBackend();
    }

    /**
     * フーリエ係数計算を生成します。
     *
     * @param backend DFT バックエンドです
     * @return フーリエ係数計算です
     */
    @Bean
    public FourierEngine fourierEngine(FourierTransformBackend backend) {
        return new FourierEngine(backend);
    }

    /**
     * ラスタライズとフーリエ係数計算をまとめた窓口を生成します。
     *
     * @param rasterizer ラスタライザです
     * @param engine フーリエ係数計算です
     * @return 窓口です
     */
    @Bean
    public UnitCellFourier unitCellFourier(UnitCellRasterizer rasterizer, FourierEngine engine) {
        return new UnitCellFourier(rasterizer, engine);
    }

    /**
     * 既定の結晶について、設定された画素数でフーリエ係数表を計算します。
     *
     * <p>
     * 初回参照時に一度だけ計算します。
     * </p>
     *
     * @param unitCellFourier 窓口です
     * @param crystal 既定のフォトニック結晶です
     * @return 係数表です
     */
    @Bean
    @Lazy
    public FourierTable defaultFourierTable(UnitCellFourier unitCellFourier,
            PhotonicCrystal crystal) {
        return unitCellFourier.calculateAllXi(crystal, p.getGrid().getSize());
    }
}
