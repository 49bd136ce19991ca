package io.github.yok.phc.core.raster;

import io.github.yok.phc.core.exception.InvalidGeometryException;
import io.github.yok.phc.core.geometry.PhotonicCrystal;
import io.github.yok.phc.core.geometry.ShapeInCell;
import io.github.yok.phc.core.geometry.UnitCellBase;
import java.util.List;
import java.util.stream.IntStream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 単位胞の基底を誘電率グリッドに標本化するクラスです。
 *
 * <p>
 * 画素 (i, j) の中心は実空間の {@code x = (i - c)·a/N}、{@code y = (j - c)·a/N}（{@code c = (N-1)/2}）に対応し、
 * 単位胞の中心がグリッドの幾何学的中点に来ます。
 * </p>
 *
 * <p>
 * 各画素は、その中心を含む形状のうち列の最後のものの誘電率を取り、どれにも含まれなければ背景の誘電率を取ります。
 * 画素ごとに独立して決まるため、行単位で並列化しても結果は変わりません。
 * </p>
 *
 * <p>
 * 画素の写像は辺 a の正方形の単位胞を前提とするため、正方形でない単位胞（三角格子など）は扱いません。
 * </p>
 */
@Getter
@Slf4j
public final class UnitCellRasterizer {

    /**
     * 行単位で並列に標本化するかどうかです。
     */
    private final boolean parallel;

    /**
     * ラスタライザを生成します。
     *
     * @param parallel 行単位で並列に標本化する場合は true です
     */
    public UnitCellRasterizer(boolean parallel) {
        this.parallel = parallel;
    }

    /**
     * 結晶の単位胞を N×N の誘電率グリッドに標本化します。
     *
     * @param crystal フォトニック結晶です（null 不可）
     * @param gridSize 一辺の画素数 N です（1 以上）
     * @return 誘電率グリッドです
     * @throws IllegalArgumentException crystal が null の場合に発生します
     * @throws InvalidGeometryException 単位胞が正方形でない、または gridSize が不正な場合に発生します
     * @throws io.github.yok.phc.core.exception.UnsupportedShapeException 未対応の形状を含む場合に発生します
     */
    public DielectricGrid generateGrid(PhotonicCrystal crystal, int gridSize) {
        if (crystal == null) {
            throw new IllegalArgumentException("crystal は null 不可です");
        }
        if (!crystal.getLattice().isSquareCell()) {
            throw new InvalidGeometryException("正方形でない単位胞は標本化できません: "
                    + crystal.getLattice());
        }
        return generateGrid(crystal.getBase(), crystal.getLattice().latticeConstant(), gridSize);
    }

    /**
     * 基底を N×N の誘電率グリッドに標本化します。
     *
     * @param base 単位胞の基底です（null 不可、変更しません）
     * @param latticeConstant 格子定数 a です（正の有限値）
     * @param gridSize 一辺の画素数 N です（1 以上）
     * @return 誘電率グリッドです
     * @throws IllegalArgumentException base が null の場合に発生します
     * @throws InvalidGeometryException latticeConstant または gridSize が不正な場合に発生します
     * @throws io.github.yok.phc.core.exception.UnsupportedShapeException 未対応の形状を含む場合に発生します
     */
    public DielectricGrid generateGrid(UnitCellBase base, double latticeConstant, int gridSize) {
        if (base == null) {
            throw new IllegalArgumentException("base は null 不可です");
        }
        if (gridSize <= 0) {
            throw new InvalidGeometryException("gridSize は 1 以上が必要です: " + gridSize);
        }
        if (!(latticeConstant > 0.0) || !Double.isFinite(latticeConstant)) {
            throw new InvalidGeometryException("格子定数は正の有限値である必要があります: " + latticeConstant);
        }

        long t0 = System.nanoTime();

        // 描画前にすべての形状を領域へ解決する（未対応形状で途中まで描いた結果を返さない）
        List<ShapeInCell> shapes = base.getShapes();
        int shapeCount = shapes.size();
        ShapeRegion[] regions = new ShapeRegion[shapeCount];
        double[] epsilons = new double[shapeCount];
        for (int k = 0; k < shapeCount; k++) {
            ShapeInCell s = shapes.get(k);
            regions[k] = ShapeRegions.of(s.getShape(), s.getCenterS() * latticeConstant,
                    s.getCenterT() * latticeConstant);
            epsilons[k] = s.getMaterial().inPlaneEpsilon();
        }
        double background = base.getBackgroundMaterial().inPlaneEpsilon();

        double[][] values = new double[gridSize][gridSize];
        double pitch = latticeConstant / gridSize;
        double c = (gridSize - 1) / 2.0;

        IntStream rows = IntStream.range(0, gridSize);
        if (parallel) {
            rows = rows.parallel();
        }
        rows.forEach(i -> fillRow(values[i], (i - c) * pitch, c, pitch, regions, epsilons,
                background));

        DielectricGrid grid = DielectricGrid.of(values);

        if (log.isDebugEnabled()) {
            long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
            log.debug("誘電率グリッドを生成しました。N={}、形状数={}、a={}、並列={}、所要時間={}ms", gridSize,
                    shapeCount, latticeConstant, parallel, elapsedMs);
        }
        return grid;
    }

    /**
     * 1 行分（x 固定）の画素を埋めます。
     *
     * @param row 書き込み先の行です
     * @param x 行に対応する実空間 x 座標です
     * @param c 画素中心のオフセット (N-1)/2 です
     * @param pitch 画素間隔 a/N です
     * @param regions 形状領域（描画順）です
     * @param epsilons 形状ごとの誘電率です
     * @param background 背景の誘電率です
     */
    private static void fillRow(double[] row, double x, double c, double pitch,
            ShapeRegion[] regions, double[] epsilons, double background) {
        for (int j = 0; j < row.length; j++) {
            double y = (j - c) * pitch;
            double value = background;
            // 末尾から走査し、最初に含む形状が最優先（最後に描かれた形状）
            for (int k = regions.length - 1; k >= 0; k--) {
                if (regions[k].contains(x, y)) {
                    value = epsilons[k];
                    break;
                }
            }
            row[j] = value;
        }
    }
}
