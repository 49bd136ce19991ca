package io.github.yok.phc.core.raster;

import io.github.yok.phc.core.exception.UnsupportedShapeException;
import io.github.yok.phc.core.geometry.Circle;
import io.github.yok.phc.core.geometry.EquilateralTriangle;
import io.github.yok.phc.core.geometry.HoleShape;
import io.github.yok.phc.core.geometry.RightAngledIsosceles;

/**
 * 形状記述子を、実空間に配置した {@link ShapeRegion} に変換するクラスです。
 *
 * <p>
 * 多角形は配置中心まわりに -θ 回転した点を、回転 0 度の基準多角形に対して判定します。
 * </p>
 */
public final class ShapeRegions {

    private static final double SQRT3 = Math.sqrt(3.0);

    private ShapeRegions() {
    }

    /**
     * 形状を中心 (cx, cy) に配置した領域を返します。
     *
     * @param shape 形状です（null 不可）
     * @param cx 中心の実空間 x 座標です
     * @param cy 中心の実空間 y 座標です
     * @return 領域です
     * @throws IllegalArgumentException shape が null の場合に発生します
     * @throws UnsupportedShapeException ラスタライズ規則のない形状の場合に発生します
     */
    public static ShapeRegion of(HoleShape shape, double cx, double cy) {
        if (shape == null) {
            throw new IllegalArgumentException("shape は null 不可です");
        }
        if (shape instanceof Circle) {
            double r = ((Circle) shape).getRadius();
            return new CircleRegion(cx, cy, r * r);
        }
        if (shape instanceof EquilateralTriangle) {
            EquilateralTriangle t = (EquilateralTriangle) shape;
            double s = t.getSide();
            double h = s * SQRT3 / 2.0;
            double[] xs = {-s / 2.0, s / 2.0, 0.0};
            double[] ys = {-h / 3.0, -h / 3.0, 2.0 * h / 3.0};
            return new ConvexPolygonRegion(cx, cy, t.getRotationDegrees(), xs, ys);
        }
        if (shape instanceof RightAngledIsosceles) {
            RightAngledIsosceles t = (RightAngledIsosceles) shape;
            double l = t.getLeg();
            double[] xs = {-l / 3.0, 2.0 * l / 3.0, -l / 3.0};
            double[] ys = {-l / 3.0, -l / 3.0, 2.0 * l / 3.0};
            return new ConvexPolygonRegion(cx, cy, t.getRotationDegrees(), xs, ys);
        }
        throw new UnsupportedShapeException(
                "ラスタライズ規則が定義されていない形状です: " + shape.kind() + "（"
                        + shape.getClass().getName() + "）");
    }

    /**
     * 円の領域です。距離の二乗で判定します。
     */
    static final class CircleRegion implements ShapeRegion {

        private final double cx;

        private final double cy;

        private final double radiusSquared;

        CircleRegion(double cx, double cy, double radiusSquared) {
            this.cx = cx;
            this.cy = cy;
            this.radiusSquared = radiusSquared;
        }

        @Override
        public boolean contains(double x, double y) {
            double dx = x - cx;
            double dy = y - cy;
            return dx * dx + dy * dy <= radiusSquared;
        }
    }

    /**
     * 回転した凸多角形の領域です。
     *
     * <p>
     * 頂点は反時計回りで与え、各辺の左側の半平面の共通部分を内部とします。
     * </p>
     */
    static final class ConvexPolygonRegion implements ShapeRegion {

        private final double cx;

        private final double cy;

        private final double cos;

        private final double sin;

        private final double[] xs;

        private final double[] ys;

        ConvexPolygonRegion(double cx, double cy, double rotationDegrees, double[] xs,
                double[] ys) {
            double theta = Math.toRadians(rotationDegrees);
            this.cx = cx;
            this.cy = cy;
            this.cos = Math.cos(theta);
            this.sin = Math.sin(theta);
            this.xs = xs.clone();
            this.ys = ys.clone();
        }

        @Override
        public boolean contains(double x, double y) {
            double dx = x - cx;
            double dy = y - cy;

            // -θ 回転で基準姿勢へ戻す
            double u = cos * dx + sin * dy;
            double v = -sin * dx + cos * dy;

            int n = xs.length;
            for (int k = 0; k < n; k++) {
                int next = (k + 1) % n;
                double ex = xs[next] - xs[k];
                double ey = ys[next] - ys[k];
                double cross = ex * (v - ys[k]) - ey * (u - xs[k]);
                if (cross < 0.0) {
                    return false;
                }
            }
            return true;
        }
    }
}
