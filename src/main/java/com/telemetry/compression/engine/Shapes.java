package com.telemetry.compression.engine;

/**
 * 窗口数值形状检查
 */
final class Shapes {

    private Shapes() {}

    static boolean sameShape(double[][] a, double[][] b) {
        return a.length == b.length && a.length > 0 && a[0].length == b[0].length;
    }

    static void requireSameShape(double[][] a, double[][] b) {
        if (!sameShape(a, b)) {
            throw new IllegalArgumentException("Window shapes differ: " + describe(a) + " vs " + describe(b));
        }
    }

    private static String describe(double[][] values) {
        return values.length + "x" + (values.length > 0 ? values[0].length : 0);
    }
}
