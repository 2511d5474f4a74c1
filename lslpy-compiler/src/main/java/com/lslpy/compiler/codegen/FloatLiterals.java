package com.lslpy.compiler.codegen;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Locale;

/**
 * 32 位浮点常量的 Python 字面量编码
 *
 * <p>整数值直接写成 {@code N.0}（Python 的 double 能精确表示）；其余值写成
 * {@code bin2float('<提示>', '<十六进制>')}，由运行时按位还原，结果与源值逐位一致。</p>
 */
public final class FloatLiterals {

    private FloatLiterals() {}

    /** 按 JVM 所在平台的本机字节序编码 */
    public static String encode(float value) {
        return encode(value, ByteOrder.nativeOrder());
    }

    public static String encode(float value, ByteOrder order) {
        if (isIntegral(value)) {
            // -0.0 == 0.0，需要单独保留符号位
            if (value == 0.0f && Float.floatToRawIntBits(value) != 0) {
                return "-0.0";
            }
            return new BigDecimal(value).toBigInteger().toString() + ".0";
        }
        // 第一个参数只是方便阅读，运行时不解析
        return "bin2float('" + readableHint(value) + "', '" + toHex(value, order) + "')";
    }

    /**
     * 是否为可以按整数写出的值。NaN 与无穷大走按位编码。
     */
    public static boolean isIntegral(float value) {
        double d = value;
        return !Double.isInfinite(d) && Math.rint(d) == d;
    }

    /**
     * IEEE-754 位模式的 4 字节十六进制表示（小写，按给定字节序）
     */
    public static String toHex(float value, ByteOrder order) {
        byte[] bytes = ByteBuffer.allocate(4).order(order).putFloat(value).array();
        StringBuilder sb = new StringBuilder(8);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b & 0xff));
        }
        return sb.toString();
    }

    /** 与 C 的 {@code %f} 一致：六位小数 */
    static String readableHint(float value) {
        return String.format(Locale.ROOT, "%f", (double) value);
    }
}
