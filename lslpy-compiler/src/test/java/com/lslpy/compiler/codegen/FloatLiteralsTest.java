package com.lslpy.compiler.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * FloatLiterals 单元测试
 */
class FloatLiteralsTest {

    private static final Pattern BIN2FLOAT = Pattern.compile("bin2float\\('([^']*)', '([0-9a-f]{8})'\\)");

    /** 模拟运行时的 bin2float：按给定字节序还原位模式 */
    private static float decode(String literal, ByteOrder order) {
        Matcher m = BIN2FLOAT.matcher(literal);
        assertTrue(m.matches(), "不是 bin2float 形式: " + literal);
        String hex = m.group(2);
        byte[] bytes = new byte[4];
        for (int i = 0; i < 4; i++) {
            bytes[i] = (byte) Integer.parseInt(hex.substring(i * 2, i * 2 + 2), 16);
        }
        return ByteBuffer.wrap(bytes).order(order).getFloat();
    }

    @Nested
    @DisplayName("整数值")
    class IntegralTests {

        @Test
        @DisplayName("整数值写成 N.0")
        void testIntegral() {
            assertEquals("2.0", FloatLiterals.encode(2.0f));
            assertEquals("-3.0", FloatLiterals.encode(-3.0f));
            assertEquals("0.0", FloatLiterals.encode(0.0f));
        }

        @Test
        @DisplayName("负零保留符号")
        void testNegativeZero() {
            assertEquals("-0.0", FloatLiterals.encode(-0.0f));
        }

        @Test
        @DisplayName("超出 long 范围的大数仍精确")
        void testHugeValues() {
            assertEquals("10000000000.0", FloatLiterals.encode(1.0e10f));
            assertEquals("16777216.0", FloatLiterals.encode(16777217f));
            String max = FloatLiterals.encode(Float.MAX_VALUE);
            assertEquals(new java.math.BigDecimal(Float.MAX_VALUE).toBigInteger() + ".0", max);
            assertEquals(Float.MAX_VALUE, (float) Double.parseDouble(max));
        }

        @Test
        @DisplayName("十进制形式解析回来与原值一致")
        void testRoundTrip() {
            float[] samples = {1f, -1f, 255f, 1024f, -65536f, 8388608f, 3.0e20f};
            for (float f : samples) {
                String literal = FloatLiterals.encode(f);
                assertThat(literal).endsWith(".0");
                assertEquals(Float.floatToRawIntBits(f), Float.floatToRawIntBits((float) Double.parseDouble(literal)));
            }
        }
    }

    @Nested
    @DisplayName("按位编码")
    class BitPatternTests {

        @Test
        @DisplayName("0.1 的小端与大端编码")
        void testByteOrders() {
            assertEquals("bin2float('0.100000', 'cdcccc3d')", FloatLiterals.encode(0.1f, ByteOrder.LITTLE_ENDIAN));
            assertEquals("bin2float('0.100000', '3dcccccd')", FloatLiterals.encode(0.1f, ByteOrder.BIG_ENDIAN));
        }

        @Test
        @DisplayName("默认使用本机字节序")
        void testNativeOrder() {
            assertEquals(FloatLiterals.encode(1.5f, ByteOrder.nativeOrder()), FloatLiterals.encode(1.5f));
        }

        @Test
        @DisplayName("非整数值逐位还原")
        void testBitExact() {
            float[] samples = {0.1f, -2.5f, 3.14159265f, 1.0e-30f, Float.MIN_VALUE, -123456.79f, 0.333333343f};
            for (ByteOrder order : new ByteOrder[]{ByteOrder.LITTLE_ENDIAN, ByteOrder.BIG_ENDIAN}) {
                for (float f : samples) {
                    float decoded = decode(FloatLiterals.encode(f, order), order);
                    assertEquals(Float.floatToRawIntBits(f), Float.floatToRawIntBits(decoded), "value " + f);
                }
            }
        }

        @Test
        @DisplayName("NaN 与无穷大走按位编码")
        void testNonFinite() {
            assertEquals("bin2float('Infinity', '7f800000')",
                    FloatLiterals.encode(Float.POSITIVE_INFINITY, ByteOrder.BIG_ENDIAN));
            assertEquals("bin2float('-Infinity', 'ff800000')",
                    FloatLiterals.encode(Float.NEGATIVE_INFINITY, ByteOrder.BIG_ENDIAN));
            float nan = decode(FloatLiterals.encode(Float.NaN, ByteOrder.BIG_ENDIAN), ByteOrder.BIG_ENDIAN);
            assertTrue(Float.isNaN(nan));
        }

        @Test
        @DisplayName("整数判定")
        void testIsIntegral() {
            assertTrue(FloatLiterals.isIntegral(7f));
            assertTrue(FloatLiterals.isIntegral(-0.0f));
            assertFalse(FloatLiterals.isIntegral(7.5f));
            assertFalse(FloatLiterals.isIntegral(Float.NaN));
            assertFalse(FloatLiterals.isIntegral(Float.POSITIVE_INFINITY));
        }
    }
}
