package com.learn.pairexchange.util;

import java.math.BigInteger;

/**
 * Checked arithmetic on {@code long} values interpreted as unsigned 64-bit integers.
 * Every operation throws {@link ArithmeticException} instead of wrapping.
 */
public class UnsignedMath {
    public static final BigInteger MAX_BIG_VALUE = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    public static long addExact(long a, long b) {
        long r = a + b;
        if(Long.compareUnsigned(r, a) < 0)
            throw new ArithmeticException("uint64 overflow: " + toString(a) + " + " + toString(b));
        return r;
    }

    public static long subtractExact(long a, long b) {
        if(Long.compareUnsigned(a, b) < 0)
            throw new ArithmeticException("uint64 underflow: " + toString(a) + " - " + toString(b));
        return a - b;
    }

    public static long multiplyExact(long a, long b) {
        // 无符号乘积的高 64 位
        long high = Math.multiplyHigh(a, b) + ((a >> 63) & b) + ((b >> 63) & a);
        if(high != 0)
            throw new ArithmeticException("uint64 overflow: " + toString(a) + " * " + toString(b));
        return a * b;
    }

    public static long divide(long dividend, long divisor) {
        return Long.divideUnsigned(dividend, divisor);
    }

    public static long min(long a, long b) {
        return Long.compareUnsigned(a, b) <= 0 ? a : b;
    }

    public static int compare(long a, long b) {
        return Long.compareUnsigned(a, b);
    }

    public static String toString(long value) {
        return Long.toUnsignedString(value);
    }

    public static BigInteger toBigInteger(long value) {
        return new BigInteger(Long.toUnsignedString(value));
    }

    public static long fromBigInteger(BigInteger value) {
        if(value.signum() < 0 || value.compareTo(MAX_BIG_VALUE) > 0)
            throw new ArithmeticException("value out of uint64 range: " + value);
        return value.longValue();
    }
}
