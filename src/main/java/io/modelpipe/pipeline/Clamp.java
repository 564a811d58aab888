package io.modelpipe.pipeline;

import java.math.BigDecimal;
import java.math.BigInteger;

final class Clamp {
    private Clamp() {
    }

    /**
     * Clamps an integral {@code value} into {@code [min, max]}. Null, non-finite and non-integral values give
     * {@code fallback}.
     */
    static long integer(Number value, long fallback, long min, long max) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (!Double.isFinite(d) || d != Math.rint(d)) {
                return fallback;
            }
            if (d < min) {
                return min;
            }
            return d > max ? max : (long) d;
        }
        BigInteger big;
        if (value instanceof BigDecimal decimal) {
            if (decimal.stripTrailingZeros().scale() > 0) {
                return fallback;
            }
            big = decimal.toBigInteger();
        } else if (value instanceof BigInteger bigInteger) {
            big = bigInteger;
        } else {
            big = BigInteger.valueOf(value.longValue());
        }
        if (big.compareTo(BigInteger.valueOf(min)) < 0) {
            return min;
        }
        if (big.compareTo(BigInteger.valueOf(max)) > 0) {
            return max;
        }
        return big.longValue();
    }
}
