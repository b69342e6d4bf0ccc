package com.costsheet.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Money arithmetic on {@link BigDecimal} at two decimal places, rounding half up.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);

    private Money() {
    }

    /**
     * Normalizes an amount to money scale. Null becomes zero.
     *
     * @param amount amount, may be null
     * @return amount at scale 2
     */
    public static BigDecimal of(BigDecimal amount) {
        return amount == null ? ZERO : amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal of(String amount) {
        return of(new BigDecimal(amount));
    }

    public static BigDecimal add(BigDecimal a, BigDecimal b) {
        return of(a).add(of(b));
    }

    /**
     * Splits a pool into {@code parts} shares rounded to the cent.
     *
     * <p>The rounding remainder goes to the first share, so the shares always sum to the
     * pool exactly.
     *
     * @param pool amount to split
     * @param parts number of shares, at least 1
     * @return shares in order
     * @throws IllegalArgumentException if parts is less than 1
     */
    public static List<BigDecimal> split(BigDecimal pool, int parts) {
        if (parts < 1) {
            throw new IllegalArgumentException("parts must be at least 1: " + parts);
        }
        BigDecimal total = of(pool);
        BigDecimal share = total.divide(BigDecimal.valueOf(parts), SCALE, RoundingMode.HALF_UP);
        BigDecimal remainder = total.subtract(share.multiply(BigDecimal.valueOf(parts)));

        List<BigDecimal> shares = new ArrayList<>(Collections.nCopies(parts, share));
        shares.set(0, share.add(remainder));
        return shares;
    }
}
