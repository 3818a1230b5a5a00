package com.signalbot.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final int PNL_SCALE = 8;
    public static final int QUANTITY_SCALE = 10;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);

    private MoneyUtils() {
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal pnl(BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO.setScale(PNL_SCALE, RoundingMode.HALF_UP);
        }
        return value.setScale(PNL_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal quantity(BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO.setScale(QUANTITY_SCALE, RoundingMode.HALF_UP);
        }
        return value.setScale(QUANTITY_SCALE, RoundingMode.HALF_DOWN);
    }

    /**
     * Base-currency quantity bought by {@code usd} at {@code price}, rounded down so the
     * order never exceeds the requested notional.
     */
    public static BigDecimal toBaseQuantity(BigDecimal usd, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive: " + price);
        }
        return usd.divide(price, QUANTITY_SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal max(BigDecimal left, BigDecimal right) {
        return left.compareTo(right) >= 0 ? left : right;
    }

    public static BigDecimal min(BigDecimal left, BigDecimal right) {
        return left.compareTo(right) <= 0 ? left : right;
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
