package com.stockanalyzer.backtester.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;

/**
 * Decision issued by a strategy for one bar.
 * <p>
 * For BUY a {@code null} fraction means "use the configured sizing policy". For SELL a
 * {@code null} fraction means the whole position. {@code strength} is the conviction of the
 * indicator signal behind the action, {@code null} for actions not derived from a signal.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Action {

    private static final Action HOLD = new Action(ActionType.HOLD, null, "", null);

    ActionType type;
    BigDecimal fraction;
    String reason;
    @With
    Double strength;

    public static Action hold() {
        return HOLD;
    }

    public static Action hold(String reason) {
        return new Action(ActionType.HOLD, null, reason, null);
    }

    public static Action buy(String reason) {
        return new Action(ActionType.BUY, null, reason, null);
    }

    public static Action buy(BigDecimal fraction, String reason) {
        return new Action(ActionType.BUY, checkFraction(fraction), reason, null);
    }

    public static Action sellAll(String reason) {
        return new Action(ActionType.SELL, null, reason, null);
    }

    public static Action sell(BigDecimal fraction, String reason) {
        return new Action(ActionType.SELL, checkFraction(fraction), reason, null);
    }

    public boolean isHold() {
        return type == ActionType.HOLD;
    }

    public boolean isSellAll() {
        return type == ActionType.SELL && fraction == null;
    }

    private static BigDecimal checkFraction(BigDecimal fraction) {
        if (fraction == null || fraction.signum() <= 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Action fraction must be in (0, 1], got " + fraction);
        }
        return fraction;
    }

    @Override
    public String toString() {
        return switch (type) {
            case HOLD -> "HOLD";
            case BUY -> fraction == null ? "BUY" : "BUY(" + fraction.toPlainString() + ")";
            case SELL -> fraction == null ? "SELL(ALL)" : "SELL(" + fraction.toPlainString() + ")";
        };
    }
}
