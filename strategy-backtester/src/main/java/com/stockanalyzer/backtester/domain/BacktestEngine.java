package com.stockanalyzer.backtester.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Core backtesting engine that executes a strategy against a bar series.
 * <p>
 * Bars are processed strictly in order. The decision taken on bar {@code t} is filled on
 * bar {@code t + 1} according to the configured {@link FillPolicy}. The engine keeps no
 * state between runs, so one instance can serve concurrent runs.
 */
@Slf4j
public class BacktestEngine {

    /**
     * Run a backtest with the given parameters.
     *
     * @throws BacktestConfigurationException if the configuration or strategy is unusable
     * @throws DataIntegrityException         if the bar sequence is malformed
     */
    public BacktestResult runBacktest(Strategy strategy, List<Bar> bars, BacktestConfig config) {
        if (strategy == null) {
            throw new BacktestConfigurationException("Strategy is required");
        }
        if (config == null) {
            throw new BacktestConfigurationException("Backtest configuration is required");
        }
        config.validate();
        validateBars(bars);
        validateIndicators(strategy, bars);

        log.info("Starting backtest - Strategy: {}, Bars: {}, Fill: {}, Sizing: {}, Costs: {}",
                strategy.getName(), bars.size(), config.getFillPolicy(), config.getSizingPolicy(),
                config.getCostModel());

        BacktestResult result = new Run(strategy, List.copyOf(bars), config).execute();

        EquityPoint last = result.getEquityCurve().get(result.getEquityCurve().size() - 1);
        log.info("Backtest completed - Strategy: {}, Trades: {}, Rejected: {}, Final equity: {}",
                strategy.getName(), result.getTradeLog().getTrades().size(),
                result.getTradeLog().getRejections().size(), last.getEquity());
        return result;
    }

    static void validateBars(List<Bar> bars) {
        if (bars == null || bars.isEmpty()) {
            throw new DataIntegrityException("Bar sequence is empty");
        }
        Bar previous = null;
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null) {
                throw new DataIntegrityException("Bar " + i + " is null");
            }
            if (bar.getDate() == null) {
                throw new DataIntegrityException("Bar " + i + " has no date");
            }
            requirePositive(bar.getOpen(), "open", i);
            requirePositive(bar.getHigh(), "high", i);
            requirePositive(bar.getLow(), "low", i);
            requirePositive(bar.getClose(), "close", i);
            if (bar.getHigh().compareTo(bar.getLow()) < 0) {
                throw new DataIntegrityException("Bar " + i + " (" + bar.getDate() + ") has high below low");
            }
            if (bar.getVolume() != null && bar.getVolume() < 0) {
                throw new DataIntegrityException("Bar " + i + " (" + bar.getDate() + ") has negative volume");
            }
            if (previous != null && !bar.getDate().isAfter(previous.getDate())) {
                throw new DataIntegrityException("Bar dates must be strictly increasing: bar " + i + " ("
                        + bar.getDate() + ") does not follow " + previous.getDate());
            }
            previous = bar;
        }
    }

    static void validateIndicators(Strategy strategy, List<Bar> bars) {
        for (String indicator : strategy.requiredIndicators()) {
            for (int i = 0; i < bars.size(); i++) {
                if (!bars.get(i).hasIndicator(indicator)) {
                    throw new BacktestConfigurationException("Strategy " + strategy.getName()
                            + " requires indicator '" + indicator + "' but bar " + i + " ("
                            + bars.get(i).getDate() + ") does not carry it");
                }
            }
        }
    }

    private static void requirePositive(BigDecimal price, String field, int index) {
        if (price == null) {
            throw new DataIntegrityException("Bar " + index + " has no " + field + " price");
        }
        if (price.signum() <= 0) {
            throw new DataIntegrityException("Bar " + index + " has non-positive " + field + " price: " + price);
        }
    }

    /**
     * State of a single run. Created per call, never shared.
     */
    private static final class Run {

        private final Strategy strategy;
        private final List<Bar> bars;
        private final BacktestConfig config;
        private final PortfolioState portfolio;
        private final TradeLog tradeLog = new TradeLog();
        private final List<EquityPoint> equityCurve;

        private PendingOrder pending;

        Run(Strategy strategy, List<Bar> bars, BacktestConfig config) {
            this.strategy = strategy;
            this.bars = bars;
            this.config = config;
            this.portfolio = new PortfolioState(config.getInitialCash());
            this.equityCurve = new ArrayList<>(bars.size());
        }

        BacktestResult execute() {
            int lastIndex = bars.size() - 1;

            for (int t = 0; t <= lastIndex; t++) {
                Bar bar = bars.get(t);

                if (pending != null) {
                    PendingOrder order = pending;
                    pending = null;
                    fill(order, t, bar);
                }

                Action action = strategy.decide(BarHistory.upTo(bars, t), portfolio.snapshot());
                if (action == null) {
                    throw new IllegalStateException("Strategy " + strategy.getName()
                            + " returned no action for bar " + t);
                }
                if (!action.isHold()) {
                    pending = accept(action, t, bar, t == lastIndex);
                }

                if (t == lastIndex && config.isCloseAtEnd() && !portfolio.isFlat()) {
                    closeAtEnd(t, bar);
                }

                equityCurve.add(EquityPoint.builder()
                        .barIndex(t)
                        .date(bar.getDate())
                        .close(bar.getClose())
                        .cash(portfolio.getCash())
                        .positionQuantity(portfolio.getPositionQuantity())
                        .equity(portfolio.getEquity(bar.getClose()))
                        .build());
            }

            return BacktestResult.builder()
                    .strategyName(strategy.getName())
                    .config(config)
                    .barCount(bars.size())
                    .tradeLog(tradeLog)
                    .equityCurve(Collections.unmodifiableList(equityCurve))
                    .finalPortfolio(portfolio.snapshot())
                    .build();
        }

        /**
         * First-stage check on the signal bar. Returns the order to fill on the next bar,
         * or {@code null} when the action was rejected.
         */
        private PendingOrder accept(Action action, int t, Bar bar, boolean lastBar) {
            if (action.getType() == ActionType.SELL && portfolio.isFlat()) {
                reject(action, t, bar, RejectionReason.NO_POSITION, "no open position to sell");
                return null;
            }
            if (action.getType() == ActionType.BUY && portfolio.getCash().signum() <= 0) {
                reject(action, t, bar, RejectionReason.INSUFFICIENT_CASH, "no cash available");
                return null;
            }
            if (lastBar) {
                reject(action, t, bar, RejectionReason.NO_FILL_BAR, "signal on the final bar cannot be filled");
                return null;
            }
            return new PendingOrder(action, t);
        }

        private void fill(PendingOrder order, int t, Bar bar) {
            BigDecimal price = config.getFillPolicy() == FillPolicy.NEXT_OPEN ? bar.getOpen() : bar.getClose();
            if (order.action.getType() == ActionType.BUY) {
                fillBuy(order, t, bar, price);
            } else {
                fillSell(order.action, order.signalIndex, t, bar, price);
            }
        }

        private void fillBuy(PendingOrder order, int t, Bar bar, BigDecimal price) {
            Action action = order.action;
            long quantity;

            long headroom = Long.MAX_VALUE - portfolio.getPositionQuantity();

            if (config.getSizingPolicy() == SizingPolicy.FIXED_QUANTITY && action.getFraction() == null) {
                quantity = config.getFixedQuantity();
                if (quantity > headroom) {
                    reject(action, t, bar, RejectionReason.POSITION_LIMIT,
                            quantity + " more shares would overflow the position of " + portfolio.getPositionQuantity());
                    return;
                }
                BigDecimal required = totalBuyCost(price, BigDecimal.valueOf(quantity));
                if (required.compareTo(portfolio.getCash()) > 0) {
                    reject(action, t, bar, RejectionReason.INSUFFICIENT_CASH,
                            "need " + required + " for " + quantity + " shares, have " + portfolio.getCash());
                    return;
                }
            } else {
                BigDecimal budget = portfolio.getCash().multiply(buyFraction(action));
                BigDecimal affordable = affordableQuantity(price, budget);
                if (affordable.signum() <= 0) {
                    reject(action, t, bar, RejectionReason.INSUFFICIENT_CASH,
                            "budget " + budget.setScale(2, RoundingMode.DOWN) + " buys no share at " + price);
                    return;
                }
                if (affordable.compareTo(BigDecimal.valueOf(headroom)) > 0) {
                    if (headroom == 0) {
                        reject(action, t, bar, RejectionReason.POSITION_LIMIT,
                                "position already holds the maximum of " + Long.MAX_VALUE + " shares");
                        return;
                    }
                    log.warn("Capping BUY on bar {} at {} shares, budget covers {}", t, headroom, affordable);
                    quantity = headroom;
                } else {
                    quantity = affordable.longValueExact();
                }
            }

            BigDecimal cost = config.costOf(price.multiply(BigDecimal.valueOf(quantity)));
            portfolio.applyBuy(t, quantity, price, cost);

            Trade trade = Trade.builder()
                    .signalBarIndex(order.signalIndex)
                    .barIndex(t)
                    .date(bar.getDate())
                    .type(Trade.TradeType.BUY)
                    .quantity(quantity)
                    .price(price)
                    .cost(cost)
                    .cashAfter(portfolio.getCash())
                    .reason(action.getReason())
                    .signalStrength(action.getStrength())
                    .build();
            tradeLog.record(trade);

            log.debug("BUY {} shares at {} on {} (cost: {}, cash: {})",
                    quantity, price, bar.getDate(), cost, portfolio.getCash());
        }

        private void fillSell(Action action, int signalIndex, int t, Bar bar, BigDecimal price) {
            long position = portfolio.getPositionQuantity();
            if (position == 0) {
                reject(action, t, bar, RejectionReason.NO_POSITION, "no open position to sell");
                return;
            }

            long quantity = action.isSellAll()
                    ? position
                    : BigDecimal.valueOf(position).multiply(action.getFraction())
                            .setScale(0, RoundingMode.DOWN).longValue();
            if (quantity <= 0) {
                reject(action, t, bar, RejectionReason.ZERO_QUANTITY,
                        "fraction " + action.getFraction() + " of " + position + " shares rounds to zero");
                return;
            }

            BigDecimal notional = price.multiply(BigDecimal.valueOf(quantity));
            BigDecimal cost = config.costOf(notional);
            if (portfolio.getCash().add(notional).subtract(cost).signum() < 0) {
                reject(action, t, bar, RejectionReason.INSUFFICIENT_CASH,
                        "cost " + cost + " exceeds proceeds " + notional + " plus cash");
                return;
            }

            BigDecimal entryPrice = portfolio.getAverageEntryPrice();
            Integer entryIndex = portfolio.getEntryBarIndex();
            BigDecimal entryCost = portfolio.applySell(quantity, price, cost);

            BigDecimal realizedPnl = price.subtract(entryPrice)
                    .multiply(BigDecimal.valueOf(quantity))
                    .subtract(cost)
                    .subtract(entryCost)
                    .setScale(4, RoundingMode.HALF_UP);
            BigDecimal basis = entryPrice.multiply(BigDecimal.valueOf(quantity)).add(entryCost);
            BigDecimal realizedPnlPct = basis.signum() == 0 ? null
                    : realizedPnl.divide(basis, 6, RoundingMode.HALF_UP)
                            .multiply(BigDecimal.valueOf(100))
                            .setScale(4, RoundingMode.HALF_UP);

            Trade trade = Trade.builder()
                    .signalBarIndex(signalIndex)
                    .barIndex(t)
                    .date(bar.getDate())
                    .type(Trade.TradeType.SELL)
                    .quantity(quantity)
                    .price(price)
                    .cost(cost)
                    .cashAfter(portfolio.getCash())
                    .reason(action.getReason())
                    .signalStrength(action.getStrength())
                    .entryBarIndex(entryIndex)
                    .entryDate(entryIndex != null ? bars.get(entryIndex).getDate() : null)
                    .entryPrice(entryPrice)
                    .realizedPnl(realizedPnl)
                    .realizedPnlPct(realizedPnlPct)
                    .holdingBars(entryIndex != null ? t - entryIndex : null)
                    .build();
            tradeLog.record(trade);

            log.debug("SELL {} shares at {} on {} (cost: {}, P&L: {}, cash: {})",
                    quantity, price, bar.getDate(), cost, realizedPnl, portfolio.getCash());
        }

        private void closeAtEnd(int t, Bar bar) {
            log.debug("Closing open position of {} shares at end of series", portfolio.getPositionQuantity());
            fillSell(Action.sellAll("close at end of series"), t, t, bar, bar.getClose());
        }

        private BigDecimal buyFraction(Action action) {
            if (action.getFraction() != null) {
                return action.getFraction();
            }
            return config.getSizingPolicy() == SizingPolicy.ALL_IN ? BigDecimal.ONE : config.getPositionFraction();
        }

        /**
         * Largest whole number of shares whose price plus costs fits in {@code budget}.
         */
        private BigDecimal affordableQuantity(BigDecimal price, BigDecimal budget) {
            BigDecimal available = config.getCostModel().chargesFixedFee()
                    ? budget.subtract(config.getFixedFee())
                    : budget;
            if (available.signum() <= 0) {
                return BigDecimal.ZERO;
            }
            BigDecimal unitCost = config.getCostModel().chargesProportional()
                    ? price.multiply(BigDecimal.ONE.add(config.getProportionalRate()))
                    : price;
            BigDecimal quantity = available.divide(unitCost, 0, RoundingMode.DOWN);
            // cost rounding can push the estimate a share over budget
            while (quantity.signum() > 0 && totalBuyCost(price, quantity).compareTo(budget) > 0) {
                quantity = quantity.subtract(BigDecimal.ONE);
            }
            return quantity;
        }

        private BigDecimal totalBuyCost(BigDecimal price, BigDecimal quantity) {
            BigDecimal notional = price.multiply(quantity);
            return notional.add(config.costOf(notional));
        }

        private void reject(Action action, int t, Bar bar, RejectionReason reason, String message) {
            log.warn("Rejected {} on bar {} ({}): {} - {}", action, t, bar.getDate(), reason, message);
            tradeLog.reject(RejectedAction.builder()
                    .barIndex(t)
                    .date(bar.getDate())
                    .actionType(action.getType())
                    .action(action.toString())
                    .reason(reason)
                    .message(message)
                    .build());
        }
    }

    private static final class PendingOrder {
        private final Action action;
        private final int signalIndex;

        private PendingOrder(Action action, int signalIndex) {
            this.action = action;
            this.signalIndex = signalIndex;
        }
    }
}
