package com.boardroom.sim.directive;

import com.boardroom.sim.random.RandomSource;

/**
 * Quarterly requirement set by the board and evaluated at Resolution.
 * Requirements scale with board pressure.
 */
public enum BoardDirective {

    /** Reach a profit floor of min(21, 5 + 2p). */
    PROFIT_FLOOR("DIR_PROFIT_FLOOR", "Achieve Quarterly Profit") {
        @Override
        public int requiredAmount(int pressure) {
            return Math.min(21, 5 + pressure * 2);
        }

        @Override
        public boolean isMet(int lastProfit, int currentProfit, int pressure) {
            return currentProfit >= requiredAmount(pressure);
        }
    },

    /** Grow profit by 5 + floor(sqrt(8p)) over last quarter. */
    PROFIT_INCREASE("DIR_PROFIT_INCREASE", "Increase Quarterly Profit") {
        @Override
        public int requiredAmount(int pressure) {
            return 5 + (int) Math.floor(Math.sqrt(pressure * 8.0));
        }

        @Override
        public boolean isMet(int lastProfit, int currentProfit, int pressure) {
            return currentProfit - lastProfit >= requiredAmount(pressure);
        }
    };

    private final String directiveId;
    private final String title;

    BoardDirective(String directiveId, String title) {
        this.directiveId = directiveId;
        this.title = title;
    }

    public String directiveId() {
        return directiveId;
    }

    public String title() {
        return title;
    }

    public abstract int requiredAmount(int pressure);

    public abstract boolean isMet(int lastProfit, int currentProfit, int pressure);

    /** e.g. {@code "Achieve Quarterly Profit: $7M target"}. */
    public String description(int pressure) {
        return title + ": $" + requiredAmount(pressure) + "M target";
    }

    /**
     * Directive for the coming quarter. Always the profit floor; draws nothing
     * from {@code rng}.
     */
    public static BoardDirective generate(int pressure, RandomSource rng) {
        return PROFIT_FLOOR;
    }
}
