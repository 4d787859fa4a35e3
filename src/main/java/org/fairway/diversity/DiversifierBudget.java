package org.fairway.diversity;

/**
 * Deterministic bounds on route diversification work.
 *
 * <p>The pool holds at most {@code max(k * poolFactor, k + poolPadding)} candidates and alternate
 * routes are re-sampled at most {@code maxDepth} levels deep.</p>
 */
final class DiversifierBudget {
    static final int DEFAULT_MAX_DEPTH = 2;
    static final int DEFAULT_POOL_FACTOR = 6;
    static final int DEFAULT_POOL_PADDING = 4;

    private static final String PROP_MAX_DEPTH = "fairway.diversifier.maxDepth";
    private static final String PROP_POOL_FACTOR = "fairway.diversifier.poolFactor";

    private final int maxDepth;
    private final int poolFactor;

    private DiversifierBudget(int maxDepth, int poolFactor) {
        this.maxDepth = Math.max(0, maxDepth);
        this.poolFactor = Math.max(1, poolFactor);
    }

    static DiversifierBudget of(int maxDepth, int poolFactor) {
        return new DiversifierBudget(maxDepth, poolFactor);
    }

    /**
     * Loads bounds from system properties, falling back to the defaults.
     */
    static DiversifierBudget defaults() {
        return of(
                readInt(PROP_MAX_DEPTH, DEFAULT_MAX_DEPTH),
                readInt(PROP_POOL_FACTOR, DEFAULT_POOL_FACTOR)
        );
    }

    int maxDepth() {
        return maxDepth;
    }

    int maxPool(int k) {
        return Math.max(k * poolFactor, k + DEFAULT_POOL_PADDING);
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
