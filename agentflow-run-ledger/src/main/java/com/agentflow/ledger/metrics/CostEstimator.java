package com.agentflow.ledger.metrics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Converts token counts to an estimated USD cost using per-1K-token prices.
 * Models without a price (local models, unlisted hosted models) cost zero.
 * Results are rounded to 6 decimal places.
 */
public final class CostEstimator {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final int SCALE = 6;

    private static final Map<String, ModelPrice> DEFAULT_PRICES;

    static {
        Map<String, ModelPrice> prices = new LinkedHashMap<>();
        prices.put("gemini-3-pro", ModelPrice.of("0.002", "0.012"));
        prices.put("gemini-3-flash", ModelPrice.of("0.0005", "0.003"));
        prices.put("gemini-2.5-pro", ModelPrice.of("0.00125", "0.010"));
        prices.put("gemini-2.5-flash", ModelPrice.of("0.0003", "0.0025"));
        prices.put("gemini-2.5-flash-lite", ModelPrice.of("0.0001", "0.0004"));
        prices.put("gemini-1.5-pro", ModelPrice.of("0.00125", "0.005"));
        prices.put("gemini-1.5-flash", ModelPrice.of("0.000075", "0.0003"));
        prices.put("gemini-1.5-flash-8b", ModelPrice.of("0.0000375", "0.00015"));
        prices.put("gemini-1.0-pro", ModelPrice.of("0.0005", "0.0015"));
        DEFAULT_PRICES = Collections.unmodifiableMap(prices);
    }

    private final Map<String, ModelPrice> prices;

    public CostEstimator() {
        this(DEFAULT_PRICES);
    }

    public CostEstimator(Map<String, ModelPrice> prices) {
        Map<String, ModelPrice> copy = new LinkedHashMap<>();
        if (prices != null) {
            prices.forEach((model, price) -> copy.put(normalize(model), price));
        }
        this.prices = Collections.unmodifiableMap(copy);
    }

    /** Estimator with the built-in table plus (or overriding with) the given prices. */
    public static CostEstimator withAdditionalPrices(Map<String, ModelPrice> extra) {
        Map<String, ModelPrice> merged = new LinkedHashMap<>(DEFAULT_PRICES);
        if (extra != null) merged.putAll(extra);
        return new CostEstimator(merged);
    }

    public BigDecimal estimate(String model, long promptTokens, long completionTokens) {
        ModelPrice price = findPrice(model).orElse(null);
        if (price == null) {
            return BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
        }
        BigDecimal input = BigDecimal.valueOf(Math.max(0, promptTokens)).divide(THOUSAND).multiply(price.getInputPer1k());
        BigDecimal output = BigDecimal.valueOf(Math.max(0, completionTokens)).divide(THOUSAND).multiply(price.getOutputPer1k());
        return input.add(output).setScale(SCALE, RoundingMode.HALF_UP);
    }

    public Optional<ModelPrice> findPrice(String model) {
        if (model == null || model.isBlank()) return Optional.empty();
        return Optional.ofNullable(prices.get(normalize(model)));
    }

    public Map<String, ModelPrice> getPrices() {
        return prices;
    }

    private static String normalize(String model) {
        String m = model.trim().toLowerCase(Locale.ROOT);
        // Strip provider prefixes such as "models/gemini-1.5-flash" or "google/gemini-1.5-flash".
        int slash = m.lastIndexOf('/');
        return slash >= 0 ? m.substring(slash + 1) : m;
    }

    /** Input and output price per 1K tokens, in USD. */
    public static final class ModelPrice {
        private final BigDecimal inputPer1k;
        private final BigDecimal outputPer1k;

        public ModelPrice(BigDecimal inputPer1k, BigDecimal outputPer1k) {
            this.inputPer1k = inputPer1k != null ? inputPer1k : BigDecimal.ZERO;
            this.outputPer1k = outputPer1k != null ? outputPer1k : BigDecimal.ZERO;
        }

        public static ModelPrice of(String inputPer1k, String outputPer1k) {
            return new ModelPrice(new BigDecimal(inputPer1k), new BigDecimal(outputPer1k));
        }

        public BigDecimal getInputPer1k() { return inputPer1k; }
        public BigDecimal getOutputPer1k() { return outputPer1k; }
    }
}
