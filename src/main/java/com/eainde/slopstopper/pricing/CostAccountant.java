package com.eainde.slopstopper.pricing;

import com.eainde.slopstopper.error.UnknownModelPricingException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Maps (model, input tokens, output tokens) to an estimated USD cost from a static price table.
 * Unknown models fail instead of pricing at zero.
 */
public class CostAccountant {

    public static final int SCALE = 8;

    public static final Map<String, ModelPrice> DEFAULT_PRICES = Map.of(
            "gemini-2.5-flash-lite", ModelPrice.perMillion("0.10", "0.40"),
            "gemini-2.5-flash", ModelPrice.perMillion("0.30", "2.50"),
            "gemini-2.5-pro", ModelPrice.perMillion("1.25", "10.00"),
            "gemini-3-flash-preview", ModelPrice.perMillion("0.50", "3.00"),
            "gemini-3-pro-preview", ModelPrice.perMillion("2.00", "12.00"),
            "mock", ModelPrice.perMillion("0", "0")
    );

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final Map<String, ModelPrice> prices;

    public CostAccountant() {
        this(DEFAULT_PRICES);
    }

    public CostAccountant(Map<String, ModelPrice> prices) {
        this.prices = Map.copyOf(prices);
    }

    public BigDecimal estimate(String model, long inputTokens, long outputTokens) {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("Token counts must be non-negative");
        }
        ModelPrice price = model == null ? null : prices.get(model);
        if (price == null) {
            throw new UnknownModelPricingException(model, prices.keySet());
        }
        BigDecimal input = price.inputPer1k().multiply(BigDecimal.valueOf(inputTokens));
        BigDecimal output = price.outputPer1k().multiply(BigDecimal.valueOf(outputTokens));
        return input.add(output).divide(THOUSAND, SCALE, RoundingMode.HALF_UP);
    }

    public boolean isPriced(String model) {
        return model != null && prices.containsKey(model);
    }
}
