package com.eainde.slopstopper.pricing;

import java.math.BigDecimal;

/**
 * USD per 1,000 tokens, input and output priced separately.
 */
public record ModelPrice(BigDecimal inputPer1k, BigDecimal outputPer1k) {

    public ModelPrice {
        if (inputPer1k == null || outputPer1k == null
                || inputPer1k.signum() < 0 || outputPer1k.signum() < 0) {
            throw new IllegalArgumentException("Prices must be non-negative");
        }
    }

    /**
     * Convenience for the per-million figures providers publish.
     */
    public static ModelPrice perMillion(String input, String output) {
        BigDecimal thousand = BigDecimal.valueOf(1000);
        return new ModelPrice(new BigDecimal(input).divide(thousand), new BigDecimal(output).divide(thousand));
    }
}
