package com.eainde.slopstopper.compare;

/**
 * Reconciliation produced by the judge pass.
 *
 * @param reconciledAction the action the judge would take, or {@code null} when it gave none
 * @param judgeModel       model that answered, which is the fallback model if the primary judge failed
 */
public record JudgeVerdict(Winner winner,
                           String reasoning,
                           String reconciledAction,
                           String judgeModel,
                           int inputTokens,
                           int outputTokens) {

    public enum Winner { A, B, TIE }
}
