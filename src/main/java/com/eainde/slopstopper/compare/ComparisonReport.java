package com.eainde.slopstopper.compare;

import com.eainde.slopstopper.analysis.PassResult;

import java.math.BigDecimal;

/**
 * Both analysis passes for one record plus the judge's reconciliation. Nothing in here is persisted.
 *
 * @param judgeError why no judge verdict is present, {@code null} when there is one
 */
public record ComparisonReport(String videoId,
                               String title,
                               Side a,
                               Side b,
                               JudgeVerdict judge,
                               String judgeError) {

    /**
     * One configuration's pass.
     *
     * @param pass  {@code null} when the pass failed
     * @param error failure detail, {@code null} on success
     * @param cost  estimated cost, {@code null} when the pass failed or the model has no price
     */
    public record Side(String label, String requestedModel, PassResult pass, BigDecimal cost, String error) {

        public boolean succeeded() {
            return pass != null;
        }
    }
}
