package com.eainde.slopstopper.error;

import java.util.Collection;
import java.util.TreeSet;

public class UnknownModelPricingException extends PipelineException {

    public UnknownModelPricingException(String model, Collection<String> knownModels) {
        super("no price configured for model '" + model + "' (known: " + new TreeSet<>(knownModels) + ")");
    }

    @Override
    public String kind() {
        return "UnknownModelPricing";
    }
}
