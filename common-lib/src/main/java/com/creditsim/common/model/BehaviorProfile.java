package com.creditsim.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Payment behavior shared by a set of participants.
 *
 * <p>All props are optional. Missing values fall back to: {@code txRate=1.0},
 * uniform currency preference, no amount model, no group targeting,
 * {@code periodicityFactor=1.0} (filter disabled).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BehaviorProfile(
    @JsonProperty("id")                    String id,
    @JsonProperty("txRate")                Double txRate,
    @JsonProperty("equivalentWeights")     Map<String, Double> equivalentWeights,
    @JsonProperty("amountModel")           Map<String, AmountModel> amountModel,
    @JsonProperty("recipientGroupWeights") Map<String, Double> recipientGroupWeights,
    @JsonProperty("flowChains")            List<List<String>> flowChains,
    @JsonProperty("flowAffinity")          Double flowAffinity,
    @JsonProperty("periodicityFactor")     Double periodicityFactor
) {

    public static BehaviorProfile defaults(String id) {
        return new BehaviorProfile(id, null, null, null, null, null, null, null);
    }

    public AmountModel amountModelFor(String equivalent) {
        return amountModel == null ? null : amountModel.get(equivalent);
    }
}
