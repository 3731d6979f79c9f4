package org.carball.plansampler.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class PlanDebug {

    @JsonProperty("normalized_plan")
    String normalizedPlan;

    @JsonProperty("obfuscated_plan")
    String obfuscatedPlan;

    @JsonProperty("digest_text")
    String digestText;
}
