package com.rush.agent.model;

import lombok.Value;

@Value
public class RiskAssessment {

    public static final RiskAssessment NONE = new RiskAssessment(null);

    Double score;

    public boolean exceeds(double threshold) {
        return score != null && score > threshold;
    }
}
