package com.rush.agent.model;

import lombok.Value;

// approved is null when the reply says nothing either way
@Value
public class ActionDecision {

    public static final ActionDecision NONE = new ActionDecision(false, null);

    boolean required;
    Boolean approved;

    public boolean isExplicitlyRejected() {
        return Boolean.FALSE.equals(approved);
    }
}
