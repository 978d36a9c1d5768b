package com.studyflow.core.model;

/**
 * Study phases at which an endpoint must be assessed.
 *
 * @param baseline assessed at baseline
 * @param treatment assessed during treatment
 * @param followUp assessed at end of treatment or follow-up
 */
public record EndpointTiming(boolean baseline, boolean treatment, boolean followUp) {

    public static EndpointTiming all() {
        return new EndpointTiming(true, true, true);
    }

    public boolean any() {
        return baseline || treatment || followUp;
    }
}
