package com.example.fleetsafety.domain;

import lombok.Getter;

@Getter
public class IllegalIncidentTransitionException extends IllegalStateException {

    private final String incidentId;
    private final Incident.IncidentStatus from;
    private final Incident.IncidentStatus to;

    public IllegalIncidentTransitionException(String incidentId, Incident.IncidentStatus from,
                                              Incident.IncidentStatus to) {
        super("Incident " + incidentId + " cannot move from " + from.value() + " to " + to.value());
        this.incidentId = incidentId;
        this.from = from;
        this.to = to;
    }
}
