package com.example.fleetsafety.event;

public record AlertEscalatedEvent(String alertId, Long companyId, int escalationLevel, int escalationCount,
                                  String decisionId) {
}
