package com.example.fleetsafety.event;

public record AlertRevalidationDueEvent(String alertId, Long companyId, int investigationCount) {
}
