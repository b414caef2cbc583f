package com.example.fleetsafety.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Everything the AI pipeline hands back for one triage or revalidation run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssessmentOutcome {

    private AiAssessment assessment;
    private String humanMessage;
    private Map<String, Object> alertContext;
    private Map<String, Object> execution;
    private Map<String, Object> notificationDecision;
}
