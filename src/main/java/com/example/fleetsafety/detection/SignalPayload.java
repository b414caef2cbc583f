package com.example.fleetsafety.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inbound safety event as delivered by the stream-ingestion collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignalPayload {

    private String sourceEventId;
    @Builder.Default
    private List<BehaviorLabel> behaviorLabels = new ArrayList<>();
    private String eventState;
    private String vehicleId;
    private String vehicleName;
    private String driverId;
    private String driverName;
    private Instant occurredAt;

    public List<String> labelValues() {
        if (behaviorLabels == null) return List.of();
        return behaviorLabels.stream()
                .filter(Objects::nonNull)
                .map(BehaviorLabel::value)
                .filter(v -> v != null && !v.isBlank())
                .toList();
    }

    /** Upstream sends labels either as plain strings or as {@code {label|name, source}} objects. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BehaviorLabel {
        private String label;
        private String name;
        private String source;

        @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
        public static BehaviorLabel of(String label) {
            return new BehaviorLabel(label, null, null);
        }

        public String value() {
            return label != null ? label : name;
        }
    }
}
