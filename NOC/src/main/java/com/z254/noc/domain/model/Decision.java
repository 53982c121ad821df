package com.z254.noc.domain.model;

import com.z254.noc.domain.error.StageError;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Advisory judgement returned by the decision service.
 * <p>
 * Every field may be absent in the service response; absent or null fields take
 * the defaults below rather than failing the pipeline.
 */
@Value
@Builder(toBuilder = true)
public class Decision {

    /** Placeholder used downstream when the service returned no id */
    public static final String UNKNOWN_ID = "unknown";

    public static final String UNKNOWN_ROOT_CAUSE = "unknown";

    String id;

    @Builder.Default
    String rootCause = UNKNOWN_ROOT_CAUSE;

    double confidence;

    @Builder.Default
    Severity severity = Severity.MEDIUM;

    @Singular
    List<RemediationAction> actions;

    @Builder.Default
    Map<String, Object> details = Map.of();

    /** Set when the decision could not be obtained */
    StageError error;

    /**
     * Degraded decision used when the service failed.
     */
    public static Decision unavailable(StageError error) {
        return Decision.builder()
                .rootCause(UNKNOWN_ROOT_CAUSE)
                .confidence(0.0)
                .severity(Severity.MEDIUM)
                .error(error)
                .build();
    }

    public String getRootCause() {
        return rootCause != null ? rootCause : UNKNOWN_ROOT_CAUSE;
    }

    public Severity getSeverity() {
        return severity != null ? severity : Severity.MEDIUM;
    }

    public String idOrPlaceholder() {
        return id != null && !id.isBlank() ? id : UNKNOWN_ID;
    }

    public boolean isAvailable() {
        return error == null;
    }
}
