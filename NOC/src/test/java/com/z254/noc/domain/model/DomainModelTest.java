package com.z254.noc.domain.model;

import com.z254.noc.domain.error.ErrorKind;
import com.z254.noc.domain.error.StageError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DomainModelTest {

    @Nested
    @DisplayName("Alarm")
    class AlarmTests {

        @Test
        void signalSourceStripsTheVendorPrefix() {
            Alarm alarm = Alarm.builder().namespace("AWS/EC2").build();

            assertThat(alarm.signalSource("AWS/")).isEqualTo("EC2");
            assertThat(alarm.signalSource("")).isEqualTo("AWS/EC2");
            assertThat(Alarm.builder().build().signalSource("AWS/")).isNull();
        }

        @Test
        void missingTimestampSortsFirst() {
            assertThat(Alarm.builder().build().getEffectiveTimestamp()).isEqualTo(Instant.MIN);
        }

        @Test
        void dimensionLookupIsNullSafe() {
            assertThat(Alarm.builder().dimensions(null).build().dimension("InstanceId")).isNull();
        }
    }

    @Nested
    @DisplayName("Labels")
    class LabelTests {

        @Test
        void severityParsingDefaultsToMedium() {
            assertThat(Severity.from("critical")).isEqualTo(Severity.CRITICAL);
            assertThat(Severity.from(" High ")).isEqualTo(Severity.HIGH);
            assertThat(Severity.from("sev1")).isEqualTo(Severity.MEDIUM);
            assertThat(Severity.from(null)).isEqualTo(Severity.MEDIUM);
        }

        @Test
        void severityOrdering() {
            assertThat(Severity.CRITICAL.isAtLeast(Severity.HIGH)).isTrue();
            assertThat(Severity.MEDIUM.isAtLeast(Severity.HIGH)).isFalse();
        }

        @Test
        void unrecognisedActionTypeIsUnknown() {
            assertThat(ActionType.from("ticket")).isEqualTo(ActionType.TICKET);
            assertThat(ActionType.from("reboot")).isEqualTo(ActionType.UNKNOWN);
            assertThat(ActionType.from(null)).isEqualTo(ActionType.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("Degraded results")
    class DegradedTests {

        @Test
        void degradedGroupHasUnknownRootCause() {
            AlertGroup group = AlertGroup.degraded(List.of(Alarm.builder().alarmName("a").namespace("AWS/EC2").build()),
                    StageError.of(ErrorKind.DECISION_UNAVAILABLE, "down"));

            assertThat(group.getRootCause()).isEqualTo(AlertGroup.UNKNOWN_ROOT_CAUSE);
            assertThat(group.getConfidence()).isZero();
            assertThat(group.getRecommendedActions()).isEmpty();
            assertThat(group.isDegraded()).isTrue();
        }

        @Test
        void unavailableDecisionUsesPlaceholders() {
            Decision decision = Decision.unavailable(StageError.of(ErrorKind.DECISION_UNAVAILABLE, "down"));

            assertThat(decision.isAvailable()).isFalse();
            assertThat(decision.idOrPlaceholder()).isEqualTo(Decision.UNKNOWN_ID);
            assertThat(decision.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(decision.getActions()).isEmpty();
        }

        @Test
        void decisionDefaultsExplicitNulls() {
            Decision decision = Decision.builder().id("d-1").rootCause(null).severity(null).confidence(0.9).build();

            assertThat(decision.getRootCause()).isEqualTo(Decision.UNKNOWN_ROOT_CAUSE);
            assertThat(decision.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(decision.isAvailable()).isTrue();
        }

        @Test
        void groupDefaultsExplicitNullRootCause() {
            AlertGroup group = AlertGroup.builder().alarm(Alarm.builder().alarmName("a").build()).rootCause(null).build();

            assertThat(group.getRootCause()).isEqualTo(AlertGroup.UNKNOWN_ROOT_CAUSE);
        }

        @Test
        void errorResultCarriesNoRecords() {
            PipelineResult result = PipelineResult.error(ErrorKind.INVALID_INPUT, "bad");

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getResults()).isEmpty();
            assertThat(result.getWarnings()).isEmpty();
        }
    }
}
