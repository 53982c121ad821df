package com.z254.noc.correlation;

import com.z254.noc.client.DecisionService;
import com.z254.noc.client.IncidentStore;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.error.ErrorKind;
import com.z254.noc.domain.error.NocException;
import com.z254.noc.domain.model.ActionType;
import com.z254.noc.domain.model.Alarm;
import com.z254.noc.domain.model.AlertGroup;
import com.z254.noc.domain.model.Decision;
import com.z254.noc.domain.model.RemediationAction;
import com.z254.noc.domain.model.ResultStatus;
import com.z254.noc.observability.NocMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AlertCorrelator}.
 */
@ExtendWith(MockitoExtension.class)
class AlertCorrelatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private IncidentStore incidentStore;

    @Mock
    private DecisionService decisionService;

    private NocProperties properties;
    private NocMetrics metrics;
    private AlertCorrelator correlator;

    @BeforeEach
    void setUp() {
        properties = new NocProperties();
        metrics = new NocMetrics(new SimpleMeterRegistry());
        correlator = newCorrelator(new NoResourceRelationship());
    }

    private AlertCorrelator newCorrelator(ResourceRelationship relationship) {
        HistoricalContextProvider history = new HistoricalContextProvider(incidentStore, properties, metrics);
        return new AlertCorrelator(history, decisionService, relationship, properties, metrics);
    }

    @Nested
    @DisplayName("Grouping")
    class GroupingTests {

        @Test
        @DisplayName("Should partition every alarm into exactly one group")
        void shouldPartitionAlarms() {
            List<Alarm> alarms = List.of(
                    alarm("a", "AWS/EC2", 0),
                    alarm("b", "AWS/RDS", 30),
                    alarm("c", "AWS/EC2", 60));

            List<List<Alarm>> groups = correlator.groupAlarms(alarms);

            assertThat(groups).hasSize(3);
            assertThat(groups.stream().mapToInt(List::size).sum()).isEqualTo(3);
            assertThat(groups).extracting(g -> g.get(0).getAlarmName()).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("Should chain alarms whose ends are further apart than the window")
        void shouldChainThroughIntermediateMembers() {
            List<Alarm> alarms = List.of(
                    alarm("a", "AWS/EC2", 0),
                    alarm("b", "AWS/EC2", 240),
                    alarm("c", "AWS/EC2", 480));

            List<List<Alarm>> groups = correlator.groupAlarms(alarms);

            assertThat(groups).hasSize(1);
            assertThat(groups.get(0)).extracting(Alarm::getAlarmName).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("Should split when the gap exceeds the window")
        void shouldSplitOnGap() {
            List<Alarm> alarms = List.of(
                    alarm("a", "AWS/EC2", 0),
                    alarm("b", "AWS/EC2", 301));

            assertThat(correlator.groupAlarms(alarms)).hasSize(2);
        }

        @Test
        @DisplayName("Should treat a gap equal to the window as related")
        void shouldIncludeWindowBoundary() {
            List<Alarm> alarms = List.of(
                    alarm("a", "AWS/EC2", 0),
                    alarm("b", "AWS/EC2", 300));

            assertThat(correlator.groupAlarms(alarms)).hasSize(1);
        }

        @Test
        @DisplayName("Should order by transition time, alarms without one first")
        void shouldOrderMissingTimestampsFirst() {
            Alarm late = alarm("late", "AWS/EC2", 60);
            Alarm early = alarm("early", "AWS/EC2", 0);
            Alarm untimed = Alarm.builder().alarmName("untimed").namespace("AWS/EC2").build();

            List<List<Alarm>> groups = correlator.groupAlarms(List.of(late, early, untimed));

            assertThat(groups).hasSize(2);
            assertThat(groups.get(0)).extracting(Alarm::getAlarmName).containsExactly("untimed");
            assertThat(groups.get(1)).extracting(Alarm::getAlarmName).containsExactly("early", "late");
        }

        @Test
        @DisplayName("Should keep input order for equal timestamps")
        void shouldBeStable() {
            List<Alarm> alarms = List.of(
                    alarm("first", "AWS/EC2", 0),
                    alarm("second", "AWS/EC2", 0));

            assertThat(correlator.groupAlarms(alarms).get(0))
                    .extracting(Alarm::getAlarmName)
                    .containsExactly("first", "second");
        }

        @Test
        @DisplayName("Should not relate different namespaces without a relationship")
        void shouldSeparateNamespaces() {
            assertThat(correlator.areRelated(alarm("a", "AWS/EC2", 0), alarm("b", "AWS/RDS", 10))).isFalse();
        }

        @Test
        @DisplayName("Should relate different namespaces through the configured relationship")
        void shouldUseRelationship() {
            AlertCorrelator tagged = newCorrelator(new TagResourceRelationship(List.of("InstanceId")));
            Alarm cpu = alarm("cpu", "AWS/EC2", 0).toBuilder().dimensions(Map.of("InstanceId", "i-1")).build();
            Alarm disk = alarm("disk", "AWS/EBS", 10).toBuilder().dimensions(Map.of("InstanceId", "i-1")).build();

            assertThat(tagged.areRelated(cpu, disk)).isTrue();
            assertThat(tagged.groupAlarms(List.of(cpu, disk))).hasSize(1);
        }

        @Test
        @DisplayName("Should relate alarms that both lack a namespace")
        void shouldRelateNullNamespaces() {
            Alarm a = Alarm.builder().alarmName("a").stateUpdatedTimestamp(T0).build();
            Alarm b = Alarm.builder().alarmName("b").stateUpdatedTimestamp(T0.plusSeconds(5)).build();

            assertThat(correlator.areRelated(a, b)).isTrue();
        }
    }

    @Nested
    @DisplayName("Correlation")
    class CorrelationTests {

        @Test
        @DisplayName("Should return success with no groups for empty input")
        void shouldHandleEmptyInput() {
            StepVerifier.create(correlator.correlate(List.of()))
                    .assertNext(result -> {
                        assertThat(result.getStatus()).isEqualTo(ResultStatus.SUCCESS);
                        assertThat(result.getGroups()).isEmpty();
                    })
                    .verifyComplete();

            verify(decisionService, never()).decide(anyMap(), anyList());
        }

        @Test
        @DisplayName("Should annotate groups with the decision")
        void shouldAnnotateGroups() {
            when(incidentStore.recent(any())).thenReturn(Mono.just(List.of()));
            when(decisionService.decide(anyMap(), anyList())).thenReturn(Mono.just(Decision.builder()
                    .id("D-1")
                    .rootCause("disk full")
                    .confidence(0.8)
                    .action(RemediationAction.builder().type(ActionType.REMEDIATE).target("cleanup").build())
                    .build()));

            StepVerifier.create(correlator.correlate(List.of(alarm("a", "AWS/EC2", 0), alarm("b", "AWS/EC2", 10))))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        assertThat(result.getGroups()).hasSize(1);
                        AlertGroup group = result.getGroups().get(0);
                        assertThat(group.getRootCause()).isEqualTo("disk full");
                        assertThat(group.getConfidence()).isEqualTo(0.8);
                        assertThat(group.getRecommendedActions()).hasSize(1);
                        assertThat(group.isDegraded()).isFalse();
                    })
                    .verifyComplete();
        }

        @SuppressWarnings("unchecked")
        @Test
        @DisplayName("Should send alerts and history time range to the decision service")
        void shouldBuildDecisionContext() {
            when(incidentStore.recent(any())).thenReturn(Mono.just(List.of()));
            when(decisionService.decide(anyMap(), anyList())).thenReturn(Mono.just(Decision.builder().build()));

            correlator.correlate(List.of(alarm("a", "AWS/EC2", 0))).block();

            ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
            verify(decisionService).decide(captor.capture(), anyList());
            Map<String, Object> context = captor.getValue();
            assertThat(context).containsKeys("alerts", "history", "timestamp");
            Map<String, Object> history = (Map<String, Object>) context.get("history");
            assertThat(history).containsKeys("recent_incidents", "time_range");
            assertThat((Map<String, Object>) history.get("time_range")).containsKeys("start", "end");
        }

        @Test
        @DisplayName("Should degrade a group when the decision service fails")
        void shouldDegradeOnDecisionFailure() {
            when(incidentStore.recent(any())).thenReturn(Mono.just(List.of()));
            when(decisionService.decide(anyMap(), anyList()))
                    .thenReturn(Mono.error(NocException.decisionUnavailable("down", null)));

            StepVerifier.create(correlator.correlate(List.of(alarm("a", "AWS/EC2", 0))))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        AlertGroup group = result.getGroups().get(0);
                        assertThat(group.getRootCause()).isEqualTo(AlertGroup.UNKNOWN_ROOT_CAUSE);
                        assertThat(group.getConfidence()).isZero();
                        assertThat(group.getRecommendedActions()).isEmpty();
                        assertThat(group.getError().getKind()).isEqualTo(ErrorKind.DECISION_UNAVAILABLE);
                    })
                    .verifyComplete();

            assertThat(metrics.getDecisionsUnavailable().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should still ask for a decision when history is unavailable")
        void shouldContinueWithoutHistory() {
            when(incidentStore.recent(any())).thenReturn(Mono.error(new IllegalStateException("store down")));
            when(decisionService.decide(anyMap(), anyList()))
                    .thenReturn(Mono.just(Decision.builder().rootCause("network").confidence(0.6).build()));

            StepVerifier.create(correlator.correlate(List.of(alarm("a", "AWS/EC2", 0))))
                    .assertNext(result -> {
                        AlertGroup group = result.getGroups().get(0);
                        assertThat(group.getRootCause()).isEqualTo("network");
                        assertThat(group.getError().getKind()).isEqualTo(ErrorKind.UPSTREAM_UNAVAILABLE);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should report an error when grouping itself fails")
        void shouldFailOnMalformedInput() {
            List<Alarm> alarms = new ArrayList<>(Arrays.asList(alarm("a", "AWS/EC2", 0), null));

            StepVerifier.create(correlator.correlate(alarms))
                    .assertNext(result -> {
                        assertThat(result.getStatus()).isEqualTo(ResultStatus.ERROR);
                        assertThat(result.getGroups()).isEmpty();
                        assertThat(result.getError()).isNotNull();
                    })
                    .verifyComplete();
        }
    }

    private static Alarm alarm(String name, String namespace, long offsetSeconds) {
        return Alarm.builder()
                .alarmName(name)
                .namespace(namespace)
                .metricName("CPUUtilization")
                .state("ALARM")
                .stateUpdatedTimestamp(T0.plusSeconds(offsetSeconds))
                .build();
    }
}
