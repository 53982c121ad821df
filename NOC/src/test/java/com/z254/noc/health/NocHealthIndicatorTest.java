package com.z254.noc.health;

import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.ResultStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class NocHealthIndicatorTest {

    private NocHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        indicator = new NocHealthIndicator(new NocProperties());
    }

    @Test
    void upBeforeAnyRun() {
        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsEntry("lastRunStatus", "NONE");
                })
                .verifyComplete();
    }

    @Test
    void downAfterConsecutiveFailures() {
        indicator.recordRun(ResultStatus.ERROR);
        indicator.recordRun(ResultStatus.ERROR);
        indicator.recordRun(ResultStatus.ERROR);

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }

    @Test
    void successResetsTheFailureCount() {
        indicator.recordRun(ResultStatus.ERROR);
        indicator.recordRun(ResultStatus.ERROR);
        indicator.recordRun(ResultStatus.SUCCESS);

        assertThat(indicator.getConsecutiveFailures()).isZero();
    }
}
