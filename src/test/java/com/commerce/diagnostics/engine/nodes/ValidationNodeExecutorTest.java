package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.engine.WindowResolver;
import com.commerce.diagnostics.model.Alert;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static com.commerce.diagnostics.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class ValidationNodeExecutorTest {

    private final ValidationNodeExecutor executor =
            new ValidationNodeExecutor(new WindowResolver(), createEngineConfig());

    private static String openWindow(long minutesBack, long minutesAhead) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        return now.minus(minutesBack, ChronoUnit.MINUTES) + "|" + now.plus(minutesAhead, ChronoUnit.MINUTES);
    }

    @Test
    void execute_closedWindowAboveThreshold_proceeds() {
        ExecutionContext context = createContext(createAlert(25.0));

        NodeOutcome outcome = executor.execute(validation("validate", "compare", 10.0), context);

        assertThat(outcome.getStatus()).isEqualTo(NodeOutcome.Status.SUCCESS);
        assertThat(outcome.getNext()).isEqualTo("compare");
        assertThat(context.getMetadata().isPartialData()).isFalse();
    }

    @Test
    void execute_dropBelowMinimum_suppressed() {
        NodeOutcome outcome = executor.execute(validation("validate", "compare", 10.0),
                createContext(createAlert(8.0)));

        assertThat(outcome.getStatus()).isEqualTo(NodeOutcome.Status.SUPPRESSED);
        assertThat(outcome.getReason()).isEqualTo("below_threshold");
    }

    @Test
    void execute_noMinimum_anyDropProceeds() {
        NodeOutcome outcome = executor.execute(validation("validate", "compare", null),
                createContext(createAlert(0.5)));

        assertThat(outcome.getStatus()).isEqualTo(NodeOutcome.Status.SUCCESS);
    }

    @Test
    void execute_openShortWindow_deferred() {
        Alert alert = createAlert(25.0).toBuilder().currentWindow(openWindow(5, 5)).build();

        NodeOutcome outcome = executor.execute(validation("validate", "compare", 10.0), createContext(alert));

        assertThat(outcome.getStatus()).isEqualTo(NodeOutcome.Status.DEFERRED);
        assertThat(outcome.getReason()).isEqualTo("window_too_short");
    }

    @Test
    void execute_openButLongWindow_proceedsAsPartial() {
        Alert alert = createAlert(25.0).toBuilder().currentWindow(openWindow(50, 10)).build();
        ExecutionContext context = createContext(alert);

        NodeOutcome outcome = executor.execute(validation("validate", "compare", 10.0), context);

        assertThat(outcome.getStatus()).isEqualTo(NodeOutcome.Status.SUCCESS);
        assertThat(context.getMetadata().isPartialData()).isTrue();
    }
}
