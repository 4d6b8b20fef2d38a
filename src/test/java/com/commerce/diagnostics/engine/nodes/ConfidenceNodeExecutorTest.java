package com.commerce.diagnostics.engine.nodes;

import com.commerce.diagnostics.engine.ExecutionContext;
import com.commerce.diagnostics.engine.NodeOutcome;
import com.commerce.diagnostics.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.commerce.diagnostics.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceNodeExecutorTest {

    private final ConfidenceNodeExecutor executor = new ConfidenceNodeExecutor(createEngineConfig());
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        context = TestDataFactory.createContext(createAlert(25.0));
    }

    private double score() {
        NodeOutcome outcome = executor.execute(confidence("confidence", "insight"), context);
        assertThat(outcome.getNext()).isEqualTo("insight");
        return context.getAnalysisResults().getConfidence();
    }

    @Test
    void execute_noRootCauses_scoresPointThree() {
        assertThat(score()).isEqualTo(0.3);
    }

    @Test
    void execute_singleStrongCause_scoresPointNine() {
        context.getAnalysisResults().setRootCauses(List.of(createFinding("payment_gateway", "razorpay", 65.0)));

        assertThat(score()).isEqualTo(0.9);
    }

    @Test
    void execute_moderateTopCauseClearlyAhead_getsSeparationBonus() {
        context.getAnalysisResults().setRootCauses(List.of(
                createFinding("discount_code", "WELCOME10", 30.0),
                createFinding("payment_gateway", "payu", 12.0)));

        // 0.5 + 0.15 + 0.1
        assertThat(score()).isEqualTo(0.75);
    }

    @Test
    void execute_closeCompetingCauses_noSeparationBonus() {
        context.getAnalysisResults().setRootCauses(List.of(
                createFinding("discount_code", "WELCOME10", 30.0),
                createFinding("payment_gateway", "payu", 25.0)));

        assertThat(score()).isEqualTo(0.65);
    }

    @Test
    void execute_lowOrderVolume_penalized() {
        context.getAnalysisResults().setRootCauses(List.of(createFinding("payment_gateway", "razorpay", 65.0)));
        context.getDerived().putFunnelMetric("orders", createFunnelMetric(20, 100));

        assertThat(score()).isEqualTo(0.8);
    }

    @Test
    void execute_weakEvidenceWithLowVolume_stillWithinBounds() {
        context.getDerived().putFunnelMetric("orders", createFunnelMetric(5, 10));

        assertThat(score()).isEqualTo(0.2).isBetween(0.1, 0.99);
    }
}
