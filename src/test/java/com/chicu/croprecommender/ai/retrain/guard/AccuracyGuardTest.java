package com.chicu.croprecommender.ai.retrain.guard;

import com.chicu.croprecommender.ai.retrain.RetrainProperties;
import com.chicu.croprecommender.support.TestSnapshots;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccuracyGuardTest {

    private final AccuracyGuard guard = new AccuracyGuard(new RetrainProperties());

    @Test
    void firstModelOnlyNeedsAbsoluteMinimum() {
        assertTrue(guard.checkCandidate(null, TestSnapshots.metrics(0.80)).allowed());
        assertFalse(guard.checkCandidate(null, TestSnapshots.metrics(0.79)).allowed());
    }

    @Test
    void smallRegressionWithinToleranceIsAllowed() {
        GuardDecision d = guard.checkCandidate(TestSnapshots.metrics(0.97), TestSnapshots.metrics(0.955));
        assertTrue(d.allowed(), d.reason());
        assertEquals(0.955, d.candidateAccuracy(), 1e-12);
        assertEquals(0.95, d.requiredAccuracy(), 1e-9);
    }

    @Test
    void largerRegressionIsDenied() {
        GuardDecision d = guard.checkCandidate(TestSnapshots.metrics(0.97), TestSnapshots.metrics(0.94));

        assertFalse(d.allowed());
        assertTrue(d.reason().contains("regresses"));
    }

    @Test
    void candidateBelowMinimumIsDeniedEvenWithoutRegression() {
        GuardDecision d = guard.checkCandidate(TestSnapshots.metrics(0.5), TestSnapshots.metrics(0.6));

        assertFalse(d.allowed());
        assertTrue(d.reason().contains("minimum"));
    }

    @Test
    void missingOrNonFiniteMetricsAreDenied() {
        assertFalse(guard.checkCandidate(null, null).allowed());
        assertFalse(guard.checkCandidate(null, TestSnapshots.metrics(Double.NaN)).allowed());
    }
}
