package me.neonhub.reasoning.routing;

import me.neonhub.reasoning.domain.model.ContextPriority;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RoutingPolicyTest {

    private final RoutingPolicy policy = RoutingPolicy.defaults();

    @Test
    void idleAgentWithPerfectRecordScoresOne() {
        assertEquals(1.0, policy.score(1.0, 0.0, ContextPriority.MEDIUM), 1e-9);
        assertEquals(1.0, policy.score(1.0, 0.0, ContextPriority.CRITICAL), 1e-9);
    }

    @Test
    void latencyAtScaleHalvesLatencyScore() {
        double score = policy.score(0.0, 1000.0, ContextPriority.MEDIUM);

        assertEquals(0.4 * 0.5, score, 1e-9);
    }

    @Test
    void urgentPrioritiesUseUrgentWeights() {
        assertEquals(0.85, policy.score(1.0, Double.MAX_VALUE, ContextPriority.HIGH), 1e-6);
        assertEquals(0.6, policy.score(1.0, Double.MAX_VALUE, ContextPriority.LOW), 1e-6);
        assertEquals(0.6, policy.score(1.0, Double.MAX_VALUE, null), 1e-6);
    }

    @Test
    void blendKeepsEightyPercentOfPreviousValue() {
        assertEquals(0.8 * 100 + 0.2 * 600, policy.blend(100, 600), 1e-9);
    }

    @Test
    void smoothingFactorIsConfigurable() {
        RoutingPolicy reactive = RoutingPolicy.builder().smoothingFactor(0.5).build();

        assertEquals(350.0, reactive.blend(100, 600), 1e-9);
    }
}
