package com.agentforge.orchestrator.agent;

import com.agentforge.orchestrator.error.ConfigurationException;
import com.agentforge.orchestrator.error.StageExecutionException;
import com.agentforge.orchestrator.model.StageConfig;
import com.agentforge.orchestrator.model.StageId;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageAgentRegistryTest {

    SimpleMeterRegistry meters = new SimpleMeterRegistry();

    @Test
    void execute_success_recordsTimerAndCounter() {
        StageAgentRegistry registry = new StageAgentRegistry(List.of(
                agent(StageId.SCRIBE, StageResult.success("doc", List.of(), Map.of(), null))), meters);

        StageResult result = registry.execute(StageId.SCRIBE, StageConfig.enabledDefaults(), Map.of());

        assertThat(result.outputSummary()).isEqualTo("doc");
        assertThat(meters.get("agentforge.stage.duration").tag("stage", "scribe").timer().count())
                .isEqualTo(1);
        assertThat(meters.get("agentforge.stage.calls").tags("stage", "scribe", "status", "success")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void execute_unexpectedException_isWrappedAndCountedAsError() {
        StageAgent broken = new StageAgent() {
            @Override public StageId stage() { return StageId.FORGE; }
            @Override public StageResult execute(StageConfig config, Map<String, Object> context) {
                throw new IllegalStateException("disk full");
            }
        };
        StageAgentRegistry registry = new StageAgentRegistry(List.of(broken), meters);

        assertThatThrownBy(() -> registry.execute(StageId.FORGE, StageConfig.enabledDefaults(), Map.of()))
                .isInstanceOf(StageExecutionException.class)
                .hasMessage("disk full")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(meters.get("agentforge.stage.calls").tags("stage", "forge", "status", "error")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void get_missingStage_throws() {
        StageAgentRegistry registry = new StageAgentRegistry(List.of(), meters);

        assertThatThrownBy(() -> registry.get(StageId.PHOENIX))
                .isInstanceOf(StageExecutionException.class)
                .hasMessageContaining("no agent registered");
    }

    @Test
    void constructor_twoAgentsForOneStage_isRejected() {
        StageResult ok = StageResult.success("", List.of(), Map.of(), null);

        assertThatThrownBy(() -> new StageAgentRegistry(
                List.of(agent(StageId.SCRIBE, ok), agent(StageId.SCRIBE, ok)), meters))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("scribe");
    }

    private static StageAgent agent(StageId stage, StageResult result) {
        return new StageAgent() {
            @Override public StageId stage() { return stage; }
            @Override public StageResult execute(StageConfig config, Map<String, Object> context) {
                return result;
            }
        };
    }
}
