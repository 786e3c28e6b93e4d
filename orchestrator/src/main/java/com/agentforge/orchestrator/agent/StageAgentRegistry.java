package com.agentforge.orchestrator.agent;

import com.agentforge.orchestrator.error.ConfigurationException;
import com.agentforge.orchestrator.error.StageExecutionException;
import com.agentforge.orchestrator.model.StageConfig;
import com.agentforge.orchestrator.model.StageId;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One {@link StageAgent} per stage, collected from the Spring context.
 *
 * <p>Every run goes through {@link #execute}, which times and counts it:
 * <pre>
 *   agentforge.stage.duration{stage}
 *   agentforge.stage.calls{stage, status="success|fix_needed|error"}
 * </pre>
 */
@Component
public class StageAgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageAgentRegistry.class);

    private final Map<StageId, StageAgent> agents = new EnumMap<>(StageId.class);
    private final MeterRegistry meterRegistry;

    public StageAgentRegistry(List<StageAgent> allAgents, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (StageAgent agent : allAgents) {
            StageAgent previous = agents.put(agent.stage(), agent);
            if (previous != null) {
                throw new ConfigurationException("Two agents registered for stage " + agent.stage().id()
                        + ": " + previous.getClass().getSimpleName()
                        + " and " + agent.getClass().getSimpleName());
            }
            log.info("Registered {} for stage '{}'", agent.getClass().getSimpleName(), agent.stage().id());
        }
    }

    public StageAgent get(StageId stage) {
        StageAgent agent = agents.get(stage);
        if (agent == null) {
            throw new StageExecutionException(stage, "no agent registered");
        }
        return agent;
    }

    /**
     * Run a stage with metrics. Anything other than a
     * {@link StageExecutionException} is wrapped into one.
     */
    public StageResult execute(StageId stage, StageConfig config, Map<String, Object> context) {
        StageAgent agent = get(stage);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            StageResult result = agent.execute(config, context);
            status = result.isFixNeeded() ? "fix_needed" : "success";
            return result;
        } catch (StageExecutionException e) {
            throw e;
        } catch (Exception e) {
            throw new StageExecutionException(stage, e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("agentforge.stage.duration", "stage", stage.id()));
            meterRegistry.counter("agentforge.stage.calls", "stage", stage.id(), "status", status).increment();
        }
    }
}
