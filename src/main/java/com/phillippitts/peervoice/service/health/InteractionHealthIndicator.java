package com.phillippitts.peervoice.service.health;

import com.phillippitts.peervoice.service.interaction.InteractionState;
import com.phillippitts.peervoice.service.interaction.InteractionStateMachine;
import com.phillippitts.peervoice.service.interaction.SessionStats;
import com.phillippitts.peervoice.service.stt.SpeechRecognizer;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the voice session.
 *
 * <ul>
 *   <li>UP: session running and recognizer ready</li>
 *   <li>DEGRADED: session alive but the recognizer is unhealthy</li>
 *   <li>DOWN: session terminated</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class InteractionHealthIndicator implements HealthIndicator {

    private final InteractionStateMachine stateMachine;
    private final SpeechRecognizer recognizer;

    public InteractionHealthIndicator(InteractionStateMachine stateMachine, SpeechRecognizer recognizer) {
        this.stateMachine = stateMachine;
        this.recognizer = recognizer;
    }

    @Override
    public Health health() {
        InteractionState state = stateMachine.getState();
        SessionStats stats = stateMachine.stats();
        Health.Builder builder;
        if (state == InteractionState.TERMINATED) {
            builder = Health.down().withDetail("status", "Session terminated");
        } else if (!recognizer.isHealthy()) {
            builder = Health.status("DEGRADED").withDetail("status", "Recognizer unavailable");
        } else {
            builder = Health.up().withDetail("status", "Session operational");
        }
        return builder
                .withDetail("state", state.name())
                .withDetail("paused", stateMachine.isPaused())
                .withDetail("recognizer", recognizer.getEngineName())
                .withDetail("batchesCompleted", stats.batchesCompleted())
                .withDetail("commandsProcessed", stats.commandsProcessed())
                .withDetail("echoesSuppressed", stats.echoesSuppressed())
                .build();
    }
}
