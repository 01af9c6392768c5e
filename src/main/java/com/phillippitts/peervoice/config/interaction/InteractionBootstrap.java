package com.phillippitts.peervoice.config.interaction;

import com.phillippitts.peervoice.service.batch.SpeechBatcher;
import com.phillippitts.peervoice.service.interaction.AudioPipeline;
import com.phillippitts.peervoice.service.interaction.InteractionState;
import com.phillippitts.peervoice.service.interaction.InteractionStateChangedEvent;
import com.phillippitts.peervoice.service.interaction.InteractionStateMachine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Starts the session once the application is ready (when {@code interaction.auto-start=true})
 * and tears the pipeline down when the session terminates.
 */
@Component
class InteractionBootstrap {

    private static final Logger LOG = LogManager.getLogger(InteractionBootstrap.class);

    private final InteractionProperties props;
    private final SpeechBatcher batcher;
    private final AudioPipeline pipeline;
    private final InteractionStateMachine stateMachine;

    InteractionBootstrap(InteractionProperties props, SpeechBatcher batcher, AudioPipeline pipeline,
                         InteractionStateMachine stateMachine) {
        this.props = props;
        this.batcher = batcher;
        this.pipeline = pipeline;
        this.stateMachine = stateMachine;
    }

    @EventListener(ApplicationReadyEvent.class)
    void onApplicationReady() {
        if (!props.isAutoStart()) {
            LOG.info("interaction.auto-start=false; session not started");
            return;
        }
        batcher.start();
        pipeline.start();
        stateMachine.start();
    }

    @Async("eventExecutor")
    @EventListener
    void onStateChanged(InteractionStateChangedEvent event) {
        if (event.to() != InteractionState.TERMINATED) {
            return;
        }
        LOG.info("Session terminated; stopping audio pipeline and batcher");
        pipeline.stop();
        batcher.stop();
    }
}
