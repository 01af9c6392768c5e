package com.phillippitts.peervoice.presentation.controller;

import com.phillippitts.peervoice.service.interaction.GlobalCommand;
import com.phillippitts.peervoice.service.interaction.InteractionStateMachine;
import com.phillippitts.peervoice.service.interaction.SessionStats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Programmatic control of the voice session: manual activation, global commands and a status view.
 */
@RestController
@RequestMapping("/api/session")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final InteractionStateMachine stateMachine;

    SessionController(InteractionStateMachine stateMachine) {
        this.stateMachine = stateMachine;
    }

    @PostMapping("/activate")
    ResponseEntity<Map<String, Object>> activate() {
        LOG.info("Activation requested via REST");
        stateMachine.activate();
        return ResponseEntity.accepted().body(Map.of("state", stateMachine.getState().name()));
    }

    @PostMapping("/commands/{command}")
    ResponseEntity<Map<String, Object>> command(@PathVariable("command") String command) {
        GlobalCommand parsed = GlobalCommand.fromName(command)
                .orElseThrow(() -> new UnknownCommandException(command));
        LOG.info("Global command {} requested via REST", parsed);
        stateMachine.submitGlobalCommand(parsed);
        return ResponseEntity.accepted().body(Map.of(
                "command", parsed.name(),
                "state", stateMachine.getState().name()));
    }

    @GetMapping
    ResponseEntity<SessionView> status() {
        return ResponseEntity.ok(new SessionView(
                stateMachine.getSessionId(),
                stateMachine.getState().name(),
                stateMachine.isPaused(),
                stateMachine.stats()));
    }

    record SessionView(String sessionId, String state, boolean paused, SessionStats stats) {}
}
