package com.phillippitts.peervoice.presentation.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Liveness endpoint; the request passes through {@code MdcFilter} so its log line carries the
 * request id.
 */
@RestController
class PingController {

    private static final Logger LOG = LogManager.getLogger(PingController.class);

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        LOG.info("Ping received");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", Instant.now().toString()
        ));
    }
}
