package com.phillippitts.platemate.presentation.controller;

import com.phillippitts.platemate.service.session.SessionController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Liveness endpoint. The request passes the MDC filter, so the log line shows the request id.
 */
@RestController
class PingController {

    private static final Logger LOG = LogManager.getLogger(PingController.class);

    private final SessionController session;

    PingController(SessionController session) {
        this.session = session;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        LOG.info("Ping received (session={})", session.state());
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "session", session.state().name(),
                "timestamp", Instant.now().toString()
        ));
    }
}
