package com.llmcouncil.presentation.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Liveness endpoint. Also a cheap way to see the MDC fields in the log output.
 */
@RestController
class StatusController {

    private static final Logger log = LogManager.getLogger(StatusController.class);

    @GetMapping("/")
    ResponseEntity<Map<String, Object>> status() {
        log.debug("Status requested");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "llm-council",
                "timestamp", Instant.now().toString()
        ));
    }
}
