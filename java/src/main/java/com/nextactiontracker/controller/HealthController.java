package com.nextactiontracker.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping
public class HealthController {

    static final String VERSION = "1.0.0";

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of(
            "message", "Next Action Tracker API",
            "version", VERSION
        ));
    }

    @GetMapping("/health")
    public Mono<Map<String, String>> health() {
        return Mono.just(Map.of(
            "status", "healthy",
            "service", "next-action-tracker-api"
        ));
    }
}
