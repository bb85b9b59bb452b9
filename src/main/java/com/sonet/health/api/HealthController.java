package com.sonet.health.api;

import com.sonet.post.store.PostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness plus a round trip to the bound storage backend. Always answers 200; a failing
 * database is reported in the body.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    static final String SERVICE_NAME = "sonet-api";

    private final PostStore postStore;

    @GetMapping
    public Map<String, Object> health() {
        Map<String, Object> db = new LinkedHashMap<>();
        long start = System.nanoTime();
        try {
            postStore.ping();
            db.put("status", "ok");
        } catch (DataAccessException e) {
            log.warn("health.db failed adapter={} error={}", postStore.adapterName(), e.getMessage());
            db.put("status", "error: " + e.getMostSpecificCause().getMessage());
        }
        db.put("latencyMs", (System.nanoTime() - start) / 1_000_000);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", SERVICE_NAME);
        body.put("adapter", postStore.adapterName());
        body.put("database", db);
        return body;
    }
}
