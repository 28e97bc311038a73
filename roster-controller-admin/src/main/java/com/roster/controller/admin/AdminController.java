package com.roster.controller.admin;

import com.roster.player.model.PlayerKey;
import com.roster.service.core.ratelimit.SlidingWindowRateLimiter;
import com.roster.service.core.registry.PlayerRegistry;
import com.roster.service.core.registry.RegistryExpiryJob;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Operator endpoints. Off unless {@code roster.admin.enabled=true}; there is no authentication in front of them. */
@RestController
@RequestMapping("/admin")
@ConditionalOnProperty(prefix = "roster.admin", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final PlayerRegistry registry;
    private final SlidingWindowRateLimiter rateLimiter;
    private final RegistryExpiryJob expiryJob;

    @GetMapping("/registry")
    public Map<String, Object> registryStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("entries", registry.size());
        stats.put("trackedOrigins", rateLimiter.trackedOrigins());
        stats.put("rateLimitWindowMillis", rateLimiter.window().toMillis());
        stats.put("rateLimitMaxRequests", rateLimiter.maxRequests());
        return stats;
    }

    @DeleteMapping("/players/{playerName}/{jobId}")
    public ResponseEntity<Void> removePlayer(@PathVariable String playerName, @PathVariable String jobId) {
        boolean removed = registry.remove(new PlayerKey(playerName, jobId));
        if (!removed) {
            return ResponseEntity.notFound().build();
        }
        log.info("Admin removed player {} on job {}", playerName, jobId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/registry/sweep")
    public RegistryExpiryJob.SweepResult sweep() {
        return expiryJob.sweep();
    }
}
