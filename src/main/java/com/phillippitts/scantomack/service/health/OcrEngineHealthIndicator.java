package com.phillippitts.scantomack.service.health;

import com.phillippitts.scantomack.domain.EngineId;
import com.phillippitts.scantomack.service.ocr.registry.EngineHealthReport;
import com.phillippitts.scantomack.service.ocr.registry.EngineRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for the configured OCR engines.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: every configured engine available</li>
 *   <li>DEGRADED: at least one engine available</li>
 *   <li>DOWN: no engine available (or none configured)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class OcrEngineHealthIndicator implements HealthIndicator {

    private final EngineRegistry registry;

    public OcrEngineHealthIndicator(EngineRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        EngineHealthReport report = registry.health();
        long available = report.availableCount();
        int configured = report.engines().size();

        Health.Builder builder = new Health.Builder();
        if (configured > 0 && available == configured) {
            builder.up().withDetail("status", "All engines operational");
        } else if (available > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial engine availability");
        } else {
            builder.down().withDetail("status", "No engines available");
        }
        for (Map.Entry<EngineId, Boolean> e : report.engines().entrySet()) {
            builder.withDetail(e.getKey().wireName(), e.getValue() ? "ready" : "unavailable");
        }
        return builder
                .withDetail("workerPoolSize", report.workerPoolSize())
                .withDetail("bridgeProcessCount", report.bridgeProcessCount())
                .build();
    }
}
