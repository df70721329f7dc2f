package com.brayford.organization.api;

import com.brayford.organization.config.DeletionProperties;
import com.brayford.organization.config.OrganizationServiceProperties;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight service info endpoint: identity plus the active deletion timings.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final OrganizationServiceProperties properties;
    private final DeletionProperties deletion;
    private final Clock clock;

    public ServiceInfoController(OrganizationServiceProperties properties, DeletionProperties deletion, Clock clock) {
        this.properties = properties;
        this.deletion = deletion;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        var info = new LinkedHashMap<String, Object>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description() != null ? properties.description() : "");
        info.put("status", "running");
        info.put("deletion", Map.of(
                "tokenTtl", deletion.tokenTtl().toString(),
                "gracePeriod", deletion.gracePeriod().toString(),
                "undoWindow", deletion.undoWindow().toString()));
        info.put("timestamp", clock.instant().toString());
        return info;
    }
}
