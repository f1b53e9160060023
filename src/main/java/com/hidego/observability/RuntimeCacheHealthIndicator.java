package com.hidego.observability;

import com.hidego.tenant.TenantRuntime;
import com.hidego.tenant.TenantRuntimeManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class RuntimeCacheHealthIndicator implements HealthIndicator {

    private final TenantRuntimeManager manager;

    public RuntimeCacheHealthIndicator(TenantRuntimeManager manager) {
        this.manager = manager;
    }

    @Override
    public Health health() {
        TenantRuntime dispatcher = manager.getDispatcher();
        boolean running = dispatcher != null && dispatcher.isRunning();

        Health.Builder builder = running ? Health.up() : Health.down();
        builder.withDetail("dispatcher", running ? "running" : "not running")
                .withDetail("liveRuntimes", manager.liveCount())
                .withDetail("capacity", manager.capacity());
        if (dispatcher != null) {
            builder.withDetail("dispatcherLastUpdate", dispatcher.getLastActivity().toString());
        }
        return builder.build();
    }
}
