package com.hidego.registration;

import com.hidego.config.SecretsConfig;
import com.hidego.routing.UpdateRoutes;
import com.hidego.tenant.RuntimeCreationException;
import com.hidego.tenant.TenantRuntimeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Brings up the dispatcher bot once the application is ready.
 */
@Component
public class DispatcherBootstrap {

    private static final Logger log = LoggerFactory.getLogger(DispatcherBootstrap.class);

    private final TenantRuntimeManager manager;
    private final RegistrationCommandHandler commands;
    private final SecretsConfig secrets;

    public DispatcherBootstrap(TenantRuntimeManager manager, RegistrationCommandHandler commands,
                               SecretsConfig secrets) {
        this.manager = manager;
        this.commands = commands;
        this.secrets = secrets;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void attachDispatcher() {
        String token = secrets.getMainBotToken();
        if (token == null || token.isBlank()) {
            log.warn("hidego.secrets.main-bot-token is not set, running without a dispatcher bot");
            return;
        }
        try {
            manager.attachDispatcher(token, dispatcherRoutes());
        } catch (RuntimeCreationException | IllegalStateException e) {
            log.error("Dispatcher bot could not be started", e);
        }
    }

    UpdateRoutes dispatcherRoutes() {
        return UpdateRoutes.builder()
                .onCommand("start", commands::start)
                .onCommand("register", commands::register)
                .onCommand("revoke", commands::revoke)
                .onCommand("privacy", commands::privacy)
                .onCommand("about", commands::about)
                .build();
    }
}
