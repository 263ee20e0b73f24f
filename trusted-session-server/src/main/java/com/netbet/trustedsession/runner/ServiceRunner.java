package com.netbet.trustedsession.runner;

import com.netbet.trustedsession.refresh.AutoRefreshLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Server mode: once the HTTP listener is up, start the auto refresh loop. Its first iteration
 * generates the initial token.
 */
@Component
@ConditionalOnProperty(name = "trusted-session.oneshot", havingValue = "false", matchIfMissing = true)
public class ServiceRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ServiceRunner.class);

    private final AutoRefreshLoop autoRefreshLoop;
    private final boolean autoRefreshEnabled;

    public ServiceRunner(AutoRefreshLoop autoRefreshLoop,
                         @Value("${trusted-session.auto-refresh.enabled:true}") boolean autoRefreshEnabled) {
        this.autoRefreshLoop = autoRefreshLoop;
        this.autoRefreshEnabled = autoRefreshEnabled;
    }

    @Override
    public void run(String... args) {
        log.info("Starting Trusted Session Generator (autoRefresh={})", autoRefreshEnabled);
        if (autoRefreshEnabled) {
            autoRefreshLoop.start();
        } else {
            log.info("Auto refresh disabled; tokens are generated on demand only");
        }
    }
}
