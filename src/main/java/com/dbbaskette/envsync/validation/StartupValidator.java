package com.dbbaskette.envsync.validation;

import com.dbbaskette.envsync.config.EnvSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class StartupValidator {

    private static final Logger log = LoggerFactory.getLogger(StartupValidator.class);

    private final EnvSyncProperties properties;

    public StartupValidator(EnvSyncProperties properties) {
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validate() {
        log.info("=== EnvSync Startup Validation ===");

        validateGitHubToken();
        validateApiToken();
        validateProjects();

        log.info("=== Startup Validation Complete ===");
    }

    private void validateGitHubToken() {
        if (properties.getGithub().hasToken()) {
            log.info("[OK] GitHub token configured");
        } else {
            log.warn("[WARN] GitHub token not configured. Set GITHUB_TOKEN; only dry runs will work.");
        }
    }

    private void validateApiToken() {
        if (properties.getApi().isSecured()) {
            log.info("[OK] API bearer token configured");
        } else {
            log.warn("[WARN] API token not configured. /secrets and /environments are open. Set ENVSYNC_API_TOKEN.");
        }
    }

    private void validateProjects() {
        int count = properties.getProjects().size();
        if (count > 0) {
            log.info("[OK] {} project(s) configured", count);
        } else {
            log.warn("[WARN] No projects configured under envsync.projects");
        }
        if (properties.getSchedule().isEnabled()) {
            log.info("[OK] Scheduled distribution every {} hour(s)", properties.getSchedule().getIntervalHours());
        }
    }
}
