package com.sreagent.core.orchestrator;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "sreagent.orchestrator")
public class OrchestratorProperties {

    /** How long a finished worker stays inspectable before it is destroyed. */
    private Duration cooldown = Duration.ofSeconds(120);

    /** Worker kind used when the classifier fails or names an unknown kind. */
    private String defaultKind = "health_worker";

    private String defaultAction = "check_all";

    private int historySize = 100;

    private int maxCompleted = 200;

    public Duration getCooldown() {
        return cooldown;
    }

    public void setCooldown(Duration cooldown) {
        this.cooldown = cooldown;
    }

    public String getDefaultKind() {
        return defaultKind;
    }

    public void setDefaultKind(String defaultKind) {
        this.defaultKind = defaultKind;
    }

    public String getDefaultAction() {
        return defaultAction;
    }

    public void setDefaultAction(String defaultAction) {
        this.defaultAction = defaultAction;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public int getMaxCompleted() {
        return maxCompleted;
    }

    public void setMaxCompleted(int maxCompleted) {
        this.maxCompleted = maxCompleted;
    }
}
