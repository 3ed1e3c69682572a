package com.rolloutstream.dispatch.cli;

import com.rolloutstream.core.health.HealthCheckService;
import com.rolloutstream.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: rollout-stream health
 * <p>
 * Checks that the Kubernetes API server is reachable. Exits non-zero when it is not.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check cluster connectivity")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        boolean down = false;
        for (HealthStatus check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            if (check.clusterVersion() != null) {
                label += " (" + check.clusterVersion() + ")";
            }
            if (check.isDown()) {
                ConsoleOutput.error(label);
                down = true;
            } else {
                ConsoleOutput.success(label);
            }
        }
        return down ? 1 : 0;
    }
}
