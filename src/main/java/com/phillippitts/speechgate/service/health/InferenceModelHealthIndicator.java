package com.phillippitts.speechgate.service.health;

import com.phillippitts.speechgate.service.inference.ModelAccessCoordinator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the inference runtimes are configured and executable, plus the number of
 * calls queued for the model.
 *
 * <p>Gives the same readiness answer as the {@code check_status} action. Exposed via
 * /actuator/health.
 */
@Component
public class InferenceModelHealthIndicator implements HealthIndicator {

    private final ModelAccessCoordinator coordinator;

    public InferenceModelHealthIndicator(ModelAccessCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        boolean configured = coordinator.isModelConfigured();
        boolean ready = coordinator.isModelReady();
        Health.Builder builder = ready ? Health.up() : Health.down();
        return builder
                .withDetail("configured", configured)
                .withDetail("ready", ready)
                .withDetail("busy", coordinator.isBusy())
                .withDetail("queued", coordinator.queueLength())
                .build();
    }
}
