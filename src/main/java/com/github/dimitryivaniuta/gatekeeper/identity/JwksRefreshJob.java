package com.github.dimitryivaniuta.gatekeeper.identity;

import com.github.dimitryivaniuta.gatekeeper.config.GatekeeperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Periodically reloads the verification key set every {@code gatekeeper.token.refresh-interval}.
 * The first run happens at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwksRefreshJob implements SchedulingConfigurer {

    private final VerificationKeyProvider keyProvider;
    private final GatekeeperProperties properties;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration interval = properties.getToken().getRefreshInterval();
        registrar.addFixedDelayTask(new FixedDelayTask(this::refreshKeys, interval, Duration.ZERO));
    }

    public void refreshKeys() {
        if (keyProvider.refresh()) {
            log.debug("Verification keys refreshed: {} known", keyProvider.currentKeys().size());
        }
    }
}
