package dao.railroad.cargo.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private RelayConfig relay = new RelayConfig();

    @Data
    public static class RelayConfig {
        /**
         * Enable/disable delivery of oracle fulfilments back into the ledger
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to check for fulfilled oracle requests (in milliseconds)
         * Default: 2000ms (2 seconds)
         */
        private long checkIntervalMs = 2000;
    }
}
