package dao.railroad.cargo.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "chain")
@Data
public class ChainProperties {

    /**
     * Chain id of the deployment, part of the ledger identity in state hashes.
     * Local dev chain: 31337
     */
    private Long id;
}
