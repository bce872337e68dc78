package dao.railroad.cargo.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "ledger")
@Validated
@Data
public class LedgerProperties {

    /**
     * Owner actor id (0x-prefixed address).
     * Example: 0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266
     */
    @NotBlank
    private String owner;

    /**
     * Ledger identity (20-byte hex address). Folded into every state hash so a proof
     * produced for one deployment cannot be replayed against another.
     */
    @NotBlank
    private String address;

    /**
     * Initial provider allowlist. May be a list or a single comma-separated string.
     */
    private List<String> providers = new ArrayList<>();

    /**
     * Minimum time between two throttled calls from the same actor.
     * Default: 60s. Never below the 10s protocol floor.
     */
    private Duration cooldownInterval = Duration.ofSeconds(60);

    /**
     * Model version in effect at startup.
     * Default: 1
     */
    private long initialModelVersion = 1L;
}
