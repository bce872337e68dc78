package dao.railroad.cargo.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "oracle")
@Data
public class OracleProperties {

    /**
     * KMS signing keys (hex, 64 characters) used by the local decryption oracle.
     */
    private List<String> kmsPrivateKeys = new ArrayList<>();

    /**
     * Addresses whose signatures the ledger accepts on decryption proofs.
     * When empty, the addresses of {@code kmsPrivateKeys} are used.
     */
    private List<String> kmsSigners = new ArrayList<>();

    /**
     * Number of distinct KMS signatures a proof needs.
     * Default: 1
     */
    private int threshold = 1;
}
