package dao.railroad.cargo.service;

import dao.railroad.cargo.config.ChainProperties;
import dao.railroad.cargo.config.LedgerProperties;
import dao.railroad.cargo.model.BatchTotals;
import dao.railroad.cargo.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * Commitment over a batch's ciphertext handles and the ledger's own identity.
 * <p>
 * stateHash = keccak256(abi.encodePacked(demand, supply, profit, uint256(chainId), address(ledger)))
 */
@Slf4j
@Service
public class StateHasher {

    static final long DEFAULT_CHAIN_ID = 31337L;

    private final byte[] ledgerAddress20;
    private final byte[] chainId32;

    public StateHasher(LedgerProperties ledgerProps, ChainProperties chainProps) {
        String address = ledgerProps.getAddress();
        if (address == null || address.isBlank()) {
            throw new IllegalStateException("ledger.address must be configured");
        }
        this.ledgerAddress20 = Numeric.hexStringToByteArray(address.trim());
        if (ledgerAddress20.length != 20) {
            throw new IllegalStateException("ledger.address must be a 20-byte hex address: " + address);
        }

        long chainId = chainProps.getId() != null ? chainProps.getId() : DEFAULT_CHAIN_ID;
        this.chainId32 = new byte[32];
        byte[] cid = BigInteger.valueOf(chainId).toByteArray();
        int len = Math.min(cid.length, 32);
        System.arraycopy(cid, cid.length - len, chainId32, 32 - len, len);

        log.info("StateHasher initialized: ledger={}, chainId={}", CryptoUtil.toHex0x(ledgerAddress20), chainId);
    }

    public String stateHash(BatchTotals totals) {
        byte[] packed = CryptoUtil.concat(
                totals.demand().toCommitmentBytes(),
                totals.supply().toCommitmentBytes(),
                totals.profit().toCommitmentBytes(),
                chainId32,
                ledgerAddress20
        );
        return CryptoUtil.toHex0x(CryptoUtil.keccak256(packed));
    }
}
