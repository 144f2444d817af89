package dev.fairbid.games.escrow.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Funds transfer that credits balances held in memory. Principals can be marked as unable to receive.
 */
public class InMemoryAccounts implements FundsTransfer {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryAccounts.class);

    private final Map<String, Long> balances = new HashMap<>();
    private final Set<String> unreceivable = new HashSet<>();

    public synchronized void refuseTransfersTo(String principal) {
        unreceivable.add(principal);
    }

    public synchronized void acceptTransfersTo(String principal) {
        unreceivable.remove(principal);
    }

    @Override
    public synchronized void transfer(String recipient, long amount) throws TransferFailedException {
        if (amount <= 0) {
            throw new TransferFailedException(recipient, amount, "amount must be positive");
        }
        if (unreceivable.contains(recipient)) {
            throw new TransferFailedException(recipient, amount, recipient + " does not accept transfers");
        }
        balances.merge(recipient, amount, Long::sum);
        logger.debug("funds_credited", kv("recipient", recipient), kv("amount", amount));
    }

    public synchronized long balanceOf(String principal) {
        return balances.getOrDefault(principal, 0L);
    }

    public synchronized long totalCredited() {
        return balances.values().stream().mapToLong(Long::longValue).sum();
    }
}
