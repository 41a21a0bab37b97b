package com.tracechain.ledger;

import com.tracechain.domain.LedgerId;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Clients built once at startup for the enabled ledgers. Injected wherever a ledger is selected by id.
 */
public class LedgerClientRegistry {

    private final Map<LedgerId, LedgerClient> clients;

    public LedgerClientRegistry(Collection<? extends LedgerClient> clients) {
        Map<LedgerId, LedgerClient> byId = new EnumMap<>(LedgerId.class);
        for (LedgerClient client : clients) {
            if (byId.put(client.ledgerId(), client) != null) {
                throw new IllegalArgumentException("Duplicate ledger client for " + client.ledgerId());
            }
        }
        this.clients = Collections.unmodifiableMap(byId);
    }

    /**
     * @throws LedgerConfigurationException when the ledger is not enabled
     */
    public LedgerClient require(LedgerId ledgerId) {
        LedgerClient client = clients.get(ledgerId);
        if (client == null) {
            throw new LedgerConfigurationException("Ledger client not configured: " + ledgerId);
        }
        return client;
    }

    public Optional<LedgerClient> find(LedgerId ledgerId) {
        return Optional.ofNullable(clients.get(ledgerId));
    }

    public Set<LedgerId> enabledLedgers() {
        return clients.keySet();
    }
}
