package io.agentrelay.storage;

import io.agentrelay.model.BrokerSnapshot;

import java.util.Optional;

/**
 * Durable home for broker state between runs. The broker itself never calls a
 * store; the runtime restores on start and saves on close.
 */
public interface PersistentStore {
    void save(BrokerSnapshot snapshot);

    Optional<BrokerSnapshot> load();
}
