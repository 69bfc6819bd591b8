package ru.aritmos.provisioningbroker.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Хранилище в памяти: запоминает вызовы upsert, может имитировать отказ БД.
 */
public class RecordingCredentialStore extends CredentialStore {

    private final List<CredentialModels.CredentialUpdate> updates = new ArrayList<>();
    private final Map<String, CredentialModels.TenantCredentialRecord> records = new HashMap<>();
    private boolean failing;

    public RecordingCredentialStore() {
        super(null);
    }

    public RecordingCredentialStore failing() {
        this.failing = true;
        return this;
    }

    @Override
    public synchronized CredentialModels.PersistOutcome upsert(String tenantId, CredentialModels.CredentialUpdate update) {
        if (failing) {
            return CredentialModels.PersistOutcome.fail("Connection refused");
        }
        updates.add(update);
        boolean inserted = !records.containsKey(tenantId);
        records.put(tenantId, new CredentialModels.TenantCredentialRecord(tenantId,
                update.bearerToken(), update.bearerIssuedAt(), update.bearerExpiresAt(),
                update.sessionToken(), update.sessionExpiresAt(), update.refreshToken(), update.integrationToken(),
                null, null));
        return CredentialModels.PersistOutcome.ok(inserted);
    }

    @Override
    public synchronized Optional<CredentialModels.TenantCredentialRecord> find(String tenantId) {
        return Optional.ofNullable(records.get(tenantId));
    }

    @Override
    public void ping() {
        if (failing) {
            throw new IllegalStateException("Хранилище учётных данных недоступно: Connection refused");
        }
    }

    public synchronized List<CredentialModels.CredentialUpdate> updates() {
        return List.copyOf(updates);
    }
}
