package ru.aritmos.provisioningbroker.checks;

import jakarta.inject.Singleton;
import ru.aritmos.provisioningbroker.store.CredentialStore;

/**
 * Проверка доступности таблицы учётных данных.
 */
@Singleton
public class CredentialStoreChecker {

    private final CredentialStore credentialStore;

    public CredentialStoreChecker(CredentialStore credentialStore) {
        this.credentialStore = credentialStore;
    }

    public void check(StartupChecksConfiguration.CheckConfig cfg) {
        credentialStore.ping();
    }
}
