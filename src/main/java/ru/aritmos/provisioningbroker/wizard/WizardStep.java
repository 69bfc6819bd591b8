package ru.aritmos.provisioningbroker.wizard;

/**
 * Шаги мастера создания интеграции.
 */
public enum WizardStep {
    NAVIGATE,
    OPEN_FORM,
    NAME,
    SELECT_SCOPES,
    SUBMIT,
    EXTRACT_TOKEN,
    DONE
}
