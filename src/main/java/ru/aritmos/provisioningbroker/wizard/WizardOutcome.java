package ru.aritmos.provisioningbroker.wizard;

import ru.aritmos.provisioningbroker.core.ProvisioningModels;

import java.util.List;

/**
 * Итог мастера создания интеграции.
 *
 * @param reachedStep    последний начатый шаг ({@link WizardStep#DONE} при успехе)
 * @param token          токен интеграции
 * @param path           путь извлечения токена
 * @param acceptedScopes принятые консолью права
 * @param skippedScopes  отклонённые права
 */
public record WizardOutcome(WizardStep reachedStep,
                            boolean success,
                            String token,
                            ExtractionPath path,
                            List<String> acceptedScopes,
                            List<String> skippedScopes,
                            ProvisioningModels.ErrorCode errorCode,
                            String reason) {

    public static WizardOutcome done(String token, ExtractionPath path, List<String> accepted, List<String> skipped) {
        return new WizardOutcome(WizardStep.DONE, true, token, path, List.copyOf(accepted), List.copyOf(skipped), null, null);
    }

    public static WizardOutcome failed(WizardStep step,
                                       List<String> accepted,
                                       List<String> skipped,
                                       ProvisioningModels.ErrorCode code,
                                       String reason) {
        return new WizardOutcome(step, false, null, ExtractionPath.NONE, List.copyOf(accepted), List.copyOf(skipped), code, reason);
    }
}
