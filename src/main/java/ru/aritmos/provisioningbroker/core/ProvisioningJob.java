package ru.aritmos.provisioningbroker.core;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Задание выдачи учётных данных.
 * <p>
 * Изменяется только оркестратором (из потока задания); читается из любого потока.
 */
public final class ProvisioningJob {

    private final String jobId;
    private final String tenantId;
    private final String loginIdentity;
    private final String targetTenantHandle;
    private final List<String> scopes;
    private final ProvisioningModels.Flavor flavor;
    private final Instant createdAt;
    private final Clock clock;

    private volatile ProvisioningModels.JobStatus status = ProvisioningModels.JobStatus.PENDING;
    private volatile Instant updatedAt;
    private volatile ProvisioningModels.ProvisioningResult result;

    public ProvisioningJob(String jobId,
                           String tenantId,
                           String loginIdentity,
                           String targetTenantHandle,
                           List<String> scopes,
                           ProvisioningModels.Flavor flavor,
                           Clock clock) {
        this.jobId = jobId;
        this.tenantId = tenantId;
        this.loginIdentity = loginIdentity;
        this.targetTenantHandle = targetTenantHandle;
        this.scopes = scopes == null ? List.of() : List.copyOf(scopes);
        this.flavor = flavor == null ? ProvisioningModels.Flavor.FULL_PROVISIONING : flavor;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.createdAt = this.clock.instant();
        this.updatedAt = createdAt;
    }

    public String jobId() {
        return jobId;
    }

    public String tenantId() {
        return tenantId;
    }

    public String loginIdentity() {
        return loginIdentity;
    }

    public String targetTenantHandle() {
        return targetTenantHandle;
    }

    public List<String> scopes() {
        return scopes;
    }

    public ProvisioningModels.Flavor flavor() {
        return flavor;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public ProvisioningModels.JobStatus status() {
        return status;
    }

    public ProvisioningModels.ProvisioningResult result() {
        return result;
    }

    /**
     * Перевести задание в новый статус. Завершённое задание не меняется.
     */
    synchronized void transition(ProvisioningModels.JobStatus next) {
        if (status.isTerminal() || next == null) {
            return;
        }
        status = next;
        updatedAt = clock.instant();
    }

    /**
     * Завершить задание с итогом.
     */
    synchronized void complete(ProvisioningModels.ProvisioningResult r) {
        if (status.isTerminal()) {
            return;
        }
        result = r;
        status = r != null && r.isSuccess() ? ProvisioningModels.JobStatus.COMPLETED : ProvisioningModels.JobStatus.FAILED;
        updatedAt = clock.instant();
    }

    public String logPrefix() {
        return "[PROVISIONING][job=" + jobId + "][tenant=" + tenantId + "]";
    }
}
