package ru.aritmos.provisioningbroker.api;

import io.micronaut.core.annotation.Introspected;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.security.annotation.Secured;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import ru.aritmos.provisioningbroker.core.ProvisioningJob;
import ru.aritmos.provisioningbroker.core.ProvisioningJobService;
import ru.aritmos.provisioningbroker.core.ProvisioningModels;
import ru.aritmos.provisioningbroker.core.SensitiveDataSanitizer;
import ru.aritmos.provisioningbroker.security.ProvisioningRoles;
import ru.aritmos.provisioningbroker.store.CredentialModels;
import ru.aritmos.provisioningbroker.store.CredentialStore;
import ru.aritmos.provisioningbroker.token.CapturedToken;
import ru.aritmos.provisioningbroker.token.TokenKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * API заданий выдачи учётных данных.
 * <p>
 * Значения токенов наружу не отдаются: только признак наличия и сроки действия.
 */
@Secured({ProvisioningRoles.OPERATOR, ProvisioningRoles.ADMIN})
@Controller("/api/provisioning")
@Tag(name = "Provisioning Broker: задания", description = "Запуск заданий и просмотр их статуса")
public class ProvisioningController {

    private final ProvisioningJobService jobService;
    private final CredentialStore credentialStore;

    public ProvisioningController(ProvisioningJobService jobService, CredentialStore credentialStore) {
        this.jobService = jobService;
        this.credentialStore = credentialStore;
    }

    @Post(uri = "/jobs", consumes = MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Запустить задание",
            description = "Задание выполняется асинхронно. Если для арендатора уже выполняется задание, возвращается оно."
    )
    @ApiResponse(responseCode = "202", description = "Задание принято", content = @Content(schema = @Schema(implementation = JobView.class)))
    @ApiResponse(responseCode = "400", description = "Некорректный запрос")
    public HttpResponse<?> submit(@Body ProvisioningModels.JobRequest request) {
        try {
            ProvisioningJob job = jobService.submit(request);
            return HttpResponse.status(HttpStatus.ACCEPTED).body(JobView.of(job));
        } catch (IllegalArgumentException ex) {
            return HttpResponse.badRequest(Map.of(
                    "errorCode", "BAD_REQUEST",
                    "message", SensitiveDataSanitizer.sanitizeText(ex.getMessage())));
        }
    }

    @Get(uri = "/jobs/{jobId}")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Получить статус задания")
    @ApiResponse(responseCode = "200", description = "Задание найдено", content = @Content(schema = @Schema(implementation = JobView.class)))
    @ApiResponse(responseCode = "404", description = "Задание не найдено или удалено из архива")
    public HttpResponse<JobView> get(@PathVariable String jobId) {
        return jobService.find(jobId)
                .map(j -> HttpResponse.ok(JobView.of(j)))
                .orElseGet(HttpResponse::notFound);
    }

    @Get(uri = "/tenants/{tenantId}/credentials")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Получить сведения о сохранённых учётных данных арендатора")
    @ApiResponse(responseCode = "200", description = "Запись найдена", content = @Content(schema = @Schema(implementation = CredentialsView.class)))
    @ApiResponse(responseCode = "404", description = "Для арендатора нет сохранённых учётных данных")
    public HttpResponse<CredentialsView> credentials(@PathVariable String tenantId) {
        return credentialStore.find(tenantId)
                .map(r -> HttpResponse.ok(CredentialsView.of(r)))
                .orElseGet(HttpResponse::notFound);
    }

    @Introspected
    @Schema(name = "TokenView", description = "Сведения о токене без его значения")
    record TokenView(
            @Schema(description = "Вид токена") TokenKind kind,
            @Schema(description = "Источник") CapturedToken.Source source,
            @Schema(description = "Момент выдачи") Instant issuedAt,
            @Schema(description = "Срок действия") Instant expiresAt
    ) {
        static TokenView of(CapturedToken t) {
            return new TokenView(t.kind(), t.source(), t.issuedAt(), t.expiresAt());
        }
    }

    @Introspected
    @Schema(name = "ProvisioningJobView", description = "Статус задания")
    record JobView(
            String jobId,
            String tenantId,
            String targetTenantHandle,
            ProvisioningModels.Flavor flavor,
            ProvisioningModels.JobStatus status,
            Instant createdAt,
            Instant updatedAt,
            @Schema(description = "Итог (после завершения)") ProvisioningModels.ResultStatus resultStatus,
            @Schema(description = "Полученные токены") List<TokenView> captured,
            @Schema(description = "Не полученные виды токенов") List<TokenKind> missing,
            @Schema(description = "Отклонённые консолью права") List<String> skippedScopes,
            String extractionPath,
            ProvisioningModels.ErrorCode errorCode,
            String errorMessage,
            boolean persisted,
            String persistenceWarning
    ) {
        static JobView of(ProvisioningJob job) {
            ProvisioningModels.ProvisioningResult r = job.result();
            if (r == null) {
                return new JobView(job.jobId(), job.tenantId(), job.targetTenantHandle(), job.flavor(), job.status(),
                        job.createdAt(), job.updatedAt(), null, List.of(), List.of(), List.of(), null, null, null, false, null);
            }
            List<TokenView> tokens = new ArrayList<>();
            for (CapturedToken t : r.captured().values()) {
                tokens.add(TokenView.of(t));
            }
            return new JobView(job.jobId(), job.tenantId(), job.targetTenantHandle(), job.flavor(), job.status(),
                    job.createdAt(), job.updatedAt(), r.status(), tokens, r.missing(), r.skippedScopes(),
                    r.extractionPath() == null ? null : r.extractionPath().name(),
                    r.errorCode(), r.errorMessage(), r.persisted(), r.persistenceWarning());
        }
    }

    @Introspected
    @Schema(name = "TenantCredentialsView", description = "Наличие и сроки сохранённых учётных данных")
    record CredentialsView(
            String tenantId,
            boolean bearerAvailable,
            Instant bearerIssuedAt,
            Instant bearerExpiresAt,
            boolean sessionAvailable,
            Instant sessionExpiresAt,
            boolean refreshAvailable,
            boolean integrationAvailable,
            Instant updatedAt
    ) {
        static CredentialsView of(CredentialModels.TenantCredentialRecord r) {
            return new CredentialsView(r.tenantId(),
                    r.bearerToken() != null, r.bearerIssuedAt(), r.bearerExpiresAt(),
                    r.sessionToken() != null, r.sessionExpiresAt(),
                    r.refreshToken() != null,
                    r.integrationToken() != null,
                    r.updatedAt());
        }
    }
}
