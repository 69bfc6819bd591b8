package ru.aritmos.provisioningbroker.api;

import io.micronaut.core.annotation.Introspected;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Put;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.security.annotation.Secured;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.config.RuntimeConfigValidator;
import ru.aritmos.provisioningbroker.security.ProvisioningRoles;

import java.util.List;

/**
 * Admin API: просмотр/валидация/сохранение runtime-конфигурации (включая таблицу стратегий локаторов).
 * <p>
 * Чтение конфигурации и аудита доступно оператору, изменение и dry-run только администратору.
 */
@Secured({ProvisioningRoles.OPERATOR, ProvisioningRoles.ADMIN})
@Controller("/admin/runtime-config")
@Tag(name = "Provisioning Broker: Admin API (Runtime Config)", description = "Управление runtime-конфигурацией и аудит изменений")
public class RuntimeConfigAdminController {

    private final RuntimeConfigStore runtimeConfigStore;

    public RuntimeConfigAdminController(RuntimeConfigStore runtimeConfigStore) {
        this.runtimeConfigStore = runtimeConfigStore;
    }

    @Get
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Получить текущую runtime-конфигурацию")
    @ApiResponse(responseCode = "200", description = "Конфигурация возвращена", content = @Content(schema = @Schema(implementation = RuntimeConfigResponse.class)))
    public RuntimeConfigResponse getCurrent() {
        RuntimeConfigStore.RuntimeConfig cfg = runtimeConfigStore.getEffective();
        return new RuntimeConfigResponse(cfg, runtimeConfigStore.isRemoteEnabled());
    }

    @Secured(ProvisioningRoles.ADMIN)
    @Post(uri = "/dry-run")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Dry-run валидация runtime-конфигурации")
    @ApiResponse(responseCode = "200", description = "Результат dry-run", content = @Content(schema = @Schema(implementation = DryRunResponse.class)))
    public DryRunResponse dryRun(@Body RuntimeConfigStore.RuntimeConfig payload) {
        RuntimeConfigStore.RuntimeConfig normalized = (payload == null ? runtimeConfigStore.getEffective() : payload).normalize();
        return validate(normalized);
    }

    @Secured(ProvisioningRoles.ADMIN)
    @Put
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Сохранить runtime-конфигурацию вручную")
    @ApiResponse(responseCode = "200", description = "Конфигурация сохранена", content = @Content(schema = @Schema(implementation = SaveResponse.class)))
    @ApiResponse(responseCode = "400", description = "Конфигурация содержит ошибки")
    public HttpResponse<SaveResponse> save(@Body RuntimeConfigStore.RuntimeConfig config,
                                           @Parameter(description = "Инициатор изменения") @Nullable @QueryValue String actor,
                                           @Parameter(description = "Причина изменения") @Nullable @QueryValue String reason) {
        DryRunResponse check = validate(config == null ? null : config.normalize());
        if (!check.ok()) {
            return HttpResponse.badRequest(new SaveResponse(false, check.revision(), check.errors()));
        }
        RuntimeConfigStore.RuntimeConfig applied = runtimeConfigStore.applyManual(config, actor, reason);
        return HttpResponse.ok(new SaveResponse(true, applied.revision(), List.of()));
    }

    @Get(uri = "/audit")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Получить журнал изменений runtime-конфигурации")
    @ApiResponse(responseCode = "200", description = "Журнал возвращён", content = @Content(schema = @Schema(implementation = RuntimeConfigAuditResponse.class)))
    public RuntimeConfigAuditResponse audit(@Parameter(description = "Лимит записей (1..500)") @Nullable @QueryValue Integer limit) {
        int lim = limit == null ? 100 : limit;
        return new RuntimeConfigAuditResponse(runtimeConfigStore.getAuditTrail(lim));
    }

    static DryRunResponse validate(RuntimeConfigStore.RuntimeConfig cfg) {
        RuntimeConfigValidator.Report report = RuntimeConfigValidator.validate(cfg);
        return new DryRunResponse(report.ok(), report.errors(), report.warnings(), cfg == null ? null : cfg.revision());
    }

    @Introspected
    @Schema(name = "RuntimeConfigResponse", description = "Текущая runtime-конфигурация")
    record RuntimeConfigResponse(
            @Schema(description = "Effective runtime-config") RuntimeConfigStore.RuntimeConfig config,
            @Schema(description = "Включен ли remote-config") boolean remoteEnabled
    ) {
    }

    @Introspected
    @Schema(name = "RuntimeConfigDryRunResponse", description = "Результат dry-run runtime-конфигурации")
    record DryRunResponse(
            @Schema(description = "Конфигурация может быть применена") boolean ok,
            @Schema(description = "Ошибки") List<String> errors,
            @Schema(description = "Предупреждения") List<String> warnings,
            @Schema(description = "Revision после normalize") String revision
    ) {
    }

    @Introspected
    @Schema(name = "RuntimeConfigSaveResponse", description = "Результат сохранения runtime-конфигурации")
    record SaveResponse(
            @Schema(description = "Сохранено ли изменение") boolean saved,
            @Schema(description = "Текущий revision") String revision,
            @Schema(description = "Ошибки валидации") List<String> errors
    ) {
    }

    @Introspected
    @Schema(name = "RuntimeConfigAuditResponse", description = "Журнал изменений runtime-конфигурации")
    record RuntimeConfigAuditResponse(
            @Schema(description = "Список изменений") List<RuntimeConfigStore.RuntimeConfigAuditEntry> items
    ) {
    }
}
