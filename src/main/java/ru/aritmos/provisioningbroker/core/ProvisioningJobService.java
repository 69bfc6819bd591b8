package ru.aritmos.provisioningbroker.core;

import io.micronaut.context.annotation.Value;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.config.ProvisioningCredentialsProperties;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.token.TokenKind;
import ru.aritmos.provisioningbroker.wizard.ExtractionPath;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Приём заданий и их выполнение на ограниченном пуле потоков.
 * <p>
 * Правила:
 * <ul>
 *   <li>для арендатора может выполняться только одно задание; повторная заявка возвращает активное;</li>
 *   <li>переполнение пула и очереди завершает задание кодом CAPACITY_EXCEEDED;</li>
 *   <li>завершённые задания доступны по id до истечения TTL архива.</li>
 * </ul>
 */
@Singleton
public class ProvisioningJobService {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningJobService.class);

    private static final int ARCHIVE_MAX_ENTRIES = 1000;

    private final RuntimeConfigStore configStore;
    private final ProvisioningCredentialsProperties credentials;
    private final ProvisioningOrchestrator orchestrator;
    private final ExecutorService executor;
    private final Clock clock;

    private final Map<String, ProvisioningJob> active = new ConcurrentHashMap<>();
    private final Map<String, String> activeByTenant = new ConcurrentHashMap<>();
    private final TtlCache<String, ProvisioningJob> archive;

    @Inject
    public ProvisioningJobService(RuntimeConfigStore configStore,
                                  ProvisioningCredentialsProperties credentials,
                                  ProvisioningOrchestrator orchestrator,
                                  @Value("${provisioningbroker.jobs.max-concurrent:2}") int maxConcurrent,
                                  @Value("${provisioningbroker.jobs.queue-capacity:10}") int queueCapacity) {
        this(configStore, credentials, orchestrator, newPool(maxConcurrent, queueCapacity), Clock.systemUTC());
    }

    ProvisioningJobService(RuntimeConfigStore configStore,
                           ProvisioningCredentialsProperties credentials,
                           ProvisioningOrchestrator orchestrator,
                           ExecutorService executor,
                           Clock clock) {
        this.configStore = configStore;
        this.credentials = credentials;
        this.orchestrator = orchestrator;
        this.executor = executor;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.archive = new TtlCache<>(this.clock, ARCHIVE_MAX_ENTRIES);
    }

    /**
     * Принять задание.
     *
     * @return новое задание либо уже выполняющееся задание арендатора
     * @throws IllegalArgumentException если запрос некорректен
     */
    public synchronized ProvisioningJob submit(ProvisioningModels.JobRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Пустой запрос");
        }
        ProvisioningModels.JobRequest req = request.normalize();

        String existingId = activeByTenant.get(req.tenantId());
        if (existingId != null) {
            ProvisioningJob existing = active.get(existingId);
            if (existing != null) {
                log.info("{} для арендатора уже выполняется задание, новое не создаётся", existing.logPrefix());
                return existing;
            }
        }

        RuntimeConfigStore.RuntimeConfig rc = configStore.getEffective();
        String identity = req.loginIdentity() != null ? req.loginIdentity() : credentials.getLoginIdentity();
        List<String> scopes = req.scopes() != null ? req.scopes() : rc.wizard().scopes();
        ProvisioningJob job = new ProvisioningJob(UUID.randomUUID().toString(), req.tenantId(), identity,
                req.targetTenantHandle(), scopes, req.flavor(), clock);
        ProvisioningModels.JobConfig cfg = new ProvisioningModels.JobConfig(rc, identity,
                credentials.getLoginSecret(), credentials.getMailboxUsername(), credentials.getMailboxPassword(), scopes);

        active.put(job.jobId(), job);
        activeByTenant.put(job.tenantId(), job.jobId());
        try {
            executor.execute(() -> runJob(job, cfg));
            log.info("{} задание принято: flavor={}, прав={}", job.logPrefix(), job.flavor(), scopes.size());
        } catch (RejectedExecutionException e) {
            log.warn("{} задание отклонено: пул заданий переполнен", job.logPrefix());
            job.complete(rejected(job));
            finish(job, rc);
        }
        return job;
    }

    /**
     * Найти задание (активное или из архива).
     */
    public Optional<ProvisioningJob> find(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        ProvisioningJob job = active.get(jobId);
        if (job != null) {
            return Optional.of(job);
        }
        return archive.get(jobId);
    }

    public int activeJobs() {
        return active.size();
    }

    private void runJob(ProvisioningJob job, ProvisioningModels.JobConfig cfg) {
        try {
            orchestrator.run(job, cfg);
        } catch (RuntimeException e) {
            log.error("{} задание прервано непредвиденной ошибкой", job.logPrefix(), e);
            job.complete(new ProvisioningModels.ProvisioningResult(job.jobId(), job.tenantId(), job.flavor(),
                    ProvisioningModels.ResultStatus.FAILED, Map.of(), List.copyOf(job.flavor().expectedKinds()),
                    List.of(), ExtractionPath.NONE, ProvisioningModels.ErrorCode.INTERNAL,
                    SensitiveDataSanitizer.sanitizeText(e.getMessage()), false, null));
        } finally {
            finish(job, cfg.runtime());
        }
    }

    private synchronized void finish(ProvisioningJob job, RuntimeConfigStore.RuntimeConfig rc) {
        long ttl = rc == null ? RuntimeConfigStore.JobsConfig.defaultConfig().archiveTtlSec() : rc.jobs().archiveTtlSec();
        archive.put(job.jobId(), job, ttl);
        active.remove(job.jobId());
        activeByTenant.remove(job.tenantId(), job.jobId());
    }

    private static ProvisioningModels.ProvisioningResult rejected(ProvisioningJob job) {
        List<TokenKind> missing = List.copyOf(job.flavor().expectedKinds());
        return new ProvisioningModels.ProvisioningResult(job.jobId(), job.tenantId(), job.flavor(),
                ProvisioningModels.ResultStatus.FAILED, Map.of(), missing, List.of(), ExtractionPath.NONE,
                ProvisioningModels.ErrorCode.CAPACITY_EXCEEDED, "пул заданий переполнен", false, null);
    }

    private static ExecutorService newPool(int maxConcurrent, int queueCapacity) {
        int threads = Math.max(1, maxConcurrent);
        AtomicInteger seq = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                r -> {
                    Thread t = new Thread(r, "provisioning-job-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Пул заданий не остановился за 10 с, активных заданий: {}", active.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
