package ru.aritmos.provisioningbroker.core;

import org.junit.jupiter.api.Test;
import ru.aritmos.provisioningbroker.config.ProvisioningCredentialsProperties;
import ru.aritmos.provisioningbroker.config.RuntimeConfigStore;
import ru.aritmos.provisioningbroker.wizard.ExtractionPath;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProvisioningJobServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final ManualExecutor executor = new ManualExecutor();
    private final StubOrchestrator orchestrator = new StubOrchestrator();

    private ProvisioningJobService service() {
        RuntimeConfigStore store = new RuntimeConfigStore(null, null, null, "unused", false, "/unused");
        store.applyManual(TestConfigs.runtime(), "test", "init");
        ProvisioningCredentialsProperties credentials = new ProvisioningCredentialsProperties();
        credentials.setLoginIdentity("ops@example.org");
        credentials.setLoginSecret("s3cret");
        credentials.setMailboxUsername("otp@example.org");
        credentials.setMailboxPassword("mail-secret");
        return new ProvisioningJobService(store, credentials, orchestrator, executor, clock);
    }

    private static ProvisioningModels.JobRequest request(String tenant) {
        return new ProvisioningModels.JobRequest(tenant, "acme", null, null, null);
    }

    @Test
    void secondSubmitForSameTenantReturnsActiveJob() {
        ProvisioningJobService service = service();

        ProvisioningJob first = service.submit(request("tenant-1"));
        ProvisioningJob second = service.submit(request(" tenant-1 "));
        ProvisioningJob other = service.submit(request("tenant-2"));

        assertSame(first, second, "TEST_EXPECTED: пока задание активно, повторная заявка возвращает его же");
        assertNotEquals(first.jobId(), other.jobId());
        assertEquals(2, executor.pending.size(), "TEST_EXPECTED: в пул передано только два задания");
        assertEquals(2, service.activeJobs());
    }

    @Test
    void requestDefaultsComeFromCredentialsAndRuntimeConfig() {
        ProvisioningJob job = service().submit(request("tenant-1"));

        assertEquals(ProvisioningModels.Flavor.FULL_PROVISIONING, job.flavor());
        assertEquals("ops@example.org", job.loginIdentity());
        assertEquals(TestConfigs.runtime().wizard().scopes(), job.scopes());
        assertEquals(ProvisioningModels.JobStatus.PENDING, job.status());
    }

    @Test
    void finishedJobMovesToArchiveAndTenantIsReleased() {
        ProvisioningJobService service = service();
        ProvisioningJob first = service.submit(request("tenant-1"));

        executor.runAll();

        assertEquals(ProvisioningModels.JobStatus.COMPLETED, first.status());
        assertEquals(0, service.activeJobs());
        assertSame(first, service.find(first.jobId()).orElseThrow(),
                "TEST_EXPECTED: завершённое задание доступно из архива");
        assertEquals("s3cret", orchestrator.configs.get(0).loginSecret());

        ProvisioningJob next = service.submit(request("tenant-1"));
        assertNotEquals(first.jobId(), next.jobId(), "TEST_EXPECTED: после завершения создаётся новое задание");
    }

    @Test
    void archivedJobExpiresAfterTtl() {
        ProvisioningJobService service = service();
        ProvisioningJob job = service.submit(request("tenant-1"));
        executor.runAll();

        clock.advance(Duration.ofSeconds(TestConfigs.runtime().jobs().archiveTtlSec() + 1));

        assertTrue(service.find(job.jobId()).isEmpty(), "TEST_EXPECTED: по истечении TTL задание удаляется из архива");
        assertTrue(service.find(null).isEmpty());
    }

    @Test
    void rejectedExecutionCompletesWithCapacityExceeded() {
        executor.reject = true;
        ProvisioningJobService service = service();

        ProvisioningJob job = service.submit(request("tenant-1"));

        assertEquals(ProvisioningModels.JobStatus.FAILED, job.status());
        assertEquals(ProvisioningModels.ErrorCode.CAPACITY_EXCEEDED, job.result().errorCode());
        assertEquals(0, service.activeJobs());
        assertTrue(service.find(job.jobId()).isPresent());
    }

    @Test
    void unexpectedOrchestratorErrorFailsJobWithInternalCode() {
        orchestrator.failure = new IllegalStateException("boom password=qwerty");
        ProvisioningJobService service = service();
        ProvisioningJob job = service.submit(request("tenant-1"));

        executor.runAll();

        assertEquals(ProvisioningModels.JobStatus.FAILED, job.status());
        assertEquals(ProvisioningModels.ErrorCode.INTERNAL, job.result().errorCode());
        assertTrue(!job.result().errorMessage().contains("qwerty"),
                "TEST_EXPECTED: текст ошибки маскируется перед сохранением в итог");
        assertEquals(0, service.activeJobs());
    }

    @Test
    void invalidRequestIsRejected() {
        ProvisioningJobService service = service();

        assertThrows(IllegalArgumentException.class, () -> service.submit(null));
        assertThrows(IllegalArgumentException.class, () -> service.submit(request(" ")));
        assertThrows(IllegalArgumentException.class,
                () -> service.submit(new ProvisioningModels.JobRequest("tenant-1", null, null, null, null)));
        assertEquals(0, executor.pending.size());
    }

    private static final class StubOrchestrator extends ProvisioningOrchestrator {

        private final List<ProvisioningModels.JobConfig> configs = new ArrayList<>();
        private RuntimeException failure;

        StubOrchestrator() {
            super(null, null, null, null, null, null, null, null);
        }

        @Override
        public ProvisioningModels.ProvisioningResult run(ProvisioningJob job, ProvisioningModels.JobConfig config) {
            configs.add(config);
            if (failure != null) {
                throw failure;
            }
            ProvisioningModels.ProvisioningResult r = new ProvisioningModels.ProvisioningResult(job.jobId(),
                    job.tenantId(), job.flavor(), ProvisioningModels.ResultStatus.COMPLETED, Map.of(), List.of(),
                    List.of(), ExtractionPath.DIRECT, null, null, true, null);
            job.complete(r);
            return r;
        }
    }

    private static final class ManualExecutor extends AbstractExecutorService {

        private final List<Runnable> pending = new ArrayList<>();
        private boolean reject;

        void runAll() {
            List<Runnable> batch = new ArrayList<>(pending);
            pending.clear();
            batch.forEach(Runnable::run);
        }

        @Override
        public void execute(Runnable command) {
            if (reject) {
                throw new RejectedExecutionException("full");
            }
            pending.add(command);
        }

        @Override
        public void shutdown() {
            pending.clear();
        }

        @Override
        public List<Runnable> shutdownNow() {
            List<Runnable> out = new ArrayList<>(pending);
            pending.clear();
            return out;
        }

        @Override
        public boolean isShutdown() {
            return false;
        }

        @Override
        public boolean isTerminated() {
            return false;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }
    }
}
