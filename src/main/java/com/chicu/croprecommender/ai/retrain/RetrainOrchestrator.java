package com.chicu.croprecommender.ai.retrain;

import com.chicu.croprecommender.ai.ml.dataset.TrainingDataLoader;
import com.chicu.croprecommender.ai.ml.model.ModelMetrics;
import com.chicu.croprecommender.ai.ml.model.ModelSnapshot;
import com.chicu.croprecommender.ai.ml.store.ModelArtifactRepository;
import com.chicu.croprecommender.ai.ml.store.ModelStore;
import com.chicu.croprecommender.ai.ml.training.ModelTrainer;
import com.chicu.croprecommender.ai.retrain.guard.AccuracyGuard;
import com.chicu.croprecommender.ai.retrain.guard.GuardDecision;
import com.chicu.croprecommender.common.error.RetrainInProgressException;
import com.chicu.croprecommender.common.error.TrainingFailedException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Фоновое переобучение.
 *
 * <p>Одновременно выполняется не больше одной задачи; вторая заявка получает
 * RetrainInProgressException, очереди нет. Вызывающему сразу возвращается job id,
 * исход (в т.ч. ошибки) виден только через статус задачи.</p>
 *
 * <p>Кандидат публикуется только после AccuracyGuard; при отказе активной остаётся
 * предыдущая модель.</p>
 *
 * <p>Слот освобождается, когда поток fit действительно завершился. Smile не проверяет
 * interrupt, поэтому после таймаута задача уже FAILED, а слот ещё занят.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainOrchestrator {

    private final TrainingDataLoader dataLoader;
    private final ModelTrainer trainer;
    private final AccuracyGuard guard;
    private final ModelArtifactRepository repository;
    private final ModelStore store;
    private final RetrainProperties props;

    /** Единственный слот: id задачи, которая его держит, или null. */
    private final AtomicReference<String> activeJob = new AtomicReference<>();
    private volatile String latestJobId;

    private final Map<String, RetrainJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<RetrainJob>> completions = new ConcurrentHashMap<>();
    private final Deque<String> history = new ConcurrentLinkedDeque<>();

    private final ExecutorService jobExecutor = Executors.newSingleThreadExecutor(named("retrain-job"));

    /** Пересоздаётся после таймаута: зависший fit не должен занимать следующий запуск. */
    private volatile ExecutorService fitExecutor = Executors.newSingleThreadExecutor(named("retrain-fit"));

    // =========================================================
    // API
    // =========================================================

    public RetrainJob submit(RetrainRequest request) {
        RetrainRequest req = request != null ? request : RetrainRequest.builder().build();

        String jobId = UUID.randomUUID().toString().replace("-", "");
        acquire(jobId);

        try {
            TrainingDataLoader.DatasetRef ref = dataLoader.resolve(req.dataset());

            Instant now = Instant.now();
            RetrainJob job = RetrainJob.builder()
                    .jobId(jobId)
                    .state(RetrainState.QUEUED)
                    .dataset(ref.name())
                    .reason(req.reason())
                    .submittedAt(now)
                    .updatedAt(now)
                    .message("accepted")
                    .previousVersion(store.find().map(ModelSnapshot::version).orElse(null))
                    .build();

            CompletableFuture<RetrainJob> done = new CompletableFuture<>();
            register(job, done);

            jobExecutor.execute(() -> run(job.jobId(), ref, done));

            log.info("🧠 RETRAIN ACCEPTED job={} dataset={} reason={}", job.jobId(), ref.name(), safe(req.reason()));
            return job;

        } catch (RuntimeException e) {
            activeJob.compareAndSet(jobId, null);
            throw e;
        }
    }

    public Optional<RetrainJob> job(String jobId) {
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobs.get(jobId));
    }

    public Optional<RetrainJob> latest() {
        return job(latestJobId);
    }

    public boolean isRunning() {
        return activeJob.get() != null;
    }

    /**
     * Завершение задачи (терминальный статус). Для ожидания в тестах и служебных вызовов.
     */
    public Optional<CompletableFuture<RetrainJob>> completion(String jobId) {
        return jobId == null ? Optional.empty() : Optional.ofNullable(completions.get(jobId));
    }

    // =========================================================
    // job
    // =========================================================

    private void run(String jobId, TrainingDataLoader.DatasetRef ref, CompletableFuture<RetrainJob> done) {
        long started = System.currentTimeMillis();
        CompletableFuture<Void> fitFinished = CompletableFuture.completedFuture(null);
        try {
            update(jobId, RetrainState.TRAINING, "training on " + ref.name());

            CompletableFuture<Void> fit = new CompletableFuture<>();
            fitFinished = fit;
            ModelSnapshot candidate = trainWithTimeout(ref, fit);

            update(jobId, RetrainState.VALIDATING, "validating candidate " + candidate.version(),
                    candidate.metrics());

            ModelMetrics previous = store.find().map(ModelSnapshot::metrics).orElse(null);
            GuardDecision decision = guard.checkCandidate(previous, candidate.metrics());
            if (!decision.allowed()) {
                fail(jobId, new TrainingFailedException("candidate rejected: " + decision.reason()));
                return;
            }
            log.info("🧠 RETRAIN job={} guard OK acc={} required={}",
                    jobId, decision.candidateAccuracy(), decision.requiredAccuracy());

            update(jobId, RetrainState.PUBLISHING, "publishing " + candidate.version());
            repository.save(candidate);
            store.publish(candidate);

            RetrainJob finished = jobs.computeIfPresent(jobId, (id, j) -> j.toBuilder()
                    .state(RetrainState.SUCCEEDED)
                    .message("published " + candidate.version())
                    .resultVersion(candidate.version())
                    .updatedAt(Instant.now())
                    .build());

            log.info("✅ RETRAIN DONE job={} version={} testAcc={} tookMs={}",
                    jobId, candidate.version(),
                    finished != null && finished.candidateMetrics() != null
                            ? finished.candidateMetrics().testAccuracy() : null,
                    System.currentTimeMillis() - started);

        } catch (TimeoutException e) {
            fail(jobId, new TrainingFailedException("training exceeded the timeout of " + props.getTimeout()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(jobId, new TrainingFailedException("training interrupted", e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            fail(jobId, new TrainingFailedException("training failed: " + safe(cause.getMessage()), cause));
        } catch (RuntimeException e) {
            fail(jobId, new TrainingFailedException("retrain failed: " + safe(e.getMessage()), e));
        } finally {
            if (!fitFinished.isDone()) {
                log.warn("⚠️ RETRAIN job={} : abandoned fit is still running, slot stays busy until it exits", jobId);
            }
            fitFinished.whenComplete((v, t) -> {
                activeJob.compareAndSet(jobId, null);
                done.complete(jobs.get(jobId));
                log.info("🧠 RETRAIN job={} slot released", jobId);
            });
        }
    }

    /**
     * {@code finished} завершается, когда тело fit вышло (или так и не стартовало).
     */
    private ModelSnapshot trainWithTimeout(TrainingDataLoader.DatasetRef ref, CompletableFuture<Void> finished)
            throws InterruptedException, ExecutionException, TimeoutException {

        ExecutorService executor = fitExecutor;
        AtomicBoolean entered = new AtomicBoolean(false);
        Future<ModelSnapshot> f;
        try {
            f = executor.submit(() -> {
                entered.set(true);
                try {
                    return trainer.train(dataLoader.load(ref));
                } finally {
                    finished.complete(null);
                }
            });
        } catch (RejectedExecutionException e) {
            finished.complete(null);
            throw e;
        }
        try {
            ModelSnapshot candidate = f.get(props.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            finished.complete(null);
            return candidate;
        } catch (ExecutionException e) {
            finished.complete(null);
            throw e;
        } catch (TimeoutException e) {
            // кандидат отбрасывается, поток fit заменяем новым
            f.cancel(true);
            if (!entered.get()) {
                finished.complete(null);
            }
            executor.shutdownNow();
            fitExecutor = Executors.newSingleThreadExecutor(named("retrain-fit"));
            throw e;
        }
    }

    private void acquire(String jobId) {
        while (!activeJob.compareAndSet(null, jobId)) {
            String holder = activeJob.get();
            if (holder != null) {
                log.info("🧠 RETRAIN rejected: job {} is still running", holder);
                throw new RetrainInProgressException(holder);
            }
        }
    }

    private void fail(String jobId, TrainingFailedException failure) {
        jobs.computeIfPresent(jobId, (id, j) -> j.transition(RetrainState.FAILED, failure.getMessage()).toBuilder()
                .error(failure.getClass().getSimpleName())
                .build());
        if (failure.getCause() != null) {
            log.error("❌ RETRAIN FAILED job={} : {}", jobId, failure.getMessage(), failure.getCause());
        } else {
            log.warn("⚠️ RETRAIN FAILED job={} : {}", jobId, failure.getMessage());
        }
    }

    private void update(String jobId, RetrainState state, String message) {
        jobs.computeIfPresent(jobId, (id, j) -> j.transition(state, message));
        log.info("🧠 RETRAIN job={} state={} {}", jobId, state, message);
    }

    private void update(String jobId, RetrainState state, String message, ModelMetrics metrics) {
        jobs.computeIfPresent(jobId, (id, j) -> j.transition(state, message).toBuilder()
                .candidateMetrics(metrics)
                .build());
        log.info("🧠 RETRAIN job={} state={} {}", jobId, state, message);
    }

    private void register(RetrainJob job, CompletableFuture<RetrainJob> done) {
        jobs.put(job.jobId(), job);
        completions.put(job.jobId(), done);
        history.addLast(job.jobId());
        latestJobId = job.jobId();

        int limit = Math.max(1, props.getHistorySize());
        while (history.size() > limit) {
            String oldest = history.pollFirst();
            if (oldest == null) break;
            jobs.remove(oldest);
            completions.remove(oldest);
        }
    }

    @PreDestroy
    public void shutdown() {
        jobExecutor.shutdownNow();
        fitExecutor.shutdownNow();
    }

    // =========================================================
    // helpers
    // =========================================================

    private static ThreadFactory named(String prefix) {
        AtomicLong ctr = new AtomicLong(1);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + ctr.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    private static String safe(String s) {
        if (s == null) return "";
        String x = s.trim();
        return x.length() > 200 ? x.substring(0, 200) : x;
    }
}
