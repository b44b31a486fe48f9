package in.warroom.service.session;

import in.warroom.application.port.output.IncidentProvider;
import in.warroom.domain.model.Incident;
import in.warroom.infrastructure.metrics.WarRoomMetrics;
import in.warroom.service.approval.ApprovalGate;
import in.warroom.service.triage.RunResult;
import in.warroom.service.triage.TriageOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single war room session.
 *
 * At most one triage run is active at a time. {@link #start} admits a run and hands it
 * to a dedicated runner thread without waiting for it; the runner's exit is the only
 * place the running flag is cleared.
 */
public final class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final TriageOrchestrator orchestrator;
    private final ApprovalGate gate;
    private final WarRoomMetrics metrics;
    private final ExecutorService runner;
    private final AtomicLong runSeq = new AtomicLong(0);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();

    // Guarded by lock
    private boolean running = false;
    private Incident current;
    private RunResult lastResult;

    public SessionManager(TriageOrchestrator orchestrator, ApprovalGate gate, WarRoomMetrics metrics) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.runner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "triage-runner");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Admit a new run and launch it asynchronously.
     *
     * @throws AlreadyRunningException if a run is active
     * @throws NoIncidentAvailableException if the provider cannot supply an incident
     */
    public void start(IncidentProvider provider) {
        Objects.requireNonNull(provider, "provider");
        long runId;
        Incident incident;

        lock.lock();
        try {
            rejectIfRunning();
        } finally {
            lock.unlock();
        }

        // Provider runs outside the lock so status reads never wait on it
        incident = fetchIncident(provider);

        lock.lock();
        try {
            rejectIfRunning();
            gate.reset();
            running = true;
            current = incident;
            lastResult = null;
            runId = runSeq.incrementAndGet();
        } finally {
            lock.unlock();
        }

        try {
            runner.execute(() -> runToCompletion(runId, incident));
        } catch (RejectedExecutionException e) {
            finish(runId, RunResult.FAILED, Duration.ZERO);
            throw new IllegalStateException("Session manager is stopped", e);
        }
        log.info("[SESSION] Run #{} admitted: {}", runId, incident.id());
    }

    // Caller holds lock
    private void rejectIfRunning() {
        if (running) {
            log.info("[SESSION] Start rejected, run already active ({})", current.id());
            throw new AlreadyRunningException();
        }
    }

    private Incident fetchIncident(IncidentProvider provider) {
        Optional<Incident> incident;
        try {
            incident = provider.nextIncident();
        } catch (RuntimeException e) {
            log.error("[SESSION] Incident provider failed: {}", e.getMessage(), e);
            throw new NoIncidentAvailableException("Incident provider failed: " + e.getMessage(), e);
        }
        return incident.orElseThrow(() -> {
            log.warn("[SESSION] Incident provider returned no incident, run not started");
            return new NoIncidentAvailableException("no incident available");
        });
    }

    private void runToCompletion(long runId, Incident incident) {
        Instant startedAt = Instant.now();
        RunResult result = RunResult.FAILED;
        try {
            result = orchestrator.run(incident);
        } catch (InterruptedException e) {
            log.warn("[SESSION] Run #{} interrupted", runId);
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("[SESSION] Run #{} failed: {}", runId, e.getMessage(), e);
        } finally {
            finish(runId, result, Duration.between(startedAt, Instant.now()));
        }
    }

    private void finish(long runId, RunResult result, Duration elapsed) {
        lock.lock();
        try {
            running = false;
            lastResult = result;
            idle.signalAll();
        } finally {
            lock.unlock();
        }
        metrics.recordRun(result.label(), elapsed);
        log.info("[SESSION] Run #{} finished: {} in {}s", runId, result, elapsed.toSeconds());
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Incident of the active or most recent run.
     */
    public Optional<Incident> current() {
        lock.lock();
        try {
            return Optional.ofNullable(current);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Result of the most recent finished run, empty while a run is active or before the first one.
     */
    public Optional<RunResult> lastResult() {
        lock.lock();
        try {
            return Optional.ofNullable(lastResult);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until no run is active.
     *
     * @return true if idle within the timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (running) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop the runner. An active run is interrupted; no further runs are admitted.
     */
    public void stop() {
        log.info("[SESSION] Stopping session manager");
        runner.shutdownNow();
        try {
            if (!runner.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[SESSION] Runner did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
