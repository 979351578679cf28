package com.gateproof.orchestrator;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.gateproof.audit.AuditTrail;
import com.gateproof.crypto.Digests;
import com.gateproof.gate.GateContext;
import com.gateproof.gate.GateRegistry;
import com.gateproof.gate.GateStatus;
import com.gateproof.gate.GateVerdict;
import com.gateproof.gate.OperationContext;
import com.gateproof.lifecycle.Anchor;
import com.gateproof.lifecycle.AnchorChain;
import com.gateproof.lifecycle.LifecycleRegistry;
import com.gateproof.lifecycle.Stage;
import com.gateproof.policy.EnforcementAction;
import com.gateproof.policy.Policy;
import com.gateproof.policy.PolicyEngine;
import com.gateproof.policy.ResolvedGate;
import com.gateproof.policy.ResolvedStage;
import com.gateproof.policy.StagePolicy;
import com.gateproof.receipt.GateOutcome;
import com.gateproof.receipt.Outcome;
import com.gateproof.receipt.Receipt;
import com.gateproof.receipt.ReceiptGenerator;
import com.gateproof.receipt.VerdictSummary;
import com.gateproof.runtime.RetryPolicy;
import com.gateproof.trust.SigningUnavailableException;

/**
 * Drives one stage of one operation through
 * {@code IDLE -> GATES_RUNNING -> AGGREGATING -> ENFORCING -> SEALED}, or {@code ABORTED} on an
 * unrecoverable failure.
 *
 * <p>Gates of a stage run concurrently on a bounded pool. A gate's timeout starts when a worker picks
 * it up; a gate that times out or is skipped by fail-fast is interrupted so its worker is freed. An
 * escalation suspends the run on the review broker's future, bounded by the stage's escalation
 * timeout; expiry blocks. Sealing is the only step that writes to the audit trail. Aborted runs seal
 * nothing and log an {@link AbortDiagnostic} instead.
 *
 * <p>A block is recorded as soon as it is decided, so it holds even when sealing it fails. Per-operation
 * state is released when an operation proceeds through {@link Stage#INFERENCE} or on {@link #complete}.
 */
public class GateOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GateOrchestrator.class);

    private final GateRegistry gateRegistry;
    private final PolicyEngine policyEngine;
    private final LifecycleRegistry lifecycles;
    private final ReceiptGenerator receiptGenerator;
    private final AuditTrail auditTrail;
    private final ReviewBroker reviewBroker;
    private final RetryPolicy signingRetry;
    private final Clock clock;
    private final ExecutorService gateExecutor;
    private final ExecutorService stageExecutor;
    private final ScheduledThreadPoolExecutor timeoutScheduler;
    private final ObjectMapper diagnosticMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private final Map<String, PolicyViolationException> blockedOperations = new ConcurrentHashMap<>();
    private final Map<String, String> lastReceiptIds = new ConcurrentHashMap<>();

    public GateOrchestrator(
            GateRegistry gateRegistry,
            PolicyEngine policyEngine,
            LifecycleRegistry lifecycles,
            ReceiptGenerator receiptGenerator,
            AuditTrail auditTrail,
            ReviewBroker reviewBroker,
            RetryPolicy signingRetry,
            Clock clock,
            int gateWorkers) {
        this.gateRegistry = Objects.requireNonNull(gateRegistry, "gateRegistry");
        this.policyEngine = Objects.requireNonNull(policyEngine, "policyEngine");
        this.lifecycles = Objects.requireNonNull(lifecycles, "lifecycles");
        this.receiptGenerator = Objects.requireNonNull(receiptGenerator, "receiptGenerator");
        this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail");
        this.reviewBroker = Objects.requireNonNull(reviewBroker, "reviewBroker");
        this.signingRetry = Objects.requireNonNull(signingRetry, "signingRetry");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (gateWorkers < 1) {
            throw new IllegalArgumentException("gateWorkers must be >= 1");
        }
        this.gateExecutor = Executors.newFixedThreadPool(gateWorkers, namedThreads("gate-worker-"));
        this.stageExecutor = Executors.newCachedThreadPool(namedThreads("stage-runner-"));
        this.timeoutScheduler = new ScheduledThreadPoolExecutor(1, namedThreads("gate-timeout-"));
        this.timeoutScheduler.setRemoveOnCancelPolicy(true);
    }

    public StageResult run(Policy policy, OperationContext context) {
        return run(policy, context, null);
    }

    /**
     * Runs a stage and waits for it to finish.
     *
     * @throws PolicyViolationException when policy blocks the stage or the operation was blocked earlier
     * @throws OperationAbortedException when the run aborted
     */
    public StageResult run(Policy policy, OperationContext context, byte[] stageSalt) {
        try {
            return runAsync(policy, context, stageSalt).get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CompletionException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while waiting for stage " + context.stage().id(), e);
        }
    }

    /**
     * Runs a stage without blocking the caller. {@code stageSalt} seeds the stage anchor when the
     * lifecycle has not anchored this stage yet; null derives it from the evidence digest.
     */
    public CompletableFuture<StageResult> runAsync(Policy policy, OperationContext context, byte[] stageSalt) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(context, "context");
        byte[] salt = stageSalt == null ? Digests.fromHex(context.evidenceDigest()) : stageSalt.clone();
        StageRun run = new StageRun(policy, context, salt);
        return CompletableFuture.supplyAsync(() -> guarded(run, () -> evaluate(run)), stageExecutor)
                .thenCompose(decision -> guarded(run, () -> awaitReview(run, decision)))
                .thenApplyAsync(enforced -> guarded(run, () -> seal(run, enforced)), stageExecutor);
    }

    public boolean isBlocked(String operationId) {
        return blockedOperations.containsKey(operationId);
    }

    /**
     * Forgets an operation: its block, if any, and the receipt its next stage would chain to. Call it
     * once an operation is abandoned or finished outside the normal stage order.
     *
     * @return true when anything was held for the operation
     */
    public boolean complete(String operationId) {
        Objects.requireNonNull(operationId, "operationId");
        boolean wasBlocked = blockedOperations.remove(operationId) != null;
        boolean hadReceipt = lastReceiptIds.remove(operationId) != null;
        if (wasBlocked || hadReceipt) {
            log.info("orchestrator.operation.released op={} blocked={}", operationId, wasBlocked);
        }
        return wasBlocked || hadReceipt;
    }

    /** Number of operations for which a block or a parent receipt is still held. */
    public int trackedOperations() {
        Set<String> operations = new HashSet<>(lastReceiptIds.keySet());
        operations.addAll(blockedOperations.keySet());
        return operations.size();
    }

    @Override
    public void close() {
        stageExecutor.shutdown();
        gateExecutor.shutdownNow();
        timeoutScheduler.shutdownNow();
    }

    private EnforcementDecision evaluate(StageRun run) {
        OperationContext context = run.context;
        PolicyViolationException prior = blockedOperations.get(context.operationId());
        if (prior != null) {
            log.warn("orchestrator.refused op={} stage={} blockedAt={}", context.operationId(), context.stage().id(), prior.stage().id());
            throw new PolicyViolationException(context.operationId(), context.stage(), prior.policyRef(), prior.blockingGates(),
                    prior.receipt(), "operation was blocked at stage " + prior.stage().id() + " and later stages are refused");
        }

        run.resolved = policyEngine.resolve(run.policy, context.stage(), gateRegistry);
        run.anchor = anchorFor(run);
        run.transition(OrchestratorState.GATES_RUNNING);
        run.verdicts = runGates(run);
        run.transition(OrchestratorState.AGGREGATING);
        EnforcementDecision decision = EnforcementDecision.decide(run.resolved, run.verdicts);
        log.info("orchestrator.aggregate op={} stage={} status={} gates={}", context.operationId(), context.stage().id(),
                decision.aggregateStatus(), run.verdicts.size());
        run.transition(OrchestratorState.ENFORCING);
        log.info("orchestrator.enforce op={} stage={} action={} policy={}", context.operationId(), context.stage().id(),
                decision.action().id(), run.resolved.policyRef());
        return decision;
    }

    private Anchor anchorFor(StageRun run) {
        OperationContext context = run.context;
        AnchorChain chain = lifecycles.chain(context.lifecycleId())
                .orElseThrow(() -> new IllegalArgumentException("Unknown lifecycle " + context.lifecycleId()));
        synchronized (chain) {
            return chain.anchorFor(context.stage()).orElseGet(() -> chain.advance(context.stage(), run.salt));
        }
    }

    private List<GateVerdict> runGates(StageRun run) {
        StagePolicy stagePolicy = run.resolved.stagePolicy();
        Stage stage = run.context.stage();
        Duration timeout = stagePolicy.gateTimeout();
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();

        List<CompletableFuture<GateVerdict>> dispatched = new ArrayList<>();
        List<CompletableFuture<GateVerdict>> futures = new ArrayList<>();
        for (ResolvedGate resolvedGate : run.resolved.gates()) {
            GateContext gateContext = new GateContext(run.context, resolvedGate.rule().thresholds(), run.resolved.policyRef());
            CompletableFuture<GateVerdict> raw = dispatch(resolvedGate, gateContext, timeout);
            dispatched.add(raw);
            CompletableFuture<GateVerdict> future = raw
                    .handle((verdict, error) -> normalize(resolvedGate.name(), stage, verdict, error, timeout));
            if (stagePolicy.failFast()) {
                future.thenAccept(verdict -> {
                    if (verdict.status() == GateStatus.FAIL) {
                        firstFailure.complete(null);
                    }
                });
            }
            futures.add(future);
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]));
        if (stagePolicy.failFast()) {
            CompletableFuture.anyOf(all, firstFailure).join();
        } else {
            all.join();
        }

        List<GateVerdict> verdicts = new ArrayList<>();
        List<ResolvedGate> gates = run.resolved.gates();
        for (int i = 0; i < futures.size(); i++) {
            CompletableFuture<GateVerdict> future = futures.get(i);
            if (dispatched.get(i).cancel(true)) {
                log.info("orchestrator.gate.skipped op={} stage={} gate={}", run.context.operationId(), stage.id(), gates.get(i).name());
                verdicts.add(GateVerdict.skipped(gates.get(i).name(), stage));
            } else {
                verdicts.add(future.join());
            }
        }
        for (String missing : run.resolved.missingGates()) {
            verdicts.add(GateVerdict.of(missing, stage, GateStatus.REVIEW, "gate enabled by policy but not registered"));
        }
        return verdicts;
    }

    /**
     * Hands one gate to the worker pool. The timeout is armed when the gate starts running; when the
     * returned future times out or is cancelled, the gate's worker is interrupted.
     */
    private CompletableFuture<GateVerdict> dispatch(ResolvedGate resolvedGate, GateContext gateContext, Duration timeout) {
        CompletableFuture<GateVerdict> verdict = new CompletableFuture<>();
        Future<?> task = gateExecutor.submit(() -> {
            if (verdict.isDone()) {
                return;
            }
            ScheduledFuture<?> timer = timeoutScheduler.schedule(
                    () -> verdict.completeExceptionally(new TimeoutException()), timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                verdict.complete(resolvedGate.gate().evaluate(gateContext));
            } catch (RuntimeException e) {
                verdict.completeExceptionally(e);
            } catch (Error e) {
                verdict.completeExceptionally(e);
                throw e;
            } finally {
                timer.cancel(false);
            }
        });
        verdict.whenComplete((result, error) -> {
            if (error instanceof TimeoutException || error instanceof CancellationException) {
                task.cancel(true);
            }
        });
        return verdict;
    }

    private GateVerdict normalize(String gateName, Stage stage, GateVerdict verdict, Throwable error, Duration timeout) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof CancellationException) {
                return GateVerdict.skipped(gateName, stage);
            }
            if (cause instanceof TimeoutException) {
                log.warn("orchestrator.gate.timeout stage={} gate={} timeout={}", stage.id(), gateName, timeout);
                return GateVerdict.of(gateName, stage, GateStatus.REVIEW, "gate timed out after " + timeout);
            }
            log.warn("orchestrator.gate.failed stage={} gate={} error={}", stage.id(), gateName, cause.toString());
            StringWriter trace = new StringWriter();
            cause.printStackTrace(new PrintWriter(trace));
            return new GateVerdict(gateName, stage, GateStatus.REVIEW, Map.of(), List.of(), Digests.sha256Hex(trace.toString()),
                    "gate raised " + cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
        if (verdict == null) {
            return GateVerdict.of(gateName, stage, GateStatus.REVIEW, "gate returned no verdict");
        }
        if (verdict.status() == GateStatus.SKIPPED || !gateName.equals(verdict.gateName())) {
            return GateVerdict.of(gateName, stage, GateStatus.REVIEW, "gate returned a malformed verdict");
        }
        return verdict;
    }

    private CompletableFuture<Enforced> awaitReview(StageRun run, EnforcementDecision decision) {
        if (decision.action() != EnforcementAction.ESCALATE) {
            Outcome outcome = decision.action() == EnforcementAction.BLOCK ? Outcome.BLOCKED : Outcome.PROCEEDED;
            return CompletableFuture.completedFuture(new Enforced(decision, decision.action(), outcome, decision.warnings(), null, null));
        }

        Duration timeout = run.resolved.stagePolicy().escalationTimeout();
        OperationContext context = run.context;
        ReviewRequest request = new ReviewRequest(
                context.operationId() + "/" + context.stage().id(),
                context.operationId(),
                context.lifecycleId(),
                context.stage(),
                run.resolved.policyRef(),
                decision.aggregateStatus(),
                decision.triggeringGates().stream().map(BlockingGate::gateName).toList(),
                run.verdicts,
                clock.instant(),
                clock.instant().plus(timeout));

        CompletableFuture<ReviewDecision> pending;
        try {
            pending = Objects.requireNonNull(reviewBroker.requestReview(request), "review future");
        } catch (RuntimeException e) {
            log.warn("orchestrator.review.unavailable op={} stage={} reason={}", context.operationId(), context.stage().id(), e.toString());
            return CompletableFuture.completedFuture(escalationFailed(decision, "review broker unavailable: " + e.getMessage()));
        }
        return pending.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((review, error) -> resolveEscalation(run, decision, request, review, error, timeout));
    }

    private Enforced resolveEscalation(
            StageRun run,
            EnforcementDecision decision,
            ReviewRequest request,
            ReviewDecision review,
            Throwable error,
            Duration timeout) {
        if (error != null || review == null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            String reason = cause instanceof TimeoutException
                    ? "escalation timed out after " + timeout
                    : "escalation failed: " + (cause == null ? "no decision" : cause.getMessage());
            log.warn("orchestrator.escalation.blocked op={} stage={} reason={}", run.context.operationId(), run.context.stage().id(), reason);
            return escalationFailed(decision, reason);
        }
        List<String> warnings = new ArrayList<>(decision.warnings());
        if (review.approved()) {
            warnings.add("escalation approved by " + review.reviewerId());
            log.info("orchestrator.escalation.approved op={} stage={} reviewer={}", run.context.operationId(), run.context.stage().id(), review.reviewerId());
            return new Enforced(decision, EnforcementAction.ESCALATE, Outcome.PROCEEDED, warnings, review, request.requestId());
        }
        warnings.add("escalation rejected by " + review.reviewerId()
                + (review.rationale() == null || review.rationale().isBlank() ? "" : ": " + review.rationale()));
        log.warn("orchestrator.escalation.rejected op={} stage={} reviewer={}", run.context.operationId(), run.context.stage().id(), review.reviewerId());
        return new Enforced(decision, EnforcementAction.BLOCK, Outcome.BLOCKED, warnings, review, request.requestId());
    }

    private static Enforced escalationFailed(EnforcementDecision decision, String reason) {
        List<String> warnings = new ArrayList<>(decision.warnings());
        warnings.add(reason);
        return new Enforced(decision, EnforcementAction.BLOCK, Outcome.BLOCKED, warnings, null, null);
    }

    private StageResult seal(StageRun run, Enforced enforced) {
        OperationContext context = run.context;
        String operationId = context.operationId();
        String policyRef = run.resolved.policyRef();
        EnforcementDecision decision = enforced.decision();
        List<GateOutcome> gateOutcomes = run.verdicts.stream().map(GateOutcome::of).toList();
        String parentReceiptId = lastReceiptIds.get(operationId);
        boolean blocked = enforced.outcome() == Outcome.BLOCKED;
        if (blocked) {
            blockedOperations.put(operationId, violation(run, enforced, null));
        }

        Receipt reviewReceipt = null;
        if (enforced.review() != null) {
            ReviewDecision review = enforced.review();
            VerdictSummary reviewSummary = new VerdictSummary(decision.aggregateStatus(), EnforcementAction.ESCALATE,
                    review.approved() ? Outcome.APPROVED : Outcome.REJECTED, gateOutcomes, List.of(), null);
            reviewReceipt = signingRetry.run("seal.review", SigningUnavailableException.class,
                    () -> receiptGenerator.sealReview(operationId, run.anchor, review.reviewerId(),
                            review.evidenceDigest(enforced.reviewRequestId()), policyRef, reviewSummary, parentReceiptId));
        }

        VerdictSummary summary = new VerdictSummary(decision.aggregateStatus(), enforced.action(), enforced.outcome(),
                gateOutcomes, enforced.warnings(), reviewReceipt == null ? null : reviewReceipt.receiptId());
        Receipt receipt = signingRetry.run("seal.stage", SigningUnavailableException.class,
                () -> receiptGenerator.seal(operationId, run.anchor, context.evidenceDigest(), policyRef, summary, parentReceiptId));

        try {
            if (reviewReceipt != null) {
                auditTrail.append(reviewReceipt);
            }
            auditTrail.append(receipt);
        } catch (IOException e) {
            throw abort(run, e);
        }
        if (blocked) {
            PolicyViolationException violation = violation(run, enforced, receipt);
            blockedOperations.put(operationId, violation);
            lastReceiptIds.put(operationId, receipt.receiptId());
            run.transition(OrchestratorState.SEALED);
            log.warn("orchestrator.blocked op={} stage={} receipt={} policy={}", operationId, context.stage().id(), receipt.receiptId(), policyRef);
            throw violation;
        }
        if (context.stage() == Stage.INFERENCE) {
            complete(operationId);
        } else {
            lastReceiptIds.put(operationId, receipt.receiptId());
        }
        run.transition(OrchestratorState.SEALED);
        return new StageResult(operationId, context.stage(), policyRef, decision.aggregateStatus(), enforced.action(),
                enforced.outcome(), run.verdicts, enforced.warnings(), receipt, reviewReceipt, run.transitionsSnapshot());
    }

    private static PolicyViolationException violation(StageRun run, Enforced enforced, Receipt receipt) {
        EnforcementDecision decision = enforced.decision();
        String reason = decision.action() == EnforcementAction.ESCALATE
                ? enforced.warnings().get(enforced.warnings().size() - 1)
                : "aggregate status " + decision.aggregateStatus() + " maps to block";
        return new PolicyViolationException(run.context.operationId(), run.context.stage(), run.resolved.policyRef(),
                decision.triggeringGates(), receipt, reason);
    }

    private <T> T guarded(StageRun run, Supplier<T> step) {
        try {
            return step.get();
        } catch (PolicyViolationException | OperationAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw abort(run, e);
        }
    }

    private OperationAbortedException abort(StageRun run, Throwable error) {
        OrchestratorState failedIn = run.current();
        run.transition(OrchestratorState.ABORTED);
        AbortDiagnostic diagnostic = new AbortDiagnostic(
                run.context.operationId(),
                run.context.lifecycleId(),
                run.context.stage().id(),
                failedIn,
                error.getClass().getName(),
                error.getMessage(),
                clock.instant(),
                run.transitionsSnapshot(),
                run.verdicts.stream().map(GateOutcome::of).toList());
        try {
            log.error("orchestrator.aborted diagnostic={}", diagnosticMapper.writeValueAsString(diagnostic));
        } catch (JsonProcessingException jsonError) {
            log.error("orchestrator.aborted diagnostic={}", diagnostic, jsonError);
        }
        return new OperationAbortedException(diagnostic, error);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Enforced(
            EnforcementDecision decision,
            EnforcementAction action,
            Outcome outcome,
            List<String> warnings,
            ReviewDecision review,
            String reviewRequestId) {
    }

    /** Mutable progress of one stage run; each step runs after the previous one completed. */
    private static final class StageRun {
        private final Policy policy;
        private final OperationContext context;
        private final byte[] salt;
        private final List<OrchestratorState> transitions = new ArrayList<>(List.of(OrchestratorState.IDLE));
        private ResolvedStage resolved;
        private Anchor anchor;
        private List<GateVerdict> verdicts = List.of();

        private StageRun(Policy policy, OperationContext context, byte[] salt) {
            this.policy = policy;
            this.context = context;
            this.salt = salt;
        }

        private synchronized void transition(OrchestratorState next) {
            OrchestratorState from = current();
            transitions.add(next);
            log.info("orchestrator.transition op={} stage={} from={} to={}", context.operationId(), context.stage().id(), from, next);
        }

        private synchronized OrchestratorState current() {
            return transitions.get(transitions.size() - 1);
        }

        private synchronized List<OrchestratorState> transitionsSnapshot() {
            return List.copyOf(transitions);
        }
    }
}
