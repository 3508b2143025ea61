package com.gentoro.fedquery.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.fedquery.config.EngineSettings;
import com.gentoro.fedquery.data.RowSet;
import com.gentoro.fedquery.engine.combinator.Combinator;
import com.gentoro.fedquery.exception.ExceptionUtil;
import com.gentoro.fedquery.exception.FedQueryErrorCode;
import com.gentoro.fedquery.exception.FedQueryException;
import com.gentoro.fedquery.logging.LoggingService;
import com.gentoro.fedquery.plan.Plan;
import com.gentoro.fedquery.plan.PlanGraph;
import com.gentoro.fedquery.plan.PlanParser;
import com.gentoro.fedquery.plan.PlanValidationException;
import com.gentoro.fedquery.plan.PlanValidator;
import com.gentoro.fedquery.plan.Step;
import com.gentoro.fedquery.source.AdapterException;
import com.gentoro.fedquery.source.AdapterRegistry;
import com.gentoro.fedquery.source.DataSourceAdapter;
import com.gentoro.fedquery.telemetry.PlanTelemetry;
import com.gentoro.fedquery.telemetry.TelemetryOutcome;
import com.gentoro.fedquery.telemetry.TelemetryRecord;
import com.gentoro.fedquery.telemetry.TelemetrySink;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;

/**
 * Runs validated plans against the registered adapters.
 *
 * <p>Scheduling is Kahn-style: a step becomes ready once every input it reads has been published,
 * and ready steps are dispatched in declaration order. Query steps run on a shared worker pool,
 * with at most {@code engine.max-concurrent-queries} of one plan in flight at a time. In-memory
 * steps run on the calling thread as soon as they are ready; they never block on I/O.
 *
 * <p>The first step that fails for good aborts the plan: steps that have not started are skipped,
 * running ones are cancelled by interrupting their worker, and late results are discarded. The
 * caller always receives a {@link PlanResult}; {@code execute} does not throw for plan, step or
 * deadline failures.
 */
public class FederatedExecutor implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(FederatedExecutor.class);

  private final AdapterRegistry adapters;
  private final EngineSettings settings;
  private final RetryPolicy retryPolicy;
  private final TelemetrySink telemetrySink;
  private final ExecutorService workers;
  private final Clock clock;
  private final Sleeper sleeper;
  private final DoubleSupplier random;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public FederatedExecutor(
      AdapterRegistry adapters, EngineSettings settings, TelemetrySink telemetrySink) {
    this(
        adapters,
        settings,
        telemetrySink,
        Clock.systemUTC(),
        Sleeper.SYSTEM,
        () -> ThreadLocalRandom.current().nextDouble());
  }

  FederatedExecutor(
      AdapterRegistry adapters,
      EngineSettings settings,
      TelemetrySink telemetrySink,
      Clock clock,
      Sleeper sleeper,
      DoubleSupplier random) {
    this.adapters = adapters;
    this.settings = settings;
    this.retryPolicy = RetryPolicy.from(settings);
    this.telemetrySink = telemetrySink;
    this.clock = clock;
    this.sleeper = sleeper;
    this.random = random;
    AtomicInteger threadCounter = new AtomicInteger();
    this.workers =
        Executors.newFixedThreadPool(
            settings.workerThreads(),
            r -> {
              Thread t = new Thread(r, "fedquery-worker-" + threadCounter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  /** Parse and run a plan given as JSON text. */
  public PlanResult execute(String planJson) {
    try {
      return execute(PlanParser.parse(planJson));
    } catch (PlanValidationException e) {
      return rejected(null, e, clock.instant());
    }
  }

  /** Parse and run a plan given as a JSON tree. */
  public PlanResult execute(JsonNode planJson) {
    try {
      return execute(PlanParser.parse(planJson));
    } catch (PlanValidationException e) {
      return rejected(null, e, clock.instant());
    }
  }

  public PlanResult execute(Plan plan) {
    Instant started = clock.instant();
    if (closed.get()) {
      return PlanResult.failure(
          plan.getId(),
          new FailureReport(
              FailureReport.Kind.INTERNAL_ERROR,
              null,
              null,
              FedQueryErrorCode.STATE_ERROR.name(),
              "Executor has been shut down",
              null,
              null,
              null,
              null),
          initialStates(plan, StepState.SKIPPED),
          List.of(),
          Duration.ZERO);
    }

    PlanGraph graph;
    try {
      graph = PlanValidator.validate(plan, adapters.registeredKinds());
    } catch (PlanValidationException e) {
      return rejected(plan, e, started);
    }

    PlanRun run = new PlanRun(graph, started);
    try {
      return run.execute();
    } catch (RuntimeException e) {
      log.error(
          "Unexpected error while executing plan {}: {}",
          plan.getId(),
          ExceptionUtil.formatCompactStackTrace(e),
          e);
      return run.abortUnexpected(e);
    }
  }

  private PlanResult rejected(Plan plan, PlanValidationException e, Instant started) {
    String planId = plan == null ? null : plan.getId();
    log.warn("Plan {} rejected ({}): {}", planId, e.getReason(), e.getMessage());
    List<String> skipped = plan == null ? List.of() : ids(plan.getSteps());
    FailureReport report =
        new FailureReport(
            FailureReport.Kind.PLAN_INVALID,
            e.getStepIds().isEmpty() ? null : e.getStepIds().get(0),
            null,
            e.getReason().name(),
            e.getMessage(),
            List.of(),
            skipped,
            List.of(),
            List.of());
    Map<String, StepState> states =
        plan == null ? Map.of() : initialStates(plan, StepState.SKIPPED);
    return PlanResult.failure(
        planId, report, states, List.of(), Duration.between(started, clock.instant()));
  }

  private static Map<String, StepState> initialStates(Plan plan, StepState state) {
    Map<String, StepState> states = new LinkedHashMap<>();
    for (Step s : plan.getSteps()) {
      states.putIfAbsent(s.getId(), state);
    }
    return states;
  }

  private static List<String> ids(List<Step> steps) {
    return steps.stream().map(Step::getId).distinct().toList();
  }

  /** Stop the worker pool. Plans still running see their query steps fail. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Worker pool did not terminate within 5 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Outcome of one query step, produced on a worker thread. */
  private record Completion(
      Step step, RowSet rows, AdapterException error, int attempts, Instant finished) {}

  /** Reason the plan stopped early. */
  private record Abort(
      FailureReport.Kind kind, Step step, String errorKind, String message) {}

  /** Mutable state of one execution. Only touched by the calling thread. */
  private final class PlanRun {
    private final PlanGraph graph;
    private final Plan plan;
    private final Instant started;
    private final Instant deadline;
    private final Map<String, StepState> states = new LinkedHashMap<>();
    private final Map<String, Integer> waitingOn = new HashMap<>();
    private final PriorityQueue<Step> ready =
        new PriorityQueue<>(Comparator.comparingInt(Step::getIndex));
    private final ResultStore store = new ResultStore();
    private final PlanTelemetry telemetry;
    private final Map<String, Future<?>> inFlight = new LinkedHashMap<>();
    private final Map<String, Instant> startTimes = new HashMap<>();
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
    private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private int runningQueries;
    private Abort abort;

    PlanRun(PlanGraph graph, Instant started) {
      this.graph = graph;
      this.plan = graph.getPlan();
      this.started = started;
      this.deadline = started.plus(plan.getDeadline().orElse(settings.planDeadline()));
      this.telemetry = new PlanTelemetry(plan.getId());
    }

    PlanResult execute() {
      log.info(
          "Executing plan {} ({} steps, deadline in {} ms)",
          plan.getId(),
          plan.size(),
          Duration.between(started, deadline).toMillis());
      for (Step step : plan.getSteps()) {
        states.put(step.getId(), StepState.PENDING);
        int dependencies = graph.dependencyCount(step.getId());
        waitingOn.put(step.getId(), dependencies);
        if (dependencies == 0) {
          markReady(step);
        }
      }

      String finalId = graph.getFinalStep().getId();
      while (abort == null && states.get(finalId) != StepState.SUCCEEDED) {
        dispatchReady();
        if (abort != null || states.get(finalId) == StepState.SUCCEEDED) {
          break;
        }
        if (inFlight.isEmpty()) {
          abort =
              new Abort(
                  FailureReport.Kind.INTERNAL_ERROR,
                  null,
                  FedQueryErrorCode.INTERNAL_CONSISTENCY_ERROR.name(),
                  "No step is running and none can be started");
          break;
        }
        Completion completion;
        try {
          completion = nextCompletion();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          abort =
              new Abort(
                  FailureReport.Kind.INTERNAL_ERROR,
                  null,
                  FedQueryErrorCode.EXECUTION_ERROR.name(),
                  "Plan execution was interrupted");
          break;
        }
        if (completion == null) {
          deadlineExceeded();
          break;
        }
        onCompletion(completion);
      }
      return finish();
    }

    private Completion nextCompletion() throws InterruptedException {
      Completion completion = completions.poll();
      if (completion != null) {
        return completion;
      }
      long waitMs = Duration.between(clock.instant(), deadline).toMillis();
      if (waitMs <= 0) {
        return null;
      }
      return completions.poll(waitMs, TimeUnit.MILLISECONDS);
    }

    private void markReady(Step step) {
      states.put(step.getId(), StepState.READY);
      ready.add(step);
    }

    private void dispatchReady() {
      List<Step> deferred = new ArrayList<>();
      while (abort == null && !ready.isEmpty()) {
        Step step = ready.poll();
        if (step.isBackendQuery()) {
          if (runningQueries >= settings.maxConcurrentQueries()) {
            deferred.add(step);
          } else {
            submit(step);
          }
        } else if (!clock.instant().isBefore(deadline)) {
          ready.add(step);
          deadlineExceeded();
        } else {
          runInline(step);
        }
      }
      ready.addAll(deferred);
    }

    private void submit(Step step) {
      String id = step.getId();
      DataSourceAdapter adapter = adapters.get(step.getDataSource());
      AtomicInteger counter = attempts.computeIfAbsent(id, k -> new AtomicInteger());
      states.put(id, StepState.RUNNING);
      startTimes.put(id, clock.instant());
      log.debug("Dispatching query step '{}' to {}", id, step.getDataSource().wireName());
      try {
        inFlight.put(
            id, workers.submit(() -> completions.add(callWithRetry(step, adapter, counter))));
        runningQueries++;
      } catch (RejectedExecutionException e) {
        states.put(id, StepState.FAILED);
        abort =
            new Abort(
                FailureReport.Kind.INTERNAL_ERROR,
                step,
                FedQueryErrorCode.STATE_ERROR.name(),
                "Worker pool rejected step '" + id + "'");
      }
    }

    /** Runs on a worker thread. */
    private Completion callWithRetry(Step step, DataSourceAdapter adapter, AtomicInteger counter) {
      JsonNode query = step.getQuery();
      AdapterException failure = null;
      while (true) {
        if (isCancelled()) {
          return cancelledCompletion(step, failure, counter.get());
        }
        int attempt = counter.incrementAndGet();
        Instant now = clock.instant();
        Instant stepDeadline = now.plus(settings.stepTimeout());
        Instant callDeadline = stepDeadline.isBefore(deadline) ? stepDeadline : deadline;
        try {
          RowSet rows = adapter.execute(query, callDeadline);
          return new Completion(
              step, rows == null ? RowSet.empty() : rows, null, attempt, clock.instant());
        } catch (AdapterException e) {
          failure = e;
        } catch (RuntimeException e) {
          failure =
              new AdapterException(
                  AdapterException.Kind.BACKEND_REJECTED,
                  step.getDataSource(),
                  "Adapter failed unexpectedly: " + ExceptionUtil.extractErrorMessage(e),
                  e);
        }

        if (isCancelled() || !retryPolicy.shouldRetry(failure, attempt)) {
          return new Completion(step, null, failure, attempt, clock.instant());
        }
        Duration delay = retryPolicy.backoff(attempt, random);
        if (clock.instant().plus(delay).isAfter(deadline)) {
          log.warn(
              "Step '{}' failed with {} and a retry would start after the plan deadline",
              step.getId(),
              failure.getKind());
          return new Completion(step, null, failure, attempt, clock.instant());
        }
        log.warn(
            "Step '{}' attempt {}/{} failed with {}: {}. Retrying in {} ms",
            step.getId(),
            attempt,
            retryPolicy.maxAttempts(),
            failure.getKind(),
            failure.getMessage(),
            delay.toMillis());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return new Completion(step, null, failure, attempt, clock.instant());
        }
      }
    }

    /** True once the plan is finishing; no further attempt of its steps may start. */
    private boolean isCancelled() {
      return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    private Completion cancelledCompletion(Step step, AdapterException last, int attempt) {
      AdapterException error =
          last != null
              ? last
              : new AdapterException(
                  AdapterException.Kind.TIMEOUT, step.getDataSource(), "Step was cancelled");
      return new Completion(step, null, error, attempt, clock.instant());
    }

    private void onCompletion(Completion completion) {
      Step step = completion.step();
      String id = step.getId();
      if (inFlight.remove(id) == null) {
        return;
      }
      runningQueries--;
      Instant start = startTimes.get(id);
      Duration duration = Duration.between(start, completion.finished());
      if (completion.error() == null) {
        TelemetryOutcome outcome =
            completion.attempts() > 1 ? TelemetryOutcome.RETRIED : TelemetryOutcome.SUCCEEDED;
        record(
            step, start, duration, completion.rows().size(), completion.attempts(), outcome, null);
        complete(step, completion.rows());
        return;
      }
      AdapterException error = completion.error();
      states.put(id, StepState.FAILED);
      record(
          step,
          start,
          duration,
          0,
          completion.attempts(),
          TelemetryOutcome.FAILED,
          error.getKind().name());
      log.warn(
          "Step '{}' failed after {} attempt(s) with {}: {}",
          id,
          completion.attempts(),
          error.getKind(),
          error.getMessage());
      abort =
          new Abort(
              FailureReport.Kind.STEP_FAILED,
              step,
              error.getKind().name(),
              ExceptionUtil.extractErrorMessage(error));
    }

    private void runInline(Step step) {
      String id = step.getId();
      states.put(id, StepState.RUNNING);
      Instant start = clock.instant();
      try {
        Map<String, RowSet> inputs = new LinkedHashMap<>();
        for (String var : step.getInputs()) {
          inputs.put(var, store.get(var));
        }
        RowSet rows = Combinator.apply(step.getOperation(), inputs, step.getParameters());
        record(
            step,
            start,
            Duration.between(start, clock.instant()),
            rows.size(),
            1,
            TelemetryOutcome.SUCCEEDED,
            null);
        complete(step, rows);
      } catch (InternalConsistencyException e) {
        failInline(step, start, FailureReport.Kind.INTERNAL_ERROR, e);
      } catch (FedQueryException e) {
        failInline(step, start, FailureReport.Kind.STEP_FAILED, e);
      } catch (RuntimeException e) {
        log.error(
            "Unexpected error in step '{}': {}", id, ExceptionUtil.formatCompactStackTrace(e), e);
        failInline(
            step,
            start,
            FailureReport.Kind.INTERNAL_ERROR,
            ExceptionUtil.wrap(e, FedQueryErrorCode.EXECUTION_ERROR, e.toString()));
      }
    }

    private void failInline(
        Step step, Instant start, FailureReport.Kind kind, FedQueryException e) {
      states.put(step.getId(), StepState.FAILED);
      record(
          step,
          start,
          Duration.between(start, clock.instant()),
          0,
          1,
          TelemetryOutcome.FAILED,
          e.getCode().name());
      log.warn("Step '{}' failed: {}", step.getId(), e.getMessage());
      abort = new Abort(kind, step, e.getCode().name(), ExceptionUtil.extractErrorMessage(e));
    }

    private void complete(Step step, RowSet rows) {
      try {
        store.publish(step.getOutputVar(), rows);
      } catch (DuplicateOutputException e) {
        states.put(step.getId(), StepState.FAILED);
        abort =
            new Abort(
                FailureReport.Kind.INTERNAL_ERROR, step, e.getCode().name(), e.getMessage());
        return;
      }
      states.put(step.getId(), StepState.SUCCEEDED);
      log.debug("Step '{}' produced {} row(s)", step.getId(), rows.size());
      for (Step dependent : graph.dependentsOf(step.getId())) {
        if (waitingOn.merge(dependent.getId(), -1, Integer::sum) == 0) {
          markReady(dependent);
        }
      }
    }

    private void deadlineExceeded() {
      long budget = Duration.between(started, deadline).toMillis();
      log.warn("Plan {} exceeded its deadline of {} ms", plan.getId(), budget);
      abort =
          new Abort(
              FailureReport.Kind.DEADLINE_EXCEEDED,
              null,
              FailureReport.Kind.DEADLINE_EXCEEDED.name(),
              "Plan did not complete within " + budget + " ms");
    }

    private void record(
        Step step,
        Instant start,
        Duration duration,
        long rows,
        int attemptCount,
        TelemetryOutcome outcome,
        String errorKind) {
      telemetry.append(
          new TelemetryRecord(
              plan.getId(),
              step.getId(),
              step.getKind(),
              step.getDataSource(),
              start,
              duration,
              rows,
              attemptCount,
              outcome,
              errorKind));
    }

    private PlanResult finish() {
      if (abort == null) {
        RowSet rows = store.get(graph.getFinalStep().getOutputVar());
        Duration elapsed = Duration.between(started, clock.instant());
        log.info(
            "Plan {} succeeded in {} ms with {} row(s)",
            plan.getId(),
            elapsed.toMillis(),
            rows.size());
        flushTelemetry();
        return PlanResult.success(plan.getId(), rows, states, telemetry.snapshot(), elapsed);
      }

      List<String> pending = new ArrayList<>();
      if (abort.kind() == FailureReport.Kind.DEADLINE_EXCEEDED) {
        states.forEach(
            (id, state) -> {
              if (!state.isTerminal()) {
                pending.add(id);
              }
            });
      }
      cancelInFlight();
      states.replaceAll(
          (id, state) ->
              state == StepState.PENDING || state == StepState.READY ? StepState.SKIPPED : state);

      FailureReport report =
          new FailureReport(
              abort.kind(),
              abort.step() == null ? null : abort.step().getId(),
              abort.step() == null ? null : abort.step().getDataSource().wireName(),
              abort.errorKind(),
              abort.message(),
              idsIn(StepState.SUCCEEDED),
              idsIn(StepState.SKIPPED),
              idsIn(StepState.CANCELLED),
              pending);
      Duration elapsed = Duration.between(started, clock.instant());
      log.warn(
          "Plan {} failed after {} ms ({}): {}",
          plan.getId(),
          elapsed.toMillis(),
          report.kind(),
          report.message());
      flushTelemetry();
      return PlanResult.failure(plan.getId(), report, states, telemetry.snapshot(), elapsed);
    }

    PlanResult abortUnexpected(RuntimeException e) {
      abort =
          new Abort(
              FailureReport.Kind.INTERNAL_ERROR,
              null,
              ExceptionUtil.toErrorDetails(e).code().name(),
              ExceptionUtil.extractErrorMessage(e));
      return finish();
    }

    private void cancelInFlight() {
      cancelled.set(true);
      Instant now = clock.instant();
      for (Map.Entry<String, Future<?>> entry : inFlight.entrySet()) {
        String id = entry.getKey();
        entry.getValue().cancel(true);
        states.put(id, StepState.CANCELLED);
        Instant start = startTimes.get(id);
        record(
            graph.getStep(id),
            start,
            Duration.between(start, now),
            0,
            attempts.get(id).get(),
            TelemetryOutcome.CANCELLED,
            null);
        log.debug("Cancelled in-flight step '{}'", id);
      }
      inFlight.clear();
      runningQueries = 0;
    }

    private List<String> idsIn(StepState state) {
      List<String> out = new ArrayList<>();
      states.forEach(
          (id, s) -> {
            if (s == state) {
              out.add(id);
            }
          });
      return out;
    }

    private void flushTelemetry() {
      try {
        telemetry.flushTo(telemetrySink);
      } catch (RuntimeException e) {
        log.warn(
            "Telemetry sink failed for plan {}: {}",
            plan.getId(),
            ExceptionUtil.extractErrorMessage(e));
      }
    }
  }
}
