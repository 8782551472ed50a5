package com.di.silverline.coordinator;

import com.di.silverline.config.SilverlineProperties;
import com.di.silverline.exception.IngestionCancelledException;
import com.di.silverline.exception.PartialReplaceException;
import com.di.silverline.exception.TimeoutExceededException;
import com.di.silverline.util.MdcPropagation;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one per-table step (locate, stage, apply) on its own thread under a time budget.
 *
 * <p>When the budget runs out, or the waiting thread is interrupted, the step's thread is interrupted
 * (warehouse jobs cancel themselves on interrupt) and given {@code timeouts.cleanup-grace} to stop.
 * The waiting thread then gets {@link TimeoutExceededException} or {@link IngestionCancelledException}.
 * A step that stops with {@link PartialReplaceException} during the grace period reports that instead,
 * since the target is left in a state the caller must know about.
 */
@Slf4j
@Component
public class StepRunner {

    private final ExecutorService workers;
    private final Duration cleanupGrace;

    public StepRunner(SilverlineProperties properties) {
        this.cleanupGrace = properties.getTimeouts().getCleanupGrace();
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "silverline-step-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public <T> RunningStep<T> start(String name, Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Callable<Void> body = MdcPropagation.wrapCallable(() -> {
            try {
                result.complete(task.call());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
            return null;
        });
        Future<Void> worker = workers.submit(body);
        return new RunningStep<>(name, result, worker, cleanupGrace);
    }

    /** Starts the step and waits for it; see {@link RunningStep#await(Duration)}. */
    public <T> T run(String name, Duration budget, Callable<T> task) {
        return start(name, task).await(budget);
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    /**
     * Handle on a started step.
     */
    public static final class RunningStep<T> {

        private final String name;
        private final CompletableFuture<T> result;
        private final Future<Void> worker;
        private final Duration grace;

        RunningStep(String name, CompletableFuture<T> result, Future<Void> worker, Duration grace) {
            this.name = name;
            this.result = result;
            this.worker = worker;
            this.grace = grace;
        }

        /**
         * Waits up to {@code budget} for the step's result. Exceptions thrown by the step are rethrown as is.
         */
        public T await(Duration budget) {
            try {
                return result.get(budget.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("[COORDINATOR] step '{}' exceeded {}, cancelling", name, budget);
                worker.cancel(true);
                Throwable failure = settle();
                if (failure instanceof PartialReplaceException partial) {
                    throw partial;
                }
                throw new TimeoutExceededException(name, budget);
            } catch (InterruptedException e) {
                log.warn("[COORDINATOR] step '{}' interrupted, cancelling", name);
                worker.cancel(true);
                settle();
                Thread.currentThread().interrupt();
                throw new IngestionCancelledException("Step '" + name + "' cancelled", e);
            } catch (ExecutionException e) {
                throw rethrow(e.getCause());
            }
        }

        public boolean isSettled() {
            return result.isDone();
        }

        /** The step's value if it has completed normally, otherwise empty. */
        public Optional<T> succeededValue() {
            if (!result.isDone() || result.isCompletedExceptionally()) {
                return Optional.empty();
            }
            return Optional.ofNullable(result.getNow(null));
        }

        /** Runs {@code action} once the step has finished, whatever the result. */
        public void whenSettled(Runnable action) {
            result.whenComplete((value, error) -> action.run());
        }

        /**
         * Gives a cancelled step the grace period to stop.
         *
         * @return the step's failure if it stopped with one, otherwise null
         */
        private Throwable settle() {
            try {
                result.get(grace.toMillis(), TimeUnit.MILLISECONDS);
                return null;
            } catch (ExecutionException e) {
                log.debug("[COORDINATOR] cancelled step '{}' ended with {}", name, e.getCause().toString());
                return e.getCause();
            } catch (CancellationException | CompletionException e) {
                return e;
            } catch (TimeoutException e) {
                log.warn("[COORDINATOR] step '{}' still running {} after cancellation", name, grace);
                return null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }

        private RuntimeException rethrow(Throwable cause) {
            if (cause instanceof RuntimeException re) {
                return re;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            return new IllegalStateException("Step '" + name + "' failed: " + cause, cause);
        }
    }
}
