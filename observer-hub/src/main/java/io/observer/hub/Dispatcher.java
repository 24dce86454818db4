package io.observer.hub;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Invokes a snapshot of callbacks with one value and returns once all of them have completed.
 *
 * <p>Without an executor every callback runs sequentially on the publishing thread. With an
 * executor each callback is submitted as its own task and the publishing thread joins all of
 * them before returning. While joining, the publishing thread runs any of its tasks the executor
 * has not started yet, so a callback that publishes again from a pool thread cannot starve the
 * pool, however small it is. In both modes:
 * <ul>
 *   <li>a {@link RuntimeException} thrown by a callback is logged and isolated, so sibling
 *       callbacks still run and the publisher never sees it</li>
 *   <li>an {@link Error} is logged and rethrown to the publisher, but only after every other
 *       callback has completed</li>
 * </ul>
 *
 * <p>The executor belongs to the caller and is never shut down here.
 */
final class Dispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(Dispatcher.class);

    private final ExecutorService callbackExecutor;

    /**
     * @param callbackExecutor executor for parallel delivery, null for delivery on the calling thread
     */
    Dispatcher(ExecutorService callbackExecutor) {
        this.callbackExecutor = callbackExecutor;
    }

    boolean isParallel() {
        return callbackExecutor != null;
    }

    <T> void dispatch(List<Registration<T>> targets, T value) {
        if (targets.isEmpty()) {
            return;
        }
        if (callbackExecutor == null || targets.size() == 1) {
            dispatchDirect(targets, value);
        } else {
            dispatchParallel(targets, value);
        }
    }

    /**
     * Invokes a single callback on the calling thread with the same isolation rules as
     * {@link #dispatch(List, Object)}.
     */
    <T> void invokeNow(String identifier, Consumer<? super T> callback, T value) {
        invoke(identifier, callback, value);
    }

    private <T> void dispatchDirect(List<Registration<T>> targets, T value) {
        Error fatal = null;
        for (Registration<T> target : targets) {
            try {
                invoke(describe(target), target.getCallback(), value);
            } catch (Error e) {
                fatal = accumulate(fatal, e);
            }
        }
        if (fatal != null) {
            throw fatal;
        }
    }

    private <T> void dispatchParallel(List<Registration<T>> targets, T value) {
        List<FutureTask<Void>> pending = new ArrayList<>(targets.size());

        for (Registration<T> target : targets) {
            FutureTask<Void> task = new FutureTask<>(() -> invoke(describe(target), target.getCallback(), value), null);
            try {
                callbackExecutor.execute(task);
            } catch (RejectedExecutionException e) {
                // Run by the publishing thread while joining
                LOGGER.warn("Callback executor rejected subscriber {}, invoking it on the publishing thread",
                    describe(target));
            }
            pending.add(task);
        }

        Error fatal = null;
        boolean interrupted = false;
        for (FutureTask<Void> task : pending) {
            // No-op unless the executor has not started the task yet. A callback publishing on a
            // pool thread then never waits for work queued behind itself.
            task.run();
            while (true) {
                try {
                    task.get();
                    break;
                } catch (InterruptedException e) {
                    // Keep joining: a publish is never abandoned half way
                    interrupted = true;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof Error) {
                        fatal = accumulate(fatal, (Error) cause);
                    } else {
                        LOGGER.warn("Callback task failed outside the subscriber", cause);
                    }
                    break;
                }
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (fatal != null) {
            throw fatal;
        }
    }

    private static <T> void invoke(String identifier, Consumer<? super T> callback, T value) {
        try {
            callback.accept(value);
        } catch (RuntimeException e) {
            LOGGER.warn("Subscriber {} threw exception while handling value {}", identifier, value, e);
        } catch (Error e) {
            LOGGER.error("Subscriber {} threw Error while handling value {}", identifier, value, e);
            throw e;
        }
    }

    private static Error accumulate(Error first, Error next) {
        if (first == null) {
            return next;
        }
        if (first != next) {
            first.addSuppressed(next);
        }
        return first;
    }

    private static String describe(Registration<?> registration) {
        return "#" + registration.getId();
    }
}
