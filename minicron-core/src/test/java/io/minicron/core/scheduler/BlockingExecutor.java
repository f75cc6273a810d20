package io.minicron.core.scheduler;

import io.minicron.core.exec.CommandExecutor;
import io.minicron.core.exec.ExecutionResult;
import io.minicron.core.log.RunStatus;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor whose commands run until {@link #release()} is called.
 */
final class BlockingExecutor implements CommandExecutor {
    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch released = new CountDownLatch(1);
    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public ExecutionResult run(String command, Duration timeout) {
        calls.incrementAndGet();
        started.countDown();
        try {
            if (!released.await(30, TimeUnit.SECONDS)) {
                return new ExecutionResult(RunStatus.TIMED_OUT, null, "", "never released", Duration.ofSeconds(30));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ExecutionResult(RunStatus.INTERRUPTED, null, "", "interrupted", Duration.ZERO);
        }
        return ExecutionResult.exited(0, "done", "", Duration.ofMillis(5));
    }

    boolean awaitStarted() throws InterruptedException {
        return started.await(10, TimeUnit.SECONDS);
    }

    void release() {
        released.countDown();
    }

    int calls() {
        return calls.get();
    }
}
