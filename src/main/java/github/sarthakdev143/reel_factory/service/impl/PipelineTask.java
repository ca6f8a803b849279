package github.sarthakdev143.reel_factory.service.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A unit of pipeline work whose cancellation interrupts the thread running it, and whose caller can wait for
 * that thread to leave the task before touching the files it writes.
 */
final class PipelineTask<T> extends FutureTask<T> {

    private static final Logger logger = LoggerFactory.getLogger(PipelineTask.class);

    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private PipelineTask(Callable<T> callable) {
        super(callable);
    }

    /**
     * Hands the work to the executor. A saturated executor runs it on the calling thread instead, so a busy
     * pool slows a request down rather than failing it.
     */
    static <T> PipelineTask<T> submit(String name, Callable<T> callable, TaskExecutor executor) {
        PipelineTask<T> task = new PipelineTask<>(callable);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            logger.debug("Executor saturated; running {} on the request thread", name);
            task.run();
        }
        return task;
    }

    @Override
    public void run() {
        started.set(true);
        try {
            super.run();
        } finally {
            stopped.countDown();
        }
    }

    /**
     * Cancels the task and, if a thread had already picked it up, blocks until that thread returns. The
     * caller's interrupt status is preserved.
     */
    void cancelAndAwait() {
        cancel(true);
        // not started by now means the body never runs: FutureTask skips cancelled tasks
        if (!started.get()) {
            return;
        }

        boolean interrupted = Thread.interrupted();
        try {
            while (true) {
                try {
                    stopped.await();
                    return;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
