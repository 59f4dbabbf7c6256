package com.example.automatacurve;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs curve tasks on a single background thread, one at a time. Starting a
 * new task cancels the one still running.
 */
public class CurveRunner implements AutoCloseable {

    private static final Logger logger = Logger.getLogger("com.example.automatacurve");

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "computation thread");
        thread.setDaemon(true);
        return thread;
    });

    private CancellationToken current;

    public synchronized Future<List<PointSet>> start(CurveTask task) {
        if (current != null && !current.isCancelled()) {
            logger.log(Level.FINE, "stopping previous computation");
            current.cancel();
        }
        CancellationToken token = new CancellationToken();
        current = token;
        return executor.submit(() -> task.compute(token));
    }

    /** Asks the running task to stop; it still completes its future with a partial result. */
    public synchronized void cancel() {
        if (current != null) {
            current.cancel();
        }
    }

    @Override
    public void close() {
        cancel();
        executor.shutdown();
    }
}
