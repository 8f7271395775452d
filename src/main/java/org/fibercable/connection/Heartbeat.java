package org.fibercable.connection;

import org.jetlang.core.Disposable;
import org.jetlang.core.Scheduler;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Liveness pulse for one connection. Started once when the connection opens and stopped once on teardown.
 */
public class Heartbeat {

    public static final String PING_IDENTIFIER = "_ping";

    private final Scheduler scheduler;
    private final long interval;
    private final TimeUnit unit;
    private final Runnable beat;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile Disposable scheduled;

    public Heartbeat(Scheduler scheduler, long interval, TimeUnit unit, Runnable beat) {
        this.scheduler = scheduler;
        this.interval = interval;
        this.unit = unit;
        this.beat = beat;
    }

    public void start() {
        if (interval <= 0 || stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        Runnable send = new Runnable() {
            public void run() {
                if (!stopped.get()) {
                    beat.run();
                }
            }

            @Override
            public String toString() {
                return "Heartbeat.beat()";
            }
        };
        scheduled = scheduler.scheduleAtFixedRate(send, interval, interval, unit);
    }

    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            Disposable toDispose = scheduled;
            if (toDispose != null) {
                toDispose.dispose();
            }
        }
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }
}
