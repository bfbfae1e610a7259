package com.meganode.core.signal;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot signal observed by any number of consumers, most commonly used for
 * shutdown.
 *
 * <ul>
 *   <li>Share the same instance to get another producer or consumer.</li>
 *   <li>Consumers that start waiting after the signal was sent still observe it.</li>
 *   <li>Sending more than once is harmless; only the first send has an effect.</li>
 *   <li>Each listener registered with {@link #onSend(Runnable)} runs exactly once.</li>
 * </ul>
 */
public final class NotifyOnce {

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new ArrayList<>();
    private boolean sent;

    /**
     * Send the signal.
     *
     * @return true if this call sent it, false if it had already been sent
     */
    public boolean send() {
        List<Runnable> toRun;
        synchronized (this) {
            if (sent) {
                return false;
            }
            sent = true;
            toRun = List.copyOf(listeners);
            listeners.clear();
        }
        latch.countDown();
        toRun.forEach(Runnable::run);
        return true;
    }

    /**
     * Immediately returns whether the signal has been sent.
     */
    public boolean isSent() {
        return latch.getCount() == 0;
    }

    /**
     * Block until the signal is sent.
     */
    public void await() throws InterruptedException {
        latch.await();
    }

    /**
     * Block until the signal is sent or the timeout elapses.
     *
     * @return true if the signal was sent
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Run {@code listener} when the signal is sent, or right away on the calling
     * thread if it already was. Listeners must be quick and must not block.
     */
    public void onSend(Runnable listener) {
        synchronized (this) {
            if (!sent) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }
}
