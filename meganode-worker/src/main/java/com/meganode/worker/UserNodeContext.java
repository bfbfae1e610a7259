package com.meganode.worker;

import com.meganode.core.model.LeaseId;
import com.meganode.core.model.RunPorts;
import com.meganode.core.model.UserPk;
import com.meganode.core.signal.NotifyOnce;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Context provided to a user node while it runs.
 */
public class UserNodeContext {

    private final UserPk userPk;
    private final LeaseId leaseId;
    private final boolean shutdownAfterSync;
    private final NotifyOnce stopSignal;
    private final ReadyCallback readyCallback;
    private final ActivityCallback activityCallback;
    private final AtomicBoolean ready = new AtomicBoolean(false);

    public UserNodeContext(
            UserPk userPk,
            LeaseId leaseId,
            boolean shutdownAfterSync,
            NotifyOnce stopSignal,
            ReadyCallback readyCallback,
            ActivityCallback activityCallback) {
        this.userPk = userPk;
        this.leaseId = leaseId;
        this.shutdownAfterSync = shutdownAfterSync;
        this.stopSignal = stopSignal;
        this.readyCallback = readyCallback;
        this.activityCallback = activityCallback;
    }

    public UserPk getUserPk() {
        return userPk;
    }

    /**
     * The lease this node was admitted under. Later renewals are not reflected here.
     */
    public LeaseId getLeaseId() {
        return leaseId;
    }

    /**
     * Whether the node should sync and then exit instead of serving.
     */
    public boolean shutdownAfterSync() {
        return shutdownAfterSync;
    }

    /**
     * Report that the node is ready to serve on the given ports.
     *
     * @return true on the first call, false if readiness was already reported
     */
    public boolean markReady(int appPort, int lexePort) {
        if (!ready.compareAndSet(false, true)) {
            return false;
        }
        readyCallback.onReady(new RunPorts(userPk, appPort, lexePort));
        return true;
    }

    public boolean isReady() {
        return ready.get();
    }

    /**
     * Report user activity, resetting the user's inactivity timer.
     */
    public void reportActivity() {
        activityCallback.onActivity(userPk);
    }

    public boolean isStopRequested() {
        return stopSignal.isSent();
    }

    /**
     * Block until a stop is requested or the timeout elapses.
     *
     * @return true if a stop was requested
     */
    public boolean awaitStop(Duration timeout) throws InterruptedException {
        return stopSignal.await(timeout);
    }

    /**
     * Block until a stop is requested.
     */
    public void awaitStop() throws InterruptedException {
        stopSignal.await();
    }

    /**
     * Callback for readiness.
     */
    @FunctionalInterface
    public interface ReadyCallback {
        void onReady(RunPorts ports);
    }

    /**
     * Callback for user activity.
     */
    @FunctionalInterface
    public interface ActivityCallback {
        void onActivity(UserPk userPk);
    }
}
