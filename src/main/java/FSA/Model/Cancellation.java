package FSA.Model;

import java.util.concurrent.ScheduledFuture;

/**
 * Cancellation token checked by long-running pipelines at stage boundaries (between candidates,
 * between cover sizes, between explored subsets).
 * <p>
 * A token is interrupted explicitly, by a scheduled timer ({@link #setBackref}), or once some
 * construction grows past its state threshold.
 */
public class Cancellation {

    private final int stateThreshold;

    private volatile boolean interrupted;
    private volatile boolean oom;

    private ScheduledFuture<?> backref;

    public Cancellation() {
        this(false, Integer.MAX_VALUE);
    }

    public Cancellation(boolean interrupted, int stateThreshold) {
        this.interrupted = interrupted;
        this.stateThreshold = stateThreshold;
    }

    public static Cancellation none() {
        return new Cancellation();
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public void setInterrupted() {
        this.interrupted = true;
    }

    public boolean isOom() {
        return oom;
    }

    public boolean isAboveThreshold(int states) {
        if (states > stateThreshold) {
            this.oom = true;
        }
        return this.oom;
    }

    public boolean isCancelled() {
        return isInterrupted() || isOom();
    }

    public String cancelLabel() {
        return this.isInterrupted() ? "TO" : "OOM";
    }

    /**
     * Stops the timer that would interrupt this token, if one was scheduled.
     */
    public void cancel() {
        if (backref != null) {
            backref.cancel(true);
        }
    }

    public void setBackref(ScheduledFuture<?> backref) {
        this.backref = backref;
    }
}
