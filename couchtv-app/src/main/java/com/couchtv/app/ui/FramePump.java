package com.couchtv.app.ui;

import com.couchtv.app.session.MediaSession;

import javax.swing.*;
import java.util.Objects;

/**
 * Drives {@link MediaSession#processPending()} from the Swing event thread so finished
 * fetches show up even while the user is idle.
 */
public class FramePump {

    public static final int DEFAULT_INTERVAL_MS = 500;

    private final MediaSession session;
    private final Runnable repaint;
    private final Timer timer;

    public FramePump(MediaSession session, Runnable repaint) {
        this(session, session.config().getFrameIntervalMillis(), repaint);
    }

    /**
     * @param repaint called after every drain, or null
     */
    public FramePump(MediaSession session, int intervalMillis, Runnable repaint) {
        this.session = Objects.requireNonNull(session, "session");
        this.repaint = repaint;
        this.timer = new Timer(intervalMillis > 0 ? intervalMillis : DEFAULT_INTERVAL_MS, e -> tick());
        this.timer.setCoalesce(true);
    }

    public void start() {
        if (!timer.isRunning()) {
            timer.start();
        }
    }

    public void stop() {
        if (timer.isRunning()) {
            timer.stop();
        }
    }

    public boolean isRunning() {
        return timer.isRunning();
    }

    public int getInterval() {
        return timer.getDelay();
    }

    /**
     * One frame: apply finished fetches, then repaint.
     *
     * @return number of results applied
     */
    int tick() {
        int drained = session.processPending();
        if (repaint != null) {
            repaint.run();
        }
        return drained;
    }
}
