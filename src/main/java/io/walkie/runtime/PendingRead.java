package io.walkie.runtime;

import io.walkie.model.MessageEntry;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.BooleanSupplier;

/**
 * A suspended {@code read}. Resolved exactly once, by whichever comes first of a new
 * message, its timeout, a {@code leave} of the channel, or its client going away;
 * later attempts are no-ops.
 */
public final class PendingRead {
    private final Channel channel;
    private final BooleanSupplier clientAlive;
    private final CompletableFuture<List<MessageEntry>> result;
    private ScheduledFuture<?> timer;

    PendingRead(Channel channel, BooleanSupplier clientAlive) {
        this.channel = channel;
        this.clientAlive = clientAlive;
        this.result = new CompletableFuture<>();
    }

    public Channel channel() {
        return channel;
    }

    public CompletableFuture<List<MessageEntry>> result() {
        return result;
    }

    public boolean isDone() {
        return result.isDone();
    }

    boolean clientAlive() {
        return clientAlive.getAsBoolean();
    }

    void armTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    boolean resolve(List<MessageEntry> messages) {
        if (!result.complete(messages)) {
            return false;
        }
        if (timer != null) {
            timer.cancel(false);
        }
        return true;
    }
}
