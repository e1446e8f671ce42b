package io.walkie.model;

/**
 * One inbound message as handed to a local reader. {@code from} is the sender's
 * instance id, or a short form of its mesh identity when the frame carried none.
 */
public record MessageEntry(
        String from,
        String data,
        long ts
) {
}
