package io.walkie.mesh;

/**
 * An open byte stream to one remote node. Writes are queued and never block the caller;
 * the handler receives inbound chunks in stream order, followed by exactly one close.
 */
public interface MeshConnection {

    String remoteIdentity();

    /** Attaches the inbound handler. Data received before this call is replayed to it. */
    void setHandler(StreamHandler handler);

    boolean isWritable();

    void write(byte[] bytes);

    void close();
}
