package io.walkie.mesh;

public interface StreamHandler {

    void onData(byte[] chunk);

    void onClose();
}
