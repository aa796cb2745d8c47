package io.seventytwo.blocks.api;

/**
 * Host lifecycle hooks. A thin platform adapter calls these when the process is about to be
 * suspended and when it runs again; nothing else about the platform leaks into the engine.
 */
public interface LifecycleSignal {
    void onSuspend();

    void onResume();
}
