package io.github.hotbrkm.outreach.dispatcher.send.result;

@FunctionalInterface
public interface DispatchProgressListener {

    DispatchProgressListener NOOP = progress -> {
    };

    void onProgress(DispatchProgress progress);
}
