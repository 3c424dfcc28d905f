package com.assetloom.asset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot wrapper around a callback queued on an asset.
 *
 * Whichever of {@link #fire} and {@link #cancel} runs first wins; the other
 * becomes a no-op, so a listener never fires twice or after cancellation.
 */
final class PendingListener implements AssetRequest {

    private static final Logger LOGGER = LoggerFactory.getLogger(PendingListener.class);

    private final long assetId;
    private final AssetCallback callback;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    PendingListener(long assetId, AssetCallback callback) {
        this.assetId = assetId;
        this.callback = callback;
    }

    @Override
    public long assetId() {
        return assetId;
    }

    @Override
    public boolean isDone() {
        return settled.get();
    }

    @Override
    public boolean cancel() {
        boolean withdrawn = settled.compareAndSet(false, true);
        if (withdrawn) {
            LOGGER.debug("Request for asset {} cancelled", assetId);
        }
        return withdrawn;
    }

    void fire(AssetOutcome outcome) {
        if (!settled.compareAndSet(false, true) || callback == null) {
            return;
        }
        try {
            callback.onComplete(outcome);
        } catch (RuntimeException e) {
            LOGGER.error("Callback for asset {} threw", assetId, e);
        }
    }
}
