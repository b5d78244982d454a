package com.intervista.core.persistence;

import java.util.Optional;

/**
 * Position of one stored snapshot: the session revision and the write sequence that orders writes of
 * the same session. Encoded as the checkpoint id {@code <revision>-<writeSeq>}.
 */
record SnapshotKey(long revision, long writeSeq) {

    String checkpointId() {
        return revision + "-" + writeSeq;
    }

    /** Empty for ids this store did not write. */
    static Optional<SnapshotKey> parse(String checkpointId) {
        int dash = checkpointId == null ? -1 : checkpointId.indexOf('-');
        if (dash <= 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(new SnapshotKey(
                    Long.parseLong(checkpointId.substring(0, dash)),
                    Long.parseLong(checkpointId.substring(dash + 1))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
