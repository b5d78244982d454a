package com.intervista.core.state;

import com.intervista.core.config.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds {@code intervista.state.*}.
 *
 * <pre>
 * intervista:
 *   state:
 *     history-depth: 50
 *     snapshot-every-revisions: 10
 *     snapshot-every-seconds: 30
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "intervista.state")
public class StateProperties {

    private int historyDepth = 50;
    private int snapshotEveryRevisions = 10;
    private int snapshotEverySeconds = 30;

    @PostConstruct
    void validate() {
        if (historyDepth < 1) {
            throw new InvalidConfigurationException("intervista.state.history-depth must be >= 1, got " + historyDepth);
        }
        if (snapshotEveryRevisions < 1) {
            throw new InvalidConfigurationException(
                    "intervista.state.snapshot-every-revisions must be >= 1, got " + snapshotEveryRevisions);
        }
        if (snapshotEverySeconds < 0) {
            throw new InvalidConfigurationException(
                    "intervista.state.snapshot-every-seconds must be >= 0, got " + snapshotEverySeconds);
        }
    }

    public int getHistoryDepth() { return historyDepth; }
    public void setHistoryDepth(int historyDepth) { this.historyDepth = historyDepth; }
    public int getSnapshotEveryRevisions() { return snapshotEveryRevisions; }
    public void setSnapshotEveryRevisions(int snapshotEveryRevisions) { this.snapshotEveryRevisions = snapshotEveryRevisions; }
    public int getSnapshotEverySeconds() { return snapshotEverySeconds; }
    public void setSnapshotEverySeconds(int snapshotEverySeconds) { this.snapshotEverySeconds = snapshotEverySeconds; }
}
