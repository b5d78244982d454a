package com.intervista.core.model;

/**
 * Per-modality outcome shown in a session report.
 */
public enum ModalityStatus {
    OK,
    DEGRADED
}
