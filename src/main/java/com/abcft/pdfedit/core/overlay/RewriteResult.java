package com.abcft.pdfedit.core.overlay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of applying an overlay.
 */
public class RewriteResult {

    private RewriteStatus status;
    private String message;
    private final TextOverlayInfo overlay;
    private final List<String> warnings = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    public RewriteResult(RewriteStatus status, String message, TextOverlayInfo overlay) {
        this.status = status;
        this.message = message;
        this.overlay = overlay;
    }

    public static RewriteResult failed(String message, TextOverlayInfo overlay) {
        RewriteResult result = new RewriteResult(RewriteStatus.FAILED, message, overlay);
        result.errors.add(message);
        return result;
    }

    public RewriteStatus getStatus() {
        return status;
    }

    void setStatus(RewriteStatus status) {
        this.status = status;
    }

    public String getMessage() {
        return message;
    }

    void setMessage(String message) {
        this.message = message;
    }

    public TextOverlayInfo getOverlay() {
        return overlay;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean isSuccess() {
        return !status.isFailure();
    }

    public void addWarning(String warning) {
        warnings.add(warning);
        if (status == RewriteStatus.SUCCESS) {
            status = RewriteStatus.PARTIAL_SUCCESS;
        }
    }

    public void addError(String error) {
        errors.add(error);
        status = RewriteStatus.FAILED;
    }

    @Override
    public String toString() {
        return status + ": " + message;
    }
}
