package com.e2eq.l10n.model;

import java.util.Objects;

/**
 * A per-file problem recorded during a run. Recorded errors never abort the run; they are
 * reported back to the caller once all other files have been processed.
 *
 * @param kind   whether the file failed to load or failed to write
 * @param path   the file concerned
 * @param reason human readable cause
 */
public record ResourceError(ResourceErrorKind kind, String path, String reason) {

    public ResourceError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
        reason = reason == null ? "" : reason;
    }

    public static ResourceError parse(String path, String reason) {
        return new ResourceError(ResourceErrorKind.PARSE, path, reason);
    }

    public static ResourceError serialization(String path, String reason) {
        return new ResourceError(ResourceErrorKind.SERIALIZATION, path, reason);
    }
}
