package com.e2eq.l10n.exceptions;

/**
 * Fatal configuration problem detected before any file is written: ambiguous or duplicate keys,
 * an invalid strategy selection, or a policy that would overwrite an existing tree.
 */
public final class MergeConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public MergeConfigurationException(String message) {
        super(message);
    }

    public MergeConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
