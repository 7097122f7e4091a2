package com.e2eq.l10n.corpus;

/**
 * A source-language text and the translation that was reconciled against it.
 */
public record CorpusPair(String source, String translation) {
}
