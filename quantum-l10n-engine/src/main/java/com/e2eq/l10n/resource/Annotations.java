package com.e2eq.l10n.resource;

import com.e2eq.l10n.util.CommentCodec;
import org.apache.commons.lang3.StringUtils;

/**
 * The two comment annotations kept in front of an entry: the history note and the source-text
 * snapshot. Comments are told apart by their prefix only.
 */
public final class Annotations {

    public static final String HISTORY_PREFIX = "HISTORY:";
    public static final String SNAPSHOT_PREFIX = "EN:";

    public enum Kind {
        HISTORY(HISTORY_PREFIX),
        SNAPSHOT(SNAPSHOT_PREFIX),
        OTHER(null);

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    private Annotations() {
    }

    /**
     * Any whitespace, line breaks included, may come before the prefix.
     */
    public static Kind classify(String commentData) {
        String body = StringUtils.stripStart(StringUtils.defaultString(commentData), null);
        if (body.startsWith(HISTORY_PREFIX)) {
            return Kind.HISTORY;
        }
        if (body.startsWith(SNAPSHOT_PREFIX)) {
            return Kind.SNAPSHOT;
        }
        return Kind.OTHER;
    }

    /**
     * Extracts the decoded text of an annotation comment.
     *
     * @throws IllegalArgumentException when the comment is not an annotation
     */
    public static String textOf(String commentData) {
        Kind kind = classify(commentData);
        if (kind == Kind.OTHER) {
            throw new IllegalArgumentException("Not an annotation comment: " + commentData);
        }
        String body = StringUtils.stripStart(commentData, null).substring(kind.prefix().length());
        return CommentCodec.decode(stripTrailing(stripOne(body)));
    }

    /**
     * @return comment data in the canonical form {@code " PREFIX text "}
     */
    public static String render(Kind kind, String text) {
        if (kind == Kind.OTHER) {
            throw new IllegalArgumentException("Only annotations can be rendered");
        }
        return " " + kind.prefix() + " " + CommentCodec.encode(text) + " ";
    }

    private static String stripOne(String s) {
        return s.startsWith(" ") ? s.substring(1) : s;
    }

    /**
     * Drops the single space of the canonical form, or the whole trailing run when the comment
     * closes on a line of its own.
     */
    private static String stripTrailing(String s) {
        String stripped = StringUtils.stripEnd(s, null);
        if (s.substring(stripped.length()).indexOf('\n') >= 0) {
            return stripped;
        }
        return s.endsWith(" ") ? s.substring(0, s.length() - 1) : s;
    }
}
