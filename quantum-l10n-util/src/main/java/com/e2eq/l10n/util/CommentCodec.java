package com.e2eq.l10n.util;

/**
 * Reversible encoding of arbitrary text into the body of an XML comment.
 * <p>
 * A comment may not contain {@code --} and may not end with {@code -}. The codec replaces
 * {@code &} with {@code &amp;} and every hyphen that would start such a sequence with
 * {@code &#45;}. Line breaks in the trailing whitespace of the text become {@code &#10;} and
 * {@code &#13;}, so an encoded body never ends on a raw line break. Decoding is a single left-to-right pass, so encoded text always decodes back to
 * the original; unknown {@code &} sequences in hand-written comments are kept literally.
 */
public final class CommentCodec {

    private static final String AMP = "&amp;";
    private static final String HYPHEN = "&#45;";
    private static final String LF = "&#10;";
    private static final String CR = "&#13;";

    private CommentCodec() {
    }

    public static String encode(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int trailing = text.length();
        while (trailing > 0 && Character.isWhitespace(text.charAt(trailing - 1))) {
            trailing--;
        }
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (i >= trailing && c == '\n') {
                sb.append(LF);
            } else if (i >= trailing && c == '\r') {
                sb.append(CR);
            } else if (c == '&') {
                sb.append(AMP);
            } else if (c == '-' && (i == text.length() - 1 || text.charAt(i + 1) == '-')) {
                sb.append(HYPHEN);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String decode(String body) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        if (body.indexOf('&') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            if (body.startsWith(AMP, i)) {
                sb.append('&');
                i += AMP.length();
            } else if (body.startsWith(HYPHEN, i)) {
                sb.append('-');
                i += HYPHEN.length();
            } else if (body.startsWith(LF, i)) {
                sb.append('\n');
                i += LF.length();
            } else if (body.startsWith(CR, i)) {
                sb.append('\r');
                i += CR.length();
            } else {
                sb.append(body.charAt(i));
                i++;
            }
        }
        return sb.toString();
    }
}
