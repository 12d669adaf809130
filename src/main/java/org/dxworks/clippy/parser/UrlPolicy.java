package org.dxworks.clippy.parser;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Link target check shared by the parser and the renderers. Accepts http(s), relative
 * paths, anchors, mailto and tel targets no longer than the given bound.
 */
public final class UrlPolicy {

    // Scheme and a non-empty authority; the rest of the target is taken as written
    private static final Pattern WEB_TARGET = Pattern.compile("^https?://[^/?#\\s]+.*", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private UrlPolicy() {
    }

    public static boolean isSafe(String url, int maxLength) {
        if (url == null || url.isBlank() || url.length() > maxLength) {
            return false;
        }
        return hasAllowedTarget(url.trim());
    }

    public static boolean hasAllowedTarget(String url) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        if (url.startsWith("/") || url.startsWith("./") || url.startsWith("../") || url.startsWith("#")) {
            return true;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("mailto:") || lower.startsWith("tel:")) {
            return true;
        }
        return WEB_TARGET.matcher(url).matches();
    }
}
