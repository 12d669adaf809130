package org.dxworks.clippy.capture;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.safety.Cleaner;
import org.jsoup.safety.Safelist;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * First stage of capture: reduces selected markup to the tags and attributes the block
 * parser understands. Scripts, event handlers, unsafe link targets and CSS other than
 * basic text styling are removed; relative links are kept as written.
 */
public class CaptureSanitizer {

    // Resolves relative links during the protocol check only; it never reaches the output
    private static final String PLACEHOLDER_BASE_URI = "https://capture.invalid/";

    private static final Set<String> ALLOWED_STYLE_PROPERTIES = Set.of(
            "font-weight", "font-style", "text-decoration", "text-decoration-line", "color", "background-color");
    private static final Pattern UNSAFE_STYLE_VALUE = Pattern.compile("javascript:|expression\\s*\\(|url\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final int MAX_STYLE_VALUE_LENGTH = 100;

    private static final Safelist SAFE_LIST = new Safelist()
            .addTags("p", "div", "br", "h1", "h2", "h3", "h4", "h5", "h6", "ul", "ol", "li",
                    "blockquote", "pre", "code", "kbd", "samp", "hr", "strong", "b", "em", "i", "u", "ins",
                    "s", "del", "strike", "a", "span")
            .addAttributes("a", "href", "title")
            .addAttributes("blockquote", "cite")
            .addAttributes("code", "class")
            .addAttributes("pre", "class")
            .addAttributes(":all", "style")
            .addProtocols("a", "href", "http", "https", "mailto", "tel", "#")
            .preserveRelativeLinks(true);

    public String sanitize(String html) {
        return sanitize(html, null);
    }

    /**
     * @param baseUri page the markup was captured from, used to judge relative links
     */
    public String sanitize(String html, String baseUri) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String base = baseUri == null || baseUri.isBlank() ? PLACEHOLDER_BASE_URI : baseUri;
        Document dirty = Jsoup.parseBodyFragment(html, base);
        Document clean = new Cleaner(SAFE_LIST).clean(dirty);
        clean.outputSettings().prettyPrint(false);

        for (Element styled : clean.body().select("[style]")) {
            String style = sanitizeStyle(styled.attr("style"));
            if (style.isEmpty()) {
                styled.removeAttr("style");
            } else {
                styled.attr("style", style);
            }
        }
        return clean.body().html();
    }

    static String sanitizeStyle(String style) {
        List<String> kept = new ArrayList<>();
        for (String declaration : style.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String property = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = declaration.substring(colon + 1).trim().replaceAll("[<>'\"]", "");
            if (!ALLOWED_STYLE_PROPERTIES.contains(property)
                    || value.isEmpty()
                    || value.length() >= MAX_STYLE_VALUE_LENGTH
                    || UNSAFE_STYLE_VALUE.matcher(value).find()) {
                continue;
            }
            kept.add(property + ": " + value);
        }
        return String.join("; ", kept);
    }
}
