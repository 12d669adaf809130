package org.dxworks.clippy;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.dxworks.clippy.capture.CaptureSanitizer;
import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.parser.BlockParseOptions;
import org.dxworks.clippy.parser.BlockParser;
import org.dxworks.clippy.parser.ParseOutcome;
import org.dxworks.clippy.parser.TextParser;
import org.dxworks.clippy.platform.PlatformCapabilities;
import org.dxworks.clippy.platform.PlatformCapabilityProvider;
import org.dxworks.clippy.platform.PlatformRegistry;
import org.dxworks.clippy.platform.PreferredFormat;
import org.dxworks.clippy.render.delta.QuillDelta;
import org.dxworks.clippy.render.delta.QuillDeltaRenderer;
import org.dxworks.clippy.render.delta.QuillRenderConfig;
import org.dxworks.clippy.render.html.HtmlRenderer;
import org.dxworks.clippy.render.markdown.MarkdownFlavor;
import org.dxworks.clippy.render.markdown.MarkdownRenderConfig;
import org.dxworks.clippy.render.markdown.MarkdownRenderer;
import org.dxworks.clippy.render.text.PlainTextRenderer;
import org.dxworks.clippy.validation.ContentSanitizer;
import org.dxworks.clippy.validation.ContentValidator;
import org.dxworks.clippy.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point tying capture and paste together: raw captured markup or text goes in
 * through {@link #processContent}, content comes out for a platform through
 * {@link #render}.
 */
public class ClippyProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ClippyProcessor.class);

    private final ClippyConfig config;
    private final PlatformCapabilityProvider platforms;
    private final CaptureSanitizer captureSanitizer = new CaptureSanitizer();
    private final BlockParser blockParser;
    private final TextParser textParser;
    private final ContentValidator validator;
    private final ContentSanitizer sanitizer;
    private final HtmlRenderer htmlRenderer = new HtmlRenderer();
    private final MarkdownRenderer markdownRenderer = new MarkdownRenderer();
    private final QuillDeltaRenderer deltaRenderer = new QuillDeltaRenderer();
    private final PlainTextRenderer plainTextRenderer = new PlainTextRenderer();

    public ClippyProcessor() {
        this(ClippyConfig.load(), new PlatformRegistry(), Clock.systemUTC());
    }

    public ClippyProcessor(ClippyConfig config, PlatformCapabilityProvider platforms, Clock clock) {
        this.config = config;
        this.platforms = platforms;
        this.blockParser = new BlockParser(clock);
        this.textParser = new TextParser(clock);
        this.validator = new ContentValidator(config.getLimits());
        this.sanitizer = new ContentSanitizer(config.getLimits(), clock);
    }

    /**
     * Parses captured input into content. Content that fails validation is repaired
     * with the sanitizer; the returned warnings include the validation findings.
     */
    public ParseOutcome processContent(String raw, InputFormat format, String sourceUrl, String sourceDomain) {
        InputFormat actual = format == null || format == InputFormat.AUTO ? InputFormat.detect(raw) : format;
        BlockParseOptions options = BlockParseOptions.DEFAULTS
                .withLimits(config.getLimits())
                .withEmptyBlockPolicy(config.getEmptyBlockPolicy())
                .withSource(sourceUrl, sourceDomain);

        ParseOutcome parsed = actual == InputFormat.HTML
                ? blockParser.parse(captureSanitizer.sanitize(raw, sourceUrl), options)
                : textParser.parse(raw, options);
        List<String> warnings = new ArrayList<>(parsed.warnings());

        ClippyContent content = parsed.content();
        ValidationResult validation = validator.validate(content);
        warnings.addAll(validation.warnings());
        if (!validation.valid()) {
            logger.warn("Captured content failed validation, sanitizing: {}", validation.errors());
            warnings.addAll(validation.errors());
            content = sanitizer.sanitize(content);
        }
        return new ParseOutcome(content, warnings);
    }

    public RenderResult render(ClippyContent content) {
        return render(content, RenderOptions.DEFAULTS);
    }

    public RenderResult render(ClippyContent content, RenderOptions options) {
        String requested = options.platformId() != null ? options.platformId() : config.getDefaultPlatform();
        List<String> warnings = new ArrayList<>();
        if (platforms.find(requested).isEmpty()) {
            warnings.add("Unknown platform '" + requested + "', rendering for " + platforms.fallback().id());
        }
        PlatformCapabilities capabilities = platforms.capabilitiesFor(requested);
        PreferredFormat format = options.format() != null ? options.format() : capabilities.preferredFormat();

        try {
            return switch (format) {
                case HTML -> new RenderResult(format, capabilities.id(), renderHtml(content, options), null, true, warnings);
                case MARKDOWN -> new RenderResult(format, capabilities.id(), renderMarkdown(content, capabilities, options), null, true, warnings);
                case DELTA -> {
                    QuillDelta delta = renderDelta(content, options);
                    yield new RenderResult(format, capabilities.id(), ContentCodec.mapper().writeValueAsString(delta), delta, true, warnings);
                }
                case PLAINTEXT -> new RenderResult(format, capabilities.id(), renderPlainText(content, options), null, true, warnings);
            };
        } catch (JsonProcessingException | RuntimeException e) {
            logger.error("Rendering {} for {} failed", format.getName(), capabilities.id(), e);
            warnings.add("Rendering " + format.getName() + " failed: " + e.getMessage());
            String fallback = options.fallbackToPlainText() ? renderPlainText(content, options) : "";
            return new RenderResult(PreferredFormat.PLAINTEXT, capabilities.id(), fallback, null, false, warnings);
        }
    }

    private String renderHtml(ClippyContent content, RenderOptions options) {
        String html = htmlRenderer.render(content);
        if (exceeds(html, options)) {
            return "<p>" + HtmlRenderer.escape(renderPlainText(content, options)) + "</p>";
        }
        return html;
    }

    private String renderMarkdown(ClippyContent content, PlatformCapabilities capabilities, RenderOptions options) {
        MarkdownRenderConfig markdownConfig = MarkdownFlavor.fromName(capabilities.id())
                .filter(flavor -> flavor != MarkdownFlavor.STANDARD)
                .map(MarkdownRenderConfig::forFlavor)
                .orElse(MarkdownRenderConfig.DEFAULTS)
                .withPreserveFormatting(options.preserveFormatting());
        String markdown = markdownRenderer.render(content, markdownConfig);
        return exceeds(markdown, options) ? renderPlainText(content, options) : markdown;
    }

    private QuillDelta renderDelta(ClippyContent content, RenderOptions options) {
        QuillDelta delta = deltaRenderer.render(content, QuillRenderConfig.DEFAULTS.withPreserveFormatting(options.preserveFormatting()));
        if (exceeds(delta.plainText(), options)) {
            return QuillDeltaRenderer.fromText(PlainTextRenderer.truncate(delta.plainText(), options.maxLength()));
        }
        return delta;
    }

    private String renderPlainText(ClippyContent content, RenderOptions options) {
        String text = plainTextRenderer.render(content);
        return options.maxLength() > 0 ? PlainTextRenderer.truncate(text, options.maxLength()) : text;
    }

    private static boolean exceeds(String rendered, RenderOptions options) {
        return options.maxLength() > 0 && rendered.length() > options.maxLength();
    }
}
