package org.dxworks.clippy.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.clippy.ContentCodec;
import org.dxworks.clippy.model.BlockKind;
import org.dxworks.clippy.model.ClippyContent;
import org.dxworks.clippy.model.ContentLimits;
import org.dxworks.clippy.parser.UrlPolicy;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks content against the wire shape and the content limits. Validation runs on the
 * JSON tree so that payloads from storage or other processes, which may carry wrong
 * types, are judged the same way as parsed content.
 */
public class ContentValidator {

    private static final Set<String> FORMATTING_KEYS = Set.of("bold", "italic", "underline", "strikethrough", "code");

    private final ContentLimits limits;

    public ContentValidator() {
        this(ContentLimits.DEFAULTS);
    }

    public ContentValidator(ContentLimits limits) {
        this.limits = limits;
    }

    public ValidationResult validate(ClippyContent content) {
        if (content == null) {
            return ValidationResult.invalid("Content is missing");
        }
        return validate(ContentCodec.toTree(content));
    }

    public ValidationResult validate(String json) {
        if (json == null || json.isBlank()) {
            return ValidationResult.invalid("Content is missing");
        }
        try {
            return validate(ContentCodec.readTree(json));
        } catch (JsonProcessingException e) {
            return ValidationResult.invalid("Malformed JSON: " + e.getOriginalMessage());
        }
    }

    public ValidationResult validate(JsonNode root) {
        Walk walk = new Walk();
        if (root == null || !root.isObject()) {
            walk.error("Content must be a JSON object");
            return walk.result();
        }

        JsonNode version = root.get("version");
        if (version == null || !version.isTextual() || !ClippyContent.CURRENT_VERSION.equals(version.asText())) {
            walk.error("Unsupported version " + describe(version) + ", expected \"" + ClippyContent.CURRENT_VERSION + "\"");
        }

        JsonNode blocks = root.get("blocks");
        if (blocks == null || !blocks.isArray()) {
            walk.error("blocks must be an array");
        } else {
            if (blocks.size() > limits.maxBlocks()) {
                walk.warn("Content has " + blocks.size() + " blocks, more than the limit of " + limits.maxBlocks());
            }
            for (int i = 0; i < blocks.size(); i++) {
                validateBlock(blocks.get(i), "blocks[" + i + "]", walk);
            }
        }

        validateMetadata(root.get("metadata"), walk);
        return walk.result();
    }

    private void validateBlock(JsonNode block, String path, Walk walk) {
        if (block == null || !block.isObject()) {
            walk.error(path + " must be an object");
            return;
        }
        validateId(block, path, walk);

        JsonNode type = block.get("type");
        if (type == null || !type.isTextual()) {
            walk.error(path + " has no type");
            return;
        }
        Optional<BlockKind> kind = BlockKind.fromName(type.asText());
        if (kind.isEmpty()) {
            walk.error(path + " has unknown block type \"" + type.asText() + "\"");
            return;
        }

        switch (kind.get()) {
            case PARAGRAPH -> validateInlineArray(block.get("content"), path + ".content", walk);
            case HEADING -> {
                JsonNode level = block.get("level");
                if (level == null || !level.isIntegralNumber() || level.asInt() < 1 || level.asInt() > 6) {
                    walk.error(path + " heading level must be an integer from 1 to 6, got " + describe(level));
                }
                validateInlineArray(block.get("content"), path + ".content", walk);
            }
            case LIST -> validateList(block, path, 1, walk);
            case QUOTE -> {
                validateInlineArray(block.get("content"), path + ".content", walk);
                JsonNode citation = block.get("citation");
                if (isPresent(citation)) {
                    if (!citation.isTextual()) {
                        walk.error(path + ".citation must be a string");
                    } else if (citation.asText().length() > limits.maxCitationLength()) {
                        walk.warn(path + ".citation is longer than " + limits.maxCitationLength() + " chars");
                    }
                }
            }
            case CODE -> {
                JsonNode content = block.get("content");
                if (content == null || !content.isTextual()) {
                    walk.error(path + ".content must be a string");
                } else if (content.asText().length() > limits.maxTextLength()) {
                    walk.warn(path + ".content is longer than " + limits.maxTextLength() + " chars");
                }
                JsonNode language = block.get("language");
                if (isPresent(language) && !language.isTextual()) {
                    walk.warn(path + ".language is not a string and will be ignored");
                }
            }
            case DIVIDER -> {
            }
        }
    }

    private void validateList(JsonNode list, String path, int depth, Walk walk) {
        if (depth > limits.maxNestingLevel() && !walk.nestingReported) {
            walk.nestingReported = true;
            walk.warn(path + " nests lists " + depth + " levels deep, more than the limit of " + limits.maxNestingLevel());
        }

        JsonNode listType = list.get("listType");
        if (listType == null || !listType.isTextual()
                || !("bulleted".equals(listType.asText()) || "numbered".equals(listType.asText()))) {
            walk.error(path + ".listType must be \"bulleted\" or \"numbered\", got " + describe(listType));
        }

        JsonNode items = list.get("items");
        if (items == null || !items.isArray()) {
            walk.error(path + ".items must be an array");
            return;
        }
        if (items.size() > limits.maxListItems()) {
            walk.warn(path + " has " + items.size() + " items, more than the limit of " + limits.maxListItems());
        }
        for (int i = 0; i < items.size(); i++) {
            String itemPath = path + ".items[" + i + "]";
            JsonNode item = items.get(i);
            if (item == null || !item.isObject()) {
                walk.error(itemPath + " must be an object");
                continue;
            }
            validateId(item, itemPath, walk);
            validateInlineArray(item.get("content"), itemPath + ".content", walk);

            JsonNode nested = item.get("nested");
            if (isPresent(nested)) {
                if (!nested.isObject()) {
                    walk.error(itemPath + ".nested must be a list object");
                } else {
                    validateId(nested, itemPath + ".nested", walk);
                    validateList(nested, itemPath + ".nested", depth + 1, walk);
                }
            }
        }
    }

    private void validateInlineArray(JsonNode content, String path, Walk walk) {
        if (content == null || !content.isArray()) {
            walk.error(path + " must be an array");
            return;
        }
        for (int i = 0; i < content.size(); i++) {
            validateInline(content.get(i), path + "[" + i + "]", walk);
        }
    }

    private void validateInline(JsonNode inline, String path, Walk walk) {
        if (inline == null || !inline.isObject()) {
            walk.error(path + " must be an object");
            return;
        }
        JsonNode type = inline.get("type");
        String typeName = type != null && type.isTextual() ? type.asText() : "";
        switch (typeName) {
            case "text" -> {
                validateText(inline.get("text"), path, walk);
                validateFormatting(inline.get("formatting"), path, walk);
            }
            case "link" -> {
                JsonNode url = inline.get("url");
                if (url == null || !url.isTextual() || url.asText().isBlank()) {
                    walk.error(path + " link has no url");
                } else {
                    String target = url.asText();
                    if (target.length() > limits.maxUrlLength()) {
                        walk.warn(path + " url is longer than " + limits.maxUrlLength() + " chars");
                    } else if (!UrlPolicy.hasAllowedTarget(target.trim())) {
                        walk.warn(path + " url looks suspicious and will not be rendered as a link");
                    }
                }
                validateText(inline.get("text"), path, walk);
                validateFormatting(inline.get("formatting"), path, walk);
            }
            case "linebreak" -> {
            }
            default -> walk.error(path + " has unknown inline type " + describe(type));
        }
    }

    private void validateText(JsonNode text, String path, Walk walk) {
        if (text == null || !text.isTextual()) {
            walk.error(path + " has no text");
        } else if (text.asText().length() > limits.maxTextLength()) {
            walk.warn(path + " text is longer than " + limits.maxTextLength() + " chars");
        }
    }

    private static void validateFormatting(JsonNode formatting, String path, Walk walk) {
        if (!isPresent(formatting)) {
            return;
        }
        if (!formatting.isObject()) {
            walk.error(path + ".formatting must be an object");
            return;
        }
        Iterator<String> names = formatting.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!FORMATTING_KEYS.contains(name)) {
                walk.warn(path + ".formatting has unknown flag \"" + name + "\"");
            } else if (!formatting.get(name).isBoolean()) {
                walk.error(path + ".formatting." + name + " must be a boolean");
            }
        }
    }

    private void validateMetadata(JsonNode metadata, Walk walk) {
        if (!isPresent(metadata)) {
            return;
        }
        if (!metadata.isObject()) {
            walk.error("metadata must be an object");
            return;
        }
        JsonNode sourceUrl = metadata.get("sourceUrl");
        if (sourceUrl != null && sourceUrl.isTextual() && sourceUrl.asText().length() > limits.maxUrlLength()) {
            walk.warn("metadata.sourceUrl is longer than " + limits.maxUrlLength() + " chars");
        }
        JsonNode capturedAt = metadata.get("capturedAt");
        if (isPresent(capturedAt) && (!capturedAt.isTextual() || !isTimestamp(capturedAt.asText()))) {
            walk.warn("metadata.capturedAt is not an ISO-8601 timestamp: " + describe(capturedAt));
        }
    }

    private void validateId(JsonNode node, String path, Walk walk) {
        JsonNode id = node.get("id");
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            walk.error(path + " has no id");
            return;
        }
        if (!walk.ids.add(id.asText())) {
            walk.error(path + " reuses id \"" + id.asText() + "\"");
        }
    }

    private static boolean isTimestamp(String value) {
        try {
            Instant.parse(value);
            return true;
        } catch (DateTimeParseException e) {
            try {
                OffsetDateTime.parse(value);
                return true;
            } catch (DateTimeParseException offsetFailure) {
                return false;
            }
        }
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    private static String describe(JsonNode node) {
        return node == null ? "nothing" : node.toString();
    }

    private static final class Walk {
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final Set<String> ids = new HashSet<>();
        private boolean nestingReported;

        private void error(String message) {
            errors.add(message);
        }

        private void warn(String message) {
            warnings.add(message);
        }

        private ValidationResult result() {
            return ValidationResult.of(errors, warnings);
        }
    }
}
