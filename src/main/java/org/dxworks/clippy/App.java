package org.dxworks.clippy;

import org.dxworks.clippy.parser.ParseOutcome;
import org.dxworks.clippy.platform.PreferredFormat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;

public class App {

    private static final String JSON_FORMAT = "json";

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: java -jar clippy-content.jar <input-file> <output-file> [format] [platformId]");
            System.err.println("  <input-file>:  captured HTML or plain text");
            System.err.println("  <output-file>: where the converted content is written");
            System.err.println("  [format]:      html, markdown, delta, text or json (default: json)");
            System.err.println("  [platformId]:  target platform, e.g. github, discord, slack, gmail, textarea");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input file does not exist: " + input);
            System.exit(1);
        }
        String format = args.length > 2 ? args[2].toLowerCase(Locale.ROOT) : JSON_FORMAT;
        String platformId = args.length > 3 ? args[3] : null;

        Optional<PreferredFormat> renderFormat = Optional.empty();
        if (!JSON_FORMAT.equals(format)) {
            renderFormat = PreferredFormat.fromName("text".equals(format) ? PreferredFormat.PLAINTEXT.getName() : format);
            if (renderFormat.isEmpty()) {
                System.err.println("Error: Unknown format: " + format);
                System.exit(2);
            }
        }

        try {
            String output = convert(Files.readString(input, StandardCharsets.UTF_8), renderFormat.orElse(null), platformId);
            Path outputPath = Paths.get(args[1]);
            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }
            Files.writeString(outputPath, output, StandardCharsets.UTF_8);
            System.out.println("Wrote " + format + " output to " + outputPath.toAbsolutePath());
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Converts captured input to the requested format, or to the content JSON when
     * {@code format} is null.
     */
    public static String convert(String raw, PreferredFormat format, String platformId) throws IOException {
        ClippyProcessor processor = new ClippyProcessor();
        ParseOutcome outcome = processor.processContent(raw, InputFormat.AUTO, null, null);
        outcome.warnings().forEach(warning -> System.err.println("Warning: " + warning));
        if (format == null) {
            return ContentCodec.toPrettyJson(outcome.content());
        }
        RenderResult result = processor.render(outcome.content(), new RenderOptions(platformId, format, true, 0, true));
        result.warnings().forEach(warning -> System.err.println("Warning: " + warning));
        return result.content();
    }
}
