package org.dxworks.clippy.platform;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of known platforms, read from the {@code platforms.yml} classpath resource.
 */
public class PlatformRegistry implements PlatformCapabilityProvider {

    private static final Logger logger = LoggerFactory.getLogger(PlatformRegistry.class);

    public static final String RESOURCE = "/platforms.yml";
    public static final String FALLBACK_PLATFORM_ID = "textarea";

    private final Map<String, PlatformCapabilities> platforms;
    private final PlatformCapabilities fallback;

    public PlatformRegistry() {
        this(loadDefaults());
    }

    public PlatformRegistry(List<PlatformCapabilities> platforms) {
        Map<String, PlatformCapabilities> byId = new LinkedHashMap<>();
        for (PlatformCapabilities platform : platforms) {
            if (byId.put(platform.id(), platform) != null) {
                logger.warn("Platform {} is defined more than once, keeping the last definition", platform.id());
            }
        }
        if (!byId.containsKey(FALLBACK_PLATFORM_ID)) {
            throw new IllegalArgumentException("Platform registry must define the '" + FALLBACK_PLATFORM_ID + "' platform");
        }
        this.platforms = Map.copyOf(byId);
        this.fallback = byId.get(FALLBACK_PLATFORM_ID);
    }

    public static PlatformRegistry fromYaml(InputStream yaml) throws IOException {
        return new PlatformRegistry(readYaml(yaml));
    }

    @Override
    public Optional<PlatformCapabilities> find(String platformId) {
        if (platformId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(platforms.get(platformId));
    }

    @Override
    public PlatformCapabilities fallback() {
        return fallback;
    }

    public Set<String> platformIds() {
        return platforms.keySet();
    }

    private static List<PlatformCapabilities> loadDefaults() {
        try (InputStream yaml = PlatformRegistry.class.getResourceAsStream(RESOURCE)) {
            if (yaml == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return readYaml(yaml);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    private static List<PlatformCapabilities> readYaml(InputStream yaml) throws IOException {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        YamlPlatforms parsed = yamlMapper.readValue(yaml, YamlPlatforms.class);
        if (parsed == null || parsed.platforms == null) {
            return List.of();
        }
        return parsed.platforms;
    }

    private static class YamlPlatforms {
        public List<PlatformCapabilities> platforms;
    }
}
