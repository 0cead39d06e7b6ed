package org.dxworks.docframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

public class DocframeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(DocframeConfig.class);

    public static final int DEFAULT_DETECTION_PREFIX_BYTES = 8192;
    public static final int MIN_DETECTION_PREFIX_BYTES = 64;
    private static final String CONFIG_FILE_NAME = "docframe-config.yml";

    private final int detectionPrefixBytes;
    private final Set<String> disabledFormats;
    private final Set<String> disabledTransforms;

    private DocframeConfig(int detectionPrefixBytes, Collection<String> disabledFormats, Collection<String> disabledTransforms) {
        this.detectionPrefixBytes = detectionPrefixBytes;
        this.disabledFormats = Set.copyOf(disabledFormats);
        this.disabledTransforms = Set.copyOf(disabledTransforms);
    }

    public int getDetectionPrefixBytes() {
        return detectionPrefixBytes;
    }

    public Set<String> getDisabledFormats() {
        return disabledFormats;
    }

    public Set<String> getDisabledTransforms() {
        return disabledTransforms;
    }

    public boolean isFormatEnabled(String formatName) {
        return !disabledFormats.contains(formatName);
    }

    public boolean isTransformEnabled(String transformName) {
        return !disabledTransforms.contains(transformName);
    }

    public static DocframeConfig defaults() {
        return new DocframeConfig(DEFAULT_DETECTION_PREFIX_BYTES, Set.of(), Set.of());
    }

    /**
     * Loads {@code docframe-config.yml} from the working directory, or the defaults when it is absent.
     */
    public static DocframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static DocframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int prefixBytes = yamlConfig.detectionPrefixBytes != null
                        ? yamlConfig.detectionPrefixBytes
                        : DEFAULT_DETECTION_PREFIX_BYTES;
                return with(prefixBytes,
                        yamlConfig.disabledFormats != null ? yamlConfig.disabledFormats : Set.of(),
                        yamlConfig.disabledTransforms != null ? yamlConfig.disabledTransforms : Set.of());
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    /**
     * Builds a configuration explicitly. Prefix sizes below {@value #MIN_DETECTION_PREFIX_BYTES} are raised to it.
     */
    public static DocframeConfig with(int detectionPrefixBytes, Collection<String> disabledFormats,
                                      Collection<String> disabledTransforms) {
        int effectivePrefixBytes = Math.max(detectionPrefixBytes, MIN_DETECTION_PREFIX_BYTES);
        return new DocframeConfig(effectivePrefixBytes, disabledFormats, disabledTransforms);
    }

    public static DocframeConfig with(int detectionPrefixBytes) {
        return with(detectionPrefixBytes, Set.of(), Set.of());
    }

    private static class YamlConfig {
        public Integer detectionPrefixBytes;
        public LinkedHashSet<String> disabledFormats;
        public LinkedHashSet<String> disabledTransforms;
    }
}
