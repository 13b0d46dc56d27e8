package im.arun.hierconfig.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.hierconfig.rules.LineageRule;
import im.arun.hierconfig.rules.TagRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads options, tag rules and lineage rules from YAML.
 * <p>
 * Bundled defaults live on the classpath as {@code hierconfig/options_<os>.yaml}.
 */
public class OptionsLoader {
    private static final Logger logger = LoggerFactory.getLogger(OptionsLoader.class);
    private static final String DEFAULT_OPTIONS_RESOURCE = "hierconfig/options_%s.yaml";

    private final ObjectMapper yamlMapper;

    public OptionsLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Load options from a file, or the bundled defaults for {@code os} when the path is null.
     */
    public HConfigOptions loadOptions(Path optionsPath, String os) {
        if (optionsPath != null) {
            return loadOptions(optionsPath);
        }
        return loadDefaultOptions(os);
    }

    public HConfigOptions loadOptions(Path optionsPath) {
        if (!Files.exists(optionsPath)) {
            throw new OptionsException("Options file not found: " + optionsPath);
        }
        try (InputStream in = Files.newInputStream(optionsPath)) {
            return loadOptions(in, optionsPath.toString());
        } catch (IOException e) {
            throw new OptionsException("Failed to read options file " + optionsPath + ": " + e.getMessage(), e);
        }
    }

    public HConfigOptions loadDefaultOptions(String os) {
        String resource = String.format(DEFAULT_OPTIONS_RESOURCE, os == null ? "ios" : os.toLowerCase(Locale.ROOT));
        InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(resource);
        if (resourceStream == null) {
            throw new OptionsException("No bundled options for os '" + os + "' (" + resource + ")");
        }
        try (InputStream in = resourceStream) {
            return loadOptions(in, resource);
        } catch (IOException e) {
            throw new OptionsException("Failed to read bundled options " + resource + ": " + e.getMessage(), e);
        }
    }

    public HConfigOptions loadOptions(InputStream in, String source) {
        HConfigOptions options;
        try {
            options = yamlMapper.readValue(in, HConfigOptions.class);
        } catch (IOException e) {
            throw new OptionsException("Malformed options in " + source + ": " + e.getMessage(), e);
        }
        if (options == null) {
            throw new OptionsException("Options document is empty: " + source);
        }
        options.requireComplete();
        logger.debug("Loaded options from {}: {} ordering, {} sectional exiting, {} indent adjust rules",
            source, options.getOrdering().size(), options.getSectionalExiting().size(),
            options.getIndentAdjust().size());
        return options;
    }

    public List<TagRule> loadTagRules(Path path) {
        return readList(path, new TypeReference<List<TagRule>>() {});
    }

    public List<TagRule> loadTagRules(InputStream in, String source) {
        return readList(in, source, new TypeReference<List<TagRule>>() {});
    }

    public List<LineageRule> loadLineageRules(Path path) {
        return readList(path, new TypeReference<List<LineageRule>>() {});
    }

    private <T> List<T> readList(Path path, TypeReference<List<T>> type) {
        if (!Files.exists(path)) {
            throw new OptionsException("Rules file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return readList(in, path.toString(), type);
        } catch (IOException e) {
            throw new OptionsException("Failed to read rules file " + path + ": " + e.getMessage(), e);
        }
    }

    private <T> List<T> readList(InputStream in, String source, TypeReference<List<T>> type) {
        try {
            List<T> rules = yamlMapper.readValue(in, type);
            if (rules == null) {
                logger.warn("Rules document {} is empty", source);
                return new ArrayList<>();
            }
            logger.debug("Loaded {} rules from {}", rules.size(), source);
            return rules;
        } catch (IOException e) {
            throw new OptionsException("Malformed rules in " + source + ": " + e.getMessage(), e);
        }
    }
}
