package im.arun.hierconfig.service;

import im.arun.hierconfig.config.HConfigOptions;
import im.arun.hierconfig.config.OptionsLoader;
import im.arun.hierconfig.config.ProcessingConfig;
import im.arun.hierconfig.model.ConfigRecord;
import im.arun.hierconfig.model.Host;
import im.arun.hierconfig.rules.LineageRule;
import im.arun.hierconfig.rules.TagRule;
import im.arun.hierconfig.tree.ConfigTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs the file-driven pipeline: load options and rules, parse, merge an optional delta,
 * transform, dump.
 */
public class HierConfigService {
    private static final Logger logger = LoggerFactory.getLogger(HierConfigService.class);

    private final OptionsLoader optionsLoader;

    public HierConfigService() {
        this(new OptionsLoader());
    }

    public HierConfigService(OptionsLoader optionsLoader) {
        this.optionsLoader = optionsLoader;
    }

    public ConfigTree processConfig(Path configPath, ProcessingConfig config) throws IOException {
        HConfigOptions options = optionsLoader.loadOptions(config.getOptionsPath(), config.getOs());
        Host host = new Host(config.getHostname(), config.getOs(), options);

        ConfigTree tree = new ConfigTree(host);
        tree.getLog().info("Starting configuration processing", Map.of("config", configPath.toString()));
        tree.loadFromFile(configPath);

        if (config.getMergeConfigPath() != null) {
            ConfigTree delta = new ConfigTree(host).loadFromFile(config.getMergeConfigPath());
            int deleted = tree.mergeWithNegation(delta);
            logger.info("Merged {} into {}: {} lines deleted", config.getMergeConfigPath(), configPath, deleted);
        }

        if (config.isApplyAclTransforms()) {
            tree.applyAclTransforms();
        }
        if (config.getTagRulesPath() != null) {
            List<TagRule> tagRules = optionsLoader.loadTagRules(config.getTagRulesPath());
            tree.addTags(tagRules, config.isStripNegation());
        }
        if (config.isSetOrderWeight()) {
            tree.setOrderWeight();
        }
        if (config.isAddSectionalExiting()) {
            tree.addSectionalExiting();
        }

        logger.info("Processed {}: {} lines, {} top-level sections",
            configPath, tree.allChildren().size(), tree.getChildren().size());
        return tree;
    }

    /**
     * Flatten a processed tree, filtered by the lineage rules file when one is configured.
     */
    public List<ConfigRecord> dump(ConfigTree tree, ProcessingConfig config) {
        List<LineageRule> lineageRules = null;
        if (config.getLineageRulesPath() != null) {
            lineageRules = optionsLoader.loadLineageRules(config.getLineageRulesPath());
        }
        List<ConfigRecord> records = tree.dump(lineageRules);
        tree.getLog().info("Dumped configuration", Map.of("records", records.size()));
        return records;
    }
}
