package im.arun.hierconfig.config;

import lombok.Data;

import java.nio.file.Path;

/**
 * What {@link im.arun.hierconfig.service.HierConfigService} does to one configuration file.
 */
@Data
public class ProcessingConfig {
    private String hostname = "device";
    private String os = "ios";
    private Path optionsPath;
    private Path tagRulesPath;
    private Path lineageRulesPath;
    private Path mergeConfigPath;
    private boolean stripNegation = false;
    private boolean setOrderWeight = true;
    private boolean addSectionalExiting = true;
    private boolean applyAclTransforms = false;
}
