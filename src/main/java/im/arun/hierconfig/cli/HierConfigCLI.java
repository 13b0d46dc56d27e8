package im.arun.hierconfig.cli;

import im.arun.hierconfig.config.OptionsException;
import im.arun.hierconfig.config.ProcessingConfig;
import im.arun.hierconfig.model.ConfigRecord;
import im.arun.hierconfig.service.HierConfigService;
import im.arun.hierconfig.tree.ConfigParseException;
import im.arun.hierconfig.tree.ConfigTree;
import im.arun.hierconfig.tree.DumpSerializer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface: parse a device configuration and print it as records or CLI text.
 */
@Command(
    name = "hierconfig",
    description = "Parse network device configuration into a hierarchy, tag and order it, and dump it",
    mixinStandardHelpOptions = true,
    version = "hierconfig 1.0"
)
public class HierConfigCLI implements Callable<Integer> {

    enum Format { json, text }

    @Option(names = {"--config"}, description = "Path to the device configuration text", required = true)
    private String configPath;

    @Option(names = {"--hostname"}, description = "Device hostname", defaultValue = "device")
    private String hostname;

    @Option(names = {"--os"}, description = "Operating system family (ios, nxos)", defaultValue = "ios")
    private String os;

    @Option(names = {"--options"}, description = "Options YAML (defaults to the bundled options for --os)")
    private String optionsPath;

    @Option(names = {"--merge"}, description = "Configuration delta merged onto --config; 'no <line>' deletes <line>")
    private String mergePath;

    @Option(names = {"--tags"}, description = "Tag rules YAML")
    private String tagRulesPath;

    @Option(names = {"--lineage-rules"}, description = "Lineage rules YAML restricting the dump")
    private String lineageRulesPath;

    @Option(names = {"--strip-negation"}, description = "Match tag rules against 'no' forms too")
    private boolean stripNegation;

    @Option(names = {"--acl-transforms"}, description = "Renumber and clean access lists")
    private boolean aclTransforms;

    @Option(names = {"--no-sectional-exiting"}, description = "Skip adding sectional exit lines")
    private boolean noSectionalExiting;

    @Option(names = {"--format"}, description = "Output format: ${COMPLETION-CANDIDATES}", defaultValue = "json")
    private Format format;

    @Option(names = {"--output"}, description = "Output file path")
    private String outputPath;

    @Option(names = {"--log-file"}, description = "Write the processing log as JSON to this file")
    private String logFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path configFilePath = Paths.get(configPath);
        if (!Files.exists(configFilePath)) {
            err.println("Error: configuration file not found: " + configPath);
            return 1;
        }

        if (mergePath != null && !Files.exists(Paths.get(mergePath))) {
            err.println("Error: merge file not found: " + mergePath);
            return 1;
        }

        ProcessingConfig config = new ProcessingConfig();
        config.setHostname(hostname);
        config.setOs(os);
        config.setOptionsPath(optionsPath == null ? null : Paths.get(optionsPath));
        config.setMergeConfigPath(mergePath == null ? null : Paths.get(mergePath));
        config.setTagRulesPath(tagRulesPath == null ? null : Paths.get(tagRulesPath));
        config.setLineageRulesPath(lineageRulesPath == null ? null : Paths.get(lineageRulesPath));
        config.setStripNegation(stripNegation);
        config.setApplyAclTransforms(aclTransforms);
        config.setAddSectionalExiting(!noSectionalExiting);

        HierConfigService service = new HierConfigService();
        ConfigTree tree;
        List<ConfigRecord> records;
        try {
            tree = service.processConfig(configFilePath, config);
            records = service.dump(tree, config);
        } catch (ConfigParseException | OptionsException e) {
            err.println("Error processing configuration: " + e.getMessage());
            return 1;
        }

        String output;
        if (format == Format.text) {
            ConfigTree filtered = new ConfigTree(tree.getHost()).loadFromDump(records);
            output = filtered.toCiscoStyleText();
        } else {
            output = new DumpSerializer().toJson(records);
        }

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), output);
            out.println("Output written to: " + outputPath);
        } else {
            out.println(output);
        }

        if (logFile != null) {
            tree.getLog().writeTo(Paths.get(logFile));
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new HierConfigCLI()).execute(args);
        System.exit(exitCode);
    }
}
