package im.arun.hierconfig.model;

import im.arun.hierconfig.config.HConfigOptions;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The device a configuration belongs to: its name, its operating system family
 * (e.g. {@code ios}, {@code nxos}, {@code iosxr}) and the parsing options for that family.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Host {
    private String hostname;
    private String os;
    private HConfigOptions options;
}
