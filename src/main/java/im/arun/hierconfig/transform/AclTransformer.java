package im.arun.hierconfig.transform;

import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.rules.MatchKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Access-list rewrites for Cisco style configurations. Nothing here runs during parsing;
 * callers opt in per pass or through {@link #applyAll(ConfigNode)}.
 */
public class AclTransformer {
    private static final Logger logger = LoggerFactory.getLogger(AclTransformer.class);

    private static final String IPV4_ACL = "ip access-list";
    private static final String IPV6_ACL = "ipv6 access-list ";
    private static final String REMARK = "remark";
    private static final String SEQUENCE = "sequence";
    private static final int SEQUENCE_STEP = 10;

    private final String os;

    public AclTransformer(String os) {
        this.os = os;
    }

    /**
     * Remove remarks, number IPv4 entries, strip IPv6 sequence numbers.
     */
    public void applyAll(ConfigNode root) {
        removeAclRemarks(root);
        addAclSequenceNumbers(root);
        removeIpv6AclSequenceNumbers(root);
    }

    /**
     * Prefix the entries of each IPv4 access list with 10, 20, 30... On {@code ios}
     * only permit and deny lines are numbered; elsewhere remarks are numbered too.
     *
     * @return number of entries numbered
     */
    public int addAclSequenceNumbers(ConfigNode root) {
        List<String> aclLinePrefixes = "ios".equals(os)
            ? List.of("permit", "deny")
            : List.of("permit", "deny", REMARK);
        int numbered = 0;
        for (ConfigNode child : root.getChildren()) {
            if (!child.getText().startsWith(IPV4_ACL)) {
                continue;
            }
            int sn = SEQUENCE_STEP;
            for (ConfigNode entry : child.getChildren()) {
                if (startsWithAny(entry.getText(), aclLinePrefixes)) {
                    entry.setText(sn + " " + entry.getText());
                    sn += SEQUENCE_STEP;
                    numbered++;
                }
            }
        }
        log(root, "Added ACL sequence numbers", numbered);
        return numbered;
    }

    /**
     * Drop the leading {@code sequence <n>} of IPv6 access-list entries.
     */
    public int removeIpv6AclSequenceNumbers(ConfigNode root) {
        int stripped = 0;
        for (ConfigNode acl : root.getChildren(MatchKind.STARTSWITH, IPV6_ACL)) {
            for (ConfigNode entry : acl.getChildren()) {
                if (entry.getText().startsWith(SEQUENCE)) {
                    String[] words = entry.getText().split(" ");
                    List<String> rest = new ArrayList<>();
                    for (int i = 2; i < words.length; i++) {
                        rest.add(words[i]);
                    }
                    entry.setText(String.join(" ", rest));
                    stripped++;
                }
            }
        }
        log(root, "Removed IPv6 ACL sequence numbers", stripped);
        return stripped;
    }

    public int removeAclRemarks(ConfigNode root) {
        int removed = 0;
        for (ConfigNode acl : root.getChildren(MatchKind.STARTSWITH, IPV4_ACL + " ")) {
            for (ConfigNode entry : new ArrayList<>(acl.getChildren())) {
                if (entry.getText().startsWith(REMARK)) {
                    acl.removeChild(entry);
                    removed++;
                }
            }
        }
        log(root, "Removed ACL remarks", removed);
        return removed;
    }

    private static boolean startsWithAny(String text, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (text.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private void log(ConfigNode root, String message, int count) {
        root.getLog().info(message, Map.of("entries", count));
        logger.debug("{}: {}", message, count);
    }
}
