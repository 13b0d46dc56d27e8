package im.arun.hierconfig.tree;

import im.arun.hierconfig.config.HConfigOptions;
import im.arun.hierconfig.config.IndentAdjust;
import im.arun.hierconfig.config.Substitution;
import im.arun.hierconfig.model.ConfigNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds a configuration tree from device CLI text.
 * <p>
 * Nesting is read from leading whitespace relative to the previous line, so irregular
 * indent widths are tolerated. {@code indent_adjust} options add virtual levels for blocks
 * whose children are not indented. Banner blocks are collapsed into one top-level node.
 */
public class TextParser {
    private static final Logger logger = LoggerFactory.getLogger(TextParser.class);
    private static final String BANNER_PREFIX = "banner ";
    private static final String SEPARATOR_LINE = "!";
    private static final int ROOT_INDENT = -1;

    private final HConfigOptions options;

    public TextParser(HConfigOptions options) {
        this.options = options.requireComplete();
    }

    /**
     * Parse {@code configText} into children of {@code root}.
     *
     * @return number of lines placed in the tree
     * @throws ConfigParseException if the text ends inside a banner
     */
    public int parse(ConfigNode root, String configText) {
        for (Substitution sub : options.getFullTextSub()) {
            configText = sub.apply(configText);
        }

        // Raw indent of each node, valid only while this parse runs
        Map<ConfigNode, Integer> indentLevels = new IdentityHashMap<>();
        indentLevels.put(root, ROOT_INDENT);

        ConfigNode currentSection = root;
        ConfigNode mostRecentItem = root;
        int indentAdjust = 0;
        Deque<Pattern> endIndentAdjust = new ArrayDeque<>();
        BannerTerminators terminators = new BannerTerminators();
        List<String> tempBanner = new ArrayList<>();
        boolean inBanner = false;
        int lineCount = 0;
        int placed = 0;
        int banners = 0;

        Iterator<String> lines = configText.lines().iterator();
        while (lines.hasNext()) {
            String line = lines.next();
            lineCount++;

            if (inBanner) {
                if (!SEPARATOR_LINE.equals(line)) {
                    tempBanner.add(line);
                }
                if (terminators.endsBanner(line)) {
                    inBanner = false;
                    mostRecentItem = root.addChild(String.join("\n", tempBanner), true, false);
                    indentLevels.put(mostRecentItem, 0);
                    currentSection = root;
                    tempBanner.clear();
                    placed++;
                    banners++;
                }
                continue;
            }

            if (line.startsWith(BANNER_PREFIX)) {
                inBanner = true;
                tempBanner.add(line);
                terminators.addDelimiterFrom(line);
                continue;
            }

            line = normalizeWhitespace(line);
            for (Substitution sub : options.getPerLineSub()) {
                line = sub.apply(line);
            }
            line = line.stripTrailing();
            if (line.isEmpty()) {
                continue;
            }

            int leading = leadingWhitespace(line);
            int thisIndent = leading + indentAdjust;
            line = line.substring(leading);

            // Walk back up the tree
            while (thisIndent <= indentLevels.get(currentSection)) {
                currentSection = currentSection.getParent();
            }

            // Walk down the tree by one step
            if (thisIndent > indentLevels.get(mostRecentItem)) {
                currentSection = mostRecentItem;
            }

            mostRecentItem = currentSection.addChild(line, true, false);
            indentLevels.put(mostRecentItem, thisIndent);
            placed++;

            for (IndentAdjust expression : options.getIndentAdjust()) {
                if (expression.startsBlock(line)) {
                    indentAdjust++;
                    endIndentAdjust.addLast(expression.getEndPattern());
                    break;
                }
            }
            if (!endIndentAdjust.isEmpty() && endIndentAdjust.peekFirst().matcher(line).find()) {
                indentAdjust--;
                endIndentAdjust.removeFirst();
            }
        }

        if (inBanner) {
            String start = tempBanner.isEmpty() ? "" : tempBanner.get(0);
            throw new ConfigParseException(
                "Configuration ended inside an unterminated banner starting with '" + start + "'");
        }

        root.getLog().info("Parsed configuration text", Map.of(
            "lines", lineCount,
            "placed", placed,
            "banners", banners
        ));
        logger.debug("Parsed {} lines into {} nodes ({} banners)", lineCount, placed, banners);
        return placed;
    }

    /**
     * Collapse internal whitespace runs to one space, keeping the count of leading
     * whitespace characters as spaces.
     */
    static String normalizeWhitespace(String line) {
        int leading = leadingWhitespace(line);
        String body = line.strip();
        if (body.isEmpty()) {
            return "";
        }
        return " ".repeat(leading) + String.join(" ", body.split("\\s+"));
    }

    static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Terminator heuristics collected from the banners of one parse.
     */
    static final class BannerTerminators {
        private final Set<String> endLines = new LinkedHashSet<>(List.of("EOF", "%", "!"));
        private final Set<String> endContains = new LinkedHashSet<>();

        void addDelimiterFrom(String bannerLine) {
            String[] words = bannerLine.strip().split("\\s+");
            if (words.length < 3) {
                return;
            }
            String delimiter = words[2];
            endContains.add(delimiter);
            endLines.add(delimiter.substring(0, 1));
            endLines.add(delimiter.substring(0, Math.min(2, delimiter.length())));
        }

        boolean endsBanner(String line) {
            if (line.startsWith("^")) {
                return true;
            }
            if (endLines.contains(line)) {
                return true;
            }
            for (String token : endContains) {
                if (line.contains(token)) {
                    return true;
                }
            }
            return false;
        }
    }
}
