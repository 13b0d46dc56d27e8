package im.arun.hierconfig.cli;

import static im.arun.hierconfig.TestFixtures.fixture;
import static org.junit.jupiter.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

public class HierConfigCLITest {

    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cmd = new CommandLine(new HierConfigCLI());
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
    }

    @Test
    void printsJsonRecords() {
        int exitCode = cmd.execute("--config", fixture("running_config.conf").toString(),
            "--tags", fixture("tags_ios.yaml").toString());

        assertEquals(0, exitCode, err.toString());
        String json = out.toString();
        assertTrue(json.contains("\"text\" : \"hostname edge1\""), json);
        assertTrue(json.contains("\"new_in_config\" : false"), json);
        assertTrue(json.contains("\"security\""), json);
    }

    @Test
    void printsFilteredCliText() {
        int exitCode = cmd.execute("--config", fixture("running_config.conf").toString(),
            "--lineage-rules", fixture("lineage_rules.yaml").toString(),
            "--format", "text");

        assertEquals(0, exitCode, err.toString());
        String text = out.toString();
        assertTrue(text.startsWith("router bgp 65000\n address-family ipv4\n  neighbor 10.0.0.2 activate\n"), text);
        assertTrue(text.contains("  exit-address-family\n"), text);
        assertFalse(text.contains("hostname"), text);
    }

    @Test
    void writesOutputAndLogFiles(@TempDir Path dir) throws Exception {
        Path output = dir.resolve("dump.json");
        Path log = dir.resolve("log.json");

        int exitCode = cmd.execute("--config", fixture("running_config.conf").toString(),
            "--hostname", "edge1", "--acl-transforms",
            "--output", output.toString(), "--log-file", log.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("Output written to"));
        assertTrue(Files.readString(output).contains("10 permit tcp any any eq 80"));
        assertTrue(Files.readString(log).contains("Parsed configuration text"));
    }

    @Test
    void mergesDeltaFile() {
        int exitCode = cmd.execute("--config", fixture("running_config.conf").toString(),
            "--merge", fixture("merge_delta.conf").toString(), "--format", "text");

        assertEquals(0, exitCode, err.toString());
        String text = out.toString();
        assertTrue(text.contains("interface GigabitEthernet0/2\n shutdown\n description spare\n"), text);
        assertTrue(text.contains("hostname edge1-new\n"), text);
        assertFalse(text.contains("line vty"), text);
    }

    @Test
    void missingMergeFileFails() {
        int exitCode = cmd.execute("--config", fixture("running_config.conf").toString(),
            "--merge", "/no/such/delta.conf");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("merge file not found"), err.toString());
    }

    @Test
    void missingConfigFails() {
        int exitCode = cmd.execute("--config", "/no/such/file.conf");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("not found"), err.toString());
    }

    @Test
    void badOptionsFileFails() {
        int exitCode = cmd.execute("--config", fixture("running_config.conf").toString(),
            "--options", fixture("options_bad_regex.yaml").toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("Error processing configuration"), err.toString());
    }
}
