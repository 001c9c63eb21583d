package io.github.manjago.switchboard.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SwitchboardCliTest {
    
    @TempDir
    Path tempDir;
    
    private Path registryFile;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cli;
    
    @BeforeEach
    void setUp() throws Exception {
        registryFile = Path.of(SwitchboardCliTest.class.getResource("/tool-registry.conf").toURI());
        cli = new CommandLine(new SwitchboardCli());
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
    }
    
    private int execute(String... args) {
        return cli.execute(args);
    }
    
    @Test
    @DisplayName("trace shows the manipulated stream and binding")
    void traceReady() {
        int status = execute("trace", "-r", registryFile.toString(), "--", "build", "-rj", "4", "app");
        
        assertEquals(0, status);
        String text = out.toString();
        assertTrue(text.contains("Manipulated:   [build, -r, -j, 4, app]"));
        assertTrue(text.contains("Routed:        switchboard build"));
        assertTrue(text.contains("Outcome:       ready"));
        assertTrue(text.contains("Exit status:   0"));
    }
    
    @Test
    @DisplayName("trace reports routing failures with status 1")
    void traceRouteFailure() {
        int status = execute("trace", "-r", registryFile.toString(), "--", "test", "bogus");
        
        assertEquals(1, status);
        assertTrue(out.toString().contains("Partial path:  [test]"));
        assertTrue(out.toString().contains("Unmatched:     bogus"));
    }
    
    @Test
    @DisplayName("trace reports option errors by kind")
    void traceOptionError() {
        int status = execute("trace", "-r", registryFile.toString(), "--", "build", "app", "--json", "--yaml");
        
        assertEquals(1, status);
        assertTrue(out.toString().contains("option error GROUP_MISUSE"));
    }
    
    @Test
    @DisplayName("tree prints groups, signatures and aliases")
    void tree() {
        int status = execute("tree", "-r", registryFile.toString());
        
        assertEquals(0, status);
        String text = out.toString();
        assertTrue(text.contains("switchboard  [--quiet --help]"));
        assertTrue(text.contains("  build <target> [<mode>]  [--release --jobs --json --yaml]"));
        assertTrue(text.contains("  test/  [--verbose]"));
        assertTrue(text.contains("    unit [<filters>] ..."));
        assertTrue(text.contains("  -h -> help"));
    }
    
    @Test
    @DisplayName("Settings file changes the program name and splitting")
    void settingsFile() throws Exception {
        Path settings = tempDir.resolve("settings.conf");
        Files.writeString(settings, "switchboard { name = tool, stream.split-short-flags = false }");
        
        int status = execute("trace", "-r", registryFile.toString(), "-f", settings.toString(),
                "--", "build", "-rj", "4", "app");
        
        assertEquals(1, status);
        assertTrue(out.toString().contains("Routed:        tool build"));
        assertTrue(out.toString().contains("Unrecognized option: -rj"));
    }
    
    @Test
    @DisplayName("Invalid registry exits with status 2")
    void invalidRegistry() throws Exception {
        Path bad = Path.of(SwitchboardCliTest.class.getResource("/duplicate-registry.conf").toURI());
        
        assertEquals(2, execute("tree", "-r", bad.toString()));
        assertTrue(err.toString().contains("Invalid registry:"));
        assertEquals(2, execute("trace", "-r", tempDir.resolve("missing.conf").toString()));
    }
    
    @Test
    @DisplayName("run echoes the bound options and parameters")
    void runEchoes() {
        int status = execute("run", "-r", registryFile.toString(), "--", "build", "-j", "4", "app");
        
        assertEquals(0, status);
        String text = out.toString();
        assertTrue(text.contains("Running: switchboard build"));
        assertTrue(text.contains("  option    --jobs           4"));
        assertTrue(text.contains("  parameter target           app"));
        assertTrue(text.contains("  parameter mode             debug"));
    }
    
    @Test
    @DisplayName("run echoes variadic parameters")
    void runVariadic() {
        assertEquals(0, execute("run", "-r", registryFile.toString(), "--", "test", "unit", "fast", "slow"));
        assertTrue(out.toString().contains("Running: switchboard test unit"));
        assertTrue(out.toString().contains("  parameter filters          [fast, slow]"));
    }
    
    @Test
    @DisplayName("run reports failures on the error writer")
    void runFailures() {
        assertEquals(1, execute("run", "-r", registryFile.toString(), "--", "nope"));
        assertTrue(err.toString().contains("Command \"nope\" not found"));
        assertTrue(out.toString().contains("Usage: switchboard <command> [options]"));
        
        assertEquals(1, execute("run", "-r", registryFile.toString(), "--", "build"));
        assertTrue(err.toString().contains("Expected at least 1 argument, got 0"));
    }
    
    @Test
    @DisplayName("Malformed settings file exits with status 2")
    void malformedSettings() throws Exception {
        Path settings = tempDir.resolve("broken.conf");
        Files.writeString(settings, "switchboard { name = ");
        
        assertEquals(2, execute("tree", "-r", registryFile.toString(), "-f", settings.toString()));
        assertTrue(err.toString().contains("Invalid registry: Malformed settings file"));
    }
    
    @Test
    @DisplayName("Missing required registry option is a usage error")
    void missingRegistry() {
        assertEquals(CommandLine.ExitCode.USAGE, execute("tree"));
    }
}
