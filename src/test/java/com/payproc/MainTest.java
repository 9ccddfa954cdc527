package com.payproc;

import com.payproc.config.LedgerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the command line entry point
 */
class MainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

    @Test
    void testProcessSampleFile() throws IOException {
        Path input = copySample();

        int exitCode = Main.run(new String[]{input.toString()}, LedgerConfig.builder().build(), out, err);

        assertEquals(Main.EXIT_OK, exitCode);
        List<String> lines = outputLines();
        assertEquals("client,available,held,total,locked", lines.get(0));
        assertEquals(List.of("1,51.0,0.0,51.0,false", "2,0.0,0.0,0.0,true"),
                lines.subList(1, lines.size()).stream().sorted().toList());
    }

    @Test
    void testPartitionedRunProducesSameOutput() throws IOException {
        Path input = copySample();
        LedgerConfig config = LedgerConfig.builder().partitions(4).build();

        int exitCode = Main.run(new String[]{input.toString()}, config, out, err);

        assertEquals(Main.EXIT_OK, exitCode);
        List<String> lines = outputLines();
        assertEquals(List.of("1,51.0,0.0,51.0,false", "2,0.0,0.0,0.0,true"),
                lines.subList(1, lines.size()).stream().sorted().toList());
    }

    @Test
    void testSkippedRecordsDoNotChangeExitCode() throws IOException {
        Path input = tempDir.resolve("mixed.csv");
        Files.writeString(input, "type,client,tx,amount\n"
                + "deposit,1,1,10.0\n"
                + "bogus,1,2,1.0\n"
                + "withdrawal,1,3,99.0\n");

        int exitCode = Main.run(new String[]{input.toString()}, LedgerConfig.builder().build(), out, err);

        assertEquals(Main.EXIT_OK, exitCode);
        assertEquals(List.of("client,available,held,total,locked", "1,10.0,0.0,10.0,false"), outputLines());
    }

    @Test
    void testSilentFlagSuppressesOutput() throws IOException {
        Path input = copySample();

        int exitCode = Main.run(new String[]{input.toString(), "--silent"}, LedgerConfig.builder().build(), out, err);

        assertEquals(Main.EXIT_OK, exitCode);
        assertEquals(0, out.size());
    }

    @Test
    void testSilentConfigSuppressesOutput() throws IOException {
        Path input = copySample();

        int exitCode = Main.run(new String[]{input.toString()}, LedgerConfig.builder().silent(true).build(), out, err);

        assertEquals(Main.EXIT_OK, exitCode);
        assertEquals(0, out.size());
    }

    @Test
    void testEmptyFileWritesNothing() throws IOException {
        Path input = tempDir.resolve("empty.csv");
        Files.writeString(input, "type,client,tx,amount\n");

        int exitCode = Main.run(new String[]{input.toString()}, LedgerConfig.builder().build(), out, err);

        assertEquals(Main.EXIT_OK, exitCode);
        assertEquals(0, out.size());
    }

    @Test
    void testMissingFileFails() {
        Path input = tempDir.resolve("missing.csv");

        int exitCode = Main.run(new String[]{input.toString()}, LedgerConfig.builder().build(), out, err);

        assertEquals(Main.EXIT_FAILURE, exitCode);
        assertEquals(0, out.size());
    }

    @Test
    void testMissingArgumentIsUsageError() {
        int exitCode = Main.run(new String[]{}, LedgerConfig.builder().build(), out, err);

        assertEquals(Main.EXIT_USAGE, exitCode);
        assertTrue(errorOutput().contains("Missing input file path"));
        assertTrue(errorOutput().contains("Usage: payment-processor"));
    }

    @Test
    void testUnknownOptionIsUsageError() {
        int exitCode = Main.run(new String[]{"in.csv", "--verbose"}, LedgerConfig.builder().build(), out, err);

        assertEquals(Main.EXIT_USAGE, exitCode);
        assertTrue(errorOutput().contains("Unknown option: --verbose"));
    }

    @Test
    void testExtraArgumentIsUsageError() {
        int exitCode = Main.run(new String[]{"a.csv", "b.csv"}, LedgerConfig.builder().build(), out, err);

        assertEquals(Main.EXIT_USAGE, exitCode);
        assertTrue(errorOutput().contains("Unexpected argument: b.csv"));
    }

    @Test
    void testHelp() {
        int exitCode = Main.run(new String[]{"--help"}, LedgerConfig.builder().build(), out, err);

        assertEquals(Main.EXIT_OK, exitCode);
        assertTrue(errorOutput().contains("Usage: payment-processor"));
        assertEquals(0, out.size());
    }

    @Test
    void testArgumentsParse() {
        Main.Arguments arguments = Main.Arguments.parse(new String[]{"--silent", "input.csv"});

        assertEquals(Path.of("input.csv"), arguments.path());
        assertTrue(arguments.silent());
        assertFalse(arguments.help());
    }

    private Path copySample() throws IOException {
        Path input = tempDir.resolve("activities.csv");
        try (InputStream sample = getClass().getClassLoader().getResourceAsStream("activities.csv")) {
            assertNotNull(sample, "activities.csv must be on the test classpath");
            Files.copy(sample, input, StandardCopyOption.REPLACE_EXISTING);
        }
        return input;
    }

    private List<String> outputLines() {
        return out.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private String errorOutput() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }
}
