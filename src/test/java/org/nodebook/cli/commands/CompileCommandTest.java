package org.nodebook.cli.commands;

import org.nodebook.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the compile command, run through the same command line setup as the entry point.
 */
@Tag("integration")
public class CompileCommandTest {

    private static final String REX = """
            # Rex [Dog]
            <eats> Bone;
            has age: 3;
            """;

    @TempDir
    Path tempDir;

    private Path storeDir;
    private String schemaFile;
    private StringWriter out;
    private StringWriter err;
    private CommandLine cmdLine;

    @BeforeEach
    void setUp() throws Exception {
        storeDir = tempDir.resolve("graphs");
        schemaFile = Path.of(getClass().getResource("/schemas/zoo.conf").toURI()).toString();
        out = new StringWriter();
        err = new StringWriter();
        cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
    }

    @Test
    void testCommandIsRegistered() {
        assertThat(cmdLine.getSubcommands()).containsKeys("compile", "export");
    }

    @Test
    void testHelpListsOptions() {
        cmdLine.execute("help", "compile");

        assertThat(out.toString()).contains("--graph", "--lenient", "--dry-run", "--implicit-targets");
    }

    @Test
    void testCompileValidDocument() throws Exception {
        int exitCode = compile(write(REX), "kennel");

        assertThat(exitCode)
            .describedAs("stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(CompileCommand.EXIT_OK);
        assertThat(out.toString())
            .contains("\"success\": true")
            .contains("\"applied\": true")
            .contains("attr_rex_age_in_months@basic")
            .contains("\"value\": \"36\"");
        assertThat(storeDir.resolve("kennel.json")).exists();
    }

    @Test
    void testSecondCompilationIsEmpty() throws Exception {
        Path file = write(REX);
        compile(file, "kennel");
        StringWriter second = new StringWriter();
        cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(second));

        int exitCode = compile(file, "kennel");

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(second.toString()).contains("\"changes\": []").contains("\"applied\": false");
    }

    @Test
    void testStrictCompilationWithErrorsAppliesNothing() throws Exception {
        int exitCode = compile(write(REX + "<chases> Cat;\n"), "kennel");

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_COMPILE_ERRORS);
        assertThat(out.toString()).contains("UNKNOWN_RELATION_TYPE").contains("\"aborted\": true");
        assertThat(storeDir.resolve("kennel.json")).doesNotExist();
    }

    @Test
    void testLenientCompilationAppliesValidDeclarations() throws Exception {
        int exitCode = compile(write(REX + "<chases> Cat;\n"), "kennel", "--lenient");

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_COMPILE_ERRORS);
        assertThat(out.toString()).contains("\"applied\": true").contains("\"skipped\": [");
        assertThat(storeDir.resolve("kennel.json")).exists();
    }

    @Test
    void testDryRunDoesNotWrite() throws Exception {
        int exitCode = compile(write(REX), "kennel", "--dry-run");

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(out.toString()).contains("\"applied\": false").contains("CREATE");
        assertThat(storeDir.resolve("kennel.json")).doesNotExist();
    }

    @Test
    void testConfigFileSetsModeAndTargetPolicy() throws Exception {
        Path config = Path.of(getClass().getResource("/test-nodebook.conf").toURI());

        int exitCode = cmdLine.execute("-c", config.toString(), "compile", "-f", write(REX).toString(),
                "-g", "kennel", "--store", storeDir.toString(), "--schema", schemaFile);

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_COMPILE_ERRORS);
        assertThat(out.toString()).contains("UNKNOWN_TARGET_NODE").contains("\"applied\": true");
    }

    @Test
    void testCommandLineOverridesTargetPolicy() throws Exception {
        Path config = Path.of(getClass().getResource("/test-nodebook.conf").toURI());

        int exitCode = cmdLine.execute("-c", config.toString(), "compile", "-f", write(REX).toString(),
                "-g", "kennel", "--store", storeDir.toString(), "--schema", schemaFile,
                "--implicit-targets", "AUTO_CREATE");

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_OK);
    }

    @Test
    void testMissingSchemaFileIsInfrastructureError() throws Exception {
        int exitCode = cmdLine.execute("compile", "-f", write(REX).toString(), "-g", "kennel",
                "--store", storeDir.toString(), "--schema", tempDir.resolve("missing.conf").toString());

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_INFRASTRUCTURE);
        assertThat(err.toString()).contains("Schema file not found");
    }

    @Test
    void testInvalidGraphIdIsRejected() throws Exception {
        int exitCode = compile(write(REX), "../escape");

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_INFRASTRUCTURE);
        assertThat(err.toString()).contains("Invalid graph id");
    }

    @Test
    void testCompileNonexistentFileReturnsError() {
        int exitCode = compile(tempDir.resolve("missing.cnl"), "kennel");

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_INFRASTRUCTURE);
    }

    @Test
    void testMissingRequiredGraphOption() throws Exception {
        int exitCode = cmdLine.execute("compile", "-f", write(REX).toString());

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("--graph");
    }

    private int compile(Path file, String graphId, String... extra) {
        String[] base = {"compile", "-f", file.toString(), "-g", graphId, "--store", storeDir.toString(),
                "--schema", schemaFile};
        String[] args = new String[base.length + extra.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extra, 0, args, base.length, extra.length);
        return cmdLine.execute(args);
    }

    private Path write(String text) throws Exception {
        Path file = Files.createTempFile(tempDir, "doc", ".cnl");
        Files.writeString(file, text);
        return file;
    }
}
