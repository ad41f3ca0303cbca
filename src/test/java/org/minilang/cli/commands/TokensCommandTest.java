package org.minilang.cli.commands;

import org.minilang.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class TokensCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void testPrintsOneTokenPerLine() {
        int exitCode = execute("tokens", "Var i:=9i;");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString().lines()).containsExactly(
            "VAR 'Var'",
            "IDENTIFIER 'i'",
            "ASSIGN ':='",
            "ERROR '9i'",
            "SEMICOLON ';'");
    }

    @Test
    void testTokenizesFile() throws Exception {
        Path sourceFile = tempDir.resolve("prog.ml");
        Files.writeString(sourceFile, "begin\r\nend");

        int exitCode = execute("tokens", "-f", sourceFile.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString().lines()).containsExactly("BEGIN 'begin'", "END 'end'");
    }

    @Test
    void testMissingInputIsUsageError() {
        int exitCode = execute("tokens");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Either --file or SOURCE is required.");
    }

    @Test
    void testMissingFileGivesExitCodeTwo() {
        int exitCode = execute("tokens", "-f", tempDir.resolve("absent.ml").toString());

        assertThat(exitCode).isEqualTo(AnalyzeCommand.EXIT_IO_ERROR);
    }

    @Test
    void testMissingConfigFileGivesExitCodeTwo() {
        int exitCode = execute("-c", tempDir.resolve("absent.conf").toString(), "tokens", "begin");

        assertThat(exitCode).isEqualTo(AnalyzeCommand.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("Configuration file not found");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testConfigFileIsAccepted() throws Exception {
        Path config = tempDir.resolve("minilang.conf");
        Files.writeString(config, "logging.level = ERROR\n");

        int exitCode = execute("-c", config.toString(), "tokens", "end");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString().lines()).containsExactly("END 'end'");
    }
}
