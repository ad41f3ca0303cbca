package org.minilang.cli.commands;

import org.minilang.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class ExamplesCommandTest {

    @Test
    void testRunsBundledPrograms() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("examples");

        assertThat(exitCode).describedAs("stderr: %s", err.toString()).isEqualTo(0);
        String output = out.toString();
        assertThat(output)
            .contains("Testing (Correct): Var i,j:integer;Begin i:=0;j:=1;End\nAnalysis successful: No errors found.")
            .contains("Testing (Missing space after var): Vari:integer;\nErrors found:\n- program must start with 'var'")
            .contains("Testing (Missing :=): Var i:integer;Begin i=0;End\nErrors found:\n- invalid token in realization: =")
            .contains("- missing ';' after assignment")
            .contains("- 'else' not matched to 'if'")
            .contains("- missing 'end' to match 'while'")
            .contains("- if's end missing ';'")
            .endsWith("14 programs, 12 with errors\n");
    }
}
