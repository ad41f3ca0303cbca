package org.minilang.cli.commands;

import java.util.ArrayList;
import java.util.List;

/**
 * A labeled sample program from the bundled {@code examples/programs.txt} resource.
 *
 * @param label  Short description of what the sample exercises.
 * @param source The program text.
 */
public record ExampleProgram(String label, String source) {

    static final String RESOURCE = "examples/programs.txt";

    /**
     * Parses the examples format: a line starting with {@code #} opens a new sample and
     * carries its label; the following lines up to the next label are the program text.
     * Blank lines between samples are ignored.
     *
     * @param content The resource content.
     * @return The samples in file order.
     */
    static List<ExampleProgram> parse(String content) {
        List<ExampleProgram> programs = new ArrayList<>();
        String label = null;
        StringBuilder body = new StringBuilder();
        for (String line : content.split("\n", -1)) {
            if (line.startsWith("#")) {
                if (label != null) {
                    programs.add(new ExampleProgram(label, body.toString().strip()));
                }
                label = line.substring(1).strip();
                body.setLength(0);
            } else if (label != null) {
                body.append(line).append('\n');
            }
        }
        if (label != null) {
            programs.add(new ExampleProgram(label, body.toString().strip()));
        }
        return programs;
    }
}
