package org.fuselex.cli.commands;

import org.fuselex.lexer.fuse.FuseLexer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "detect", description = "Checks whether a file is Fuse source, by name or by its shebang line.")
public class DetectCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the file.")
    private File file;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        if (FuseLexer.DESCRIPTOR.matchesFileName(file.getName()) || FuseLexer.detect(firstLine())) {
            spec.commandLine().getOut().println(FuseLexer.DESCRIPTOR.tag());
            spec.commandLine().getOut().flush();
            return 0;
        }
        return 1;
    }

    private String firstLine() throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            final String line = reader.readLine();
            return line != null ? line : "";
        }
    }
}
