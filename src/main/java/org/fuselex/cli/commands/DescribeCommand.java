package org.fuselex.cli.commands;

import org.fuselex.lexer.fuse.FuseLexer;
import org.fuselex.lexer.fuse.LexerDescriptor;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "describe", description = "Prints the name, file patterns and MIME types of the lexer.")
public class DescribeCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final LexerDescriptor descriptor = FuseLexer.DESCRIPTOR;
        final PrintWriter out = spec.commandLine().getOut();
        out.println("title:       " + descriptor.title());
        out.println("description: " + descriptor.description());
        out.println("tag:         " + descriptor.tag());
        out.println("filenames:   " + String.join(", ", descriptor.filenames()));
        out.println("mimetypes:   " + String.join(", ", descriptor.mimetypes()));
        out.flush();
        return 0;
    }
}
