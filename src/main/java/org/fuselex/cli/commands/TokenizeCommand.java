package org.fuselex.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.typesafe.config.Config;
import org.fuselex.cli.CommandLineInterface;
import org.fuselex.diagnostics.Diagnostic;
import org.fuselex.diagnostics.DiagnosticsEngine;
import org.fuselex.lexer.Token;
import org.fuselex.lexer.TokenStreams;
import org.fuselex.lexer.fuse.FuseLexer;
import org.fuselex.lexer.fuse.FuseLexerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "tokenize", description = "Tokenizes a Fuse source file and prints the tokens.")
public class TokenizeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenizeCommand.class);

    /** Exit code of {@code --strict} when unrecognized input was found. */
    public static final int EXIT_UNRECOGNIZED_INPUT = 2;

    enum Format { PLAIN, JSON }

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: from configuration).")
    private Format format;

    @Option(names = "--raw", description = "Print one token per rule match instead of merging adjacent tokens of the same category.")
    private boolean raw;

    @Option(names = "--no-builtins", description = "Do not classify built-in names.")
    private boolean noBuiltins;

    @Option(names = "--disable-module", description = "Treat this built-in name as a plain name. Repeatable.")
    private List<String> disabledModules;

    @Option(names = "--strict", description = "Exit with code " + EXIT_UNRECOGNIZED_INPUT + " if any input is unrecognized.")
    private boolean strict;

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getConfig();
        final FuseLexerOptions options = resolveOptions(config);
        final Format outputFormat = format != null ? format
                : Format.valueOf(config.getString("fuselex.output.format").toUpperCase(Locale.ROOT));
        final boolean coalesce = !raw && config.getBoolean("fuselex.output.coalesce");

        final String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        final DiagnosticsEngine diagnostics = new DiagnosticsEngine(file.getName());
        final FuseLexer lexer = new FuseLexer(options);
        Iterator<Token> tokens = lexer.tokenize(source, diagnostics);
        if (coalesce) {
            tokens = TokenStreams.coalesce(tokens);
        }

        final PrintWriter out = spec.commandLine().getOut();
        if (outputFormat == Format.JSON) {
            printJson(tokens, out);
        } else {
            printPlain(tokens, out);
        }
        out.flush();

        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            LOGGER.warn("{}", diagnostic);
        }
        if (strict && diagnostics.hasWarnings()) {
            return EXIT_UNRECOGNIZED_INPUT;
        }
        return 0;
    }

    private FuseLexerOptions resolveOptions(final Config config) {
        FuseLexerOptions options = FuseLexerOptions.fromConfig(config);
        if (noBuiltins) {
            options = options.withFunctionHighlighting(false);
        }
        if (disabledModules != null && !disabledModules.isEmpty()) {
            options = options.withDisabledModules(disabledModules);
        }
        return options;
    }

    private void printPlain(final Iterator<Token> tokens, final PrintWriter out) {
        while (tokens.hasNext()) {
            final Token token = tokens.next();
            out.println(token.category().qualifiedName() + "\t" + escape(token.text()));
        }
    }

    private void printJson(final Iterator<Token> tokens, final PrintWriter out) {
        final JsonArray array = new JsonArray();
        while (tokens.hasNext()) {
            final Token token = tokens.next();
            final JsonObject json = new JsonObject();
            json.addProperty("category", token.category().qualifiedName());
            json.addProperty("text", token.text());
            json.addProperty("offset", token.offset());
            array.add(json);
        }
        final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        out.println(gson.toJson(array));
    }

    static String escape(final String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\\' -> sb.append("\\\\");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
