package org.fuselex.cli;

import com.typesafe.config.Config;
import org.fuselex.junit.extensions.logging.ExpectLog;
import org.fuselex.junit.extensions.logging.LogLevel;
import org.fuselex.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private CommandLineInterface cli;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        cli = new CommandLineInterface();
        commandLine = new CommandLine(cli);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(new StringWriter()));
    }

    @Test
    void describePrintsTheDescriptor() {
        int exitCode = commandLine.execute("describe");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString())
                .contains("title:       Fuse")
                .contains("tag:         fuse")
                .contains("filenames:   *.fuse, *.fu")
                .contains("mimetypes:   text/x-fuse, application/x-fuse");
    }

    @Test
    void detectRecognizesFileNames() throws IOException {
        Path file = Files.writeString(tempDir.resolve("main.fuse"), "x = 1\n");

        assertThat(commandLine.execute("detect", "-f", file.toString())).isEqualTo(0);
        assertThat(out.toString().trim()).isEqualTo("fuse");
    }

    @Test
    void detectRecognizesShebangs() throws IOException {
        Path script = Files.writeString(tempDir.resolve("tool"), "#!/usr/bin/env fuse\nprint(1)\n");
        Path shell = Files.writeString(tempDir.resolve("run"), "#!/bin/sh\necho\n");
        Path empty = Files.writeString(tempDir.resolve("empty"), "");

        assertThat(commandLine.execute("detect", "-f", script.toString())).isEqualTo(0);
        assertThat(commandLine.execute("detect", "-f", shell.toString())).isEqualTo(1);
        assertThat(commandLine.execute("detect", "-f", empty.toString())).isEqualTo(1);
    }

    @Test
    void unknownSubcommandIsAUsageError() {
        assertThat(commandLine.execute("highlight")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void explicitConfigurationFileIsApplied() throws IOException {
        Path conf = Files.writeString(tempDir.resolve("custom.conf"), "fuselex.output.format = json\n");
        Path source = Files.writeString(tempDir.resolve("a.fuse"), "nil");

        int exitCode = commandLine.execute("-c", conf.toString(), "tokenize", "-f", source.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("\"category\": \"Keyword.Constant\"");
        Config config = cli.getConfig();
        assertThat(config.getString("fuselex.output.format")).isEqualTo("json");
        assertThat(config.getBoolean("fuselex.output.coalesce")).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*CommandLineInterface", messagePattern = "(?s)Failed to load or parse configuration.*")
    void missingConfigurationFileFailsTheCommand() throws IOException {
        Path source = Files.writeString(tempDir.resolve("a.fuse"), "nil");

        int exitCode = commandLine.execute("-c", tempDir.resolve("absent.conf").toString(),
                "tokenize", "-f", source.toString());

        assertThat(exitCode).isNotEqualTo(0);
    }
}
