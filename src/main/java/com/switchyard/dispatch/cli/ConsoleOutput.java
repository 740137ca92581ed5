package com.switchyard.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.events.SwitchyardEvent;
import com.switchyard.core.model.GitStats;
import com.switchyard.core.model.Session;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Switchyard CLI.
 */
public class ConsoleOutput {

    private static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new SimpleModule().addSerializer(Path.class, ToStringSerializer.instance))
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ConsoleOutput() {
        // utility class
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWITCHYARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void event(SwitchyardEvent event) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|faint [" + event.type().wireName() + "]|@ " + event.sessionName() + " " + event.payload()));
    }

    /**
     * Prints the failure and returns the exit code for its kind.
     */
    public static int failure(SwitchyardException e) {
        error(e.getMessage());
        return e.kind().exitCode();
    }

    /**
     * Prints {@code value} as indented JSON for scripting ({@code --json}).
     */
    public static void json(Object value) {
        try {
            System.out.println(JSON.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }

    public static void paths(List<String> paths) {
        for (String path : paths) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + path));
        }
    }

    public static void sessionRow(Session s) {
        String state = switch (s.sessionState()) {
            case SPEC -> "@|fg(magenta) spec    |@";
            case RUNNING -> "@|fg(blue) running |@";
            case REVIEWED -> "@|fg(green) reviewed|@";
        };
        String ready = s.readyToMerge() ? " @|fg(green) [ready]|@" : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  %-24s ", s.name()) + state + String.format(" %-30s", s.branch()) + ready));
    }

    public static void stats(GitStats stats) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Changes: " + stats.filesChanged() + " file(s), @|fg(green) +" + stats.linesAdded()
                        + "|@ @|fg(red) -" + stats.linesRemoved() + "|@"
                        + (stats.hasUncommitted() ? " @|fg(yellow) (uncommitted)|@" : "")));
    }
}
