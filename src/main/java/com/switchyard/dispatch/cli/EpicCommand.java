package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.Epic;
import com.switchyard.sessions.EpicService;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command group: switchyard epic create|list|delete|assign
 */
@Command(name = "epic", mixinStandardHelpOptions = true, description = "Group sessions and specs into epics",
        subcommands = {
                EpicCommand.Create.class,
                EpicCommand.ListEpics.class,
                EpicCommand.Delete.class,
                EpicCommand.Assign.class
        })
@Component
public class EpicCommand implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    @Command(name = "create", mixinStandardHelpOptions = true, description = "Create an epic")
    @Component
    public static class Create implements Callable<Integer> {

        @Parameters(index = "0", description = "Epic name")
        private String name;

        @Option(names = {"--color"}, description = "Display color")
        private String color;

        private final EpicService epics;

        public Create(EpicService epics) {
            this.epics = epics;
        }

        @Override
        public Integer call() {
            try {
                Epic epic = epics.createEpic(name, color);
                ConsoleOutput.success("Created epic " + epic.name() + " (" + epic.id() + ")");
                return 0;
            } catch (SwitchyardException e) {
                return ConsoleOutput.failure(e);
            }
        }
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "List epics")
    @Component
    public static class ListEpics implements Callable<Integer> {

        private final EpicService epics;

        public ListEpics(EpicService epics) {
            this.epics = epics;
        }

        @Override
        public Integer call() {
            try {
                for (Epic epic : epics.listEpics()) {
                    System.out.printf("  %-38s %-24s %s%n", epic.id(), epic.name(),
                            epic.color() != null ? epic.color() : "-");
                }
                return 0;
            } catch (SwitchyardException e) {
                return ConsoleOutput.failure(e);
            }
        }
    }

    @Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete an epic and detach its members")
    @Component
    public static class Delete implements Callable<Integer> {

        @Parameters(index = "0", description = "Epic id")
        private String id;

        private final EpicService epics;

        public Delete(EpicService epics) {
            this.epics = epics;
        }

        @Override
        public Integer call() {
            try {
                epics.deleteEpic(id);
                ConsoleOutput.success("Deleted epic " + id);
                return 0;
            } catch (SwitchyardException e) {
                return ConsoleOutput.failure(e);
            }
        }
    }

    @Command(name = "assign", mixinStandardHelpOptions = true,
            description = "Assign a session or spec to an epic; omit the epic to clear it")
    @Component
    public static class Assign implements Callable<Integer> {

        @Parameters(index = "0", description = "Session or spec name")
        private String name;

        @Parameters(index = "1", arity = "0..1", description = "Epic id")
        private String epicId;

        private final EpicService epics;

        public Assign(EpicService epics) {
            this.epics = epics;
        }

        @Override
        public Integer call() {
            try {
                epics.setItemEpic(name, epicId);
                ConsoleOutput.success(epicId == null ? "Cleared epic of " + name : "Assigned " + name + " to " + epicId);
                return 0;
            } catch (SwitchyardException e) {
                return ConsoleOutput.failure(e);
            }
        }
    }
}
