package com.switchyard.dispatch.cli;

import com.switchyard.core.errors.SwitchyardException;
import com.switchyard.core.model.Session;
import com.switchyard.core.model.Spec;
import com.switchyard.sessions.SessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command group: switchyard spec create|list|start|delete
 */
@Command(name = "spec", mixinStandardHelpOptions = true, description = "Manage spec drafts",
        subcommands = {
                SpecCommand.Create.class,
                SpecCommand.ListSpecs.class,
                SpecCommand.Start.class,
                SpecCommand.Delete.class
        })
@Component
public class SpecCommand implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    @Command(name = "create", mixinStandardHelpOptions = true, description = "Create a spec")
    @Component
    public static class Create implements Callable<Integer> {

        @Parameters(index = "0", description = "Spec name")
        private String name;

        @Option(names = {"--content", "-c"}, description = "Spec content")
        private String content;

        private final SessionService sessions;

        public Create(SessionService sessions) {
            this.sessions = sessions;
        }

        @Override
        public Integer call() {
            try {
                Spec spec = sessions.createSpec(name, content);
                ConsoleOutput.success("Created spec " + spec.name());
                return 0;
            } catch (SwitchyardException e) {
                return ConsoleOutput.failure(e);
            }
        }
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "List specs")
    @Component
    public static class ListSpecs implements Callable<Integer> {

        private final SessionService sessions;

        public ListSpecs(SessionService sessions) {
            this.sessions = sessions;
        }

        @Override
        public Integer call() {
            try {
                List<Spec> specs = sessions.listSpecs();
                if (specs.isEmpty()) {
                    ConsoleOutput.info("No specs.");
                }
                for (Spec spec : specs) {
                    String firstLine = spec.content().lines().findFirst().orElse("");
                    System.out.printf("  %-24s %s%n", spec.name(), firstLine);
                }
                return 0;
            } catch (SwitchyardException e) {
                return ConsoleOutput.failure(e);
            }
        }
    }

    @Command(name = "start", mixinStandardHelpOptions = true, description = "Start a spec as a running session")
    @Component
    public static class Start implements Callable<Integer> {

        @Parameters(index = "0", description = "Spec name")
        private String name;

        @Option(names = {"--parent", "-p"}, description = "Parent branch (default: configured default)")
        private String parentBranch;

        private final SessionService sessions;

        public Start(SessionService sessions) {
            this.sessions = sessions;
        }

        @Override
        public Integer call() {
            try {
                Session session = sessions.startSpec(name, parentBranch);
                ConsoleOutput.success("Started " + session.name() + " on " + session.branch());
                return 0;
            } catch (SwitchyardException e) {
                return ConsoleOutput.failure(e);
            }
        }
    }

    @Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete a spec")
    @Component
    public static class Delete implements Callable<Integer> {

        @Parameters(index = "0", description = "Spec name")
        private String name;

        private final SessionService sessions;

        public Delete(SessionService sessions) {
            this.sessions = sessions;
        }

        @Override
        public Integer call() {
            try {
                sessions.deleteSpec(name);
                ConsoleOutput.success("Deleted spec " + name);
                return 0;
            } catch (SwitchyardException e) {
                return ConsoleOutput.failure(e);
            }
        }
    }
}
