package com.switchyard.dispatch.cli;

import com.switchyard.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Root picocli command for the Switchyard CLI.
 */
@Command(
        name = "switchyard",
        mixinStandardHelpOptions = true,
        version = "Switchyard 0.1.0",
        description = "Isolated agent sessions on git worktrees",
        subcommands = {
                CreateCommand.class,
                ListCommand.class,
                ShowCommand.class,
                SpecCommand.class,
                ReadyCommand.class,
                UnreadyCommand.class,
                ReviewCommand.class,
                TransitionCommand.class,
                PreviewCommand.class,
                MergeCommand.class,
                UpdateCommand.class,
                CancelCommand.class,
                EpicCommand.class,
                CloneCommand.class,
                LaunchCommand.class,
                BranchesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwitchyardCommand implements Runnable {

    private final EventBus eventBus;
    private EventBus.Subscription eventPrinter;

    public SwitchyardCommand(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Option(names = {"--events"}, description = "Print lifecycle events as they happen")
    void setShowEvents(boolean show) {
        if (show && eventPrinter == null) {
            eventPrinter = eventBus.subscribeAll(ConsoleOutput::event);
        }
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }
}
