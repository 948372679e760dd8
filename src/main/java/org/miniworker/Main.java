package org.miniworker;

import org.miniworker.cli.RunCommand;
import org.miniworker.cli.ServeCommand;
import org.miniworker.cli.StatusCommand;
import org.miniworker.config.utils.LogContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Entry point
 *  run    - run one worker in this process (what the manager spawns)
 *  status - read status files from a stats directory
 *  serve  - management REST API that starts and stops worker processes
 */
@Command(
        name = "mini-worker",
        version = "0.1.0",
        description = "Mini-Worker: a simple, parameter-driven worker framework",
        mixinStandardHelpOptions = true,
        subcommands = {RunCommand.class, StatusCommand.class, ServeCommand.class, CommandLine.HelpCommand.class}
)
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static CommandLine commandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        LogContext.start("Main");
        int exitCode;
        try {
            exitCode = commandLine().execute(args);
        } finally {
            LogContext.clear();
        }
        System.exit(exitCode);
    }
}
