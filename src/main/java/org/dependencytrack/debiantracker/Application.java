package org.dependencytrack.debiantracker;

import org.dependencytrack.debiantracker.cli.CheckCommand;
import org.dependencytrack.debiantracker.cli.NormalizeCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

@Command(
        name = "debian-tracker",
        version = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                CheckCommand.class,
                NormalizeCommand.class})
public class Application implements Callable<Integer> {

    public static void main(final String[] args) {
        System.exit(new CommandLine(new Application()).execute(args));
    }

    @Override
    public Integer call() {
        return 0;
    }

}
