package org.losp.cli.commands;

import org.losp.cli.CommandLineInterface;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "debug",
    description = "Like repl, or run when a file is given, but prints every instruction before it executes."
)
public class DebugCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILE", description = "The source file to run; omit for an interactive session.")
    private Path file;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (file == null) {
            return ReplCommand.startRepl(parent, out, err, true);
        }
        return RunCommand.runFile(parent.createSession(out, true), file, err);
    }
}
