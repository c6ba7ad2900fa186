package org.losp.cli.commands;

import org.losp.Session;
import org.losp.cli.CommandLineInterface;
import org.losp.compiler.api.CompilationException;
import org.losp.runtime.LospRuntimeException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Compiles a source file and runs its forms in order."
)
public class RunCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "The source file to run.")
    private Path file;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return runFile(parent.createSession(out, false), file, spec.commandLine().getErr());
    }

    /**
     * Runs a file and reports the outcome.
     *
     * @param session The session to run in.
     * @param file The source file.
     * @param err Where errors are reported.
     * @return 0 on success, 1 if the file could not be read, compiled or run.
     */
    static int runFile(Session session, Path file, PrintWriter err) {
        try {
            session.runFile(file);
            return 0;
        } catch (IOException e) {
            err.println("error: cannot read " + file + ": " + e.getMessage());
        } catch (CompilationException e) {
            err.println("error: " + e.getMessage());
        } catch (LospRuntimeException e) {
            err.println("runtime error: " + e.getMessage());
        }
        err.flush();
        return 1;
    }
}
