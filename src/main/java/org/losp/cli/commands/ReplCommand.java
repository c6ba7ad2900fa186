package org.losp.cli.commands;

import com.typesafe.config.Config;
import org.losp.Session;
import org.losp.cli.CommandLineInterface;
import org.losp.cli.Repl;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "repl",
    description = "Starts an interactive session."
)
public class ReplCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        return startRepl(parent, spec.commandLine().getOut(), spec.commandLine().getErr(), false);
    }

    /**
     * Runs an interactive session on the system terminal.
     *
     * @param parent The root command, source of configuration.
     * @param out Where values and program output go.
     * @param err Where errors go.
     * @param trace Whether instructions are traced.
     * @return The exit code.
     * @throws IOException if the terminal cannot be opened.
     */
    static int startRepl(CommandLineInterface parent, PrintWriter out, PrintWriter err, boolean trace) throws IOException {
        Config replConfig = parent.getConfig().getConfig("losp.repl");
        Session session = parent.createSession(out, trace);
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReaderBuilder builder = LineReaderBuilder.builder().terminal(terminal);
            String historyFile = replConfig.getString("history-file");
            if (!historyFile.isBlank()) {
                builder.variable(LineReader.HISTORY_FILE, Path.of(historyFile));
            }
            LineReader lineReader = builder.build();
            return new Repl(session, lineReader, out, err,
                    replConfig.getString("prompt"), replConfig.getString("continuation-prompt")).run();
        }
    }
}
