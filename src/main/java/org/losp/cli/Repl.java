package org.losp.cli;

import org.losp.EvaluationResult;
import org.losp.Session;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;

import java.io.PrintWriter;

/**
 * The read-compile-execute-print loop. Lines are collected until parentheses
 * and strings are balanced, then the entry is evaluated form by form and each
 * value is echoed. Errors are printed and the loop carries on.
 */
public class Repl {

    private final Session session;
    private final LineReader reader;
    private final PrintWriter out;
    private final PrintWriter err;
    private final String prompt;
    private final String continuationPrompt;

    /**
     * @param session The session that evaluates the entries.
     * @param reader The line source.
     * @param out Where values are echoed.
     * @param err Where errors are reported.
     * @param prompt The prompt for a new entry.
     * @param continuationPrompt The prompt while an entry is incomplete.
     */
    public Repl(Session session, LineReader reader, PrintWriter out, PrintWriter err,
                String prompt, String continuationPrompt) {
        this.session = session;
        this.reader = reader;
        this.out = out;
        this.err = err;
        this.prompt = prompt;
        this.continuationPrompt = continuationPrompt;
    }

    /**
     * Runs until {@code exit}, {@code quit} or end of input.
     * @return The exit code, always 0.
     */
    public int run() {
        StringBuilder pending = new StringBuilder();
        int entryNumber = 0;
        while (true) {
            String line;
            try {
                line = reader.readLine(pending.length() == 0 ? prompt : continuationPrompt);
            } catch (UserInterruptException e) {
                // Ctrl-C drops the entry being typed
                pending.setLength(0);
                continue;
            } catch (EndOfFileException e) {
                return 0;
            }
            if (line == null) {
                return 0;
            }
            if (pending.length() == 0) {
                String command = line.trim();
                if ("exit".equals(command) || "quit".equals(command)) {
                    return 0;
                }
                if (command.isEmpty()) {
                    continue;
                }
            }
            pending.append(line).append('\n');
            String source = pending.toString();
            if (!Session.isComplete(source)) {
                continue;
            }
            pending.setLength(0);
            entryNumber++;
            for (EvaluationResult result : session.evaluateInteractive(source, "<repl:" + entryNumber + ">")) {
                if (result.isSuccess()) {
                    out.println(result.value().repr());
                } else {
                    err.println("error: " + result.error().getMessage());
                }
            }
            out.flush();
            err.flush();
        }
    }
}
