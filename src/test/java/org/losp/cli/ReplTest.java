package org.losp.cli;

import org.losp.Session;
import org.losp.runtime.VirtualMachine;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Drives the {@link Repl} with a mocked JLine reader.
 */
@ExtendWith(MockitoExtension.class)
public class ReplTest {

    private static final String NL = System.lineSeparator();

    @Mock
    private LineReader reader;

    private StringWriter out;
    private StringWriter err;
    private Repl repl;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        PrintWriter outWriter = new PrintWriter(out);
        Session session = new Session(new VirtualMachine(outWriter));
        repl = new Repl(session, reader, outWriter, new PrintWriter(err), "losp> ", "  ... ");
    }

    @Test
    @Tag("unit")
    void testEchoesValuesUntilExit() {
        when(reader.readLine(anyString())).thenReturn("(def x 41)", "", "(+ x 1) \"s\"", "exit", "(print 1)");

        assertThat(repl.run()).isZero();

        assertThat(out.toString()).isEqualTo("41" + NL + "42" + NL + "\"s\"" + NL);
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testCollectsLinesUntilFormIsComplete() {
        when(reader.readLine(anyString())).thenReturn("(defn add (a b)", "  (+ a b))", "(add 2", "3)", "quit");

        repl.run();

        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(reader, atLeastOnce()).readLine(prompts.capture());
        assertThat(prompts.getAllValues()).containsExactly("losp> ", "  ... ", "losp> ", "  ... ", "losp> ");
        assertThat(out.toString()).isEqualTo("fn<add>" + NL + "5" + NL);
    }

    /**
     * An error is reported and the loop keeps the definitions made before it.
     */
    @Test
    @Tag("unit")
    void testReportsErrorsAndContinues() {
        when(reader.readLine(anyString())).thenReturn("(def y 2) (/ y 0) (* y 3)", "(if 1)", "y", "exit");

        repl.run();

        assertThat(out.toString()).isEqualTo("2" + NL + "6" + NL + "2" + NL);
        assertThat(err.toString().split(NL))
                .hasSize(2)
                .allMatch(line -> line.startsWith("error: "));
        assertThat(err.toString()).contains("division by zero").contains("<repl:2>");
    }

    @Test
    @Tag("unit")
    void testInterruptDiscardsPendingInputAndEndOfFileExits() {
        when(reader.readLine(anyString()))
                .thenReturn("(+ 1")
                .thenThrow(new UserInterruptException(""))
                .thenReturn("(+ 2 3)")
                .thenThrow(new EndOfFileException());

        assertThat(repl.run()).isZero();

        assertThat(out.toString()).isEqualTo("5" + NL);
    }

    @Test
    @Tag("unit")
    void testNullLineEndsSession() {
        when(reader.readLine(anyString())).thenReturn(null);

        assertThat(repl.run()).isZero();
        assertThat(out.toString()).isEmpty();
    }
}
