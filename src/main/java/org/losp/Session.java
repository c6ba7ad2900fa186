package org.losp;

import org.losp.compiler.Compiler;
import org.losp.compiler.api.CompilationException;
import org.losp.compiler.api.CompiledProgram;
import org.losp.compiler.api.CompilerErrorCode;
import org.losp.compiler.diagnostics.DiagnosticsEngine;
import org.losp.compiler.frontend.lexer.Lexer;
import org.losp.compiler.frontend.lexer.Token;
import org.losp.compiler.frontend.parser.Parser;
import org.losp.compiler.frontend.parser.ast.AstNode;
import org.losp.runtime.LospRuntimeException;
import org.losp.runtime.VirtualMachine;
import org.losp.runtime.model.Chunk;
import org.losp.runtime.model.NilValue;
import org.losp.runtime.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives the compiler and one {@link VirtualMachine} for a front end. All
 * evaluations of a session share the VM's global table.
 * <p>
 * Interactive evaluation compiles and runs one form at a time, so an error
 * only costs the form that raised it. Program runs compile the whole text
 * before executing anything and stop at the first error.
 */
public class Session {

    private static final Logger LOG = LoggerFactory.getLogger(Session.class);

    private final Compiler compiler = new Compiler();
    private final VirtualMachine vm;

    /**
     * @param vm The machine to run on; its globals become the session's state.
     */
    public Session(VirtualMachine vm) {
        this.vm = vm;
    }

    public VirtualMachine getVirtualMachine() {
        return vm;
    }

    /**
     * Evaluates every form of an interactive entry in order. A form that fails
     * to lex, parse, compile or run yields a failed result and evaluation
     * continues with the next form.
     *
     * @param source The entered text.
     * @param entryName The name used in error positions.
     * @return One result per form.
     */
    public List<EvaluationResult> evaluateInteractive(String source, String entryName) {
        List<EvaluationResult> results = new ArrayList<>();
        Parser parser = new Parser(new Lexer(source, entryName), new DiagnosticsEngine());
        while (parser.hasNextForm()) {
            try {
                AstNode form = parser.parseForm();
                Chunk chunk = compiler.compileForm(form);
                results.add(EvaluationResult.success(vm.execute(chunk)));
            } catch (CompilationException | LospRuntimeException e) {
                LOG.debug("Form in {} failed: {}", entryName, e.getMessage());
                results.add(EvaluationResult.failure(e));
            }
        }
        return results;
    }

    /**
     * Compiles a whole program and runs its forms in order.
     *
     * @param source The program text.
     * @param programName The name used in error positions.
     * @return The value of the last form, or Nil for an empty program.
     * @throws CompilationException if any form is malformed; nothing has run then.
     * @throws LospRuntimeException if a form fails at runtime; later forms do not run.
     */
    public Value runProgram(String source, String programName) throws CompilationException, LospRuntimeException {
        return execute(compiler.compile(source, programName));
    }

    /**
     * Reads a UTF-8 source file and runs it as a program.
     *
     * @param file The file.
     * @return The value of the last form.
     * @throws IOException if the file cannot be read.
     * @throws CompilationException if any form is malformed.
     * @throws LospRuntimeException if a form fails at runtime.
     */
    public Value runFile(Path file) throws IOException, CompilationException, LospRuntimeException {
        LOG.debug("Running {}", file);
        return execute(compiler.compile(file));
    }

    private Value execute(CompiledProgram program) throws LospRuntimeException {
        Value last = NilValue.INSTANCE;
        for (Chunk chunk : program.chunks()) {
            last = vm.execute(chunk);
        }
        return last;
    }

    /**
     * Tells whether an interactive entry can be evaluated or needs more lines:
     * it is incomplete while a parenthesis or a string literal is still open.
     *
     * @param source The text entered so far.
     * @return {@code false} if more input is needed.
     */
    public static boolean isComplete(String source) {
        int depth = 0;
        for (Token token : new Lexer(source)) {
            switch (token.type()) {
                case LEFT_PAREN:
                    depth++;
                    break;
                case RIGHT_PAREN:
                    depth--;
                    break;
                case ERROR:
                    if (token.value() == CompilerErrorCode.UNTERMINATED_STRING) {
                        return false;
                    }
                    break;
                default:
                    break;
            }
        }
        return depth <= 0;
    }
}
