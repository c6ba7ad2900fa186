package org.losp.compiler;

import org.losp.compiler.api.CompilationException;
import org.losp.compiler.api.CompiledProgram;
import org.losp.compiler.api.ICompiler;
import org.losp.compiler.backend.emit.Emitter;
import org.losp.compiler.diagnostics.Diagnostic;
import org.losp.compiler.diagnostics.DiagnosticsEngine;
import org.losp.compiler.frontend.lexer.Lexer;
import org.losp.compiler.frontend.parser.Parser;
import org.losp.compiler.frontend.parser.ast.AstNode;
import org.losp.runtime.model.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The main compiler implementation. It runs the pipeline lexer, parser, emitter
 * and turns source text into one chunk per top-level form. It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    /**
     * {@inheritDoc}
     * <p>
     * Every form is parsed and compiled even after an error, so the exception
     * lists all problems of the text at once.
     */
    @Override
    public CompiledProgram compile(String source, String programName) throws CompilationException {
        diagnostics = new DiagnosticsEngine();

        // Phase 1 and 2: lexing and parsing; the parser pulls tokens as it goes
        Parser parser = new Parser(new Lexer(source, programName), diagnostics);
        List<AstNode> forms = parser.parse();
        LOG.debug("Parsed {} top-level form(s) from {}", forms.size(), programName);

        // Phase 3: emission
        Emitter emitter = new Emitter(diagnostics);
        List<Chunk> chunks = new ArrayList<>(forms.size());
        for (AstNode form : forms) {
            try {
                chunks.add(emitter.compileTopLevel(form));
            } catch (CompilationException e) {
                diagnostics.reportError(e);
            }
        }

        logWarnings();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary(), diagnostics.getErrors().get(0));
        }
        LOG.debug("Compiled {} into {} chunk(s)", programName, chunks.size());
        return new CompiledProgram(programName, chunks);
    }

    @Override
    public Chunk compileForm(AstNode form) throws CompilationException {
        diagnostics = new DiagnosticsEngine();
        Chunk chunk = new Emitter(diagnostics).compileTopLevel(form);
        logWarnings();
        return chunk;
    }

    /**
     * @return The diagnostics of the most recent compilation.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private void logWarnings() {
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            if (diagnostic.type() == Diagnostic.Type.WARNING) {
                LOG.warn("{}", diagnostic);
            }
        }
    }
}
