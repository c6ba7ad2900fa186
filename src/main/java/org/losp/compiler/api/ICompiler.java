package org.losp.compiler.api;

import org.losp.compiler.frontend.parser.ast.AstNode;
import org.losp.runtime.model.Chunk;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface for the losp compiler.
 */
public interface ICompiler {

    /**
     * Compiles every form of the given source text. No chunk is returned unless the
     * whole text compiles.
     *
     * @param source The program text.
     * @param programName A name for the program, used in diagnostics.
     * @return The compiled program.
     * @throws CompilationException summarising all errors if any form fails to lex, parse or compile.
     */
    CompiledProgram compile(String source, String programName) throws CompilationException;

    /**
     * Compiles a single, already parsed form into a top-level chunk. Used by
     * interactive drivers that execute each form before compiling the next.
     *
     * @param form The parsed form.
     * @return The top-level chunk, ending in a return of the form's value.
     * @throws CompilationException if the form is malformed.
     */
    Chunk compileForm(AstNode form) throws CompilationException;

    /**
     * Compiles the source code from a file.
     * @param programPath The path to the source file, read as UTF-8.
     * @return The compiled program.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default CompiledProgram compile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readString(programPath, StandardCharsets.UTF_8), programPath.toString());
    }
}
