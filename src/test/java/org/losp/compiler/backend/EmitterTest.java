package org.losp.compiler.backend;

import org.losp.compiler.api.CompilationException;
import org.losp.compiler.api.CompilerErrorCode;
import org.losp.compiler.backend.emit.Emitter;
import org.losp.compiler.diagnostics.Diagnostic;
import org.losp.compiler.diagnostics.DiagnosticsEngine;
import org.losp.compiler.frontend.lexer.Lexer;
import org.losp.compiler.frontend.parser.Parser;
import org.losp.runtime.isa.OpCode;
import org.losp.runtime.model.Chunk;
import org.losp.runtime.model.FloatValue;
import org.losp.runtime.model.IntValue;
import org.losp.runtime.model.LospFunction;
import org.losp.runtime.model.StringValue;
import org.losp.runtime.services.Disassembler;
import org.losp.runtime.services.DisassemblyData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link Emitter}. Programs are parsed from source and the
 * emitted chunks are inspected through the {@link Disassembler}.
 */
public class EmitterTest {

    private final Disassembler disassembler = new Disassembler();
    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private Chunk compile(String source) throws CompilationException {
        Parser parser = new Parser(new Lexer(source, "test.losp"), diagnostics);
        return new Emitter(diagnostics).compileTopLevel(parser.parseForm());
    }

    private List<OpCode> opcodes(Chunk chunk) {
        return disassembler.disassemble(chunk).stream().map(DisassemblyData::opcode).toList();
    }

    private CompilerErrorCode errorOf(String source) {
        try {
            compile(source);
        } catch (CompilationException e) {
            return e.getErrorCode();
        }
        throw new AssertionError("expected a compilation error for " + source);
    }

    @Test
    @Tag("unit")
    void testArithmeticCompilesToInstructions() throws CompilationException {
        Chunk chunk = compile("(+ 1 2)");

        assertThat(chunk.name()).isEqualTo("<top>");
        assertThat(opcodes(chunk)).containsExactly(OpCode.CONSTANT, OpCode.CONSTANT, OpCode.ADD, OpCode.RETURN);
        assertThat(chunk.constants()).containsExactly(new IntValue(1), new IntValue(2));
    }

    @Test
    @Tag("unit")
    void testVariadicOperatorsFoldLeft() throws CompilationException {
        assertThat(opcodes(compile("(- 10 2 3)"))).containsExactly(
                OpCode.CONSTANT, OpCode.CONSTANT, OpCode.SUBTRACT, OpCode.CONSTANT, OpCode.SUBTRACT, OpCode.RETURN);
        assertThat(opcodes(compile("(- 5)"))).containsExactly(OpCode.CONSTANT, OpCode.NEGATE, OpCode.RETURN);
        assertThat(opcodes(compile("(<= 1 2)"))).containsExactly(
                OpCode.CONSTANT, OpCode.CONSTANT, OpCode.GREATER, OpCode.NOT, OpCode.RETURN);
    }

    @Test
    @Tag("unit")
    void testEqualConstantsShareOneSlot() throws CompilationException {
        Chunk chunk = compile("(+ 1 1)");

        assertThat(chunk.constants()).containsExactly(new IntValue(1));
        assertThat(disassembler.disassemble(chunk).get(1).operands()).containsExactly(0);
    }

    /**
     * Zero and negative zero compare equal but are different constants: dividing
     * by them gives infinities of opposite sign.
     */
    @Test
    @Tag("unit")
    void testSignedZeroLiteralsKeepSeparateSlots() throws CompilationException {
        Chunk chunk = compile("(= 0.0 -0.0)");

        assertThat(chunk.constants()).hasSize(2);
        FloatValue second = (FloatValue) chunk.constants().get(1);
        assertThat(Double.doubleToRawLongBits(second.value())).isEqualTo(Double.doubleToRawLongBits(-0.0));
        List<DisassemblyData> code = disassembler.disassemble(chunk);
        assertThat(code.get(0).operands()).containsExactly(0);
        assertThat(code.get(1).operands()).containsExactly(1);
    }

    /**
     * Let locals live in the stack slots their initializers leave behind and are
     * dropped with a single TRUNCATE when the let ends.
     */
    @Test
    @Tag("unit")
    void testLetUsesStackSlots() throws CompilationException {
        // Act
        Chunk chunk = compile("(let ((a 1) (b 2)) (+ a b))");
        List<DisassemblyData> code = disassembler.disassemble(chunk);

        // Assert
        assertThat(code).extracting(DisassemblyData::opcode).containsExactly(
                OpCode.CONSTANT, OpCode.CONSTANT, OpCode.GET_LOCAL, OpCode.GET_LOCAL, OpCode.ADD,
                OpCode.TRUNCATE, OpCode.RETURN);
        assertThat(code.get(2).operands()).containsExactly(0);
        assertThat(code.get(3).operands()).containsExactly(1);
        assertThat(code.get(5).operands()).containsExactly(0);
    }

    @Test
    @Tag("unit")
    void testNestedLetSlotsFollowTheStack() throws CompilationException {
        List<DisassemblyData> code = disassembler.disassemble(compile("(+ 1 (let ((a 2)) a))"));

        // 1 occupies slot 0, so a lands in slot 1
        assertThat(code.get(2).opcode()).isEqualTo(OpCode.GET_LOCAL);
        assertThat(code.get(2).operands()).containsExactly(1);
        assertThat(code.get(3).opcode()).isEqualTo(OpCode.TRUNCATE);
        assertThat(code.get(3).operands()).containsExactly(1);
    }

    @Test
    @Tag("unit")
    void testUnboundSymbolsCompileToGlobalLookups() throws CompilationException {
        Chunk chunk = compile("x");

        assertThat(opcodes(chunk)).containsExactly(OpCode.GET_GLOBAL, OpCode.RETURN);
        assertThat(chunk.constants()).containsExactly(new StringValue("x"));
    }

    /**
     * The function body gets its own chunk with the parameters in slots 0 and 1;
     * the enclosing chunk only stores and binds the function.
     */
    @Test
    @Tag("unit")
    void testDefnBuildsFunctionConstant() throws CompilationException {
        // Act
        Chunk chunk = compile("(defn foo (a b) (+ a b))");

        // Assert
        assertThat(opcodes(chunk)).containsExactly(OpCode.CONSTANT, OpCode.SET_GLOBAL, OpCode.RETURN);
        assertThat(chunk.constants().get(0)).isInstanceOf(LospFunction.class);
        LospFunction foo = (LospFunction) chunk.constants().get(0);
        assertThat(foo.name()).isEqualTo("foo");
        assertThat(foo.arity()).isEqualTo(2);
        assertThat(opcodes(foo.chunk())).containsExactly(OpCode.GET_LOCAL, OpCode.GET_LOCAL, OpCode.ADD, OpCode.RETURN);
        assertThat(disassembler.reachableChunks(chunk)).extracting(Chunk::name).containsExactly("<top>", "foo");
    }

    @Test
    @Tag("unit")
    void testIfPatchesBothJumps() throws CompilationException {
        List<DisassemblyData> code = disassembler.disassemble(compile("(if true 1 2)"));

        assertThat(code).extracting(DisassemblyData::opcode).containsExactly(
                OpCode.CONSTANT, OpCode.JUMP_IF_FALSE, OpCode.CONSTANT, OpCode.JUMP, OpCode.CONSTANT, OpCode.RETURN);
        assertThat(code.get(1).operands()).containsExactly(code.get(4).offset());
        assertThat(code.get(3).operands()).containsExactly(code.get(5).offset());
    }

    @Test
    @Tag("unit")
    void testWhileJumpsBackToCondition() throws CompilationException {
        List<DisassemblyData> code = disassembler.disassemble(compile("(while c (f))"));

        assertThat(code).extracting(DisassemblyData::opcode).containsExactly(
                OpCode.GET_GLOBAL, OpCode.JUMP_IF_FALSE, OpCode.GET_GLOBAL, OpCode.CALL, OpCode.POP, OpCode.JUMP,
                OpCode.NIL, OpCode.RETURN);
        assertThat(code.get(5).operands()).containsExactly(0);
        assertThat(code.get(1).operands()).containsExactly(code.get(6).offset());
    }

    @Test
    @Tag("unit")
    void testLocalShadowsBuiltinOperator() throws CompilationException {
        assertThat(opcodes(compile("(let ((+ 1)) (+ 2 3))"))).containsExactly(
                OpCode.CONSTANT, OpCode.GET_LOCAL, OpCode.CONSTANT, OpCode.CONSTANT, OpCode.CALL, OpCode.TRUNCATE,
                OpCode.RETURN);
    }

    @Test
    @Tag("unit")
    void testEveryByteCarriesItsSourceLine() throws CompilationException {
        Chunk chunk = compile("(+ 1\n   2)");

        List<DisassemblyData> code = disassembler.disassemble(chunk);
        assertThat(code.get(0).line()).isEqualTo(1);
        assertThat(code.get(1).line()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testMalformedShapesAreCompileErrors() {
        assertThat(errorOf("(def 1 2)")).isEqualTo(CompilerErrorCode.EXPECTED_SYMBOL);
        assertThat(errorOf("(defn 1 () 2)")).isEqualTo(CompilerErrorCode.EXPECTED_SYMBOL);
        assertThat(errorOf("(defn f (a 1) a)")).isEqualTo(CompilerErrorCode.EXPECTED_SYMBOL);
        assertThat(errorOf("(defn f (a a) a)")).isEqualTo(CompilerErrorCode.DUPLICATE_PARAMETER);
        assertThat(errorOf("(let ((a)) a)")).isEqualTo(CompilerErrorCode.INVALID_LET_BINDING);
        assertThat(errorOf("(let ((a 1 2)) a)")).isEqualTo(CompilerErrorCode.INVALID_LET_BINDING);
        assertThat(errorOf("(let (1 2) 3)")).isEqualTo(CompilerErrorCode.INVALID_LET_BINDING);
        assertThat(errorOf("(= 1)")).isEqualTo(CompilerErrorCode.INVALID_OPERAND_COUNT);
        assertThat(errorOf("(not 1 2)")).isEqualTo(CompilerErrorCode.INVALID_OPERAND_COUNT);
        assertThat(errorOf("(+ 1)")).isEqualTo(CompilerErrorCode.INVALID_OPERAND_COUNT);
    }

    @Test
    @Tag("unit")
    void testExpectedSymbolMessageDescribesTheForm() {
        assertThatThrownBy(() -> compile("(def (f) 1)"))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getDetail()).isEqualTo("'def' target must be a symbol, found a list"));
        assertThatThrownBy(() -> compile("(defn g (a \"b\") a)"))
                .isInstanceOfSatisfying(CompilationException.class,
                        e -> assertThat(e.getDetail()).isEqualTo("parameter must be a symbol, found '\"b\"'"));
    }

    @Test
    @Tag("unit")
    void testTooManyArguments() {
        String source = "(f " + String.join(" ", Collections.nCopies(256, "1")) + ")";

        assertThatThrownBy(() -> compile(source))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("255");
        assertThat(errorOf(source)).isEqualTo(CompilerErrorCode.TOO_MANY_ARGUMENTS);
    }

    @Test
    @Tag("unit")
    void testDefiningABuiltinNameWarns() throws CompilationException {
        compile("(def + 1)");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::type)
                .isEqualTo(Diagnostic.Type.WARNING);
    }
}
