package org.losp.compiler.backend.emit;

import org.losp.compiler.api.CompilationException;
import org.losp.compiler.api.CompilerErrorCode;
import org.losp.compiler.api.SourceInfo;
import org.losp.compiler.diagnostics.DiagnosticsEngine;
import org.losp.compiler.frontend.parser.ast.AstNode;
import org.losp.compiler.frontend.parser.ast.CallNode;
import org.losp.compiler.frontend.parser.ast.DefNode;
import org.losp.compiler.frontend.parser.ast.DefnNode;
import org.losp.compiler.frontend.parser.ast.DoNode;
import org.losp.compiler.frontend.parser.ast.IfNode;
import org.losp.compiler.frontend.parser.ast.LetBinding;
import org.losp.compiler.frontend.parser.ast.LetNode;
import org.losp.compiler.frontend.parser.ast.LiteralNode;
import org.losp.compiler.frontend.parser.ast.LogicalNode;
import org.losp.compiler.frontend.parser.ast.SymbolNode;
import org.losp.compiler.frontend.parser.ast.WhenNode;
import org.losp.compiler.frontend.parser.ast.WhileNode;
import org.losp.runtime.isa.OpCode;
import org.losp.runtime.model.Chunk;
import org.losp.runtime.model.LospFunction;
import org.losp.runtime.model.NilValue;
import org.losp.runtime.model.StringValue;
import org.losp.runtime.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * The Emitter is the backend of the compiler. It walks one top-level form in a
 * single pass and produces its chunk; every {@code defn} it meets gets a chunk
 * of its own, stored as a function constant of the enclosing chunk.
 * <p>
 * Every expression leaves exactly one value on the stack. Symbols are resolved
 * here: a name bound by an enclosing {@code let} or parameter list of the same
 * function becomes a frame-relative slot access, anything else a global lookup
 * by name at runtime.
 */
public class Emitter {

    private static final Logger LOG = LoggerFactory.getLogger(Emitter.class);

    /** The name of chunks compiled from top-level forms. */
    public static final String TOP_LEVEL_NAME = "<top>";
    /** Upper bound of call arguments and function parameters; CALL encodes the count in one byte. */
    public static final int MAX_ARGUMENTS = 255;

    private final DiagnosticsEngine diagnostics;
    private FunctionScope scope;

    /**
     * @param diagnostics The engine that receives warnings.
     */
    public Emitter(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Compiles a top-level form into a chunk that returns the form's value.
     *
     * @param form The form.
     * @return The chunk.
     * @throws CompilationException if the form is malformed or exceeds a chunk limit.
     */
    public Chunk compileTopLevel(AstNode form) throws CompilationException {
        scope = new FunctionScope(new ChunkBuilder(TOP_LEVEL_NAME));
        try {
            expression(form);
            emit(OpCode.RETURN, form.sourceInfo());
            return scope.chunk().build();
        } finally {
            scope = null;
        }
    }

    private void expression(AstNode node) throws CompilationException {
        if (node instanceof LiteralNode literal) {
            literal(literal);
        } else if (node instanceof SymbolNode symbol) {
            symbolReference(symbol);
        } else if (node instanceof DefNode def) {
            def(def);
        } else if (node instanceof LetNode let) {
            let(let);
        } else if (node instanceof IfNode ifNode) {
            ifForm(ifNode);
        } else if (node instanceof WhenNode when) {
            when(when);
        } else if (node instanceof DoNode doNode) {
            body(doNode.body(), doNode.sourceInfo());
        } else if (node instanceof DefnNode defn) {
            defn(defn);
        } else if (node instanceof WhileNode whileNode) {
            whileLoop(whileNode);
        } else if (node instanceof LogicalNode logical) {
            logical(logical);
        } else if (node instanceof CallNode call) {
            call(call);
        } else {
            throw new IllegalStateException("Unsupported AST node: " + node.getClass().getSimpleName());
        }
    }

    private void literal(LiteralNode node) throws CompilationException {
        if (node.value() == NilValue.INSTANCE) {
            emit(OpCode.NIL, node.sourceInfo());
        } else {
            emitConstant(node.value(), node.sourceInfo());
        }
    }

    private void symbolReference(SymbolNode node) throws CompilationException {
        OptionalInt slot = scope.resolve(node.name());
        if (slot.isPresent()) {
            emit(OpCode.GET_LOCAL, slot.getAsInt(), node.sourceInfo());
        } else {
            emit(OpCode.GET_GLOBAL, nameConstant(node.name(), node.sourceInfo()), node.sourceInfo());
        }
    }

    private void def(DefNode node) throws CompilationException {
        String name = requireSymbol(node.target(), "'def' target").name();
        warnIfBuiltin(name, node.target().sourceInfo());
        expression(node.value());
        emit(OpCode.SET_GLOBAL, nameConstant(name, node.sourceInfo()), node.sourceInfo());
    }

    private void let(LetNode node) throws CompilationException {
        scope.beginScope();
        for (LetBinding binding : node.bindings()) {
            if (!(binding.target() instanceof SymbolNode target) || binding.initializers().size() != 1) {
                throw new CompilationException(CompilerErrorCode.INVALID_LET_BINDING,
                        "a let binding must be a symbol followed by exactly one initializer", binding.sourceInfo());
            }
            expression(binding.initializers().get(0));
            scope.declareTop(target.name());
        }
        body(node.body(), node.sourceInfo());
        OptionalInt lowest = scope.endScope();
        if (lowest.isPresent()) {
            scope.chunk().emit(OpCode.TRUNCATE, lowest.getAsInt(), node.sourceInfo());
            scope.setStackDepth(lowest.getAsInt() + 1);
        }
    }

    private void ifForm(IfNode node) throws CompilationException {
        SourceInfo at = node.sourceInfo();
        expression(node.condition());
        int elseJump = emitJump(OpCode.JUMP_IF_FALSE, at);
        int depth = scope.stackDepth();
        expression(node.thenBranch());
        int endJump = emitJump(OpCode.JUMP, at);
        scope.chunk().patchJump(elseJump, at);
        scope.setStackDepth(depth);
        expression(node.elseBranch());
        scope.chunk().patchJump(endJump, at);
    }

    private void when(WhenNode node) throws CompilationException {
        SourceInfo at = node.sourceInfo();
        expression(node.condition());
        int elseJump = emitJump(OpCode.JUMP_IF_FALSE, at);
        int depth = scope.stackDepth();
        body(node.body(), at);
        int endJump = emitJump(OpCode.JUMP, at);
        scope.chunk().patchJump(elseJump, at);
        scope.setStackDepth(depth);
        emit(OpCode.NIL, at);
        scope.chunk().patchJump(endJump, at);
    }

    private void whileLoop(WhileNode node) throws CompilationException {
        SourceInfo at = node.sourceInfo();
        int loopStart = scope.chunk().size();
        expression(node.condition());
        int exitJump = emitJump(OpCode.JUMP_IF_FALSE, at);
        body(node.body(), at);
        emit(OpCode.POP, at);
        emit(OpCode.JUMP, loopStart, at);
        scope.chunk().patchJump(exitJump, at);
        emit(OpCode.NIL, at);
    }

    /**
     * {@code and}: a DUP JIF end POP b ... end.
     * {@code or}: a DUP JIF next JUMP end next: POP b ... end.
     */
    private void logical(LogicalNode node) throws CompilationException {
        SourceInfo at = node.sourceInfo();
        List<AstNode> operands = node.operands();
        int[] endJumps = new int[operands.size() - 1];
        for (int i = 0; i < operands.size(); i++) {
            expression(operands.get(i));
            if (i == operands.size() - 1) {
                break;
            }
            emit(OpCode.DUP, at);
            if (node.operator() == LogicalNode.Operator.AND) {
                endJumps[i] = emitJump(OpCode.JUMP_IF_FALSE, at);
            } else {
                int next = emitJump(OpCode.JUMP_IF_FALSE, at);
                endJumps[i] = emitJump(OpCode.JUMP, at);
                scope.chunk().patchJump(next, at);
            }
            emit(OpCode.POP, at);
        }
        for (int endJump : endJumps) {
            scope.chunk().patchJump(endJump, at);
        }
    }

    private void defn(DefnNode node) throws CompilationException {
        String name = requireSymbol(node.name(), "function name").name();
        if (node.params().size() > MAX_ARGUMENTS) {
            throw new CompilationException(CompilerErrorCode.TOO_MANY_ARGUMENTS,
                    String.format("function '%s' declares more than %d parameters", name, MAX_ARGUMENTS), node.sourceInfo());
        }
        warnIfBuiltin(name, node.name().sourceInfo());

        FunctionScope enclosing = scope;
        scope = new FunctionScope(new ChunkBuilder(name));
        LospFunction function;
        try {
            Set<String> seen = new HashSet<>();
            for (AstNode param : node.params()) {
                String paramName = requireSymbol(param, "parameter").name();
                if (!seen.add(paramName)) {
                    throw new CompilationException(CompilerErrorCode.DUPLICATE_PARAMETER,
                            String.format("parameter '%s' of function '%s' is declared twice", paramName, name), param.sourceInfo());
                }
                scope.declareParameter(paramName);
            }
            body(node.body(), node.sourceInfo());
            emit(OpCode.RETURN, node.sourceInfo());
            Chunk chunk = scope.chunk().build();
            function = new LospFunction(name, node.params().size(), chunk);
            LOG.debug("Compiled function '{}' with {} parameter(s): {} bytes, {} constants",
                    name, function.arity(), chunk.size(), chunk.constants().size());
        } finally {
            scope = enclosing;
        }
        emitConstant(function, node.sourceInfo());
        emit(OpCode.SET_GLOBAL, nameConstant(name, node.sourceInfo()), node.sourceInfo());
    }

    private void call(CallNode node) throws CompilationException {
        if (node.callee() instanceof SymbolNode head && scope.resolve(head.name()).isEmpty()) {
            Optional<Builtin> builtin = Builtin.fromSymbol(head.name());
            if (builtin.isPresent()) {
                builtinCall(builtin.get(), node);
                return;
            }
        }
        int argCount = node.arguments().size();
        if (argCount > MAX_ARGUMENTS) {
            throw new CompilationException(CompilerErrorCode.TOO_MANY_ARGUMENTS,
                    String.format("a call passes more than %d arguments", MAX_ARGUMENTS), node.sourceInfo());
        }
        expression(node.callee());
        for (AstNode argument : node.arguments()) {
            expression(argument);
        }
        scope.chunk().emit(OpCode.CALL, argCount, node.sourceInfo());
        scope.adjustStack(-argCount);
    }

    private void builtinCall(Builtin builtin, CallNode node) throws CompilationException {
        SourceInfo at = node.sourceInfo();
        List<AstNode> operands = node.arguments();
        if (!builtin.accepts(operands.size())) {
            throw new CompilationException(CompilerErrorCode.INVALID_OPERAND_COUNT,
                    String.format("'%s' takes %s, got %d", builtin.symbol(), builtin.describeOperandCount(), operands.size()), at);
        }
        expression(operands.get(0));
        if (builtin == Builtin.SUBTRACT && operands.size() == 1) {
            emit(OpCode.NEGATE, at);
            return;
        }
        if (builtin.isVariadic()) {
            for (int i = 1; i < operands.size(); i++) {
                expression(operands.get(i));
                emit(builtin.opCode(), at);
            }
            return;
        }
        for (int i = 1; i < operands.size(); i++) {
            expression(operands.get(i));
        }
        emit(builtin.opCode(), at);
        if (builtin == Builtin.LESS_EQUAL || builtin == Builtin.GREATER_EQUAL) {
            emit(OpCode.NOT, at);
        }
    }

    /**
     * Compiles a sequence whose value is the value of its last expression, or Nil when empty.
     */
    private void body(List<AstNode> expressions, SourceInfo at) throws CompilationException {
        if (expressions.isEmpty()) {
            emit(OpCode.NIL, at);
            return;
        }
        for (int i = 0; i < expressions.size(); i++) {
            expression(expressions.get(i));
            if (i < expressions.size() - 1) {
                emit(OpCode.POP, at);
            }
        }
    }

    private SymbolNode requireSymbol(AstNode node, String role) throws CompilationException {
        if (node instanceof SymbolNode symbol) {
            return symbol;
        }
        throw new CompilationException(CompilerErrorCode.EXPECTED_SYMBOL,
                String.format("%s must be a symbol, found %s", role, describe(node)), node.sourceInfo());
    }

    private static String describe(AstNode node) {
        if (node instanceof LiteralNode) {
            return "'" + node.token().text() + "'";
        }
        return "a list";
    }

    private void warnIfBuiltin(String name, SourceInfo at) {
        if (Builtin.fromSymbol(name).isPresent()) {
            diagnostics.reportWarning(String.format(
                    "global '%s' can only be read as a value; calls to '%s' use the built-in operator", name, name), at);
        }
    }

    private int nameConstant(String name, SourceInfo at) throws CompilationException {
        return scope.chunk().addConstant(new StringValue(name), at);
    }

    private void emitConstant(Value value, SourceInfo at) throws CompilationException {
        emit(OpCode.CONSTANT, scope.chunk().addConstant(value, at), at);
    }

    private void emit(OpCode op, SourceInfo at) throws CompilationException {
        scope.chunk().emit(op, at);
        scope.adjustStack(op.stackEffect());
    }

    private void emit(OpCode op, int operand, SourceInfo at) throws CompilationException {
        scope.chunk().emit(op, operand, at);
        scope.adjustStack(op.stackEffect());
    }

    private int emitJump(OpCode op, SourceInfo at) throws CompilationException {
        int operandOffset = scope.chunk().emitJump(op, at);
        scope.adjustStack(op.stackEffect());
        return operandOffset;
    }
}
