package org.losp.compiler.frontend;

import org.losp.compiler.api.CompilationException;
import org.losp.compiler.api.CompilerErrorCode;
import org.losp.compiler.diagnostics.Diagnostic;
import org.losp.compiler.diagnostics.DiagnosticsEngine;
import org.losp.compiler.frontend.lexer.Lexer;
import org.losp.compiler.frontend.parser.Parser;
import org.losp.compiler.frontend.parser.ast.AstNode;
import org.losp.compiler.frontend.parser.ast.CallNode;
import org.losp.compiler.frontend.parser.ast.DefNode;
import org.losp.compiler.frontend.parser.ast.DefnNode;
import org.losp.compiler.frontend.parser.ast.IfNode;
import org.losp.compiler.frontend.parser.ast.LetNode;
import org.losp.compiler.frontend.parser.ast.LiteralNode;
import org.losp.compiler.frontend.parser.ast.LogicalNode;
import org.losp.compiler.frontend.parser.ast.SymbolNode;
import org.losp.compiler.frontend.parser.ast.WhenNode;
import org.losp.runtime.model.BoolValue;
import org.losp.runtime.model.FloatValue;
import org.losp.runtime.model.IntValue;
import org.losp.runtime.model.NilValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Parser}: the tree shapes it builds and
 * how it recovers from malformed forms.
 */
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private List<AstNode> parse(String source) {
        diagnostics = new DiagnosticsEngine();
        return new Parser(new Lexer(source, "test.losp"), diagnostics).parse();
    }

    private List<CompilerErrorCode> errorCodes() {
        return diagnostics.getDiagnostics().stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .map(Diagnostic::code)
                .toList();
    }

    @Test
    @Tag("unit")
    void testAtomsBecomeLiteralsAndSymbols() {
        List<AstNode> forms = parse("42 2.5 \"s\" nil true false pi");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(forms).hasSize(7);
        assertThat(((LiteralNode) forms.get(0)).value()).isEqualTo(new IntValue(42));
        assertThat(((LiteralNode) forms.get(1)).value()).isEqualTo(new FloatValue(2.5));
        assertThat(((LiteralNode) forms.get(3)).value()).isEqualTo(NilValue.INSTANCE);
        assertThat(((LiteralNode) forms.get(4)).value()).isEqualTo(BoolValue.TRUE);
        assertThat(forms.get(6)).isInstanceOf(SymbolNode.class);
        assertThat(((SymbolNode) forms.get(6)).name()).isEqualTo("pi");
    }

    /**
     * Verifies the structure of a function definition: name, parameter list and body.
     */
    @Test
    @Tag("unit")
    void testDefnStructure() {
        // Act
        List<AstNode> forms = parse("(defn foo (a b) (+ a b))");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        DefnNode defn = (DefnNode) forms.get(0);
        assertThat(((SymbolNode) defn.name()).name()).isEqualTo("foo");
        assertThat(defn.params()).extracting(p -> ((SymbolNode) p).name()).containsExactly("a", "b");
        assertThat(defn.body()).singleElement().isInstanceOf(CallNode.class);
        CallNode call = (CallNode) defn.body().get(0);
        assertThat(((SymbolNode) call.callee()).name()).isEqualTo("+");
        assertThat(call.arguments()).hasSize(2);
        assertThat(defn.sourceInfo().columnNumber()).isEqualTo(2);
    }

    /**
     * A parenthesised binding and a bare name followed by its initializer can be mixed.
     */
    @Test
    @Tag("unit")
    void testLetBindingListIsReadPairwise() {
        // Act
        List<AstNode> forms = parse("(let ((a 1) b 1) (= a b))");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        LetNode let = (LetNode) forms.get(0);
        assertThat(let.bindings()).hasSize(2);
        assertThat(((SymbolNode) let.bindings().get(0).target()).name()).isEqualTo("a");
        assertThat(let.bindings().get(0).initializers()).hasSize(1);
        assertThat(((SymbolNode) let.bindings().get(1).target()).name()).isEqualTo("b");
        assertThat(let.bindings().get(1).initializers()).hasSize(1);
        assertThat(let.body()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testSpecialFormsAndApplications() {
        List<AstNode> forms = parse("(if c 1 2) (when c) (and a b) (def x 1) ((f) 1)");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(forms.get(0)).isInstanceOf(IfNode.class);
        assertThat(((WhenNode) forms.get(1)).body()).isEmpty();
        assertThat(((LogicalNode) forms.get(2)).operator()).isEqualTo(LogicalNode.Operator.AND);
        assertThat(forms.get(3)).isInstanceOf(DefNode.class);
        CallNode call = (CallNode) forms.get(4);
        assertThat(call.callee()).isInstanceOf(CallNode.class);
    }

    /**
     * A malformed form is reported and skipped; the forms after it are still parsed.
     */
    @Test
    @Tag("unit")
    void testRecoveryAfterMalformedForm() {
        // Act
        List<AstNode> forms = parse("(if 1 2) (def x (+ 1 2.3.4)) ) 7");

        // Assert
        assertThat(errorCodes()).containsExactly(
                CompilerErrorCode.INVALID_FORM_ARITY,
                CompilerErrorCode.MALFORMED_NUMBER,
                CompilerErrorCode.UNEXPECTED_TOKEN);
        assertThat(forms).singleElement().isInstanceOf(LiteralNode.class);
        assertThat(((LiteralNode) forms.get(0)).value()).isEqualTo(new IntValue(7));
    }

    @Test
    @Tag("unit")
    void testStructuralErrors() {
        parse("()");
        assertThat(errorCodes()).containsExactly(CompilerErrorCode.EMPTY_FORM);

        parse("(+ 1 (* 2 3)");
        assertThat(errorCodes()).containsExactly(CompilerErrorCode.UNEXPECTED_END_OF_INPUT);

        parse("(defn f)");
        assertThat(errorCodes()).containsExactly(CompilerErrorCode.INVALID_FORM_ARITY);

        parse("(defn f x x)");
        assertThat(errorCodes()).containsExactly(CompilerErrorCode.UNEXPECTED_TOKEN);

        parse("(def x)");
        assertThat(errorCodes()).containsExactly(CompilerErrorCode.INVALID_FORM_ARITY);

        parse("(or)");
        assertThat(errorCodes()).containsExactly(CompilerErrorCode.INVALID_FORM_ARITY);

        parse("(while)");
        assertThat(errorCodes()).containsExactly(CompilerErrorCode.INVALID_FORM_ARITY);

        parse("def");
        assertThat(errorCodes()).containsExactly(CompilerErrorCode.UNEXPECTED_TOKEN);

        parse("(print \"unterminated)");
        assertThat(errorCodes()).containsExactly(CompilerErrorCode.UNTERMINATED_STRING);
    }

    /**
     * Shape checks that need meaning are left to the compiler, so these parse cleanly.
     */
    @Test
    @Tag("unit")
    void testNameChecksAreNotParseErrors() {
        List<AstNode> forms = parse("(def 1 2) (let ((a)) a) (defn f (1) 1)");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(forms).hasSize(3);
    }

    /**
     * {@link Parser#parseForm()} yields one form at a time and throws for a malformed one.
     */
    @Test
    @Tag("unit")
    void testParseFormOneAtATime() throws CompilationException {
        // Arrange
        Parser parser = new Parser(new Lexer("1 (if) 2"), new DiagnosticsEngine());

        // Act & Assert
        assertThat(parser.hasNextForm()).isTrue();
        assertThat(parser.parseForm()).isInstanceOf(LiteralNode.class);
        assertThatThrownBy(parser::parseForm)
                .isInstanceOf(CompilationException.class)
                .extracting(e -> ((CompilationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.INVALID_FORM_ARITY);
        assertThat(((LiteralNode) parser.parseForm()).value()).isEqualTo(new IntValue(2));
        assertThat(parser.hasNextForm()).isFalse();
    }
}
