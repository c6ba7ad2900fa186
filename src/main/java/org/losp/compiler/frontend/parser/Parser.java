package org.losp.compiler.frontend.parser;

import org.losp.compiler.api.CompilationException;
import org.losp.compiler.api.CompilerErrorCode;
import org.losp.compiler.diagnostics.DiagnosticsEngine;
import org.losp.compiler.frontend.lexer.Keyword;
import org.losp.compiler.frontend.lexer.Token;
import org.losp.compiler.frontend.lexer.TokenType;
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
import org.losp.runtime.model.BoolValue;
import org.losp.runtime.model.FloatValue;
import org.losp.runtime.model.IntValue;
import org.losp.runtime.model.NilValue;
import org.losp.runtime.model.StringValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Builds one AST per top-level form from the token stream of a
 * {@link org.losp.compiler.frontend.lexer.Lexer}. Tokens are pulled on demand,
 * so forms can be parsed one at a time.
 * <p>
 * The parser is purely structural. It checks parenthesis balance and the
 * number of sub-forms of each special form, but leaves the meaning of names,
 * binding shapes and operator arities to the compiler. After an error the
 * rest of the offending top-level form is skipped and parsing resumes with the
 * next one.
 */
public class Parser {

    private final Iterator<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private Token current;
    private int depth = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The token sequence, ending with {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine that {@link #parse()} reports errors to.
     */
    public Parser(Iterable<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens.iterator();
        this.diagnostics = diagnostics;
        this.current = this.tokens.next();
    }

    /**
     * Parses all remaining forms. Malformed forms are reported to the
     * diagnostics engine and left out of the result.
     * @return The well-formed top-level forms, in source order.
     */
    public List<AstNode> parse() {
        List<AstNode> forms = new ArrayList<>();
        while (hasNextForm()) {
            try {
                forms.add(parseForm());
            } catch (CompilationException e) {
                diagnostics.reportError(e);
            }
        }
        return forms;
    }

    /**
     * @return {@code true} if there is input left before the end of the text.
     */
    public boolean hasNextForm() {
        return !isAtEnd();
    }

    /**
     * Parses the next top-level form.
     * @return The form.
     * @throws CompilationException if the form is malformed; the parser is then positioned after it.
     */
    public AstNode parseForm() throws CompilationException {
        try {
            return form();
        } catch (CompilationException e) {
            synchronize();
            throw e;
        }
    }

    private AstNode form() throws CompilationException {
        Token token = peek();
        switch (token.type()) {
            case LEFT_PAREN:
                return list();
            case INTEGER:
                advance();
                return new LiteralNode(token, new IntValue((Long) token.value()));
            case FLOAT:
                advance();
                return new LiteralNode(token, new FloatValue((Double) token.value()));
            case STRING:
                advance();
                return new LiteralNode(token, new StringValue((String) token.value()));
            case SYMBOL:
                advance();
                return new SymbolNode(token);
            case KEYWORD:
                return keywordAtom(token);
            case RIGHT_PAREN:
                throw error(CompilerErrorCode.UNEXPECTED_TOKEN, "unexpected ')'", token);
            case ERROR:
                throw lexError(token);
            default:
                throw error(CompilerErrorCode.UNEXPECTED_END_OF_INPUT, "unexpected end of input", token);
        }
    }

    private AstNode keywordAtom(Token token) throws CompilationException {
        switch ((Keyword) token.value()) {
            case NIL:
                advance();
                return new LiteralNode(token, NilValue.INSTANCE);
            case TRUE:
                advance();
                return new LiteralNode(token, BoolValue.TRUE);
            case FALSE:
                advance();
                return new LiteralNode(token, BoolValue.FALSE);
            default:
                throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                        "'" + token.text() + "' can only appear at the head of a form", token);
        }
    }

    private AstNode list() throws CompilationException {
        Token open = advance();
        Token head = peek();
        if (head.type() == TokenType.RIGHT_PAREN) {
            throw error(CompilerErrorCode.EMPTY_FORM, "empty form '()'", open);
        }
        if (head.type() == TokenType.KEYWORD) {
            Keyword keyword = (Keyword) head.value();
            switch (keyword) {
                case DEF:
                    advance();
                    return def(open, head);
                case LET:
                    advance();
                    return let(open, head);
                case IF:
                    advance();
                    return ifForm(open, head);
                case WHEN: {
                    advance();
                    List<AstNode> parts = elements(open);
                    requireAtLeast(parts, 1, head, "a condition");
                    close();
                    return new WhenNode(head, parts.get(0), parts.subList(1, parts.size()));
                }
                case WHILE: {
                    advance();
                    List<AstNode> parts = elements(open);
                    requireAtLeast(parts, 1, head, "a condition");
                    close();
                    return new WhileNode(head, parts.get(0), parts.subList(1, parts.size()));
                }
                case DO: {
                    advance();
                    List<AstNode> body = elements(open);
                    close();
                    return new DoNode(head, body);
                }
                case DEFN:
                    advance();
                    return defn(open, head);
                case AND:
                case OR: {
                    advance();
                    List<AstNode> operands = elements(open);
                    requireAtLeast(operands, 1, head, "at least one operand");
                    close();
                    return new LogicalNode(head, keyword == Keyword.AND ? LogicalNode.Operator.AND : LogicalNode.Operator.OR, operands);
                }
                default:
                    // nil, true and false in head position are applications
                    break;
            }
        }
        AstNode callee = form();
        List<AstNode> arguments = elements(open);
        close();
        return new CallNode(open, callee, arguments);
    }

    private AstNode def(Token open, Token keyword) throws CompilationException {
        List<AstNode> parts = elements(open);
        if (parts.size() != 2) {
            throw arity(keyword, "a name and a value", parts.size());
        }
        close();
        return new DefNode(keyword, parts.get(0), parts.get(1));
    }

    private AstNode ifForm(Token open, Token keyword) throws CompilationException {
        List<AstNode> parts = elements(open);
        if (parts.size() != 3) {
            throw arity(keyword, "a condition, a then branch and an else branch", parts.size());
        }
        close();
        return new IfNode(keyword, parts.get(0), parts.get(1), parts.get(2));
    }

    private AstNode defn(Token open, Token keyword) throws CompilationException {
        if (check(TokenType.RIGHT_PAREN)) {
            throw arity(keyword, "a name, a parameter list and a body", 0);
        }
        AstNode name = form();
        Token paramsOpen = peek();
        if (paramsOpen.type() == TokenType.RIGHT_PAREN) {
            throw error(CompilerErrorCode.INVALID_FORM_ARITY, "'defn' is missing its parameter list", paramsOpen);
        }
        if (paramsOpen.type() != TokenType.LEFT_PAREN) {
            throw expected("parameter list", paramsOpen);
        }
        advance();
        List<AstNode> params = elements(paramsOpen);
        close();
        List<AstNode> body = elements(open);
        close();
        return new DefnNode(keyword, name, params, body);
    }

    /**
     * Reads the binding list pairwise: an element that opens a parenthesis is a
     * complete {@code (name init)} binding, any other element is a name that
     * takes the next element as its initializer.
     */
    private AstNode let(Token open, Token keyword) throws CompilationException {
        Token bindingsOpen = peek();
        if (bindingsOpen.type() == TokenType.RIGHT_PAREN) {
            throw error(CompilerErrorCode.INVALID_FORM_ARITY, "'let' is missing its binding list", bindingsOpen);
        }
        if (bindingsOpen.type() != TokenType.LEFT_PAREN) {
            throw expected("binding list", bindingsOpen);
        }
        advance();
        List<LetBinding> bindings = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            Token start = peek();
            if (start.type() == TokenType.LEFT_PAREN) {
                advance();
                List<AstNode> parts = elements(start);
                if (parts.isEmpty()) {
                    throw error(CompilerErrorCode.EMPTY_FORM, "empty binding '()'", start);
                }
                close();
                bindings.add(new LetBinding(start, parts.get(0), parts.subList(1, parts.size())));
            } else {
                AstNode target = form();
                List<AstNode> initializers = check(TokenType.RIGHT_PAREN) ? List.of() : List.of(form());
                bindings.add(new LetBinding(start, target, initializers));
            }
        }
        close();
        List<AstNode> body = elements(open);
        close();
        return new LetNode(keyword, bindings, body);
    }

    /**
     * Parses forms up to, but not including, the closing parenthesis of the
     * list opened by {@code open}.
     */
    private List<AstNode> elements(Token open) throws CompilationException {
        List<AstNode> elements = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            if (isAtEnd()) {
                throw error(CompilerErrorCode.UNEXPECTED_END_OF_INPUT,
                        String.format("unexpected end of input: '(' at line %d, column %d is never closed",
                                open.line(), open.column()), peek());
            }
            elements.add(form());
        }
        return elements;
    }

    private void requireAtLeast(List<AstNode> parts, int minimum, Token keyword, String what) throws CompilationException {
        if (parts.size() < minimum) {
            throw arity(keyword, what, parts.size());
        }
    }

    private void close() {
        advance();
    }

    /**
     * Skips the rest of the current top-level form. At top level only the
     * offending token is dropped.
     */
    private void synchronize() {
        if (depth == 0) {
            if (!isAtEnd()) {
                advance();
            }
            return;
        }
        while (depth > 0 && !isAtEnd()) {
            advance();
        }
    }

    private boolean check(TokenType type) {
        return current.type() == type;
    }

    private Token advance() {
        Token token = current;
        if (token.type() == TokenType.LEFT_PAREN) {
            depth++;
        } else if (token.type() == TokenType.RIGHT_PAREN && depth > 0) {
            depth--;
        }
        if (tokens.hasNext()) {
            current = tokens.next();
        }
        return token;
    }

    private boolean isAtEnd() {
        return current.type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return current;
    }

    private CompilationException expected(String what, Token found) {
        if (found.type() == TokenType.ERROR) {
            return lexError(found);
        }
        if (found.type() == TokenType.END_OF_FILE) {
            return error(CompilerErrorCode.UNEXPECTED_END_OF_INPUT, "expected " + what + " but input ended", found);
        }
        return error(CompilerErrorCode.UNEXPECTED_TOKEN, "expected " + what + " but found '" + found.text() + "'", found);
    }

    private CompilationException arity(Token keyword, String expectation, int found) {
        return error(CompilerErrorCode.INVALID_FORM_ARITY,
                String.format("'%s' expects %s, got %d sub-form%s", keyword.text(), expectation, found, found == 1 ? "" : "s"),
                keyword);
    }

    private CompilationException lexError(Token token) {
        CompilerErrorCode code = (CompilerErrorCode) token.value();
        String message;
        switch (code) {
            case MALFORMED_NUMBER:
                message = "malformed number '" + token.text() + "'";
                break;
            case INTEGER_OUT_OF_RANGE:
                message = "integer literal '" + token.text() + "' does not fit into 64 bits";
                break;
            case UNTERMINATED_STRING:
                message = "unterminated string literal";
                break;
            default:
                message = "invalid token '" + token.text() + "'";
                break;
        }
        return error(code, message, token);
    }

    private CompilationException error(CompilerErrorCode code, String message, Token at) {
        return new CompilationException(code, message, at.sourceInfo());
    }
}
