package org.losp.compiler.frontend.lexer;

import org.losp.compiler.api.CompilerErrorCode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Scanning is lazy: tokens are produced one at a time as an iterator is
 * advanced, and every call to {@link #iterator()} starts again from the
 * beginning of the text. The sequence always ends with exactly one
 * {@link TokenType#END_OF_FILE} token.
 * <p>
 * Malformed input does not stop the scan. It becomes an {@link TokenType#ERROR}
 * token whose value is the {@link CompilerErrorCode}; the consumer decides what
 * to do with it.
 */
public class Lexer implements Iterable<Token> {

    private final String source;
    private final String logicalFileName;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this(source, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, String logicalFileName) {
        this.source = source;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, ending with {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    /**
     * @return A fresh scan positioned at the start of the text.
     */
    @Override
    public Iterator<Token> iterator() {
        return new Scan();
    }

    private final class Scan implements Iterator<Token> {

        private int start = 0;
        private int current = 0;
        private int line = 1;
        private int column = 1;
        private int startLine;
        private int startColumn;
        private boolean finished = false;

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public Token next() {
            if (finished) {
                throw new NoSuchElementException("End of input already reached in " + logicalFileName);
            }
            skipWhitespaceAndComments();
            start = current;
            startLine = line;
            startColumn = column;
            if (isAtEnd()) {
                finished = true;
                return new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName);
            }
            char c = advance();
            switch (c) {
                case '(':
                    return token(TokenType.LEFT_PAREN, null);
                case ')':
                    return token(TokenType.RIGHT_PAREN, null);
                case '"':
                    return string();
                default:
                    return atom();
            }
        }

        private void skipWhitespaceAndComments() {
            while (!isAtEnd()) {
                char c = peek();
                if (c == ';') {
                    // A comment goes until the end of the line.
                    while (!isAtEnd() && peek() != '\n') advance();
                } else if (Character.isWhitespace(c)) {
                    advance();
                } else {
                    return;
                }
            }
        }

        private Token string() {
            while (!isAtEnd() && peek() != '"') advance();
            if (isAtEnd()) {
                return token(TokenType.ERROR, CompilerErrorCode.UNTERMINATED_STRING);
            }
            advance(); // closing quote
            return token(TokenType.STRING, source.substring(start + 1, current - 1));
        }

        private Token atom() {
            while (!isAtEnd() && !isDelimiter(peek())) advance();
            String text = source.substring(start, current);
            if (looksNumeric(text)) {
                return number(text);
            }
            return Keyword.fromText(text)
                    .map(keyword -> token(TokenType.KEYWORD, keyword))
                    .orElseGet(() -> token(TokenType.SYMBOL, null));
        }

        private Token number(String text) {
            int digitsFrom = text.charAt(0) == '-' ? 1 : 0;
            int dots = 0;
            for (int i = digitsFrom; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '.') {
                    dots++;
                } else if (!isDigit(c)) {
                    return token(TokenType.ERROR, CompilerErrorCode.MALFORMED_NUMBER);
                }
            }
            if (dots > 1) {
                return token(TokenType.ERROR, CompilerErrorCode.MALFORMED_NUMBER);
            }
            if (dots == 1) {
                return token(TokenType.FLOAT, Double.parseDouble(text));
            }
            try {
                return token(TokenType.INTEGER, Long.parseLong(text));
            } catch (NumberFormatException e) {
                return token(TokenType.ERROR, CompilerErrorCode.INTEGER_OUT_OF_RANGE);
            }
        }

        private Token token(TokenType type, Object value) {
            return new Token(type, source.substring(start, current), value, startLine, startColumn, logicalFileName);
        }

        private char advance() {
            char c = source.charAt(current++);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            return c;
        }

        private char peek() {
            return source.charAt(current);
        }

        private boolean isAtEnd() {
            return current >= source.length();
        }
    }

    /**
     * A run is numeric if it starts with a digit, or with '.' or '-' followed by a
     * digit, or with "-." followed by a digit. A lone '-' or '.' is a symbol.
     */
    private static boolean looksNumeric(String text) {
        int i = 0;
        if (text.charAt(i) == '-') i++;
        if (i < text.length() && text.charAt(i) == '.') i++;
        return i < text.length() && isDigit(text.charAt(i));
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == ';' || c == '"';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
