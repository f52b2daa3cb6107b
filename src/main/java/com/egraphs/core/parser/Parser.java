/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.parser;

import com.egraphs.core.common.exception.EGException;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static com.egraphs.core.common.exception.ErrorMessage.Syntax.MALFORMED_NUMBER;
import static com.egraphs.core.common.exception.ErrorMessage.Syntax.TRAILING_INPUT;
import static com.egraphs.core.common.exception.ErrorMessage.Syntax.UNEXPECTED_CHARACTER;
import static com.egraphs.core.common.exception.ErrorMessage.Syntax.UNEXPECTED_CLOSE;
import static com.egraphs.core.common.exception.ErrorMessage.Syntax.UNTERMINATED_LIST;
import static com.egraphs.core.common.exception.ErrorMessage.Syntax.UNTERMINATED_STRING;

/**
 * Reads one s-expression of symbols, numbers, double-quoted strings and {@code =}.
 */
public class Parser {

    private final String text;
    private int offset;

    private Parser(String text) {
        this.text = text;
        this.offset = 0;
    }

    /**
     * @return the single sentence in the text, or null if the text holds only whitespace
     */
    @Nullable
    public static SyntaxTree parse(String text) {
        Parser parser = new Parser(text);
        parser.skipWhitespace();
        if (parser.atEnd()) return null;
        SyntaxTree tree = parser.readForm();
        parser.skipWhitespace();
        if (!parser.atEnd()) throw EGException.of(TRAILING_INPUT, parser.offset);
        return tree;
    }

    private SyntaxTree readForm() {
        char c = text.charAt(offset);
        if (c == '(') return readCompound();
        else if (c == ')') throw EGException.of(UNEXPECTED_CLOSE, offset);
        else return readToken();
    }

    private SyntaxTree.Compound readCompound() {
        int start = offset++;
        List<SyntaxTree> children = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (atEnd()) throw EGException.of(UNTERMINATED_LIST, start);
            if (text.charAt(offset) == ')') {
                offset++;
                return SyntaxTree.Compound.of(children);
            }
            children.add(readForm());
        }
    }

    private SyntaxTree.Token readToken() {
        char c = text.charAt(offset);
        if (c == '"') return readString();
        else if (c == '=') {
            offset++;
            return SyntaxTree.Token.equalsSign();
        } else if (isNumberStart()) return readNumber();
        else if (isSymbolStart(c)) return readSymbol();
        else throw EGException.of(UNEXPECTED_CHARACTER, c, offset);
    }

    private SyntaxTree.Token readString() {
        int start = offset++;
        while (!atEnd()) {
            char c = text.charAt(offset++);
            if (c == '\\') {
                if (atEnd()) break;
                offset++;
            } else if (c == '"') {
                return SyntaxTree.Token.string(text.substring(start, offset));
            }
        }
        throw EGException.of(UNTERMINATED_STRING, start);
    }

    private SyntaxTree.Token readNumber() {
        int start = offset;
        int digits = skipDigits();
        if (!atEnd() && text.charAt(offset) == '.') {
            offset++;
            digits += skipDigits();
        }
        // either side of the point may be empty, but not both
        if (digits == 0) throw EGException.of(MALFORMED_NUMBER, text.substring(start, offset), start);
        if (!atEnd() && (text.charAt(offset) == 'e' || text.charAt(offset) == 'E')) {
            offset++;
            if (!atEnd() && (text.charAt(offset) == '+' || text.charAt(offset) == '-')) offset++;
            if (skipDigits() == 0) throw EGException.of(MALFORMED_NUMBER, text.substring(start, offset), start);
        }
        if (!atEnd() && (isSymbolPart(text.charAt(offset)) || text.charAt(offset) == '.')) {
            throw EGException.of(MALFORMED_NUMBER, text.substring(start, offset + 1), start);
        }
        return SyntaxTree.Token.number(text.substring(start, offset));
    }

    private SyntaxTree.Token readSymbol() {
        int start = offset;
        while (!atEnd() && isSymbolPart(text.charAt(offset))) offset++;
        return SyntaxTree.Token.symbol(text.substring(start, offset));
    }

    private int skipDigits() {
        int start = offset;
        while (!atEnd() && isDigit(text.charAt(offset))) offset++;
        return offset - start;
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(offset))) offset++;
    }

    private boolean isNumberStart() {
        char c = text.charAt(offset);
        if (c == '.') return offset + 1 < text.length() && isDigit(text.charAt(offset + 1));
        return isDigit(c);
    }

    private boolean atEnd() {
        return offset >= text.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isSymbolStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isSymbolPart(char c) {
        return isSymbolStart(c) || isDigit(c);
    }
}
