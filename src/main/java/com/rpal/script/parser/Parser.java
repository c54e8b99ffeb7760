package com.rpal.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.rpal.script.RpalRuntimeException;

/**
 * Recursive-descent parser for the RPAL phrase-structure grammar. Produces the raw,
 * un-standardized tree; the node shapes are the ones {@link Standardizer} rewrites.
 */
public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public TreeNode parse() {
        if (check(TokenType.EOF)) throw error(peek(), "Empty program.");
        TreeNode program = expression();
        if (!check(TokenType.EOF)) throw error(peek(), "Unexpected '" + peek().lexeme + "' after end of program.");
        return program;
    }

    // -------------------------
    // Expressions
    // -------------------------

    // E -> 'let' D 'in' E | 'fn' Vb+ '.' E | Ew
    private TreeNode expression() {
        if (match("let")) {
            TreeNode def = definition();
            consume("in", "Expect 'in' after let definition.");
            return TreeNode.of(NodeType.LET, def, expression());
        }
        if (match("fn")) {
            List<TreeNode> parts = new ArrayList<>();
            while (startsBinding()) parts.add(bindingVariable());
            if (parts.isEmpty()) throw error(peek(), "Expect identifier or '(' after 'fn'.");
            consume(".", "Expect '.' after lambda parameters.");
            parts.add(expression());
            return TreeNode.of(NodeType.LAMBDA, parts);
        }
        return whereExpression();
    }

    // Ew -> T 'where' Dr | T
    private TreeNode whereExpression() {
        TreeNode expr = tuple();
        if (match("where")) {
            return TreeNode.of(NodeType.WHERE, expr, recursiveDefinition());
        }
        return expr;
    }

    // T -> Ta (',' Ta)+ | Ta
    private TreeNode tuple() {
        TreeNode first = augment();
        if (!check(",")) return first;

        List<TreeNode> items = new ArrayList<>();
        items.add(first);
        while (match(",")) items.add(augment());
        return TreeNode.of(NodeType.TAU, items);
    }

    // Ta -> Ta 'aug' Tc | Tc
    private TreeNode augment() {
        TreeNode expr = conditional();
        while (match("aug")) {
            expr = TreeNode.of(NodeType.AUG, expr, conditional());
        }
        return expr;
    }

    // Tc -> B '->' Tc '|' Tc | B
    private TreeNode conditional() {
        TreeNode cond = or();
        if (match("->")) {
            TreeNode then = conditional();
            consume("|", "Expect '|' in conditional expression.");
            return TreeNode.of(NodeType.CONDITIONAL, cond, then, conditional());
        }
        return cond;
    }

    // B -> B 'or' Bt | Bt
    private TreeNode or() {
        TreeNode expr = and();
        while (match("or")) {
            expr = TreeNode.of(NodeType.OR, expr, and());
        }
        return expr;
    }

    // Bt -> Bt '&' Bs | Bs
    private TreeNode and() {
        TreeNode expr = not();
        while (match("&")) {
            expr = TreeNode.of(NodeType.AMP, expr, not());
        }
        return expr;
    }

    // Bs -> 'not' Bp | Bp
    private TreeNode not() {
        if (match("not")) return TreeNode.of(NodeType.NOT, comparison());
        return comparison();
    }

    // Bp -> A ('gr' | 'ge' | 'ls' | 'le' | 'eq' | 'ne' | '>' | '>=' | '<' | '<=') A | A
    private TreeNode comparison() {
        TreeNode left = arithmetic();
        Token op = peek();
        if (op.type == TokenType.KEYWORD || op.type == TokenType.OPERATOR) {
            NodeType rel = NodeType.forOperator(op.lexeme);
            if (rel != null && rel.ordinal() >= NodeType.GR.ordinal() && rel.ordinal() <= NodeType.NE.ordinal()) {
                advance();
                return TreeNode.of(rel, left, arithmetic());
            }
        }
        return left;
    }

    // A -> A '+' At | A '-' At | '+' At | '-' At | At
    private TreeNode arithmetic() {
        TreeNode expr;
        if (match("+")) {
            expr = term();
        } else if (match("-")) {
            expr = TreeNode.of(NodeType.NEG, term());
        } else {
            expr = term();
        }

        while (check("+") || check("-")) {
            NodeType op = NodeType.forOperator(advance().lexeme);
            expr = TreeNode.of(op, expr, term());
        }
        return expr;
    }

    // At -> At '*' Af | At '/' Af | Af
    private TreeNode term() {
        TreeNode expr = factor();
        while (check("*") || check("/")) {
            NodeType op = NodeType.forOperator(advance().lexeme);
            expr = TreeNode.of(op, expr, factor());
        }
        return expr;
    }

    // Af -> Ap '**' Af | Ap   (right associative)
    private TreeNode factor() {
        TreeNode base = infix();
        if (match("**")) {
            return TreeNode.of(NodeType.EXP, base, factor());
        }
        return base;
    }

    // Ap -> Ap '@' <IDENTIFIER> R | R
    private TreeNode infix() {
        TreeNode expr = application();
        while (match("@")) {
            Token name = consume(TokenType.IDENTIFIER, "Expect identifier after '@'.");
            expr = TreeNode.of(NodeType.AT, expr, TreeNode.identifier(name.lexeme), application());
        }
        return expr;
    }

    // R -> R Rn | Rn
    private TreeNode application() {
        TreeNode expr = operand();
        while (startsOperand()) {
            expr = TreeNode.of(NodeType.GAMMA, expr, operand());
        }
        return expr;
    }

    // Rn -> <IDENTIFIER> | <INTEGER> | <STRING> | 'true' | 'false' | 'nil' | '(' E ')' | 'dummy'
    private TreeNode operand() {
        Token t = peek();
        switch (t.type) {
            case IDENTIFIER:
                advance();
                return TreeNode.identifier(t.lexeme);
            case INTEGER:
                advance();
                return TreeNode.leaf(NodeType.INTEGER, t.lexeme);
            case STRING:
                advance();
                return TreeNode.string(t.lexeme.substring(1, t.lexeme.length() - 1));
            default:
                break;
        }
        if (match("true")) return TreeNode.leaf(NodeType.TRUE);
        if (match("false")) return TreeNode.leaf(NodeType.FALSE);
        if (match("nil")) return TreeNode.leaf(NodeType.NIL);
        if (match("dummy")) return TreeNode.leaf(NodeType.DUMMY);
        if (match("(")) {
            TreeNode inner = expression();
            consume(")", "Expect ')' after expression.");
            return inner;
        }
        throw error(t, "Expect literal, identifier or '('.");
    }

    // -------------------------
    // Definitions
    // -------------------------

    // D -> Da 'within' D | Da
    private TreeNode definition() {
        TreeNode def = simultaneousDefinition();
        if (match("within")) {
            return TreeNode.of(NodeType.WITHIN, def, definition());
        }
        return def;
    }

    // Da -> Dr ('and' Dr)+ | Dr
    private TreeNode simultaneousDefinition() {
        TreeNode first = recursiveDefinition();
        if (!check("and")) return first;

        List<TreeNode> defs = new ArrayList<>();
        defs.add(first);
        while (match("and")) defs.add(recursiveDefinition());
        return TreeNode.of(NodeType.AND, defs);
    }

    // Dr -> 'rec' Db | Db
    private TreeNode recursiveDefinition() {
        if (match("rec")) return TreeNode.of(NodeType.REC, basicDefinition());
        return basicDefinition();
    }

    // Db -> Vl '=' E | <IDENTIFIER> Vb+ '=' E | '(' D ')'
    private TreeNode basicDefinition() {
        if (match("(")) {
            TreeNode inner = definition();
            consume(")", "Expect ')' after definition.");
            return inner;
        }

        Token name = consume(TokenType.IDENTIFIER, "Expect identifier at start of definition.");
        TreeNode id = TreeNode.identifier(name.lexeme);

        if (check(",") || check("=")) {
            TreeNode lhs = variableList(id);
            consume("=", "Expect '=' in definition.");
            return TreeNode.of(NodeType.EQUAL, lhs, expression());
        }

        List<TreeNode> parts = new ArrayList<>();
        parts.add(id);
        while (startsBinding()) parts.add(bindingVariable());
        if (parts.size() == 1) throw error(peek(), "Expect parameter or '=' after '" + name.lexeme + "'.");
        consume("=", "Expect '=' after function parameters.");
        parts.add(expression());
        return TreeNode.of(NodeType.FCN_FORM, parts);
    }

    // Vb -> <IDENTIFIER> | '(' Vl ')' | '(' ')'
    private TreeNode bindingVariable() {
        if (match("(")) {
            if (match(")")) return TreeNode.leaf(NodeType.EMPTY_PARAMS);
            Token first = consume(TokenType.IDENTIFIER, "Expect identifier or ')'.");
            TreeNode list = variableList(TreeNode.identifier(first.lexeme));
            consume(")", "Expect ')' after parameter list.");
            return list;
        }
        Token name = consume(TokenType.IDENTIFIER, "Expect identifier or '('.");
        return TreeNode.identifier(name.lexeme);
    }

    // Vl -> <IDENTIFIER> (',' <IDENTIFIER>)*   (first identifier already consumed)
    private TreeNode variableList(TreeNode first) {
        if (!check(",")) return first;

        List<TreeNode> names = new ArrayList<>();
        names.add(first);
        while (match(",")) {
            Token name = consume(TokenType.IDENTIFIER, "Expect identifier after ','.");
            names.add(TreeNode.identifier(name.lexeme));
        }
        return TreeNode.of(NodeType.COMMA, names);
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private boolean startsBinding() {
        return check(TokenType.IDENTIFIER) || check("(");
    }

    private boolean startsOperand() {
        Token t = peek();
        switch (t.type) {
            case IDENTIFIER: case INTEGER: case STRING:
                return true;
            default:
                return t.is("true") || t.is("false") || t.is("nil") || t.is("dummy") || t.is("(");
        }
    }

    private boolean match(String lexeme) {
        if (check(lexeme)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(String lexeme) {
        return peek().is(lexeme);
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private Token consume(String lexeme, String message) {
        if (check(lexeme)) return advance();
        throw error(peek(), message);
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private RpalRuntimeException error(Token token, String message) {
        String where = token.type == TokenType.EOF ? "at end" : "at '" + token.lexeme + "'";
        return RpalRuntimeException.syntax(token.line, message + " (" + where + ")");
    }
}
