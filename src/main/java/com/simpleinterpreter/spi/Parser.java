package com.simpleinterpreter.spi;

import java.util.ArrayList;
import java.util.List;

import static com.simpleinterpreter.spi.TokenType.*;

/*
 * Grammar:
 * low prec
 * to
 * high prec
 *
 * program              : PROGRAM variable SEMI block DOT ;
 * block                : declarations compound_statement ;
 * declarations         : ( VAR ( variable_declaration SEMI )+ )* ;
 * variable_declaration : ID ( COMMA ID )* COLON type_spec ;
 * type_spec            : INTEGER | REAL ;
 * compound_statement   : BEGIN statement_list END ;
 * statement_list       : statement ( SEMI statement )* ;
 * statement            : compound_statement
 *                      | assignment_statement
 *                      | empty ;
 * assignment_statement : variable ASSIGN expr ;
 * empty                : ;
 * expr                 : term ( ( PLUS | MINUS ) term )* ;
 * term                 : factor ( ( MULTIPLY | INTEGER_DIVIDE | FLOAT_DIVIDE ) factor )* ;
 * factor               : ( PLUS | MINUS ) factor
 *                      | INTEGER_CONST
 *                      | REAL_CONST
 *                      | LPAREN expr RPAREN
 *                      | variable ;
 * variable             : ID ;
 */

public class Parser {
    private final Lexer lexer;
    private Token currentTok;
    private Token prevTok = null;

    public Parser(Lexer lexer) {
        this.lexer = lexer;
        this.currentTok = lexer.nextToken();
    }

    public static Parser newFromSource(String source) {
        return new Parser(new Lexer(source));
    }

    public Node.Program parse() {
        Node.Program program = program();
        eat(EOF);
        return program;
    }

    // the bare arithmetic dialect: a single expression and nothing after it
    public Node parseExpression() {
        Node expr = expr();
        eat(EOF);
        return expr;
    }

    private Node.Program program() {
        eat(PROGRAM);
        Node.Var name = variable();
        eat(SEMI);
        Node.Block block = block();
        eat(DOT);
        return new Node.Program(name.token, block);
    }

    private Node.Block block() {
        List<Node.VarDecl> declarations = declarations();
        Node.Compound compound = compoundStatement();
        return new Node.Block(declarations, compound);
    }

    private List<Node.VarDecl> declarations() {
        List<Node.VarDecl> declarations = new ArrayList<>();
        while (matchAny(VAR)) {
            // at least one declaration per VAR section
            do {
                declarations.addAll(variableDeclaration());
                eat(SEMI);
            } while (checkTok(ID));
        }
        return declarations;
    }

    private List<Node.VarDecl> variableDeclaration() {
        List<Node.Var> vars = new ArrayList<>();
        vars.add(variable());
        while (matchAny(COMMA)) {
            vars.add(variable());
        }
        eat(COLON);
        Token typeTok = typeSpec();

        List<Node.VarDecl> decls = new ArrayList<>();
        for (Node.Var var : vars) {
            decls.add(new Node.VarDecl(var, new Node.Type(typeTok)));
        }
        return decls;
    }

    private Token typeSpec() {
        if (matchAny(INTEGER, REAL)) {
            return prevTok;
        }
        throw new SyntaxError(currentTok, null,
                "Expected type INTEGER or REAL, got " + currentTok.type + " '" + currentTok.lexeme + "'");
    }

    private Node.Compound compoundStatement() {
        Token begin = eat(BEGIN);
        List<Node> statements = statementList();
        eat(END);
        return new Node.Compound(begin, statements);
    }

    private List<Node> statementList() {
        List<Node> statements = new ArrayList<>();
        statements.add(statement());
        while (matchAny(SEMI)) {
            statements.add(statement());
        }
        return statements;
    }

    private Node statement() {
        if (checkTok(BEGIN)) return compoundStatement();
        if (checkTok(ID)) return assignmentStatement();
        return new Node.NoOp();
    }

    private Node.Assign assignmentStatement() {
        Node.Var var = variable();
        Token assign = eat(ASSIGN);
        return new Node.Assign(var, assign, expr());
    }

    private Node.Var variable() {
        return new Node.Var(eat(ID));
    }

    private Node expr() {
        Node node = term();
        while (matchAny(PLUS, MINUS)) {
            Token op = prevTok;
            node = new Node.BinOp(node, op, term());
        }
        return node;
    }

    private Node term() {
        Node node = factor();
        while (matchAny(MULTIPLY, INTEGER_DIVIDE, FLOAT_DIVIDE)) {
            Token op = prevTok;
            node = new Node.BinOp(node, op, factor());
        }
        return node;
    }

    private Node factor() {
        if (matchAny(PLUS, MINUS)) {
            Token op = prevTok;
            return new Node.UnaryOp(op, factor());
        }
        if (matchAny(INTEGER_CONST, REAL_CONST)) {
            return new Node.Num(prevTok);
        }
        if (matchAny(LPAREN)) {
            Node node = expr();
            eat(RPAREN);
            return node;
        }
        if (checkTok(ID)) {
            return variable();
        }
        throw new SyntaxError(currentTok, null,
                "Expected expression, got " + currentTok.type + " '" + currentTok.lexeme + "'");
    }

    // Advances past the current token if it has the expected kind.
    private Token eat(TokenType ttype) {
        if (checkTok(ttype)) {
            return advance();
        }
        throw new SyntaxError(currentTok, ttype,
                "Expected " + ttype + ", got " + currentTok.type + " '" + currentTok.lexeme + "'");
    }

    private boolean matchAny(TokenType... ttypes) {
        for (TokenType ttype : ttypes) {
            if (checkTok(ttype)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean checkTok(TokenType ttype) {
        return currentTok.type == ttype;
    }

    private Token advance() {
        prevTok = currentTok;
        if (currentTok.type != EOF) {
            currentTok = lexer.nextToken();
        }
        return prevTok;
    }
}
