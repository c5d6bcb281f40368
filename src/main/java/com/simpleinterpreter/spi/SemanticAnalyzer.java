package com.simpleinterpreter.spi;

/**
 * Builds the symbol table of a program and checks that every name used is
 * declared exactly once. Runs before the program is interpreted.
 */
public class SemanticAnalyzer implements Node.Visitor<Void> {
    private final boolean verbose;
    private SymbolTable symbols = null;

    public SemanticAnalyzer(boolean verbose) {
        this.verbose = verbose;
    }

    public SymbolTable analyze(Node.Program program) {
        program.accept(this);
        return symbols;
    }

    @Override
    public Void visitProgramNode(Node.Program node) {
        symbols = new SymbolTable(node.name.lexeme, 1, verbose);
        node.block.accept(this);
        return null;
    }

    @Override
    public Void visitBlockNode(Node.Block node) {
        for (Node.VarDecl decl : node.declarations) {
            decl.accept(this);
        }
        node.compoundStatement.accept(this);
        return null;
    }

    @Override
    public Void visitVarDeclNode(Node.VarDecl node) {
        Symbol type = symbols.lookup(node.type.name);
        if (type == null) {
            throw new NameError(node.type.token, "Unknown type '" + node.type.token.lexeme + "'.");
        }
        String name = node.variable.name();
        if (symbols.lookup(name) != null) {
            throw new NameError(node.variable.token, "Duplicate identifier '" + name + "'.");
        }
        symbols.define(new Symbol.Variable(name, type));
        return null;
    }

    @Override
    public Void visitTypeNode(Node.Type node) {
        return null;
    }

    @Override
    public Void visitCompoundNode(Node.Compound node) {
        for (Node statement : node.statements) {
            statement.accept(this);
        }
        return null;
    }

    @Override
    public Void visitAssignNode(Node.Assign node) {
        node.expr.accept(this);
        node.variable.accept(this);
        return null;
    }

    @Override
    public Void visitNoOpNode(Node.NoOp node) {
        return null;
    }

    @Override
    public Void visitVarNode(Node.Var node) {
        if (!(symbols.lookup(node.name()) instanceof Symbol.Variable)) {
            throw new NameError(node.token, "Undeclared variable '" + node.name() + "'.");
        }
        return null;
    }

    @Override
    public Void visitBinOpNode(Node.BinOp node) {
        node.left.accept(this);
        node.right.accept(this);
        return null;
    }

    @Override
    public Void visitUnaryOpNode(Node.UnaryOp node) {
        node.expr.accept(this);
        return null;
    }

    @Override
    public Void visitNumNode(Node.Num node) {
        return null;
    }
}
