package com.simpleinterpreter.spi;

import java.util.List;

/**
 * Renders a tree in Lisp notation, e.g. {@code (+ 1 (* 2 3))}. Two trees
 * print the same exactly when they have the same structure.
 */
public class AstPrinter implements Node.Visitor<String> {

    public static String print(Node node) {
        return node.accept(new AstPrinter());
    }

    // parse errors propagate to the caller
    public static String printProgram(String src) {
        return print(Parser.newFromSource(src).parse());
    }

    public static String printExpression(String src) {
        return print(Parser.newFromSource(src).parseExpression());
    }

    @Override
    public String visitProgramNode(Node.Program node) {
        return parenthesize("program " + node.name.lexeme, node.block);
    }

    @Override
    public String visitBlockNode(Node.Block node) {
        StringBuilder builder = new StringBuilder();
        builder.append("(block");
        for (Node.VarDecl decl : node.declarations) {
            builder.append(" ").append(decl.accept(this));
        }
        builder.append(" ").append(node.compoundStatement.accept(this));
        builder.append(")");
        return builder.toString();
    }

    @Override
    public String visitVarDeclNode(Node.VarDecl node) {
        return parenthesize("decl", node.variable, node.type);
    }

    @Override
    public String visitTypeNode(Node.Type node) {
        return node.name;
    }

    @Override
    public String visitCompoundNode(Node.Compound node) {
        return parenthesize("compound", node.statements);
    }

    @Override
    public String visitAssignNode(Node.Assign node) {
        return parenthesize(":=", node.variable, node.expr);
    }

    @Override
    public String visitNoOpNode(Node.NoOp node) {
        return "(noop)";
    }

    @Override
    public String visitVarNode(Node.Var node) {
        return node.name();
    }

    @Override
    public String visitNumNode(Node.Num node) {
        return node.token.lexeme;
    }

    @Override
    public String visitUnaryOpNode(Node.UnaryOp node) {
        return parenthesize(operatorSymbol(node.operator), node.expr);
    }

    @Override
    public String visitBinOpNode(Node.BinOp node) {
        return parenthesize(operatorSymbol(node.operator), node.left, node.right);
    }

    static String operatorSymbol(Token operator) {
        switch (operator.type) {
            case PLUS: return "+";
            case MINUS: return "-";
            case MULTIPLY: return "*";
            case INTEGER_DIVIDE: return "DIV";
            case FLOAT_DIVIDE: return "/";
            default:
                throw new IllegalStateException("Not an operator: " + operator.type);
        }
    }

    private String parenthesize(String name, Node... nodes) {
        return parenthesize(name, List.of(nodes));
    }

    private String parenthesize(String name, List<? extends Node> nodes) {
        StringBuilder builder = new StringBuilder();
        builder.append("(").append(name);
        for (Node node : nodes) {
            builder.append(" ");
            builder.append(node.accept(this));
        }
        builder.append(")");
        return builder.toString();
    }
}
