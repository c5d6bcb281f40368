package com.simpleinterpreter.spi;

/**
 * Renders an expression in reverse Polish notation: {@code 1 + 2 * 3}
 * becomes {@code 1 2 3 * +}. Negation is written as a subtraction from
 * zero. Statements have no postfix form.
 */
public class RpnPrinter implements Node.Visitor<String> {

    public static String print(Node node) {
        return node.accept(new RpnPrinter());
    }

    public static String printExpression(String src) {
        return print(Parser.newFromSource(src).parseExpression());
    }

    @Override
    public String visitNumNode(Node.Num node) {
        return node.token.lexeme;
    }

    @Override
    public String visitVarNode(Node.Var node) {
        return node.name();
    }

    @Override
    public String visitUnaryOpNode(Node.UnaryOp node) {
        String operand = node.expr.accept(this);
        if (node.operator.type == TokenType.MINUS) {
            return "0 " + operand + " -";
        }
        return operand;
    }

    @Override
    public String visitBinOpNode(Node.BinOp node) {
        return node.left.accept(this) + " " + node.right.accept(this) + " " +
            AstPrinter.operatorSymbol(node.operator);
    }

    @Override
    public String visitCompoundNode(Node.Compound node) {
        throw unsupported(node);
    }

    @Override
    public String visitAssignNode(Node.Assign node) {
        throw unsupported(node);
    }

    @Override
    public String visitNoOpNode(Node.NoOp node) {
        throw unsupported(node);
    }

    @Override
    public String visitVarDeclNode(Node.VarDecl node) {
        throw unsupported(node);
    }

    @Override
    public String visitTypeNode(Node.Type node) {
        throw unsupported(node);
    }

    @Override
    public String visitBlockNode(Node.Block node) {
        throw unsupported(node);
    }

    @Override
    public String visitProgramNode(Node.Program node) {
        throw unsupported(node);
    }

    private static UnsupportedOperationException unsupported(Node node) {
        return new UnsupportedOperationException("No postfix form for " + node.getClass().getSimpleName());
    }
}
