package com.simpleinterpreter.spi;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree-walking evaluator. Values are {@link Integer} or {@link Double};
 * arithmetic on two integers stays integral, anything involving a real is
 * real.
 *
 * <p>Options:
 * <ul>
 *   <li>{@code usePrintBuf}: collect the program trace in {@link #printBuf}
 *       instead of writing it to stdout.</li>
 *   <li>{@code verbose}: report symbol table activity while analyzing.</li>
 * </ul>
 */
public class Interpreter implements Node.Visitor<Number> {
    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    public HashMap<String, Object> options = null;
    public StringBuffer printBuf = null;

    private Environment environment = new Environment();
    private SymbolTable symbolTable = null;

    public Interpreter() {
        HashMap<String, Object> opts = new HashMap<>();
        opts.put("usePrintBuf", (Boolean)false);
        opts.put("verbose", (Boolean)false);
        this.options = opts;
    }

    public Interpreter(HashMap<String, Object> options) {
        this.options = options;
        if (Boolean.TRUE.equals(this.options.get("usePrintBuf"))) {
            this.printBuf = new StringBuffer();
        }
    }

    // Runs a whole program against a fresh environment.
    public void interpret(Node.Program program) {
        LOG.debug("Interpreting program {}", program.name.lexeme);
        this.environment = new Environment();
        this.symbolTable = new SemanticAnalyzer(isVerbose()).analyze(program);
        program.accept(this);

        println("Variables:");
        for (Map.Entry<String, Number> entry : environment.values().entrySet()) {
            println("  " + entry.getKey() + " = " + stringify(entry.getValue()));
        }
    }

    public void interpret(String src) {
        interpret(Parser.newFromSource(src).parse());
    }

    public Number evaluate(Node expr) {
        if (!expr.isExpression()) {
            throw new IllegalStateException("Invalid node in expression: " + expr.getClass().getSimpleName());
        }
        return expr.accept(this);
    }

    public Number evaluate(String src) {
        return evaluate(Parser.newFromSource(src).parseExpression());
    }

    public Environment environment() {
        return environment;
    }

    // null until a program has been interpreted
    public SymbolTable symbolTable() {
        return symbolTable;
    }

    @Override
    public Number visitProgramNode(Node.Program node) {
        node.block.accept(this);
        return null;
    }

    @Override
    public Number visitBlockNode(Node.Block node) {
        for (Node.VarDecl decl : node.declarations) {
            decl.accept(this);
        }
        node.compoundStatement.accept(this);
        return null;
    }

    // declared types are reported, not enforced
    @Override
    public Number visitVarDeclNode(Node.VarDecl node) {
        println("VAR " + node.variable.name() + " : " + node.type.name);
        return null;
    }

    @Override
    public Number visitTypeNode(Node.Type node) {
        return null;
    }

    @Override
    public Number visitCompoundNode(Node.Compound node) {
        for (Node statement : node.statements) {
            statement.accept(this);
        }
        return null;
    }

    @Override
    public Number visitAssignNode(Node.Assign node) {
        Number value = evaluate(node.expr);
        environment.assign(node.variable.token, value);
        println(node.variable.name() + " := " + stringify(value));
        return null;
    }

    @Override
    public Number visitNoOpNode(Node.NoOp node) {
        return null;
    }

    @Override
    public Number visitVarNode(Node.Var node) {
        return environment.get(node.token);
    }

    @Override
    public Number visitNumNode(Node.Num node) {
        return node.value();
    }

    @Override
    public Number visitUnaryOpNode(Node.UnaryOp node) {
        Number value = evaluate(node.expr);

        switch (node.operator.type) {
            case PLUS:
                return value;
            case MINUS:
                if (value instanceof Integer) {
                    try {
                        return Math.negateExact(value.intValue());
                    } catch (java.lang.ArithmeticException e) {
                        throw new ArithmeticError(node.operator, "Integer overflow.");
                    }
                }
                return -value.doubleValue();
            default:
                throw new IllegalStateException("Unknown unary operator " + node.operator.type);
        }
    }

    @Override
    public Number visitBinOpNode(Node.BinOp node) {
        Number left = evaluate(node.left);
        Number right = evaluate(node.right);
        boolean integral = left instanceof Integer && right instanceof Integer;

        try {
            switch (node.operator.type) {
                case PLUS:
                    if (integral) return Math.addExact(left.intValue(), right.intValue());
                    return left.doubleValue() + right.doubleValue();
                case MINUS:
                    if (integral) return Math.subtractExact(left.intValue(), right.intValue());
                    return left.doubleValue() - right.doubleValue();
                case MULTIPLY:
                    if (integral) return Math.multiplyExact(left.intValue(), right.intValue());
                    return left.doubleValue() * right.doubleValue();
                case INTEGER_DIVIDE: {
                    int dividend = left.intValue();
                    int divisor = right.intValue();
                    if (divisor == 0) {
                        throw new ArithmeticError(node.operator, "Division by zero.");
                    }
                    if (dividend == Integer.MIN_VALUE && divisor == -1) {
                        throw new ArithmeticError(node.operator, "Integer overflow.");
                    }
                    return dividend / divisor;
                }
                case FLOAT_DIVIDE:
                    // IEEE-754: x / 0.0 is infinite or NaN
                    return left.doubleValue() / right.doubleValue();
                default:
                    throw new IllegalStateException("Unknown binary operator " + node.operator.type);
            }
        } catch (java.lang.ArithmeticException e) {
            throw new ArithmeticError(node.operator, "Integer overflow.");
        }
    }

    public static String stringify(Number value) {
        if (value == null) return "nil";
        return value.toString();
    }

    private boolean isVerbose() {
        return Boolean.TRUE.equals(options.get("verbose"));
    }

    private void println(String line) {
        if (printBuf != null) {
            printBuf.append(line).append("\n");
        } else {
            System.out.println(line);
        }
    }
}
