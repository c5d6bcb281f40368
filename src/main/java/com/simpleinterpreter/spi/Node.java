package com.simpleinterpreter.spi;

import java.util.List;

/**
 * Syntax tree produced by the {@link Parser}. Nodes are immutable and own
 * their children. Traversals implement {@link Visitor}; nodes know nothing
 * about the traversals run over them.
 */
public abstract class Node {
  public interface Visitor<R> {
    R visitNumNode(Num node);
    R visitVarNode(Var node);
    R visitUnaryOpNode(UnaryOp node);
    R visitBinOpNode(BinOp node);
    R visitCompoundNode(Compound node);
    R visitAssignNode(Assign node);
    R visitNoOpNode(NoOp node);
    R visitVarDeclNode(VarDecl node);
    R visitTypeNode(Type node);
    R visitBlockNode(Block node);
    R visitProgramNode(Program node);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  // true for the node kinds the arithmetic dialect can evaluate
  public boolean isExpression() {
    return false;
  }

  public static final class Num extends Node {
    public final Token token;

    public Num(Token token) {
      this.token = token;
    }

    // Integer for INTEGER_CONST, Double for REAL_CONST
    public Number value() {
      return (Number)token.literal;
    }

    @Override
    public boolean isExpression() {
      return true;
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNumNode(this);
    }
  }

  public static final class Var extends Node {
    public final Token token;

    public Var(Token token) {
      this.token = token;
    }

    public String name() {
      return token.lexeme;
    }

    @Override
    public boolean isExpression() {
      return true;
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVarNode(this);
    }
  }

  public static final class UnaryOp extends Node {
    public final Token operator;
    public final Node expr;

    public UnaryOp(Token operator, Node expr) {
      this.operator = operator;
      this.expr = expr;
    }

    @Override
    public boolean isExpression() {
      return true;
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnaryOpNode(this);
    }
  }

  public static final class BinOp extends Node {
    public final Node left;
    public final Token operator;
    public final Node right;

    public BinOp(Node left, Token operator, Node right) {
      this.left = left;
      this.operator = operator;
      this.right = right;
    }

    @Override
    public boolean isExpression() {
      return true;
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinOpNode(this);
    }
  }

  public static final class Compound extends Node {
    public final Token begin;
    public final List<Node> statements;

    public Compound(Token begin, List<Node> statements) {
      this.begin = begin;
      this.statements = List.copyOf(statements);
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCompoundNode(this);
    }
  }

  public static final class Assign extends Node {
    public final Var variable;
    public final Token operator;
    public final Node expr;

    public Assign(Var variable, Token operator, Node expr) {
      this.variable = variable;
      this.operator = operator;
      this.expr = expr;
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssignNode(this);
    }
  }

  public static final class NoOp extends Node {
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNoOpNode(this);
    }
  }

  public static final class VarDecl extends Node {
    public final Var variable;
    public final Type type;

    public VarDecl(Var variable, Type type) {
      this.variable = variable;
      this.type = type;
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVarDeclNode(this);
    }
  }

  public static final class Type extends Node {
    public final Token token;
    public final String name; // upper-cased: INTEGER or REAL

    public Type(Token token) {
      this.token = token;
      this.name = token.type.name();
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTypeNode(this);
    }
  }

  public static final class Block extends Node {
    public final List<VarDecl> declarations;
    public final Compound compoundStatement;

    public Block(List<VarDecl> declarations, Compound compoundStatement) {
      this.declarations = List.copyOf(declarations);
      this.compoundStatement = compoundStatement;
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBlockNode(this);
    }
  }

  public static final class Program extends Node {
    public final Token name;
    public final Block block;

    public Program(Token name, Block block) {
      this.name = name;
      this.block = block;
    }

    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitProgramNode(this);
    }
  }
}
