package com.simpleinterpreter.test;

import static org.junit.Assert.assertEquals;
import org.junit.Test;

import com.simpleinterpreter.spi.AstPrinter;

public class AstPrinterTest {

    @Test
    public void testNumber() {
        assertEquals("42", AstPrinter.printExpression("42"));
        assertEquals("3.14", AstPrinter.printExpression("3.14"));
    }

    @Test
    public void testBinaryExpr() {
        assertEquals("(+ 1 (* 2 3))", AstPrinter.printExpression("1+2*3"));
        assertEquals("(* (+ 1 2) 3)", AstPrinter.printExpression("(1+2)*3"));
        assertEquals("(DIV 7 2)", AstPrinter.printExpression("7 div 2"));
        assertEquals("(/ 7 2)", AstPrinter.printExpression("7 / 2"));
    }

    @Test
    public void testUnaryExpr() {
        assertEquals("(- (- 5))", AstPrinter.printExpression("--5"));
        assertEquals("(+ x)", AstPrinter.printExpression("+x"));
    }

    @Test
    public void testProgram() {
        String code = "PROGRAM p; VAR a : INTEGER; BEGIN a := 1; END.";
        assertEquals("(program p (block (decl a INTEGER) (compound (:= a 1) (noop))))",
                     AstPrinter.printProgram(code));
    }

    @Test
    public void testProgramWithSeveralDeclarations() {
        String code = "PROGRAM Part10;\n" +
                      "VAR a, b : INTEGER;\n" +
                      "    y    : REAL;\n" +
                      "BEGIN y := a / (b - 1) END.";
        assertEquals("(program Part10 (block (decl a INTEGER) (decl b INTEGER) (decl y REAL) " +
                     "(compound (:= y (/ a (- b 1))))))",
                     AstPrinter.printProgram(code));
    }
}
