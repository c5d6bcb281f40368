package com.simpleinterpreter.test;

import java.util.HashMap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Before;
import org.junit.Test;

import com.simpleinterpreter.spi.ArithmeticError;
import com.simpleinterpreter.spi.Interpreter;
import com.simpleinterpreter.spi.NameError;
import com.simpleinterpreter.spi.Node;
import com.simpleinterpreter.spi.Parser;
import com.simpleinterpreter.spi.SyntaxError;

public class InterpreterTest {
    private Interpreter interp = null;

    @Before
    public void setUp() {
        HashMap<String, Object> opts = new HashMap<>();
        opts.put("usePrintBuf", (Boolean)true);
        this.interp = new Interpreter(opts);
    }

    @Test
    public void testSimpleExpressions() {
        assertInt(2, eval("2"));
        assertInt(6, eval("2 * 3"));
        assertInt(9, eval("  2+3+4"));
        assertInt(24, eval("2*3*4  "));
        assertInt(7, eval("1+2*  3"));
    }

    @Test
    public void testPrecedenceAndGrouping() {
        assertInt(7, eval("1+2*3"));
        assertInt(9, eval("(1+2)*3"));
        assertInt(-4, eval("1-2-3"));
    }

    @Test
    public void testUnaryOperators() {
        assertInt(5, eval("--5"));
        assertInt(-5, eval("-5"));
        assertInt(5, eval("+5"));
        assertInt(10, eval("5 - - - + - (3 + 4) - +2"));
        assertReal(-2.5, eval("-(2.5)"));
    }

    @Test
    public void testNestedParens() {
        assertInt(10, eval("7 + 3 * (10 div (12 Div (3 + 1) - 1)) dIV (2 + 3) - 5 - 3 + (8)"));
    }

    @Test
    public void testIntegerDivision() {
        assertInt(3, eval("7 DIV 2"));
        assertInt(-3, eval("-7 div 2"));
        // real operands are truncated first
        assertInt(3, eval("7.9 div 2.2"));
    }

    @Test
    public void testFloatDivision() {
        assertReal(3.5, eval("7 / 2"));
        assertReal(2.0, eval("4 / 2"));
    }

    @Test
    public void testFloatDivisionByZero() {
        assertReal(Double.POSITIVE_INFINITY, eval("1 / 0"));
        assertReal(Double.NEGATIVE_INFINITY, eval("-1 / 0.0"));
        assertTrue(Double.isNaN(eval("0 / 0").doubleValue()));
    }

    @Test
    public void testRealPromotion() {
        assertReal(3.5, eval("1 + 2.5"));
        assertReal(6.0, eval("2 * 3.0"));
        assertReal(-0.5, eval("1 - 1.5"));
    }

    @Test(expected = ArithmeticError.class)
    public void testIntegerDivisionByZero() {
        eval("1 div 0");
    }

    @Test(expected = ArithmeticError.class)
    public void testIntegerDivisionByTruncatedZero() {
        eval("1 div 0.5");
    }

    @Test(expected = ArithmeticError.class)
    public void testIntegerOverflow() {
        eval("2147483647 + 1");
    }

    @Test(expected = NameError.class)
    public void testUndefinedVariableInExpression() {
        eval("x + 1");
    }

    @Test(expected = SyntaxError.class)
    public void testTrailingGarbage() {
        eval("2 2");
    }

    @Test(expected = IllegalStateException.class)
    public void testStatementIsNotAnExpression() {
        Node.Program program = Parser.newFromSource("PROGRAM p; BEGIN END.").parse();
        interp.evaluate(program.block.compoundStatement);
    }

    @Test
    public void testReassignmentOverwrites() {
        String code = "PROGRAM p;\n" +
                      "VAR a, b : INTEGER;\n" +
                      "BEGIN\n" +
                      "  a := 1;\n" +
                      "  a := a + 1;\n" +
                      "  b := a\n" +
                      "END.";
        interp.interpret(code);
        assertInt(2, interp.environment().values().get("a"));
        assertInt(2, interp.environment().values().get("b"));
    }

    @Test
    public void testVariablesAreCaseInsensitive() {
        interp.interpret("PROGRAM p; VAR Count : INTEGER; BEGIN count := 1; COUNT := Count + 1 END.");
        assertInt(2, interp.environment().values().get("count"));
        assertEquals(1, interp.environment().values().size());
    }

    @Test
    public void testDeclaredTypeNotEnforced() {
        interp.interpret("PROGRAM p; VAR a : INTEGER; BEGIN a := 7 / 2 END.");
        assertReal(3.5, interp.environment().values().get("a"));
    }

    @Test
    public void testUnassignedVariableRead() {
        try {
            interp.interpret("PROGRAM p; VAR a, b : INTEGER; BEGIN a := b END.");
            fail("expected a NameError");
        } catch (NameError err) {
            assertTrue(err.getMessage().contains("'b'"));
            assertEquals(1, err.line);
        }
        // aborted: no final report
        assertFalse(interp.printBuf.toString().contains("Variables:"));
    }

    @Test
    public void testEachRunHasFreshEnvironment() {
        interp.interpret("PROGRAM one; VAR a : INTEGER; BEGIN a := 1 END.");
        try {
            interp.interpret("PROGRAM two; VAR a, b : INTEGER; BEGIN b := a END.");
            fail("expected a NameError");
        } catch (NameError err) {
            assertTrue(err.getMessage().contains("'a'"));
        }
    }

    @Test
    public void testTrace() {
        String code = "PROGRAM Trace;\n" +
                      "VAR x : INTEGER; y : REAL;\n" +
                      "BEGIN x := 7 DIV 2; y := x / 2 END.";
        interp.interpret(code);
        String expected = "VAR x : INTEGER\n" +
                          "VAR y : REAL\n" +
                          "x := 3\n" +
                          "y := 1.5\n" +
                          "Variables:\n" +
                          "  x = 3\n" +
                          "  y = 1.5\n";
        assertEquals(expected, interp.printBuf.toString());
    }

    @Test
    public void testSymbolTableBuiltForProgram() {
        interp.interpret("PROGRAM p; VAR a : REAL; BEGIN a := 1 END.");
        assertEquals("p", interp.symbolTable().scopeName);
        assertTrue(interp.symbolTable().lookup("A") != null);
    }

    private Number eval(String src) {
        return interp.evaluate(src);
    }

    private static void assertInt(int expected, Number actual) {
        assertTrue("expected an integer, got " + actual, actual instanceof Integer);
        assertEquals(expected, actual.intValue());
    }

    private static void assertReal(double expected, Number actual) {
        assertTrue("expected a real, got " + actual, actual instanceof Double);
        assertEquals(expected, actual.doubleValue(), 1e-9);
    }
}
