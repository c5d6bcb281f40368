package com.simpleinterpreter.spi;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.HashMap;

import jline.console.ConsoleReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end. With {@code -f FILE} a whole program is run;
 * without it, a prompt evaluates one arithmetic expression per line.
 */
public class Spi {
    private static final Logger LOG = LoggerFactory.getLogger(Spi.class);

    static boolean hadError = false;
    static boolean hadRuntimeError = false;

    public static void main(String[] args) throws IOException {
        String fname = null;
        boolean showTree = false;
        boolean showSymbols = false;
        int i = 0;

        while (i < args.length) {
            if (args[i].equals("-f") && i + 1 < args.length) {
                fname = args[i+1];
                i += 2;
            } else if (args[i].equals("-t")) {
                showTree = true;
                i += 1;
            } else if (args[i].equals("-s")) {
                showSymbols = true;
                i += 1;
            } else {
                System.err.println("Usage: Spi [-f FILENAME] [-t] [-s]");
                System.exit(1);
            }
        }

        if (fname == null) {
            runPrompt();
        } else {
            runFile(fname, showTree, showSymbols);
        }
    }

    private static void runFile(String path, boolean showTree, boolean showSymbols) throws IOException {
        LOG.debug("Running {}", path);
        String src = SpiUtil.readFile(path);
        HashMap<String, Object> opts = new HashMap<>();
        opts.put("usePrintBuf", (Boolean)false);
        opts.put("verbose", (Boolean)showSymbols);
        Interpreter interpreter = new Interpreter(opts);
        try {
            Node.Program program = Parser.newFromSource(src).parse();
            if (showTree) {
                System.out.println("Tree:");
                System.out.println(AstPrinter.print(program));
                System.out.println();
            }
            interpreter.interpret(program);
            if (showSymbols) {
                System.out.println();
                System.out.println("Symbol table:");
                System.out.print(interpreter.symbolTable());
            }
        } catch (SpiError error) {
            report(error);
        }
        if (hadError) System.exit(65);
        if (hadRuntimeError) System.exit(70);
    }

    private static void runPrompt() throws IOException {
        ConsoleReader reader = new ConsoleReader();
        PrintWriter out = new PrintWriter(reader.getOutput());
        reader.setPrompt("calc> ");

        String line;
        for (;;) {
            line = reader.readLine();
            if (line == null) {
                break;
            }
            if (line.equals("exit") || line.equals("quit")) {
                break;
            }
            if (line.trim().isEmpty()) {
                continue;
            }
            try {
                // one pipeline per line: nothing carries over
                Node expr = Parser.newFromSource(line).parseExpression();
                Number result = new Interpreter().evaluate(expr);
                out.println("Result: " + Interpreter.stringify(result));
                out.println("Lisp: " + AstPrinter.print(expr));
                out.println("RPN: " + RpnPrinter.print(expr));
                out.println();
            } catch (SpiError error) {
                report(error);
            }
            out.flush();
            hadError = false;
            hadRuntimeError = false;
        }
    }

    static void report(SpiError error) {
        String where = error.line > 0 ? "[line " + error.line + "] " : "";
        System.err.println(where + error.kind() + ": " + error.getMessage());
        if (error instanceof LexicalError || error instanceof SyntaxError) {
            hadError = true;
        } else {
            hadRuntimeError = true;
        }
    }
}
