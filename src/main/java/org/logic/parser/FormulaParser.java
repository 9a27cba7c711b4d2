package org.logic.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.logic.antlr.LogicFormulaLexer;
import org.logic.antlr.LogicFormulaParser;
import org.logic.cnf.Formula;

import java.util.logging.Logger;

/**
 * Text to {@link Formula} conversion.
 *
 * PIPELINE:
 * 1. character-level validation ({@link FormulaValidator})
 * 2. ANTLR lexing and parsing with the LogicFormula grammar
 * 3. tree construction ({@link FormulaBuilder})
 *
 * Any problem surfaces as a {@link FormatException}; ANTLR's console error reporting
 * is replaced by a listener that throws.
 */
public class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /**
     * Parses formula text.
     *
     * @param text formula in surface notation, e.g. {@code (AvB)->(!C)}
     * @return the un-normalized formula tree
     * @throws FormatException if the text is not a valid formula
     */
    public Formula parse(String text) {
        FormulaValidator.validate(text);

        ThrowingErrorListener errorListener = new ThrowingErrorListener(text);

        CharStream input = CharStreams.fromString(text);
        LogicFormulaLexer lexer = new LogicFormulaLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        LogicFormulaParser parser = new LogicFormulaParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        ParseTree tree = parser.formula();
        Formula formula = new FormulaBuilder().visit(tree);

        LOGGER.fine("Parsed '" + text + "' as " + formula);
        return formula;
    }

    /**
     * Reports lexer and parser errors as {@link FormatException}.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        private final String text;

        ThrowingErrorListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new FormatException(FormatException.Reason.MALFORMED_FORMULA, text, charPositionInLine, msg);
        }
    }
}
