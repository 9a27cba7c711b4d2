package org.logic.optionalfeatures;

import org.junit.jupiter.api.Test;
import org.logic.cnf.Formula;
import org.logic.parser.FormulaParser;
import org.logic.parser.FormulaValidator;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RandomFormulaGeneratorTest {

    private final FormulaParser parser = new FormulaParser();

    @Test
    void generatedFormulasAreValid() {
        for (long seed = 0; seed < 200; seed++) {
            String formula = new RandomFormulaGenerator(new Random(seed)).generate();

            assertTrue(FormulaValidator.isValid(formula), "seed " + seed + ": " + formula);
            assertTrue(formula.length() >= RandomFormulaGenerator.DEFAULT_MINIMUM_LENGTH, formula);
            Formula parsed = parser.parse(formula);
            assertTrue(parsed.symbols().size() <= RandomFormulaGenerator.DEFAULT_LITERAL_COUNT, formula);
        }
    }

    @Test
    void respectsRequestedSize() {
        for (long seed = 0; seed < 50; seed++) {
            String formula = new RandomFormulaGenerator(new Random(seed)).generate(40, 5);

            assertTrue(formula.length() >= 40, formula);
            assertTrue(distinctLetters(formula).size() <= 5, formula);
            parser.parse(formula);
        }
    }

    @Test
    void sameSeedSameFormula() {
        assertEquals(new RandomFormulaGenerator(new Random(42)).generate(),
                new RandomFormulaGenerator(new Random(42)).generate());
    }

    @Test
    void clampsIllegalParameters() {
        RandomFormulaGenerator generator = new RandomFormulaGenerator(new Random(3));

        assertTrue(distinctLetters(generator.generate(10, 100)).size() <= 26);
        assertTrue(distinctLetters(generator.generate(10, 0)).size() <= RandomFormulaGenerator.DEFAULT_LITERAL_COUNT);
        assertTrue(generator.generate(-1, 2).length() >= RandomFormulaGenerator.DEFAULT_MINIMUM_LENGTH);
    }

    @Test
    void rejectsMissingRandomSource() {
        assertThrows(IllegalArgumentException.class, () -> new RandomFormulaGenerator(null));
    }

    private static Set<Character> distinctLetters(String formula) {
        Set<Character> letters = new HashSet<>();
        for (char c : formula.toCharArray()) {
            if (c >= 'A' && c <= 'Z') {
                letters.add(c);
            }
        }
        return letters;
    }
}
