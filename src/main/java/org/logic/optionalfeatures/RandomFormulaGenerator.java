package org.logic.optionalfeatures;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Generates random formulas in the toolkit's surface notation, for experiments and
 * manual testing of the other commands.
 *
 * GENERATION:
 * 1. pick the requested number of distinct letters
 * 2. building blocks: the letters, their negations, then random combinations
 *    (XcY) and occasional negated groups !(X) until there are 4 blocks per letter
 * 3. start from a random block and grow by (result)cX or Xc(result) until the
 *    minimum length is reached
 * 4. make sure every picked letter appears, overwriting one repeated letter if needed
 *
 * Every generated string passes formula validation.
 */
public class RandomFormulaGenerator {

    private static final Logger LOGGER = Logger.getLogger(RandomFormulaGenerator.class.getName());

    //region CONFIGURATION

    public static final int DEFAULT_MINIMUM_LENGTH = 15;
    public static final int DEFAULT_LITERAL_COUNT = 3;

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String[] CONNECTIVES = {"a", "v", "->"};
    private static final int BLOCKS_PER_LITERAL = 4;

    //endregion

    private final Random random;

    public RandomFormulaGenerator() {
        this(new Random());
    }

    /**
     * @param random source of randomness, seed it for reproducible formulas
     */
    public RandomFormulaGenerator(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Random source cannot be null");
        }
        this.random = random;
    }

    //region PUBLIC INTERFACE

    public String generate() {
        return generate(DEFAULT_MINIMUM_LENGTH, DEFAULT_LITERAL_COUNT);
    }

    /**
     * Generates a formula.
     *
     * Out-of-range parameters are clamped: more than 26 literals become 26, fewer
     * than one become the default, a negative length becomes the default.
     *
     * @param minimumLength minimum number of characters
     * @param literalCount number of distinct letters to use
     * @return a valid formula string
     */
    public String generate(int minimumLength, int literalCount) {
        if (literalCount > ALPHABET.length()) {
            literalCount = ALPHABET.length();
        } else if (literalCount < 1) {
            literalCount = DEFAULT_LITERAL_COUNT;
        }
        if (minimumLength < 0) {
            minimumLength = DEFAULT_MINIMUM_LENGTH;
        }

        List<String> literals = pickLiterals(literalCount);
        List<String> elements = buildElements(literals);

        String result = pick(elements);
        while (result.length() < minimumLength) {
            String addition = pick(elements);
            String connective = CONNECTIVES[random.nextInt(CONNECTIVES.length)];
            if (random.nextBoolean()) {
                result = join("(" + result + ")", connective, addition);
            } else {
                result = join(addition, connective, "(" + result + ")");
            }
        }

        result = includeAllLiterals(result, literals);
        LOGGER.fine("Generated random formula: " + result);
        return result;
    }

    //endregion

    //region BUILDING BLOCKS

    private List<String> pickLiterals(int count) {
        Set<String> picked = new LinkedHashSet<>();
        while (picked.size() < count) {
            picked.add(String.valueOf(ALPHABET.charAt(random.nextInt(ALPHABET.length()))));
        }
        return new ArrayList<>(picked);
    }

    private List<String> buildElements(List<String> literals) {
        List<String> elements = new ArrayList<>(literals);
        for (String literal : literals) {
            elements.add("!" + literal);
        }

        while (elements.size() < literals.size() * BLOCKS_PER_LITERAL) {
            String first = pick(elements);
            String second = pick(elements);
            while (first.equals(second)) {
                first = pick(elements);
                second = pick(elements);
            }
            String connective = CONNECTIVES[random.nextInt(CONNECTIVES.length)];

            String negatedGroup = "!(" + first + ")";
            if (random.nextInt(4) == 0 && !first.startsWith("!") && first.length() > 1
                    && !elements.contains(negatedGroup)) {
                elements.add(negatedGroup);
            } else {
                elements.add("(" + join(first, connective, second) + ")");
            }
        }
        return elements;
    }

    private String includeAllLiterals(String formula, List<String> literals) {
        String result = formula;
        for (String literal : literals) {
            if (result.contains(literal)) {
                continue;
            }
            for (int i = 0; i < result.length(); i++) {
                char c = result.charAt(i);
                if (Character.isUpperCase(c) && result.indexOf(c) != result.lastIndexOf(c)) {
                    result = result.substring(0, i) + literal + result.substring(i + 1);
                    break;
                }
            }
        }
        return result;
    }

    /**
     * '->' may not be directly followed by '!', such right operands get brackets.
     */
    private static String join(String left, String connective, String right) {
        if ("->".equals(connective) && right.startsWith("!")) {
            return left + connective + "(" + right + ")";
        }
        return left + connective + right;
    }

    private String pick(List<String> elements) {
        return elements.get(random.nextInt(elements.size()));
    }

    //endregion
}
