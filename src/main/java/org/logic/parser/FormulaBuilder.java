package org.logic.parser;

import org.logic.antlr.LogicFormulaBaseVisitor;
import org.logic.antlr.LogicFormulaParser.ConnectiveContext;
import org.logic.antlr.LogicFormulaParser.ExpressionContext;
import org.logic.antlr.LogicFormulaParser.FormulaContext;
import org.logic.antlr.LogicFormulaParser.GroupContext;
import org.logic.antlr.LogicFormulaParser.LiteralContext;
import org.logic.antlr.LogicFormulaParser.NegationContext;
import org.logic.cnf.Formula;

import java.util.logging.Logger;

/**
 * Visitor turning the ANTLR parse tree of the LogicFormula grammar into a
 * {@link Formula} tree.
 *
 * CONVERSION:
 * - LITERAL token -> literal node
 * - '!' operand -> negation of the operand
 * - '(' expression ')' -> the nested expression as its own sub-tree
 * - operand (connective operand)* -> binary nodes folded left to right, so AaBvC
 *   becomes (AaB)vC and A->B->C becomes (A->B)->C
 *
 * No normalization happens here; implications and nesting are kept as written.
 */
public class FormulaBuilder extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaBuilder.class.getName());

    //region ENTRY POINT

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.expression());
        LOGGER.finest("Parsed formula tree: " + formula);
        return formula;
    }

    //endregion

    //region CONNECTIVE CHAINS

    /**
     * Folds a chain of connectives at one bracket level from left to right.
     */
    @Override
    public Formula visitExpression(ExpressionContext ctx) {
        Formula result = visit(ctx.operand(0));

        for (int i = 0; i < ctx.connective().size(); i++) {
            Formula right = visit(ctx.operand(i + 1));
            result = combine(ctx.connective(i), result, right);
        }

        return result;
    }

    private Formula combine(ConnectiveContext connective, Formula left, Formula right) {
        if (connective.AND() != null) {
            return Formula.and(left, right);
        }
        if (connective.OR() != null) {
            return Formula.or(left, right);
        }
        return Formula.implies(left, right);
    }

    //endregion

    //region OPERANDS

    @Override
    public Formula visitNegation(NegationContext ctx) {
        return Formula.not(visit(ctx.operand()));
    }

    @Override
    public Formula visitLiteral(LiteralContext ctx) {
        return Formula.literal(ctx.LITERAL().getText());
    }

    @Override
    public Formula visitGroup(GroupContext ctx) {
        return visit(ctx.expression());
    }

    //endregion
}
