package com.lynkvertx.primecee.calculation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Evaluates the per-unit MWh expression configured on a product
 * (e.g. {@code KWH_CUMAC * BONUS_DOM * LED_WATT / MWH_DIVISOR}).
 * <p>
 * Variables are resolved as properties of a map root; the evaluation context
 * exposes no type references, constructors or bean references.
 */
@Slf4j
@Component
public class CeeFormulaEvaluator {

    public static final String KWH_CUMAC = "KWH_CUMAC";
    public static final String BONIFICATION = "BONIFICATION";
    public static final String BONUS_DOM = "BONUS_DOM";
    public static final String COEFFICIENT = "COEFFICIENT";
    public static final String LED_WATT = "LED_WATT";
    public static final String MWH_DIVISOR = "MWH_DIVISOR";

    private final ExpressionParser parser = new SpelExpressionParser();

    /**
     * @return the finite, positive value of the expression, or null when it is blank,
     * invalid, or evaluates to anything else
     */
    public Double evaluate(String expression, Map<String, Double> variables) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        EvaluationContext context = SimpleEvaluationContext
            .forPropertyAccessors(new MapAccessor())
            .build();
        try {
            Expression parsed = parser.parseExpression(expression.trim());
            Object value = parsed.getValue(context, variables);
            if (!(value instanceof Number)) {
                log.warn("CEE formula '{}' did not evaluate to a number: {}", expression, value);
                return null;
            }
            double result = ((Number) value).doubleValue();
            if (!Double.isFinite(result) || result <= 0) {
                log.warn("CEE formula '{}' evaluated to a non-positive or non-finite value: {}", expression, result);
                return null;
            }
            return result;
        } catch (ParseException | EvaluationException | ArithmeticException e) {
            log.warn("Failed to evaluate CEE formula '{}': {}", expression, e.getMessage());
            return null;
        }
    }
}
