package org.exprcalc;

import org.exprcalc.api.Calculation;
import org.exprcalc.api.ICalculator;
import org.exprcalc.api.Value;
import org.exprcalc.backend.RpnEvaluator;
import org.exprcalc.diagnostics.DiagnosticsEngine;
import org.exprcalc.frontend.lexer.Lexer;
import org.exprcalc.frontend.lexer.Token;
import org.exprcalc.frontend.postfix.RpnElement;
import org.exprcalc.frontend.postfix.ShuntingYardConverter;
import org.exprcalc.frontend.signs.SignNormalizer;
import org.exprcalc.registry.OperationRegistry;
import org.exprcalc.registry.StandardLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * The main calculator implementation. This class orchestrates the pipeline
 * lexer, sign normalizer, shunting-yard converter and postfix evaluator.
 * <p>
 * It holds nothing but the immutable registry; every call works on its own
 * diagnostics and buffers, so one instance may be shared between threads.
 */
public class Calculator implements ICalculator {

    private static final Logger LOG = LoggerFactory.getLogger(Calculator.class);

    private final OperationRegistry registry;

    /**
     * Creates a calculator over the built-in {@link StandardLibrary}.
     */
    public Calculator() {
        this(StandardLibrary.registry());
    }

    /**
     * Creates a calculator over a custom registry.
     * @param registry The constants and functions expressions may use.
     */
    public Calculator(OperationRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return The constants and functions expressions may use.
     */
    public OperationRegistry registry() {
        return registry;
    }

    @Override
    public Calculation<Value> calculate(String expression) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<RpnElement> postfix = compile(expression, diagnostics);
        if (diagnostics.hasErrors()) {
            return failure(expression, diagnostics);
        }

        // Phase 4: Evaluation
        Value value = new RpnEvaluator(registry, diagnostics).evaluate(postfix);
        if (diagnostics.hasErrors()) {
            return failure(expression, diagnostics);
        }
        return Calculation.success(value);
    }

    /**
     * Runs every phase except evaluation and returns the postfix stream.
     *
     * @param expression The expression.
     * @return The postfix stream, or the first error found while building it.
     */
    public Calculation<List<RpnElement>> toPostfix(String expression) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<RpnElement> postfix = compile(expression, diagnostics);
        if (diagnostics.hasErrors()) {
            return failure(expression, diagnostics);
        }
        return Calculation.success(Collections.unmodifiableList(postfix));
    }

    private List<RpnElement> compile(String expression, DiagnosticsEngine diagnostics) {
        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(expression, diagnostics).scanTokens();
        if (diagnostics.hasErrors()) {
            return List.of();
        }

        // Phase 2: Sign Normalization
        List<Token> normalized = new SignNormalizer(tokens).normalize();

        // Phase 3: Infix to Postfix
        return new ShuntingYardConverter(normalized, diagnostics, registry).convert();
    }

    private <T> Calculation<T> failure(String expression, DiagnosticsEngine diagnostics) {
        LOG.debug("Calculation of '{}' failed: {}", expression, diagnostics.summary());
        return Calculation.failure(diagnostics.firstError());
    }
}
