package org.exprcalc.api;

/**
 * Defines unique, testable error codes for every way an expression can fail.
 * This decouples callers and tests from the wording of the error messages.
 */
public enum CalculatorErrorCode {
    // region Lexical & Structural Errors
    /** The expression was empty or consisted only of whitespace. */
    EMPTY_EXPRESSION,
    /** A token is neither a number, a known identifier, an operator nor punctuation. */
    UNKNOWN_TOKEN,
    /** A function name was not immediately followed by an opening parenthesis. */
    MISSING_FUNCTION_PAREN,
    /** Parentheses are unbalanced, or a separator appeared outside of a function call. */
    UNMATCHED_PARENTHESIS,
    // endregion

    // region Evaluation Errors
    /** A function call's argument count is not accepted by the function. */
    INVALID_ARITY,
    /** The underlying arithmetic or function application failed (division by zero, domain error). */
    OPERATION_FAILED,
    /** The postfix stream did not collapse to exactly one value. */
    INVALID_FINAL_RESULT
    // endregion
}
