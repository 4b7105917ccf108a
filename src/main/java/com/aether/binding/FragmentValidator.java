package com.aether.binding;

/**
 * Syntax checker for target-language code. Implementations parse only; nothing
 * handed to a validator is ever executed.
 */
public interface FragmentValidator {

    /**
     * Checks a sequence of statements as it would appear in a method body.
     *
     * @param source the statements
     * @return the check result
     */
    SyntaxCheck checkStatements(String source);

    /**
     * Checks a single expression.
     *
     * @param source the expression
     * @return the check result
     */
    SyntaxCheck checkExpression(String source);

    /**
     * Checks a complete ES module.
     *
     * @param source the module text
     * @param name file name used in messages
     * @return the check result
     */
    SyntaxCheck checkModule(String source, String name);

    /**
     * A validator that accepts everything, for when checking is switched off.
     *
     * @return the permissive validator
     */
    static FragmentValidator permissive() {
        return new FragmentValidator() {
            @Override
            public SyntaxCheck checkStatements(String source) {
                return SyntaxCheck.ok();
            }

            @Override
            public SyntaxCheck checkExpression(String source) {
                return SyntaxCheck.ok();
            }

            @Override
            public SyntaxCheck checkModule(String source, String name) {
                return SyntaxCheck.ok();
            }
        };
    }
}
