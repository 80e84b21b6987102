package com.lazyduck.expression;

/**
 * A value that can contribute to a content-addressed expression name.
 *
 * <p>Equal values must return equal tokens across runs. Operand types that
 * do not implement this interface fall back to an identity token, which is
 * stable only within one process.
 */
public interface Tokenizable {

    /**
     * Returns a deterministic token describing this value's content.
     *
     * @return the token
     */
    String token();
}
