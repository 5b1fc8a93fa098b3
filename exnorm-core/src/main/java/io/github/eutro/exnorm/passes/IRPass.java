package io.github.eutro.exnorm.passes;

/**
 * A transformation from one form to another.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);
}
