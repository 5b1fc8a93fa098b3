package io.github.eutro.exnorm.ext;

/**
 * Values of {@link CommonExts#ROLE}.
 */
public enum NodeRole {
    /**
     * The body of a comprehension, whose value becomes an element of the result.
     */
    COMPREHENSION_BODY,
    /**
     * The reducer of an {@code Enum.reduce}/{@code Enum.reduce_while} lowered from a loop.
     */
    FOLD_BODY,
    /**
     * A function rendering a template, which reads its {@code assigns} parameter implicitly.
     */
    TEMPLATE_RENDER,
}
