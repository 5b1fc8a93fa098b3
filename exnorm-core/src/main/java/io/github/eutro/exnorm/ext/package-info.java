/**
 * Typed metadata for tree nodes.
 * <p>
 * An {@link io.github.eutro.exnorm.ext.Ext} is a typed key, and an
 * {@link io.github.eutro.exnorm.ext.ExtContainer} maps exts to values.
 * Nodes are immutable, so their {@link io.github.eutro.exnorm.ext.Meta} is too:
 * attaching metadata produces a new {@code Meta}, and a new node through
 * {@link io.github.eutro.exnorm.ast.Node#withMeta(io.github.eutro.exnorm.ext.Meta)}.
 * <p>
 * The set of exts is closed, see {@link io.github.eutro.exnorm.ext.CommonExts}.
 */
package io.github.eutro.exnorm.ext;
