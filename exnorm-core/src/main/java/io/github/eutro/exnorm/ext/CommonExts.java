package io.github.eutro.exnorm.ext;

import java.util.Map;

/**
 * The fixed set of metadata fields the front end may attach to nodes.
 */
public class CommonExts {
    /**
     * Path of the original source file a definition came from.
     */
    public static final Ext<String> SOURCE_FILE = Ext.create(String.class, "SOURCE_FILE");

    /**
     * Set on an expression the front end knows to be free of side effects.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");

    /**
     * Set on a {@link io.github.eutro.exnorm.ast.Match} whose binder is a compiler temporary.
     * {@code false} explicitly marks a binder as user-written, overriding naming conventions.
     */
    public static final Ext<Boolean> COMPILER_TEMP = Ext.create(Boolean.class, "COMPILER_TEMP");

    /**
     * Set on an {@link io.github.eutro.exnorm.ast.Fn} or {@link io.github.eutro.exnorm.ast.For}
     * produced from a loop, mapping generated iteration binders to the names in the original program.
     */
    public static final Ext<Map<String, String>> LOOP_ORIGIN_NAMES = Ext.create(Map.class, "LOOP_ORIGIN_NAMES");

    /**
     * The role a node plays in the construct the front end lowered it from.
     */
    public static final Ext<NodeRole> ROLE = Ext.create(NodeRole.class, "ROLE");

    public static <T extends ExtContainer> boolean hasRole(T t, NodeRole role) {
        return t.getNullable(ROLE) == role;
    }

    public static Meta markPure(Meta meta) {
        return meta.with(IS_PURE, true);
    }

    public static Meta markTemp(Meta meta) {
        return meta.with(COMPILER_TEMP, true);
    }
}
