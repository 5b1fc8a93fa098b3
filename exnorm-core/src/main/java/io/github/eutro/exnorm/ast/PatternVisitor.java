package io.github.eutro.exnorm.ast;

/**
 * A visitor over every pattern shape.
 *
 * @param <R> The result type.
 */
public interface PatternVisitor<R> {
    R visitPVar(PVar pattern);

    R visitPWildcard(PWildcard pattern);

    R visitPLit(PLit pattern);

    R visitPTuple(PTuple pattern);

    R visitPList(PList pattern);

    R visitPCons(PCons pattern);

    R visitPMap(PMap pattern);

    R visitPStruct(PStruct pattern);

    R visitPPin(PPin pattern);

    R visitPAlias(PAlias pattern);

    R visitPBinary(PBinary pattern);
}
