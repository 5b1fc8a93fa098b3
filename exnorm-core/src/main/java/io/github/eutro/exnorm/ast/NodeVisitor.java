package io.github.eutro.exnorm.ast;

/**
 * A visitor over every node shape.
 * <p>
 * Implementations must acknowledge every shape; adding a shape to the tree adds a method here.
 * Visitors that only care about a few shapes extend {@link Default}, whose
 * {@link Default#visitDefault(Node)} is the explicit fallthrough arm.
 *
 * @param <R> The result type.
 */
public interface NodeVisitor<R> {
    R visitNil(Nil node);

    R visitBool(Bool node);

    R visitIntLit(IntLit node);

    R visitFloatLit(FloatLit node);

    R visitStr(Str node);

    R visitAtom(Atom node);

    R visitVar(Var node);

    R visitModuleRef(ModuleRef node);

    R visitAttribute(Attribute node);

    R visitMatch(Match node);

    R visitBlock(Block node);

    R visitParen(Paren node);

    R visitIf(If node);

    R visitUnless(Unless node);

    R visitCond(Cond node);

    R visitCase(Case node);

    R visitWith(With node);

    R visitReceive(Receive node);

    R visitFn(Fn node);

    R visitDef(Def node);

    R visitCapture(Capture node);

    R visitCall(Call node);

    R visitRemoteCall(RemoteCall node);

    R visitApply(Apply node);

    R visitBinOp(BinOp node);

    R visitUnaryOp(UnaryOp node);

    R visitPipe(Pipe node);

    R visitTuple(Tuple node);

    R visitListLit(ListLit node);

    R visitCons(Cons node);

    R visitMapLit(MapLit node);

    R visitMapUpdate(MapUpdate node);

    R visitStruct(Struct node);

    R visitStructUpdate(StructUpdate node);

    R visitKeyword(Keyword node);

    R visitAccess(Access node);

    R visitField(Field node);

    R visitFor(For node);

    R visitRange(Range node);

    R visitTry(Try node);

    R visitRaise(Raise node);

    R visitThrow(Throw node);

    R visitModuleDef(ModuleDef node);

    R visitDirective(Directive node);

    R visitRaw(Raw node);

    R visitTemplate(Template node);

    R visitInterpolation(Interpolation node);

    /**
     * A visitor which sends every shape it does not override to {@link #visitDefault(Node)}.
     *
     * @param <R> The result type.
     */
    abstract class Default<R> implements NodeVisitor<R> {
        protected abstract R visitDefault(Node node);

        @Override
        public R visitNil(Nil node) {
            return visitDefault(node);
        }

        @Override
        public R visitBool(Bool node) {
            return visitDefault(node);
        }

        @Override
        public R visitIntLit(IntLit node) {
            return visitDefault(node);
        }

        @Override
        public R visitFloatLit(FloatLit node) {
            return visitDefault(node);
        }

        @Override
        public R visitStr(Str node) {
            return visitDefault(node);
        }

        @Override
        public R visitAtom(Atom node) {
            return visitDefault(node);
        }

        @Override
        public R visitVar(Var node) {
            return visitDefault(node);
        }

        @Override
        public R visitModuleRef(ModuleRef node) {
            return visitDefault(node);
        }

        @Override
        public R visitAttribute(Attribute node) {
            return visitDefault(node);
        }

        @Override
        public R visitMatch(Match node) {
            return visitDefault(node);
        }

        @Override
        public R visitBlock(Block node) {
            return visitDefault(node);
        }

        @Override
        public R visitParen(Paren node) {
            return visitDefault(node);
        }

        @Override
        public R visitIf(If node) {
            return visitDefault(node);
        }

        @Override
        public R visitUnless(Unless node) {
            return visitDefault(node);
        }

        @Override
        public R visitCond(Cond node) {
            return visitDefault(node);
        }

        @Override
        public R visitCase(Case node) {
            return visitDefault(node);
        }

        @Override
        public R visitWith(With node) {
            return visitDefault(node);
        }

        @Override
        public R visitReceive(Receive node) {
            return visitDefault(node);
        }

        @Override
        public R visitFn(Fn node) {
            return visitDefault(node);
        }

        @Override
        public R visitDef(Def node) {
            return visitDefault(node);
        }

        @Override
        public R visitCapture(Capture node) {
            return visitDefault(node);
        }

        @Override
        public R visitCall(Call node) {
            return visitDefault(node);
        }

        @Override
        public R visitRemoteCall(RemoteCall node) {
            return visitDefault(node);
        }

        @Override
        public R visitApply(Apply node) {
            return visitDefault(node);
        }

        @Override
        public R visitBinOp(BinOp node) {
            return visitDefault(node);
        }

        @Override
        public R visitUnaryOp(UnaryOp node) {
            return visitDefault(node);
        }

        @Override
        public R visitPipe(Pipe node) {
            return visitDefault(node);
        }

        @Override
        public R visitTuple(Tuple node) {
            return visitDefault(node);
        }

        @Override
        public R visitListLit(ListLit node) {
            return visitDefault(node);
        }

        @Override
        public R visitCons(Cons node) {
            return visitDefault(node);
        }

        @Override
        public R visitMapLit(MapLit node) {
            return visitDefault(node);
        }

        @Override
        public R visitMapUpdate(MapUpdate node) {
            return visitDefault(node);
        }

        @Override
        public R visitStruct(Struct node) {
            return visitDefault(node);
        }

        @Override
        public R visitStructUpdate(StructUpdate node) {
            return visitDefault(node);
        }

        @Override
        public R visitKeyword(Keyword node) {
            return visitDefault(node);
        }

        @Override
        public R visitAccess(Access node) {
            return visitDefault(node);
        }

        @Override
        public R visitField(Field node) {
            return visitDefault(node);
        }

        @Override
        public R visitFor(For node) {
            return visitDefault(node);
        }

        @Override
        public R visitRange(Range node) {
            return visitDefault(node);
        }

        @Override
        public R visitTry(Try node) {
            return visitDefault(node);
        }

        @Override
        public R visitRaise(Raise node) {
            return visitDefault(node);
        }

        @Override
        public R visitThrow(Throw node) {
            return visitDefault(node);
        }

        @Override
        public R visitModuleDef(ModuleDef node) {
            return visitDefault(node);
        }

        @Override
        public R visitDirective(Directive node) {
            return visitDefault(node);
        }

        @Override
        public R visitRaw(Raw node) {
            return visitDefault(node);
        }

        @Override
        public R visitTemplate(Template node) {
            return visitDefault(node);
        }

        @Override
        public R visitInterpolation(Interpolation node) {
            return visitDefault(node);
        }
    }
}
