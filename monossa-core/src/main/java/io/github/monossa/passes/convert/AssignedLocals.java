package io.github.monossa.passes.convert;

import io.github.monossa.ast.Definition;
import io.github.monossa.ast.Expression;
import io.github.monossa.ast.LValue;

import java.util.Set;
import java.util.TreeSet;

/**
 * Finds the locals an expression assigns to directly or through tuple fields,
 * which are the ones it may rename.
 */
final class AssignedLocals implements Expression.Visitor<Void> {
    private final Set<Integer> assigned = new TreeSet<>();

    private AssignedLocals() {
    }

    /**
     * Find the locals assigned anywhere within an expression.
     *
     * @param expr The expression.
     * @return The ids of the locals, in ascending order.
     */
    static Set<Integer> in(Expression expr) {
        AssignedLocals finder = new AssignedLocals();
        finder.visit(expr);
        return finder.assigned;
    }

    private void visit(Expression expr) {
        expr.accept(this);
    }

    @Override
    public Void visitIdent(Expression.Ident ident) {
        return null;
    }

    @Override
    public Void visitLiteral(Expression.Literal literal) {
        if (literal instanceof Expression.ArrayLiteral) {
            for (Expression element : ((Expression.ArrayLiteral) literal).contents) {
                visit(element);
            }
        }
        return null;
    }

    @Override
    public Void visitBlock(Expression.Block block) {
        for (Expression expr : block.expressions) {
            visit(expr);
        }
        return null;
    }

    @Override
    public Void visitUnary(Expression.Unary unary) {
        visit(unary.rhs);
        return null;
    }

    @Override
    public Void visitBinary(Expression.Binary binary) {
        visit(binary.lhs);
        visit(binary.rhs);
        return null;
    }

    @Override
    public Void visitIndex(Expression.Index index) {
        visit(index.collection);
        visit(index.index);
        return null;
    }

    @Override
    public Void visitCast(Expression.Cast cast) {
        visit(cast.lhs);
        return null;
    }

    @Override
    public Void visitFor(Expression.For forExpr) {
        visit(forExpr.startRange);
        visit(forExpr.endRange);
        visit(forExpr.block);
        return null;
    }

    @Override
    public Void visitIf(Expression.If ifExpr) {
        visit(ifExpr.condition);
        visit(ifExpr.consequence);
        if (ifExpr.alternative != null) {
            visit(ifExpr.alternative);
        }
        return null;
    }

    @Override
    public Void visitTuple(Expression.Tuple tuple) {
        for (Expression element : tuple.elements) {
            visit(element);
        }
        return null;
    }

    @Override
    public Void visitExtractTupleField(Expression.ExtractTupleField extract) {
        visit(extract.tuple);
        return null;
    }

    @Override
    public Void visitCall(Expression.Call call) {
        visit(call.func);
        for (Expression argument : call.arguments) {
            visit(argument);
        }
        return null;
    }

    @Override
    public Void visitLet(Expression.Let let) {
        visit(let.expression);
        return null;
    }

    @Override
    public Void visitConstrain(Expression.Constrain constrain) {
        visit(constrain.expression);
        return null;
    }

    @Override
    public Void visitAssign(Expression.Assign assign) {
        visit(assign.expression);
        visitTarget(assign.lvalue, true);
        return null;
    }

    private void visitTarget(LValue lvalue, boolean renames) {
        if (lvalue instanceof LValue.Ident) {
            Definition definition = ((LValue.Ident) lvalue).ident.definition;
            if (renames && definition instanceof Definition.Local) {
                assigned.add(((Definition.Local) definition).id);
            }
        } else if (lvalue instanceof LValue.MemberAccess) {
            visitTarget(((LValue.MemberAccess) lvalue).object, renames);
        } else {
            // stores through the array, which keeps its address
            LValue.Index index = (LValue.Index) lvalue;
            visit(index.index);
            visitTarget(index.array, false);
        }
    }

    @Override
    public Void visitSemi(Expression.Semi semi) {
        visit(semi.expression);
        return null;
    }
}
