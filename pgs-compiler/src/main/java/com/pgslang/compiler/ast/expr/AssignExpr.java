package com.pgslang.compiler.ast.expr;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;

/**
 * 赋值表达式（含复合赋值），值为赋入的值
 */
public class AssignExpr extends Expression {
    private final Expression target;
    private final AssignOp operator;
    private final Expression value;

    public AssignExpr(SourceLocation location, Expression target, AssignOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public AssignOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isCompound() {
        return operator != AssignOp.ASSIGN;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }

    /**
     * 赋值运算符
     */
    public enum AssignOp {
        ASSIGN("=", null),
        ADD_ASSIGN("+=", BinaryExpr.BinaryOp.ADD),
        SUB_ASSIGN("-=", BinaryExpr.BinaryOp.SUB),
        MUL_ASSIGN("*=", BinaryExpr.BinaryOp.MUL),
        DIV_ASSIGN("/=", BinaryExpr.BinaryOp.DIV);

        private final String symbol;
        private final BinaryExpr.BinaryOp binaryOp;

        AssignOp(String symbol, BinaryExpr.BinaryOp binaryOp) {
            this.symbol = symbol;
            this.binaryOp = binaryOp;
        }

        public String getSymbol() {
            return symbol;
        }

        /** 复合赋值对应的二元运算，普通赋值返回 null */
        public BinaryExpr.BinaryOp getBinaryOp() {
            return binaryOp;
        }
    }
}
