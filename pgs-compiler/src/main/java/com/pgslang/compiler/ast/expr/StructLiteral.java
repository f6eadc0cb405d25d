package com.pgslang.compiler.ast.expr;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.decl.QualifiedName;

import java.util.List;

/**
 * 容器字面量 {@code Point { x: 3.0, y: 4.0 }}
 */
public class StructLiteral extends Expression {
    private final QualifiedName typeName;
    private final List<FieldInit> fields;

    public StructLiteral(SourceLocation location, QualifiedName typeName, List<FieldInit> fields) {
        super(location);
        this.typeName = typeName;
        this.fields = fields;
    }

    public QualifiedName getTypeName() {
        return typeName;
    }

    public List<FieldInit> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructLiteral(this, context);
    }

    /**
     * 字段初始化项
     */
    public static final class FieldInit {
        private final SourceLocation location;
        private final String name;
        private final Expression value;

        public FieldInit(SourceLocation location, String name, Expression value) {
            this.location = location;
            this.name = name;
            this.value = value;
        }

        public SourceLocation getLocation() {
            return location;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }
    }
}
