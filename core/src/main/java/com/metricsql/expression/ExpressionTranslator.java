package com.metricsql.expression;

import com.metricsql.dialect.Dialect;
import com.metricsql.exception.CompileInvariantException;
import com.metricsql.exception.UnsupportedFeatureException;
import com.metricsql.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Translates filter expressions into SQL with positional arguments.
 *
 * <p>Translation is a single recursive pass over the {@link Expression} union.
 * Names resolve through a {@link NameResolver}; literals are always bound as
 * {@code ?} arguments, never interpolated. The same expression always yields
 * the same SQL and arguments.
 *
 * <p>Example:
 * <pre>
 *   translate(condition(IN, name("city"), list("London", "Paris")))
 *   // "city" IN (?, ?)   args: [London, Paris]
 * </pre>
 */
public final class ExpressionTranslator {

    private final Dialect dialect;
    private final NameResolver resolver;
    private final SubqueryCompiler subqueries;

    /**
     * Creates a translator.
     *
     * @param dialect the active dialect
     * @param resolver resolves names in the target clause
     * @param subqueries compiles subquery expressions, or null if not available in this clause
     */
    public ExpressionTranslator(Dialect dialect, NameResolver resolver, SubqueryCompiler subqueries) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.subqueries = subqueries;
    }

    /**
     * Translates an expression.
     *
     * @param expression the expression
     * @return the SQL fragment and its arguments
     * @throws ValidationException if the expression is malformed
     * @throws CompileInvariantException if a name cannot be resolved
     */
    public SqlFragment translate(Expression expression) {
        TranslationContext ctx = new TranslationContext();
        write(expression, ctx);
        return ctx.toFragment();
    }

    private void write(Expression expression, TranslationContext ctx) {
        if (expression == null) {
            throw new ValidationException("expression has no populated variant", "expression");
        }
        switch (expression.kind()) {
            case NAME:
                writeName((NameExpression) expression, ctx);
                break;
            case VALUE: {
                ValueExpression value = (ValueExpression) expression;
                if (value.isList()) {
                    throw new ValidationException(
                        "list values are only allowed as the second expression of 'in' or 'nin'", "condition");
                }
                writeValue(value, ctx);
                break;
            }
            case CONDITION:
                writeCondition((ConditionExpression) expression, ctx);
                break;
            case SUBQUERY:
                ctx.append("(").append(compileSubquery((SubqueryExpression) expression)).append(")");
                break;
            default:
                throw new IllegalStateException("Unhandled expression kind: " + expression.kind());
        }
    }

    private void writeName(NameExpression name, TranslationContext ctx) {
        SqlFragment resolved = resolver.resolve(name.name());
        if (resolved == null) {
            throw new CompileInvariantException("Name '" + name.name() + "' is not resolvable in this clause");
        }
        ctx.append(resolved);
    }

    private void writeValue(ValueExpression value, TranslationContext ctx) {
        if (!value.isList()) {
            ctx.placeholder(value.value());
            return;
        }
        List<?> elements = value.elements();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                ctx.append(", ");
            }
            ctx.placeholder(elements.get(i));
        }
    }

    private void writeCondition(ConditionExpression condition, TranslationContext ctx) {
        Operator op = condition.operator();
        List<Expression> children = condition.children();

        if (op.isLogical()) {
            writeLogical(op, children, ctx);
            return;
        }
        if (children.size() != 2) {
            throw new ValidationException(
                "operator '" + op.code() + "' requires exactly 2 expressions, got " + children.size(),
                "condition");
        }
        Expression left = children.get(0);
        Expression right = children.get(1);

        if (op.isMembership()) {
            writeMembership(op, left, right, ctx);
        } else if (op.isLike()) {
            writeLike(op, left, right, ctx);
        } else {
            writeComparison(op, left, right, ctx);
        }
    }

    private void writeLogical(Operator op, List<Expression> children, TranslationContext ctx) {
        if (children.isEmpty()) {
            throw new ValidationException(
                "operator '" + op.code() + "' requires at least one expression", "condition");
        }
        ctx.append("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                ctx.append(" ").append(op.symbol()).append(" ");
            }
            write(children.get(i), ctx);
        }
        ctx.append(")");
    }

    private void writeComparison(Operator op, Expression left, Expression right, TranslationContext ctx) {
        // x = NULL is never true in three-valued logic
        if (op == Operator.EQ || op == Operator.NEQ) {
            Expression operand = null;
            if (isNullLiteral(right)) {
                operand = left;
            } else if (isNullLiteral(left)) {
                operand = right;
            }
            if (operand != null) {
                write(operand, ctx);
                ctx.append(op == Operator.EQ ? " IS NULL" : " IS NOT NULL");
                return;
            }
        }
        write(left, ctx);
        ctx.append(" ").append(op.symbol()).append(" ");
        write(right, ctx);
    }

    private void writeLike(Operator op, Expression left, Expression right, TranslationContext ctx) {
        String not = op.isNegated() ? "NOT " : "";
        boolean caseInsensitive = op == Operator.ILIKE || op == Operator.NILIKE;

        if (!caseInsensitive || dialect.supportsILike()) {
            write(left, ctx);
            ctx.append(" ").append(not).append(caseInsensitive ? "ILIKE " : "LIKE ");
            write(right, ctx);
            return;
        }
        ctx.append("lower(");
        write(left, ctx);
        ctx.append(") ").append(not).append("LIKE lower(");
        write(right, ctx);
        ctx.append(")");
    }

    private void writeMembership(Operator op, Expression left, Expression right, TranslationContext ctx) {
        boolean negated = op == Operator.NIN;

        if (right instanceof SubqueryExpression subquery) {
            write(left, ctx);
            ctx.append(negated ? " NOT IN (" : " IN (").append(compileSubquery(subquery)).append(")");
            return;
        }
        if (!(right instanceof ValueExpression list) || !list.isList()) {
            throw new ValidationException(
                "operator '" + op.code() + "' requires a list value or subquery as second expression",
                "condition");
        }

        List<Object> values = new ArrayList<>();
        boolean hasNull = false;
        for (Object element : list.elements()) {
            if (element == null) {
                hasNull = true;
            } else {
                values.add(element);
            }
        }

        if (values.isEmpty() && !hasNull) {
            ctx.append(negated ? "TRUE" : "FALSE");
            return;
        }

        int sqlMark = ctx.sqlMark();
        int argMark = ctx.argMark();
        write(left, ctx);
        SqlFragment leftSql = ctx.cut(sqlMark, argMark);

        if (values.isEmpty()) {
            ctx.append(leftSql).append(negated ? " IS NOT NULL" : " IS NULL");
            return;
        }
        if (hasNull) {
            ctx.append("(");
        }
        ctx.append(leftSql).append(negated ? " NOT IN (" : " IN (");
        writeValue(new ValueExpression(values), ctx);
        ctx.append(")");
        if (hasNull) {
            ctx.append(negated ? " AND " : " OR ").append(leftSql)
                .append(negated ? " IS NOT NULL)" : " IS NULL)");
        }
    }

    private SqlFragment compileSubquery(SubqueryExpression subquery) {
        if (subqueries == null) {
            throw new UnsupportedFeatureException("subquery expressions in this clause", null);
        }
        return subqueries.compile(subquery);
    }

    private static boolean isNullLiteral(Expression expression) {
        return expression instanceof ValueExpression value && value.isNull();
    }
}
