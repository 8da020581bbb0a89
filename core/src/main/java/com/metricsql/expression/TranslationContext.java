package com.metricsql.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Output buffer and argument list shared by the recursive calls of one top-level
 * translation. Created per {@link ExpressionTranslator#translate(Expression)} call
 * and discarded afterwards.
 */
final class TranslationContext {

    private final StringBuilder sql = new StringBuilder();
    private final List<Object> args = new ArrayList<>();

    TranslationContext append(String text) {
        sql.append(text);
        return this;
    }

    TranslationContext append(SqlFragment fragment) {
        sql.append(fragment.sql());
        args.addAll(fragment.args());
        return this;
    }

    TranslationContext placeholder(Object arg) {
        sql.append('?');
        args.add(arg);
        return this;
    }

    int sqlMark() {
        return sql.length();
    }

    int argMark() {
        return args.size();
    }

    /**
     * Removes and returns everything written since the given marks, so that a
     * sub-expression can be re-emitted more than once.
     */
    SqlFragment cut(int sqlMark, int argMark) {
        String text = sql.substring(sqlMark);
        List<Object> cutArgs = new ArrayList<>(args.subList(argMark, args.size()));
        sql.setLength(sqlMark);
        args.subList(argMark, args.size()).clear();
        return new SqlFragment(text, cutArgs);
    }

    SqlFragment toFragment() {
        return new SqlFragment(sql.toString(), args);
    }
}
