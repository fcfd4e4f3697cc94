package objectsdb.query;

import objectsdb.schema.FieldBinding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Filter of a generated query: a conjunction of conditions compiled to a
 * parameterized WHERE body.
 *
 * <p>Values are always bound as parameters. Column and table names are checked
 * to be plain identifiers. {@link #sql(String, Object...)} is the one escape
 * hatch: its text is passed through untouched as an opaque fragment, so the
 * caller that writes it owns its correctness.
 */
public final class Predicate {

    private static final Predicate ALL = new Predicate(List.of());

    private final List<Condition> conditions;

    private Predicate(List<Condition> conditions) {
        this.conditions = conditions;
    }

    /** No filter. */
    public static Predicate all() {
        return ALL;
    }

    public static Predicate where(String column, Operator op, Object value) {
        return ALL.and(column, op, value);
    }

    public static Predicate eq(String column, Object value) {
        return where(column, Operator.EQ, value);
    }

    public static Predicate in(String column, Collection<?> values) {
        return ALL.andIn(column, values);
    }

    public static Predicate contains(String arrayColumn, Object value) {
        return ALL.andContains(arrayColumn, value);
    }

    public static Predicate isNull(String column) {
        return ALL.andIsNull(column);
    }

    public static Predicate isNotNull(String column) {
        return ALL.andIsNotNull(column);
    }

    public static Predicate inSelect(String column, String table, String selectColumn, Predicate filter) {
        return ALL.andInSelect(column, table, selectColumn, filter);
    }

    /**
     * Caller-written WHERE fragment with {@code ?} placeholders. Not parsed or validated here;
     * a malformed fragment surfaces as a query failure when executed.
     */
    public static Predicate sql(String fragment, Object... params) {
        Objects.requireNonNull(fragment, "fragment is required");
        if (fragment.isBlank()) {
            return ALL;
        }
        List<Object> bound = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(params)));
        return ALL.with((sql, out) -> {
            sql.append('(').append(fragment).append(')');
            out.addAll(bound);
        });
    }

    public Predicate and(String column, Operator op, Object value) {
        String col = column(column);
        Objects.requireNonNull(op, "op is required");
        if (value == null) {
            throw new IllegalArgumentException("Null comparison value for " + column + ", use isNull");
        }
        Object bound = normalize(value);
        return with((sql, out) -> {
            sql.append(col).append(' ').append(op.sql()).append(" ?");
            out.add(bound);
        });
    }

    public Predicate andEq(String column, Object value) {
        return and(column, Operator.EQ, value);
    }

    /**
     * {@code column IN (...)}; an empty collection matches nothing.
     */
    public Predicate andIn(String column, Collection<?> values) {
        String col = column(column);
        List<Object> bound = new ArrayList<>(values.size());
        for (Object value : values) {
            bound.add(normalize(Objects.requireNonNull(value, "IN value")));
        }
        return with((sql, out) -> {
            if (bound.isEmpty()) {
                sql.append("1 = 0");
                return;
            }
            sql.append(col).append(" IN (");
            for (int i = 0; i < bound.size(); i++) {
                sql.append(i == 0 ? "?" : ", ?");
            }
            sql.append(')');
            out.addAll(bound);
        });
    }

    /**
     * Array column holds {@code value} as one of its elements.
     */
    public Predicate andContains(String arrayColumn, Object value) {
        String col = column(arrayColumn);
        Object bound = normalize(Objects.requireNonNull(value, "value"));
        return with((sql, out) -> {
            sql.append("? = ANY(").append(col).append(')');
            out.add(bound);
        });
    }

    public Predicate andIsNull(String column) {
        String col = column(column);
        return with((sql, out) -> sql.append(col).append(" IS NULL"));
    }

    public Predicate andIsNotNull(String column) {
        String col = column(column);
        return with((sql, out) -> sql.append(col).append(" IS NOT NULL"));
    }

    /**
     * {@code column IN (SELECT selectColumn FROM table [WHERE filter])}.
     */
    public Predicate andInSelect(String column, String table, String selectColumn, Predicate filter) {
        String col = column(column);
        String from = column(table);
        String select = column(selectColumn);
        Objects.requireNonNull(filter, "filter is required");
        return with((sql, out) -> {
            sql.append(col).append(" IN (SELECT ").append(select).append(" FROM ").append(from);
            if (!filter.isEmpty()) {
                sql.append(" WHERE ");
                filter.appendTo(sql, out);
            }
            sql.append(')');
        });
    }

    public Predicate and(Predicate other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<Condition> merged = new ArrayList<>(conditions);
        merged.addAll(other.conditions);
        return new Predicate(Collections.unmodifiableList(merged));
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * WHERE body without the {@code WHERE} keyword; empty text for {@link #all()}.
     */
    public SqlFragment compile() {
        if (isEmpty()) {
            return SqlFragment.empty();
        }
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();
        appendTo(sql, params);
        return new SqlFragment(sql.toString(), params);
    }

    private void appendTo(StringBuilder sql, List<Object> params) {
        for (int i = 0; i < conditions.size(); i++) {
            if (i > 0) {
                sql.append(" AND ");
            }
            conditions.get(i).appendTo(sql, params);
        }
    }

    private Predicate with(Condition condition) {
        List<Condition> next = new ArrayList<>(conditions);
        next.add(condition);
        return new Predicate(Collections.unmodifiableList(next));
    }

    private static String column(String name) {
        if (!FieldBinding.isIdentifier(name)) {
            throw new IllegalArgumentException("Not a valid SQL identifier: " + name);
        }
        return name;
    }

    private static Object normalize(Object value) {
        return value instanceof Enum<?> e ? e.name() : value;
    }

    @Override
    public String toString() {
        SqlFragment fragment = compile();
        return fragment.isEmpty() ? "Predicate{all}" : "Predicate{" + fragment.text() + " " + fragment.params() + "}";
    }

    @FunctionalInterface
    private interface Condition {
        void appendTo(StringBuilder sql, List<Object> params);
    }
}
