package infra.director.db;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link Database} answering queries from scripted rules, for tests.
 *
 * <p>Rules match when the SQL contains their fragment; the first matching rule wins.
 * Unmatched queries fail the way a missing catalog view would. Every call is recorded.</p>
 */
public class ScriptedDatabase implements Database {

    public static final class Call {
        public final String sql;
        public final List<Object> args;

        Call(String sql, List<Object> args) {
            this.sql = sql;
            this.args = args;
        }
    }

    @FunctionalInterface
    public interface Answer {
        QueryCursor answer(QueryContext context, String sql, List<Object> args) throws SQLException;
    }

    private static final class Rule {
        final String fragment;
        final Object argument;
        final Answer answer;

        Rule(String fragment, Object argument, Answer answer) {
            this.fragment = fragment;
            this.argument = argument;
            this.answer = answer;
        }

        boolean matches(String sql, List<Object> args) {
            return sql.contains(fragment) && (argument == null || args.contains(argument));
        }
    }

    private final String driverName;
    private final List<Rule> rules = new ArrayList<>();
    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());

    public ScriptedDatabase(String driverName) {
        this.driverName = driverName;
    }

    public ScriptedDatabase on(String fragment, Supplier<QueryCursor> rows) {
        rules.add(new Rule(fragment, null, (ctx, sql, args) -> rows.get()));
        return this;
    }

    /**
     * Rule that only applies when the given value is among the bound arguments.
     */
    public ScriptedDatabase on(String fragment, Object argument, Supplier<QueryCursor> rows) {
        rules.add(new Rule(fragment, argument, (ctx, sql, args) -> rows.get()));
        return this;
    }

    public ScriptedDatabase fail(String fragment, String message) {
        rules.add(new Rule(fragment, null, (ctx, sql, args) -> {
            throw new SQLException(message);
        }));
        return this;
    }

    public ScriptedDatabase fail(String fragment, Object argument, String message) {
        rules.add(new Rule(fragment, argument, (ctx, sql, args) -> {
            throw new SQLException(message);
        }));
        return this;
    }

    public ScriptedDatabase answer(String fragment, Answer answer) {
        rules.add(new Rule(fragment, null, answer));
        return this;
    }

    public List<Call> getCalls() {
        return new ArrayList<>(calls);
    }

    public long countCalls(String fragment) {
        return getCalls().stream().filter(call -> call.sql.contains(fragment)).count();
    }

    @Override
    public String driverName() {
        return driverName;
    }

    @Override
    public int queryTimeoutSeconds() {
        return 30;
    }

    @Override
    public QueryCursor query(QueryContext context, String sql, List<Object> args) throws SQLException {
        calls.add(new Call(sql, new ArrayList<>(args)));
        context.checkActive();
        for (Rule rule : rules) {
            if (rule.matches(sql, args)) {
                return rule.answer.answer(context, sql, args);
            }
        }
        throw new SQLException("relation does not exist: " + sql.trim().split("\\s+")[0]);
    }
}
