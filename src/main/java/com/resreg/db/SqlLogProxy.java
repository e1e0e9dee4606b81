package com.resreg.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.util.Locale;

/**
 * Wraps a connection so that every prepared statement execution is logged with its timing.
 */
final class SqlLogProxy {
    private static final int MAX_SQL_LENGTH = 400;

    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger) {
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class[]{Connection.class},
                (proxy, method, args) -> {
                    Object out = invoke(delegate, method, args);
                    if ("prepareStatement".equals(method.getName())
                            && args != null
                            && args.length > 0
                            && args[0] instanceof String
                            && out instanceof PreparedStatement) {
                        return wrapPreparedStatement((PreparedStatement) out, (String) args[0], logger);
                    }
                    return out;
                }
        );
    }

    private static PreparedStatement wrapPreparedStatement(PreparedStatement delegate, String sql, Logger logger) {
        InvocationHandler handler = new PreparedStatementHandler(delegate, sql, logger);
        return (PreparedStatement) Proxy.newProxyInstance(
                PreparedStatement.class.getClassLoader(),
                new Class[]{PreparedStatement.class},
                handler
        );
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    private static final class PreparedStatementHandler implements InvocationHandler {
        private final PreparedStatement delegate;
        private final String sql;
        private final Logger logger;

        private PreparedStatementHandler(PreparedStatement delegate, String sql, Logger logger) {
            this.delegate = delegate;
            this.sql = normalizeSql(sql);
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if (!name.startsWith("execute")) {
                return SqlLogProxy.invoke(delegate, method, args);
            }
            long started = System.nanoTime();
            try {
                Object out = SqlLogProxy.invoke(delegate, method, args);
                if (logger.isDebugEnabled()) {
                    logger.debug("SQL ok method={} elapsed_ms={}{} sql={}",
                            name, elapsedMillis(started), resultSummary(out), sql);
                }
                return out;
            } catch (Throwable error) {
                logger.warn("SQL fail method={} elapsed_ms={} err={} sql={}",
                        name, elapsedMillis(started), error.getMessage(), sql);
                throw error;
            }
        }
    }

    private static String elapsedMillis(long startedNanos) {
        return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
    }

    private static String resultSummary(Object result) {
        if (result instanceof Integer || result instanceof Long) {
            return " rows=" + result;
        }
        return "";
    }

    private static String normalizeSql(String sql) {
        if (sql == null) {
            return "";
        }
        String normalized = sql.replaceAll("\\s+", " ").trim();
        if (normalized.length() <= MAX_SQL_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, MAX_SQL_LENGTH) + "...";
    }
}
