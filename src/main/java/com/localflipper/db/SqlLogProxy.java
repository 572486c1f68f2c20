package com.localflipper.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Locale;

/**
 * Wraps a JDBC connection so that every executed statement is logged with its elapsed time.
 */
final class SqlLogProxy {
    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger) {
        InvocationHandler handler = (proxy, method, args) -> {
            Object out = invoke(delegate, method, args);
            if ("prepareStatement".equals(method.getName()) && out instanceof PreparedStatement && args[0] instanceof String) {
                return (PreparedStatement) Proxy.newProxyInstance(
                        PreparedStatement.class.getClassLoader(),
                        new Class[]{PreparedStatement.class},
                        new StatementLogger(out, (String) args[0], logger));
            }
            if ("createStatement".equals(method.getName()) && out instanceof Statement) {
                return (Statement) Proxy.newProxyInstance(
                        Statement.class.getClassLoader(),
                        new Class[]{Statement.class},
                        new StatementLogger(out, null, logger));
            }
            return out;
        };
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class[]{Connection.class},
                handler);
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    private static final class StatementLogger implements InvocationHandler {
        private final Object delegate;
        private final String preparedSql;
        private final Logger logger;

        private StatementLogger(Object delegate, String preparedSql, Logger logger) {
            this.delegate = delegate;
            this.preparedSql = preparedSql;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if (!name.startsWith("execute")) {
                return SqlLogProxy.invoke(delegate, method, args);
            }
            String sql = preparedSql != null ? preparedSql
                    : (args != null && args.length > 0 && args[0] instanceof String ? (String) args[0] : "");
            long started = System.nanoTime();
            try {
                Object out = SqlLogProxy.invoke(delegate, method, args);
                logger.info("SQL ok method={} elapsed_ms={} sql={}", name, elapsedMs(started), normalize(sql));
                return out;
            } catch (Throwable e) {
                logger.warn("SQL fail method={} elapsed_ms={} err={} sql={}", name, elapsedMs(started), e.getMessage(), normalize(sql));
                throw e;
            }
        }

        private static String elapsedMs(long startedNanos) {
            return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
        }

        private static String normalize(String sql) {
            String normalized = sql == null ? "" : sql.replaceAll("\\s+", " ").trim();
            return normalized.length() <= 400 ? normalized : normalized.substring(0, 400) + "...";
        }
    }
}
