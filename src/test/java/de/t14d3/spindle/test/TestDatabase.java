package de.t14d3.spindle.test;

import de.t14d3.spindle.mapping.Schema;
import de.t14d3.spindle.test.entities.AuditedNote;
import de.t14d3.spindle.test.entities.Car;
import de.t14d3.spindle.test.entities.Engine;
import de.t14d3.spindle.test.entities.Person;
import de.t14d3.spindle.test.entities.Pet;
import de.t14d3.spindle.test.entities.Profile;
import de.t14d3.spindle.test.entities.Tag;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Shared fixtures: an in-memory H2 data source, the test schema and the DDL for
 * its tables.
 */
final class TestDatabase {
    static final Schema SCHEMA = Schema.builder()
            .register(Person.class, Pet.class, Profile.class, Car.class, Engine.class, Tag.class, AuditedNote.class)
            .build();

    private static final String[] CREATE = {
            "CREATE TABLE person (id BIGINT AUTO_INCREMENT PRIMARY KEY, name VARCHAR(100), age INT, "
                    + "email VARCHAR(100), tags VARCHAR(50) ARRAY, attributes JSON, street VARCHAR(100), city VARCHAR(100))",
            "CREATE TABLE pet (id BIGINT AUTO_INCREMENT PRIMARY KEY, name VARCHAR(100), species VARCHAR(50), person_id BIGINT)",
            "CREATE TABLE profile (id BIGINT AUTO_INCREMENT PRIMARY KEY, bio VARCHAR(255), person_id BIGINT)",
            "CREATE TABLE engine (id BIGINT AUTO_INCREMENT PRIMARY KEY, horsepower INT)",
            "CREATE TABLE car (id BIGINT AUTO_INCREMENT PRIMARY KEY, model VARCHAR(100), engine_id BIGINT)",
            "CREATE TABLE tag (code VARCHAR(20) PRIMARY KEY, label VARCHAR(100))",
            "CREATE TABLE audited_note (id BIGINT AUTO_INCREMENT PRIMARY KEY, body VARCHAR(255), revision INT)"
    };

    private static final String[] DROP = {
            "DROP TABLE IF EXISTS person", "DROP TABLE IF EXISTS pet", "DROP TABLE IF EXISTS profile",
            "DROP TABLE IF EXISTS engine", "DROP TABLE IF EXISTS car", "DROP TABLE IF EXISTS tag",
            "DROP TABLE IF EXISTS audited_note"
    };

    private TestDatabase() {
    }

    static DataSource dataSource(String name) {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1");
        return dataSource;
    }

    /**
     * Wraps {@code dataSource} so that every connection it hands out fails on
     * {@link Connection#rollback()} without rolling anything back.
     */
    static DataSource failingRollbacks(DataSource dataSource) {
        return (DataSource) Proxy.newProxyInstance(TestDatabase.class.getClassLoader(),
                new Class<?>[]{DataSource.class}, (proxy, method, args) -> {
                    Object result = invoke(dataSource, method, args);
                    if (method.getName().equals("getConnection")) {
                        return failingRollback((Connection) result);
                    }
                    return result;
                });
    }

    private static Connection failingRollback(Connection connection) {
        return (Connection) Proxy.newProxyInstance(TestDatabase.class.getClassLoader(),
                new Class<?>[]{Connection.class}, (proxy, method, args) -> {
                    if (method.getName().equals("rollback") && method.getParameterCount() == 0) {
                        throw new SQLException("connection reset during rollback");
                    }
                    return invoke(connection, method, args);
                });
    }

    private static Object invoke(Object target, java.lang.reflect.Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    static void createTables(DataSource dataSource) {
        execute(dataSource, CREATE);
    }

    static void dropTables(DataSource dataSource) {
        execute(dataSource, DROP);
    }

    static void execute(DataSource dataSource, String... sql) {
        try (Connection connection = dataSource.getConnection(); Statement stmt = connection.createStatement()) {
            for (String s : sql) {
                stmt.execute(s);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to execute test SQL", e);
        }
    }

    static long count(DataSource dataSource, String table) {
        return queryForLong(dataSource, "SELECT COUNT(*) FROM " + table);
    }

    static long queryForLong(DataSource dataSource, String sql) {
        try (Connection connection = dataSource.getConnection();
             Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query test database", e);
        }
    }
}
