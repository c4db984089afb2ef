package com.phillippitts.uptimemonitor.service.probe.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens a JDBC connection. Production code uses {@link DriverManagerConnectionFactory};
 * tests substitute a mock.
 */
@FunctionalInterface
public interface JdbcConnectionFactory {

    Connection open(String jdbcUrl, Properties properties) throws SQLException;
}
