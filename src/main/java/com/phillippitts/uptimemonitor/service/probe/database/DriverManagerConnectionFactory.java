package com.phillippitts.uptimemonitor.service.probe.database;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens a fresh, unpooled connection per check: a health check must exercise the real connect path.
 */
public final class DriverManagerConnectionFactory implements JdbcConnectionFactory {

    @Override
    public Connection open(String jdbcUrl, Properties properties) throws SQLException {
        return DriverManager.getConnection(jdbcUrl, properties);
    }
}
