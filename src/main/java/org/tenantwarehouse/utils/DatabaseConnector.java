package org.tenantwarehouse.utils;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Builds ad-hoc JDBC access for pipeline sources that live outside the warehouse database.
 */
@Component
public class DatabaseConnector {

    public DataSource buildDataSource(String url, String username, String password) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setUrl(url);
        dataSource.setUsername(username);
        dataSource.setPassword(password);
        return dataSource;
    }

    public JdbcTemplate buildJdbcTemplate(String url, String username, String password) {
        return new JdbcTemplate(buildDataSource(url, username, password));
    }
}
