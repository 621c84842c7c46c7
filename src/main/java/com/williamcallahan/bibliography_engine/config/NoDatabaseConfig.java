package com.williamcallahan.bibliography_engine.config;

import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration to disable database components in absence of a database URL
 *
 * @author William Callahan
 *
 * Features:
 * - Activates only when no database URL is configured in properties
 * - Disables Spring's DataSource and schema initialization auto-configuration
 * - Complements the in-memory repository implementations
 */
@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
@EnableAutoConfiguration(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        SqlInitializationAutoConfiguration.class
})
public class NoDatabaseConfig {
    // Empty configuration class - functionality provided by annotations
}
