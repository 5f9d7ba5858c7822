package com.automotiveiot.jdbcsink;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
@EnableConfigurationProperties(JdbcSinkProperties.class)
public class JdbcSinkConfiguration {

    private static final Logger log = LoggerFactory.getLogger(JdbcSinkConfiguration.class);

    static final String DEFAULT_SCHEMA = "classpath:driving-records-schema.sql";

    private final JdbcSinkProperties properties;

    public JdbcSinkConfiguration(JdbcSinkProperties properties) {
        this.properties = properties;
    }

    @Bean
    public TransactionTemplate drivingRecordTransactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public DrivingRecordStore drivingRecordStore(NamedParameterJdbcTemplate jdbcTemplate) {
        return new JdbcDrivingRecordStore(jdbcTemplate);
    }

    @Bean
    public DrivingRecordQueries drivingRecordQueries(NamedParameterJdbcTemplate jdbcTemplate,
                                                     TransactionTemplate drivingRecordTransactionTemplate) {
        return new DrivingRecordQueries(jdbcTemplate, drivingRecordTransactionTemplate,
                this.properties.getDefaultQueryLimit());
    }

    @ConditionalOnProperty("aiot.jdbc.sink.initialize")
    @Bean
    public DataSourceInitializer drivingRecordDataSourceInitializer(DataSource dataSource, ResourceLoader resourceLoader) {
        DataSourceInitializer dataSourceInitializer = new DataSourceInitializer();
        dataSourceInitializer.setDataSource(dataSource);
        ResourceDatabasePopulator databasePopulator = new ResourceDatabasePopulator();
        dataSourceInitializer.setDatabasePopulator(databasePopulator);

        String script = "true".equals(this.properties.getInitialize()) ? DEFAULT_SCHEMA : this.properties.getInitialize();
        log.info("Initializing driving record tables from {}", script);
        databasePopulator.addScript(resourceLoader.getResource(script));
        return dataSourceInitializer;
    }
}
