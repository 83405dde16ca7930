package com.gt.srs.conf;

import com.gt.srs.review.ReviewRecordDao;
import com.gt.srs.review.impl.ReviewRecordDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${srs.datasource.postgres.url}") String url,
                                    @Value("${srs.datasource.postgres.username}") String username,
                                    @Value("${srs.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public ReviewRecordDao getReviewRecordDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ReviewRecordDaoPG(namedParameterJdbcTemplate);
    }
}
