package com.gt.lss.conf;

import com.gt.lss.bandit.BanditArmDao;
import com.gt.lss.bandit.impl.BanditArmDaoPG;
import com.gt.lss.content.ContentDao;
import com.gt.lss.content.impl.ContentDaoPG;
import com.gt.lss.mastery.MasteryDao;
import com.gt.lss.mastery.impl.MasteryDaoPG;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.util.function.Supplier;

@Configuration
public class BeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${lss.datasource.postgres.url}") String url,
                                    @Value("${lss.datasource.postgres.username}") String username,
                                    @Value("${lss.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public ContentDao getContentDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate,
                                    @Value("${lss.dao.queryChunkSize:500}") int queryChunkSize) {
        return new ContentDaoPG(namedParameterJdbcTemplate, queryChunkSize);
    }

    @Bean
    public MasteryDao getMasteryDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate,
                                    @Value("${lss.dao.queryChunkSize:500}") int queryChunkSize) {
        return new MasteryDaoPG(namedParameterJdbcTemplate, queryChunkSize);
    }

    @Bean
    public BanditArmDao getBanditArmDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new BanditArmDaoPG(namedParameterJdbcTemplate);
    }

    // Each call hands out a fresh generator so no sampling state is shared between requests
    @Bean
    public Supplier<RandomGenerator> getBanditRandomSupplier() {
        return Well19937c::new;
    }
}
