package io.intellixity.flatdoc.examples.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.flatdoc.persistence.exec.DocumentEngine;
import io.intellixity.flatdoc.persistence.exec.Propagation;
import io.intellixity.flatdoc.persistence.jdbc.JdbcDocumentEngine;
import io.intellixity.flatdoc.persistence.jdbc.JdbcHandle;
import io.intellixity.flatdoc.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.flatdoc.persistence.jdbc.dialect.JdbcDialects;
import io.intellixity.flatdoc.persistence.jdbc.dml.JdbcDmlPlanner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FlatdocProperties.class)
public class FlatdocExampleConfig {

  @Bean(destroyMethod = "close")
  public HikariDataSource flatdocDataSource(FlatdocProperties props) {
    FlatdocProperties.Db db = props.getDb();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing flatdoc.db.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("flatdoc");
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    return new HikariDataSource(hc);
  }

  @Bean
  public JdbcDialect jdbcDialect(FlatdocProperties props) {
    return JdbcDialects.byId(props.getDialect());
  }

  @Bean
  public DocumentEngine<JdbcHandle> documentEngine(HikariDataSource ds, JdbcDialect dialect, FlatdocProperties props) {
    JdbcHandle handle = new JdbcHandle("jdbc:" + dialect.id(), ds, props.getDb().getSchema());
    return new JdbcDocumentEngine(handle, dialect, new JdbcDmlPlanner(), props.getEngine().toSettings(),
        Propagation.REQUIRED);
  }
}
