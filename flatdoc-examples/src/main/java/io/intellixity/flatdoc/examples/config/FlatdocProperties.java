package io.intellixity.flatdoc.examples.config;

import io.intellixity.flatdoc.persistence.document.ArrayPolicy;
import io.intellixity.flatdoc.persistence.exec.EngineSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flatdoc")
public class FlatdocProperties {
  /** Registered dialect id: "sqlite" or "postgres". */
  private String dialect = "sqlite";
  private final Db db = new Db();
  private final Engine engine = new Engine();

  public String getDialect() { return dialect; }
  public void setDialect(String dialect) { this.dialect = dialect; }
  public Db getDb() { return db; }
  public Engine getEngine() { return engine; }

  public static class Db {
    private String jdbcUrl = "jdbc:sqlite:flatdoc-examples.db?journal_mode=WAL&busy_timeout=10000";
    private String username;
    private String password;
    /** Schema set on every connection; blank keeps the connection default. */
    private String schema;
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }

  public static class Engine {
    private String mappingTable = EngineSettings.DEFAULT_MAPPING_TABLE;
    private String nullSortDefault = EngineSettings.DEFAULT_NULL_SORT;
    private ArrayPolicy arrayPolicy = ArrayPolicy.REJECT;
    private int schemaRetries = EngineSettings.DEFAULT_SCHEMA_RETRIES;

    public String getMappingTable() { return mappingTable; }
    public void setMappingTable(String mappingTable) { this.mappingTable = mappingTable; }
    public String getNullSortDefault() { return nullSortDefault; }
    public void setNullSortDefault(String nullSortDefault) { this.nullSortDefault = nullSortDefault; }
    public ArrayPolicy getArrayPolicy() { return arrayPolicy; }
    public void setArrayPolicy(ArrayPolicy arrayPolicy) { this.arrayPolicy = arrayPolicy; }
    public int getSchemaRetries() { return schemaRetries; }
    public void setSchemaRetries(int schemaRetries) { this.schemaRetries = schemaRetries; }

    public EngineSettings toSettings() {
      return new EngineSettings(mappingTable, nullSortDefault, arrayPolicy, schemaRetries);
    }
  }
}
