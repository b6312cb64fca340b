package io.intellixity.flatdoc.persistence.exec;

import io.intellixity.flatdoc.persistence.document.ArrayPolicy;

import java.util.Objects;

/**
 * Immutable engine configuration.\n
 *
 * @param mappingTable    reserved table holding the column name mapping
 * @param nullSortDefault value a missing sort field sorts as in paginated reads
 * @param arrayPolicy     treatment of array values on write
 * @param schemaRetries   how often a write that lost a schema race is retried
 */
public record EngineSettings(
    String mappingTable,
    String nullSortDefault,
    ArrayPolicy arrayPolicy,
    int schemaRetries
) {
  public static final String DEFAULT_MAPPING_TABLE = "flatdoc_name_mapping";
  public static final String DEFAULT_NULL_SORT = "0";
  public static final int DEFAULT_SCHEMA_RETRIES = 3;

  public EngineSettings {
    Objects.requireNonNull(mappingTable, "mappingTable");
    Objects.requireNonNull(nullSortDefault, "nullSortDefault");
    arrayPolicy = (arrayPolicy == null) ? ArrayPolicy.REJECT : arrayPolicy;
    if (schemaRetries < 0) throw new IllegalArgumentException("schemaRetries must be >= 0");
  }

  public static EngineSettings defaults() {
    return new EngineSettings(DEFAULT_MAPPING_TABLE, DEFAULT_NULL_SORT, ArrayPolicy.REJECT, DEFAULT_SCHEMA_RETRIES);
  }

  public EngineSettings withMappingTable(String v) { return new EngineSettings(v, nullSortDefault, arrayPolicy, schemaRetries); }
  public EngineSettings withNullSortDefault(String v) { return new EngineSettings(mappingTable, v, arrayPolicy, schemaRetries); }
  public EngineSettings withArrayPolicy(ArrayPolicy v) { return new EngineSettings(mappingTable, nullSortDefault, v, schemaRetries); }
  public EngineSettings withSchemaRetries(int v) { return new EngineSettings(mappingTable, nullSortDefault, arrayPolicy, v); }
}
