package io.intellixity.quire.persistence.config;

import io.intellixity.quire.persistence.query.InvalidParametersException;
import io.intellixity.quire.persistence.relation.BatchLoadConfig;

import java.util.Properties;

/**
 * Weights and cutoff of the join-vs-batch complexity score, plus batch loading defaults.\n
 *
 * The weights are empirical; they are kept configurable rather than derived.
 */
public record RelationSettings(double complexityThreshold,
                               double relationCountWeight,
                               int relationCountLimit,
                               double pipelineWeight,
                               int pipelineStageLimit,
                               double filterWeight,
                               double pathFieldWeight,
                               BatchLoadConfig defaultBatch,
                               long defaultCacheTtlSeconds) {
  public static final String PREFIX = "quire.relation.";

  public RelationSettings {
    if (complexityThreshold < 0 || complexityThreshold > 1) {
      throw new InvalidParametersException("complexityThreshold must be within [0, 1]");
    }
    if (relationCountLimit < 0 || pipelineStageLimit < 0) {
      throw new InvalidParametersException("relation/pipeline limits must be >= 0");
    }
    if (relationCountWeight < 0 || pipelineWeight < 0 || filterWeight < 0 || pathFieldWeight < 0) {
      throw new InvalidParametersException("complexity weights must be >= 0");
    }
    if (defaultBatch == null) throw new InvalidParametersException("defaultBatch must not be null");
    if (defaultCacheTtlSeconds <= 0) throw new InvalidParametersException("defaultCacheTtlSeconds must be > 0");
  }

  public static RelationSettings defaults() {
    return new RelationSettings(0.7, 0.3, 2, 0.2, 2, 0.3, 0.2, BatchLoadConfig.defaults(), 300);
  }

  public RelationSettings withComplexityThreshold(double v) {
    return new RelationSettings(v, relationCountWeight, relationCountLimit, pipelineWeight, pipelineStageLimit,
        filterWeight, pathFieldWeight, defaultBatch, defaultCacheTtlSeconds);
  }

  public static RelationSettings fromProperties(Properties p) {
    RelationSettings d = defaults();
    BatchLoadConfig b = d.defaultBatch();
    BatchLoadConfig batch = new BatchLoadConfig(
        Props.intOr(p, PREFIX + "batch-size", b.batchSize()),
        Props.intOr(p, PREFIX + "max-concurrency", b.maxConcurrency()),
        Props.boolOr(p, PREFIX + "cache-results", b.cacheResults()),
        Props.longOr(p, PREFIX + "cache-ttl-seconds", b.cacheTtlSeconds()));
    return new RelationSettings(
        Props.doubleOr(p, PREFIX + "complexity-threshold", d.complexityThreshold()),
        Props.doubleOr(p, PREFIX + "relation-count-weight", d.relationCountWeight()),
        Props.intOr(p, PREFIX + "relation-count-limit", d.relationCountLimit()),
        Props.doubleOr(p, PREFIX + "pipeline-weight", d.pipelineWeight()),
        Props.intOr(p, PREFIX + "pipeline-stage-limit", d.pipelineStageLimit()),
        Props.doubleOr(p, PREFIX + "filter-weight", d.filterWeight()),
        Props.doubleOr(p, PREFIX + "path-field-weight", d.pathFieldWeight()),
        batch,
        Props.longOr(p, PREFIX + "default-cache-ttl-seconds", d.defaultCacheTtlSeconds()));
  }
}
