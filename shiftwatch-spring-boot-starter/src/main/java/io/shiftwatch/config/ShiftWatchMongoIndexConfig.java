package io.shiftwatch.config;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the job collection.
 *
 * <p>Indexes are not created at startup unless {@code shiftwatch.ensure-indexes-on-startup=true}.
 * Series collections get their {@code timestamp} index when the series is created.
 *
 * <h3>Indexes (collection: {@code monitor_jobs} by default)</h3>
 * <ul>
 *   <li><b>idx_next_run_at</b>: { nextRunAt: 1 }, listing jobs by next fire time</li>
 *   <li><b>idx_state_kind</b>: { state: 1, kind: 1 }</li>
 * </ul>
 *
 * <pre>
 * db.monitor_jobs.createIndex({ nextRunAt: 1 }, { name: "idx_next_run_at" });
 * db.monitor_jobs.createIndex({ state: 1, kind: 1 }, { name: "idx_state_kind" });
 * </pre>
 */
public class ShiftWatchMongoIndexConfig {

    public static final String IDX_NEXT_RUN_AT = "idx_next_run_at";
    public static final String IDX_STATE_KIND = "idx_state_kind";

    private final MongoTemplate mongoTemplate;
    private final String jobsCollection;

    public ShiftWatchMongoIndexConfig(MongoTemplate mongoTemplate, String jobsCollection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.jobsCollection = Objects.requireNonNull(jobsCollection, "jobsCollection must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(jobsCollection).ensureIndex(nextRunAtIndex());
        mongoTemplate.indexOps(jobsCollection).ensureIndex(stateKindIndex());
    }

    public static Index nextRunAtIndex() {
        return new Index()
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_NEXT_RUN_AT);
    }

    public static Index stateKindIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .on("kind", Sort.Direction.ASC)
                .named(IDX_STATE_KIND);
    }
}
