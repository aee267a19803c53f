package io.shiftwatch.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.shiftwatch.core.DuplicateJobException;
import io.shiftwatch.core.JobParameters;
import io.shiftwatch.core.JobState;
import io.shiftwatch.core.MonitorJob;
import io.shiftwatch.core.StorageException;
import io.shiftwatch.core.Trigger;
import io.shiftwatch.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for job definitions.
 *
 * <p>Trigger and parameters are stored as plain sub-documents converted with Jackson; the trigger
 * carries a {@code type} discriminator ({@code interval} or {@code cron}).
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final String collection;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, String collection) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
    }

    @Override
    public void insert(MonitorJob job) {
        Objects.requireNonNull(job, "job must not be null");
        try {
            mongoTemplate.insert(toDocument(job), collection);
        } catch (DuplicateKeyException e) {
            throw new DuplicateJobException(job.name());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to insert job: " + job.name(), e);
        }
    }

    @Override
    public Optional<MonitorJob> findByName(String name) {
        try {
            MonitorJobDocument doc = mongoTemplate.findById(name, MonitorJobDocument.class, collection);
            return Optional.ofNullable(doc).map(this::toJob);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load job: " + name, e);
        }
    }

    /**
     * Documents that no longer convert (e.g. written by an incompatible version) are logged and skipped.
     */
    @Override
    public List<MonitorJob> findAll() {
        List<MonitorJobDocument> docs;
        try {
            docs = mongoTemplate.findAll(MonitorJobDocument.class, collection);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load jobs", e);
        }

        List<MonitorJob> jobs = new ArrayList<>(docs.size());
        for (MonitorJobDocument doc : docs) {
            try {
                jobs.add(toJob(doc));
            } catch (IllegalArgumentException e) {
                log.error("shiftwatch stored job unreadable, skipped name={} msg={}", doc.getName(), e.getMessage());
            }
        }
        return jobs;
    }

    @Override
    public boolean updateSchedule(String name, JobState state, Instant nextRunAt) {
        Query q = new Query(Criteria.where("_id").is(name));
        Update u = new Update()
                .set("state", state)
                .set("nextRunAt", nextRunAt);
        try {
            return mongoTemplate.updateFirst(q, u, MonitorJobDocument.class, collection).getMatchedCount() > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to update job schedule: " + name, e);
        }
    }

    @Override
    public boolean deleteByName(String name) {
        Query q = new Query(Criteria.where("_id").is(name));
        try {
            return mongoTemplate.remove(q, MonitorJobDocument.class, collection).getDeletedCount() > 0;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete job: " + name, e);
        }
    }

    MonitorJobDocument toDocument(MonitorJob job) {
        MonitorJobDocument doc = new MonitorJobDocument();
        doc.setName(job.name());
        doc.setTrigger(objectMapper.convertValue(job.trigger(), MAP_TYPE));
        doc.setKind(job.kind());
        doc.setParameters(objectMapper.convertValue(job.parameters(), MAP_TYPE));
        doc.setState(job.state());
        doc.setNextRunAt(job.nextRunAt());
        doc.setCreatedAt(Instant.now());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(MonitorJob)}: the parameters map is converted back into the
     * parameters type of the stored kind.
     */
    MonitorJob toJob(MonitorJobDocument doc) {
        if (doc.getKind() == null) {
            throw new IllegalArgumentException("job " + doc.getName() + " has no kind");
        }
        Trigger trigger = objectMapper.convertValue(doc.getTrigger(), Trigger.class);
        JobParameters parameters = objectMapper.convertValue(doc.getParameters(), doc.getKind().parametersType());
        return new MonitorJob(doc.getName(), trigger, doc.getKind(), parameters, doc.getState(), doc.getNextRunAt());
    }
}
