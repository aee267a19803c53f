package io.shiftwatch.internal.mongo;

import io.shiftwatch.core.CounterSample;
import io.shiftwatch.core.SampleRecord;
import io.shiftwatch.core.SnapshotSample;
import io.shiftwatch.core.StorageException;
import io.shiftwatch.core.TitledValue;
import io.shiftwatch.store.TimeSeriesStore;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One collection per series, one document per sample, indexed on {@code timestamp}.
 *
 * <p>Counter samples: {@code {timestamp, value, difference, speed, metricUnit}}.
 * Snapshot samples: {@code {timestamp, values: [{title, value, metricUnit}]}}.
 */
public class MongoTimeSeriesStore implements TimeSeriesStore {

    static final String TIMESTAMP = "timestamp";
    // insertion order among samples sharing a timestamp
    static final String ID = "_id";
    static final String IDX_TIMESTAMP = "idx_timestamp";

    private final MongoTemplate mongoTemplate;

    public MongoTimeSeriesStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public void createSeries(String key) {
        try {
            if (!mongoTemplate.collectionExists(key)) {
                mongoTemplate.createCollection(key);
            }
            mongoTemplate.indexOps(key).ensureIndex(new Index().on(TIMESTAMP, Sort.Direction.DESC).named(IDX_TIMESTAMP));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to create series: " + key, e);
        }
    }

    @Override
    public boolean seriesExists(String key) {
        try {
            return mongoTemplate.collectionExists(key);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to check series: " + key, e);
        }
    }

    @Override
    public void append(String key, SampleRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        try {
            mongoTemplate.insert(toDocument(record), key);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to append to series: " + key, e);
        }
    }

    @Override
    public Optional<SampleRecord> last(String key, int skip) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative");
        }
        Query q = new Query()
                .with(Sort.by(Sort.Direction.DESC, TIMESTAMP, ID))
                .skip(skip)
                .limit(1);
        try {
            return Optional.ofNullable(mongoTemplate.findOne(q, Document.class, key)).map(MongoTimeSeriesStore::toRecord);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read series: " + key, e);
        }
    }

    @Override
    public List<SampleRecord> query(String key, Instant from, Instant to, int limit) {
        Query q = new Query(Criteria.where(TIMESTAMP).gte(Date.from(from)).lte(Date.from(to)))
                .with(Sort.by(Sort.Direction.ASC, TIMESTAMP, ID))
                .limit(limit);
        try {
            List<Document> docs = mongoTemplate.find(q, Document.class, key);
            List<SampleRecord> records = new ArrayList<>(docs.size());
            for (Document doc : docs) {
                records.add(toRecord(doc));
            }
            return records;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to query series: " + key, e);
        }
    }

    @Override
    public void dropSeries(String key) {
        try {
            mongoTemplate.dropCollection(key);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to drop series: " + key, e);
        }
    }

    static Document toDocument(SampleRecord record) {
        Document doc = new Document(TIMESTAMP, Date.from(record.timestamp()));
        if (record instanceof CounterSample c) {
            doc.append("value", c.value())
                    .append("difference", c.difference())
                    .append("speed", c.speed())
                    .append("metricUnit", c.metricUnit());
        } else if (record instanceof SnapshotSample s) {
            List<Document> values = new ArrayList<>(s.values().size());
            for (TitledValue v : s.values()) {
                values.add(new Document("title", v.title())
                        .append("value", v.value())
                        .append("metricUnit", v.metricUnit()));
            }
            doc.append("values", values);
        } else {
            throw new IllegalArgumentException("Unsupported sample type: " + record.getClass().getName());
        }
        return doc;
    }

    static SampleRecord toRecord(Document doc) {
        Instant timestamp = doc.getDate(TIMESTAMP).toInstant();
        List<Document> values = doc.getList("values", Document.class);
        if (values != null) {
            List<TitledValue> titled = new ArrayList<>(values.size());
            for (Document v : values) {
                titled.add(new TitledValue(v.getString("title"), number(v, "value"), v.getString("metricUnit")));
            }
            return new SnapshotSample(timestamp, titled);
        }
        return new CounterSample(
                timestamp,
                number(doc, "value"),
                number(doc, "difference"),
                number(doc, "speed"),
                doc.getString("metricUnit")
        );
    }

    private static double number(Document doc, String field) {
        Object v = doc.get(field);
        return v instanceof Number n ? n.doubleValue() : 0.0;
    }
}
