package io.shiftwatch.internal.mongo;

import io.shiftwatch.core.FunctionKind;
import io.shiftwatch.core.JobState;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for persisted monitoring jobs. The job name is the document id.
 */
@Document(collection = "monitor_jobs")
public class MonitorJobDocument {

    @Id
    private String name;

    private Map<String, Object> trigger;
    private FunctionKind kind;
    private Map<String, Object> parameters;
    private JobState state;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;

    private Instant createdAt;

    public MonitorJobDocument() {
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Map<String, Object> getTrigger() {
        return trigger;
    }

    public void setTrigger(Map<String, Object> trigger) {
        this.trigger = trigger;
    }

    public FunctionKind getKind() {
        return kind;
    }

    public void setKind(FunctionKind kind) {
        this.kind = kind;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, Object> parameters) {
        this.parameters = parameters;
    }

    public JobState getState() {
        return state;
    }

    public void setState(JobState state) {
        this.state = state;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
