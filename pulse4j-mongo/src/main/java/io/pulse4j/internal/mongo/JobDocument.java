package io.pulse4j.internal.mongo;

import io.pulse4j.core.BackoffType;
import io.pulse4j.core.JobType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;

/**
 * Mongo document model for persisted jobs.
 */
@Document(collection = JobDocument.COLLECTION)
public class JobDocument {

    public static final String COLLECTION = "pulse_jobs";

    @Id
    private String id;

    private String name;
    private JobType type;
    private int priority;
    private boolean disabled;
    private Integer progress;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;

    private Instant lockedAt;
    private String lockedBy;
    private Instant lastRunAt;
    private Instant lastFinishedAt;

    private int runCount;
    private int finishedCount;
    private int failCount;

    private String repeatInterval;
    private String repeatTimezone;
    private String repeatAt;
    private Instant startDate;
    private Instant endDate;
    private List<String> skipDays;

    private List<UniqueField> uniqueQuery;
    private Boolean uniqueInsertOnly;

    private BackoffType backoffType;
    private Long backoffDelay;
    private Integer attempts;

    private String failReason;
    private Instant failedAt;

    private boolean shouldSaveResult;
    private Object result;
    private Object data;
    private String lastModifiedBy;

    public JobDocument() {
    }

    /**
     * One condition of a job's unique query. Stored as a list entry because query paths
     * ("data.userId") are not valid document keys.
     */
    public static class UniqueField {
        private String path;
        private Object value;

        public UniqueField() {
        }

        public UniqueField(String path, Object value) {
            this.path = path;
            this.value = value;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Object getValue() {
            return value;
        }

        public void setValue(Object value) {
            this.value = value;
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public JobType getType() {
        return type;
    }

    public void setType(JobType type) {
        this.type = type;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }

    public Integer getProgress() {
        return progress;
    }

    public void setProgress(Integer progress) {
        this.progress = progress;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public Instant getLastFinishedAt() {
        return lastFinishedAt;
    }

    public void setLastFinishedAt(Instant lastFinishedAt) {
        this.lastFinishedAt = lastFinishedAt;
    }

    public int getRunCount() {
        return runCount;
    }

    public void setRunCount(int runCount) {
        this.runCount = runCount;
    }

    public int getFinishedCount() {
        return finishedCount;
    }

    public void setFinishedCount(int finishedCount) {
        this.finishedCount = finishedCount;
    }

    public int getFailCount() {
        return failCount;
    }

    public void setFailCount(int failCount) {
        this.failCount = failCount;
    }

    public String getRepeatInterval() {
        return repeatInterval;
    }

    public void setRepeatInterval(String repeatInterval) {
        this.repeatInterval = repeatInterval;
    }

    public String getRepeatTimezone() {
        return repeatTimezone;
    }

    public void setRepeatTimezone(String repeatTimezone) {
        this.repeatTimezone = repeatTimezone;
    }

    public String getRepeatAt() {
        return repeatAt;
    }

    public void setRepeatAt(String repeatAt) {
        this.repeatAt = repeatAt;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public void setStartDate(Instant startDate) {
        this.startDate = startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public void setEndDate(Instant endDate) {
        this.endDate = endDate;
    }

    public List<String> getSkipDays() {
        return skipDays;
    }

    public void setSkipDays(List<String> skipDays) {
        this.skipDays = skipDays;
    }

    public List<UniqueField> getUniqueQuery() {
        return uniqueQuery;
    }

    public void setUniqueQuery(List<UniqueField> uniqueQuery) {
        this.uniqueQuery = uniqueQuery;
    }

    public Boolean getUniqueInsertOnly() {
        return uniqueInsertOnly;
    }

    public void setUniqueInsertOnly(Boolean uniqueInsertOnly) {
        this.uniqueInsertOnly = uniqueInsertOnly;
    }

    public BackoffType getBackoffType() {
        return backoffType;
    }

    public void setBackoffType(BackoffType backoffType) {
        this.backoffType = backoffType;
    }

    public Long getBackoffDelay() {
        return backoffDelay;
    }

    public void setBackoffDelay(Long backoffDelay) {
        this.backoffDelay = backoffDelay;
    }

    public Integer getAttempts() {
        return attempts;
    }

    public void setAttempts(Integer attempts) {
        this.attempts = attempts;
    }

    public String getFailReason() {
        return failReason;
    }

    public void setFailReason(String failReason) {
        this.failReason = failReason;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(Instant failedAt) {
        this.failedAt = failedAt;
    }

    public boolean isShouldSaveResult() {
        return shouldSaveResult;
    }

    public void setShouldSaveResult(boolean shouldSaveResult) {
        this.shouldSaveResult = shouldSaveResult;
    }

    public Object getResult() {
        return result;
    }

    public void setResult(Object result) {
        this.result = result;
    }

    public Object getData() {
        return data;
    }

    public void setData(Object data) {
        this.data = data;
    }

    public String getLastModifiedBy() {
        return lastModifiedBy;
    }

    public void setLastModifiedBy(String lastModifiedBy) {
        this.lastModifiedBy = lastModifiedBy;
    }
}
