package com.sectune.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sectune.core.model.ChatMessage;
import com.sectune.core.model.ClassificationRecord;
import com.sectune.core.model.Conversation;
import com.sectune.core.model.FineTuningJob;
import com.sectune.core.model.Hyperparameters;
import com.sectune.core.model.JobStatus;
import com.sectune.core.model.MessageRole;
import com.sectune.core.model.PerformanceRecord;
import com.sectune.core.model.ThreatCategory;
import com.sectune.core.model.TrainingExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * PostgreSQL-backed {@link TrainingStore}.
 * <p>
 * Claiming uses a single {@code UPDATE ... WHERE conversation_id IN (SELECT ... FOR
 * UPDATE SKIP LOCKED) RETURNING ...} statement, so concurrent callers never receive
 * the same record. Job transitions are conditional on the stored status, and the
 * trigger lease is an upsert guarded by its expiry.
 * <p>
 * The conversation tables belong to the chat system; they are only created here
 * when missing so a fresh database is usable.
 */
public class JdbcTrainingStore implements TrainingStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTrainingStore.class);

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS conversations (
                id          VARCHAR(255) PRIMARY KEY,
                created_at  TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS conversation_messages (
                conversation_id VARCHAR(255) NOT NULL REFERENCES conversations(id),
                sequence_index  INTEGER NOT NULL,
                role            VARCHAR(16) NOT NULL,
                content         TEXT,
                PRIMARY KEY (conversation_id, sequence_index)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS classification_records (
                conversation_id        VARCHAR(255) PRIMARY KEY,
                is_security_related    BOOLEAN NOT NULL,
                confidence             DOUBLE PRECISION NOT NULL,
                threat_category        VARCHAR(64),
                matched_keywords       TEXT NOT NULL,
                processed_for_training BOOLEAN NOT NULL DEFAULT FALSE,
                training_job_id        BIGINT,
                classified_at          TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """,
            """
            CREATE INDEX IF NOT EXISTS idx_classification_qualifying
                ON classification_records (processed_for_training, is_security_related, confidence)
            """,
            """
            CREATE TABLE IF NOT EXISTS fine_tuning_jobs (
                id                  BIGSERIAL PRIMARY KEY,
                job_name            VARCHAR(255) NOT NULL,
                model_type          VARCHAR(255) NOT NULL,
                base_model          VARCHAR(255) NOT NULL,
                status              VARCHAR(32) NOT NULL,
                training_data_count INTEGER NOT NULL DEFAULT 0,
                hyperparameters     TEXT,
                provider_job_id     VARCHAR(255),
                fine_tuned_model_id VARCHAR(255),
                error_message       TEXT,
                created_at          TIMESTAMP WITH TIME ZONE NOT NULL,
                updated_at          TIMESTAMP WITH TIME ZONE NOT NULL,
                completed_at        TIMESTAMP WITH TIME ZONE
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS training_examples (
                id                 BIGSERIAL PRIMARY KEY,
                job_id             BIGINT NOT NULL REFERENCES fine_tuning_jobs(id),
                conversation_id    VARCHAR(255),
                system_prompt      TEXT,
                user_message       TEXT,
                assistant_response TEXT,
                quality_score      DOUBLE PRECISION NOT NULL,
                threat_category    VARCHAR(64)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS performance_records (
                id              BIGSERIAL PRIMARY KEY,
                model_id        VARCHAR(255) NOT NULL,
                evaluation_type VARCHAR(64) NOT NULL,
                score           DOUBLE PRECISION NOT NULL,
                test_data_size  INTEGER NOT NULL,
                evaluation_date TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS trigger_leases (
                name       VARCHAR(255) PRIMARY KEY,
                holder     VARCHAR(255) NOT NULL,
                expires_at TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """
    );

    private static final String RECORD_COLUMNS = """
            conversation_id, is_security_related, confidence, threat_category,
            matched_keywords, processed_for_training, training_job_id, classified_at
            """;

    private static final String SELECT_MESSAGES_SQL = """
            SELECT sequence_index, role, content
            FROM conversation_messages
            WHERE conversation_id = ?
            ORDER BY sequence_index ASC
            """;

    private static final String UPSERT_CLASSIFICATION_SQL = """
            INSERT INTO classification_records (%s)
            VALUES (?, ?, ?, ?, ?, FALSE, NULL, ?)
            ON CONFLICT (conversation_id)
            DO UPDATE SET is_security_related = EXCLUDED.is_security_related,
                          confidence = EXCLUDED.confidence,
                          threat_category = EXCLUDED.threat_category,
                          matched_keywords = EXCLUDED.matched_keywords,
                          classified_at = EXCLUDED.classified_at
            """.formatted(RECORD_COLUMNS);

    private static final String SELECT_CLASSIFICATION_SQL = """
            SELECT %s FROM classification_records WHERE conversation_id = ?
            """.formatted(RECORD_COLUMNS);

    private static final String COUNT_QUALIFYING_SQL = """
            SELECT COUNT(*) FROM classification_records
            WHERE is_security_related = TRUE
              AND processed_for_training = FALSE
              AND confidence >= ?
            """;

    private static final String CLAIM_BATCH_SQL = """
            UPDATE classification_records
            SET processed_for_training = TRUE, training_job_id = ?
            WHERE conversation_id IN (
                SELECT conversation_id FROM classification_records
                WHERE is_security_related = TRUE
                  AND processed_for_training = FALSE
                  AND confidence >= ?
                ORDER BY classified_at ASC, conversation_id ASC
                LIMIT ?
                FOR UPDATE SKIP LOCKED
            )
            AND processed_for_training = FALSE
            RETURNING %s
            """.formatted(RECORD_COLUMNS);

    private static final String SELECT_HELD_OUT_SQL = """
            SELECT %s FROM classification_records
            WHERE is_security_related = TRUE AND processed_for_training = FALSE AND confidence >= ?
            ORDER BY classified_at DESC, conversation_id ASC
            LIMIT ?
            """.formatted(RECORD_COLUMNS);

    private static final String JOB_COLUMNS = """
            id, job_name, model_type, base_model, status, training_data_count, hyperparameters,
            provider_job_id, fine_tuned_model_id, error_message, created_at, updated_at, completed_at
            """;

    private static final String INSERT_JOB_SQL = """
            INSERT INTO fine_tuning_jobs (job_name, model_type, base_model, status, training_data_count,
                                          hyperparameters, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """;

    private static final String SELECT_JOB_SQL = """
            SELECT %s FROM fine_tuning_jobs WHERE id = ?
            """.formatted(JOB_COLUMNS);

    private static final String SELECT_JOBS_BY_STATUS_SQL = """
            SELECT %s FROM fine_tuning_jobs WHERE status = ANY (?) ORDER BY id ASC
            """.formatted(JOB_COLUMNS);

    private static final String CAS_JOB_SQL = """
            UPDATE fine_tuning_jobs
            SET status = ?, training_data_count = ?, provider_job_id = ?, fine_tuned_model_id = ?,
                error_message = ?, updated_at = ?, completed_at = ?
            WHERE id = ? AND status = ?
            """;

    private static final String INSERT_EXAMPLE_SQL = """
            INSERT INTO training_examples (job_id, conversation_id, system_prompt, user_message,
                                           assistant_response, quality_score, threat_category)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_EXAMPLES_SQL = """
            SELECT conversation_id, system_prompt, user_message, assistant_response, quality_score, threat_category
            FROM training_examples WHERE job_id = ? ORDER BY id ASC
            """;

    private static final String INSERT_PERFORMANCE_SQL = """
            INSERT INTO performance_records (model_id, evaluation_type, score, test_data_size, evaluation_date)
            VALUES (?, ?, ?, ?, ?)
            """;

    private static final String SELECT_PERFORMANCE_SQL = """
            SELECT model_id, evaluation_type, score, test_data_size, evaluation_date
            FROM performance_records WHERE model_id = ? ORDER BY evaluation_date ASC, id ASC
            """;

    private static final String ACQUIRE_LEASE_SQL = """
            INSERT INTO trigger_leases (name, holder, expires_at)
            VALUES (?, ?, ?)
            ON CONFLICT (name)
            DO UPDATE SET holder = EXCLUDED.holder, expires_at = EXCLUDED.expires_at
            WHERE trigger_leases.expires_at < ? OR trigger_leases.holder = EXCLUDED.holder
            """;

    private static final String RELEASE_LEASE_SQL = """
            DELETE FROM trigger_leases WHERE name = ? AND holder = ?
            """;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcTrainingStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the store's tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : CREATE_TABLES_SQL) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Training store tables ensured");
        }
    }

    @Override
    public Optional<Conversation> findConversation(String conversationId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_MESSAGES_SQL)) {
            stmt.setString(1, conversationId);
            var messages = new ArrayList<ChatMessage>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    messages.add(new ChatMessage(
                            MessageRole.fromWireName(rs.getString("role")),
                            rs.getString("content"),
                            rs.getInt("sequence_index")));
                }
            }
            return messages.isEmpty() ? Optional.empty() : Optional.of(new Conversation(conversationId, messages));
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to load conversation " + conversationId, e);
        }
    }

    @Override
    public void saveClassification(ClassificationRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_CLASSIFICATION_SQL)) {
            stmt.setString(1, record.conversationId());
            stmt.setBoolean(2, record.securityRelated());
            stmt.setDouble(3, record.confidence());
            stmt.setString(4, record.threatCategory() == null ? null : record.threatCategory().label());
            stmt.setString(5, writeJson(new TreeSet<>(record.matchedKeywords())));
            stmt.setTimestamp(6, Timestamp.from(record.classifiedAt()));
            stmt.executeUpdate();
            log.debug("Saved classification for conversation '{}'", record.conversationId());
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to save classification for " + record.conversationId(), e);
        }
    }

    @Override
    public Optional<ClassificationRecord> findClassification(String conversationId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CLASSIFICATION_SQL)) {
            stmt.setString(1, conversationId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(recordFromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to load classification for " + conversationId, e);
        }
    }

    @Override
    public int countQualifying(double minConfidence) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_QUALIFYING_SQL)) {
            stmt.setDouble(1, minConfidence);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to count qualifying classifications", e);
        }
    }

    @Override
    public List<ClassificationRecord> claimBatch(long jobId, double minConfidence, int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CLAIM_BATCH_SQL)) {
            stmt.setLong(1, jobId);
            stmt.setDouble(2, minConfidence);
            stmt.setInt(3, limit);
            var claimed = new ArrayList<ClassificationRecord>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    claimed.add(recordFromResultSet(rs));
                }
            }
            log.debug("Claimed {} classification records for job {}", claimed.size(), jobId);
            return claimed;
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to claim batch for job " + jobId, e);
        }
    }

    @Override
    public List<ClassificationRecord> findHeldOut(double minConfidence, int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_HELD_OUT_SQL)) {
            stmt.setDouble(1, minConfidence);
            stmt.setInt(2, limit);
            var records = new ArrayList<ClassificationRecord>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(recordFromResultSet(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to load held-out sample", e);
        }
    }

    @Override
    public FineTuningJob createJob(FineTuningJob job) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_JOB_SQL)) {
            stmt.setString(1, job.jobName());
            stmt.setString(2, job.modelType());
            stmt.setString(3, job.baseModel());
            stmt.setString(4, job.status().name());
            stmt.setInt(5, job.trainingDataCount());
            stmt.setString(6, job.hyperparameters() == null ? null : writeJson(job.hyperparameters()));
            stmt.setTimestamp(7, Timestamp.from(job.createdAt()));
            stmt.setTimestamp(8, Timestamp.from(job.updatedAt()));
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return job.withId(rs.getLong(1));
            }
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to create job " + job.jobName(), e);
        }
    }

    @Override
    public Optional<FineTuningJob> findJob(long jobId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_JOB_SQL)) {
            stmt.setLong(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(jobFromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to load job " + jobId, e);
        }
    }

    @Override
    public List<FineTuningJob> findJobsByStatus(Set<JobStatus> statuses) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_JOBS_BY_STATUS_SQL)) {
            Object[] names = statuses.stream().map(JobStatus::name).toArray();
            stmt.setArray(1, conn.createArrayOf("varchar", names));
            var jobs = new ArrayList<FineTuningJob>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(jobFromResultSet(rs));
                }
            }
            return jobs;
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to list jobs by status " + statuses, e);
        }
    }

    @Override
    public boolean compareAndSetJob(FineTuningJob updated, JobStatus expected) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CAS_JOB_SQL)) {
            stmt.setString(1, updated.status().name());
            stmt.setInt(2, updated.trainingDataCount());
            stmt.setString(3, updated.providerJobId());
            stmt.setString(4, updated.fineTunedModelId());
            stmt.setString(5, updated.errorMessage());
            stmt.setTimestamp(6, Timestamp.from(updated.updatedAt()));
            setNullableTimestamp(stmt, 7, updated.completedAt());
            stmt.setLong(8, updated.id());
            stmt.setString(9, expected.name());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to update job " + updated.id(), e);
        }
    }

    @Override
    public void appendExamples(long jobId, List<TrainingExample> examples) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_EXAMPLE_SQL)) {
            for (TrainingExample example : examples) {
                stmt.setLong(1, jobId);
                stmt.setString(2, example.conversationId());
                stmt.setString(3, example.systemPrompt());
                stmt.setString(4, example.userMessage());
                stmt.setString(5, example.assistantResponse());
                stmt.setDouble(6, example.qualityScore());
                stmt.setString(7, example.threatCategory() == null ? null : example.threatCategory().label());
                stmt.addBatch();
            }
            stmt.executeBatch();
            log.debug("Appended {} training examples to job {}", examples.size(), jobId);
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to append examples to job " + jobId, e);
        }
    }

    @Override
    public List<TrainingExample> findExamples(long jobId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_EXAMPLES_SQL)) {
            stmt.setLong(1, jobId);
            var examples = new ArrayList<TrainingExample>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    examples.add(new TrainingExample(
                            rs.getString("conversation_id"),
                            rs.getString("system_prompt"),
                            rs.getString("user_message"),
                            rs.getString("assistant_response"),
                            rs.getDouble("quality_score"),
                            ThreatCategory.fromLabel(rs.getString("threat_category")).orElse(null)));
                }
            }
            return examples;
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to load examples for job " + jobId, e);
        }
    }

    @Override
    public void appendPerformance(PerformanceRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_PERFORMANCE_SQL)) {
            stmt.setString(1, record.modelId());
            stmt.setString(2, record.evaluationType());
            stmt.setDouble(3, record.score());
            stmt.setInt(4, record.testDataSize());
            stmt.setTimestamp(5, Timestamp.from(record.evaluationDate()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to append performance record for " + record.modelId(), e);
        }
    }

    @Override
    public List<PerformanceRecord> findPerformance(String modelId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_PERFORMANCE_SQL)) {
            stmt.setString(1, modelId);
            var records = new ArrayList<PerformanceRecord>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(new PerformanceRecord(
                            rs.getString("model_id"),
                            rs.getString("evaluation_type"),
                            rs.getDouble("score"),
                            rs.getInt("test_data_size"),
                            rs.getTimestamp("evaluation_date").toInstant()));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to load performance records for " + modelId, e);
        }
    }

    @Override
    public boolean tryAcquireLease(String name, String holder, Duration ttl) {
        Instant now = Instant.now();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(ACQUIRE_LEASE_SQL)) {
            stmt.setString(1, name);
            stmt.setString(2, holder);
            stmt.setTimestamp(3, Timestamp.from(now.plus(ttl)));
            stmt.setTimestamp(4, Timestamp.from(now));
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to acquire lease " + name, e);
        }
    }

    @Override
    public void releaseLease(String name, String holder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(RELEASE_LEASE_SQL)) {
            stmt.setString(1, name);
            stmt.setString(2, holder);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new TrainingStoreException("Failed to release lease " + name, e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private ClassificationRecord recordFromResultSet(ResultSet rs) throws SQLException {
        long jobId = rs.getLong("training_job_id");
        Long trainingJobId = rs.wasNull() ? null : jobId;
        return new ClassificationRecord(
                rs.getString("conversation_id"),
                rs.getBoolean("is_security_related"),
                rs.getDouble("confidence"),
                ThreatCategory.fromLabel(rs.getString("threat_category")).orElse(null),
                readJson(rs.getString("matched_keywords"), new TypeReference<Set<String>>() {}),
                rs.getBoolean("processed_for_training"),
                trainingJobId,
                rs.getTimestamp("classified_at").toInstant());
    }

    private FineTuningJob jobFromResultSet(ResultSet rs) throws SQLException {
        String hyperparameters = rs.getString("hyperparameters");
        Timestamp completedAt = rs.getTimestamp("completed_at");
        return new FineTuningJob(
                rs.getLong("id"),
                rs.getString("job_name"),
                rs.getString("model_type"),
                rs.getString("base_model"),
                JobStatus.valueOf(rs.getString("status")),
                rs.getInt("training_data_count"),
                hyperparameters == null ? null : readJson(hyperparameters, new TypeReference<Hyperparameters>() {}),
                rs.getString("provider_job_id"),
                rs.getString("fine_tuned_model_id"),
                rs.getString("error_message"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant(),
                completedAt == null ? null : completedAt.toInstant());
    }

    private static void setNullableTimestamp(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setTimestamp(index, Timestamp.from(value));
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize stored JSON", e);
        }
    }
}
