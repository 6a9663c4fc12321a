package net.sentiflow.adapter.jdbc.repo;

import net.sentiflow.adapter.jdbc.JdbcUtil;
import net.sentiflow.adapter.jdbc.TxContext;
import net.sentiflow.adapter.jdbc.mapper.RowMappers;
import net.sentiflow.core.model.BatchRun;
import net.sentiflow.core.spi.BatchRunRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.Optional;

public final class JdbcBatchRunRepository implements BatchRunRepository {
    private final DataSource ds;

    public JdbcBatchRunRepository(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    /**
     * (KIND, RUN_KEY) 유니크 기반 멱등 생성.
     * 이미 있으면 그대로 두고 최신 행을 돌려준다.
     */
    @Override
    public BatchRun upsert(BatchRun.Kind kind, String runKey, int workers, long memoryMb) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                MERGE INTO TB_BATCH_RUN d
                USING (SELECT CAST(? AS VARCHAR2(20)) KIND, CAST(? AS VARCHAR2(200)) RUN_KEY FROM dual) s
                   ON (d.KIND = s.KIND AND d.RUN_KEY = s.RUN_KEY)
                 WHEN NOT MATCHED THEN
                   INSERT (KIND, RUN_KEY, STATUS, WORKERS, MEMORY_MB, CREATED_AT, UPDATED_AT)
                   VALUES (s.KIND, s.RUN_KEY, 'CREATED', ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
                """)) {
            ps.setString(1, kind.code());
            ps.setString(2, runKey);
            ps.setInt(3, workers);
            ps.setLong(4, memoryMb);
            ps.executeUpdate();
        }
        return findByKindAndRunKey(kind, runKey)
                .orElseThrow(() -> new IllegalStateException("BatchRun upsert failed unexpectedly"));
    }

    public Optional<BatchRun> findByKindAndRunKey(BatchRun.Kind kind, String runKey) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT * FROM TB_BATCH_RUN WHERE KIND = ? AND RUN_KEY = ?")) {
            ps.setString(1, kind.code());
            ps.setString(2, runKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toBatchRun(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<BatchRun> findById(long id) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM TB_BATCH_RUN WHERE ID = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toBatchRun(rs)) : Optional.empty();
            }
        }
    }

    /** RUNNING 전환 + STARTED_AT 최초 세팅 */
    @Override
    public void markStarted(long batchRunId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE TB_BATCH_RUN
                   SET STATUS     = 'RUNNING',
                       STARTED_AT = COALESCE(STARTED_AT, CURRENT_TIMESTAMP),
                       UPDATED_AT = CURRENT_TIMESTAMP
                 WHERE ID = ?
                """)) {
            ps.setLong(1, batchRunId);
            ps.executeUpdate();
        }
    }

    @Override
    public void markFinished(long batchRunId, BatchRun.Status status, String summary) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE TB_BATCH_RUN
                   SET STATUS      = ?,
                       SUMMARY     = ?,
                       FINISHED_AT = CURRENT_TIMESTAMP,
                       UPDATED_AT  = CURRENT_TIMESTAMP
                 WHERE ID = ?
                """)) {
            ps.setString(1, status.code());
            ps.setString(2, summary);
            ps.setLong(3, batchRunId);
            ps.executeUpdate();
        }
    }

    /** 유닛 기록은 FK ON DELETE CASCADE 로 함께 지워진다 */
    @Override
    public int deleteFinishedOlderThan(Instant threshold) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                DELETE FROM TB_BATCH_RUN
                 WHERE STATUS IN ('DONE', 'FAILED', 'CANCELLED')
                   AND FINISHED_AT IS NOT NULL
                   AND FINISHED_AT < ?
                """)) {
            ps.setTimestamp(1, JdbcUtil.ts(threshold));
            return ps.executeUpdate();
        }
    }
}
