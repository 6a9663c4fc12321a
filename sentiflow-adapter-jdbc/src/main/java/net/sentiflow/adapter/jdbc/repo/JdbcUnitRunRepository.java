package net.sentiflow.adapter.jdbc.repo;

import net.sentiflow.adapter.jdbc.TxContext;
import net.sentiflow.adapter.jdbc.mapper.RowMappers;
import net.sentiflow.core.model.UnitRun;
import net.sentiflow.core.spi.UnitRunRepository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcUnitRunRepository implements UnitRunRepository {
    private final DataSource ds;

    public JdbcUnitRunRepository(DataSource ds) { this.ds = ds; }

    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public UnitRun start(long batchRunId, String unitId, String subject, String stepName,
                         int workerId, String namespace) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                MERGE INTO TB_UNIT_RUN u
                USING (SELECT CAST(? AS NUMBER(19)) BATCH_RUN_ID, CAST(? AS VARCHAR2(200)) UNIT_ID FROM dual) s
                   ON (u.BATCH_RUN_ID = s.BATCH_RUN_ID AND u.UNIT_ID = s.UNIT_ID)
                 WHEN MATCHED THEN UPDATE SET
                      STATUS      = 'RUNNING',
                      ATTEMPT     = u.ATTEMPT + 1,
                      WORKER_ID   = ?,
                      NAMESPACE   = ?,
                      STARTED_AT  = CURRENT_TIMESTAMP,
                      FINISHED_AT = NULL,
                      LAST_ERROR  = NULL,
                      UPDATED_AT  = CURRENT_TIMESTAMP
                 WHEN NOT MATCHED THEN INSERT (
                      BATCH_RUN_ID, UNIT_ID, SUBJECT, STEP_NAME, STATUS, WORKER_ID, ATTEMPT, NAMESPACE,
                      STARTED_AT, CREATED_AT, UPDATED_AT
                 ) VALUES (
                      s.BATCH_RUN_ID, s.UNIT_ID, ?, ?, 'RUNNING', ?, 1, ?,
                      CURRENT_TIMESTAMP, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP
                 )
                """)) {
            ps.setLong(1, batchRunId);
            ps.setString(2, unitId);
            ps.setInt(3, workerId);
            ps.setString(4, namespace);
            ps.setString(5, subject);
            ps.setString(6, stepName);
            ps.setInt(7, workerId);
            ps.setString(8, namespace);
            ps.executeUpdate();
        }
        return find(batchRunId, unitId)
                .orElseThrow(() -> new IllegalStateException("UnitRun start failed unexpectedly"));
    }

    @Override
    public void markDone(long batchRunId, String unitId) throws Exception {
        finish(batchRunId, unitId, UnitRun.Status.DONE, null);
    }

    @Override
    public void markFailed(long batchRunId, String unitId, String error) throws Exception {
        finish(batchRunId, unitId, UnitRun.Status.FAILED, error);
    }

    /** 실행 없이 끝난 유닛. 이미 있으면 상태만 덮어쓴다 */
    @Override
    public void record(long batchRunId, String unitId, String subject, String stepName,
                       UnitRun.Status status, String note) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                MERGE INTO TB_UNIT_RUN u
                USING (SELECT CAST(? AS NUMBER(19)) BATCH_RUN_ID, CAST(? AS VARCHAR2(200)) UNIT_ID FROM dual) s
                   ON (u.BATCH_RUN_ID = s.BATCH_RUN_ID AND u.UNIT_ID = s.UNIT_ID)
                 WHEN MATCHED THEN UPDATE SET
                      STATUS      = ?,
                      LAST_ERROR  = ?,
                      FINISHED_AT = CURRENT_TIMESTAMP,
                      UPDATED_AT  = CURRENT_TIMESTAMP
                 WHEN NOT MATCHED THEN INSERT (
                      BATCH_RUN_ID, UNIT_ID, SUBJECT, STEP_NAME, STATUS, ATTEMPT, LAST_ERROR,
                      FINISHED_AT, CREATED_AT, UPDATED_AT
                 ) VALUES (
                      s.BATCH_RUN_ID, s.UNIT_ID, ?, ?, ?, 0, ?,
                      CURRENT_TIMESTAMP, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP
                 )
                """)) {
            ps.setLong(1, batchRunId);
            ps.setString(2, unitId);
            ps.setString(3, status.code());
            ps.setString(4, note);
            ps.setString(5, subject);
            ps.setString(6, stepName);
            ps.setString(7, status.code());
            ps.setString(8, note);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<UnitRun> find(long batchRunId, String unitId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT * FROM TB_UNIT_RUN WHERE BATCH_RUN_ID = ? AND UNIT_ID = ?")) {
            ps.setLong(1, batchRunId);
            ps.setString(2, unitId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toUnitRun(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<UnitRun> findAllByBatchRun(long batchRunId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT * FROM TB_UNIT_RUN WHERE BATCH_RUN_ID = ? ORDER BY ID")) {
            ps.setLong(1, batchRunId);
            try (ResultSet rs = ps.executeQuery()) {
                List<UnitRun> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toUnitRun(rs));
                return out;
            }
        }
    }

    private void finish(long batchRunId, String unitId, UnitRun.Status status, String error) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                UPDATE TB_UNIT_RUN
                   SET STATUS      = ?,
                       LAST_ERROR  = ?,
                       FINISHED_AT = CURRENT_TIMESTAMP,
                       UPDATED_AT  = CURRENT_TIMESTAMP
                 WHERE BATCH_RUN_ID = ? AND UNIT_ID = ?
                """)) {
            ps.setString(1, status.code());
            ps.setString(2, error);
            ps.setLong(3, batchRunId);
            ps.setString(4, unitId);
            ps.executeUpdate();
        }
    }
}
