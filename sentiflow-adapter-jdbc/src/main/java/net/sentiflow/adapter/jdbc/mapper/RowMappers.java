package net.sentiflow.adapter.jdbc.mapper;

import net.sentiflow.adapter.jdbc.JdbcUtil;
import net.sentiflow.core.model.BatchRun;
import net.sentiflow.core.model.RegisterEntry;
import net.sentiflow.core.model.UnitRun;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- RegisterEntry ---
    public static RegisterEntry toRegisterEntry(ResultSet rs) throws SQLException {
        return new RegisterEntry(
                rs.getString("ARTIFACT"),
                JdbcUtil.toLocal(rs.getTimestamp("START_AT")),
                rs.getString("SEMANTIC_LABEL")
        );
    }

    // --- BatchRun ---
    public static BatchRun toBatchRun(ResultSet rs) throws SQLException {
        Integer workers = rs.getInt("WORKERS");
        if (rs.wasNull()) workers = null;
        Long memory = rs.getLong("MEMORY_MB");
        if (rs.wasNull()) memory = null;
        return new BatchRun(
                rs.getLong("ID"),
                BatchRun.Kind.from(rs.getString("KIND")),
                rs.getString("RUN_KEY"),
                BatchRun.Status.from(rs.getString("STATUS")),
                workers,
                memory,
                rs.getString("SUMMARY"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("FINISHED_AT"))
        );
    }

    // --- UnitRun ---
    public static UnitRun toUnitRun(ResultSet rs) throws SQLException {
        Integer worker = rs.getInt("WORKER_ID");
        if (rs.wasNull()) worker = null;
        return new UnitRun(
                rs.getLong("ID"),
                rs.getLong("BATCH_RUN_ID"),
                rs.getString("UNIT_ID"),
                rs.getString("SUBJECT"),
                rs.getString("STEP_NAME"),
                UnitRun.Status.from(rs.getString("STATUS")),
                worker,
                rs.getLong("ATTEMPT"),
                rs.getString("NAMESPACE"),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("FINISHED_AT")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant(),
                rs.getString("LAST_ERROR")
        );
    }
}
