package net.sentiflow.adapter.jdbc.repo;

import net.sentiflow.adapter.jdbc.JdbcUtil;
import net.sentiflow.adapter.jdbc.TxContext;
import net.sentiflow.adapter.jdbc.mapper.RowMappers;
import net.sentiflow.core.error.PreconditionException;
import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.RegisterEntry;
import net.sentiflow.core.spi.TemporalDatasetStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 시계열 데이터셋을 TB_STDS / TB_STDS_ENTRY 에 둔다.
 * 항목은 (STDS_ID, ARTIFACT) 유니크. 같은 아티팩트 재등록은 시각/label 갱신.
 */
public final class JdbcTemporalDatasetStore implements TemporalDatasetStore {
    private final DataSource ds;

    public JdbcTemporalDatasetStore(DataSource ds) {
        this.ds = ds;
    }

    private Connection mustConn() {
        return TxContext.require();
    }

    private record Header(long id, Artifact.Type type, String title, String description) {}

    @Override
    public void create(String dataset, Artifact.Type type, String title, String description) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                MERGE INTO TB_STDS d
                USING (SELECT CAST(? AS VARCHAR2(200)) NAME FROM dual) s
                   ON (d.NAME = s.NAME)
                 WHEN MATCHED THEN UPDATE SET
                      STDS_TYPE   = ?,
                      TITLE       = ?,
                      DESCRIPTION = ?,
                      UPDATED_AT  = CURRENT_TIMESTAMP
                 WHEN NOT MATCHED THEN
                   INSERT (NAME, STDS_TYPE, TITLE, DESCRIPTION, CREATED_AT, UPDATED_AT)
                   VALUES (s.NAME, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
                """)) {
            ps.setString(1, dataset);
            ps.setString(2, type.code());
            ps.setString(3, title);
            ps.setString(4, description);
            ps.setString(5, type.code());
            ps.setString(6, title);
            ps.setString(7, description);
            ps.executeUpdate();
        }
        // 다시 만들면 빈 데이터셋
        long id = header(dataset).orElseThrow(() -> new IllegalStateException("dataset upsert failed")).id();
        try (PreparedStatement ps = mustConn().prepareStatement("DELETE FROM TB_STDS_ENTRY WHERE STDS_ID = ?")) {
            ps.setLong(1, id);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean exists(String dataset) throws Exception {
        return header(dataset).isPresent();
    }

    @Override
    public void register(String dataset, List<RegisterEntry> entries) throws Exception {
        long id = mustFind(dataset).id();
        try (PreparedStatement ps = mustConn().prepareStatement("""
                MERGE INTO TB_STDS_ENTRY e
                USING (SELECT CAST(? AS NUMBER(19)) STDS_ID, CAST(? AS VARCHAR2(400)) ARTIFACT FROM dual) s
                   ON (e.STDS_ID = s.STDS_ID AND e.ARTIFACT = s.ARTIFACT)
                 WHEN MATCHED THEN UPDATE SET
                      START_AT       = ?,
                      SEMANTIC_LABEL = ?
                 WHEN NOT MATCHED THEN
                   INSERT (STDS_ID, ARTIFACT, START_AT, SEMANTIC_LABEL, CREATED_AT)
                   VALUES (s.STDS_ID, s.ARTIFACT, ?, ?, CURRENT_TIMESTAMP)
                """)) {
            for (RegisterEntry e : entries) {
                ps.setLong(1, id);
                ps.setString(2, e.artifact());
                ps.setTimestamp(3, JdbcUtil.ts(e.start()));
                ps.setString(4, e.semanticLabel());
                ps.setTimestamp(5, JdbcUtil.ts(e.start()));
                ps.setString(6, e.semanticLabel());
                ps.addBatch();
            }
            if (!entries.isEmpty()) ps.executeBatch();
        }
        touch(id);
    }

    @Override
    public List<RegisterEntry> list(String dataset) throws Exception {
        long id = mustFind(dataset).id();
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT * FROM TB_STDS_ENTRY WHERE STDS_ID = ? ORDER BY START_AT, ID")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                List<RegisterEntry> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toRegisterEntry(rs));
                return out;
            }
        }
    }

    @Override
    public int extract(String source, String token, String output) throws Exception {
        Header src = mustFind(source);
        create(output, src.type(), src.title(), src.description());
        long outId = mustFind(output).id();
        try (PreparedStatement ps = mustConn().prepareStatement("""
                INSERT INTO TB_STDS_ENTRY (STDS_ID, ARTIFACT, START_AT, SEMANTIC_LABEL, CREATED_AT)
                SELECT ?, ARTIFACT, START_AT, SEMANTIC_LABEL, CURRENT_TIMESTAMP
                  FROM TB_STDS_ENTRY
                 WHERE STDS_ID = ?
                   AND ARTIFACT LIKE ? ESCAPE '\\'
                """)) {
            ps.setLong(1, outId);
            ps.setLong(2, src.id());
            ps.setString(3, JdbcUtil.containsPattern(token));
            return ps.executeUpdate();
        }
    }

    /** 데이터셋 종류 (테스트/검증용) */
    public Optional<Artifact.Type> type(String dataset) throws Exception {
        return header(dataset).map(Header::type);
    }

    private Header mustFind(String dataset) throws Exception {
        return header(dataset).orElseThrow(() ->
                new PreconditionException("Temporal dataset <" + dataset + "> not found"));
    }

    private Optional<Header> header(String dataset) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT ID, STDS_TYPE, TITLE, DESCRIPTION FROM TB_STDS WHERE NAME = ?")) {
            ps.setString(1, dataset);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new Header(rs.getLong("ID"), Artifact.Type.from(rs.getString("STDS_TYPE")),
                        rs.getString("TITLE"), rs.getString("DESCRIPTION")));
            }
        }
    }

    private void touch(long id) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "UPDATE TB_STDS SET UPDATED_AT = CURRENT_TIMESTAMP WHERE ID = ?")) {
            ps.setLong(1, id);
            ps.executeUpdate();
        }
    }
}
