package net.batchq.adapter.jdbc.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.batchq.adapter.jdbc.TxContext;
import net.batchq.adapter.jdbc.mapper.RowMappers;
import net.batchq.core.model.Task;
import net.batchq.core.model.TaskFilter;
import net.batchq.core.spi.TaskArchive;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.batchq.adapter.jdbc.JdbcUtil.setStr;
import static net.batchq.adapter.jdbc.JdbcUtil.setTs;

/**
 * 태스크 스냅샷 아카이브 (BQ_TASK_ARCHIVE).
 * PARAMETERS / RESULT 는 JSON 문자열 컬럼.
 */
public final class JdbcTaskArchive implements TaskArchive {
    private final ObjectMapper json;

    public JdbcTaskArchive(ObjectMapper json) {
        this.json = json;
    }

    public JdbcTaskArchive() {
        this(new ObjectMapper());
    }

    /**
     * ID 기준 멱등 upsert.
     * - 존재 시: 가변 컬럼 전부 갱신 + UPDATED_AT bump
     * - 미존재 시: INSERT
     * MERGE 문법이 DB마다 달라 UPDATE → 0건이면 INSERT 로 처리.
     */
    @Override
    public void save(Task t) throws Exception {
        String params = json.writeValueAsString(t.parameters());
        String result = t.result() == null ? null : json.writeValueAsString(t.result());

        int updated;
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE BQ_TASK_ARCHIVE SET
                       STATUS       = ?,
                       WORKER_ID    = ?,
                       STARTED_AT   = ?,
                       COMPLETED_AT = ?,
                       CANCELLED_AT = ?,
                       REQUEUED_AT  = ?,
                       RETRY_COUNT  = ?,
                       RESULT       = ?,
                       ERROR        = ?,
                       UPDATED_AT   = CURRENT_TIMESTAMP
                 WHERE ID = ?
                """)) {
            ps.setString(1, t.status().code());
            setStr(ps, 2, t.workerId());
            setTs(ps, 3, t.startedAt());
            setTs(ps, 4, t.completedAt());
            setTs(ps, 5, t.cancelledAt());
            setTs(ps, 6, t.requeuedAt());
            ps.setInt(7, t.retryCount());
            setStr(ps, 8, result);
            setStr(ps, 9, t.error());
            ps.setString(10, t.id());
            updated = ps.executeUpdate();
        }
        if (updated > 0) return;

        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                INSERT INTO BQ_TASK_ARCHIVE(
                    ID, USER_ID, SYMBOL, PARAMETERS, PRIORITY, STATUS, BATCH_ID, WORKER_ID,
                    CREATED_AT, ENQUEUED_AT, STARTED_AT, COMPLETED_AT, CANCELLED_AT, REQUEUED_AT,
                    RETRY_COUNT, RESULT, ERROR, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
                """)) {
            ps.setString(1, t.id());
            ps.setString(2, t.userId());
            ps.setString(3, t.symbol());
            ps.setString(4, params);
            ps.setInt(5, t.priority().value());
            ps.setString(6, t.status().code());
            setStr(ps, 7, t.batchId());
            setStr(ps, 8, t.workerId());
            setTs(ps, 9, t.createdAt());
            setTs(ps, 10, t.enqueuedAt());
            setTs(ps, 11, t.startedAt());
            setTs(ps, 12, t.completedAt());
            setTs(ps, 13, t.cancelledAt());
            setTs(ps, 14, t.requeuedAt());
            ps.setInt(15, t.retryCount());
            setStr(ps, 16, result);
            setStr(ps, 17, t.error());
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<Task> load(String taskId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement(
                "SELECT * FROM BQ_TASK_ARCHIVE WHERE ID=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toTask(rs, json)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Task> query(TaskFilter f) throws Exception {
        StringBuilder sql = new StringBuilder("SELECT * FROM BQ_TASK_ARCHIVE WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (f.userId() != null)  { sql.append(" AND USER_ID=?");  args.add(f.userId()); }
        if (f.batchId() != null) { sql.append(" AND BATCH_ID=?"); args.add(f.batchId()); }
        if (f.symbol() != null)  { sql.append(" AND SYMBOL=?");   args.add(f.symbol()); }
        if (!f.statuses().isEmpty()) {
            sql.append(" AND STATUS IN (");
            int i = 0;
            for (Task.Status s : f.statuses()) {
                sql.append(i++ == 0 ? "?" : ",?");
                args.add(s.code());
            }
            sql.append(')');
        }
        sql.append(" ORDER BY CREATED_AT DESC, ID");

        try (PreparedStatement ps = TxContext.require().prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++) ps.setObject(i + 1, args.get(i), Types.VARCHAR);
            ps.setMaxRows(f.limit());
            try (ResultSet rs = ps.executeQuery()) {
                List<Task> list = new ArrayList<>();
                while (rs.next()) list.add(RowMappers.toTask(rs, json));
                return list;
            }
        }
    }
}
