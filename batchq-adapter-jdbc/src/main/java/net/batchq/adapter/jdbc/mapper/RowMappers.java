package net.batchq.adapter.jdbc.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.batchq.adapter.jdbc.JdbcUtil;
import net.batchq.core.model.Task;
import net.batchq.core.model.TaskPriority;
import net.batchq.core.model.TaskResult;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;

public final class RowMappers {
    private RowMappers() {}

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    // --- Task (BQ_TASK_ARCHIVE) ---
    public static Task toTask(ResultSet rs, ObjectMapper json) throws SQLException, JsonProcessingException {
        String params = rs.getString("PARAMETERS");
        String result = rs.getString("RESULT");
        return new Task(
                rs.getString("ID"),
                rs.getString("USER_ID"),
                rs.getString("SYMBOL"),
                params == null ? Map.of() : json.readValue(params, MAP),
                TaskPriority.fromValue(rs.getInt("PRIORITY")),
                Task.Status.from(rs.getString("STATUS")),
                rs.getString("BATCH_ID"),
                rs.getString("WORKER_ID"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("ENQUEUED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("COMPLETED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("CANCELLED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("REQUEUED_AT")),
                rs.getInt("RETRY_COUNT"),
                result == null ? null : json.readValue(result, TaskResult.class),
                rs.getString("ERROR")
        );
    }
}
