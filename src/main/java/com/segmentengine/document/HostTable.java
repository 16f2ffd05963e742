package com.segmentengine.document;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 SQLite 的宿主表适配器：保存被索引的行，并作为全量建索引的行来源。
 */
public final class HostTable implements RowSource, AutoCloseable {
    public static final String TITLE_COLUMN = "title";
    public static final String BODY_COLUMN = "body";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS host_rows (
                row_id  INTEGER PRIMARY KEY AUTOINCREMENT,
                key     TEXT NOT NULL,
                title   TEXT,
                body    TEXT
            )
            """;

    private static final String CREATE_IDX_KEY_SQL = "CREATE INDEX IF NOT EXISTS idx_key ON host_rows(key)";
    private static final String ENABLE_WAL_SQL = "PRAGMA journal_mode=WAL";
    private static final String SELECT_COLUMNS = "SELECT row_id, key, title, body FROM host_rows";

    private final Connection connection;

    /**
     * 打开宿主表并初始化结构。
     */
    public HostTable(Path dbPath) {
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            initializeSchema();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("初始化宿主表失败: " + dbPath, sqlException);
        }
    }

    /**
     * 在一个事务内插入多行，返回带行 ID 的结果，顺序与输入一致。
     */
    public List<Row> insertAll(List<Row> rows) {
        String sql = "INSERT INTO host_rows(key, title, body) VALUES (?, ?, ?)";
        rows.forEach(Row::requireKey);
        List<Row> inserted = new ArrayList<>(rows.size());
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             Statement lastIdStatement = connection.createStatement()) {
            connection.setAutoCommit(false);
            for (Row row : rows) {
                preparedStatement.setString(1, row.key());
                preparedStatement.setString(2, row.fields().get(TITLE_COLUMN));
                preparedStatement.setString(3, row.fields().get(BODY_COLUMN));
                preparedStatement.executeUpdate();
                try (ResultSet resultSet = lastIdStatement.executeQuery("SELECT last_insert_rowid()")) {
                    long rowId = resultSet.getLong(1);
                    inserted.add(new Row(rowId, row.key(), row.fields()));
                }
            }
            connection.commit();
            connection.setAutoCommit(true);
            return inserted;
        } catch (SQLException sqlException) {
            rollbackAndRestore(sqlException);
            throw new IllegalStateException("插入行失败, count=" + rows.size(), sqlException);
        }
    }

    /**
     * 插入单行。
     */
    public Row insert(String key, String title, String body) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (title != null) {
            fields.put(TITLE_COLUMN, title);
        }
        if (body != null) {
            fields.put(BODY_COLUMN, body);
        }
        return insertAll(List.of(new Row(0L, key, fields))).get(0);
    }

    /**
     * 按行 ID 查找。
     */
    public Optional<Row> findByRowId(long rowId) {
        String sql = SELECT_COLUMNS + " WHERE row_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setLong(1, rowId);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(readRow(resultSet));
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("按行 ID 查询失败, rowId=" + rowId, sqlException);
        }
    }

    /**
     * 按行 ID 顺序扫描全表。
     */
    @Override
    public List<Row> scan() {
        String sql = SELECT_COLUMNS + " ORDER BY row_id";
        List<Row> rows = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                rows.add(readRow(resultSet));
            }
            return rows;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("扫描宿主表失败", sqlException);
        }
    }

    /**
     * 获取行总数。
     */
    public int count() {
        String sql = "SELECT COUNT(*) FROM host_rows";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.getInt(1);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询行总数失败", sqlException);
        }
    }

    /**
     * 关闭数据库连接。
     */
    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭数据库连接失败", sqlException);
        }
    }

    private void initializeSchema() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(ENABLE_WAL_SQL);
        }

        connection.setAutoCommit(false);
        try (Statement statement = connection.createStatement()) {
            statement.execute(CREATE_TABLE_SQL);
            statement.execute(CREATE_IDX_KEY_SQL);
            connection.commit();
        } catch (SQLException sqlException) {
            connection.rollback();
            throw sqlException;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    private Row readRow(ResultSet resultSet) throws SQLException {
        Map<String, String> fields = new LinkedHashMap<>();
        String title = resultSet.getString(TITLE_COLUMN);
        if (title != null) {
            fields.put(TITLE_COLUMN, title);
        }
        String body = resultSet.getString(BODY_COLUMN);
        if (body != null) {
            fields.put(BODY_COLUMN, body);
        }
        return new Row(resultSet.getLong("row_id"), resultSet.getString("key"), fields);
    }

    /**
     * 回滚当前事务并恢复自动提交，回滚本身失败时挂到原异常上。
     */
    private void rollbackAndRestore(SQLException cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackException) {
            cause.addSuppressed(rollbackException);
        }
        try {
            connection.setAutoCommit(true);
        } catch (SQLException autoCommitException) {
            cause.addSuppressed(autoCommitException);
        }
    }
}
