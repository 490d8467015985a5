package org.moviegraph.service.schema;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.moviegraph.configuration.BuildProperties;
import org.moviegraph.exceptions.IntegrityViolationException;
import org.moviegraph.models.table.ColumnDescriptor;
import org.moviegraph.models.table.NormalizedSchema;
import org.moviegraph.models.table.Table;
import org.moviegraph.models.table.TableDescriptor;
import org.moviegraph.utils.SqlIdentifiers;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Replaces the normalized tables in the target database with the content of an assembled
 * schema. Existing tables are dropped, recreated with their keys and cascading foreign keys,
 * then filled, all in one transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaWriter {

    private final JdbcTemplate jdbcTemplate;
    private final BuildProperties properties;

    /**
     * @return number of rows inserted
     */
    @Transactional
    public int write(NormalizedSchema schema) {
        List<Table> tables = new ArrayList<>(schema.tables());
        try {
            for (int i = tables.size() - 1; i >= 0; i--) {
                jdbcTemplate.execute("DROP TABLE IF EXISTS " + qualified(tables.get(i).name()) + " CASCADE");
            }
            for (Table table : tables) {
                jdbcTemplate.execute(createTable(table.descriptor()));
            }
            int written = 0;
            for (Table table : tables) {
                written += insertRows(table);
            }
            log.info("[write] {} tables, {} rows written", tables.size(), written);
            return written;
        } catch (DataAccessException exception) {
            throw new IntegrityViolationException("Database refused the normalized schema: "
                    + exception.getMostSpecificCause().getMessage(), exception);
        }
    }

    String createTable(TableDescriptor descriptor) {
        List<String> parts = new ArrayList<>();
        for (ColumnDescriptor column : descriptor.columns()) {
            boolean notNull = !column.nullable() || descriptor.primaryKey().contains(column.name());
            parts.add(SqlIdentifiers.require(column.name()) + " " + column.sqlType() + (notNull ? " NOT NULL" : ""));
        }
        parts.add("CONSTRAINT " + SqlIdentifiers.require("pk_" + descriptor.name()) + " PRIMARY KEY ("
                + descriptor.primaryKey().stream().map(SqlIdentifiers::require).collect(Collectors.joining(", ")) + ")");
        for (ColumnDescriptor foreignKey : descriptor.foreignKeys()) {
            parts.add("CONSTRAINT " + SqlIdentifiers.require("fk_" + descriptor.name() + "_" + foreignKey.name())
                    + " FOREIGN KEY (" + foreignKey.name() + ")"
                    + " REFERENCES " + qualified(foreignKey.referencedTable())
                    + " (" + SqlIdentifiers.require(foreignKey.referencedColumn()) + ")"
                    + " ON DELETE CASCADE ON UPDATE CASCADE");
        }
        return "CREATE TABLE " + qualified(descriptor.name()) + " (" + String.join(", ", parts) + ")";
    }

    private int insertRows(Table table) {
        List<Map<String, Object>> rows = table.rows();
        if (rows.isEmpty()) {
            return 0;
        }
        List<String> columns = table.descriptor().columns().stream().map(ColumnDescriptor::name).toList();
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + qualified(table.name()) + " (" + String.join(", ", columns) + ") VALUES ("
                + placeholders + ")";
        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                Map<String, Object> row = rows.get(i);
                for (int columnIndex = 0; columnIndex < columns.size(); columnIndex++) {
                    ps.setObject(columnIndex + 1, row.get(columns.get(columnIndex)));
                }
            }

            @Override
            public int getBatchSize() {
                return rows.size();
            }
        });
        log.debug("[write] {}: {} rows", table.name(), rows.size());
        return rows.size();
    }

    private String qualified(String table) {
        return SqlIdentifiers.qualify(properties.getTargetSchema(), table);
    }
}
