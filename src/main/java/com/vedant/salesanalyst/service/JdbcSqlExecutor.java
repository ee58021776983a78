package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.exception.QueryExecutionException;
import com.vedant.salesanalyst.model.QueryRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Service;

import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;

@Service
public class JdbcSqlExecutor implements SqlExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcSqlExecutor.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcSqlExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<List<Object>> runQuery(String sql, Object... params) {
        QueryRows result = jdbcTemplate.query(sql, tuples(), params);
        return result == null ? List.of() : result.rows();
    }

    @Override
    public QueryRows runQueryWithColumns(String sql) {
        QueryRows result;
        try {
            result = jdbcTemplate.query(sql, tuples());
        } catch (DataAccessException e) {
            log.error("Query failed: {}", e.getMostSpecificCause().getMessage());
            throw new QueryExecutionException("Query execution failed: " + e.getMostSpecificCause().getMessage(), e);
        }
        log.info("=== QUERY EXECUTED === {} rows returned", result == null ? 0 : result.size());
        return result == null ? QueryRows.empty() : result;
    }

    // Rows as positional tuples; column labels read once from the result metadata.
    private static ResultSetExtractor<QueryRows> tuples() {
        return rs -> {
            ResultSetMetaData md = rs.getMetaData();
            int count = md.getColumnCount();
            List<String> columns = new ArrayList<>(count);
            for (int i = 1; i <= count; i++) {
                columns.add(md.getColumnLabel(i));
            }
            List<List<Object>> rows = new ArrayList<>();
            while (rs.next()) {
                List<Object> row = new ArrayList<>(count);
                for (int i = 1; i <= count; i++) {
                    row.add(rs.getObject(i));
                }
                rows.add(row);
            }
            return new QueryRows(rows, columns);
        };
    }
}
