package ru.mirror.relay.service;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;
import ru.mirror.relay.model.QueryResult;

import javax.sql.DataSource;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;

/**
 * Ad-hoc queries from the admin console. Only a single SELECT, checked by parsing rather than
 * by prefix, and always executed inside a read-only transaction.
 */
@Slf4j
@Service
public class ReadOnlyQueryService {
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate readOnlyTransaction;

    public ReadOnlyQueryService(DataSource dataSource, PlatformTransactionManager transactionManager,
                                @Value("${relay.query.max-rows:1000}") int maxRows) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setMaxRows(maxRows);
        this.readOnlyTransaction = new TransactionTemplate(transactionManager);
        this.readOnlyTransaction.setReadOnly(true);
    }

    public QueryResult execute(String query) {
        validate(query);
        log.info("READ_ONLY_QUERY {}", query);
        try {
            return readOnlyTransaction.execute(status -> jdbcTemplate.query(query, resultSet -> {
                ResultSetMetaData metaData = resultSet.getMetaData();
                List<String> columns = new ArrayList<>();
                for (int i = 1; i <= metaData.getColumnCount(); i++) {
                    columns.add(metaData.getColumnLabel(i));
                }
                List<List<Object>> rows = new ArrayList<>();
                while (resultSet.next()) {
                    List<Object> row = new ArrayList<>();
                    for (int i = 1; i <= columns.size(); i++) {
                        row.add(resultSet.getObject(i));
                    }
                    rows.add(row);
                }
                return new QueryResult(columns, rows);
            }));
        } catch (DataAccessException e) {
            log.warn("READ_ONLY_QUERY_FAILED {}", e.getMostSpecificCause().getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "QUERY_FAILED: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    void validate(String query) {
        if (query == null || query.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "QUERY_IS_REQUIRED");
        }
        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(query);
        } catch (JSQLParserException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "QUERY_NOT_PARSED", e);
        }
        if (!(statement instanceof Select)) {
            log.warn("FORBIDDEN_QUERY {}", statement.getClass().getSimpleName());
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "ONLY_SELECT_ALLOWED");
        }
    }
}
