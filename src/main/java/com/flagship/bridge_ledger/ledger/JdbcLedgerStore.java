package com.flagship.bridge_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bridge_ledger.conversion.ConversionSnapshot;
import com.flagship.bridge_ledger.conversion.Currency;
import com.flagship.bridge_ledger.error.TransientStoreException;
import com.flagship.bridge_ledger.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * PostgreSQL ledger store on plain JDBC.
 *
 * Idempotency comes from the unique constraint on {@code group_id}: the insert
 * uses {@code ON CONFLICT DO NOTHING}, so two concurrent saves of the same
 * entry produce exactly one row and the loser sees {@link SaveResult#DUPLICATE}.
 * Conversion snapshots are stored as JSON next to the msats value of each leg,
 * which is kept in its own column for aggregation.
 */
@Repository
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    private static final String COLUMNS =
        "group_id, short_id, cust_id, ledger_type, entry_timestamp, description, source_group_id, " +
        "debit_name, debit_type, debit_sub, debit_contra, debit_unit, debit_amount, debit_msats, debit_conv, " +
        "credit_name, credit_type, credit_sub, credit_contra, credit_unit, credit_amount, credit_msats, credit_conv";

    private static final String INSERT_SQL =
        "INSERT INTO ledger_entries (" + COLUMNS + ") " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
        "ON CONFLICT (group_id) DO NOTHING";

    private static final String SELECT_SQL = "SELECT " + COLUMNS + " FROM ledger_entries ";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public SaveResult save(LedgerEntry entry) {
        entry.checkBalanced();

        LedgerLeg debit = entry.getDebit();
        LedgerLeg credit = entry.getCredit();
        int inserted;
        try {
            inserted = translate(() -> jdbcTemplate.update(INSERT_SQL,
                entry.getGroupId(),
                entry.getShortId(),
                entry.getCustId(),
                entry.getLedgerType().getCode(),
                Timestamp.from(entry.getTimestamp()),
                entry.getDescription(),
                entry.getSourceGroupId(),
                debit.getAccount().getName(),
                debit.getAccount().getAccountType().name(),
                debit.getAccount().getSub(),
                debit.getAccount().isContra(),
                debit.getUnit().name(),
                debit.getAmount(),
                debit.msats(),
                toJson(debit.getConv()),
                credit.getAccount().getName(),
                credit.getAccount().getAccountType().name(),
                credit.getAccount().getSub(),
                credit.getAccount().isContra(),
                credit.getUnit().name(),
                credit.getAmount(),
                credit.msats(),
                toJson(credit.getConv())));
        } catch (DuplicateKeyException e) {
            inserted = 0;
        }

        if (inserted == 0) {
            log.debug("Ledger entry {} already stored, skipping", entry.getGroupId());
            return SaveResult.DUPLICATE;
        }
        log.info("Ledger entry saved: {}", entry);
        return SaveResult.SAVED;
    }

    @Override
    public Optional<LedgerEntry> load(String groupId) {
        List<LedgerEntry> found = translate(() ->
            jdbcTemplate.query(SELECT_SQL + "WHERE group_id = ?", entryRowMapper(), groupId));
        return found.stream().findFirst();
    }

    @Override
    public List<LedgerEntry> findEntries(LedgerQuery query) {
        Account account = query.getAccount();
        StringBuilder sql = new StringBuilder(SELECT_SQL)
            .append("WHERE ((debit_name = ? AND debit_type = ? AND debit_sub = ? AND debit_contra = ?) ")
            .append("OR (credit_name = ? AND credit_type = ? AND credit_sub = ? AND credit_contra = ?))");
        List<Object> params = new ArrayList<>(List.of(
            account.getName(), account.getAccountType().name(), account.getSub(), account.isContra(),
            account.getName(), account.getAccountType().name(), account.getSub(), account.isContra()));

        if (query.getCustId() != null) {
            sql.append(" AND cust_id = ?");
            params.add(query.getCustId());
        }
        if (!query.getLedgerTypes().isEmpty()) {
            sql.append(" AND ledger_type IN (")
                .append(query.getLedgerTypes().stream().map(t -> "?").collect(Collectors.joining(", ")))
                .append(")");
            query.getLedgerTypes().forEach(type -> params.add(type.getCode()));
        }
        if (query.getFrom() != null) {
            sql.append(" AND entry_timestamp >= ?");
            params.add(Timestamp.from(query.getFrom()));
        }
        if (query.getTo() != null) {
            sql.append(" AND entry_timestamp <= ?");
            params.add(Timestamp.from(query.getTo()));
        }
        sql.append(" ORDER BY entry_timestamp, id");

        return translate(() -> jdbcTemplate.query(sql.toString(), entryRowMapper(), params.toArray()));
    }

    @Override
    public List<LedgerEntry> findBySourceGroupId(String sourceGroupId) {
        return translate(() -> jdbcTemplate.query(
            SELECT_SQL + "WHERE source_group_id = ? ORDER BY entry_timestamp, id",
            entryRowMapper(), sourceGroupId));
    }

    @Override
    public List<Account> listAccounts() {
        return translate(() -> jdbcTemplate.query(
            "SELECT debit_name AS name, debit_type AS type, debit_sub AS sub, debit_contra AS contra " +
            "FROM ledger_entries " +
            "UNION " +
            "SELECT credit_name, credit_type, credit_sub, credit_contra " +
            "FROM ledger_entries " +
            "ORDER BY type, name, sub",
            (rs, rowNum) -> new Account(
                rs.getString("name"),
                AccountType.valueOf(rs.getString("type")),
                rs.getString("sub"),
                rs.getBoolean("contra"))))
            .stream()
            .distinct()
            .collect(Collectors.toList());
    }

    @Override
    public LedgerTotals totals() {
        return translate(() -> jdbcTemplate.queryForObject(
            "SELECT COUNT(*) AS entry_count, COALESCE(SUM(debit_msats), 0) AS debit_msats, " +
            "COALESCE(SUM(credit_msats), 0) AS credit_msats FROM ledger_entries",
            (rs, rowNum) -> new LedgerTotals(
                rs.getLong("entry_count"), rs.getLong("debit_msats"), rs.getLong("credit_msats"))));
    }

    @Override
    public List<LedgerEntry> findConservationCandidates() {
        return translate(() -> jdbcTemplate.query(
            SELECT_SQL + "WHERE ABS(debit_msats - credit_msats) > ? ORDER BY entry_timestamp, id",
            entryRowMapper(), Currency.MSATS.getTolerance().longValueExact()));
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> LedgerEntry.builder()
            .groupId(rs.getString("group_id"))
            .shortId(rs.getString("short_id"))
            .custId(rs.getString("cust_id"))
            .ledgerType(LedgerType.fromCode(rs.getString("ledger_type")))
            .timestamp(rs.getTimestamp("entry_timestamp").toInstant())
            .description(rs.getString("description"))
            .sourceGroupId(rs.getString("source_group_id"))
            .debit(mapLeg(rs, "debit_"))
            .credit(mapLeg(rs, "credit_"))
            .build();
    }

    private LedgerLeg mapLeg(ResultSet rs, String prefix) throws SQLException {
        Account account = new Account(
            rs.getString(prefix + "name"),
            AccountType.valueOf(rs.getString(prefix + "type")),
            rs.getString(prefix + "sub"),
            rs.getBoolean(prefix + "contra"));
        return LedgerLeg.of(
            account,
            Currency.valueOf(rs.getString(prefix + "unit")),
            rs.getBigDecimal(prefix + "amount"),
            fromJson(rs.getString(prefix + "conv")));
    }

    private String toJson(ConversionSnapshot conv) {
        try {
            return objectMapper.writeValueAsString(conv);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Cannot serialize conversion snapshot: " + e.getMessage());
        }
    }

    private ConversionSnapshot fromJson(String json) {
        try {
            return objectMapper.readValue(json, ConversionSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored conversion snapshot is unreadable: " + e.getMessage(), e);
        }
    }

    /**
     * Runs a JDBC call, mapping connectivity failures to {@link TransientStoreException}.
     */
    private <T> T translate(Supplier<T> call) {
        try {
            return call.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | DataAccessResourceFailureException e) {
            throw new TransientStoreException("Ledger store unavailable: " + e.getMessage(), e);
        }
    }
}
