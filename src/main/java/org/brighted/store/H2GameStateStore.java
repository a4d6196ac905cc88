package org.brighted.store;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.brighted.runtime.model.Consequence;
import org.brighted.runtime.model.ConsequenceType;
import org.brighted.runtime.model.CooldownWindow;
import org.brighted.runtime.model.MissionCooldownState;
import org.brighted.runtime.model.PlayerProfile;
import org.brighted.runtime.model.PracticalSession;
import org.brighted.runtime.model.ProgressionCounters;
import org.brighted.runtime.model.ResourceBundle;
import org.brighted.runtime.model.SessionSnapshot;
import org.brighted.runtime.model.SessionState;
import org.brighted.runtime.progression.XpUpdateInstruction;
import org.brighted.store.api.DecisionLogEntry;
import org.brighted.store.api.IStoreTransaction;
import org.brighted.store.api.SessionNotFoundException;
import org.brighted.store.api.StoreConflictException;
import org.brighted.store.api.StoreException;
import org.brighted.store.api.TransactionWork;
import org.h2.api.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * H2 store using HikariCP for connection pooling.
 * <p>
 * <strong>Serialization:</strong> session, progression, lab and mission rows are read with
 * {@code SELECT ... FOR UPDATE}, so two transactions on the same session or user queue up
 * behind the row lock. A user without a progression or mission row gets one inserted by the
 * locking read, so first awards for a new user serialize too. A lock timeout, deadlock or
 * duplicate first insert surfaces as {@link StoreConflictException}.
 * <p>
 * <strong>At-most-once:</strong> consequences are marked with
 * {@code UPDATE consequence SET applied_at = ? WHERE id = ? AND applied_at IS NULL};
 * only a swap that updated a row may apply the effects.
 * <p>
 * Documents (snapshots, effect lists, payloads, mission sets) are JSON columns encoded by
 * {@link StateJsonCodec}.
 * <p>
 * Options:
 * <pre>
 * options {
 *   jdbcUrl = "jdbc:h2:./data/brighted"   # required
 *   username = "sa"
 *   password = ""
 *   maxPoolSize = 10
 *   minIdle = 2
 * }
 * </pre>
 */
public class H2GameStateStore extends AbstractStoreResource {

    private static final Logger log = LoggerFactory.getLogger(H2GameStateStore.class);

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS player_profile ("
                    + "user_id VARCHAR(128) PRIMARY KEY, skills_json CLOB NOT NULL, "
                    + "reputation_json CLOB NOT NULL, resources_json CLOB NOT NULL)",
            "CREATE TABLE IF NOT EXISTS practical_session ("
                    + "id VARCHAR(64) PRIMARY KEY, user_id VARCHAR(128) NOT NULL, story_slug VARCHAR(128) NOT NULL, "
                    + "state VARCHAR(16) NOT NULL, snapshot_json CLOB NOT NULL, "
                    + "started_at TIMESTAMP(9) WITH TIME ZONE NOT NULL, "
                    + "last_played_at TIMESTAMP(9) WITH TIME ZONE NOT NULL, "
                    + "completed_at TIMESTAMP(9) WITH TIME ZONE)",
            "CREATE SEQUENCE IF NOT EXISTS consequence_seq START WITH 1",
            "CREATE TABLE IF NOT EXISTS consequence ("
                    + "id VARCHAR(64) PRIMARY KEY, decision_id VARCHAR(64), session_id VARCHAR(64) NOT NULL, "
                    + "type VARCHAR(16) NOT NULL, scheduled_at TIMESTAMP(9) WITH TIME ZONE NOT NULL, "
                    + "applied_at TIMESTAMP(9) WITH TIME ZONE, rule_id VARCHAR(128) NOT NULL, "
                    + "effects_json CLOB NOT NULL, seq BIGINT NOT NULL)",
            "CREATE INDEX IF NOT EXISTS consequence_session_idx ON consequence (session_id, applied_at)",
            "CREATE SEQUENCE IF NOT EXISTS decision_seq START WITH 1",
            "CREATE TABLE IF NOT EXISTS decision_log ("
                    + "id VARCHAR(64) PRIMARY KEY, session_id VARCHAR(64) NOT NULL, user_id VARCHAR(128) NOT NULL, "
                    + "choice_id VARCHAR(128) NOT NULL, payload_json CLOB NOT NULL, immediate_json CLOB NOT NULL, "
                    + "delayed_json CLOB NOT NULL, decided_at TIMESTAMP(9) WITH TIME ZONE NOT NULL, "
                    + "seq BIGINT NOT NULL)",
            "CREATE INDEX IF NOT EXISTS decision_log_session_idx ON decision_log (session_id)",
            "CREATE TABLE IF NOT EXISTS progression ("
                    + "user_id VARCHAR(128) PRIMARY KEY, xp_total BIGINT DEFAULT 0 NOT NULL, "
                    + "xp_today INT DEFAULT 0 NOT NULL, day_key VARCHAR(10))",
            "CREATE TABLE IF NOT EXISTS lab_completion ("
                    + "user_id VARCHAR(128) NOT NULL, lab_id VARCHAR(128) NOT NULL, day_key VARCHAR(10) NOT NULL, "
                    + "PRIMARY KEY (user_id, lab_id))",
            "CREATE TABLE IF NOT EXISTS mission_state ("
                    + "user_id VARCHAR(128) PRIMARY KEY, day_key VARCHAR(10), completed_json CLOB NOT NULL, "
                    + "cooldown_until TIMESTAMP(9) WITH TIME ZONE, cooldown_reason VARCHAR(255))"
    );

    private final HikariDataSource dataSource;
    private final StateJsonCodec codec = new StateJsonCodec();

    public H2GameStateStore(String name, Config options) {
        super(name, options);

        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for H2GameStateStore.");
        }
        final String jdbcUrl = options.getString("jdbcUrl");

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 2);
        hikariConfig.setUsername(options.hasPath("username") ? options.getString("username") : "sa");
        hikariConfig.setPassword(options.hasPath("password") ? options.getString("password") : "");
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (RuntimeException e) {
            String errorMsg = String.format("Failed to initialize H2 store '%s': %s. Database: %s",
                    name, e.getMessage(), jdbcUrl);
            log.error(errorMsg);
            throw new StoreException(errorMsg, e);
        }
        log.debug("H2 store '{}' connection pool started (max={}, minIdle={})",
                name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());

        createSchema();
        log.info("H2 store '{}' ready at {}", name, jdbcUrl);
    }

    private void createSchema() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
        } catch (SQLException e) {
            String errorMsg = String.format("Schema creation failed for H2 store '%s': %s", storeName, e.getMessage());
            log.error(errorMsg);
            dataSource.close();
            throw new StoreException(errorMsg, e);
        }
    }

    @Override
    protected <T> T doInTransaction(TransactionWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(new H2Transaction(conn));
                conn.commit();
                return result;
            } catch (RuntimeException | SQLException e) {
                rollback(conn);
                if (e instanceof SQLException sql) {
                    throw translate("commit", sql);
                }
                throw (RuntimeException) e;
            }
        } catch (SQLException e) {
            throw translate("connection", e);
        }
    }

    private void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed in H2 store '{}' (connection may be closed): {}", storeName, rollbackEx.getMessage());
            recordError("ROLLBACK_FAILED", "Rollback failed", rollbackEx.getMessage());
        }
    }

    /**
     * Maps a driver failure to the store exception hierarchy. Lost lock races become
     * {@link StoreConflictException} so callers can retry the whole transaction.
     */
    static StoreException translate(String operation, SQLException e) {
        return switch (e.getErrorCode()) {
            case ErrorCode.LOCK_TIMEOUT_1, ErrorCode.DEADLOCK_1, ErrorCode.CONCURRENT_UPDATE_1,
                 ErrorCode.DUPLICATE_KEY_1 ->
                    new StoreConflictException("Conflict during " + operation + ": " + e.getMessage(), e);
            default -> new StoreException("Failed to " + operation + ": " + e.getMessage(), e);
        };
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        if (pool != null) {
            metrics.put("pool_active_connections", pool.getActiveConnections());
            metrics.put("pool_idle_connections", pool.getIdleConnections());
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.info("H2 store '{}' closed", storeName);
        }
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setObject(index, value.atOffset(ZoneOffset.UTC));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    @FunctionalInterface
    private interface SqlCall<T> {
        T run() throws SQLException;
    }

    private final class H2Transaction implements IStoreTransaction {

        private final Connection conn;

        H2Transaction(Connection conn) {
            this.conn = conn;
        }

        /**
         * Inserts the default row of a user that has none yet. The uncommitted row holds the
         * key lock, so a second transaction racing on the same new user fails with
         * {@code DUPLICATE_KEY_1} (a {@link StoreConflictException}) and retries against the
         * committed row instead of reading stale empty state.
         */
        private void claimRow(String insertSql, String userId) throws SQLException {
            try (PreparedStatement stmt = conn.prepareStatement(insertSql)) {
                stmt.setString(1, userId);
                stmt.executeUpdate();
            }
        }

        private <T> T sql(String operation, SqlCall<T> call) {
            try {
                return call.run();
            } catch (SQLException e) {
                throw translate(operation, e);
            }
        }

        @Override
        public Optional<PlayerProfile> findProfile(String userId) {
            return sql("load profile " + userId, () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "SELECT skills_json, reputation_json, resources_json FROM player_profile WHERE user_id = ?")) {
                    stmt.setString(1, userId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next()) {
                            return Optional.empty();
                        }
                        Map<String, Integer> skills = codec.fromJson(rs.getString("skills_json"), StateJsonCodec.INT_MAP);
                        Map<String, Integer> reputation = codec.fromJson(rs.getString("reputation_json"), StateJsonCodec.INT_MAP);
                        ResourceBundle resources = codec.fromJson(rs.getString("resources_json"), ResourceBundle.class);
                        return Optional.of(new PlayerProfile(userId, skills, reputation, resources));
                    }
                }
            });
        }

        @Override
        public void saveProfile(PlayerProfile profile) {
            sql("save profile " + profile.userId(), () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "MERGE INTO player_profile (user_id, skills_json, reputation_json, resources_json) "
                                + "KEY (user_id) VALUES (?, ?, ?, ?)")) {
                    stmt.setString(1, profile.userId());
                    stmt.setString(2, codec.toJson(profile.skills()));
                    stmt.setString(3, codec.toJson(profile.reputation()));
                    stmt.setString(4, codec.toJson(profile.resources()));
                    return stmt.executeUpdate();
                }
            });
        }

        @Override
        public Optional<PracticalSession> findSessionForUpdate(String sessionId) {
            return sql("load session " + sessionId, () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "SELECT user_id, story_slug, state, snapshot_json, started_at, last_played_at, completed_at "
                                + "FROM practical_session WHERE id = ? FOR UPDATE")) {
                    stmt.setString(1, sessionId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next()) {
                            return Optional.empty();
                        }
                        return Optional.of(new PracticalSession(
                                sessionId,
                                rs.getString("user_id"),
                                rs.getString("story_slug"),
                                SessionState.valueOf(rs.getString("state")),
                                codec.fromJson(rs.getString("snapshot_json"), SessionSnapshot.class),
                                getInstant(rs, "started_at"),
                                getInstant(rs, "last_played_at"),
                                getInstant(rs, "completed_at")));
                    }
                }
            });
        }

        @Override
        public void insertSession(PracticalSession session) {
            sql("insert session " + session.id(), () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "INSERT INTO practical_session (id, user_id, story_slug, state, snapshot_json, "
                                + "started_at, last_played_at, completed_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
                    stmt.setString(1, session.id());
                    stmt.setString(2, session.userId());
                    stmt.setString(3, session.storySlug());
                    stmt.setString(4, session.state().name());
                    stmt.setString(5, codec.toJson(session.snapshot()));
                    setInstant(stmt, 6, session.startedAt());
                    setInstant(stmt, 7, session.lastPlayedAt());
                    setInstant(stmt, 8, session.completedAt());
                    return stmt.executeUpdate();
                }
            });
        }

        @Override
        public void updateSession(PracticalSession session) {
            int updated = sql("update session " + session.id(), () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "UPDATE practical_session SET state = ?, snapshot_json = ?, last_played_at = ?, "
                                + "completed_at = ? WHERE id = ?")) {
                    stmt.setString(1, session.state().name());
                    stmt.setString(2, codec.toJson(session.snapshot()));
                    setInstant(stmt, 3, session.lastPlayedAt());
                    setInstant(stmt, 4, session.completedAt());
                    stmt.setString(5, session.id());
                    return stmt.executeUpdate();
                }
            });
            if (updated == 0) {
                throw new SessionNotFoundException(session.id());
            }
        }

        @Override
        public Consequence insertConsequence(Consequence consequence) {
            return sql("insert consequence " + consequence.id(), () -> {
                long seq;
                try (Statement stmt = conn.createStatement();
                     ResultSet rs = stmt.executeQuery("SELECT NEXT VALUE FOR consequence_seq")) {
                    rs.next();
                    seq = rs.getLong(1);
                }
                Consequence stored = consequence.withSequence(seq);
                try (PreparedStatement stmt = conn.prepareStatement(
                        "INSERT INTO consequence (id, decision_id, session_id, type, scheduled_at, applied_at, "
                                + "rule_id, effects_json, seq) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                    stmt.setString(1, stored.id());
                    stmt.setString(2, stored.decisionId());
                    stmt.setString(3, stored.sessionId());
                    stmt.setString(4, stored.type().name());
                    setInstant(stmt, 5, stored.scheduledAt());
                    setInstant(stmt, 6, stored.appliedAt());
                    stmt.setString(7, stored.ruleId());
                    stmt.setString(8, codec.effectsToJson(stored.effects()));
                    stmt.setLong(9, seq);
                    stmt.executeUpdate();
                }
                return stored;
            });
        }

        @Override
        public List<Consequence> listPendingConsequences(String sessionId) {
            return queryConsequences(
                    "SELECT * FROM consequence WHERE session_id = ? AND applied_at IS NULL ORDER BY seq", sessionId);
        }

        @Override
        public List<Consequence> listConsequences(String sessionId) {
            return queryConsequences("SELECT * FROM consequence WHERE session_id = ? ORDER BY seq", sessionId);
        }

        private List<Consequence> queryConsequences(String query, String sessionId) {
            return sql("list consequences of " + sessionId, () -> {
                try (PreparedStatement stmt = conn.prepareStatement(query)) {
                    stmt.setString(1, sessionId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        List<Consequence> out = new ArrayList<>();
                        while (rs.next()) {
                            out.add(new Consequence(
                                    rs.getString("id"),
                                    rs.getString("decision_id"),
                                    rs.getString("session_id"),
                                    ConsequenceType.valueOf(rs.getString("type")),
                                    getInstant(rs, "scheduled_at"),
                                    getInstant(rs, "applied_at"),
                                    rs.getString("rule_id"),
                                    codec.effectsFromJson(rs.getString("effects_json")),
                                    rs.getLong("seq")));
                        }
                        return out;
                    }
                }
            });
        }

        @Override
        public boolean markConsequenceApplied(String consequenceId, Instant appliedAt) {
            return sql("mark consequence " + consequenceId, () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "UPDATE consequence SET applied_at = ? WHERE id = ? AND applied_at IS NULL")) {
                    setInstant(stmt, 1, appliedAt);
                    stmt.setString(2, consequenceId);
                    return stmt.executeUpdate() == 1;
                }
            });
        }

        @Override
        public void appendDecision(DecisionLogEntry entry) {
            sql("append decision " + entry.id(), () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "INSERT INTO decision_log (id, session_id, user_id, choice_id, payload_json, immediate_json, "
                                + "delayed_json, decided_at, seq) VALUES (?, ?, ?, ?, ?, ?, ?, ?, NEXT VALUE FOR decision_seq)")) {
                    stmt.setString(1, entry.id());
                    stmt.setString(2, entry.sessionId());
                    stmt.setString(3, entry.userId());
                    stmt.setString(4, entry.choiceId());
                    stmt.setString(5, codec.toJson(entry.payload()));
                    stmt.setString(6, codec.effectsToJson(entry.immediateEffects()));
                    stmt.setString(7, codec.toJson(entry.delayedRuleIds()));
                    setInstant(stmt, 8, entry.decidedAt());
                    return stmt.executeUpdate();
                }
            });
        }

        @Override
        public List<DecisionLogEntry> listDecisions(String sessionId) {
            return sql("list decisions of " + sessionId, () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "SELECT * FROM decision_log WHERE session_id = ? ORDER BY seq")) {
                    stmt.setString(1, sessionId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        List<DecisionLogEntry> out = new ArrayList<>();
                        while (rs.next()) {
                            out.add(new DecisionLogEntry(
                                    rs.getString("id"),
                                    rs.getString("session_id"),
                                    rs.getString("user_id"),
                                    rs.getString("choice_id"),
                                    codec.fromJson(rs.getString("payload_json"), StateJsonCodec.PAYLOAD),
                                    codec.effectsFromJson(rs.getString("immediate_json")),
                                    codec.fromJson(rs.getString("delayed_json"), StateJsonCodec.STRING_LIST),
                                    getInstant(rs, "decided_at")));
                        }
                        return out;
                    }
                }
            });
        }

        @Override
        public ProgressionCounters loadProgressionForUpdate(String userId) {
            return sql("load progression " + userId, () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "SELECT xp_total, xp_today, day_key FROM progression WHERE user_id = ? FOR UPDATE")) {
                    stmt.setString(1, userId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (rs.next()) {
                            return new ProgressionCounters(rs.getLong("xp_total"), rs.getInt("xp_today"), rs.getString("day_key"));
                        }
                    }
                }
                claimRow("INSERT INTO progression (user_id, xp_total, xp_today, day_key) VALUES (?, 0, 0, NULL)", userId);
                return ProgressionCounters.empty();
            });
        }

        @Override
        public void applyXpUpdate(String userId, XpUpdateInstruction update) {
            sql("apply xp update for " + userId, () -> {
                String todayExpr = update.todayMode() == XpUpdateInstruction.Mode.SET ? "?" : "xp_today + ?";
                int updated;
                try (PreparedStatement stmt = conn.prepareStatement(
                        "UPDATE progression SET xp_total = xp_total + ?, xp_today = " + todayExpr
                                + ", day_key = ? WHERE user_id = ?")) {
                    stmt.setLong(1, update.totalIncrement());
                    stmt.setInt(2, update.todayValue());
                    stmt.setString(3, update.dayKey());
                    stmt.setString(4, userId);
                    updated = stmt.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement stmt = conn.prepareStatement(
                            "INSERT INTO progression (user_id, xp_total, xp_today, day_key) VALUES (?, ?, ?, ?)")) {
                        stmt.setString(1, userId);
                        stmt.setLong(2, update.totalIncrement());
                        stmt.setInt(3, update.todayValue());
                        stmt.setString(4, update.dayKey());
                        stmt.executeUpdate();
                    }
                }
                return null;
            });
        }

        @Override
        public Optional<String> findLabCompletionDay(String userId, String labId) {
            return sql("load lab completion " + labId, () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "SELECT day_key FROM lab_completion WHERE user_id = ? AND lab_id = ? FOR UPDATE")) {
                    stmt.setString(1, userId);
                    stmt.setString(2, labId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        return rs.next() ? Optional.of(rs.getString("day_key")) : Optional.empty();
                    }
                }
            });
        }

        @Override
        public void saveLabCompletion(String userId, String labId, String dayKey) {
            sql("save lab completion " + labId, () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "MERGE INTO lab_completion (user_id, lab_id, day_key) KEY (user_id, lab_id) VALUES (?, ?, ?)")) {
                    stmt.setString(1, userId);
                    stmt.setString(2, labId);
                    stmt.setString(3, dayKey);
                    return stmt.executeUpdate();
                }
            });
        }

        @Override
        public MissionCooldownState loadMissionStateForUpdate(String userId) {
            return sql("load mission state " + userId, () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "SELECT day_key, completed_json, cooldown_until, cooldown_reason FROM mission_state "
                                + "WHERE user_id = ? FOR UPDATE")) {
                    stmt.setString(1, userId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next()) {
                            claimRow("INSERT INTO mission_state (user_id, day_key, completed_json) VALUES (?, NULL, '[]')",
                                    userId);
                            return MissionCooldownState.empty();
                        }
                        Set<String> completed = codec.fromJson(rs.getString("completed_json"), StateJsonCodec.STRING_SET);
                        Instant until = getInstant(rs, "cooldown_until");
                        CooldownWindow window = until == null ? null : new CooldownWindow(until, rs.getString("cooldown_reason"));
                        return new MissionCooldownState(rs.getString("day_key"), completed, window);
                    }
                }
            });
        }

        @Override
        public void saveMissionState(String userId, MissionCooldownState state) {
            sql("save mission state " + userId, () -> {
                try (PreparedStatement stmt = conn.prepareStatement(
                        "MERGE INTO mission_state (user_id, day_key, completed_json, cooldown_until, cooldown_reason) "
                                + "KEY (user_id) VALUES (?, ?, ?, ?, ?)")) {
                    stmt.setString(1, userId);
                    stmt.setString(2, state.dayKey());
                    stmt.setString(3, codec.toJson(state.completedMissionIds()));
                    CooldownWindow window = state.cooldown();
                    setInstant(stmt, 4, window == null ? null : window.until());
                    stmt.setString(5, window == null ? null : window.reason());
                    return stmt.executeUpdate();
                }
            });
        }
    }
}
