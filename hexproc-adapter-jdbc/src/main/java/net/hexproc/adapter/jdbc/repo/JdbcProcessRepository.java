package net.hexproc.adapter.jdbc.repo;

import net.hexproc.adapter.jdbc.JdbcUtil;
import net.hexproc.adapter.jdbc.mapper.RowMappers;
import net.hexproc.core.model.NewProcess;
import net.hexproc.core.model.ProcessRecord;
import net.hexproc.core.model.ProcessState;
import net.hexproc.core.model.Resources;
import net.hexproc.core.spi.ProcessRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.hexproc.adapter.jdbc.JdbcUtil.mustConn;

/**
 * TB_PROCESS. 상태를 바꾸는 UPDATE 는 모두 (ID, STATE, VERSION) 조건의 CAS 이며 VERSION 을 올린다.
 * 락 조회는 단일 행 키 조건에만 건다 (FETCH FIRST 와 FOR UPDATE 를 섞지 않음).
 */
public final class JdbcProcessRepository implements ProcessRepository {

    private static final String ACTIVE_STATES = "('QUEUED', 'RUNNING', 'CANCELLING')";

    @Override
    public ProcessRecord insert(NewProcess p) throws Exception {
        Connection c = mustConn();
        long id;
        try (PreparedStatement ps = c.prepareStatement("""
            INSERT INTO TB_PROCESS
                (OWNER_ID, GATEWAY_SERVER_ID, TARGET_SERVER_ID, PROCESS_TYPE, PRIORITY, STATE,
                 CPU_RESERVED, RAM_RESERVED, HDD_RESERVED, NET_RESERVED,
                 PROGRESS, REQUIRED_WORK, VERSION,
                 CREATED_AT, LAST_CHECKPOINT_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, 'QUEUED', ?, ?, ?, ?, 0, ?, 0, ?, ?, ?)
        """, new String[]{"ID"})) {
            Timestamp at = JdbcUtil.ts(p.createdAt());
            ps.setLong(1, p.ownerId());
            ps.setLong(2, p.gatewayServerId());
            ps.setLong(3, p.targetServerId());
            ps.setString(4, p.processType().code());
            ps.setInt(5, p.priority().weight());
            ps.setLong(6, p.reservation().cpu());
            ps.setLong(7, p.reservation().ram());
            ps.setLong(8, p.reservation().hdd());
            ps.setLong(9, p.reservation().net());
            ps.setDouble(10, p.requiredWork());
            ps.setTimestamp(11, at);
            ps.setTimestamp(12, at);
            ps.setTimestamp(13, at);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("no generated key for TB_PROCESS insert");
                id = keys.getLong(1);
            }
        }
        return findById(id).orElseThrow(() -> new SQLException("inserted process " + id + " not found"));
    }

    @Override
    public Optional<ProcessRecord> findById(long processId) throws Exception {
        return selectOne("SELECT * FROM TB_PROCESS WHERE ID = ?", processId);
    }

    @Override
    public Optional<ProcessRecord> lockOwnedSkipLocked(long processId, long ownerId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT *
                FROM TB_PROCESS
                WHERE ID = ?
                  AND OWNER_ID = ?
                FOR UPDATE SKIP LOCKED
            """)) {
            ps.setLong(1, processId);
            ps.setLong(2, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toProcess(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<ProcessRecord> lockById(long processId) throws Exception {
        return selectOne("SELECT * FROM TB_PROCESS WHERE ID = ? FOR UPDATE", processId);
    }

    @Override
    public Optional<ProcessRecord> lockCancelling(long processId) throws Exception {
        return selectOne("SELECT * FROM TB_PROCESS WHERE ID = ? AND STATE = 'CANCELLING' FOR UPDATE", processId);
    }

    @Override
    public boolean transition(long processId, long expectedVersion, ProcessState from, ProcessState to, Instant now) throws Exception {
        String sql = to.isTerminal()
                ? """
                  UPDATE TB_PROCESS
                     SET STATE = ?, VERSION = VERSION + 1, UPDATED_AT = ?, COMPLETED_AT = ?
                   WHERE ID = ? AND STATE = ? AND VERSION = ?
                  """
                : """
                  UPDATE TB_PROCESS
                     SET STATE = ?, VERSION = VERSION + 1, UPDATED_AT = ?
                   WHERE ID = ? AND STATE = ? AND VERSION = ?
                  """;
        try (PreparedStatement ps = mustConn().prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, to.code());
            ps.setTimestamp(i++, JdbcUtil.ts(now));
            if (to.isTerminal()) ps.setTimestamp(i++, JdbcUtil.ts(now));
            ps.setLong(i++, processId);
            ps.setString(i++, from.code());
            ps.setLong(i, expectedVersion);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean advance(long processId, long expectedVersion, ProcessState from, ProcessState to,
                           double progress, Instant checkpointAt) throws Exception {
        String sql = to.isTerminal()
                ? """
                  UPDATE TB_PROCESS
                     SET STATE = ?, PROGRESS = ?, LAST_CHECKPOINT_AT = ?, VERSION = VERSION + 1,
                         UPDATED_AT = ?, COMPLETED_AT = ?
                   WHERE ID = ? AND STATE = ? AND VERSION = ?
                  """
                : """
                  UPDATE TB_PROCESS
                     SET STATE = ?, PROGRESS = ?, LAST_CHECKPOINT_AT = ?, VERSION = VERSION + 1,
                         UPDATED_AT = ?
                   WHERE ID = ? AND STATE = ? AND VERSION = ?
                  """;
        Timestamp at = JdbcUtil.ts(checkpointAt);
        try (PreparedStatement ps = mustConn().prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, to.code());
            ps.setDouble(i++, progress);
            ps.setTimestamp(i++, at);
            ps.setTimestamp(i++, at);
            if (to.isTerminal()) ps.setTimestamp(i++, at);
            ps.setLong(i++, processId);
            ps.setString(i++, from.code());
            ps.setLong(i, expectedVersion);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public List<Long> findActiveIds(int limit) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT ID
                FROM TB_PROCESS
                WHERE STATE IN %s
                ORDER BY PRIORITY DESC, LAST_CHECKPOINT_AT ASC, ID ASC
                FETCH FIRST ? ROWS ONLY
            """.formatted(ACTIVE_STATES))) {
            ps.setInt(1, limit);
            return ids(ps);
        }
    }

    @Override
    public List<Long> findIdsInState(ProcessState state, int limit) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT ID
                FROM TB_PROCESS
                WHERE STATE = ?
                ORDER BY UPDATED_AT ASC, ID ASC
                FETCH FIRST ? ROWS ONLY
            """)) {
            ps.setString(1, state.code());
            ps.setInt(2, limit);
            return ids(ps);
        }
    }

    @Override
    public List<ProcessRecord> findActiveByOwner(long ownerId) throws Exception {
        List<ProcessRecord> out = new ArrayList<>();
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT *
                FROM TB_PROCESS
                WHERE OWNER_ID = ?
                  AND STATE IN %s
                ORDER BY CREATED_AT ASC, ID ASC
            """.formatted(ACTIVE_STATES))) {
            ps.setLong(1, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toProcess(rs));
            }
        }
        return out;
    }

    @Override
    public Resources sumActiveReservations(long gatewayServerId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT COALESCE(SUM(CPU_RESERVED), 0) AS CPU_RESERVED,
                       COALESCE(SUM(RAM_RESERVED), 0) AS RAM_RESERVED,
                       COALESCE(SUM(HDD_RESERVED), 0) AS HDD_RESERVED,
                       COALESCE(SUM(NET_RESERVED), 0) AS NET_RESERVED
                FROM TB_PROCESS
                WHERE GATEWAY_SERVER_ID = ?
                  AND STATE IN %s
            """.formatted(ACTIVE_STATES))) {
            ps.setLong(1, gatewayServerId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? RowMappers.toReserved(rs) : Resources.ZERO;
            }
        }
    }

    // === utils ===

    private Optional<ProcessRecord> selectOne(String sql, long processId) throws SQLException {
        try (PreparedStatement ps = mustConn().prepareStatement(sql)) {
            ps.setLong(1, processId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toProcess(rs)) : Optional.empty();
            }
        }
    }

    private static List<Long> ids(PreparedStatement ps) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) ids.add(rs.getLong(1));
        }
        return ids;
    }
}
