package net.hexproc.adapter.jdbc.repo;

import net.hexproc.adapter.jdbc.mapper.RowMappers;
import net.hexproc.core.model.ResourcePool;
import net.hexproc.core.model.Resources;
import net.hexproc.core.spi.ServerRepository;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.hexproc.adapter.jdbc.JdbcUtil.mustConn;

/**
 * TB_SERVER 한 행 = 서버 하나의 자원 풀.
 * 차감/반환은 조건부 UPDATE 로만 한다. 조건이 어긋나면 0건 반영 → false.
 */
public final class JdbcServerRepository implements ServerRepository {

    @Override
    public Optional<ResourcePool> lockPool(long serverId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
                SELECT *
                FROM TB_SERVER
                WHERE ID = ?
                FOR UPDATE
            """)) {
            ps.setLong(1, serverId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toResourcePool(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public Optional<ResourcePool> findById(long serverId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM TB_SERVER WHERE ID = ?")) {
            ps.setLong(1, serverId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toResourcePool(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public boolean exists(long serverId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT 1 FROM TB_SERVER WHERE ID = ?")) {
            ps.setLong(1, serverId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public boolean debit(long serverId, Resources amount) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
            UPDATE TB_SERVER
               SET CPU_AVAILABLE = CPU_AVAILABLE - ?,
                   RAM_AVAILABLE = RAM_AVAILABLE - ?,
                   HDD_AVAILABLE = HDD_AVAILABLE - ?,
                   NET_AVAILABLE = NET_AVAILABLE - ?,
                   UPDATED_AT    = CURRENT_TIMESTAMP
             WHERE ID = ?
               AND CPU_AVAILABLE >= ?
               AND RAM_AVAILABLE >= ?
               AND HDD_AVAILABLE >= ?
               AND NET_AVAILABLE >= ?
        """)) {
            int i = bindAmount(ps, 1, amount);
            ps.setLong(i++, serverId);
            bindAmount(ps, i, amount);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean credit(long serverId, Resources amount) throws Exception {
        // total 을 넘기는 반환은 이중 반환이므로 반영하지 않는다
        try (PreparedStatement ps = mustConn().prepareStatement("""
            UPDATE TB_SERVER
               SET CPU_AVAILABLE = CPU_AVAILABLE + ?,
                   RAM_AVAILABLE = RAM_AVAILABLE + ?,
                   HDD_AVAILABLE = HDD_AVAILABLE + ?,
                   NET_AVAILABLE = NET_AVAILABLE + ?,
                   UPDATED_AT    = CURRENT_TIMESTAMP
             WHERE ID = ?
               AND CPU_AVAILABLE + ? <= CPU_TOTAL
               AND RAM_AVAILABLE + ? <= RAM_TOTAL
               AND HDD_AVAILABLE + ? <= HDD_TOTAL
               AND NET_AVAILABLE + ? <= NET_TOTAL
        """)) {
            int i = bindAmount(ps, 1, amount);
            ps.setLong(i++, serverId);
            bindAmount(ps, i, amount);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean insertIfAbsent(ResourcePool pool) throws Exception {
        if (exists(pool.serverId())) return false;

        Resources t = pool.total();
        Resources a = pool.available();
        try (PreparedStatement ps = mustConn().prepareStatement("""
            INSERT INTO TB_SERVER
                (ID, CPU_TOTAL, RAM_TOTAL, HDD_TOTAL, NET_TOTAL,
                 CPU_AVAILABLE, RAM_AVAILABLE, HDD_AVAILABLE, NET_AVAILABLE,
                 DIFFICULTY, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        """)) {
            ps.setLong(1, pool.serverId());
            int i = bindAmount(ps, 2, t);
            i = bindAmount(ps, i, a);
            ps.setInt(i, pool.difficulty());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            // 동시 등록으로 PK 충돌: 이미 있는 것으로 본다
            if (e.getSQLState() != null && e.getSQLState().startsWith("23")) return false;
            throw e;
        }
    }

    @Override
    public List<Long> findAllIds() throws Exception {
        List<Long> ids = new ArrayList<>();
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT ID FROM TB_SERVER ORDER BY ID");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) ids.add(rs.getLong(1));
        }
        return ids;
    }

    /** cpu, ram, hdd, net 순으로 바인딩하고 다음 인덱스를 돌려준다 */
    private static int bindAmount(PreparedStatement ps, int from, Resources r) throws SQLException {
        ps.setLong(from, r.cpu());
        ps.setLong(from + 1, r.ram());
        ps.setLong(from + 2, r.hdd());
        ps.setLong(from + 3, r.net());
        return from + 4;
    }
}
