package net.hexproc.adapter.jdbc.mapper;

import net.hexproc.adapter.jdbc.JdbcUtil;
import net.hexproc.core.model.*;
import java.sql.*;

public final class RowMappers {
    private RowMappers() {}

    // --- Server (resource pool) ---
    public static ResourcePool toResourcePool(ResultSet rs) throws SQLException {
        return new ResourcePool(
                rs.getLong("ID"),
                new Resources(
                        rs.getLong("CPU_TOTAL"),
                        rs.getLong("RAM_TOTAL"),
                        rs.getLong("HDD_TOTAL"),
                        rs.getLong("NET_TOTAL")),
                new Resources(
                        rs.getLong("CPU_AVAILABLE"),
                        rs.getLong("RAM_AVAILABLE"),
                        rs.getLong("HDD_AVAILABLE"),
                        rs.getLong("NET_AVAILABLE")),
                rs.getInt("DIFFICULTY"),
                JdbcUtil.toInstant(rs.getTimestamp("CREATED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("UPDATED_AT"))
        );
    }

    // --- Process ---
    public static ProcessRecord toProcess(ResultSet rs) throws SQLException {
        return new ProcessRecord(
                rs.getLong("ID"),
                rs.getLong("OWNER_ID"),
                rs.getLong("GATEWAY_SERVER_ID"),
                rs.getLong("TARGET_SERVER_ID"),
                ProcessType.valueOf(rs.getString("PROCESS_TYPE")),
                ProcessPriority.fromWeight(rs.getInt("PRIORITY")),
                ProcessState.from(rs.getString("STATE")),
                toReserved(rs),
                rs.getDouble("PROGRESS"),
                rs.getDouble("REQUIRED_WORK"),
                rs.getLong("VERSION"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("LAST_CHECKPOINT_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("COMPLETED_AT")),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    /** CPU_RESERVED.. 컬럼(또는 같은 별칭의 합계) */
    public static Resources toReserved(ResultSet rs) throws SQLException {
        return new Resources(
                rs.getLong("CPU_RESERVED"),
                rs.getLong("RAM_RESERVED"),
                rs.getLong("HDD_RESERVED"),
                rs.getLong("NET_RESERVED"));
    }
}
