package com.marginal.data.sqlite;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.*;

class SqliteConnectionTest {

    @TempDir
    Path tempDir;

    @Test
    void sameFileSharesOneConnection() throws Exception {
        Path dbFile = tempDir.resolve("market.db");
        SqliteConnection first = SqliteConnection.forFile(dbFile);
        SqliteConnection second = SqliteConnection.forFile(tempDir.resolve("sub").resolve("..").resolve("market.db"));
        try {
            assertSame(first, second);
            Connection conn = first.getConnection();
            assertSame(conn, second.getConnection());
            assertFalse(conn.isClosed());
        } finally {
            first.close();
        }
    }

    @Test
    void closeDeregistersAndReopensLazily() throws Exception {
        Path dbFile = tempDir.resolve("market.db");
        SqliteConnection pooled = SqliteConnection.forFile(dbFile);
        Connection conn = pooled.getConnection();

        pooled.close();

        assertTrue(conn.isClosed());
        SqliteConnection reopened = SqliteConnection.forFile(dbFile);
        try {
            assertNotSame(pooled, reopened);
            Connection fresh = reopened.getConnection();
            assertNotSame(conn, fresh);
            assertFalse(fresh.isClosed());
        } finally {
            reopened.close();
        }
    }

    @Test
    void closedInstanceReconnectsOnDemand() throws Exception {
        SqliteConnection pooled = SqliteConnection.forFile(tempDir.resolve("market.db"));
        Connection conn = pooled.getConnection();
        conn.close();

        try {
            Connection fresh = pooled.getConnection();
            assertNotSame(conn, fresh);
            assertFalse(fresh.isClosed());
        } finally {
            pooled.close();
        }
    }
}
