package com.platform.kothak.connectors.sqldb;

import com.platform.kothak.config.DatabaseConfig;
import com.platform.kothak.config.SqlDbConfig;
import com.platform.kothak.error.ErrorCode;
import com.platform.kothak.error.ResourceConnectException;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HikariSqlDbConnectorTest {
    
    private final HikariSqlDbConnector connector = new HikariSqlDbConnector();
    
    @Test
    void connect_opensValidatedLeaderPool() throws Exception {
        DatabaseConfig family = family(new SqlDbConfig());
        SqlDbConfig db = family.getSqldbs().get(0);
        db.setName("orders");
        db.setDriver("h2");
        db.getLeader().setDsn("jdbc:h2:mem:connector-leader;DB_CLOSE_DELAY=-1");
        family.setDefault();
        
        try (HikariDataSource dataSource = connector.connect(family, db, SqlDb.Role.LEADER)) {
            assertThat(dataSource.getPoolName()).isEqualTo("sqldb-orders-leader");
            assertThat(dataSource.getMaximumPoolSize()).isEqualTo(10);
            assertThat(dataSource.isReadOnly()).isFalse();
            try (Connection connection = dataSource.getConnection()) {
                assertThat(connection.isValid(1)).isTrue();
            }
        }
    }
    
    @Test
    void connect_replicaPoolIsReadOnly() {
        DatabaseConfig family = family(new SqlDbConfig());
        SqlDbConfig db = family.getSqldbs().get(0);
        db.setName("orders");
        db.setDriver("H2");
        db.getLeader().setDsn("jdbc:h2:mem:connector-primary;DB_CLOSE_DELAY=-1");
        db.getReplica().setDsn("jdbc:h2:mem:connector-replica;DB_CLOSE_DELAY=-1");
        db.getReplica().setMaxOpenConns(3);
        family.setDefault();
        
        try (HikariDataSource dataSource = connector.connect(family, db, SqlDb.Role.REPLICA)) {
            assertThat(dataSource.getPoolName()).isEqualTo("sqldb-orders-replica");
            assertThat(dataSource.getMaximumPoolSize()).isEqualTo(3);
            assertThat(dataSource.isReadOnly()).isTrue();
        }
    }
    
    @Test
    void connect_unknownDriverFailsAtDriverStage() {
        DatabaseConfig family = family(new SqlDbConfig());
        SqlDbConfig db = family.getSqldbs().get(0);
        db.setName("legacy");
        db.setDriver("db2");
        db.getLeader().setDsn("jdbc:db2://host/legacy");
        family.setDefault();
        
        assertThatThrownBy(() -> connector.connect(family, db, SqlDb.Role.LEADER))
            .isInstanceOfSatisfying(ResourceConnectException.class, e -> {
                assertThat(e.getStage()).isEqualTo(ResourceConnectException.Stage.DRIVER);
                assertThat(e.getErrorCode()).isEqualTo(ErrorCode.DRIVER_NOT_SUPPORTED);
                assertThat(e.getResourceName()).isEqualTo("legacy");
            });
    }
    
    @Test
    void connect_missingDriverClassFailsAtConnectStage() {
        DatabaseConfig family = family(new SqlDbConfig());
        SqlDbConfig db = family.getSqldbs().get(0);
        db.setName("legacy");
        db.setDriver("com.example.jdbc.MissingDriver");
        db.getLeader().setDsn("jdbc:missing://host/legacy");
        family.setDefault();
        
        assertThatThrownBy(() -> connector.connect(family, db, SqlDb.Role.LEADER))
            .isInstanceOfSatisfying(ResourceConnectException.class, e ->
                assertThat(e.getStage()).isEqualTo(ResourceConnectException.Stage.CONNECT));
    }
    
    @Test
    void connect_unreachableServerFailsAfterRetries() {
        DatabaseConfig family = family(new SqlDbConfig());
        family.setMaxRetry(1);
        family.setRetryInterval(Duration.ofMillis(10));
        SqlDbConfig db = family.getSqldbs().get(0);
        db.setName("remote");
        db.setDriver("h2");
        db.getLeader().setDsn("jdbc:h2:tcp://127.0.0.1:1/remote");
        family.setDefault();
        
        assertThatThrownBy(() -> connector.connect(family, db, SqlDb.Role.LEADER))
            .isInstanceOfSatisfying(ResourceConnectException.class, e -> {
                assertThat(e.getStage()).isEqualTo(ResourceConnectException.Stage.CONNECT);
                assertThat(e.getMessage()).contains("sql database remote");
            });
    }
    
    @Test
    void driverAliases() {
        assertThat(SqlDrivers.driverClassName("mysql")).contains("com.mysql.cj.jdbc.Driver");
        assertThat(SqlDrivers.driverClassName("Postgres")).contains("org.postgresql.Driver");
        assertThat(SqlDrivers.driverClassName("org.h2.Driver")).contains("org.h2.Driver");
        assertThat(SqlDrivers.driverClassName("unknown")).isEmpty();
        assertThat(SqlDrivers.driverClassName("")).isEmpty();
    }
    
    private static DatabaseConfig family(SqlDbConfig db) {
        DatabaseConfig family = new DatabaseConfig();
        family.getSqldbs().add(db);
        return family;
    }
}
