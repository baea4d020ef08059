package com.coinchase;

import com.coinchase.config.ServerConfig;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Server Config Tests")
class ServerConfigTest {

    @Test
    @DisplayName("Defaults match the documented settings")
    void testDefaults() {
        ServerConfig config = ServerConfig.defaults();

        assertEquals(8080, config.getHttpPort());
        assertEquals(16, config.getWorkerCount());
        assertEquals(300, config.getReadIdleSeconds());
        assertEquals(300, config.getDialTimeoutSeconds());
        assertEquals(100, config.getFaultTolerance());
        assertEquals(10_000, config.getLivenessIntervalMillis());
        assertEquals(40_003, config.workerPort(3));
    }

    @Test
    @DisplayName("key=value arguments override defaults, bad values are ignored")
    void testFromArgs() {
        ServerConfig config = ServerConfig.fromArgs(new String[]{
                "httpPort=9000", "workers=4", "livenessIntervalSeconds=5", "faultTolerance=oops", "garbage", "nope=1"
        });

        assertEquals(9000, config.getHttpPort());
        assertEquals(4, config.getWorkerCount());
        assertEquals(5_000, config.getLivenessIntervalMillis());
        assertEquals(100, config.getFaultTolerance());
    }

    @Test
    @DisplayName("Base port zero lets every worker pick an ephemeral port")
    void testEphemeralWorkerPorts() {
        ServerConfig config = ServerConfig.builder().workerBasePort(0).build();

        assertEquals(0, config.workerPort(0));
        assertEquals(0, config.workerPort(7));
    }

    @Test
    @DisplayName("Invalid combinations are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder().workerCount(0).build());
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.builder()
                .livenessIntervalMillis(1000).livenessTimeoutMillis(2000).build());
    }
}
