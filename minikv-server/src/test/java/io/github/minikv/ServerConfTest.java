package io.github.minikv;

import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfTest {

    @Test
    void defaults() {
        ServerConf conf = ServerConf.fromProperties(new Properties());
        assertEquals("0.0.0.0", conf.getHost());
        assertEquals(6379, conf.getPort());
        assertEquals(100, conf.getSweepIntervalMs());
        assertEquals(1000, conf.getMaxClients());
        assertEquals(6379, conf.socketAddress().getPort());
    }

    @Test
    void fromProperties() {
        Properties props = new Properties();
        props.setProperty(ServerConf.HOST_KEY, "127.0.0.1");
        props.setProperty(ServerConf.PORT_KEY, " 7000 ");
        props.setProperty(ServerConf.SWEEP_INTERVAL_MS_KEY, "500");
        props.setProperty(ServerConf.MAX_CLIENTS_KEY, "10");

        ServerConf conf = ServerConf.fromProperties(props);
        assertEquals("127.0.0.1", conf.getHost());
        assertEquals(7000, conf.getPort());
        assertEquals(500, conf.getSweepIntervalMs());
        assertEquals(10, conf.getMaxClients());
    }

    @Test
    void malformedNumber() {
        Properties props = new Properties();
        props.setProperty(ServerConf.PORT_KEY, "redis");
        assertThrows(IllegalArgumentException.class, () -> ServerConf.fromProperties(props));
    }
}
