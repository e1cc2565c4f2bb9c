package me.golemcore.memory.infrastructure.http;

import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeouts() {
        MemoryEngineProperties properties = new MemoryEngineProperties();
        properties.getHttp().setConnectTimeout(1500);
        properties.getHttp().setReadTimeout(2500);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(1500, client.connectTimeoutMillis());
        assertEquals(2500, client.readTimeoutMillis());
        assertEquals(60000, client.writeTimeoutMillis());
        assertTrue(client.retryOnConnectionFailure());
    }
}
