package net.scanorama.adapter.jdbc.codec;

import net.scanorama.core.model.DiscoveryJobConfig;
import net.scanorama.core.model.JobConfigException;
import net.scanorama.core.model.JobType;
import net.scanorama.core.model.ScanJobConfig;
import net.scanorama.core.model.ScanOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JacksonJobConfigCodecTest {

    final JacksonJobConfigCodec codec = new JacksonJobConfigCodec();

    @Test
    void scanConfig_survivesStorage() throws Exception {
        var config = new ScanJobConfig(true, List.of("10.0.0.0/8"), List.of("linux", "windows"), 24, "auto",
                new ScanOptions("1-1024", "syn", 30));

        String json = codec.encode(config);

        assertFalse(json.contains("\"type\""), "the job type lives in its own column");
        assertEquals(config, codec.decode(JobType.SCAN, json));
    }

    @Test
    void missingFields_takeDefaults() throws Exception {
        var discovery = (DiscoveryJobConfig) codec.decode(JobType.DISCOVERY, "{\"network\":\"10.0.0.0/8\"}");
        assertEquals("tcp", discovery.method());
        assertEquals(3, discovery.timeoutSeconds());
        assertEquals(50, discovery.concurrency());

        var scan = (ScanJobConfig) codec.decode(JobType.SCAN, "{\"liveHostsOnly\":true,\"legacyField\":1}");
        assertTrue(scan.liveHostsOnly());
        assertTrue(scan.networks().isEmpty());
        assertEquals(ScanOptions.defaults(), scan.options());
    }

    @Test
    void corruptOrUntypedPayload_isAConfigError() {
        assertThrows(JobConfigException.class, () -> codec.decode(JobType.SCAN, "{not json"));
        assertThrows(JobConfigException.class, () -> codec.decode(JobType.DISCOVERY, ""));
        assertThrows(JobConfigException.class, () -> codec.decode(JobType.UNKNOWN, "{}"));
    }
}
