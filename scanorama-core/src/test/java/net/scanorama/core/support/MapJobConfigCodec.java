package net.scanorama.core.support;

import net.scanorama.core.model.JobConfig;
import net.scanorama.core.model.JobConfigException;
import net.scanorama.core.model.JobType;
import net.scanorama.core.spi.JobConfigCodec;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Encodes configs as opaque tokens; an unknown token or a type mismatch decodes as corrupt. */
public final class MapJobConfigCodec implements JobConfigCodec {
    private final Map<String, JobConfig> byToken = new ConcurrentHashMap<>();
    private final AtomicInteger seq = new AtomicInteger();

    @Override
    public String encode(JobConfig config) {
        String token = "cfg-" + seq.incrementAndGet();
        byToken.put(token, config);
        return token;
    }

    @Override
    public JobConfig decode(JobType type, String payload) throws JobConfigException {
        JobConfig c = payload == null ? null : byToken.get(payload);
        if (c == null) throw new JobConfigException("corrupt config payload: " + payload);
        if (c.type() != type) throw new JobConfigException("config is " + c.type() + ", job is " + type);
        return c;
    }
}
