package net.scanorama.adapter.jdbc.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.scanorama.core.model.DiscoveryJobConfig;
import net.scanorama.core.model.JobConfig;
import net.scanorama.core.model.JobConfigException;
import net.scanorama.core.model.JobType;
import net.scanorama.core.model.ScanJobConfig;
import net.scanorama.core.spi.JobConfigCodec;

/**
 * JSON form of the job configs stored in scheduled_jobs.config. The job type column picks the
 * record to decode into; unknown properties are ignored so older rows keep loading.
 */
public final class JacksonJobConfigCodec implements JobConfigCodec {
    private final ObjectMapper mapper;

    public JacksonJobConfigCodec() {
        this(new ObjectMapper());
    }

    public JacksonJobConfigCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String encode(JobConfig config) throws JobConfigException {
        try {
            return mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new JobConfigException("cannot encode " + config.type().code() + " config: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public JobConfig decode(JobType type, String payload) throws JobConfigException {
        if (payload == null || payload.isBlank()) {
            throw new JobConfigException("empty config for " + type.code() + " job");
        }
        Class<? extends JobConfig> target = targetOf(type);
        try {
            return mapper.readValue(payload, target);
        } catch (JsonProcessingException e) {
            throw new JobConfigException("invalid " + type.code() + " config: " + e.getOriginalMessage(), e);
        }
    }

    private static Class<? extends JobConfig> targetOf(JobType type) throws JobConfigException {
        if (type == JobType.DISCOVERY) return DiscoveryJobConfig.class;
        if (type == JobType.SCAN) return ScanJobConfig.class;
        throw new JobConfigException("unknown job type: " + type);
    }
}
