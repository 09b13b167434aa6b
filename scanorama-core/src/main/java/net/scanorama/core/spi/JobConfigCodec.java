package net.scanorama.core.spi;

import net.scanorama.core.model.JobConfig;
import net.scanorama.core.model.JobConfigException;
import net.scanorama.core.model.JobType;

public interface JobConfigCodec {
    String encode(JobConfig config) throws JobConfigException;

    JobConfig decode(JobType type, String payload) throws JobConfigException;
}
