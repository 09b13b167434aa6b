package net.scanorama.core.spi;

import java.time.Instant;

@FunctionalInterface
public interface Clock {
    Instant now();
}
