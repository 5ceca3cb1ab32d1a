package com.rivalapex.adexport.manager.id;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class JobIdGeneratorTest {

    private final JobIdGenerator generator = new JobIdGenerator();

    @Test
    void nextJobId_formatIsPrefixMillisRandom() {
        String id = generator.nextJobId();

        assertThat(id).matches("job-\\d{13}-[0-9a-z]{9}");
    }

    @Test
    void nextSyncId_usesSyncPrefix() {
        assertThat(generator.nextSyncId()).startsWith("sync-");
    }

    @Test
    void nextJobId_isUniqueAcrossManyCalls() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(generator.nextJobId());
        }
        assertThat(ids).hasSize(1000);
    }
}
