package com.ryuqq.pipeline.adapter.inmemory.store;

import com.ryuqq.pipeline.core.artifact.CacheEntry;
import com.ryuqq.pipeline.core.executor.FileContent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryCacheStore 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryCacheStoreTest {

    @Test
    void put_get_키_단위로_저장되고_나중_값이_이김() {
        // given
        InMemoryCacheStore store = new InMemoryCacheStore();
        Instant t0 = Instant.parse("2024-03-01T10:00:00Z");

        // when
        store.put(new CacheEntry("deps-main", Map.of("node_modules/a.js", FileContent.ofText("old")), t0));
        store.put(new CacheEntry("deps-main", Map.of("node_modules/a.js", FileContent.ofText("new")), t0.plusSeconds(60)));

        // then
        assertThat(store.get("deps-main")).hasValueSatisfying(entry -> {
            assertThat(entry.files()).containsEntry("node_modules/a.js", FileContent.ofText("new"));
            assertThat(entry.savedAt()).isEqualTo(t0.plusSeconds(60));
        });
        assertThat(store.get("deps-feature")).isEmpty();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void clear_후_비어있음() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        store.put(new CacheEntry("deps", Map.of(), Instant.now()));

        store.clear();

        assertThat(store.get("deps")).isEmpty();
    }

    @Test
    void null_인자면_예외() {
        InMemoryCacheStore store = new InMemoryCacheStore();

        assertThatThrownBy(() -> store.get(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.put(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
