package com.libragraph.entitystore.core.storage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class InMemoryBlobStoreTest {

    private final InMemoryBlobStore store = new InMemoryBlobStore();

    @Test
    void readMissingBlobReturnsEmpty() {
        assertThat(store.read("missing")).isEmpty();
    }

    @Test
    void createOverwrites() {
        assertThat(store.create("a", "one")).isTrue();
        assertThat(store.create("a", "two")).isTrue();
        assertThat(store.read("a")).isEqualTo("two");
    }

    @Test
    void updateBehavesLikeCreate() {
        assertThat(store.update("a", "fresh")).isTrue();
        assertThat(store.read("a")).isEqualTo("fresh");
    }

    @Test
    void deleteReportsWhetherRemovalOccurred() {
        store.create("a", "x");

        assertThat(store.delete("a")).isTrue();
        assertThat(store.delete("a")).isFalse();
        assertThat(store.read("a")).isEmpty();
    }

    @Test
    void appendCreatesThenConcatenates() {
        store.append("log", "1\n");
        store.append("log", "2\n");

        assertThat(store.read("log")).isEqualTo("1\n2\n");
    }

    @Test
    void namesAreSorted() {
        store.create("b", "x");
        store.create("a", "y");

        assertThat(store.names()).containsExactly("a", "b");
        assertThat(store.size()).isEqualTo(2);

        store.clear();
        assertThat(store.size()).isZero();
    }

    @Test
    void rejectsEmptyName() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> store.create("", "x"));
    }
}
