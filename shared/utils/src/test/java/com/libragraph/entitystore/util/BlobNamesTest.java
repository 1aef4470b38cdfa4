package com.libragraph.entitystore.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BlobNamesTest {

    @Test
    void recordName() {
        assertThat(BlobNames.record("User", "id", "1")).isEqualTo("User_id_1");
    }

    @Test
    void indexName() {
        assertThat(BlobNames.index("User")).isEqualTo("User_IDs");
    }

    @Test
    void rejectsBlankTable() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> BlobNames.index(" "))
                .withMessageContaining("table");
    }

    @Test
    void rejectsNullKeyName() {
        assertThatNullPointerException()
                .isThrownBy(() -> BlobNames.record("User", null, "1"));
    }

    @Test
    void rejectsEmptyIdToken() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> BlobNames.record("User", "id", ""));
    }
}
