package com.libragraph.entitystore.types;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class EntityTypeTest {

    record Note(Long id, String text) implements Entity<Long> {

        static Note parse(String content) {
            int sep = content.indexOf('|');
            return new Note(Long.parseLong(content.substring(0, sep)), content.substring(sep + 1));
        }

        @Override
        public Optional<Long> primaryKey() {
            return Optional.ofNullable(id);
        }

        @Override
        public String serialize() {
            return id + "|" + text;
        }
    }

    private static final EntityType<Note, Long> NOTES =
            EntityType.of("Note", "id", IdCodec.LONG, Note::parse);

    @Test
    void delegatesToEntityInstance() {
        Note note = new Note(3L, "hello");

        assertThat(NOTES.primaryKey(note)).contains(3L);
        assertThat(NOTES.serialize(note)).isEqualTo("3|hello");
        assertThat(NOTES.deserialize("3|hello")).isEqualTo(note);
    }

    @Test
    void exposesTypeLevelNames() {
        assertThat(NOTES.tableName()).isEqualTo("Note");
        assertThat(NOTES.primaryKeyName()).isEqualTo("id");
        assertThat(NOTES.idCodec()).isSameAs(IdCodec.LONG);
    }

    @Test
    void missingKeyIsEmpty() {
        assertThat(NOTES.primaryKey(new Note(null, "draft"))).isEmpty();
    }

    @Test
    void rejectsBlankTableName() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> EntityType.of(" ", "id", IdCodec.LONG, Note::parse));
    }
}
