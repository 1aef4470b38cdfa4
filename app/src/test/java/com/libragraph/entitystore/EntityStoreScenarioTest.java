package com.libragraph.entitystore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.entitystore.core.entity.Id;
import com.libragraph.entitystore.core.entity.Table;
import com.libragraph.entitystore.core.repository.CrudRepository;
import com.libragraph.entitystore.core.repository.RepositoryFactory;
import com.libragraph.entitystore.core.storage.FilesystemBlobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end runs against the filesystem store with annotated entity types.
 */
class EntityStoreScenarioTest {

    @Table("User")
    record User(@Id Long id, String data) {}

    record Device(@Id String serial, String model) {}

    @TempDir
    Path root;

    private RepositoryFactory factory;
    private CrudRepository<User, Long> users;

    @BeforeEach
    void setUp() {
        factory = new RepositoryFactory(new FilesystemBlobStore(root), new ObjectMapper());
        users = factory.create(User.class, Long.class);
    }

    @Test
    void saveFindDeleteScenario() {
        users.save(new User(1L, "Alice"));
        users.save(new User(2L, "Bob"));

        assertThat(users.findAll()).extracting(User::data).containsExactly("Alice", "Bob");

        users.deleteById(1L);

        assertThat(users.findAll()).extracting(User::data).containsExactly("Bob");
        assertThat(users.existsById(1L)).isFalse();
        assertThat(users.existsById(2L)).isTrue();
    }

    @Test
    void blobsUseDocumentedNames() throws IOException {
        users.save(new User(1L, "Alice"));

        assertThat(root.resolve("User_id_1")).exists();
        assertThat(Files.readString(root.resolve("User_IDs"))).isEqualTo("1\n");
    }

    @Test
    void dataSurvivesNewRepositoryInstance() {
        users.save(new User(5L, "Eve"));

        CrudRepository<User, Long> reopened = new RepositoryFactory(new FilesystemBlobStore(root), new ObjectMapper())
                .create(User.class, Long.class);

        assertThat(reopened.findById(5L)).contains(new User(5L, "Eve"));
        assertThat(reopened.count()).isEqualTo(1);
    }

    @Test
    void tablesAreIndependent() {
        CrudRepository<Device, String> devices = factory.create(Device.class, String.class);

        users.save(new User(1L, "Alice"));
        devices.save(new Device("esp32-a", "ESP32"));
        devices.save(new Device("esp32-b", "ESP32-S3"));

        assertThat(users.findAll()).hasSize(1);
        assertThat(devices.findAll()).extracting(Device::serial).containsExactly("esp32-a", "esp32-b");

        devices.deleteAll();

        assertThat(devices.count()).isZero();
        assertThat(users.findById(1L)).isPresent();
    }

    @Test
    void updateRepairsHandEditedIndex() throws IOException {
        Files.writeString(root.resolve("User_IDs"), "7");
        Files.writeString(root.resolve("User_id_7"), "{\"id\":7,\"data\":\"Grace\"}");

        users.update(new User(8L, "Heidi"));

        assertThat(Files.readString(root.resolve("User_IDs"))).isEqualTo("7\n8\n");
        assertThat(users.findAll()).extracting(User::data).containsExactly("Grace", "Heidi");
    }

    @Test
    void unreadableRecordIsTreatedAsMissing() throws IOException {
        users.save(new User(1L, "Alice"));
        users.save(new User(2L, "Bob"));
        Files.write(root.resolve("User_id_2"), new byte[]{(byte) 0xC3, (byte) 0x28});

        assertThat(users.existsById(2L)).isFalse();
        assertThat(users.findById(2L)).isEmpty();
        assertThat(users.findAll()).extracting(User::data).containsExactly("Alice");
    }

    @Test
    void entityWithoutKeyIsNotWritten() throws IOException {
        users.save(new User(null, "Nobody"));

        try (var files = Files.list(root)) {
            assertThat(files).isEmpty();
        }
    }
}
