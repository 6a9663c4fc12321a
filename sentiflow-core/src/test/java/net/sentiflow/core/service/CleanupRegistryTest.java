package net.sentiflow.core.service;

import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.testing.InMemoryNamespaceStore;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class CleanupRegistryTest {

    @Test
    void t1_drains_registered_targets_on_close(@TempDir Path tmp) throws Exception {
        InMemoryNamespaceStore store = new InMemoryNamespaceStore("PERMANENT");
        store.put("PERMANENT", Artifact.raster("a_clouds"));
        store.create("sentiflow_w_x");
        Path dir = Files.createDirectories(tmp.resolve("sen2cor_1/result"));
        Files.writeString(dir.resolve("x.jp2"), "x");

        try (CleanupRegistry cleanup = new CleanupRegistry(store)) {
            cleanup.artifact("PERMANENT", Artifact.raster("a_clouds"));
            cleanup.artifact("PERMANENT", Artifact.raster("never_created"));
            cleanup.namespace("sentiflow_w_x");
            cleanup.path(tmp.resolve("sen2cor_1"));
            assertEquals(4, cleanup.size());
        }

        assertThat(store.names("PERMANENT")).isEmpty();
        assertFalse(store.exists("sentiflow_w_x"));
        assertFalse(Files.exists(tmp.resolve("sen2cor_1")));
    }

    @Test
    void t2_drain_counts_only_existing_targets() {
        InMemoryNamespaceStore store = new InMemoryNamespaceStore("PERMANENT");
        store.put("PERMANENT", Artifact.raster("b_shadows"));
        CleanupRegistry cleanup = new CleanupRegistry(store);
        cleanup.artifact("PERMANENT", Artifact.raster("b_shadows"));
        cleanup.artifact("PERMANENT", Artifact.raster("missing"));

        assertEquals(1, cleanup.drain());
        assertEquals(0, cleanup.size());
        assertEquals(0, cleanup.drain());
    }
}
