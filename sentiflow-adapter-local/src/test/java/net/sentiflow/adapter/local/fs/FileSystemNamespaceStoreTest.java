package net.sentiflow.adapter.local.fs;

import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.NamespaceFingerprint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestMethodOrder(MethodOrderer.MethodName.class)
class FileSystemNamespaceStoreTest {

    @TempDir
    Path root;

    private FileSystemNamespaceStore store;

    private static final Artifact B04 = new Artifact("T32UNE_20210615T103021_B04_10m", Artifact.Type.RASTER);

    @BeforeEach
    void init() throws Exception {
        store = new FileSystemNamespaceStore(root, "PERMANENT");
    }

    @Test
    void t1_session_points_to_shared_namespace() throws Exception {
        assertThat(store.activeNamespace()).isEqualTo("PERMANENT");
        assertThat(store.exists("PERMANENT")).isTrue();
        assertThat(store.namespaces("")).isEmpty();
    }

    @Test
    void t2_private_config_names_worker_namespace() throws Exception {
        store.create("sentiflow_w_a");
        Path cfg = store.privateConfig("sentiflow_w_a");

        assertThat(Files.readString(cfg)).contains("NAMESPACE=sentiflow_w_a");
        // 공유 세션은 그대로
        assertThat(store.activeNamespace()).isEqualTo("PERMANENT");
        assertThat(store.list("sentiflow_w_a")).isEmpty();
    }

    @Test
    void t3_copy_overwrites_and_lists() throws Exception {
        store.create("w1");
        write("w1", B04, "v1");
        store.copy("w1", B04, "PERMANENT");
        write("w1", B04, "v2");
        store.copy("w1", B04, "PERMANENT");

        assertThat(store.list("PERMANENT")).containsExactly(B04);
        assertThat(Files.readString(store.location("PERMANENT", B04).resolve("data"))).isEqualTo("v2");
    }

    @Test
    void t4_delete_refuses_shared_namespace() throws Exception {
        store.create("sentiflow_w_x");
        store.delete("sentiflow_w_x");

        assertThat(store.exists("sentiflow_w_x")).isFalse();
        assertThatThrownBy(() -> store.delete("PERMANENT")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void t5_fingerprint_detects_modification() throws Exception {
        write("PERMANENT", B04, "v1");
        NamespaceFingerprint before = store.fingerprint("PERMANENT");

        Path data = store.location("PERMANENT", B04).resolve("data");
        Files.writeString(data, "changed");
        Files.setLastModifiedTime(data, FileTime.from(Instant.now().plusSeconds(60)));

        NamespaceFingerprint after = store.fingerprint("PERMANENT");
        assertThat(after).isNotEqualTo(before);
        assertThat(before.diff(after)).contains("modified");
    }

    @Test
    void t6_null_layer_marker() throws Exception {
        Artifact clouds = new Artifact("T32UNE_20210615T103021_clouds", Artifact.Type.VECTOR);
        store.writeNull("PERMANENT", clouds);

        assertThat(store.contains("PERMANENT", clouds)).isTrue();
        assertThat(store.isNull("PERMANENT", clouds)).isTrue();
        assertThat(store.isNull("PERMANENT", B04)).isFalse();
    }

    @Test
    void t7_namespaces_by_prefix() throws Exception {
        store.create("sentiflow_w_1");
        store.create("sentiflow_w_2");
        store.create("other");

        assertThat(store.namespaces("sentiflow_w_")).containsExactly("sentiflow_w_1", "sentiflow_w_2");
    }

    private void write(String ns, Artifact a, String content) throws Exception {
        Path dir = store.location(ns, a);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("data"), content);
    }
}
