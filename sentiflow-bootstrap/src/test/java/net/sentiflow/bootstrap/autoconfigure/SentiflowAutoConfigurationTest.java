package net.sentiflow.bootstrap.autoconfigure;

import net.sentiflow.bootstrap.props.SentiflowProperties;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

@TestMethodOrder(MethodOrderer.MethodName.class)
class SentiflowAutoConfigurationTest {

    @Test
    void t1_metadata_dir_falls_back_from_mask_to_import_to_workspace() {
        SentiflowProperties props = new SentiflowProperties();
        props.getWorkspace().setRoot(Path.of("/ws"));
        assertEquals(Path.of("/ws/metadata"), SentiflowAutoConfiguration.metadataDir(props));

        props.getImport().setMetadataDir(Path.of("/import-meta"));
        assertEquals(Path.of("/import-meta"), SentiflowAutoConfiguration.metadataDir(props));

        props.getMask().setMetadataDir(Path.of("/mask-meta"));
        assertEquals(Path.of("/mask-meta"), SentiflowAutoConfiguration.metadataDir(props));
    }
}
