package net.sentiflow.core.service;

import net.sentiflow.core.error.PreconditionException;
import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.HostCapacity;
import net.sentiflow.core.model.SceneMetadata;
import net.sentiflow.core.model.StepRequest;
import net.sentiflow.core.spi.TxRunner;
import net.sentiflow.core.testing.FakeStepRunner;
import net.sentiflow.core.testing.InMemoryDatasetStore;
import net.sentiflow.core.testing.InMemoryNamespaceStore;
import net.sentiflow.core.testing.RecordingLedger;
import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class MaskPipelineTest {

    private static final String SHARED = "PERMANENT";
    private static final List<String> SCENES = List.of("T32UNE_20210615T100000", "T32UNF_20210615T100010", "T32UNE_20210620T103021");

    private InMemoryNamespaceStore store;
    private FakeStepRunner steps;
    private InMemoryDatasetStore datasets;
    private RecordingLedger ledger;
    private MaskPipeline pipeline;

    @BeforeEach
    void init() throws Exception {
        store = new InMemoryNamespaceStore(SHARED);
        steps = new FakeStepRunner(store);
        datasets = new InMemoryDatasetStore();
        ledger = new RecordingLedger();

        // T32UNF 장면만 구름이 적다
        MaskMergeEngine engine = new MaskMergeEngine(store, steps, band -> Optional.of(new SceneMetadata(
                Path.of("/meta", band), band.startsWith("T32UNF") ? 2.0 : 75.0, Map.of())), SHARED);
        pipeline = new MaskPipeline(store, steps, datasets, () -> new HostCapacity(4, 16000L), ledger,
                TxRunner.direct(), Instant::now, engine, "sentiflow_w");

        datasets.create("s2", Artifact.Type.RASTER, "Sentinel-2", "Sentinel-2");
        List<String> names = SCENES.stream()
                .flatMap(s -> MaskMergeEngine.REQUIRED_BANDS.stream().map(b -> s + "_" + b))
                .toList();
        names.forEach(n -> store.put(SHARED, Artifact.raster(n)));
        datasets.register("s2", new TemporalIndexer(true).entries(names));
    }

    @Test
    void t1_clouds_and_shadows_datasets_are_created() throws Exception {
        PipelineReport r = pipeline.run(new MaskJob("s2", "clouds", "shadows", 10, null, null, 2, 2000, null));

        assertTrue(r.successful());
        assertEquals(1, r.skipped());
        assertThat(r.datasets()).containsExactly("clouds", "shadows");
        assertEquals(Artifact.Type.RASTER, datasets.get("clouds").type());
        assertThat(datasets.list("clouds")).extracting(e -> e.artifact())
                .containsExactly("clouds_patched_20210615", "T32UNE_20210620T103021_clouds");
        assertThat(datasets.list("shadows")).extracting(e -> e.artifact())
                .containsExactly("shadows_patched_20210615", "T32UNE_20210620T103021_shadows");
        assertEquals(2, steps.calls(StepRequest.MASK).size());
        assertEquals(1, ledger.count("skipped:"));
        assertEquals(1, ledger.count("finish:true"));
    }

    @Test
    void t2_unknown_input_dataset() {
        assertThatThrownBy(() -> pipeline.run(new MaskJob("nope", "clouds", null, 0, null, null, 1, 100, null)))
                .isInstanceOf(PreconditionException.class)
                .hasMessageContaining("nope");
        assertEquals(0, ledger.count("open:"));
    }

    @Test
    void t3_area_filter_step_required_when_min_size_is_set() {
        steps.unavailable(StepRequest.AREA_FILTER);
        assertThatThrownBy(() -> pipeline.run(new MaskJob("s2", "clouds", null, 0, 3.0, null, 1, 100, null)))
                .isInstanceOf(PreconditionException.class)
                .hasMessageContaining(StepRequest.AREA_FILTER);
    }

    @Test
    void t4_patch_failure_aborts_the_run() {
        steps.failIf(req -> req instanceof StepRequest.Patch);
        assertThatThrownBy(() -> pipeline.run(new MaskJob("s2", "clouds", null, 0, null, null, 2, 100, null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("clouds_patched_20210615");
        assertEquals(1, ledger.count("abort:"));
        assertFalse(datasets.exists("clouds"));
    }
}
