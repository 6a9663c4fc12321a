package net.sentiflow.core.service;

import net.sentiflow.core.error.IncompleteSceneException;
import net.sentiflow.core.error.PreconditionException;
import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.MaskState;
import net.sentiflow.core.model.RegisterEntry;
import net.sentiflow.core.model.SceneMask;
import net.sentiflow.core.model.SceneMetadata;
import net.sentiflow.core.model.StepRequest;
import net.sentiflow.core.spi.MetadataStore;
import net.sentiflow.core.testing.FakeStepRunner;
import net.sentiflow.core.testing.InMemoryNamespaceStore;
import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 마스크 계획/실행/병합
 * - 공유 네임스페이스에 장면별 7개 밴드를 깔고 시작
 * - 메타데이터는 장면 id → 구름 비율 맵
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class MaskMergeEngineTest {

    private static final String SHARED = "PERMANENT";

    private InMemoryNamespaceStore store;
    private FakeStepRunner steps;
    private final Map<String, Double> cloudy = new HashMap<>();
    private MaskMergeEngine engine;

    @BeforeEach
    void init() {
        store = new InMemoryNamespaceStore(SHARED);
        steps = new FakeStepRunner(store);
        cloudy.clear();
        MetadataStore metadata = band -> {
            String scene = band.substring(0, band.lastIndexOf('_'));
            if (!cloudy.containsKey(scene)) return Optional.empty();
            return Optional.of(new SceneMetadata(Path.of("/meta", band, "description.json"), cloudy.get(scene), Map.of()));
        };
        engine = new MaskMergeEngine(store, steps, metadata, SHARED);
    }

    private List<RegisterEntry> bands(String... scenes) {
        List<RegisterEntry> out = new ArrayList<>();
        for (String scene : scenes) {
            for (String band : MaskMergeEngine.REQUIRED_BANDS) {
                String name = scene + "_" + band;
                store.put(SHARED, Artifact.raster(name));
                out.add(RegisterEntry.of(name, net.sentiflow.core.model.ArtifactName.parse(name).acquiredAt()));
            }
        }
        return out;
    }

    private MaskOutcome run(List<RegisterEntry> inputs, MaskSettings settings) throws Exception {
        List<SceneMask> plan = engine.plan(inputs, settings);
        try (CleanupRegistry cleanup = new CleanupRegistry(store)) {
            return engine.execute(plan, settings, PoolConfig.of(2, 200), cleanup, PoolListener.NONE);
        }
    }

    @Test
    void t1_same_day_scenes_are_patched_into_one_entry() throws Exception {
        List<RegisterEntry> in = bands("A_20210615T100000", "B_20210615T103000", "C_20210615T110000", "D_20210620T103021");

        MaskOutcome out = run(in, MaskSettings.cloudsOnly());

        assertThat(out.clouds()).extracting(RegisterEntry::artifact)
                .containsExactly("clouds_patched_20210615", "D_20210620T103021_clouds");
        assertEquals(LocalDateTime.of(2021, 6, 15, 10, 0), out.clouds().get(0).start());
        assertEquals(LocalDateTime.of(2021, 6, 20, 10, 30, 21), out.clouds().get(1).start());
        assertThat(out.shadows()).isEmpty();
        assertEquals(2, out.groups().size());

        StepRequest.Patch patch = (StepRequest.Patch) steps.calls(StepRequest.PATCH).get(0).request();
        assertThat(patch.inputs()).containsExactly(
                "A_20210615T100000_clouds", "B_20210615T103000_clouds", "C_20210615T110000_clouds");

        // 합쳐진 장면의 개별 마스크와 중간 산출물은 정리된다
        List<String> shared = store.names(SHARED);
        assertThat(shared).contains("clouds_patched_20210615", "D_20210620T103021_clouds");
        assertThat(shared).doesNotContain("A_20210615T100000_clouds", "A_20210615T100000_clouds_tmp");
        assertThat(out.scenes()).filteredOn(s -> s.state() == MaskState.MERGED).hasSize(3)
                .extracting(SceneMask::cloudArtifact).containsOnly("clouds_patched_20210615");
        assertThat(out.scenes()).filteredOn(s -> s.state() != MaskState.MERGED)
                .extracting(SceneMask::cloudArtifact).containsExactly("D_20210620T103021_clouds");
        assertThat(store.namespaces(PoolConfig.DEFAULT_PREFIX)).isEmpty();
    }

    @Test
    void t2_scenes_below_threshold_are_skipped_with_null_layer() throws Exception {
        cloudy.put("A_20210615T100000", 3.5);
        cloudy.put("D_20210620T103021", 64.0);
        List<RegisterEntry> in = bands("A_20210615T100000", "D_20210620T103021");

        MaskOutcome out = run(in, new MaskSettings(10, false, null, null, MaskSettings.DEFAULT_SHADOW_THRESHOLD));

        assertEquals(1, out.skipped());
        assertEquals(1, steps.calls(StepRequest.MASK).size());
        assertTrue(store.isNull(SHARED, Artifact.raster("A_20210615T100000_clouds")));
        assertFalse(store.isNull(SHARED, Artifact.raster("D_20210620T103021_clouds")));
        assertThat(out.clouds()).extracting(RegisterEntry::artifact)
                .containsExactly("A_20210615T100000_clouds", "D_20210620T103021_clouds");
    }

    @Test
    void t3_missing_metadata_is_a_precondition_error() {
        List<RegisterEntry> in = bands("A_20210615T100000");
        assertThatThrownBy(() -> engine.plan(in, new MaskSettings(10, false, null, null, 1000)))
                .isInstanceOf(PreconditionException.class)
                .hasMessageContaining("A_20210615T100000");
    }

    @Test
    void t4_area_filter_failure_yields_null_layer() throws Exception {
        steps.failIf(r -> r instanceof StepRequest.AreaFilter);
        List<RegisterEntry> in = bands("A_20210615T100000");

        MaskOutcome out = run(in, new MaskSettings(0, false, 5.0, null, 1000));

        assertTrue(out.failures().isEmpty());
        assertTrue(store.isNull(SHARED, Artifact.raster("A_20210615T100000_clouds")));
        assertThat(out.clouds()).extracting(RegisterEntry::artifact).containsExactly("A_20210615T100000_clouds");
    }

    @Test
    void t5_failed_scene_is_left_out() throws Exception {
        steps.failIf(r -> r instanceof StepRequest.CloudMask m && m.cloudRaster().startsWith("B_"));
        List<RegisterEntry> in = bands("A_20210615T100000", "B_20210615T103000");

        MaskOutcome out = run(in, MaskSettings.cloudsOnly());

        assertEquals(1, out.failures().size());
        assertEquals("B_20210615T103000", out.failures().get(0).subject());
        // 남은 장면 하나는 병합 없이 단독으로 등록
        assertThat(out.clouds()).extracting(RegisterEntry::artifact).containsExactly("A_20210615T100000_clouds");
        assertTrue(steps.calls(StepRequest.PATCH).isEmpty());
    }

    @Test
    void t6_shadows_use_metadata_and_are_patched_too() throws Exception {
        cloudy.put("A_20210615T100000", 50.0);
        cloudy.put("B_20210615T103000", 50.0);
        List<RegisterEntry> in = bands("A_20210615T100000", "B_20210615T103000");

        MaskOutcome out = run(in, new MaskSettings(0, true, null, null, 1000));

        assertThat(out.clouds()).extracting(RegisterEntry::artifact).containsExactly("clouds_patched_20210615");
        assertThat(out.shadows()).extracting(RegisterEntry::artifact).containsExactly("shadows_patched_20210615");
        assertThat(out.scenes()).hasSize(2).allMatch(s -> s.state() == MaskState.MERGED);
        assertThat(out.scenes()).extracting(SceneMask::cloudArtifact).containsOnly("clouds_patched_20210615");
        assertThat(out.scenes()).extracting(SceneMask::shadowArtifact).containsOnly("shadows_patched_20210615");
        StepRequest.CloudShadowMask req = (StepRequest.CloudShadowMask) steps.calls(StepRequest.MASK).get(0).request();
        assertEquals(1000, req.shadowThreshold());
        assertEquals("nir8a", req.bands().entrySet().stream()
                .filter(e -> e.getValue().endsWith("_B8A")).findFirst().orElseThrow().getKey());
        // 벡터 중간 산출물은 옮기지 않는다
        assertThat(store.list(SHARED)).noneMatch(a -> a.type() == Artifact.Type.VECTOR);
    }

    @Test
    void t7_null_band_makes_scene_incomplete() {
        List<RegisterEntry> in = bands("A_20210615T100000");
        store.putNull(SHARED, Artifact.raster("A_20210615T100000_B11"));

        assertThatThrownBy(() -> engine.plan(in, MaskSettings.cloudsOnly()))
                .isInstanceOf(IncompleteSceneException.class);
    }

    @Test
    void t8_band_listed_twice_is_planned_once() throws Exception {
        List<RegisterEntry> in = bands("A_20210615T100000", "B_20210615T103000");
        in.add(in.get(0));

        List<SceneMask> plan = engine.plan(in, MaskSettings.cloudsOnly());

        assertThat(plan).extracting(s -> s.scene().id()).containsExactly("A_20210615T100000", "B_20210615T103000");
        assertEquals("A_20210615T100000_B02", plan.get(0).bands().get("blue"));
        assertEquals(LocalDateTime.of(2021, 6, 15, 10, 30), plan.get(1).scene().acquiredAt());
    }
}
