package net.sentiflow.core.service;

import net.sentiflow.core.error.PreconditionException;
import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.ArtifactName;
import net.sentiflow.core.model.CompletedUnit;
import net.sentiflow.core.model.DateGroup;
import net.sentiflow.core.model.ExecutionTarget;
import net.sentiflow.core.model.MaskState;
import net.sentiflow.core.model.PoolReport;
import net.sentiflow.core.model.RegisterEntry;
import net.sentiflow.core.model.Scene;
import net.sentiflow.core.model.SceneMask;
import net.sentiflow.core.model.SceneMetadata;
import net.sentiflow.core.model.StepRequest;
import net.sentiflow.core.model.StepResult;
import net.sentiflow.core.model.UnitFailure;
import net.sentiflow.core.model.WorkUnit;
import net.sentiflow.core.model.WorkerContext;
import net.sentiflow.core.spi.MetadataStore;
import net.sentiflow.core.spi.NamespaceStore;
import net.sentiflow.core.spi.StepRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 장면별 구름/그림자 마스크 계산과 같은 날짜 병합.
 * <ol>
 *   <li>plan: 입력 밴드를 장면별로 묶고 임계값으로 계산 여부를 정한다.</li>
 *   <li>execute: 계산할 장면만 풀에 넣고, 모두 끝난 뒤(barrier) 결과를 옮기고 날짜별로 합친다.</li>
 * </ol>
 * 장면 상태는 이 클래스를 호출한 스레드에서만 바뀐다.
 */
public final class MaskMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MaskMergeEngine.class);

    /** 밴드 → 마스크 스텝 입력 역할 */
    public static final Map<String, String> BAND_ROLES;
    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("B02", "blue");
        m.put("B03", "green");
        m.put("B04", "red");
        m.put("B08", "nir");
        m.put("B8A", "nir8a");
        m.put("B11", "swir11");
        m.put("B12", "swir12");
        BAND_ROLES = Collections.unmodifiableMap(m);
    }
    public static final List<String> REQUIRED_BANDS = List.copyOf(BAND_ROLES.keySet());

    public static final String CLOUDS = "clouds";
    public static final String SHADOWS = "shadows";

    private final NamespaceStore namespaces;
    private final StepRunner steps;
    private final MetadataStore metadata;
    private final String sharedNamespace;

    public MaskMergeEngine(NamespaceStore namespaces, StepRunner steps, MetadataStore metadata, String sharedNamespace) {
        this.namespaces = namespaces;
        this.steps = steps;
        this.metadata = metadata;
        this.sharedNamespace = sharedNamespace;
    }

    /**
     * 입력 항목(시각 포함)을 장면별로 묶고 계산 여부를 결정한다.
     * 값이 전부 null 인 밴드 래스터는 경고 후 제외한다.
     */
    public List<SceneMask> plan(List<RegisterEntry> inputs, MaskSettings settings) throws Exception {
        Map<String, LocalDateTime> starts = new LinkedHashMap<>();
        for (RegisterEntry e : inputs) {
            if (namespaces.isNull(sharedNamespace, Artifact.raster(e.artifact()))) {
                log.warn("Raster {} only consists of NULL() in current region. Cloud/shadow detection is skipped.",
                        e.artifact());
                continue;
            }
            starts.putIfAbsent(e.artifact(), e.start());
        }
        Map<String, Map<String, String>> bandsByScene = TemporalIndexer.groupByScene(starts.keySet());
        TemporalIndexer.requireComplete(bandsByScene, REQUIRED_BANDS);
        // 장면 시각과 메타데이터 조회는 장면의 첫 밴드 기준
        Map<String, String> firstBand = new HashMap<>();
        Map<String, LocalDateTime> times = new HashMap<>();
        for (String name : starts.keySet()) {
            String sceneId = ArtifactName.parse(name).sceneId();
            if (firstBand.putIfAbsent(sceneId, name) == null) times.put(sceneId, starts.get(name));
        }

        List<SceneMask> plan = new ArrayList<>();
        int number = 0;
        for (var e : bandsByScene.entrySet()) {
            String sceneId = e.getKey();
            log.info("Processing {} of {} scenes", ++number, bandsByScene.size());
            SceneMetadata meta = null;
            if (settings.needsMetadata()) {
                meta = metadata.find(firstBand.get(sceneId)).orElseThrow(() -> new PreconditionException(
                        "No metadata found for scene <" + sceneId + "> (band <" + firstBand.get(sceneId) + ">)"));
            }
            Map<String, String> roles = new LinkedHashMap<>();
            BAND_ROLES.forEach((band, role) -> roles.put(role, e.getValue().get(band)));

            SceneMask scene = new SceneMask(
                    new Scene(sceneId, times.get(sceneId)),
                    roles,
                    meta,
                    sceneId + "_" + CLOUDS,
                    settings.shadows() ? sceneId + "_" + SHADOWS : null);

            if (settings.threshold() > 0) {
                Double cloudy = meta.cloudyPixelPercentage();
                if (cloudy == null) {
                    throw new PreconditionException("CLOUDY_PIXEL_PERCENTAGE missing in " + meta.source());
                }
                if (cloudy < settings.threshold()) {
                    log.info("Scene <{}> has {}% cloudy pixels, below threshold {}. Skipping computation.",
                            sceneId, cloudy, settings.threshold());
                    scene.skip();
                    plan.add(scene);
                    continue;
                }
            }
            scene.compute();
            plan.add(scene);
        }
        return plan;
    }

    /** 계획된 장면을 실행하고 같은 날짜 결과를 합친다. */
    public MaskOutcome execute(List<SceneMask> plan,
                               MaskSettings settings,
                               PoolConfig poolConfig,
                               CleanupRegistry cleanup,
                               PoolListener listener) throws Exception {
        ExecutionTarget shared = ExecutionTarget.shared(sharedNamespace, poolConfig.memoryMb());
        Map<String, SceneMask> byId = new LinkedHashMap<>();
        plan.forEach(s -> byId.put(s.scene().id(), s));

        List<SceneMask> computed = plan.stream().filter(s -> s.state() == MaskState.COMPUTED).toList();
        int skipped = (int) plan.stream().filter(s -> s.state() == MaskState.SKIPPED).count();
        for (SceneMask s : computed) {
            // 마스크 스텝이 남기는 재조정 사본
            s.bands().values().forEach(b -> cleanup.artifact(sharedNamespace, Artifact.raster(b + "_double")));
        }

        ResultReconciler reconciler = new ResultReconciler(namespaces, sharedNamespace);
        PoolReport report = new PoolReport(0, List.of(), List.of(), 0, false);
        if (!computed.isEmpty()) {
            try (IsolatedWorkerPool pool = new IsolatedWorkerPool(namespaces, steps, sharedNamespace, poolConfig, listener)) {
                for (SceneMask s : computed) {
                    pool.submit(WorkUnit.of(s.scene().id(), s.scene().id(), request(s, settings)));
                }
                report = pool.awaitAll();
            }
        }

        for (UnitFailure f : report.failures()) {
            byId.get(f.unitId()).fail(f.reason());
        }
        Iterator<CompletedUnit> pending = report.completed().iterator();
        try {
            while (pending.hasNext()) {
                CompletedUnit done = pending.next();
                SceneMask scene = byId.get(done.unit().id());
                List<Artifact> moved = reconciler.reconcile(done.context(),
                        (ctx, a) -> transfer(scene, ctx, a, settings, shared));
                Set<String> names = new HashSet<>();
                moved.forEach(a -> names.add(a.name()));
                if (!names.contains(scene.cloudArtifact())) nullLayer(scene.cloudArtifact(), shared);
                if (scene.shadowArtifact() != null && !names.contains(scene.shadowArtifact())) {
                    nullLayer(scene.shadowArtifact(), shared);
                }
                reconciler.rebaseline();
                scene.standalone();
            }
        } catch (Exception e) {
            while (pending.hasNext()) reconciler.discard(pending.next().context());
            throw e;
        }
        for (SceneMask scene : plan) {
            if (scene.state() != MaskState.SKIPPED) continue;
            nullLayer(scene.cloudArtifact(), shared);
            if (scene.shadowArtifact() != null) nullLayer(scene.shadowArtifact(), shared);
            scene.standalone();
        }

        List<DateGroup> groups = merge(plan, settings, shared, cleanup);

        Map<String, RegisterEntry> clouds = new LinkedHashMap<>();
        Map<String, RegisterEntry> shadows = new LinkedHashMap<>();
        Map<LocalDate, DateGroup> byDate = new HashMap<>();
        groups.forEach(g -> byDate.put(g.date(), g));
        for (SceneMask scene : plan) {
            if (scene.state() == MaskState.FAILED) continue;
            DateGroup g = byDate.get(scene.scene().acquisitionDate());
            clouds.putIfAbsent(scene.cloudArtifact(), RegisterEntry.of(scene.cloudArtifact(), g.registerTime()));
            if (scene.shadowArtifact() != null) {
                shadows.putIfAbsent(scene.shadowArtifact(), RegisterEntry.of(scene.shadowArtifact(), g.registerTime()));
            }
        }
        return new MaskOutcome(plan, groups, new ArrayList<>(clouds.values()), new ArrayList<>(shadows.values()),
                report.failures(), skipped, report);
    }

    private List<DateGroup> merge(List<SceneMask> plan, MaskSettings settings,
                                  ExecutionTarget shared, CleanupRegistry cleanup) throws Exception {
        Map<LocalDate, DateGroup> groups = new TreeMap<>();
        for (SceneMask s : plan) {
            if (s.state() != MaskState.STANDALONE) continue;
            groups.computeIfAbsent(s.scene().acquisitionDate(), DateGroup::new).add(s);
        }
        for (DateGroup g : groups.values()) {
            if (!g.needsMerge()) {
                SceneMask only = g.members().get(0);
                g.merged(only.cloudArtifact(), only.shadowArtifact());
                continue;
            }
            String clouds = patch(g, CLOUDS, g.members().stream().map(SceneMask::cloudArtifact).toList(), shared, cleanup);
            String shadows = null;
            if (settings.shadows()) {
                shadows = patch(g, SHADOWS, g.members().stream().map(SceneMask::shadowArtifact).toList(), shared, cleanup);
            }
            for (SceneMask m : g.members()) m.mergedInto(clouds, shadows);
            g.merged(clouds, shadows);
        }
        return new ArrayList<>(groups.values());
    }

    private String patch(DateGroup g, String kind, List<String> inputs,
                         ExecutionTarget shared, CleanupRegistry cleanup) throws Exception {
        String output = g.patchedName(kind);
        log.info("Patching {} {} masks of {} into <{}>", inputs.size(), kind, g.date(), output);
        StepResult r = steps.invoke(new StepRequest.Patch(inputs, output), shared);
        if (!r.ok()) {
            throw new IllegalStateException("Patching <" + output + "> failed with exit status "
                    + r.exitStatus() + ": " + r.diagnostics());
        }
        inputs.forEach(i -> cleanup.artifact(sharedNamespace, Artifact.raster(i)));
        return output;
    }

    private StepRequest request(SceneMask s, MaskSettings settings) {
        if (settings.shadows()) {
            return new StepRequest.CloudShadowMask(s.bands(), s.cloudArtifact(), s.shadowArtifact(),
                    s.metadata().source(), settings.shadowThreshold());
        }
        return new StepRequest.CloudMask(s.bands(), s.cloudArtifact());
    }

    /** 마스크 래스터만 공유 네임스페이스로 옮기고 중간 산출물은 버린다. */
    private Artifact transfer(SceneMask scene, WorkerContext ctx, Artifact a,
                              MaskSettings settings, ExecutionTarget shared) throws Exception {
        if (a.type() != Artifact.Type.RASTER) return null;
        if (a.name().equals(scene.cloudArtifact())) {
            return filterOrCopy(ctx, a, settings.minSizeClouds(), CLOUDS, shared);
        }
        if (a.name().equals(scene.shadowArtifact())) {
            return filterOrCopy(ctx, a, settings.minSizeShadows(), SHADOWS, shared);
        }
        return null;
    }

    private Artifact filterOrCopy(WorkerContext ctx, Artifact a, Double minSize, String kind,
                                  ExecutionTarget shared) throws Exception {
        if (minSize == null) {
            namespaces.copy(ctx.namespace(), a, sharedNamespace);
            return a;
        }
        String reason;
        try {
            StepResult r = steps.invoke(new StepRequest.AreaFilter(ctx.namespace(), a.name(), a.name(), minSize), shared);
            if (r.ok()) return a;
            reason = "exit status " + r.exitStatus();
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            reason = e.getMessage();
        }
        // 남는 영역이 없으면 면적 필터가 실패한다
        log.info("No {} larger than {} ha detected ({}). Image is considered {} free.",
                kind, minSize, reason, kind.equals(CLOUDS) ? "cloud" : "shadow");
        nullLayer(a.name(), shared);
        return a;
    }

    private void nullLayer(String name, ExecutionTarget shared) throws Exception {
        StepResult r = steps.invoke(new StepRequest.NullLayer(name), shared);
        if (!r.ok()) {
            throw new IllegalStateException("Could not create null layer <" + name + ">: " + r.diagnostics());
        }
    }
}
