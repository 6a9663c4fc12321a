package net.sentiflow.core.service;

import net.sentiflow.core.error.PreconditionException;
import net.sentiflow.core.model.Allocation;
import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.BatchRun;
import net.sentiflow.core.model.ExecutionTarget;
import net.sentiflow.core.model.LayerClass;
import net.sentiflow.core.model.PoolReport;
import net.sentiflow.core.model.RegisterEntry;
import net.sentiflow.core.model.SceneInput;
import net.sentiflow.core.model.StepRequest;
import net.sentiflow.core.model.StepResult;
import net.sentiflow.core.model.UnitFailure;
import net.sentiflow.core.model.WorkUnit;
import net.sentiflow.core.spi.Clock;
import net.sentiflow.core.spi.HostProbe;
import net.sentiflow.core.spi.NamespaceStore;
import net.sentiflow.core.spi.SceneSource;
import net.sentiflow.core.spi.StepRunner;
import net.sentiflow.core.spi.TemporalDatasetStore;
import net.sentiflow.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 장면 import 파이프라인.
 * (대기보정) → 격리 import → 결과 이동 → (offset) → 밴드/구름 데이터셋 등록 → 밴드별 하위 데이터셋
 */
public final class ImportPipeline {
    private static final Logger log = LoggerFactory.getLogger(ImportPipeline.class);

    private final NamespaceStore namespaces;
    private final StepRunner steps;
    private final SceneSource scenes;
    private final TemporalDatasetStore datasets;
    private final HostProbe host;
    private final RunLedger ledger;
    private final TxRunner tx;
    private final Clock clock;
    private final TemporalIndexer indexer;
    private final String sharedNamespace;
    private final String workerPrefix;

    public ImportPipeline(NamespaceStore namespaces,
                          StepRunner steps,
                          SceneSource scenes,
                          TemporalDatasetStore datasets,
                          HostProbe host,
                          RunLedger ledger,
                          TxRunner tx,
                          Clock clock,
                          TemporalIndexer indexer,
                          String sharedNamespace,
                          String workerPrefix) {
        this.namespaces = namespaces;
        this.steps = steps;
        this.scenes = scenes;
        this.datasets = datasets;
        this.host = host;
        this.ledger = ledger;
        this.tx = tx;
        this.clock = clock;
        this.indexer = indexer;
        this.sharedNamespace = sharedNamespace;
        this.workerPrefix = workerPrefix;
    }

    public PipelineReport run(ImportSettings s) throws Exception {
        requireStep(StepRequest.SCENE_IMPORT);
        if (s.atmosphericCorrection()) requireStep(StepRequest.ATMOSPHERIC_CORRECTION);
        if (s.offset() != null) requireStep(StepRequest.OFFSET);

        List<SceneInput> inputs = scenes.scan(s.inputDir(), s.singleFolders());
        if (inputs.isEmpty()) {
            throw new PreconditionException("No Sentinel-2 scenes found in " + s.inputDir());
        }
        Allocation alloc = ResourceBudget.compute(s.workers(), s.memoryMb(), inputs.size(),
                host.probe(), ResourceBudget.CpuPolicy.CLAMP);
        PoolConfig pool = new PoolConfig(alloc.poolSize(), alloc.perWorkerMemoryMb(), workerPrefix,
                s.drainTimeout(), null);

        RunLedger.Session session = ledger.open(BatchRun.Kind.IMPORT, "import:" + clock.now(),
                pool.concurrency(), alloc.effectiveMemoryMb());
        List<UnitFailure> failures = new ArrayList<>();
        boolean cancelled = false;
        try (CleanupRegistry cleanup = new CleanupRegistry(namespaces)) {
            if (s.atmosphericCorrection()) {
                Path tmp = s.tempDir();
                if (tmp == null) {
                    tmp = Files.createTempDirectory("sentiflow");
                    cleanup.path(tmp);
                }
                Path sen2cor = tmp.resolve("sen2cor_" + ProcessHandle.current().pid());
                Files.createDirectories(sen2cor);
                cleanup.path(sen2cor);
                PoolReport corrected = correct(inputs, sen2cor, s, pool, session);
                failures.addAll(corrected.failures());
                cancelled |= corrected.cancelled();
                inputs = scenes.scan(sen2cor, true);
            }

            log.info("Importing {} Sentinel scene(s) ...", inputs.size());
            ResultReconciler reconciler = new ResultReconciler(namespaces, sharedNamespace);
            PoolReport imported = runPool(pool, session, importUnits(inputs, s));
            failures.addAll(imported.failures());
            cancelled |= imported.cancelled();
            Map<String, List<Artifact>> moved = reconciler.reconcileAll(imported.completed(), reconciler.copy());

            List<String> all = new ArrayList<>();
            // 같은 이름의 래스터와 벡터가 함께 있을 수 있다
            Map<String, List<Artifact>> byName = new LinkedHashMap<>();
            for (List<Artifact> artifacts : moved.values()) {
                for (Artifact a : artifacts) {
                    all.add(a.name());
                    byName.computeIfAbsent(a.name(), k -> new ArrayList<>()).add(a);
                }
            }
            List<String> bands = new ArrayList<>();
            List<Artifact> masks = new ArrayList<>();
            for (var part : indexer.partition(byName.keySet()).entrySet()) {
                for (String name : part.getValue()) {
                    for (Artifact a : byName.get(name)) {
                        if (part.getKey().layerClass() == LayerClass.BAND && a.type() == Artifact.Type.RASTER) {
                            if (!bands.contains(name)) bands.add(name);
                        } else {
                            masks.add(a);
                        }
                    }
                }
            }
            if (s.offset() != null) applyOffset(bands, s.offset(), pool.memoryMb());

            List<String> created = new ArrayList<>();
            List<String> warnings = new ArrayList<>(alloc.warnings());
            if (s.dataset() != null) register(s, bands, masks, created, warnings);

            PipelineReport report = new PipelineReport("import", session.batchRunId(), created, all, failures,
                    0, warnings, cancelled);
            session.finish(report);
            log.info("{}", report.summary());
            return report;
        } catch (Exception e) {
            session.abort(e);
            throw e;
        }
    }

    private PoolReport correct(List<SceneInput> inputs, Path sen2cor, ImportSettings s,
                               PoolConfig pool, RunLedger.Session session) throws Exception {
        log.info("Starting atmospheric correction with sen2cor ...");
        List<WorkUnit> units = new ArrayList<>();
        int idx = 0;
        for (SceneInput in : inputs) {
            if (!in.hasSafeProduct()) {
                log.warn("{} has no .SAFE product, skipping atmospheric correction", in.location());
                continue;
            }
            int n = idx++;
            Path out = sen2cor.resolve("sen2cor_result_" + n);
            Files.createDirectories(out);
            units.add(WorkUnit.of("sen2cor_" + n, in.id(),
                    new StepRequest.AtmosphericCorrection(in.product(), out, s.sen2corHome())));
        }
        ResultReconciler reconciler = new ResultReconciler(namespaces, sharedNamespace);
        PoolReport report = runPool(pool, session, units);
        // 대기보정은 파일만 남기고 네임스페이스에는 쓰지 않는다
        reconciler.reconcileAll(report.completed(), reconciler.copy());
        return report;
    }

    private List<WorkUnit> importUnits(List<SceneInput> inputs, ImportSettings s) {
        StepRequest.ImportMode mode = StepRequest.ImportMode.of(s.resample(), s.cloudOutput());
        String region = s.extent() == ImportSettings.Extent.REGION ? s.region() : null;
        List<WorkUnit> units = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        int idx = 0;
        for (SceneInput in : inputs) {
            if (!ids.add(in.id())) {
                log.warn("Scene {} is listed twice ({}), importing it once", in.id(), in.location());
                continue;
            }
            units.add(WorkUnit.of("import_" + (++idx), in.id(), new StepRequest.SceneImport(
                    in.location(), in.patternFile(), s.bandPattern(), region, s.metadataDir(), s.zeroToNull(), mode)));
        }
        return units;
    }

    private PoolReport runPool(PoolConfig config, PoolListener listener, List<WorkUnit> units) throws Exception {
        try (IsolatedWorkerPool pool = new IsolatedWorkerPool(namespaces, steps, sharedNamespace, config, listener)) {
            pool.submitAll(units);
            return pool.awaitAll();
        }
    }

    private void applyOffset(List<String> bands, int offset, long memoryMb) throws Exception {
        ExecutionTarget shared = ExecutionTarget.shared(sharedNamespace, memoryMb);
        for (String band : bands) {
            StepResult r = steps.invoke(new StepRequest.OffsetAdjust(band, offset), shared);
            if (!r.ok()) {
                throw new IllegalStateException("Offset adjustment of <" + band + "> failed: " + r.diagnostics());
            }
        }
        log.info("Applied offset {} to {} band(s)", offset, bands.size());
    }

    private void register(ImportSettings s, List<String> bands, List<Artifact> masks,
                          List<String> created, List<String> warnings) throws Exception {
        log.info("Creating temporal dataset <{}> of Sentinel scenes ...", s.dataset());
        List<RegisterEntry> bandEntries = indexer.entries(bands);
        tx.required(() -> {
            datasets.create(s.dataset(), Artifact.Type.RASTER, "Sentinel-2", "Sentinel-2");
            datasets.register(s.dataset(), bandEntries);
            return null;
        });
        created.add(s.dataset());

        if (s.cloudOutput() != null) {
            String clouds = s.cloudDatasetName();
            // 데이터셋 하나에는 한 종류의 레이어만
            List<String> cloudNames = new ArrayList<>();
            for (Artifact m : masks) {
                if (m.type() == s.cloudOutput()) {
                    cloudNames.add(m.name());
                    continue;
                }
                String w = String.format("%s is a %s layer, not registered in %s dataset <%s>",
                        m.name(), m.type().element(), s.cloudOutput().element(), clouds);
                log.warn(w);
                warnings.add(w);
            }
            List<RegisterEntry> cloudEntries = indexer.plainEntries(cloudNames);
            tx.required(() -> {
                datasets.create(clouds, s.cloudOutput(), "Sentinel-2_sen2cor_clouds", "Sentinel-2_sen2cor_clouds");
                datasets.register(clouds, cloudEntries);
                return null;
            });
            created.add(clouds);
            log.info("<{}> is created", clouds);
        }

        for (String band : TemporalIndexer.bandTokens(s.bandPattern(), s.resample())) {
            String out = s.dataset() + "_" + band;
            int n = tx.required(() -> datasets.extract(s.dataset(), band, out));
            created.add(out);
            log.info("<{}> is created with {} entries", out, n);
        }
    }

    private void requireStep(String step) {
        if (!steps.available(step)) {
            throw new PreconditionException("The processing step '" + step + "' is not available, configure it first");
        }
    }
}
