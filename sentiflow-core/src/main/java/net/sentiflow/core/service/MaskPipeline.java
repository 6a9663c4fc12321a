package net.sentiflow.core.service;

import net.sentiflow.core.error.PreconditionException;
import net.sentiflow.core.model.Allocation;
import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.BatchRun;
import net.sentiflow.core.model.MaskState;
import net.sentiflow.core.model.RegisterEntry;
import net.sentiflow.core.model.SceneMask;
import net.sentiflow.core.model.StepRequest;
import net.sentiflow.core.spi.Clock;
import net.sentiflow.core.spi.HostProbe;
import net.sentiflow.core.spi.NamespaceStore;
import net.sentiflow.core.spi.StepRunner;
import net.sentiflow.core.spi.TemporalDatasetStore;
import net.sentiflow.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** 밴드 데이터셋에서 장면별 구름(그림자) 마스크를 만들고 데이터셋으로 등록한다. */
public final class MaskPipeline {
    private static final Logger log = LoggerFactory.getLogger(MaskPipeline.class);

    private final NamespaceStore namespaces;
    private final StepRunner steps;
    private final TemporalDatasetStore datasets;
    private final HostProbe host;
    private final RunLedger ledger;
    private final TxRunner tx;
    private final Clock clock;
    private final MaskMergeEngine engine;
    private final String workerPrefix;

    public MaskPipeline(NamespaceStore namespaces,
                        StepRunner steps,
                        TemporalDatasetStore datasets,
                        HostProbe host,
                        RunLedger ledger,
                        TxRunner tx,
                        Clock clock,
                        MaskMergeEngine engine,
                        String workerPrefix) {
        this.namespaces = namespaces;
        this.steps = steps;
        this.datasets = datasets;
        this.host = host;
        this.ledger = ledger;
        this.tx = tx;
        this.clock = clock;
        this.engine = engine;
        this.workerPrefix = workerPrefix;
    }

    public PipelineReport run(MaskJob job) throws Exception {
        MaskSettings settings = job.settings();
        requireStep(StepRequest.MASK);
        requireStep(StepRequest.NULL_LAYER);
        requireStep(StepRequest.PATCH);
        if (job.minSizeClouds() != null || job.minSizeShadows() != null) requireStep(StepRequest.AREA_FILTER);

        List<RegisterEntry> inputs = tx.required(() -> {
            if (!datasets.exists(job.input())) {
                throw new PreconditionException("Temporal dataset <" + job.input() + "> not found");
            }
            return datasets.list(job.input());
        });

        List<SceneMask> plan = engine.plan(inputs, settings);
        int pending = (int) plan.stream().filter(s -> s.state() == MaskState.COMPUTED).count();
        Allocation alloc = ResourceBudget.compute(job.workers(), job.memoryMb(), pending,
                host.probe(), ResourceBudget.CpuPolicy.WARN);
        PoolConfig pool = new PoolConfig(alloc.poolSize(), alloc.perWorkerMemoryMb(), workerPrefix,
                job.drainTimeout(), null);

        RunLedger.Session session = ledger.open(BatchRun.Kind.MASK, "mask:" + job.input() + ":" + clock.now(),
                pool.concurrency(), alloc.effectiveMemoryMb());
        try (CleanupRegistry cleanup = new CleanupRegistry(namespaces)) {
            for (SceneMask s : plan) {
                if (s.state() == MaskState.SKIPPED) {
                    session.skipped(s.scene().id(), s.scene().id(), StepRequest.MASK, "below cloud threshold");
                }
            }
            log.info("Find clouds (and shadows) in {} Sentinel scene(s) ...", pending);
            MaskOutcome outcome = engine.execute(plan, settings, pool, cleanup, session);

            List<String> created = new ArrayList<>();
            log.info("Create temporal dataset of clouds ...");
            tx.required(() -> {
                datasets.create(job.outputClouds(), Artifact.Type.RASTER, "Sentinel-2 cloud mask", "Sentinel-2 cloud mask");
                datasets.register(job.outputClouds(), outcome.clouds());
                return null;
            });
            created.add(job.outputClouds());
            if (job.outputShadows() != null) {
                log.info("Create temporal dataset of shadows ...");
                tx.required(() -> {
                    datasets.create(job.outputShadows(), Artifact.Type.RASTER,
                            "Sentinel-2 shadow mask", "Sentinel-2 shadow mask");
                    datasets.register(job.outputShadows(), outcome.shadows());
                    return null;
                });
                created.add(job.outputShadows());
            }

            List<String> artifacts = new ArrayList<>();
            outcome.clouds().forEach(e -> artifacts.add(e.artifact()));
            outcome.shadows().forEach(e -> artifacts.add(e.artifact()));
            PipelineReport report = new PipelineReport("mask", session.batchRunId(), created, artifacts,
                    outcome.failures(), outcome.skipped(), alloc.warnings(), outcome.pool().cancelled());
            session.finish(report);
            log.info("{}", report.summary());
            return report;
        } catch (Exception e) {
            session.abort(e);
            throw e;
        }
    }

    private void requireStep(String step) {
        if (!steps.available(step)) {
            throw new PreconditionException("The processing step '" + step + "' is not available, configure it first");
        }
    }
}
