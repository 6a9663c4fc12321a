package net.sentiflow.bootstrap.runner;

import net.sentiflow.bootstrap.props.SentiflowProperties;
import net.sentiflow.core.maintenance.WorkspaceJanitor;
import net.sentiflow.core.model.Artifact;
import net.sentiflow.core.model.UnitFailure;
import net.sentiflow.core.service.ImportPipeline;
import net.sentiflow.core.service.ImportSettings;
import net.sentiflow.core.service.MaskJob;
import net.sentiflow.core.service.MaskPipeline;
import net.sentiflow.core.service.PipelineReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

/**
 * 기동 시 설정된 파이프라인을 한 번 실행한다.
 * 실행 전에 작업 공간을 정리하고, 보고서가 성공이 아니면 종료 코드 1.
 */
public class PipelineRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final ImportPipeline importPipeline;
    private final MaskPipeline maskPipeline;
    private final WorkspaceJanitor janitor;
    private final SentiflowProperties props;

    private volatile PipelineReport report;

    public PipelineRunner(ImportPipeline importPipeline,
                          MaskPipeline maskPipeline,
                          WorkspaceJanitor janitor,
                          SentiflowProperties props) {
        this.importPipeline = importPipeline;
        this.maskPipeline = maskPipeline;
        this.janitor = janitor;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (props.getMaintenance().isEnabled()) {
            var r = janitor.runOnce(props.getWorkspace().getWorkerPrefix(), props.getMaintenance().getFinishedTtl());
            log.info("[Sentiflow] maintenance: {}", r);
        }

        report = switch (props.getRunner().getPipeline()) {
            case IMPORT -> importPipeline.run(importSettings(props));
            case MASK -> maskPipeline.run(maskJob(props));
        };

        log.info("[Sentiflow] {}", report.summary());
        for (UnitFailure f : report.failures()) {
            log.error("[Sentiflow] failed {}: {}", f.subject(), f.reason());
        }
        for (String w : report.warnings()) {
            log.warn("[Sentiflow] {}", w);
        }
    }

    @Override
    public int getExitCode() {
        PipelineReport r = report;
        return r == null || r.successful() ? 0 : 1;
    }

    public PipelineReport report() { return report; }

    static ImportSettings importSettings(SentiflowProperties props) {
        var p = props.getImport();
        Artifact.Type cloudOutput = p.getCloudOutput() == null || p.getCloudOutput().isBlank()
                ? null : Artifact.Type.from(p.getCloudOutput());
        return new ImportSettings(
                p.getInputDir(),
                p.isSingleFolders(),
                p.getTempDir(),
                p.getWorkers(),
                p.getMemoryMb(),
                p.getBandPattern(),
                p.isResample(),
                p.isZeroToNull(),
                p.getExtent(),
                p.getRegion(),
                cloudOutput,
                p.isAtmosphericCorrection(),
                p.getSen2corHome(),
                p.getOffset(),
                p.getMetadataDir(),
                p.getDataset(),
                p.getCloudDataset(),
                p.getDrainTimeout());
    }

    static MaskJob maskJob(SentiflowProperties props) {
        var m = props.getMask();
        return new MaskJob(
                m.getInput(),
                m.getOutputClouds(),
                m.getOutputShadows(),
                m.getThreshold(),
                m.getMinSizeClouds(),
                m.getMinSizeShadows(),
                m.getWorkers(),
                m.getMemoryMb(),
                m.getDrainTimeout());
    }
}
