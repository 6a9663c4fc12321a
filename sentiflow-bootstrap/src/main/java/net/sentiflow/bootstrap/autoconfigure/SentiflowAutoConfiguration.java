package net.sentiflow.bootstrap.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.sentiflow.adapter.local.fs.FileSystemNamespaceStore;
import net.sentiflow.adapter.local.fs.LocalSceneSource;
import net.sentiflow.adapter.local.host.SystemHostProbe;
import net.sentiflow.adapter.local.metadata.JsonMetadataStore;
import net.sentiflow.adapter.local.process.ProcessStepRunner;
import net.sentiflow.bootstrap.props.SentiflowProperties;
import net.sentiflow.bootstrap.runner.PipelineRunner;
import net.sentiflow.core.maintenance.WorkspaceJanitor;
import net.sentiflow.core.service.ImportPipeline;
import net.sentiflow.core.service.MaskMergeEngine;
import net.sentiflow.core.service.MaskPipeline;
import net.sentiflow.core.service.RepositoryRunLedger;
import net.sentiflow.core.service.RunLedger;
import net.sentiflow.core.service.TemporalIndexer;
import net.sentiflow.core.spi.*;
import net.sentiflow.integration.spring.SentiflowSpringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@AutoConfiguration
@EnableConfigurationProperties(SentiflowProperties.class)
@Import(SentiflowSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class SentiflowAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SentiflowAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공: 로컬 호스트 ---

    @Bean
    @ConditionalOnMissingBean
    public NamespaceStore namespaceStore(SentiflowProperties props) throws IOException {
        var ws = props.getWorkspace();
        return new FileSystemNamespaceStore(ws.getRoot(), ws.getSharedNamespace());
    }

    @Bean
    @ConditionalOnMissingBean
    public StepRunner stepRunner(SentiflowProperties props) {
        var steps = props.getSteps();
        var runner = new ProcessStepRunner(steps.getCommands(), props.getWorkspace().getRoot(), steps.getTimeout());
        List<String> unresolved = runner.unresolvedSteps();
        if (!unresolved.isEmpty()) {
            log.warn("Step commands not executable: {}", unresolved);
        }
        return runner;
    }

    @Bean
    @ConditionalOnMissingBean
    public MetadataStore metadataStore(SentiflowProperties props, ObjectProvider<ObjectMapper> om) {
        return new JsonMetadataStore(metadataDir(props), om.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public SceneSource sceneSource() {
        return new LocalSceneSource();
    }

    @Bean
    @ConditionalOnMissingBean
    public HostProbe hostProbe() {
        return new SystemHostProbe();
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public RunLedger runLedger(BatchRunRepository batchRuns, UnitRunRepository unitRuns, TxRunner tx) {
        return new RepositoryRunLedger(batchRuns, unitRuns, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public TemporalIndexer temporalIndexer(SentiflowProperties props) {
        return new TemporalIndexer(props.getWorkspace().isSemanticLabels());
    }

    @Bean
    @ConditionalOnMissingBean
    public ImportPipeline importPipeline(NamespaceStore namespaces,
                                         StepRunner steps,
                                         SceneSource scenes,
                                         TemporalDatasetStore datasets,
                                         HostProbe host,
                                         RunLedger ledger,
                                         TxRunner tx,
                                         Clock clock,
                                         TemporalIndexer indexer,
                                         SentiflowProperties props) {
        var ws = props.getWorkspace();
        return new ImportPipeline(namespaces, steps, scenes, datasets, host, ledger, tx, clock, indexer,
                ws.getSharedNamespace(), ws.getWorkerPrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public MaskMergeEngine maskMergeEngine(NamespaceStore namespaces,
                                           StepRunner steps,
                                           MetadataStore metadata,
                                           SentiflowProperties props) {
        return new MaskMergeEngine(namespaces, steps, metadata, props.getWorkspace().getSharedNamespace());
    }

    @Bean
    @ConditionalOnMissingBean
    public MaskPipeline maskPipeline(NamespaceStore namespaces,
                                     StepRunner steps,
                                     TemporalDatasetStore datasets,
                                     HostProbe host,
                                     RunLedger ledger,
                                     TxRunner tx,
                                     Clock clock,
                                     MaskMergeEngine engine,
                                     SentiflowProperties props) {
        return new MaskPipeline(namespaces, steps, datasets, host, ledger, tx, clock, engine,
                props.getWorkspace().getWorkerPrefix());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkspaceJanitor workspaceJanitor(NamespaceStore namespaces,
                                             BatchRunRepository batchRuns,
                                             TxRunner tx,
                                             Clock clock) {
        return new WorkspaceJanitor(namespaces, batchRuns, tx, clock);
    }

    // --- 실행기 (프로퍼티로 켬) ---

    @Bean
    @ConditionalOnProperty(prefix = "sentiflow.runner", name = "enabled", havingValue = "true")
    public PipelineRunner pipelineRunner(ImportPipeline importPipeline,
                                         MaskPipeline maskPipeline,
                                         WorkspaceJanitor janitor,
                                         SentiflowProperties props) {
        log.info("[Sentiflow] pipeline runner enabled: pipeline={}", props.getRunner().getPipeline());
        return new PipelineRunner(importPipeline, maskPipeline, janitor, props);
    }

    /** 마스크 → import → 작업 공간 기본값 순으로 메타데이터 위치를 고른다 */
    static Path metadataDir(SentiflowProperties props) {
        if (props.getMask().getMetadataDir() != null) return props.getMask().getMetadataDir();
        if (props.getImport().getMetadataDir() != null) return props.getImport().getMetadataDir();
        return props.getWorkspace().getRoot().resolve("metadata");
    }
}
