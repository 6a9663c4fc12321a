package net.sentiflow.bootstrap.props;

import net.sentiflow.core.service.ImportSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("sentiflow")
public class SentiflowProperties {
    private Workspace workspace = new Workspace();
    private Steps steps = new Steps();
    private Import importing = new Import();   // 'import' 는 예약어, 바인딩은 getter/setter 이름 기준
    private Mask mask = new Mask();
    private Runner runner = new Runner();
    private Maintenance maintenance = new Maintenance();

    public Workspace getWorkspace() {
        return workspace;
    }

    public void setWorkspace(Workspace workspace) {
        this.workspace = workspace;
    }

    public Steps getSteps() {
        return steps;
    }

    public void setSteps(Steps steps) {
        this.steps = steps;
    }

    public Import getImport() {
        return importing;
    }

    public void setImport(Import importing) {
        this.importing = importing;
    }

    public Mask getMask() {
        return mask;
    }

    public void setMask(Mask mask) {
        this.mask = mask;
    }

    public Runner getRunner() {
        return runner;
    }

    public void setRunner(Runner runner) {
        this.runner = runner;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(Maintenance maintenance) {
        this.maintenance = maintenance;
    }

    public enum Pipeline { IMPORT, MASK }

    public static class Workspace {
        private Path root = Path.of("workspace");
        private String sharedNamespace = "PERMANENT";
        private String workerPrefix = "sentiflow_w";
        private boolean semanticLabels = true;

        public Path getRoot() {
            return root;
        }

        public void setRoot(Path root) {
            this.root = root;
        }

        public String getSharedNamespace() {
            return sharedNamespace;
        }

        public void setSharedNamespace(String sharedNamespace) {
            this.sharedNamespace = sharedNamespace;
        }

        public String getWorkerPrefix() {
            return workerPrefix;
        }

        public void setWorkerPrefix(String workerPrefix) {
            this.workerPrefix = workerPrefix;
        }

        public boolean isSemanticLabels() {
            return semanticLabels;
        }

        public void setSemanticLabels(boolean semanticLabels) {
            this.semanticLabels = semanticLabels;
        }
    }

    public static class Steps {
        private Map<String, List<String>> commands = new LinkedHashMap<>(); // 스텝 이름 → 실행 명령 (예: mask: [/opt/sentiflow/bin/mask.sh])
        private Duration timeout; // null 이면 무제한

        public Map<String, List<String>> getCommands() {
            return commands;
        }

        public void setCommands(Map<String, List<String>> commands) {
            this.commands = commands;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Import {
        private Path inputDir;
        private boolean singleFolders = false;
        private Path tempDir;
        private int workers = 1;
        private long memoryMb = 300;
        private String bandPattern;
        private boolean resample = false;
        private boolean zeroToNull = false;
        private ImportSettings.Extent extent = ImportSettings.Extent.INPUT;
        private String region;
        private String cloudOutput; // vector | raster, 비우면 구름 마스크 없음
        private boolean atmosphericCorrection = false;
        private Path sen2corHome;
        private Integer offset;
        private Path metadataDir;
        private String dataset;
        private String cloudDataset;
        private Duration drainTimeout;

        public Path getInputDir() {
            return inputDir;
        }

        public void setInputDir(Path inputDir) {
            this.inputDir = inputDir;
        }

        public boolean isSingleFolders() {
            return singleFolders;
        }

        public void setSingleFolders(boolean singleFolders) {
            this.singleFolders = singleFolders;
        }

        public Path getTempDir() {
            return tempDir;
        }

        public void setTempDir(Path tempDir) {
            this.tempDir = tempDir;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public long getMemoryMb() {
            return memoryMb;
        }

        public void setMemoryMb(long memoryMb) {
            this.memoryMb = memoryMb;
        }

        public String getBandPattern() {
            return bandPattern;
        }

        public void setBandPattern(String bandPattern) {
            this.bandPattern = bandPattern;
        }

        public boolean isResample() {
            return resample;
        }

        public void setResample(boolean resample) {
            this.resample = resample;
        }

        public boolean isZeroToNull() {
            return zeroToNull;
        }

        public void setZeroToNull(boolean zeroToNull) {
            this.zeroToNull = zeroToNull;
        }

        public ImportSettings.Extent getExtent() {
            return extent;
        }

        public void setExtent(ImportSettings.Extent extent) {
            this.extent = extent;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getCloudOutput() {
            return cloudOutput;
        }

        public void setCloudOutput(String cloudOutput) {
            this.cloudOutput = cloudOutput;
        }

        public boolean isAtmosphericCorrection() {
            return atmosphericCorrection;
        }

        public void setAtmosphericCorrection(boolean atmosphericCorrection) {
            this.atmosphericCorrection = atmosphericCorrection;
        }

        public Path getSen2corHome() {
            return sen2corHome;
        }

        public void setSen2corHome(Path sen2corHome) {
            this.sen2corHome = sen2corHome;
        }

        public Integer getOffset() {
            return offset;
        }

        public void setOffset(Integer offset) {
            this.offset = offset;
        }

        public Path getMetadataDir() {
            return metadataDir;
        }

        public void setMetadataDir(Path metadataDir) {
            this.metadataDir = metadataDir;
        }

        public String getDataset() {
            return dataset;
        }

        public void setDataset(String dataset) {
            this.dataset = dataset;
        }

        public String getCloudDataset() {
            return cloudDataset;
        }

        public void setCloudDataset(String cloudDataset) {
            this.cloudDataset = cloudDataset;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Mask {
        private String input;
        private String outputClouds;
        private String outputShadows;
        private double threshold = 0;
        private Double minSizeClouds;
        private Double minSizeShadows;
        private int workers = 1;
        private long memoryMb = 300;
        private Path metadataDir;
        private Duration drainTimeout;

        public String getInput() {
            return input;
        }

        public void setInput(String input) {
            this.input = input;
        }

        public String getOutputClouds() {
            return outputClouds;
        }

        public void setOutputClouds(String outputClouds) {
            this.outputClouds = outputClouds;
        }

        public String getOutputShadows() {
            return outputShadows;
        }

        public void setOutputShadows(String outputShadows) {
            this.outputShadows = outputShadows;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public Double getMinSizeClouds() {
            return minSizeClouds;
        }

        public void setMinSizeClouds(Double minSizeClouds) {
            this.minSizeClouds = minSizeClouds;
        }

        public Double getMinSizeShadows() {
            return minSizeShadows;
        }

        public void setMinSizeShadows(Double minSizeShadows) {
            this.minSizeShadows = minSizeShadows;
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public long getMemoryMb() {
            return memoryMb;
        }

        public void setMemoryMb(long memoryMb) {
            this.memoryMb = memoryMb;
        }

        public Path getMetadataDir() {
            return metadataDir;
        }

        public void setMetadataDir(Path metadataDir) {
            this.metadataDir = metadataDir;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Runner {
        private boolean enabled = false;
        private Pipeline pipeline = Pipeline.IMPORT;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Pipeline getPipeline() {
            return pipeline;
        }

        public void setPipeline(Pipeline pipeline) {
            this.pipeline = pipeline;
        }
    }

    public static class Maintenance {
        private boolean enabled = true;
        private Duration finishedTtl = Duration.ofDays(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getFinishedTtl() {
            return finishedTtl;
        }

        public void setFinishedTtl(Duration finishedTtl) {
            this.finishedTtl = finishedTtl;
        }
    }
}
