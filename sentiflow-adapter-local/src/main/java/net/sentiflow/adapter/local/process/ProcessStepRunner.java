package net.sentiflow.adapter.local.process;

import net.sentiflow.core.model.ExecutionTarget;
import net.sentiflow.core.model.StepRequest;
import net.sentiflow.core.model.StepResult;
import net.sentiflow.core.spi.StepRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 스텝마다 설정된 외부 실행 파일을 띄운다.
 * <p>
 * 인자는 {@code key=value} 형식으로 요청에서 만든다 ({@link StepArguments}).
 * 실행 대상은 환경 변수로 넘긴다. 프로세스마다 환경 사본을 따로 가진다.
 * 출력 중 {@code produced=<name>} 줄은 산출물 이름으로 모은다.
 */
public final class ProcessStepRunner implements StepRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessStepRunner.class);

    public static final String ENV_WORKSPACE = "SENTIFLOW_WORKSPACE";
    public static final String ENV_NAMESPACE = "SENTIFLOW_NAMESPACE";
    public static final String ENV_SHARED_NAMESPACE = "SENTIFLOW_SHARED_NAMESPACE";
    public static final String ENV_MEMORY_MB = "SENTIFLOW_MEMORY_MB";
    public static final String ENV_SESSION = "SENTIFLOW_SESSION";
    public static final String PRODUCED_PREFIX = "produced=";

    private static final int DIAGNOSTIC_LINES = 20;
    private static final Duration DESTROY_GRACE = Duration.ofSeconds(5);

    private final Map<String, List<String>> commands;
    private final Path workspace;
    private final Duration stepTimeout;     // null 이면 무제한

    public ProcessStepRunner(Map<String, List<String>> commands, Path workspace, Duration stepTimeout) {
        this.commands = Map.copyOf(commands);
        this.workspace = workspace;
        this.stepTimeout = stepTimeout;
    }

    @Override
    public boolean available(String stepName) {
        List<String> cmd = commands.get(stepName);
        if (cmd == null || cmd.isEmpty()) return false;
        return resolvable(cmd.get(0));
    }

    @Override
    public StepResult invoke(StepRequest request, ExecutionTarget target) throws Exception {
        List<String> cmd = commands.get(request.stepName());
        if (cmd == null || cmd.isEmpty()) {
            throw new IllegalStateException("No command configured for step '" + request.stepName() + "'");
        }
        List<String> argv = new ArrayList<>(cmd);
        argv.addAll(StepArguments.of(request));

        ProcessBuilder pb = new ProcessBuilder(argv);
        Map<String, String> env = pb.environment();
        env.put(ENV_WORKSPACE, workspace.toString());
        env.put(ENV_NAMESPACE, target.namespace());
        env.put(ENV_SHARED_NAMESPACE, target.sharedNamespace());
        env.put(ENV_MEMORY_MB, Long.toString(target.memoryMb()));
        if (target.configHandle() != null) env.put(ENV_SESSION, target.configHandle().toString());
        else env.remove(ENV_SESSION);

        Path output = Files.createTempFile("sentiflow-step-", ".log");
        try {
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());
            log.debug("Running {} in <{}>: {}", request.stepName(), target.namespace(), argv);
            Process p = pb.start();
            int exit;
            try {
                if (stepTimeout == null) {
                    exit = p.waitFor();
                } else if (p.waitFor(stepTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    exit = p.exitValue();
                } else {
                    stop(p);
                    return StepResult.failure(-1, request.stepName() + " timed out after " + stepTimeout);
                }
            } catch (InterruptedException e) {
                stop(p);
                throw e;
            }
            List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
            if (exit != 0) {
                return StepResult.failure(exit, tail(lines));
            }
            List<String> produced = lines.stream()
                    .filter(l -> l.startsWith(PRODUCED_PREFIX))
                    .map(l -> l.substring(PRODUCED_PREFIX.length()).trim())
                    .toList();
            return StepResult.success(produced);
        } finally {
            Files.deleteIfExists(output);
        }
    }

    private static void stop(Process p) {
        p.destroy();
        try {
            if (!p.waitFor(DESTROY_GRACE.toMillis(), TimeUnit.MILLISECONDS)) p.destroyForcibly();
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private static String tail(List<String> lines) {
        int from = Math.max(0, lines.size() - DIAGNOSTIC_LINES);
        return String.join("\n", lines.subList(from, lines.size()));
    }

    static boolean resolvable(String executable) {
        if (executable.contains(File.separator)) return Files.isExecutable(Path.of(executable));
        String path = System.getenv("PATH");
        if (path == null) return false;
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            if (Files.isExecutable(Path.of(dir, executable))) return true;
        }
        return false;
    }

    /** 설정 오류를 일찍 보기 위한 점검 (실행 파일 경로가 잘못된 스텝 이름) */
    public List<String> unresolvedSteps() {
        return commands.entrySet().stream()
                .filter(e -> e.getValue().isEmpty() || !resolvable(e.getValue().get(0)))
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
