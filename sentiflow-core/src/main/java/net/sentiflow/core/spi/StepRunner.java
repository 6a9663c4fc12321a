package net.sentiflow.core.spi;

import net.sentiflow.core.model.ExecutionTarget;
import net.sentiflow.core.model.StepRequest;
import net.sentiflow.core.model.StepResult;

/** 불투명한 외부 처리 스텝 실행기 */
public interface StepRunner {

    /** 해당 스텝을 실행할 수 있는지 (설치/설정 여부) */
    boolean available(String stepName);

    /**
     * 요청을 target 네임스페이스에서 실행한다.
     * 실패는 non-zero exit 로 돌려주거나 예외로 던진다. 인터럽트되면 실행 중인 스텝을 중단한다.
     */
    StepResult invoke(StepRequest request, ExecutionTarget target) throws Exception;
}
