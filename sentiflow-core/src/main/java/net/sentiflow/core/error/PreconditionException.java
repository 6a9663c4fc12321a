package net.sentiflow.core.error;

/** 실행 전제 위반. 의미 있는 결과를 낼 수 없으므로 전체 실행을 중단한다. */
public class PreconditionException extends IllegalStateException {
    public PreconditionException(String message) { super(message); }
    public PreconditionException(String message, Throwable cause) { super(message, cause); }
}
