package net.sentiflow.core.error;

/** 워커가 격리를 벗어나 공유 네임스페이스를 건드렸다. 재시도 대상이 아니다. */
public class IsolationViolationException extends IllegalStateException {
    public IsolationViolationException(String message) { super(message); }
}
