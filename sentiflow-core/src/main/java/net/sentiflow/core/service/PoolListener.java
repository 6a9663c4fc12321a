package net.sentiflow.core.service;

import net.sentiflow.core.model.StepResult;
import net.sentiflow.core.model.WorkUnit;
import net.sentiflow.core.model.WorkerContext;

/** 풀 내부 유닛 상태 변화 통지. 구현은 스레드 안전해야 한다. */
public interface PoolListener {
    PoolListener NONE = new PoolListener() {};

    default void onStart(WorkUnit unit, WorkerContext context) throws Exception {}
    default void onSuccess(WorkUnit unit, WorkerContext context, StepResult result) throws Exception {}
    default void onFailure(WorkUnit unit, String reason) throws Exception {}
    default void onCancelled(WorkUnit unit) throws Exception {}
}
