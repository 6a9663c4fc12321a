package net.sentiflow.core.model;

/** 실행이 끝나 reconcile 을 기다리는 유닛 */
public record CompletedUnit(WorkUnit unit, WorkerContext context, StepResult result) {}
