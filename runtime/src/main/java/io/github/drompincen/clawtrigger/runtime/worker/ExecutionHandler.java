package io.github.drompincen.clawtrigger.runtime.worker;

public interface ExecutionHandler {

    ExecutionOutcome execute(ExecutionContext context) throws Exception;
}
