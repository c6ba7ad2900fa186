package org.losp.runtime.spi;

/**
 * A read-only tap on the virtual machine's dispatch loop. When installed, it is
 * notified before every instruction executes. Observers must not influence
 * execution.
 */
@FunctionalInterface
public interface IExecutionObserver {

    /**
     * Called before the described instruction executes.
     * @param event The instruction about to execute and the machine state it will see.
     */
    void beforeInstruction(TraceEvent event);
}
