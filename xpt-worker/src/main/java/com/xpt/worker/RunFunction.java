package com.xpt.worker;

/**
 * User computation for one run. Reads parameters and adds results through the scope.
 */
@FunctionalInterface
public interface RunFunction {

    void run(RunScope scope) throws Exception;
}
