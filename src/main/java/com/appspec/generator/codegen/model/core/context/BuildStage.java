package com.appspec.generator.codegen.model.core.context;

/**
 * States a build run moves through. {@link #FAILED} is reachable from every stage before
 * {@link #DONE}.
 */
public enum BuildStage {
    INIT,
    RESOLVE_ORDER,
    PRE_BUILD,
    GENERATE,
    POST_BUILD,
    DONE,
    FAILED
}
