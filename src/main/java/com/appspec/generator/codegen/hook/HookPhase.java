package com.appspec.generator.codegen.hook;

public enum HookPhase {
    /** Before any generator; environment and precondition checks. */
    PRE_BUILD,
    /** After every generator succeeded; side effects outside the file tree. */
    POST_BUILD
}
