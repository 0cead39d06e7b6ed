package org.dxworks.docframe.pipeline;

/**
 * Stages of a conversion where {@link DocumentHook}s run.
 */
public enum HookPoint {
    /** Right after the input was parsed. */
    POST_AST,
    /** Before each transform; {@link HookContext#getTransformName()} names it. */
    PRE_TRANSFORM,
    /** After each transform. */
    POST_TRANSFORM,
    /** After all transforms, before element hooks and rendering. */
    PRE_RENDER
}
