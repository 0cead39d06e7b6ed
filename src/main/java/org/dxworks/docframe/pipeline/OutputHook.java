package org.dxworks.docframe.pipeline;

/**
 * Rewrites the rendered text after rendering. Only text renderers support output hooks.
 */
@FunctionalInterface
public interface OutputHook {

    String apply(String output, HookContext context);
}
