package org.dxworks.docframe.pipeline;

import org.dxworks.docframe.ast.Document;

/**
 * Sees the whole document at one {@link HookPoint}. Returns the document to continue with;
 * returning null is an error.
 */
@FunctionalInterface
public interface DocumentHook {

    Document apply(Document document, HookContext context);
}
