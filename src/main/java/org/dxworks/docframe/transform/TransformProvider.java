package org.dxworks.docframe.transform;

import java.util.List;

/**
 * Plugin entry point for additional transforms, found with {@link java.util.ServiceLoader}.
 * List implementations in {@code META-INF/services/org.dxworks.docframe.transform.TransformProvider}.
 */
public interface TransformProvider {

    List<TransformMetadata> transforms();
}
