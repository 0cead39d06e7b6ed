package org.dxworks.docframe.converter;

import java.io.IOException;

/**
 * Decides whether content belongs to a format by inspecting bounded structure,
 * for example the entry list of an archive. Implementations must not decode
 * the whole input.
 */
@FunctionalInterface
public interface ContentDetector {

    boolean matches(DetectionContext context) throws IOException;
}
