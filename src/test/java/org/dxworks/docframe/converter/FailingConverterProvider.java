package org.dxworks.docframe.converter;

import java.util.List;

public class FailingConverterProvider implements ConverterProvider {

    @Override
    public List<ConverterMetadata> converters() {
        throw new IllegalStateException("plugin misconfigured");
    }
}
