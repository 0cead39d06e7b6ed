package org.dxworks.docframe.ast;

import java.util.Locale;

/** Horizontal alignment of a table column or cell. */
public enum Alignment {
    LEFT, CENTER, RIGHT;

    public String externalName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Alignment fromExternalName(String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
