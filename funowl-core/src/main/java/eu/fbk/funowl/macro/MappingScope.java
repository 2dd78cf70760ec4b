package eu.fbk.funowl.macro;

import java.util.Locale;

import eu.fbk.funowl.data.Reference;

/**
 * The scope of a semantic mapping, determining the SKOS mapping property used to assert it.
 */
public enum MappingScope {

    EXACT("exactMatch"),

    BROAD("broadMatch"),

    NARROW("narrowMatch"),

    CLOSE("closeMatch"),

    RELATED("relatedMatch");

    private final Reference property;

    private MappingScope(final String localName) {
        this.property = Reference.create("skos", localName);
    }

    public Reference getProperty() {
        return this.property;
    }

    public static MappingScope forName(final String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

}
