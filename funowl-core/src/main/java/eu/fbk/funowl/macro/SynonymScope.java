package eu.fbk.funowl.macro;

import java.util.Locale;

import eu.fbk.funowl.data.Reference;
import eu.fbk.funowl.vocabulary.OBOINOWL;

/**
 * The scope of an OBO synonym, determining the oboInOwl annotation property used to assert it.
 */
public enum SynonymScope {

    EXACT(OBOINOWL.HAS_EXACT_SYNONYM),

    BROAD(OBOINOWL.HAS_BROAD_SYNONYM),

    NARROW(OBOINOWL.HAS_NARROW_SYNONYM),

    RELATED(OBOINOWL.HAS_RELATED_SYNONYM);

    private final Reference property;

    private SynonymScope(final Reference property) {
        this.property = property;
    }

    public Reference getProperty() {
        return this.property;
    }

    /**
     * Returns the scope with the name specified, ignoring case.
     *
     * @param name
     *            the scope name, e.g., "exact"
     * @return the corresponding scope
     * @throws IllegalArgumentException
     *             if no scope has that name
     */
    public static SynonymScope forName(final String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

}
