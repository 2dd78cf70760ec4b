package eu.fbk.funowl.data;

/**
 * An object that is identified by a namespaced {@link Reference}.
 */
public interface Referenced {

    /**
     * Returns the reference identifying this object. Any display name carried by the returned
     * reference is not significant for identity.
     *
     * @return the reference, not null
     */
    Reference getReference();

}
