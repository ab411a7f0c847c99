/**
 *
 */
package org.theseed.rba;

/**
 * This exception is thrown when the gene associations needed to compute enzyme
 * compositions are missing, according to the annotation policy in effect.
 */
public class MissingAnnotationException extends RbaBuildException {

    /** serialization version ID */
    private static final long serialVersionUID = -1208863617421546690L;

    public MissingAnnotationException(String message) {
        super(message);
    }

}
