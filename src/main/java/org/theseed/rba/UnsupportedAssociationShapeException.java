/**
 *
 */
package org.theseed.rba;

/**
 * This exception is thrown when a gene association uses something other than genes,
 * ANDs, and ORs, or when a text association cannot be parsed.
 */
public class UnsupportedAssociationShapeException extends RbaBuildException {

    /** serialization version ID */
    private static final long serialVersionUID = 7447285006731880953L;

    public UnsupportedAssociationShapeException(String message) {
        super(message);
    }

}
