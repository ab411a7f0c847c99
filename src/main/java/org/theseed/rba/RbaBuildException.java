/**
 *
 */
package org.theseed.rba;

/**
 * This is the base class for all the errors that abort a model build.  A build either
 * completes the whole model or throws one of these.
 */
public class RbaBuildException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = -3170211493588420815L;

    public RbaBuildException(String message) {
        super(message);
    }

    public RbaBuildException(String message, Throwable cause) {
        super(message, cause);
    }

}
