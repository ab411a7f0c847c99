/**
 *
 */
package org.theseed.rba;

/**
 * This exception is thrown when an input document (the SBML model or the parameter file)
 * cannot be read as a structure.
 */
public class InvalidInputFormatException extends RbaBuildException {

    /** serialization version ID */
    private static final long serialVersionUID = 5826437196304471262L;

    public InvalidInputFormatException(String message) {
        super(message);
    }

    public InvalidInputFormatException(String message, Throwable cause) {
        super(message, cause);
    }

}
