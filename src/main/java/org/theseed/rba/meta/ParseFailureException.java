/**
 *
 */
package org.theseed.rba.meta;

/**
 * This exception is thrown when the command-line parameters of a command are invalid.
 */
public class ParseFailureException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = 4128306571382615932L;

    public ParseFailureException(String message) {
        super(message);
    }

}
