/**
 *
 */
package org.theseed.rba.association;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.theseed.rba.UnsupportedAssociationShapeException;

/**
 * This object parses a text gene association, such as "(b0001 and b0002) or b0003", into a
 * {@link GeneAssociation}.  The keywords "and" and "or" are case-insensitive, parentheses group,
 * and AND binds more tightly than OR.  An empty or blank string parses to the empty association.
 *
 * The grammar is
 *
 *  	expr	:= term ( OR term )*
 *  	term	:= factor ( AND factor )*
 *  	factor	:= gene | "(" expr ")"
 */
public class AssociationExpressionParser {

    // FIELDS
    /** tokens of the expression being parsed */
    private List<String> tokens;
    /** position of the next token */
    private int pos;
    /** original text (for error messages) */
    private String text;

    /**
     * Parse a text gene association.
     *
     * @param text		association text to parse
     *
     * @return the association tree
     *
     * @throws UnsupportedAssociationShapeException	if the text is not a well-formed association
     */
    public GeneAssociation parse(String text) throws UnsupportedAssociationShapeException {
        GeneAssociation retVal;
        this.text = text;
        this.tokens = tokenize(text);
        this.pos = 0;
        if (this.tokens.isEmpty())
            retVal = GeneAssociation.EMPTY;
        else {
            retVal = this.parseExpression();
            if (this.pos < this.tokens.size())
                throw this.error("unexpected \"" + this.tokens.get(this.pos) + "\"");
        }
        return retVal;
    }

    /**
     * Split an association string into tokens.  Parentheses are always tokens by themselves, and
     * everything else is separated by white space.
     *
     * @param text		string to split
     *
     * @return the list of tokens
     */
    protected static List<String> tokenize(String text) {
        List<String> retVal = new ArrayList<String>();
        if (! StringUtils.isBlank(text)) {
            StringBuilder current = new StringBuilder();
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '(' || c == ')' || Character.isWhitespace(c)) {
                    if (current.length() > 0) {
                        retVal.add(current.toString());
                        current.setLength(0);
                    }
                    if (! Character.isWhitespace(c))
                        retVal.add(String.valueOf(c));
                } else
                    current.append(c);
            }
            if (current.length() > 0)
                retVal.add(current.toString());
        }
        return retVal;
    }

    /**
     * @return the association for an OR-expression starting at the current position
     *
     * @throws UnsupportedAssociationShapeException
     */
    private GeneAssociation parseExpression() throws UnsupportedAssociationShapeException {
        List<GeneAssociation> terms = new ArrayList<GeneAssociation>();
        terms.add(this.parseTerm());
        while (this.nextIs("or")) {
            this.pos++;
            terms.add(this.parseTerm());
        }
        return (terms.size() == 1 ? terms.get(0) : new GeneAssociation.Or(terms));
    }

    /**
     * @return the association for an AND-expression starting at the current position
     *
     * @throws UnsupportedAssociationShapeException
     */
    private GeneAssociation parseTerm() throws UnsupportedAssociationShapeException {
        List<GeneAssociation> factors = new ArrayList<GeneAssociation>();
        factors.add(this.parseFactor());
        while (this.nextIs("and")) {
            this.pos++;
            factors.add(this.parseFactor());
        }
        return (factors.size() == 1 ? factors.get(0) : new GeneAssociation.And(factors));
    }

    /**
     * @return the association for a gene or a parenthesized expression at the current position
     *
     * @throws UnsupportedAssociationShapeException
     */
    private GeneAssociation parseFactor() throws UnsupportedAssociationShapeException {
        if (this.pos >= this.tokens.size())
            throw this.error("unexpected end of expression");
        String token = this.tokens.get(this.pos);
        this.pos++;
        GeneAssociation retVal;
        if (token.equals("(")) {
            retVal = this.parseExpression();
            if (! this.nextIs(")"))
                throw this.error("missing right parenthesis");
            this.pos++;
        } else if (token.equals(")") || isKeyword(token))
            throw this.error("unexpected \"" + token + "\"");
        else
            retVal = GeneAssociation.gene(token);
        return retVal;
    }

    /**
     * @return TRUE if the next token matches the specified string (case-insensitive)
     *
     * @param expected	expected token
     */
    private boolean nextIs(String expected) {
        return (this.pos < this.tokens.size() && this.tokens.get(this.pos).equalsIgnoreCase(expected));
    }

    /**
     * @return TRUE if the token is a logical keyword
     *
     * @param token		token to check
     */
    private static boolean isKeyword(String token) {
        return token.equalsIgnoreCase("and") || token.equalsIgnoreCase("or");
    }

    /**
     * @return an exception describing a parsing error
     *
     * @param problem	description of the problem
     */
    private UnsupportedAssociationShapeException error(String problem) {
        return new UnsupportedAssociationShapeException("Invalid gene association \"" + this.text + "\": "
                + problem + ".");
    }

}
