/**
 *
 */
package org.theseed.rba.meta;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for all the commands.  The subclass declares its options and arguments with
 * args4j annotations.  Parsing the command line sets the defaults, parses the options, and validates
 * them; running the command executes it and logs any failure.
 *
 * The command-line options common to all commands are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 */
public abstract class BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** start time of the command */
    private long startTime;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true, usage = "display command-line usage")
    private boolean help;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /**
     * Parse the command-line parameters.
     *
     * @param args		command-line parameters
     *
     * @return TRUE if the parameters are valid and the command should run, else FALSE
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help)
                parser.printUsage(System.err);
            else {
                if (this.debug) {
                    Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
                    if (root instanceof ch.qos.logback.classic.Logger)
                        ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
                    log.debug("Debug logging enabled.");
                }
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException | IOException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
        }
        return retVal;
    }

    /**
     * Execute the command.  A failure is logged with its stack trace.
     */
    public void run() {
        this.startTime = System.currentTimeMillis();
        try {
            this.runCommand();
            log.info("{} seconds to run command.", (System.currentTimeMillis() - this.startTime) / 1000.0);
        } catch (Exception e) {
            log.error("Command failed.", e);
            throw new RuntimeException(e);
        }
    }

    /**
     * Set the default values of the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options and arguments.
     *
     * @return TRUE if the command should run, else FALSE
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Execute the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
