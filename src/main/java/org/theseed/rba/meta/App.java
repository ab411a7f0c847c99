package org.theseed.rba.meta;

import java.util.Arrays;

/**
 * Commands for building resource-balance-allocation models.
 *
 * build			build an RBA model from a parameter file and an SBML model
 * proteins			list the proteins in a parameter file
 * enzymes			list the expanded reactions and their enzymes
 * compartments		report the compartment classification of an SBML model
 */
public class App
{
    public static void main( String[] args )
    {
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "build" :
            processor = new BuildProcessor();
            break;
        case "proteins" :
            processor = new ProteinsProcessor();
            break;
        case "enzymes" :
            processor = new EnzymesProcessor();
            break;
        case "compartments" :
            processor = new CompartmentsProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
        }
    }
}
