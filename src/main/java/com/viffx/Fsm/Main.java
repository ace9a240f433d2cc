package com.viffx.Fsm;

import com.viffx.Fsm.Ast.AstPrinter;
import com.viffx.Fsm.Ast.ProgramScope;
import com.viffx.Fsm.Compiler.Parser;
import com.viffx.Fsm.Compiler.ParserOptions;
import com.viffx.Fsm.Compiler.SyntaxError;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Command line front end: parses one source file and writes its syntax tree.
 */
public class Main {
    private static final String VERBOSE_FLAG = "v";
    private static final String OUTPUT_FLAG = "o";
    private static final String HELP_FLAG = "h";
    private static final String OUTPUT_SUFFIX = ".out";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err).code());
    }

    /**
     * Runs the front end without exiting the JVM.
     *
     * @param out receives the usage text
     * @param err receives error messages
     */
    public static ExitCode run(String[] args, PrintStream out, PrintStream err) {
        Options opts = initOptions();

        CommandLine cmd;
        try {
            CommandLineParser parser = new DefaultParser();
            cmd = parser.parse(opts, args);
        } catch (ParseException ex) {
            // Use Apache CLI-provided messages
            err.println(ex.getMessage());
            usage(opts, out);
            return ExitCode.ERROR_COMMAND;
        }

        if (cmd.hasOption(HELP_FLAG)) {
            usage(opts, out);
            return ExitCode.SUCCESS;
        }

        String[] remainingArgs = cmd.getArgs();
        if (remainingArgs.length != 1) {
            err.println("Expected one source file, but got " + remainingArgs.length + " arguments");
            usage(opts, out);
            return ExitCode.ERROR_COMMAND;
        }

        boolean verbose = cmd.hasOption(VERBOSE_FLAG);
        Logger logger = Logging.setupLogging(verbose);

        File input = new File(remainingArgs[0]);
        File output = cmd.hasOption(OUTPUT_FLAG)
                ? new File(cmd.getOptionValue(OUTPUT_FLAG))
                : new File(input.getPath() + OUTPUT_SUFFIX);

        String source;
        try {
            source = FileUtils.readFileToString(input, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            err.println("Cannot read " + input + ": " + ex.getMessage());
            return ExitCode.ERROR_IO;
        }

        ProgramScope program;
        try {
            program = new Parser(ParserOptions.defaults().withTraceActions(verbose)).parse(source);
        } catch (SyntaxError ex) {
            err.println(input + ":" + ex.getMessage());
            return ExitCode.ERROR_PARSER;
        }
        logger.debug("Parsed " + program.declarations().size() + " declarations from " + input);

        try {
            FileUtils.writeStringToFile(output, AstPrinter.print(program), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            err.println("Cannot write " + output + ": " + ex.getMessage());
            return ExitCode.ERROR_IO;
        }
        logger.debug("Wrote " + output);
        return ExitCode.SUCCESS;
    }

    private static Options initOptions() {
        Options opts = new Options();
        opts.addOption(new Option(VERBOSE_FLAG, "verbose", false, "Log parser actions"));
        opts.addOption(new Option(OUTPUT_FLAG, "output", true, "Write the syntax tree to this file instead of <source>.out"));
        opts.addOption(new Option(HELP_FLAG, "help", false, "Print this message"));
        return opts;
    }

    private static void usage(Options opts, PrintStream out) {
        HelpFormatter fmt = new HelpFormatter();
        PrintWriter writer = new PrintWriter(out);
        fmt.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "fsm-lang [options] <source>", null, opts,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }
}
