package io.feydor.mmlbeep;

import io.feydor.mmlbeep.mml.MmlScore;
import io.feydor.mmlbeep.mml.exceptions.MmlException;
import io.feydor.mmlbeep.util.BeepFormat;
import io.feydor.mmlbeep.util.FileIo;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts an MML score into a beep file: a list of [frequencyHz, durationMs] pairs where a frequency of 0 is a
 * rest. Only one track of the score is written.
 *
 * <p>Usage: java MmlBeepCli score.txt beep.json -t 2</p>
 */
public final class MmlBeepCli {
    private static final Logger LOGGER = Logger.getLogger(MmlBeepCli.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        System.exit(new MmlBeepCli(System.out, System.err).run(args));
    }

    public MmlBeepCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * @param args the command line
     * @return the process exit code
     */
    public int run(String[] args) {
        List<String> files = new ArrayList<>();
        int track = 1;
        var format = BeepFormat.JSON;
        boolean verbose = false;
        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-V", "--version" -> {
                        printVersion();
                        return EXIT_OK;
                    }
                    case "-H", "--help", "-h" -> {
                        printOptions();
                        return EXIT_OK;
                    }
                    case "-t", "--track" -> track = parseTrack(optionValue(args, ++i, arg));
                    case "-f", "--format" -> format = BeepFormat.fromName(optionValue(args, ++i, arg));
                    case "-v", "--verbose" -> verbose = true;
                    default -> {
                        if (arg.startsWith("-") && arg.length() > 1)
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        files.add(arg);
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            printOptions();
            return EXIT_FAILURE;
        }

        if (files.size() != 2) {
            err.println("ERROR: Expected an MML file and a beep file, got: " + files);
            printOptions();
            return EXIT_FAILURE;
        }

        return convert(files.get(0), Path.of(files.get(1)), track, format, verbose);
    }

    private int convert(String mmlFile, Path beepFile, int track, BeepFormat format, boolean verbose) {
        try {
            var score = new MmlScore(mmlFile, verbose);
            var events = score.events(track);
            FileIo.writeBeepFile(beepFile, events, format);
            if (verbose)
                out.printf("INFO: Wrote %d beeps (%d ms) to %s\n", events.size(), MmlScore.totalDurationMs(events), beepFile);
            return EXIT_OK;
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "I/O failure", e);
            err.printf("ERROR: %s\n", e.getMessage());
            return EXIT_FAILURE;
        } catch (MmlException e) {
            LOGGER.log(Level.FINE, "Failed to convert " + mmlFile, e);
            err.printf("ERROR: The MML file failed to parse: %s\n%s\n", mmlFile, e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static String optionValue(String[] args, int i, String option) {
        if (i >= args.length)
            throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }

    private static int parseTrack(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("The track must be a number: " + value);
        }
    }

    private void printOptions() {
        String msg = "\nmml2beep\n\nUsage: mml2beep [MML File] [Beep File]\n\n";
        msg += "Options:\n";
        msg += "\n  -t,--track N     Convert the Nth track (Default: 1)";
        msg += "\n  -f,--format F    Write the beeps as json (Default) or cpp";
        msg += "\n  -V,--version     Print version information";
        msg += "\n  -H,--help        Print this message";
        msg += "\n  -v,--verbose     Print extra logs";
        out.println(msg);
    }

    private void printVersion() {
        out.println("mml2beep 0.1.0\nCopyright (C) 2023 feydor\n");
    }
}
