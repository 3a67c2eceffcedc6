package org.camunda.bpm.getstarted.migration;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.camunda.bpm.getstarted.migration.analysis.BpmnMigrationAnalyzer;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.BpmnParseException;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.BpmnValidator;
import org.camunda.bpm.getstarted.migration.analysis.models.AnalysisReport;
import org.camunda.bpm.getstarted.migration.report.ConsoleReportPrinter;
import org.camunda.bpm.getstarted.migration.report.CsvReportExporter;
import org.camunda.bpm.getstarted.migration.report.HtmlReportExporter;
import org.camunda.bpm.getstarted.migration.report.JsonReportExporter;
import org.camunda.bpm.getstarted.migration.report.ReportExportException;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 * java -jar bpmn-migration-analyzer.jar process.bpmn --json report.json --html report.html
 * </pre>
 */
@Slf4j
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;

    private static final String USAGE = "bpmn-migration-analyzer <bpmn-file> [options]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the tool without exiting the JVM.
     *
     * @return the process exit code: 1 when no input file is given, 0 otherwise, including when
     *         an option is not understood or the document cannot be analyzed
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options = createOptions();

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;
        boolean helpShown = false;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            err.println("Error: " + e.getMessage());
            printHelp(options, err);
            helpShown = true;
            try {
                cmd = parser.parse(options, knownArguments(options, args));
            } catch (ParseException retry) {
                return EXIT_USAGE;
            }
        }

        if (cmd.hasOption("h")) {
            printHelp(options, out);
            return EXIT_OK;
        }
        if (cmd.getArgList().isEmpty()) {
            if (!helpShown) {
                printHelp(options, err);
            }
            return EXIT_USAGE;
        }

        Path bpmnFile = Path.of(cmd.getArgList().get(0));
        try {
            if (cmd.hasOption("strict")) {
                BpmnValidator.validate(bpmnFile);
            }

            AnalysisReport report = new BpmnMigrationAnalyzer().analyze(bpmnFile);
            new ConsoleReportPrinter(out).print(report);

            if (cmd.hasOption("json")) {
                Path target = Path.of(cmd.getOptionValue("json"));
                new JsonReportExporter().export(report, target);
                out.println();
                out.println("JSON report exported to: " + target);
            }
            if (cmd.hasOption("csv")) {
                Path target = Path.of(cmd.getOptionValue("csv"));
                new CsvReportExporter().export(report, target);
                out.println("CSV report exported to: " + target);
            }
            if (cmd.hasOption("html")) {
                Path target = Path.of(cmd.getOptionValue("html"));
                new HtmlReportExporter().export(report, target);
                out.println("HTML report exported to: " + target);
            }
        } catch (BpmnParseException e) {
            err.println("Error: " + e.getMessage());
        } catch (ReportExportException e) {
            log.error("Export failed", e);
            err.println("Error: " + e.getMessage());
        }
        return EXIT_OK;
    }

    /**
     * Drops unknown options and options missing their value, so a bad flag does not stop the
     * analysis of a given input file.
     */
    static String[] knownArguments(Options options, String[] args) {
        List<String> kept = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-") || arg.equals("-")) {
                kept.add(arg);
                continue;
            }

            String name = arg.split("=", 2)[0];
            if (!options.hasOption(name)) {
                continue;
            }
            Option option = options.getOption(name);
            if (!option.hasArg() || arg.contains("=")) {
                kept.add(arg);
            } else if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                kept.add(arg);
                kept.add(args[++i]);
            }
        }
        return kept.toArray(new String[0]);
    }

    private static Options createOptions() {
        Options options = new Options();

        options.addOption(Option.builder()
                .longOpt("json")
                .hasArg()
                .argName("file")
                .desc("Export results to JSON")
                .build());

        options.addOption(Option.builder()
                .longOpt("csv")
                .hasArg()
                .argName("file")
                .desc("Export issues to CSV")
                .build());

        options.addOption(Option.builder()
                .longOpt("html")
                .hasArg()
                .argName("file")
                .desc("Export report to HTML")
                .build());

        options.addOption(Option.builder()
                .longOpt("strict")
                .desc("Validate the document against the BPMN 2.0 schema before analyzing")
                .build());

        options.addOption(Option.builder("h")
                .longOpt("help")
                .desc("Show this help message")
                .build());

        return options;
    }

    private static void printHelp(Options options, PrintStream stream) {
        PrintWriter writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE, null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD,
                "\nExample:\n  bpmn-migration-analyzer process.bpmn --json report.json --html report.html");
        writer.flush();
    }
}
