/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.vizprep;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Map.Entry;

import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.container.obj.ColumnType;
import ml.shifu.vizprep.core.Preprocessor;
import ml.shifu.vizprep.core.TypeClassifier;
import ml.shifu.vizprep.core.session.AnalysisSession;
import ml.shifu.vizprep.core.session.TableVariant;
import ml.shifu.vizprep.core.viz.JsonChartRenderer;
import ml.shifu.vizprep.core.viz.VisualizationKind;
import ml.shifu.vizprep.core.viz.VisualizationRequest;
import ml.shifu.vizprep.core.viz.VisualizationSelector;
import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;
import ml.shifu.vizprep.util.Constants;
import ml.shifu.vizprep.util.CsvTableLoader;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * VizPrepCLI class is the MAIN class for whole project. It reads the parameters from command line, loads the data file
 * and executes the corresponding command.
 */
public class VizPrepCLI {

    private static final String COLUMNS_CMD = "columns";
    private static final String PREPROCESS_CMD = "preprocess";
    private static final String VIZ_CMD = "viz";

    private static final String FILE = "f";
    private static final String DELIMITER = "d";
    private static final String OUTPUT = "o";
    private static final String KIND = "k";
    private static final String X = "x";
    private static final String Y = "y";
    private static final String VARIANT = "v";

    static private final Logger log = LoggerFactory.getLogger(VizPrepCLI.class);

    public static void main(String[] args) {
        Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        int status = run(args, out);
        System.exit(status);
    }

    /**
     * Run one command.
     * 
     * @param args
     *            command line arguments, command first
     * @param out
     *            where results go when no output file is given
     * @return 0 if success, 1 if failed
     */
    public static int run(String[] args, Writer out) {
        if(args.length < 1 || isHelpOption(args[0])) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        CommandLineParser parser = new GnuParser();
        Options opts = buildOptions();
        CommandLine cmd = null;
        try {
            cmd = parser.parse(opts, args);
        } catch (ParseException e) {
            log.error("Invalid command options. Please check help message.", e);
            printUsage();
            return 1;
        }

        if(!cmd.hasOption(FILE)) {
            log.error("Data file is not set, please set it by -f <file>.");
            printUsage();
            return 1;
        }

        String command = args[0];
        try {
            CsvTableLoader loader = new CsvTableLoader(cmd.getOptionValue(DELIMITER));
            Table raw = loader.load(cmd.getOptionValue(FILE));

            if(COLUMNS_CMD.equalsIgnoreCase(command)) {
                listColumns(raw, out);
            } else if(PREPROCESS_CMD.equalsIgnoreCase(command)) {
                Table prepared = new Preprocessor().preprocess(raw);
                Writer writer = openOutput(cmd, out);
                try {
                    loader.write(prepared, writer);
                } finally {
                    closeOutput(writer, out);
                }
            } else if(VIZ_CMD.equalsIgnoreCase(command)) {
                visualize(cmd, raw, out);
            } else {
                log.error("Invalid command {}, please check help message.", command);
                printUsage();
                return 1;
            }
        } catch (VizPrepException e) {
            log.error("Command {} failed with {}", command, e.toString());
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Command {} failed: {}", command, e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Command " + command + " failed with IO error.", e);
            return 1;
        }
        return 0;
    }

    private static void listColumns(Table raw, Writer out) throws IOException {
        Map<String, ColumnType> types = new TypeClassifier().classifyAll(raw);
        PrintWriter writer = new PrintWriter(out);
        int index = 0;
        for(Entry<String, ColumnType> entry: types.entrySet()) {
            writer.println(index++ + "\t" + entry.getKey() + "\t"
                    + (entry.getValue().isCategorical() ? "Categorical" : "Numerical"));
        }
        writer.flush();
    }

    private static void visualize(CommandLine cmd, Table raw, Writer out) throws IOException {
        VisualizationKind kind = VisualizationKind.of(cmd.getOptionValue(KIND, VisualizationKind.DISTRIBUTION.name()));
        TableVariant variant = TableVariant.of(cmd.getOptionValue(VARIANT, TableVariant.RAW.name()));

        // prepared table is only built if the request targets it
        AnalysisSession session = new AnalysisSession(raw, new Preprocessor(), new VisualizationSelector());
        Table table = session.getTable(variant);

        String x = columnName(table, cmd.getOptionValue(X));
        VisualizationRequest request;
        if(kind.isPaired()) {
            request = VisualizationRequest.of(kind, x, columnName(table, cmd.getOptionValue(Y)));
        } else {
            request = VisualizationRequest.of(kind, x);
        }

        Writer writer = openOutput(cmd, out);
        try {
            session.visualize(variant, request, new JsonChartRenderer(writer));
        } finally {
            closeOutput(writer, out);
        }
    }

    /**
     * Column reference is a name, or a zero-based index if no column has that name.
     */
    private static String columnName(Table table, String reference) {
        if(StringUtils.isBlank(reference)) {
            throw new IllegalArgumentException("Column is not set, please set it by -x/-y <column>.");
        }
        if(!table.hasColumn(reference) && NumberUtils.isDigits(reference)) {
            return table.getColumn(Integer.parseInt(reference)).getName();
        }
        return reference;
    }

    private static Writer openOutput(CommandLine cmd, Writer out) throws IOException {
        if(!cmd.hasOption(OUTPUT)) {
            return out;
        }
        File file = new File(cmd.getOptionValue(OUTPUT));
        try {
            return new OutputStreamWriter(FileUtils.openOutputStream(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new VizPrepException(VizPrepErrorCode.ERROR_WRITE_OUTPUT, e, "Cannot open output file "
                    + file.getPath());
        }
    }

    private static void closeOutput(Writer writer, Writer out) throws IOException {
        if(writer == out) {
            writer.flush();
        } else {
            IOUtils.closeQuietly(writer);
        }
    }

    @SuppressWarnings("static-access")
    private static Options buildOptions() {
        Options opts = new Options();

        Option opt_file = OptionBuilder.hasArg().withDescription("Delimited data file with header").create(FILE);
        Option opt_delimiter = OptionBuilder.hasArg().withDescription("Field delimiter, detected if not set")
                .create(DELIMITER);
        Option opt_output = OptionBuilder.hasArg().withDescription("Output file, stdout if not set").create(OUTPUT);
        Option opt_kind = OptionBuilder.hasArg()
                .withDescription("distribution, comparison, correlation or proportion").create(KIND);
        Option opt_x = OptionBuilder.hasArg().withDescription("Column name or index (x axis)").create(X);
        Option opt_y = OptionBuilder.hasArg().withDescription("Column name or index (y axis)").create(Y);
        Option opt_variant = OptionBuilder.hasArg().withDescription("raw or prepared table").create(VARIANT);

        opts.addOption(opt_file);
        opts.addOption(opt_delimiter);
        opts.addOption(opt_output);
        opts.addOption(opt_kind);
        opts.addOption(opt_x);
        opts.addOption(opt_y);
        opts.addOption(opt_variant);
        return opts;
    }

    private static boolean isHelpOption(String str) {
        return "h".equalsIgnoreCase(str) || "-h".equalsIgnoreCase(str) || "help".equalsIgnoreCase(str)
                || "-help".equalsIgnoreCase(str);
    }

    private static void printUsage() {
        System.out.println("Usage: vizprep [-Dkey=value] COMMAND -f <file> [-d <delimiter>]");
        System.out.println("where COMMAND is one of:");
        System.out.println("\tcolumns                                 List column index, name and type.");
        System.out.println("\tpreprocess [-o <file>]                  Impute, encode and scale the data.");
        System.out.println("\tviz -k <kind> -x <col> [-y <col>] [-v raw|prepared] [-o <file>]");
        System.out.println("\t                                        Resolve a chart spec and print it as json.");
        System.out.println("\t                                        kind: distribution, comparison, correlation, proportion");
        System.out.println("Version " + Constants.version);
    }
}
