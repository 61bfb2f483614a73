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
package ml.shifu.vizprep.util;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import ml.shifu.vizprep.container.Column;
import ml.shifu.vizprep.container.Table;
import ml.shifu.vizprep.exception.VizPrepErrorCode;
import ml.shifu.vizprep.exception.VizPrepException;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Load a delimited text file with a header row into a {@link Table}, and write a table back.
 * 
 * <p>
 * A column is numerical if every non-missing cell is a plain decimal number, otherwise categorical. Cells equal to
 * one of the missing tokens ({@code "", NA, N/A, NaN, null} by default) and numbers which overflow double are
 * missing.
 */
public class CsvTableLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableLoader.class);

    private static final String[] CANDIDATE_DELIMITERS = { "\t", ";", "," };

    private static final char QUOTE = '"';

    /**
     * Plain decimal or scientific notation, no type suffix, hex or Infinity literal.
     */
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private String delimiter;

    private final Set<String> missingTokens;

    public CsvTableLoader() {
        this(Environment.getProperty(Constants.VIZPREP_LOADER_DELIMITER));
    }

    /**
     * @param delimiter
     *            field delimiter, detected from the header line if null
     */
    public CsvTableLoader(String delimiter) {
        this.delimiter = delimiter;
        String tokens = Environment.getProperty(Constants.VIZPREP_LOADER_MISSING_VALUES,
                Constants.DEFAULT_MISSING_VALUES);
        this.missingTokens = new HashSet<String>(Arrays.asList(StringUtils.splitPreserveAllTokens(tokens, ',')));
    }

    public String getDelimiter() {
        return delimiter;
    }

    public Table load(String filePath) {
        return load(new File(filePath));
    }

    public Table load(File file) {
        if(!file.exists() || !file.isFile()) {
            throw new VizPrepException(VizPrepErrorCode.ERROR_INPUT_NOT_FOUND, "File " + file.getPath()
                    + " is not found.");
        }

        List<String> lines;
        try {
            lines = FileUtils.readLines(file, "UTF-8");
        } catch (IOException e) {
            throw new VizPrepException(VizPrepErrorCode.ERROR_LOAD_TABLE, e, "Cannot read file " + file.getPath());
        }
        return parse(lines, file.getPath());
    }

    /**
     * Parse the lines of a delimited text, the first non-blank one being the header.
     */
    public Table parse(List<String> lines, String source) {
        int lineIndex = 0;
        while(lineIndex < lines.size() && StringUtils.isBlank(lines.get(lineIndex))) {
            lineIndex++;
        }
        if(lineIndex == lines.size()) {
            throw new VizPrepException(VizPrepErrorCode.ERROR_LOAD_TABLE, "No header is found in " + source);
        }

        String headerLine = lines.get(lineIndex++);
        if(delimiter == null) {
            delimiter = detectDelimiter(headerLine);
            log.debug("Delimiter '{}' is detected for {}.", delimiter, source);
        }
        List<String> header = splitLine(headerLine);
        Set<String> names = new HashSet<String>();
        for(String name: header) {
            if(!names.add(name)) {
                throw new VizPrepException(VizPrepErrorCode.ERROR_LOAD_TABLE, "Duplicated column " + name
                        + " in header of " + source);
            }
        }

        List<List<String>> cells = new ArrayList<List<String>>(header.size());
        for(int i = 0; i < header.size(); i++) {
            cells.add(new ArrayList<String>());
        }
        for(; lineIndex < lines.size(); lineIndex++) {
            String line = lines.get(lineIndex);
            if(StringUtils.isBlank(line)) {
                continue;
            }
            List<String> fields = splitLine(line);
            if(fields.size() > header.size()) {
                throw new VizPrepException(VizPrepErrorCode.ERROR_LOAD_TABLE, "Line " + (lineIndex + 1) + " of "
                        + source + " has " + fields.size() + " fields, but header has " + header.size() + ".");
            }
            for(int i = 0; i < header.size(); i++) {
                String field = i < fields.size() ? fields.get(i) : null;
                cells.get(i).add(field == null || missingTokens.contains(field.trim()) ? null : field);
            }
        }

        List<Column> columns = new ArrayList<Column>(header.size());
        for(int i = 0; i < header.size(); i++) {
            columns.add(toColumn(header.get(i), cells.get(i)));
        }
        Table table = new Table(columns);
        log.info("Loaded {} from {}.", table, source);
        return table;
    }

    private static Column toColumn(String name, List<String> cells) {
        List<Double> numbers = new ArrayList<Double>(cells.size());
        for(String cell: cells) {
            if(cell == null) {
                numbers.add(null);
                continue;
            }
            Double number = toDouble(cell);
            if(number == null) {
                return Column.categorical(name, cells);
            }
            numbers.add(number);
        }
        return Column.numerical(name, numbers);
    }

    private static Double toDouble(String cell) {
        String trimmed = cell.trim();
        if(!NUMBER.matcher(trimmed).matches()) {
            // not a number, column will be categorical
            return null;
        }
        Double number = Double.valueOf(trimmed);
        if(number.isInfinite()) {
            // overflows like 1e999 stay numerical, Column stores them as missing
            log.warn("Value {} overflows double and is treated as missing.", trimmed);
        }
        return number;
    }

    private static String detectDelimiter(String line) {
        for(String candidate: CANDIDATE_DELIMITERS) {
            if(line.contains(candidate)) {
                return candidate;
            }
        }
        return Constants.DEFAULT_DELIMITER;
    }

    /**
     * Split a line by the delimiter; a field wrapped in double quotes may contain the delimiter and doubled quotes.
     */
    List<String> splitLine(String line) {
        List<String> fields = new ArrayList<String>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while(i < line.length()) {
            char c = line.charAt(i);
            if(quoted) {
                if(c == QUOTE && i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                    field.append(QUOTE);
                    i += 2;
                    continue;
                }
                if(c == QUOTE) {
                    quoted = false;
                } else {
                    field.append(c);
                }
                i++;
            } else if(c == QUOTE && field.length() == 0) {
                quoted = true;
                i++;
            } else if(line.startsWith(delimiter, i)) {
                fields.add(field.toString());
                field.setLength(0);
                i += delimiter.length();
            } else {
                field.append(c);
                i++;
            }
        }
        fields.add(field.toString());
        return fields;
    }

    /**
     * Write the table with a header row, missing cells are written as empty fields.
     */
    public void write(Table table, Writer writer) throws IOException {
        String sep = delimiter == null ? Constants.DEFAULT_DELIMITER : delimiter;
        List<String> header = new ArrayList<String>(table.getColumnCount());
        for(String name: table.getColumnNames()) {
            header.add(quote(name, sep));
        }
        writer.write(StringUtils.join(header, sep));
        writer.write('\n');

        List<Column> columns = table.getColumns();
        for(int row = 0; row < table.getRowCount(); row++) {
            List<String> fields = new ArrayList<String>(columns.size());
            for(Column column: columns) {
                Object value = column.getValue(row);
                fields.add(value == null ? "" : quote(value.toString(), sep));
            }
            writer.write(StringUtils.join(fields, sep));
            writer.write('\n');
        }
        writer.flush();
    }

    private static String quote(String value, String sep) {
        if(value.contains(sep) || value.indexOf(QUOTE) >= 0) {
            return QUOTE + value.replace("\"", "\"\"") + QUOTE;
        }
        return value;
    }
}
