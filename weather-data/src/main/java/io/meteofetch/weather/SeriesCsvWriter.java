package io.meteofetch.weather;

import io.meteofetch.core.DailyRecord;
import io.meteofetch.core.MergedSeries;
import io.meteofetch.core.WeatherParameter;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;

/**
 * Writes a merged series as CSV: {@code date,<parameter keys...>,source}, one row per record, empty cells for
 * missing values. Gap dates get no row.
 */
public class SeriesCsvWriter {

    public void write(MergedSeries series, Set<WeatherParameter> parameters, Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            write(series, parameters, w);
        }
    }

    public void write(MergedSeries series, Set<WeatherParameter> parameters, Writer out) throws IOException {
        Set<WeatherParameter> columns = EnumSet.copyOf(parameters);
        StringBuilder header = new StringBuilder("date");
        for (WeatherParameter p : columns) header.append(',').append(p.key());
        out.write(header.append(",source\n").toString());
        for (DailyRecord r : series.records()) {
            StringBuilder line = new StringBuilder(r.date().toString());
            for (WeatherParameter p : columns) {
                Double v = r.value(p);
                line.append(',');
                if (v != null) line.append(cell(v));
            }
            line.append(',').append(r.source() == null ? "" : r.source()).append('\n');
            out.write(line.toString());
        }
    }

    // plain decimal notation, never 1.0E-4
    private static String cell(double v) {
        return Double.isFinite(v) ? BigDecimal.valueOf(v).toPlainString() : Double.toString(v);
    }
}
