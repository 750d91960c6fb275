package io.meteofetch.weather;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.meteofetch.budget.QuotaState;
import io.meteofetch.budget.QuotaTracker;
import io.meteofetch.core.FetchRequest;
import io.meteofetch.core.GapRange;
import io.meteofetch.core.Location;
import io.meteofetch.core.Segment;
import io.meteofetch.core.SegmentOutcome;
import io.meteofetch.core.WeatherParameter;
import io.meteofetch.error.AcquisitionFailedException;
import io.meteofetch.error.ErrorKind;
import io.meteofetch.runtime.AcquisitionEngine;
import io.meteofetch.runtime.AcquisitionHandle;
import io.meteofetch.runtime.AcquisitionListener;
import io.meteofetch.runtime.AcquisitionResult;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * CLI to download a daily historical weather series for one location into CSV.
 */
@CommandLine.Command(name = "weather-fetch", mixinStandardHelpOptions = true, description = "Download daily historical weather to CSV")
public final class WeatherFetchCommand implements Callable<Integer> {
    static final int EXIT_COMPLETE = 0;
    static final int EXIT_INCOMPLETE = 1;
    static final int EXIT_INVALID = 2;

    @CommandLine.Option(names = "--lat", required = true, description = "Latitude in degrees")
    double latitude;

    @CommandLine.Option(names = "--lon", required = true, description = "Longitude in degrees")
    double longitude;

    @CommandLine.Option(names = {"-s", "--start"}, required = true, description = "First day (yyyy-MM-dd)")
    LocalDate startDate;

    @CommandLine.Option(names = {"-e", "--end"}, description = "Last day (yyyy-MM-dd); default yesterday")
    LocalDate endDate;

    @CommandLine.Option(names = {"-p", "--param"}, split = ",", description = "Daily parameters (comma-separated or repeat option)",
            defaultValue = "temperature_2m_max,temperature_2m_min,precipitation_sum")
    List<String> params = new ArrayList<>();

    @CommandLine.Option(names = "--provider", description = "Provider id or 'auto'", defaultValue = FetchRequest.AUTO)
    String provider;

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output CSV file; default stdout")
    Path out;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new WeatherFetchCommand()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter err = spec.commandLine().getErr();
        PrintWriter stdout = spec.commandLine().getOut();
        if (endDate == null) endDate = LocalDate.now(ZoneOffset.UTC).minusDays(1);

        Set<WeatherParameter> parameters = EnumSet.noneOf(WeatherParameter.class);
        for (String p : params) {
            Optional<WeatherParameter> parsed = WeatherParameter.fromKey(p.trim());
            if (parsed.isEmpty()) {
                err.println("Unknown parameter: " + p);
                return EXIT_INVALID;
            }
            parsed.ifPresent(parameters::add);
        }

        FetchRequest request;
        try {
            request = new FetchRequest(new Location(latitude, longitude), parameters, startDate, endDate, provider);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_INVALID;
        }

        Injector injector = Guice.createInjector(new WeatherDataModule(WeatherDataConfig.fromEnv()));
        AcquisitionEngine engine = injector.getInstance(AcquisitionEngine.class);
        QuotaTracker quota = injector.getInstance(QuotaTracker.class);
        try {
            AcquisitionHandle handle;
            try {
                handle = engine.submit(request, new ProgressPrinter(err));
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                return EXIT_INVALID;
            }
            AcquisitionResult result;
            try {
                result = handle.result().get();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof AcquisitionFailedException failure) {
                    err.println("Acquisition failed: " + failure.getMessage());
                    for (GapRange g : failure.gaps()) err.println("  missing " + g);
                    printUsage(err, quota);
                    return EXIT_INCOMPLETE;
                }
                throw e;
            }

            SeriesCsvWriter csv = new SeriesCsvWriter();
            if (out != null) {
                csv.write(result.series(), parameters, out);
            } else {
                csv.write(result.series(), parameters, stdout);
                stdout.flush();
            }
            printSummary(err, result);
            printUsage(err, quota);
            if (out != null) stdout.println("Saved " + result.series().records().size() + " days to " + out);
            return result.status() == AcquisitionResult.Status.COMPLETE ? EXIT_COMPLETE : EXIT_INCOMPLETE;
        } finally {
            engine.close();
        }
    }

    private static void printSummary(PrintWriter err, AcquisitionResult result) {
        err.println("Status: " + result.status()
                + " records=" + result.series().records().size()
                + " coverage=" + String.format(Locale.ROOT, "%.1f%%", result.series().coverage() * 100)
                + " servedBy=" + result.servedBy());
        for (GapRange g : result.gapRanges()) err.println("  missing " + g);
    }

    private static void printUsage(PrintWriter err, QuotaTracker quota) {
        err.println("Provider usage:");
        for (QuotaState s : quota.snapshots().values()) {
            String limit = s.isLimited() ? s.used() + "/" + s.capacity() + " (" + s.level() + ")" : s.used() + " calls (unlimited)";
            err.println("  " + s.providerId() + ": " + limit + (s.resetAt() == null ? "" : " resets " + s.resetAt()));
        }
    }

    private static final class ProgressPrinter implements AcquisitionListener {
        private final PrintWriter err;

        ProgressPrinter(PrintWriter err) { this.err = err; }

        @Override
        public void onSegmentFinished(SegmentOutcome outcome, int finished, int total) {
            err.println("[" + finished + "/" + total + "] " + outcome.segment() + " " + outcome.status()
                    + (outcome.servedBy() == null ? "" : " via " + outcome.servedBy()));
            err.flush();
        }

        @Override
        public void onProviderFallback(Segment segment, String fromProvider, String toProvider, ErrorKind reason) {
            err.println(segment + ": " + fromProvider + " -> " + toProvider + " (" + reason + ")");
            err.flush();
        }
    }
}
