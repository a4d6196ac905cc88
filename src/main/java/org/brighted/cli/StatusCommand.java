package org.brighted.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.brighted.store.api.IGameStateStore;
import org.brighted.store.api.OperationalError;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Prints the health of the configured game-state store together with its metrics and
 * the most recent operational errors.
 */
@Command(name = "status", description = "Show store health, metrics and recent errors.")
public class StatusCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--json", description = "Print the status as JSON.")
    private boolean json;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        IGameStateStore store = parent.getEngine().store();
        PrintWriter out = spec.commandLine().getOut();

        if (json) {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("store", store.getStoreName());
            status.put("healthy", store.isHealthy());
            status.put("metrics", store.getMetrics());
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(status));
        } else {
            out.printf("%s: %s%n", store.getStoreName(), store.isHealthy() ? "healthy" : "UNHEALTHY");
            store.getMetrics().forEach((metric, value) -> out.printf("  %-28s %s%n", metric, value));
            for (OperationalError error : store.getErrors()) {
                out.printf("  ! %s %s: %s (%s)%n", error.timestamp(), error.errorType(), error.message(), error.details());
            }
        }
        return 0;
    }
}
