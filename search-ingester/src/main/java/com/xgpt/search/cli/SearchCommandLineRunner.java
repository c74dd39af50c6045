package com.xgpt.search.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xgpt.search.service.SearchValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Runs the {@code search} command when the application is started as
 * {@code search "<variants>" [--max=500] [--days=7] ...}. Does nothing otherwise.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SearchCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final String COMMAND = "search";

    private final SearchCommand searchCommand;
    private final ObjectMapper objectMapper;

    private PrintStream out = System.out;
    private int exitCode;

    public static boolean isSearchCommand(String[] args) {
        return args.length > 0 && COMMAND.equals(args[0]);
    }

    public static boolean isJsonOutput(String[] args) {
        return Arrays.stream(args).anyMatch(arg -> arg.equals("--json") || arg.startsWith("--json="));
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty() || !COMMAND.equals(positional.get(0))) {
            return;
        }

        CommandResult result;
        boolean json = args.containsOption("json");
        try {
            result = searchCommand.execute(parseOptions(args));
        } catch (SearchValidationException e) {
            result = CommandResult.failure(e.getMessage());
        }

        print(result, json);
        exitCode = result.success() ? 0 : 1;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    static SearchCommandOptions parseOptions(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        SearchCommandOptions options = new SearchCommandOptions();
        if (positional.size() > 1) {
            options.setQuery(String.join(" ", positional.subList(1, positional.size())));
        }
        options.setName(value(args, "name"));
        options.setMaxTweets(intValue(args, "max"));
        options.setDays(intValue(args, "days"));
        options.setSince(value(args, "since"));
        options.setUntil(value(args, "until"));
        options.setMode(value(args, "mode"));
        options.setEmbed(args.containsOption("embed"));
        options.setDryRun(args.containsOption("dry-run"));
        options.setJson(args.containsOption("json"));
        options.setResume(longValue(args, "resume"));
        options.setCleanup(args.containsOption("cleanup"));
        options.setOlderThan(value(args, "older-than"));
        return options;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void print(CommandResult result, boolean json) {
        if (json) {
            try {
                out.println(objectMapper.writeValueAsString(result));
                return;
            } catch (JsonProcessingException e) {
                log.warn("Could not serialise result as JSON: {}", e.getMessage());
            }
        }
        if (result.success()) {
            out.println(result.message());
        } else {
            out.println("[error] " + result.message());
        }
    }

    /**
     * Last value given for a valued option, or null when the option is absent. Options are only
     * read in {@code --name=value} form, so a valued option given bare ({@code --days 7}) is
     * rejected instead of letting its value leak into the query.
     */
    private static String value(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        String last = values == null || values.isEmpty() ? null : values.get(values.size() - 1);
        if (last == null || last.isBlank()) {
            throw new SearchValidationException("--" + name + " requires a value, e.g. --" + name + "=...");
        }
        return last;
    }

    private static Integer intValue(ApplicationArguments args, String name) {
        String raw = value(args, name);
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw notAWholeNumber(name, raw);
        }
    }

    private static Long longValue(ApplicationArguments args, String name) {
        String raw = value(args, name);
        if (raw == null) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw notAWholeNumber(name, raw);
        }
    }

    private static SearchValidationException notAWholeNumber(String name, String raw) {
        return new SearchValidationException("--" + name + " must be a whole number, got \"" + raw + "\"");
    }
}
