package com.xgpt.search.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xgpt.search.service.SearchValidationException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class SearchCommandLineRunnerTest {

    private SearchCommand command;
    private SearchCommandLineRunner runner;
    private ByteArrayOutputStream output;

    @BeforeEach
    void setUp() {
        command = mock(SearchCommand.class);
        runner = new SearchCommandLineRunner(command, new ObjectMapper());
        output = new ByteArrayOutputStream();
        runner.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @Test
    void parsesVariantsAndOptions() {
        SearchCommandOptions options = SearchCommandLineRunner.parseOptions(new DefaultApplicationArguments(
                "search", "AGI,", "GPT-5", "--name=frontier", "--max=50", "--days=7", "--mode=top",
                "--embed", "--dry-run", "--json"));

        assertThat(options.getQuery()).isEqualTo("AGI, GPT-5");
        assertThat(options.getName()).isEqualTo("frontier");
        assertThat(options.getMaxTweets()).isEqualTo(50);
        assertThat(options.getDays()).isEqualTo(7);
        assertThat(options.getMode()).isEqualTo("top");
        assertThat(options.isEmbed()).isTrue();
        assertThat(options.isDryRun()).isTrue();
        assertThat(options.isJson()).isTrue();
        assertThat(options.getResume()).isNull();
        assertThat(options.isCleanup()).isFalse();
    }

    @Test
    void parsesResumeAndCleanup() {
        SearchCommandOptions resume = SearchCommandLineRunner.parseOptions(
                new DefaultApplicationArguments("search", "--resume=12"));
        SearchCommandOptions cleanup = SearchCommandLineRunner.parseOptions(
                new DefaultApplicationArguments("search", "--cleanup", "--older-than=30d"));

        assertThat(resume.getResume()).isEqualTo(12L);
        assertThat(resume.getQuery()).isNull();
        assertThat(cleanup.isCleanup()).isTrue();
        assertThat(cleanup.getOlderThan()).isEqualTo("30d");
    }

    @Test
    void resumeAcceptsSessionIdsBeyondIntRange() {
        SearchCommandOptions options = SearchCommandLineRunner.parseOptions(
                new DefaultApplicationArguments("search", "--resume=3000000000"));

        assertThat(options.getResume()).isEqualTo(3_000_000_000L);
    }

    @Test
    void valuedOptionWrittenWithSpaceIsRejected() {
        assertThatThrownBy(() -> SearchCommandLineRunner.parseOptions(new DefaultApplicationArguments(
                "search", "AGI", "--days", "7", "--since", "2024-01-01")))
                .isInstanceOf(SearchValidationException.class)
                .hasMessage("--days requires a value, e.g. --days=...");
        assertThatThrownBy(() -> SearchCommandLineRunner.parseOptions(new DefaultApplicationArguments(
                "search", "AGI", "--since", "2024-01-01")))
                .isInstanceOf(SearchValidationException.class)
                .hasMessage("--since requires a value, e.g. --since=...");
    }

    @Test
    void spacedDaysAndSinceFailBeforeAnySearchRuns() {
        runner.run(new DefaultApplicationArguments("search", "AGI", "--days", "7", "--since", "2024-01-01"));

        assertThat(printed()).isEqualTo("[error] --days requires a value, e.g. --days=...");
        assertThat(runner.getExitCode()).isEqualTo(1);
        verifyNoInteractions(command);
    }

    @Test
    void nonNumericMaxIsRejected() {
        assertThatThrownBy(() -> SearchCommandLineRunner.parseOptions(
                new DefaultApplicationArguments("search", "AGI", "--max=lots")))
                .isInstanceOf(SearchValidationException.class)
                .hasMessage("--max must be a whole number, got \"lots\"");
    }

    @Test
    void printsMessageAndExitsCleanlyOnSuccess() {
        when(command.execute(any())).thenReturn(CommandResult.ok("[ok] Search complete: 1 new tweets, 0 duplicates, 1 users created"));

        runner.run(new DefaultApplicationArguments("search", "AGI"));

        assertThat(printed()).isEqualTo("[ok] Search complete: 1 new tweets, 0 duplicates, 1 users created");
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void failurePrintsErrorAndSetsExitCode() {
        runner.run(new DefaultApplicationArguments("search", "AGI", "--days=soon"));

        assertThat(printed()).isEqualTo("[error] --days must be a whole number, got \"soon\"");
        assertThat(runner.getExitCode()).isEqualTo(1);
        verifyNoInteractions(command);
    }

    @Test
    void jsonFlagPrintsResultAsJson() throws Exception {
        when(command.execute(any())).thenReturn(CommandResult.ok("Search completed", Map.of("tweetsCollected", 3)));

        runner.run(new DefaultApplicationArguments("search", "AGI", "--json"));

        Map<?, ?> json = new ObjectMapper().readValue(printed(), Map.class);
        assertThat(json.get("success")).isEqualTo(true);
        assertThat(json.get("message")).isEqualTo("Search completed");
        assertThat(json.get("data")).isEqualTo(Map.of("tweetsCollected", 3));
    }

    @Test
    void otherInvocationsAreIgnored() {
        runner.run(new DefaultApplicationArguments("--server.port=9000"));

        assertThat(printed()).isEmpty();
        assertThat(SearchCommandLineRunner.isSearchCommand(new String[] {"serve"})).isFalse();
        assertThat(SearchCommandLineRunner.isSearchCommand(new String[] {"search", "AGI"})).isTrue();
        verifyNoInteractions(command);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8).trim();
    }
}
