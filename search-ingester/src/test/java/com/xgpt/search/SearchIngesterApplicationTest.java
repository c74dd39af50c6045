package com.xgpt.search;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.test.util.ReflectionTestUtils;

class SearchIngesterApplicationTest {

    @TempDir
    Path dir;

    @Test
    void jsonCommandWritesOnlyTheResultObjectToStdout() throws Exception {
        String[] args = {"search", "--cleanup", "--older-than=30d", "--json",
                "--spring.datasource.url=jdbc:sqlite:" + dir.resolve("cli.db")};
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        PrintStream original = System.out;
        int exitCode;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        try {
            exitCode = SpringApplication.exit(SearchIngesterApplication.create(args).run(args));
        } finally {
            System.setOut(original);
        }

        String printed = stdout.toString(StandardCharsets.UTF_8).trim();
        assertThat(exitCode).isZero();
        assertThat(printed.lines()).hasSize(1);
        JsonNode result = new ObjectMapper().readTree(printed);
        assertThat(result.get("success").asBoolean()).isTrue();
        assertThat(result.get("data").get("deleted").asInt()).isZero();
        assertThat(result.get("data").get("olderThanDays").asInt()).isEqualTo(30);
    }

    @Test
    void searchCommandRunsWithoutWebServer() {
        SpringApplication command = SearchIngesterApplication.create(new String[] {"search", "AGI"});
        SpringApplication json = SearchIngesterApplication.create(new String[] {"search", "AGI", "--json"});
        SpringApplication server = SearchIngesterApplication.create(new String[0]);

        assertThat(command.getWebApplicationType()).isEqualTo(WebApplicationType.NONE);
        assertThat(command.getAdditionalProfiles()).isEmpty();
        assertThat(json.getAdditionalProfiles()).containsExactly(SearchIngesterApplication.JSON_OUTPUT_PROFILE);
        assertThat(ReflectionTestUtils.getField(json, "bannerMode")).isEqualTo(Banner.Mode.OFF);
        assertThat(server.getWebApplicationType()).isEqualTo(WebApplicationType.SERVLET);
    }
}
