package com.eventboard.app;

import com.eventboard.storage.DatasetStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBoardApplicationTest {

    @TempDir
    Path dir;

    private HttpServer server;
    private volatile String health = "{\"status\":\"ok\",\"ready\":true,\"monitors\":{\"crd\":true,\"announcements\":false}}";
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/health", exchange -> respond(exchange, 200, health));
        server.createContext("/crd", exchange -> respond(exchange, 200,
                "{\"success\":true,\"metadata\":{\"scrape_timestamp\":\"2024-01-15T10:00:00\"},"
                        + "\"pagination\":{\"page\":1,\"per_page\":1000,\"total_pages\":1,\"total_records\":2},"
                        + "\"data\":[{\"COMPANY NAME\":\"Abc Ltd\",\"CREDIT RATING\":\"AA\"},"
                        + "{\"COMPANY NAME\":\"Xyz Ltd\",\"CREDIT RATING\":\"A+\"}]}"));
        server.createContext("/event-calendar", exchange -> respond(exchange, 200,
                "{\"success\":true,\"pagination\":{\"page\":1,\"total_pages\":1},\"data\":[]}"));
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void fetchShouldSaveNonEmptyDatasetsAndSummary() {
        int exit = app("").run(fetchArgs());

        Path out = dir.resolve("out");
        assertEquals(EventBoardApplication.EXIT_OK, exit);
        assertTrue(Files.exists(out.resolve(DatasetStore.fileNameFor("crd"))));
        assertFalse(Files.exists(out.resolve(DatasetStore.fileNameFor("event_calendar"))));
        assertTrue(Files.exists(out.resolve(DatasetStore.SUMMARY_FILE)));
        String output = output();
        assertTrue(output.contains("[ready]   crd"));
        assertTrue(output.contains("[waiting] announcements"));
        assertTrue(output.contains("crd: 2 records"));
        assertTrue(output.contains("event_calendar: no data available"));
    }

    @Test
    void fetchShouldBeRefusedWhenNoMonitorIsReady() {
        health = "{\"status\":\"starting\",\"ready\":false,\"monitors\":{\"crd\":false}}";

        int exit = app("").run(fetchArgs());

        assertEquals(EventBoardApplication.EXIT_REFUSED, exit);
        assertTrue(output().contains("no monitors are ready yet"));
        assertFalse(Files.exists(dir.resolve("out").resolve(DatasetStore.SUMMARY_FILE)));
    }

    @Test
    void yesFlagShouldOverrideTheMonitorGate() {
        health = "{\"status\":\"starting\",\"ready\":false,\"monitors\":{\"crd\":false}}";
        String[] args = fetchArgs();
        String[] withYes = new String[args.length + 1];
        System.arraycopy(args, 0, withYes, 0, args.length);
        withYes[args.length] = "--yes";

        int exit = app("").run(withYes);

        assertEquals(EventBoardApplication.EXIT_OK, exit);
        assertTrue(Files.exists(dir.resolve("out").resolve(DatasetStore.fileNameFor("crd"))));
    }

    @Test
    void exploreShouldOpenFetchedData() {
        app("").run(fetchArgs());
        buffer.reset();

        int exit = app("1\n0\n").run(new String[]{"explore", "--dir", "out", "--file", "crd_all"});

        assertEquals(EventBoardApplication.EXIT_OK, exit);
        assertTrue(output().contains("Loaded 2 records"));
        assertTrue(output().contains("Abc Ltd"));
    }

    @Test
    void configCommandShouldReportSources() {
        int exit = app("").run(new String[]{"config", "-D", "api.per_page=50"});

        assertEquals(EventBoardApplication.EXIT_OK, exit);
        assertTrue(output().contains("api.per_page=50 (override)"));
        assertTrue(output().contains("view.max_column_width=40"));
    }

    @Test
    void usageErrorsShouldExitWithTwo() {
        assertEquals(EventBoardApplication.EXIT_USAGE, app("").run(new String[]{}));
        assertEquals(EventBoardApplication.EXIT_USAGE, app("").run(new String[]{"launch"}));
        assertEquals(EventBoardApplication.EXIT_USAGE, app("").run(new String[]{"fetch", "--bogus"}));
        assertEquals(EventBoardApplication.EXIT_OK, app("").run(new String[]{"--help"}));
    }

    private String[] fetchArgs() {
        return new String[]{
                "fetch",
                "-D", "api.base_url=http://127.0.0.1:" + server.getAddress().getPort(),
                "-D", "outputs.dir=out",
                "-D", "api.request_delay_ms=0",
                "-D", "fetch.endpoints=event_calendar,crd"
        };
    }

    private EventBoardApplication app(String input) {
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        return new EventBoardApplication(dir, new BufferedReader(new StringReader(input)), out, false);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
