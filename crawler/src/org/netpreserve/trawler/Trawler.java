package org.netpreserve.trawler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.netpreserve.trawler.autoscaling.TaskFailedException;
import org.netpreserve.trawler.config.JobConfig;
import org.netpreserve.trawler.storage.WorkList;
import org.netpreserve.trawler.storage.WorkQueue;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Trawler {
    private static final Logger log = LoggerFactory.getLogger(Trawler.class);
    private static final Pattern HREF = Pattern.compile(
            "(?i)<(a|area|base|link)\\b[^>]*?\\bhref\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s>\"']+))");

    public static void main(String[] args) throws Exception {
        Path jobDir = Path.of("data");
        var seeds = new ArrayList<Url>();
        boolean dumpConfig = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dump-config" -> dumpConfig = true;
                case "--job-dir", "-j" -> jobDir = Path.of(args[++i]);
                case "--help", "-h" -> {
                    System.out.println("Usage: trawler [options] [URL...]");
                    System.out.println("Options:");
                    System.out.println("  -h, --help");
                    System.out.println("      --dump-config        Print the effective configuration and exit");
                    System.out.println("  -j, --job-dir DIR        Directory for job data and config.yaml");
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    seeds.add(new Url(args[i]));
                }
            }
        }

        var mapper = newObjectMapper();
        JobConfig config = loadConfig(mapper, jobDir.resolve("config.yaml"));
        if (dumpConfig) {
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }
        seeds.addAll(config.seeds());
        if (seeds.isEmpty()) {
            System.err.println("No seed URLs given");
            System.exit(1);
        }

        Files.createDirectories(jobDir);
        var httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        try (var queue = WorkQueue.open(jobDir.resolve("queue.sqlite3"))) {
            var crawler = new Crawler(config.crawl(), config.pool(), WorkList.ofUrls(seeds), queue,
                    context -> fetch(httpClient, config.crawl().userAgent(), context),
                    (context, error) -> log.atWarn().addKeyValue("url", context.url())
                            .log("Giving up on item: {}", error.toString()));

            Runtime.getRuntime().addShutdownHook(new Thread(crawler::abort, "shutdown-hook"));

            Progress progress = crawler.run();
            log.atInfo().addKeyValue("handled", progress.handled()).addKeyValue("failed", progress.failed())
                    .log("Done");
        } catch (TaskFailedException e) {
            log.error("Crawl stopped", e.getCause());
            System.exit(2);
        }
    }

    static ObjectMapper newObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Reads the built-in defaults overlaid with the given config file, if it exists.
     */
    static JobConfig loadConfig(ObjectMapper mapper, Path configFile) throws IOException {
        JsonNode configTree;
        try (InputStream defaults = Objects.requireNonNull(
                JobConfig.class.getResourceAsStream("defaults.yaml"), "missing defaults.yaml")) {
            configTree = mapper.readTree(defaults);
        }
        if (Files.exists(configFile)) {
            configTree = deepMerge(configTree, mapper.readTree(configFile.toFile()));
        }
        return mapper.treeToValue(configTree, JobConfig.class);
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    /**
     * Fetches one item and enqueues the links found in HTML responses.
     */
    static void fetch(HttpClient httpClient, String userAgent, ItemContext context) throws Exception {
        var request = HttpRequest.newBuilder(context.url().toURI())
                .header("User-Agent", userAgent)
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            context.reportClientError();
            throw new IOException("HTTP " + status + " from " + context.url());
        }
        if (status >= 400) {
            throw new NonRetryableException("HTTP " + status + " from " + context.url());
        }
        log.atInfo().addKeyValue("url", context.url()).addKeyValue("status", status)
                .addKeyValue("depth", context.item().depth()).log("Fetched");

        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (contentType.contains("html")) {
            context.addItems(extractLinks(response.uri(), response.body()));
        }
    }

    /**
     * Finds href attributes of a, area and link elements with a regular expression. A {@code <base href>} that
     * appears before a link changes the URL later links are resolved against. This is not an HTML parser: links
     * inside comments or scripts are picked up too, and links added by JavaScript are missed.
     */
    static List<Url> extractLinks(URI base, String html) {
        var links = new ArrayList<Url>();
        Url baseUrl = new Url(base.toString());
        Matcher matcher = HREF.matcher(html);
        while (matcher.find()) {
            String href = firstNonNull(matcher.group(2), matcher.group(3), matcher.group(4)).trim();
            if (href.isEmpty() || href.startsWith("#")) continue;
            try {
                Url link = baseUrl.resolve(href).withoutFragment();
                if (matcher.group(1).equalsIgnoreCase("base")) {
                    baseUrl = link;
                } else if (link.isHttp()) {
                    links.add(link);
                }
            } catch (IllegalArgumentException | URISyntaxException e) {
                log.trace("Ignoring unparseable link {}", href, e);
            }
        }
        return links;
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) return value;
        }
        return "";
    }
}
