// file: client/src/main/java/io/admitq/client/Cli.java
package io.admitq.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple CLI for interacting with a running admitq server over HTTP.
 *
 * Usage:
 *   admitq-cli [--base-url http://host:port] enqueue <orgId> <agentId> <scheduleId> [priority]
 *   admitq-cli [--base-url http://host:port] list org|agent <id>
 *   admitq-cli [--base-url http://host:port] position <orgId> <entryId>
 *   admitq-cli [--base-url http://host:port] summary <orgId>
 *   admitq-cli [--base-url http://host:port] cancel <entryId>
 *   admitq-cli [--base-url http://host:port] remove <entryId>
 *   admitq-cli [--base-url http://host:port] admit <orgId> [agentId]
 *   admitq-cli [--base-url http://host:port] complete <orgId> <agentId>
 *   admitq-cli [--base-url http://host:port] concurrency <orgId> [agentId]
 *   admitq-cli [--base-url http://host:port] limit org|agent <id> <max|none>
 *   admitq-cli [--base-url http://host:port] sweep
 *
 * Responses are printed as indented JSON.
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;
    private final ObjectMapper json = new ObjectMapper();

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            new Cli(parsed.getKey()).run(rest);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private void run(String[] rest) throws Exception {
        String cmd = rest[0];
        switch (cmd) {
            case "enqueue" -> {
                arity(rest, 4, 5, "enqueue requires <orgId> <agentId> <scheduleId> [priority]");
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("orgId", rest[1]);
                body.put("agentId", rest[2]);
                body.put("scheduleId", rest[3]);
                body.put("priority", rest.length == 5 ? parseInt("priority", rest[4]) : 0);
                print(send("POST", "/queue", body));
            }
            case "list" -> {
                arity(rest, 3, 3, "list requires org|agent <id>");
                print(send("GET", "/queue?" + scopeParam(rest[1]) + "=" + enc(rest[2]), null));
            }
            case "position" -> {
                arity(rest, 3, 3, "position requires <orgId> <entryId>");
                print(send("GET", "/queue/" + enc(rest[2]) + "/position?orgId=" + enc(rest[1]), null));
            }
            case "summary" -> {
                arity(rest, 2, 2, "summary requires <orgId>");
                print(send("GET", "/queue/summary?orgId=" + enc(rest[1]), null));
            }
            case "cancel" -> {
                arity(rest, 2, 2, "cancel requires <entryId>");
                print(send("POST", "/queue/" + enc(rest[1]) + "/cancel", null));
            }
            case "remove" -> {
                arity(rest, 2, 2, "remove requires <entryId>");
                print(send("DELETE", "/queue/" + enc(rest[1]), null));
            }
            case "admit" -> {
                arity(rest, 2, 3, "admit requires <orgId> [agentId]");
                print(send("POST", "/admission/try", scope(rest[1], rest.length == 3 ? rest[2] : null)));
            }
            case "complete" -> {
                arity(rest, 3, 3, "complete requires <orgId> <agentId>");
                print(send("POST", "/jobs/complete", scope(rest[1], rest[2])));
            }
            case "concurrency" -> {
                arity(rest, 2, 3, "concurrency requires <orgId> [agentId]");
                String q = "orgId=" + enc(rest[1]) + (rest.length == 3 ? "&agentId=" + enc(rest[2]) : "");
                print(send("GET", "/concurrency/status?" + q, null));
            }
            case "limit" -> {
                arity(rest, 4, 4, "limit requires org|agent <id> <max|none>");
                String collection = "orgId".equals(scopeParam(rest[1])) ? "orgs" : "agents";
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("maxConcurrent", "none".equals(rest[3]) ? null : parseInt("max", rest[3]));
                print(send("PUT", "/" + collection + "/" + enc(rest[2]) + "/concurrency", body));
            }
            case "sweep" -> print(send("POST", "/admin/sweep", null));
            default -> usageAndExit("unknown command: " + cmd);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new CliException("--base-url requires a value");
            }
            return Map.entry(args[1], Arrays.copyOfRange(args, 2, args.length));
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private JsonNode send(String method, String path, Object body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(json.writeValueAsBytes(body));

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .method(method, publisher)
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() / 100 != 2) {
            throw new CliException(method + " " + path + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return json.readTree(resp.body());
    }

    private void print(JsonNode node) throws Exception {
        System.out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(node));
    }

    private static Map<String, Object> scope(String orgId, String agentId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("orgId", orgId);
        body.put("agentId", agentId);
        return body;
    }

    static String scopeParam(String kind) {
        return switch (kind) {
            case "org" -> "orgId";
            case "agent" -> "agentId";
            default -> throw new CliException("scope must be 'org' or 'agent', got " + kind);
        };
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static int parseInt(String what, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new CliException(what + " must be an integer, got " + raw);
        }
    }

    private static void arity(String[] rest, int min, int max, String msg) {
        if (rest.length < min || rest.length > max) {
            usageAndExit(msg);
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  admitq-cli [--base-url http://host:port] enqueue <orgId> <agentId> <scheduleId> [priority]
                  admitq-cli [--base-url http://host:port] list org|agent <id>
                  admitq-cli [--base-url http://host:port] position <orgId> <entryId>
                  admitq-cli [--base-url http://host:port] summary <orgId>
                  admitq-cli [--base-url http://host:port] cancel <entryId>
                  admitq-cli [--base-url http://host:port] remove <entryId>
                  admitq-cli [--base-url http://host:port] admit <orgId> [agentId]
                  admitq-cli [--base-url http://host:port] complete <orgId> <agentId>
                  admitq-cli [--base-url http://host:port] concurrency <orgId> [agentId]
                  admitq-cli [--base-url http://host:port] limit org|agent <id> <max|none>
                  admitq-cli [--base-url http://host:port] sweep
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
