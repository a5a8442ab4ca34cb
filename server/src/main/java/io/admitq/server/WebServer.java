// file: server/src/main/java/io/admitq/server/WebServer.java
package io.admitq.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.admitq.core.EnqueueRequest;
import io.admitq.core.EntryNotFoundException;
import io.admitq.core.InvalidStateException;
import io.admitq.core.QueueEntry;
import io.admitq.core.QueueScope;
import io.admitq.core.ValidationException;
import io.admitq.server.dto.AdmissionResponse;
import io.admitq.server.dto.CeilingBody;
import io.admitq.server.dto.EnqueueBody;
import io.admitq.server.dto.EnqueueResponse;
import io.admitq.server.dto.EntryView;
import io.admitq.server.dto.ScopeBody;
import io.admitq.server.dto.StatusResponse;
import io.admitq.server.dto.SummaryResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Thin HTTP adapter over {@link QueueService} and {@link CeilingRegistry}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map queue exceptions to HTTP status codes.
 *  - Emit per-request logging via {@link RequestLogger}.
 *
 * Path layout:
 *   - POST   /queue                          enqueue (+ immediate admission attempt)
 *   - GET    /queue?orgId=..|agentId=..      queued entries with positions
 *   - GET    /queue/summary?orgId=..         aggregate view of an org's queue
 *   - GET    /queue/{id}/position?orgId=..   1-based rank of a queued entry
 *   - POST   /queue/{id}/cancel              cancel a queued entry
 *   - DELETE /queue/{id}                     remove an entry whatever its status
 *   - POST   /admission/try                  {orgId, agentId}
 *   - POST   /jobs/complete                  {orgId, agentId}: release slot, drain org
 *   - GET    /orgs/{id}/concurrency          org ceiling
 *   - PUT    /orgs/{id}/concurrency          {maxConcurrent} (null = unlimited)
 *   - GET    /agents/{id}/concurrency        agent ceiling
 *   - PUT    /agents/{id}/concurrency        {maxConcurrent}
 *   - GET    /concurrency/status?orgId=..&agentId=..
 *   - POST   /admin/sweep                    run the reaper now
 *   - GET    /admin/health                   basic health check
 *
 * Errors: validation 400, invalid JSON 400, unknown entry 404, wrong status 409,
 * body too large 413, anything else 500.
 */
public final class WebServer {
    static final int MAX_BODY_BYTES = 64 * 1024; // 64 KiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final QueueService queue;
    private final CeilingRegistry ceilings;

    /** Route body: returns the status and the object to serialize. */
    @FunctionalInterface
    private interface Action {
        Reply run(byte[] body) throws Exception;
    }

    private record Reply(int status, Object body) {
        static Reply ok(Object body) {
            return new Reply(200, body);
        }
    }

    public WebServer(int port, QueueService queue, CeilingRegistry ceilings) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.ceilings = Objects.requireNonNull(ceilings, "ceilings");

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop(); // For tests to stop server
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        List<String> seg = segments(path);
        String head = seg.isEmpty() ? "" : seg.get(0);

        switch (head) {
            case "queue" -> routeQueue(ex, method, seg);
            case "admission" -> {
                if (seg.size() == 2 && "try".equals(seg.get(1)) && "POST".equals(method)) {
                    withBody(ex, this::tryAdmit);
                } else {
                    notFound(ex, method, path);
                }
            }
            case "jobs" -> {
                if (seg.size() == 2 && "complete".equals(seg.get(1)) && "POST".equals(method)) {
                    withBody(ex, this::complete);
                } else {
                    notFound(ex, method, path);
                }
            }
            case "orgs", "agents" -> {
                if (seg.size() != 3 || !"concurrency".equals(seg.get(2))) {
                    notFound(ex, method, path);
                    return;
                }
                boolean org = "orgs".equals(head);
                String id = seg.get(1);
                switch (method) {
                    case "GET" -> handle(ex, null, body -> Reply.ok(ceilingView(org, id)));
                    case "PUT" -> withBody(ex, body -> putCeiling(org, id, body));
                    default -> methodNotAllowed(ex, method, path);
                }
            }
            case "concurrency" -> {
                if (seg.size() == 2 && "status".equals(seg.get(1)) && "GET".equals(method)) {
                    handle(ex, null, body -> Reply.ok(StatusResponse.of(
                            queue.status(requiredParam(ex, "orgId"), param(ex, "agentId")))));
                } else {
                    notFound(ex, method, path);
                }
            }
            case "admin" -> {
                if (seg.size() == 2 && "health".equals(seg.get(1))) {
                    send(ex, 200, Map.of("status", "ok"));
                    RequestLogger.logRequest(method, path, 200, 0, -1, null);
                } else if (seg.size() == 2 && "sweep".equals(seg.get(1)) && "POST".equals(method)) {
                    handle(ex, null, body -> Reply.ok(Map.of("removed", queue.sweep())));
                } else {
                    notFound(ex, method, path);
                }
            }
            default -> notFound(ex, method, path);
        }
    }

    private void routeQueue(HttpServerExchange ex, String method, List<String> seg) {
        String path = ex.getRequestPath();
        if (seg.size() == 1) {
            switch (method) {
                case "POST" -> withBody(ex, this::enqueue);
                case "GET" -> handle(ex, null, body -> Reply.ok(list(ex)));
                default -> methodNotAllowed(ex, method, path);
            }
        } else if (seg.size() == 2 && "summary".equals(seg.get(1)) && "GET".equals(method)) {
            handle(ex, null, body -> Reply.ok(summary(requiredParam(ex, "orgId"))));
        } else if (seg.size() == 2 && "DELETE".equals(method)) {
            String id = seg.get(1);
            handle(ex, null, body -> {
                queue.remove(id);
                return Reply.ok(Map.of("removed", id));
            });
        } else if (seg.size() == 3 && "position".equals(seg.get(2)) && "GET".equals(method)) {
            String id = seg.get(1);
            handle(ex, null, body -> Reply.ok(Map.of(
                    "id", id,
                    "position", queue.position(requiredParam(ex, "orgId"), id))));
        } else if (seg.size() == 3 && "cancel".equals(seg.get(2)) && "POST".equals(method)) {
            String id = seg.get(1);
            handle(ex, null, body -> Reply.ok(EntryView.of(queue.cancel(id), null)));
        } else {
            notFound(ex, method, path);
        }
    }

    // ---------- handlers ----------

    /** POST /queue */
    private Reply enqueue(byte[] data) throws Exception {
        EnqueueBody req = json.readValue(data, EnqueueBody.class);
        QueueService.Enqueued r = queue.enqueue(
                new EnqueueRequest(req.orgId, req.agentId, req.scheduleId, req.priority));

        EnqueueResponse dto = new EnqueueResponse();
        dto.entry = EntryView.of(r.entry(), r.position());
        dto.admission = AdmissionResponse.of(r.decision());
        return new Reply(201, dto);
    }

    /** GET /queue?orgId=.. or GET /queue?agentId=.. */
    private List<EntryView> list(HttpServerExchange ex) {
        String orgId = param(ex, "orgId");
        String agentId = param(ex, "agentId");
        if ((orgId == null) == (agentId == null)) {
            throw new ValidationException("exactly one of orgId or agentId is required");
        }
        QueueScope scope = orgId != null ? QueueScope.byOrg(orgId) : QueueScope.byAgent(agentId);

        List<EntryView> out = new ArrayList<>();
        for (PositionCalculator.RankedEntry r : queue.list(scope)) {
            out.add(EntryView.of(r.entry(), r.position()));
        }
        return out;
    }

    private SummaryResponse summary(String orgId) {
        QueueSummary.Summary s = queue.summarize(orgId);
        SummaryResponse dto = new SummaryResponse();
        dto.orgId = s.orgId();
        dto.totalQueued = s.totalQueued();
        dto.oldestQueuedAt = s.oldestQueuedAt() == null ? null : s.oldestQueuedAt().toString();
        dto.byAgent = s.byAgent();
        dto.avgWaitMinutes = s.avgWaitMinutes();
        dto.startedInWindow = s.startedInWindow();
        dto.running = queue.runningInOrg(orgId);
        return dto;
    }

    /** POST /admission/try */
    private Reply tryAdmit(byte[] data) throws Exception {
        ScopeBody req = json.readValue(data, ScopeBody.class);
        requireId("orgId", req.orgId);
        return Reply.ok(AdmissionResponse.of(queue.tryAdmit(req.orgId, req.agentId)));
    }

    /** POST /jobs/complete */
    private Reply complete(byte[] data) throws Exception {
        ScopeBody req = json.readValue(data, ScopeBody.class);
        requireId("orgId", req.orgId);
        requireId("agentId", req.agentId);

        List<EntryView> admitted = new ArrayList<>();
        for (QueueEntry e : queue.complete(req.orgId, req.agentId)) {
            admitted.add(EntryView.of(e, null));
        }
        return Reply.ok(Map.of("admitted", admitted));
    }

    /** PUT /orgs/{id}/concurrency and PUT /agents/{id}/concurrency */
    private Reply putCeiling(boolean org, String id, byte[] data) throws Exception {
        CeilingBody req = json.readValue(data, CeilingBody.class);
        if (org) {
            ceilings.setOrgCeiling(id, req.maxConcurrent);
        } else {
            ceilings.setAgentCeiling(id, req.maxConcurrent);
        }
        return Reply.ok(ceilingView(org, id));
    }

    private CeilingBody ceilingView(boolean org, String id) {
        OptionalInt max = org ? ceilings.orgCeiling(id) : ceilings.agentCeiling(id);
        CeilingBody dto = new CeilingBody();
        dto.id = id;
        dto.maxConcurrent = max.isPresent() ? max.getAsInt() : null;
        return dto;
    }

    // ---------- request plumbing ----------

    /** Read the full body, then run the action. */
    private void withBody(HttpServerExchange ex, Action action) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> handle(exchange, data, action),
                (exchange, ioEx) -> {
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(exchange.getRequestMethod().toString(),
                            exchange.getRequestPath(), status, 0, -1, ioEx);
                }
        );
    }

    /** Run the action and map its outcome (or failure) to a response. */
    private void handle(HttpServerExchange ex, byte[] data, Action action) {
        long start = System.nanoTime();
        int status;
        long serviceMs = -1L;
        Throwable error = null;

        try {
            if (data != null && data.length > MAX_BODY_BYTES) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
            } else {
                long sStart = System.nanoTime();
                Reply reply = action.run(data);
                serviceMs = (System.nanoTime() - sStart) / 1_000_000L;
                status = reply.status();
                send(ex, status, reply.body());
            }
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (ValidationException | IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (EntryNotFoundException missing) {
            status = 404;
            error = missing;
            send(ex, status, Map.of("error", missing.getMessage(), "id", String.valueOf(missing.entryId())));
        } catch (InvalidStateException conflict) {
            status = 409;
            error = conflict;
            send(ex, status, Map.of("error", conflict.getMessage(), "status", conflict.actual().wireName()));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(),
                    "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(),
                status, totalMs, serviceMs, error);
    }

    private void notFound(HttpServerExchange ex, String method, String path) {
        send(ex, 404, Map.of("error", "not found"));
        RequestLogger.logRequest(method, path, 404, 0, -1, null);
    }

    private void methodNotAllowed(HttpServerExchange ex, String method, String path) {
        send(ex, 405, Map.of("error", "method not allowed"));
        RequestLogger.logRequest(method, path, 405, 0, -1, null);
    }

    // ---------- helpers ----------

    private static List<String> segments(String path) {
        List<String> out = new ArrayList<>();
        for (String s : path.split("/")) {
            if (!s.isEmpty()) {
                out.add(s);
            }
        }
        return out;
    }

    private static String param(HttpServerExchange ex, String name) {
        Deque<String> values = ex.getQueryParameters().get(name);
        String v = (values == null || values.isEmpty()) ? null : values.peekFirst();
        return (v == null || v.isBlank()) ? null : v;
    }

    private static String requiredParam(HttpServerExchange ex, String name) {
        String v = param(ex, name);
        if (v == null) {
            throw new ValidationException("missing query param: " + name);
        }
        return v;
    }

    private static void requireId(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be empty");
        }
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
