// file: server/src/main/java/io/admitq/server/RequestLogger.java
package io.admitq.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per completed HTTP request.
 * <p>
 * 5xx responses are logged at WARNING with the cause attached; everything
 * else at INFO, with the error message appended for 4xx.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param method        HTTP method
     * @param path          request path
     * @param status        HTTP status code sent
     * @param totalMillis   wall-clock latency of the whole request
     * @param serviceMillis time spent inside the queue service, or -1 if not reached
     * @param error         exception behind an error response, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long serviceMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)%s",
                method,
                path,
                status,
                totalMillis,
                serviceMillis >= 0 ? ", service=" + serviceMillis + "ms" : "",
                error != null && status < 500 ? " " + error.getMessage() : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
