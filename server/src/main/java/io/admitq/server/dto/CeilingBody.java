// file: server/src/main/java/io/admitq/server/dto/CeilingBody.java
package io.admitq.server.dto;

/**
 * JSON body and response for /orgs/{id}/concurrency and /agents/{id}/concurrency.
 * A null maxConcurrent means unlimited.
 */
public class CeilingBody {
    public String id;
    public Integer maxConcurrent;
}
