// file: server/src/main/java/io/admitq/server/dto/EnqueueResponse.java
package io.admitq.server.dto;

/** JSON response for POST /queue: the entry after the immediate admission attempt. */
public class EnqueueResponse {
    public EntryView entry;
    public AdmissionResponse admission;
}
