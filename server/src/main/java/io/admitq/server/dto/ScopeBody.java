// file: server/src/main/java/io/admitq/server/dto/ScopeBody.java
package io.admitq.server.dto;

/** JSON body for POST /admission/try and POST /jobs/complete. */
public class ScopeBody {
    public String orgId;
    public String agentId;
}
