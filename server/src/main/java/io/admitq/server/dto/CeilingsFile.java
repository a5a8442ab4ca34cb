// file: server/src/main/java/io/admitq/server/dto/CeilingsFile.java
package io.admitq.server.dto;

import java.util.Map;

/** On-disk layout of the ceilings JSON file. */
public class CeilingsFile {
    public Map<String, Integer> orgs;
    public Map<String, Integer> agents;
}
