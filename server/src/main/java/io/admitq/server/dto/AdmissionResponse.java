// file: server/src/main/java/io/admitq/server/dto/AdmissionResponse.java
package io.admitq.server.dto;

import io.admitq.core.AdmissionDecision;

import java.util.Locale;

/**
 * JSON response for POST /admission/try and the admission part of POST /queue.
 *   { "decision": "admitted", "entry": {...} }
 *   { "decision": "blocked", "reason": "org_saturated", "entry": {...} }
 *   { "decision": "no_candidate" }
 */
public class AdmissionResponse {
    public String decision;
    public String reason;
    public EntryView entry;

    public static AdmissionResponse of(AdmissionDecision d) {
        AdmissionResponse r = new AdmissionResponse();
        if (d instanceof AdmissionDecision.Admitted a) {
            r.decision = "admitted";
            r.entry = EntryView.of(a.entry(), null);
        } else if (d instanceof AdmissionDecision.Blocked b) {
            r.decision = "blocked";
            r.reason = b.reason().name().toLowerCase(Locale.ROOT);
            r.entry = EntryView.of(b.candidate(), null);
        } else {
            r.decision = "no_candidate";
        }
        return r;
    }
}
