package org.calista.tactica.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/** One journal record. Absent fields are left out of the JSON line. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProofEvent {

    public static final String NODE_ADDED = "NODE_ADDED";
    public static final String STATUS_CHANGED = "STATUS_CHANGED";
    public static final String BOOKMARKED = "BOOKMARKED";

    public String type;
    public long tsEpochMs;
    public String sessionId;     // theorem name
    public Long nodeId;
    public Long parentId;
    public String status;
    public String previousStatus;
    public String bookmark;
    public String path;
    public String text;          // note or tactic description

    public static ProofEvent of(String type, String sessionId, Long nodeId, String text, long tsEpochMs) {
        ProofEvent e = new ProofEvent();
        e.type = type;
        e.sessionId = sessionId;
        e.nodeId = nodeId;
        e.text = text;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}
