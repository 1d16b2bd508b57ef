package com.specscout.common.exception;

/**
 * Raised by an agent that cannot produce a verdict for a profile.
 * The dispatcher turns it into a low-confidence verdict carrying {@link #reason()}.
 */
public class AgentException extends RuntimeException {
    private final String agentName;
    private final String location;
    private final String reason;

    public AgentException(String agentName, String location, String reason) {
        this(agentName, location, reason, null);
    }

    public AgentException(String agentName, String location, String reason, Throwable cause) {
        super("[" + agentName + "] " + reason + " (location=" + location + ")", cause);
        this.agentName = agentName;
        this.location = location;
        this.reason = reason;
    }

    public String getAgentName() {
        return agentName;
    }

    public String getLocation() {
        return location;
    }

    /** Failure description without agent or location decoration. */
    public String reason() {
        return reason;
    }
}
