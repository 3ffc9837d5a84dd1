package com.tradecontrol.event;

import com.tradecontrol.domain.enums.RejectionReason;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RejectionReason reason;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(
            Object source,
            RiskEventType eventType,
            RejectionReason reason,
            String message,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.reason = reason;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    /** Null for events that are not signal rejections. */
    public RejectionReason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
