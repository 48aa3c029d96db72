package com.whereq.kiln.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Webhook notification configuration
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notifications implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Webhook URL to notify
     */
    private String webhook;

    /**
     * Build events to trigger notifications
     */
    private List<BuildEventType> events;

    /**
     * Check if notifications are enabled
     */
    @JsonIgnore
    public boolean isEnabled() {
        return webhook != null && !webhook.isEmpty() && events != null && !events.isEmpty();
    }

    /**
     * Check if should notify for given event
     */
    public boolean shouldNotify(BuildEventType type) {
        return isEnabled() && events.contains(type);
    }

    public Notifications copy() {
        return new Notifications(webhook, events == null ? null : new ArrayList<>(events));
    }
}
