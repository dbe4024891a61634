package tech.idmirror.platform.provider;

import java.util.List;

/**
 * One page of remote audit events plus the cursor for the next page (null on the last page).
 */
public record RemoteAuditEventPage(
    List<RemoteAuditEvent> events,
    String nextCursor
) {

    public RemoteAuditEventPage {
        events = events != null ? List.copyOf(events) : List.of();
    }

    public boolean hasMore() {
        return nextCursor != null && !nextCursor.isBlank();
    }
}
