package com.repairdesk.sync.service.command;

import com.repairdesk.sync.client.EntityStoreClient;
import com.repairdesk.sync.exception.MutationRejectedException;
import com.repairdesk.sync.model.domain.BookingStatus;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.QuoteRequest;
import com.repairdesk.sync.model.domain.QuoteStatus;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.dto.QuoteUpdateRequest;
import com.repairdesk.sync.service.session.ViewerSession;
import com.repairdesk.sync.service.session.ViewerSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes on behalf of a viewer. The store's answer is applied to the viewer's own session
 * straight away as an authoritative update; every other session picks the change up from
 * the feed. A rejected write leaves the cache untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityCommandService {

    private static final String DEFAULT_PREFERRED_TIME = "09:00";

    private final ViewerSessionRegistry registry;
    private final EntityStoreClient storeClient;

    public TrackedEntity updateBookingStatus(String viewerId, String bookingId, BookingStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        ViewerSession session = requireAdmin(viewerId, EntityKind.BOOKING, bookingId);
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("status", status.getWireValue());
        patch.put("updated_at", OffsetDateTime.now(ZoneOffset.UTC).toString());

        log.info("📝 {} sets booking {} to {}", viewerId, bookingId, status.getWireValue());
        TrackedEntity updated = storeClient.mutate(EntityKind.BOOKING, bookingId, patch);
        session.applyConfirmed(updated);
        return updated;
    }

    public TrackedEntity updateQuoteRequest(String viewerId, String quoteId, QuoteUpdateRequest request) {
        Map<String, Object> patch = request != null ? request.toPatch() : Map.of();
        if (patch.isEmpty()) {
            throw new IllegalArgumentException("Nothing to update on quote request " + quoteId);
        }
        ViewerSession session = requireAdmin(viewerId, EntityKind.QUOTE_REQUEST, quoteId);

        log.info("📝 {} updates quote request {}: {}", viewerId, quoteId, patch.keySet());
        TrackedEntity updated = storeClient.mutate(EntityKind.QUOTE_REQUEST, quoteId, patch);
        session.applyConfirmed(updated);
        return updated;
    }

    /**
     * Turns a quote request into a pending booking for the same customer, then marks the
     * quote accepted.
     *
     * @return the created booking
     */
    public TrackedEntity createBookingFromQuote(String viewerId, String quoteId) {
        ViewerSession session = requireAdmin(viewerId, EntityKind.QUOTE_REQUEST, quoteId);
        QuoteRequest quote = storeClient.fetchOne(EntityKind.QUOTE_REQUEST, quoteId)
                .map(QuoteRequest.class::cast)
                .orElseThrow(() -> new MutationRejectedException(EntityKind.QUOTE_REQUEST, quoteId,
                        "Quote request " + quoteId + " not found", false));

        Map<String, Object> booking = new LinkedHashMap<>();
        booking.put("user_id", quote.getUserId());
        booking.put("device_type", quote.getCustomDeviceInfo() != null ? quote.getCustomDeviceInfo() : "Unknown Device");
        booking.put("device_model", quote.getCustomDeviceInfo() != null ? quote.getCustomDeviceInfo() : "Unknown Model");
        booking.put("issue_description", quote.getIssueDescription());
        booking.put("customer_name", quote.getCustomerName());
        booking.put("customer_email", quote.getCustomerEmail());
        booking.put("customer_phone", quote.getCustomerPhone() != null ? quote.getCustomerPhone() : "");
        booking.put("quoted_price", quote.getQuotedPrice());
        booking.put("estimated_cost", quote.getQuotedPrice());
        booking.put("preferred_date", LocalDate.now(ZoneOffset.UTC).toString());
        booking.put("preferred_time", DEFAULT_PREFERRED_TIME);
        booking.put("quote_request_id", quote.getId());
        booking.put("status", BookingStatus.PENDING.getWireValue());

        TrackedEntity created = storeClient.insert(EntityKind.BOOKING, booking);
        session.applyConfirmedInsert(created);
        log.info("✅ Booking {} created from quote request {}", created.getId(), quoteId);

        TrackedEntity accepted = storeClient.mutate(EntityKind.QUOTE_REQUEST, quoteId,
                Map.of("status", QuoteStatus.ACCEPTED.getWireValue()));
        session.applyConfirmed(accepted);
        return created;
    }

    private ViewerSession requireAdmin(String viewerId, EntityKind kind, String entityId) {
        ViewerSession session = registry.require(viewerId);
        if (!session.scope().isAdmin()) {
            log.warn("⚠️ {} tried to change {} {} without the admin role", viewerId, kind.getTable(), entityId);
            throw new MutationRejectedException(kind, entityId, "Only administrators may change " + kind.getTable(), false);
        }
        return session;
    }
}
