package com.repairdesk.sync.service.notify;

import com.repairdesk.sync.model.domain.Booking;
import com.repairdesk.sync.model.domain.BookingStatus;
import com.repairdesk.sync.model.domain.ChangeEvent;
import com.repairdesk.sync.model.domain.ChatMessage;
import com.repairdesk.sync.model.domain.QuoteRequest;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.model.dto.Notification;
import com.repairdesk.sync.model.dto.NotificationKey;
import com.repairdesk.sync.model.dto.NotificationType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Decides which changes deserve a user-visible notification.
 *
 * <ul>
 *   <li>Admins hear about every new booking and every new quote request.</li>
 *   <li>Owners hear about status changes of their own bookings and quote requests.</li>
 *   <li>Anyone hears about a new message from someone else in a conversation they can see.</li>
 * </ul>
 *
 * A status change is only reported when the prior status is known. Stateless; de-duplication
 * is the {@link NotificationDispatcher}'s job.
 */
@Component
public class NotificationPolicy {

    private static final int PREVIEW_LENGTH = 80;

    public Optional<Notification> evaluate(ChangeEvent event, ViewScope scope, Predicate<String> conversationVisible) {
        return switch (event.entityKind()) {
            case BOOKING -> evaluateBooking(event, scope);
            case QUOTE_REQUEST -> evaluateQuote(event, scope);
            case CHAT_MESSAGE -> evaluateMessage(event, scope, conversationVisible);
        };
    }

    private Optional<Notification> evaluateBooking(ChangeEvent event, ViewScope scope) {
        if (event.isInsert() && scope.isAdmin()) {
            Booking booking = (Booking) event.after();
            return Optional.of(notification(
                    new NotificationKey(booking.getId(), "created", "booking"),
                    NotificationType.NEW_BOOKING, booking,
                    "New Booking",
                    "new booking",
                    describeCustomer(booking.getCustomerName()) + " booked a repair for " + deviceOrDefault(booking)));
        }
        if (event.isUpdate() && !scope.isAdmin() && statusChanged(event) && scope.owns(event.after())) {
            Booking booking = (Booking) event.after();
            BookingStatus status = booking.getStatus();
            return Optional.of(notification(
                    new NotificationKey(booking.getId(), "status", status.getWireValue()),
                    NotificationType.BOOKING_STATUS_CHANGED, booking,
                    "Booking Status Updated",
                    "status changed to " + status.getWireValue(),
                    "Your " + deviceOrDefault(booking) + " repair is now " + status.getCustomerPhrase()));
        }
        return Optional.empty();
    }

    private Optional<Notification> evaluateQuote(ChangeEvent event, ViewScope scope) {
        if (event.isInsert() && scope.isAdmin()) {
            QuoteRequest quote = (QuoteRequest) event.after();
            String device = quote.getCustomDeviceInfo() != null ? " for " + quote.getCustomDeviceInfo() : "";
            return Optional.of(notification(
                    new NotificationKey(quote.getId(), "created", "quote_request"),
                    NotificationType.NEW_QUOTE_REQUEST, quote,
                    "New Quote Request",
                    "new quote request",
                    describeCustomer(quote.getCustomerName()) + " requested a quote" + device));
        }
        if (event.isUpdate() && !scope.isAdmin() && statusChanged(event) && scope.owns(event.after())) {
            QuoteRequest quote = (QuoteRequest) event.after();
            String status = quote.getStatus().getWireValue();
            String price = quote.getQuotedPrice() != null ? " (" + quote.getQuotedPrice().toPlainString() + ")" : "";
            return Optional.of(notification(
                    new NotificationKey(quote.getId(), "status", status),
                    NotificationType.QUOTE_STATUS_CHANGED, quote,
                    "Quote Updated",
                    "quote status changed to " + status,
                    "Your quote request is now " + status + price));
        }
        return Optional.empty();
    }

    private Optional<Notification> evaluateMessage(ChangeEvent event, ViewScope scope, Predicate<String> conversationVisible) {
        if (!event.isInsert()) {
            return Optional.empty();
        }
        ChatMessage message = (ChatMessage) event.after();
        if (message.getSenderId() == null || message.getSenderId().equals(scope.viewerId())) {
            return Optional.empty();
        }
        if (!scope.isAdmin() && !conversationVisible.test(message.getConversationId())) {
            return Optional.empty();
        }
        return Optional.of(notification(
                new NotificationKey(message.getId(), "created", "message"),
                NotificationType.NEW_MESSAGE, message,
                "New Message",
                "new message",
                preview(message.getMessage())));
    }

    private static boolean statusChanged(ChangeEvent event) {
        if (!event.beforeKnown() || event.before() == null) {
            return false;
        }
        String before = event.before().statusValue();
        String after = event.after().statusValue();
        return after != null && !Objects.equals(before, after);
    }

    private static Notification notification(NotificationKey key, NotificationType type, TrackedEntity entity,
                                             String title, String summary, String description) {
        return new Notification(key, type, entity.kind(), entity.getId(), title, summary, description, Instant.now());
    }

    private static String describeCustomer(String name) {
        return name != null && !name.isBlank() ? name : "A customer";
    }

    private static String deviceOrDefault(Booking booking) {
        String label = booking.deviceLabel();
        return label.isEmpty() ? "device" : label;
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH - 3) + "...";
    }
}
